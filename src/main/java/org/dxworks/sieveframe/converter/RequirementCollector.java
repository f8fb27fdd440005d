package org.dxworks.sieveframe.converter;

import org.dxworks.sieveframe.sieve.ast.ActionCommand;
import org.dxworks.sieveframe.sieve.ast.AddressPartTest;
import org.dxworks.sieveframe.sieve.ast.Alternative;
import org.dxworks.sieveframe.sieve.ast.BodyTest;
import org.dxworks.sieveframe.sieve.ast.Command;
import org.dxworks.sieveframe.sieve.ast.ElsIfBranch;
import org.dxworks.sieveframe.sieve.ast.EnvelopeTest;
import org.dxworks.sieveframe.sieve.ast.HeaderTest;
import org.dxworks.sieveframe.sieve.ast.IfBlock;
import org.dxworks.sieveframe.sieve.ast.NotTest;
import org.dxworks.sieveframe.sieve.ast.TestExpr;
import org.dxworks.sieveframe.sieve.ast.TestListExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Works out which {@code require} extensions a list of commands depends on.
 */
final class RequirementCollector {

    private static final String REGEX = ":regex";

    private RequirementCollector() {
        // utility class
    }

    /** Needed extensions, sorted by name. */
    static List<String> collect(List<Command> commands) {
        Set<String> requires = new TreeSet<>();
        for (Command command : commands) {
            if (command instanceof IfBlock block) {
                collectTest(block.condition, requires);
                collectActions(block.actions, requires);
                for (Alternative alternative : block.alternatives) {
                    if (alternative instanceof ElsIfBranch elsIf) {
                        collectTest(elsIf.condition, requires);
                    }
                    collectActions(alternative.actions, requires);
                }
            } else if (command instanceof ActionCommand action) {
                collectAction(action, requires);
            }
        }
        return new ArrayList<>(requires);
    }

    private static void collectTest(TestExpr test, Set<String> requires) {
        if (test instanceof TestListExpr list) {
            for (TestExpr inner : list.tests) {
                collectTest(inner, requires);
            }
        } else if (test instanceof NotTest not) {
            collectTest(not.inner, requires);
        } else if (test instanceof HeaderTest header) {
            if (REGEX.equals(header.matchType)) requires.add("regex");
        } else if (test instanceof AddressPartTest address) {
            if (address instanceof EnvelopeTest) requires.add("envelope");
            if (REGEX.equals(address.matchType)) requires.add("regex");
        } else if (test instanceof BodyTest body) {
            requires.add("body");
            if (REGEX.equals(body.matchType)) requires.add("regex");
        }
    }

    private static void collectActions(List<ActionCommand> actions, Set<String> requires) {
        for (ActionCommand action : actions) {
            collectAction(action, requires);
        }
    }

    private static void collectAction(ActionCommand action, Set<String> requires) {
        switch (action.name.toLowerCase(Locale.ROOT)) {
            case "fileinto" -> requires.add("fileinto");
            case "reject" -> requires.add("reject");
            case "setflag", "addflag", "removeflag" -> requires.add("imap4flags");
            default -> {
                // keep, stop, discard, redirect are core commands
            }
        }
    }
}
