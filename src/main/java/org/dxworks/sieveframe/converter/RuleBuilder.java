package org.dxworks.sieveframe.converter;

import org.dxworks.sieveframe.model.Action;
import org.dxworks.sieveframe.model.ActionType;
import org.dxworks.sieveframe.model.AddressPart;
import org.dxworks.sieveframe.model.Condition;
import org.dxworks.sieveframe.model.ConditionTest;
import org.dxworks.sieveframe.model.LogicOperator;
import org.dxworks.sieveframe.model.MatchType;
import org.dxworks.sieveframe.model.SieveRule;
import org.dxworks.sieveframe.model.SizeComparator;
import org.dxworks.sieveframe.sieve.ast.ActionCommand;
import org.dxworks.sieveframe.sieve.ast.AddressTest;
import org.dxworks.sieveframe.sieve.ast.AllOfTest;
import org.dxworks.sieveframe.sieve.ast.AnyOfTest;
import org.dxworks.sieveframe.sieve.ast.Argument;
import org.dxworks.sieveframe.sieve.ast.BodyTest;
import org.dxworks.sieveframe.sieve.ast.BooleanTest;
import org.dxworks.sieveframe.sieve.ast.EnvelopeTest;
import org.dxworks.sieveframe.sieve.ast.ExistsTest;
import org.dxworks.sieveframe.sieve.ast.HeaderTest;
import org.dxworks.sieveframe.sieve.ast.IfBlock;
import org.dxworks.sieveframe.sieve.ast.NotTest;
import org.dxworks.sieveframe.sieve.ast.SizeTest;
import org.dxworks.sieveframe.sieve.ast.TestExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a fresh {@code if} block from a rule's conditions and actions.
 * Model fields may be null when a rule was read from JSON; they fall back to the model defaults.
 */
public class RuleBuilder {

    public IfBlock build(SieveRule rule) {
        List<ActionCommand> actions = new ArrayList<>();
        for (Action action : nonNull(rule.actions)) {
            actions.add(toActionCommand(action));
        }
        return new IfBlock(ruleName(rule), rule.enabled, buildCondition(rule), actions, List.of());
    }

    static String ruleName(SieveRule rule) {
        return rule.name == null || rule.name.isBlank() ? null : rule.name;
    }

    TestExpr buildCondition(SieveRule rule) {
        List<Condition> conditions = nonNull(rule.conditions);
        if (conditions.isEmpty()) {
            return BooleanTest.TRUE;
        }

        List<TestExpr> tests = new ArrayList<>();
        for (Condition condition : conditions) {
            tests.add(toTest(condition));
        }
        if (tests.size() == 1) {
            return tests.get(0);
        }
        return rule.logic == LogicOperator.ANY_OF ? new AnyOfTest(tests) : new AllOfTest(tests);
    }

    TestExpr toTest(Condition condition) {
        ConditionTest testType = condition.testType == null ? ConditionTest.HEADER : condition.testType;
        String matchType = (condition.matchType == null ? MatchType.CONTAINS : condition.matchType).getSieveName();
        List<String> headerNames = nonNull(condition.headerNames);
        List<String> keys = nonNull(condition.keys);

        TestExpr test = switch (testType) {
            case HEADER -> new HeaderTest(matchType, headerNames, keys);
            case ADDRESS -> new AddressTest(addressPart(condition), matchType, headerNames, keys);
            case ENVELOPE -> new EnvelopeTest(addressPart(condition), matchType, headerNames, keys);
            case SIZE -> new SizeTest(sizeComparator(condition), sizeLimit(condition));
            case EXISTS -> new ExistsTest(headerNames);
            case BODY -> new BodyTest(matchType, keys);
            case TRUE -> BooleanTest.TRUE;
            case FALSE -> BooleanTest.FALSE;
        };
        return condition.negate ? new NotTest(test) : test;
    }

    private static String addressPart(Condition condition) {
        // :all is the default and is left out
        if (condition.addressPart == null || condition.addressPart == AddressPart.ALL) return null;
        return condition.addressPart.getSieveName();
    }

    private static String sizeComparator(Condition condition) {
        return (condition.sizeComparator == null ? SizeComparator.OVER : condition.sizeComparator).getSieveName();
    }

    private static String sizeLimit(Condition condition) {
        if (condition.sizeValue == null || condition.sizeValue.isBlank()) return "0";
        return condition.sizeValue.trim();
    }

    ActionCommand toActionCommand(Action action) {
        ActionType type = action.actionType == null ? ActionType.KEEP : action.actionType;
        String name = type.getSieveName();
        if (type.takesArgument()) {
            // an empty argument is still written, "fileinto;" is not valid SIEVE
            return new ActionCommand(name, List.of(Argument.quoted(action.argument == null ? "" : action.argument)));
        }
        return new ActionCommand(name, List.of());
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
