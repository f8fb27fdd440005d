package org.dxworks.sieveframe.converter;

import org.dxworks.sieveframe.model.Action;
import org.dxworks.sieveframe.model.ActionType;
import org.dxworks.sieveframe.model.AddressPart;
import org.dxworks.sieveframe.model.Condition;
import org.dxworks.sieveframe.model.ConditionTest;
import org.dxworks.sieveframe.model.LogicOperator;
import org.dxworks.sieveframe.model.MatchType;
import org.dxworks.sieveframe.model.SizeComparator;
import org.dxworks.sieveframe.sieve.SieveEmitter;
import org.dxworks.sieveframe.sieve.ast.ActionCommand;
import org.dxworks.sieveframe.sieve.ast.AddressPartTest;
import org.dxworks.sieveframe.sieve.ast.AnyOfTest;
import org.dxworks.sieveframe.sieve.ast.Argument;
import org.dxworks.sieveframe.sieve.ast.BodyTest;
import org.dxworks.sieveframe.sieve.ast.BooleanTest;
import org.dxworks.sieveframe.sieve.ast.EnvelopeTest;
import org.dxworks.sieveframe.sieve.ast.ExistsTest;
import org.dxworks.sieveframe.sieve.ast.HeaderTest;
import org.dxworks.sieveframe.sieve.ast.IfBlock;
import org.dxworks.sieveframe.sieve.ast.NotTest;
import org.dxworks.sieveframe.sieve.ast.Script;
import org.dxworks.sieveframe.sieve.ast.SizeTest;
import org.dxworks.sieveframe.sieve.ast.TestExpr;
import org.dxworks.sieveframe.sieve.ast.TestListExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether an {@code if} block fits the rule model without loss.
 * <p>
 * A block reduces when it has no elsif/else chain, its condition is a single test, a negated
 * single test, or a non-empty flat allof/anyof of those, every tag is one the model enums know,
 * and every action is a known action with the argument shape {@link Action} can hold.
 * Anything else is kept as the emitted text of the block.
 */
public class RuleReducer {

    private final SieveEmitter emitter;

    public RuleReducer(SieveEmitter emitter) {
        this.emitter = emitter;
    }

    public Reduction reduce(IfBlock block) {
        if (block.hasAlternatives()) {
            return unreduced(block, "elsif/else chain");
        }

        LogicOperator logic = LogicOperator.ALL_OF;
        List<TestExpr> tests;
        if (block.condition instanceof TestListExpr list) {
            if (list.tests.isEmpty()) {
                return unreduced(block, "empty " + list.keyword());
            }
            logic = list instanceof AnyOfTest ? LogicOperator.ANY_OF : LogicOperator.ALL_OF;
            tests = list.tests;
        } else {
            tests = List.of(block.condition);
        }

        List<Condition> conditions = new ArrayList<>();
        for (TestExpr test : tests) {
            Optional<Condition> condition = toCondition(test);
            if (condition.isEmpty()) {
                return unreduced(block, "test without a condition form");
            }
            conditions.add(condition.get());
        }

        List<Action> actions = new ArrayList<>();
        for (ActionCommand command : block.actions) {
            Optional<Action> action = toAction(command);
            if (action.isEmpty()) {
                return unreduced(block, "action '" + command.name + "' without a model form");
            }
            actions.add(action.get());
        }

        return new Reduction.Reduced(logic, conditions, actions);
    }

    private Reduction unreduced(IfBlock block, String reason) {
        String text = emitter.emit(new Script(List.of(block)));
        return new Reduction.Unreduced(text, reason);
    }

    Optional<Condition> toCondition(TestExpr test) {
        if (test instanceof NotTest not) {
            // only one level of negation has a model form
            return toLeafCondition(not.inner).map(condition -> {
                condition.negate = true;
                return condition;
            });
        }
        return toLeafCondition(test);
    }

    private Optional<Condition> toLeafCondition(TestExpr test) {
        if (test instanceof HeaderTest header) {
            return MatchType.fromSieve(header.matchType).map(matchType ->
                    Condition.header(matchType, header.headerNames, header.keys));
        }
        if (test instanceof AddressPartTest address) {
            Optional<MatchType> matchType = MatchType.fromSieve(address.matchType);
            Optional<AddressPart> addressPart = address.addressPart == null
                    ? Optional.of(AddressPart.ALL)
                    : AddressPart.fromSieve(address.addressPart);
            if (matchType.isEmpty() || addressPart.isEmpty()) return Optional.empty();

            Condition condition = new Condition(test instanceof EnvelopeTest ? ConditionTest.ENVELOPE : ConditionTest.ADDRESS);
            condition.matchType = matchType.get();
            condition.addressPart = addressPart.get();
            condition.headerNames.addAll(address.headerNames);
            condition.keys.addAll(address.keys);
            return Optional.of(condition);
        }
        if (test instanceof SizeTest size) {
            return SizeComparator.fromSieve(size.comparator).map(comparator -> {
                Condition condition = new Condition(ConditionTest.SIZE);
                condition.sizeComparator = comparator;
                condition.sizeValue = size.limit;
                return condition;
            });
        }
        if (test instanceof ExistsTest exists) {
            Condition condition = new Condition(ConditionTest.EXISTS);
            condition.headerNames.addAll(exists.headerNames);
            return Optional.of(condition);
        }
        if (test instanceof BodyTest body) {
            return MatchType.fromSieve(body.matchType).map(matchType -> {
                Condition condition = new Condition(ConditionTest.BODY);
                condition.matchType = matchType;
                condition.keys.addAll(body.keys);
                return condition;
            });
        }
        if (test instanceof BooleanTest bool) {
            return Optional.of(new Condition(bool.value ? ConditionTest.TRUE : ConditionTest.FALSE));
        }
        // nested allof/anyof, double negation
        return Optional.empty();
    }

    Optional<Action> toAction(ActionCommand command) {
        Optional<ActionType> type = ActionType.fromSieve(command.name);
        if (type.isEmpty()) return Optional.empty();

        ActionType actionType = type.get();
        if (!actionType.takesArgument()) {
            return command.arguments.isEmpty()
                    ? Optional.of(new Action(actionType, ""))
                    : Optional.empty();
        }
        if (command.arguments.size() != 1) return Optional.empty();

        Argument argument = command.arguments.get(0);
        return argument.isString()
                ? Optional.of(new Action(actionType, argument.value))
                : Optional.empty();
    }
}
