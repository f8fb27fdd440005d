package org.dxworks.sieveframe.converter;

import org.dxworks.sieveframe.model.Action;
import org.dxworks.sieveframe.model.Condition;
import org.dxworks.sieveframe.model.LogicOperator;

import java.util.List;

/**
 * Outcome of projecting an {@code if} block onto the rule model: either it fits the
 * condition/action shape ({@link Reduced}) or it is kept as script text ({@link Unreduced}).
 */
public abstract class Reduction {

    private Reduction() {
    }

    public static final class Reduced extends Reduction {
        public final LogicOperator logic;
        public final List<Condition> conditions;
        public final List<Action> actions;

        Reduced(LogicOperator logic, List<Condition> conditions, List<Action> actions) {
            this.logic = logic;
            this.conditions = List.copyOf(conditions);
            this.actions = List.copyOf(actions);
        }
    }

    public static final class Unreduced extends Reduction {
        public final String originalText;
        public final String reason;

        Unreduced(String originalText, String reason) {
            this.originalText = originalText;
            this.reason = reason;
        }
    }
}
