package org.dxworks.sieveframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A filter rule as the visual editor sees it.
 * <p>
 * When the underlying {@code if} cannot be expressed with conditions and actions,
 * {@link #rawBlock} holds its script text and both lists stay empty.
 */
public class SieveRule {
    public String name = "";
    public boolean enabled = true;
    public LogicOperator logic = LogicOperator.ALL_OF;
    public List<Condition> conditions = new ArrayList<>();
    public List<Action> actions = new ArrayList<>();
    public String rawBlock; // nullable

    public boolean hasRawBlock() {
        return rawBlock != null;
    }
}
