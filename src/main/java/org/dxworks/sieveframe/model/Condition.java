package org.dxworks.sieveframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One test of a rule, flattened so an editor can show it as a single row.
 * Fields that do not apply to {@link #testType} keep their defaults.
 */
public class Condition {
    public ConditionTest testType = ConditionTest.HEADER;
    public List<String> headerNames = new ArrayList<>(List.of("From"));
    public List<String> keys = new ArrayList<>(List.of(""));
    public MatchType matchType = MatchType.CONTAINS;
    public AddressPart addressPart = AddressPart.ALL;
    public SizeComparator sizeComparator = SizeComparator.OVER;
    public String sizeValue = "0";
    public boolean negate;

    public Condition() {
    }

    public Condition(ConditionTest testType) {
        this.testType = testType;
        this.headerNames = new ArrayList<>();
        this.keys = new ArrayList<>();
    }

    public static Condition header(MatchType matchType, List<String> headerNames, List<String> keys) {
        Condition condition = new Condition(ConditionTest.HEADER);
        condition.matchType = matchType;
        condition.headerNames = new ArrayList<>(headerNames);
        condition.keys = new ArrayList<>(keys);
        return condition;
    }
}
