package org.dxworks.sieveframe.converter;

import org.dxworks.sieveframe.model.Action;
import org.dxworks.sieveframe.model.ActionType;
import org.dxworks.sieveframe.model.AddressPart;
import org.dxworks.sieveframe.model.Condition;
import org.dxworks.sieveframe.model.ConditionTest;
import org.dxworks.sieveframe.model.LogicOperator;
import org.dxworks.sieveframe.model.MatchType;
import org.dxworks.sieveframe.model.SieveRule;
import org.dxworks.sieveframe.model.SieveScript;
import org.dxworks.sieveframe.model.SizeComparator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SieveScriptConverterTest {

    private static final String MOVE_SPAM = "require \"fileinto\";\n"
            + "\n"
            + "# Filter: Move spam\n"
            + "if header :contains \"Subject\" \"SPAM\" {\n"
            + "    fileinto \"Junk\";\n"
            + "    stop;\n"
            + "}\n";

    private static final String CHAIN = "# Filter: Sort\n"
            + "if header :is \"X-List\" \"dev\" {\n"
            + "    keep;\n"
            + "} elsif header :is \"X-List\" \"ops\" {\n"
            + "    discard;\n"
            + "} else {\n"
            + "    stop;\n"
            + "}\n";

    private final SieveScriptConverter converter = new SieveScriptConverter();

    @Test
    void namedHeaderRule() {
        SieveScript script = converter.textToScript(MOVE_SPAM, "main");

        assertEquals("main", script.name);
        assertEquals(List.of("fileinto"), script.requires);
        assertEquals(1, script.rules.size());

        SieveRule rule = script.rules.get(0);
        assertEquals("Move spam", rule.name);
        assertTrue(rule.enabled);
        assertNull(rule.rawBlock);
        assertEquals(LogicOperator.ALL_OF, rule.logic);

        Condition condition = rule.conditions.get(0);
        assertEquals(ConditionTest.HEADER, condition.testType);
        assertEquals(MatchType.CONTAINS, condition.matchType);
        assertEquals(List.of("Subject"), condition.headerNames);
        assertEquals(List.of("SPAM"), condition.keys);

        assertEquals(2, rule.actions.size());
        assertEquals(ActionType.FILEINTO, rule.actions.get(0).actionType);
        assertEquals("Junk", rule.actions.get(0).argument);
        assertEquals(ActionType.STOP, rule.actions.get(1).actionType);
    }

    @Test
    void allofBecomesLogicWithOrderedConditions() {
        SieveScript script = converter.textToScript("if allof(header :is \"From\" \"boss@example.com\", "
                + "header :contains \"Subject\" \"urgent\") {\n    keep;\n}\n", "s");

        SieveRule rule = script.rules.get(0);
        assertEquals(LogicOperator.ALL_OF, rule.logic);
        assertEquals(2, rule.conditions.size());
        assertEquals(MatchType.IS, rule.conditions.get(0).matchType);
        assertEquals(List.of("boss@example.com"), rule.conditions.get(0).keys);
        assertEquals(MatchType.CONTAINS, rule.conditions.get(1).matchType);
        assertEquals(List.of("Subject"), rule.conditions.get(1).headerNames);
    }

    @Test
    void anyofWithNegation() {
        SieveScript script = converter.textToScript(
                "if anyof(not exists \"X-Seen\", size :under 5K) { discard; }", "s");

        SieveRule rule = script.rules.get(0);
        assertEquals(LogicOperator.ANY_OF, rule.logic);
        assertEquals(ConditionTest.EXISTS, rule.conditions.get(0).testType);
        assertTrue(rule.conditions.get(0).negate);
        assertEquals(List.of("X-Seen"), rule.conditions.get(0).headerNames);
        assertEquals(SizeComparator.UNDER, rule.conditions.get(1).sizeComparator);
        assertEquals("5K", rule.conditions.get(1).sizeValue);
    }

    @Test
    void addressDomainCondition() {
        SieveScript script = converter.textToScript("if address :is :domain \"From\" \"hapimag.com\" { keep; }", "s");

        SieveRule rule = script.rules.get(0);
        assertNull(rule.rawBlock);
        Condition condition = rule.conditions.get(0);
        assertEquals(ConditionTest.ADDRESS, condition.testType);
        assertEquals(MatchType.IS, condition.matchType);
        assertEquals(AddressPart.DOMAIN, condition.addressPart);
        assertEquals(List.of("From"), condition.headerNames);
        assertEquals(List.of("hapimag.com"), condition.keys);
    }

    @Test
    void elsifChainIsKeptRaw() {
        SieveScript script = converter.textToScript(CHAIN, "s");

        SieveRule rule = script.rules.get(0);
        assertEquals("Sort", rule.name);
        assertEquals(CHAIN, rule.rawBlock);
        assertTrue(rule.conditions.isEmpty());
        assertTrue(rule.actions.isEmpty());

        assertEquals(CHAIN, converter.scriptToText(script));
    }

    @Test
    void renamingRawRuleRewritesItsComment() {
        SieveScript script = converter.textToScript(CHAIN, "s");
        script.rules.get(0).name = "Sorted lists";
        script.rules.get(0).enabled = false;

        String text = converter.scriptToText(script);

        assertTrue(text.startsWith("# Filter: Sorted lists [DISABLED]\nif header :is \"X-List\" \"dev\" {\n"));
        assertTrue(text.endsWith("} else {\n    stop;\n}\n"));
    }

    @Test
    void unknownActionArgumentsAreKeptRaw() {
        SieveScript script = converter.textToScript("require \"fileinto\";\nif true { fileinto :copy \"Archive\"; }", "s");

        SieveRule rule = script.rules.get(0);
        assertNotNull(rule.rawBlock);
        assertTrue(rule.conditions.isEmpty());
        assertTrue(converter.scriptToText(script).contains("fileinto :copy \"Archive\";"));
    }

    @Test
    void unparseableTextBecomesOneRawRule() {
        String text = "if header :is \"Subject\" \"x\" { keep;";

        SieveScript script = converter.textToScript(text, "broken");

        assertEquals(1, script.rules.size());
        assertEquals(SieveScriptConverter.PARSE_ERROR_RULE_NAME, script.rules.get(0).name);
        assertEquals(text, script.rules.get(0).rawBlock);
        assertTrue(script.requires.isEmpty());
        assertEquals(text + "\n", converter.scriptToText(script));
    }

    @Test
    void emptyText() {
        SieveScript script = converter.textToScript("", "empty");

        assertTrue(script.rules.isEmpty());
        assertTrue(script.requires.isEmpty());
        assertEquals("", converter.scriptToText(script));
    }

    @Test
    void requiresAreDeduplicatedInFirstSeenOrder() {
        SieveScript script = converter.textToScript(
                "require [\"mailbox\", \"fileinto\"];\nrequire \"mailbox\";\nrequire \"body\";\n", "s");

        assertEquals(List.of("mailbox", "fileinto", "body"), script.requires);
    }

    @Test
    void requiresAreComputedFromRules() {
        SieveScript script = new SieveScript("built");
        script.requires.add("mailbox");
        script.rules.add(rule("Flag", condition(ConditionTest.BODY, MatchType.REGEX, "urgent.*"),
                new Action(ActionType.ADDFLAG, "\\Flagged"), new Action(ActionType.FILEINTO, "Urgent")));

        String text = converter.scriptToText(script);

        assertTrue(text.startsWith("require [\"body\", \"fileinto\", \"imap4flags\", \"regex\", \"mailbox\"];\n"));
        assertEquals(1, text.split("require", -1).length - 1);
    }

    @Test
    void singleConditionIsNotWrappedInAllof() {
        SieveScript script = new SieveScript("built");
        script.rules.add(rule("Boss", condition(ConditionTest.HEADER, MatchType.IS, "boss@example.com"),
                new Action(ActionType.KEEP, "")));

        assertEquals("# Filter: Boss\nif header :is \"From\" \"boss@example.com\" {\n    keep;\n}\n",
                converter.scriptToText(script));
    }

    @Test
    void ruleWithoutConditionsMatchesEverything() {
        SieveScript script = new SieveScript("built");
        SieveRule rule = new SieveRule();
        rule.actions.add(new Action(ActionType.STOP, ""));
        script.rules.add(rule);

        assertEquals("if true {\n    stop;\n}\n", converter.scriptToText(script));
    }

    @Test
    void representableRulesRoundTrip() {
        SieveScript script = new SieveScript("round");

        SieveRule first = rule("Lists", condition(ConditionTest.HEADER, MatchType.MATCHES, "*dev*"),
                new Action(ActionType.FILEINTO, "Lists/Dev"), new Action(ActionType.STOP, ""));
        Condition envelope = condition(ConditionTest.ENVELOPE, MatchType.IS, "me@example.com");
        envelope.headerNames = List.of("to");
        envelope.addressPart = AddressPart.LOCALPART;
        envelope.negate = true;
        first.conditions.add(envelope);
        first.logic = LogicOperator.ANY_OF;
        first.enabled = false;
        script.rules.add(first);

        Condition size = new Condition(ConditionTest.SIZE);
        size.sizeComparator = SizeComparator.OVER;
        size.sizeValue = "2M";
        script.rules.add(rule("Big", size, new Action(ActionType.REJECT, "Too \"big\"")));

        SieveScript reread = converter.textToScript(converter.scriptToText(script), "round");

        assertEquals(2, reread.rules.size());
        assertRuleEquals(first, reread.rules.get(0));
        assertRuleEquals(script.rules.get(1), reread.rules.get(1));
    }

    @Test
    void emptyActionArgumentStaysQuoted() {
        SieveScript script = new SieveScript("draft");
        script.rules.add(rule("Draft", condition(ConditionTest.HEADER, MatchType.CONTAINS, "x"),
                new Action(ActionType.FILEINTO, "")));

        String text = converter.scriptToText(script);

        assertTrue(text.contains("    fileinto \"\";\n"));
        SieveScript reread = converter.textToScript(text, "draft");
        assertRuleEquals(script.rules.get(0), reread.rules.get(0));
    }

    @Test
    void emptyStringArgumentSurvivesRepeatedFormatting() {
        SieveScript first = converter.textToScript("require \"fileinto\";\nif true { fileinto \"\"; }\n", "s");
        SieveScript second = converter.textToScript(converter.scriptToText(first), "s");

        SieveRule rule = second.rules.get(0);
        assertNull(rule.rawBlock);
        assertEquals(ActionType.FILEINTO, rule.actions.get(0).actionType);
        assertEquals("", rule.actions.get(0).argument);
        assertEquals(converter.scriptToText(first), converter.scriptToText(second));
    }

    @Test
    void emptyMultiLineRejectIsWrittenAsEmptyString() {
        SieveScript first = converter.textToScript("require \"reject\";\nif true { reject text:\n.\n; }\n", "s");

        String text = converter.scriptToText(first);

        assertTrue(text.contains("    reject \"\";\n"));
        assertNull(converter.textToScript(text, "s").rules.get(0).rawBlock);
    }

    @Test
    void unnamedDisabledRuleRoundTrips() {
        SieveScript script = new SieveScript("s");
        SieveRule rule = new SieveRule();
        rule.enabled = false;
        rule.actions.add(new Action(ActionType.KEEP, ""));
        script.rules.add(rule);

        SieveRule reread = converter.textToScript(converter.scriptToText(script), "s").rules.get(0);

        assertEquals("", reread.name);
        assertFalse(reread.enabled);
    }

    private static SieveRule rule(String name, Condition condition, Action... actions) {
        SieveRule rule = new SieveRule();
        rule.name = name;
        rule.conditions.add(condition);
        rule.actions.addAll(List.of(actions));
        return rule;
    }

    private static Condition condition(ConditionTest test, MatchType matchType, String key) {
        Condition condition = Condition.header(matchType, List.of("From"), List.of(key));
        condition.testType = test;
        return condition;
    }

    private static void assertRuleEquals(SieveRule expected, SieveRule actual) {
        assertEquals(expected.name, actual.name);
        assertEquals(expected.enabled, actual.enabled);
        assertEquals(expected.logic, actual.logic);
        assertNull(actual.rawBlock);
        assertEquals(expected.conditions.size(), actual.conditions.size());
        for (int i = 0; i < expected.conditions.size(); i++) {
            Condition e = expected.conditions.get(i);
            Condition a = actual.conditions.get(i);
            assertEquals(e.testType, a.testType);
            assertEquals(e.negate, a.negate);
            if (e.testType == ConditionTest.SIZE) {
                assertEquals(e.sizeComparator, a.sizeComparator);
                assertEquals(e.sizeValue, a.sizeValue);
            } else {
                assertEquals(e.matchType, a.matchType);
                assertEquals(e.headerNames, a.headerNames);
                assertEquals(e.keys, a.keys);
                assertEquals(e.addressPart, a.addressPart);
            }
        }
        assertEquals(expected.actions.size(), actual.actions.size());
        for (int i = 0; i < expected.actions.size(); i++) {
            assertEquals(expected.actions.get(i).actionType, actual.actions.get(i).actionType);
            assertEquals(expected.actions.get(i).argument, actual.actions.get(i).argument);
        }
    }
}
