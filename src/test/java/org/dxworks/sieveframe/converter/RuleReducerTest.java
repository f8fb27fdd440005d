package org.dxworks.sieveframe.converter;

import org.dxworks.sieveframe.model.ConditionTest;
import org.dxworks.sieveframe.model.LogicOperator;
import org.dxworks.sieveframe.sieve.SieveEmitter;
import org.dxworks.sieveframe.sieve.SieveParseException;
import org.dxworks.sieveframe.sieve.SieveParser;
import org.dxworks.sieveframe.sieve.ast.IfBlock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RuleReducerTest {

    private final SieveParser parser = new SieveParser();
    private final RuleReducer reducer = new RuleReducer(new SieveEmitter());

    private Reduction reduce(String text) throws SieveParseException {
        return reducer.reduce((IfBlock) parser.parse(text).commands.get(0));
    }

    private static Reduction.Unreduced assertUnreduced(Reduction reduction) {
        assertTrue(reduction instanceof Reduction.Unreduced, "expected the block to stay raw");
        return (Reduction.Unreduced) reduction;
    }

    @Test
    void flatAnyofReduces() throws SieveParseException {
        Reduction reduction = reduce("if anyof(true, false, body :contains \"x\") { keep; }");

        Reduction.Reduced reduced = (Reduction.Reduced) reduction;
        assertEquals(LogicOperator.ANY_OF, reduced.logic);
        assertEquals(ConditionTest.TRUE, reduced.conditions.get(0).testType);
        assertEquals(ConditionTest.FALSE, reduced.conditions.get(1).testType);
        assertEquals(ConditionTest.BODY, reduced.conditions.get(2).testType);
    }

    @Test
    void multiLineRejectReduces() throws SieveParseException {
        Reduction.Reduced reduced = (Reduction.Reduced) reduce("if true { reject text:\nNo.\n.\n; }");

        assertEquals("No.\n", reduced.actions.get(0).argument);
    }

    @Test
    void alternativesStayRaw() throws SieveParseException {
        Reduction.Unreduced unreduced = assertUnreduced(reduce("if true { keep; } else { stop; }"));

        assertEquals("if true {\n    keep;\n} else {\n    stop;\n}\n", unreduced.originalText);
    }

    @Test
    void nestedListStaysRaw() throws SieveParseException {
        assertUnreduced(reduce("if allof(true, anyof(false, true)) { keep; }"));
    }

    @Test
    void doubleNegationStaysRaw() throws SieveParseException {
        assertUnreduced(reduce("if not not true { keep; }"));
    }

    @Test
    void emptyTestListStaysRaw() throws SieveParseException {
        assertUnreduced(reduce("if allof() { keep; }"));
    }

    @Test
    void unknownMatchTypeStaysRaw() throws SieveParseException {
        assertUnreduced(reduce("if header :value \"X-Score\" \"5\" { keep; }"));
    }

    @Test
    void actionShapesOutsideTheModelStayRaw() throws SieveParseException {
        assertUnreduced(reduce("if true { keep \"x\"; }"));
        assertUnreduced(reduce("if true { fileinto; }"));
        assertUnreduced(reduce("if true { addflag [\"a\", \"b\"]; }"));
    }

    @Test
    void headerNameListsAreKept() throws SieveParseException {
        Reduction.Reduced reduced = (Reduction.Reduced) reduce("if header :is [\"To\", \"Cc\"] [\"a\", \"b\"] { keep; }");

        assertEquals(2, reduced.conditions.get(0).headerNames.size());
        assertEquals(2, reduced.conditions.get(0).keys.size());
    }
}
