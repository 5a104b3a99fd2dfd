package org.csu.sqlfront.common.result;

import org.csu.sqlfront.common.diagnostic.Diagnostic;
import org.csu.sqlfront.common.diagnostic.Phase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ResultTest {

    private static final Diagnostic ERROR = Diagnostic.error(Phase.SYNTAX, "boom", 3, 7);

    @Test
    void testSuccessCarriesValue() {
        Result<Integer> result = Result.success(41);
        assertTrue(result.isSuccess());
        assertEquals(42, result.map(v -> v + 1).getValue());
        assertEquals("41", result.flatMap(v -> Result.success(String.valueOf(v))).getValue());
        assertThrows(IllegalStateException.class, result::getDiagnostic);
    }

    @Test
    void testFailurePropagatesUnchanged() {
        Result<Integer> failure = Result.failure(ERROR);
        assertTrue(failure.isFailure());

        Result<String> mapped = failure.map(String::valueOf);
        assertTrue(mapped.isFailure());
        assertSame(ERROR, mapped.getDiagnostic());

        Result<Void> propagated = failure.propagate();
        assertSame(ERROR, propagated.getDiagnostic());
        assertThrows(IllegalStateException.class, failure::getValue);
    }

    @Test
    void testDiagnosticFormat() {
        assertEquals("[Line 3, Col 7] Syntax Error: boom", ERROR.format());
        assertEquals("[Line 1, Col 2] Semantic Warning: again",
                Diagnostic.warning(Phase.SEMANTIC, "again", 1, 2).format());
        assertTrue(ERROR.isError());
    }
}
