package me.christianrobert.kugelblitz.translator.context;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TranslationResult} and the exception details it carries.
 */
class TranslationResultTest {

    @Test
    void successCarriesOutputOnly() {
        TranslationResult result = TranslationResult.success("x = 1;");

        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals("x = 1;", result.getJavaScript());
        assertNull(result.getErrorMessage());
        assertNull(result.getErrorType());
        assertFalse(result.hasSyntaxTree());
    }

    @Test
    void successWithTreeCarriesTree() {
        TranslationResult result = TranslationResult.successWithTree("x", "NAME [x]\n");

        assertTrue(result.hasSyntaxTree());
        assertEquals("NAME [x]\n", result.getSyntaxTree());
    }

    @Test
    void failureFromExceptionHasDetailsAndNoOutput() {
        SemanticException e = new SemanticException("Tuple length mismatch", "Tuple{...}", "Tuple assignment");

        TranslationResult result = TranslationResult.failure(e);

        assertTrue(result.isFailure());
        assertNull(result.getJavaScript());
        assertEquals("SemanticException", result.getErrorType());
        assertEquals("Tuple length mismatch\nNode: Tuple{...}\nContext: Tuple assignment", result.getErrorMessage());
    }

    @Test
    void detailedMessageWithoutNodeIsPlainMessage() {
        assertEquals("boom", new TranslationException("boom").getDetailedMessage());
    }

    @Test
    void toStringShowsOutcome() {
        assertTrue(TranslationResult.success("a").toString().contains("success=true"));
        assertTrue(TranslationResult.failure("bad").toString().contains("bad"));
    }
}
