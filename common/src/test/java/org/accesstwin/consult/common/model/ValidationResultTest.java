package org.accesstwin.consult.common.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ValidationResult.
 */
class ValidationResultTest {

    @Test
    void testValid_hasNoMessages() {
        ValidationResult result = ValidationResult.valid();
        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertTrue(result.getWarnings().isEmpty());
        assertEquals("", result.describeErrors());
    }

    @Test
    void testBuilder_errorMakesInvalid() {
        ValidationResult result = ValidationResult.builder()
                .addError("modelId", "Model id is required")
                .addWarning("endpoint", "Using default")
                .build();

        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        assertEquals("modelId", result.getErrors().get(0).getField());
        assertEquals("endpoint: Using default", result.getWarnings().get(0));
    }

    @Test
    void testBuilder_warningsOnlyStayValid() {
        ValidationResult result = ValidationResult.builder()
                .addWarning("apiKey", "Unexpected prefix")
                .addInfo("endpoint", "Using default")
                .build();

        assertTrue(result.isValid());
        assertEquals(1, result.getInfos().size());
    }

    @Test
    void testDescribeErrors_joinsAll() {
        ValidationResult result = ValidationResult.builder()
                .addError("family", "Provider family is required")
                .addError("credential", "API key is required")
                .build();

        assertEquals("family: Provider family is required; credential: API key is required",
                result.describeErrors());
    }

    @Test
    void testMerge_combinesResults() {
        ValidationResult first = ValidationResult.builder().addError("a", "bad").build();
        ValidationResult merged = ValidationResult.builder()
                .addWarning("b", "meh")
                .merge(first)
                .build();

        assertFalse(merged.isValid());
        assertEquals(1, merged.getErrors().size());
        assertEquals(1, merged.getWarnings().size());
    }
}
