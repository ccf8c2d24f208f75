package com.pubannotator.pipeline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

    @Test
    void testSanitizeFilename() {
        assertEquals("run_report_2024_.csv", Utils.sanitizeFilename("run report/2024?.csv"));
        assertEquals("", Utils.sanitizeFilename(null));
    }

    @Test
    void testTruncate() {
        assertEquals("abc", Utils.truncate("abc", 5));
        assertEquals("ab...", Utils.truncate("abcdef", 2));
        assertEquals("", Utils.truncate(null, 5));
    }

    @Test
    void testEnvOrPropFallsBackToPropertyThenDefault() {
        String key = "ANNOTATOR_UTILS_TEST_KEY";
        assertEquals("fallback", Utils.envOrProp(key, "fallback"));
        System.setProperty(key, "from-property");
        try {
            assertEquals("from-property", Utils.envOrProp(key, "fallback"));
        } finally {
            System.clearProperty(key);
        }
    }
}
