package com.cybershieldx.agent.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SanitizeUtils
 */
class SanitizeUtilsTest {

    @Test
    @DisplayName("Path sanitizing removes traversal and separators")
    void testSanitizeForPath() {
        assertEquals("scan-1", SanitizeUtils.sanitizeForPath("scan-1"));
        assertEquals("_etc_passwd", SanitizeUtils.sanitizeForPath("../etc/passwd"));
        assertEquals("a_b_c", SanitizeUtils.sanitizeForPath("a\\b:c"));
        assertEquals("unknown", SanitizeUtils.sanitizeForPath(""));
        assertEquals("unknown", SanitizeUtils.sanitizeForPath(null));
    }

    @Test
    @DisplayName("Log sanitizing strips control characters and truncates")
    void testSanitizeString() {
        assertEquals("line one line two", SanitizeUtils.sanitizeString("line one\nline two\r"));
        assertEquals("", SanitizeUtils.sanitizeString(null));
        assertEquals(1024, SanitizeUtils.sanitizeString("x".repeat(5000)).length());
    }

    @Test
    @DisplayName("MAC addresses keep only the vendor prefix")
    void testMaskMacAddress() {
        assertEquals("a4:5e:60:XX:XX:XX", SanitizeUtils.maskMacAddress("a4:5e:60:d1:22:9f"));
        assertEquals("A4:5E:60:XX:XX:XX", SanitizeUtils.maskMacAddress("A4-5E-60-D1-22-9F"));
        assertEquals("not a mac", SanitizeUtils.maskMacAddress("not a mac"));
        assertNull(SanitizeUtils.maskMacAddress(null));
    }
}
