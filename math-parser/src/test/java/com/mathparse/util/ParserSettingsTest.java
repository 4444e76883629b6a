package com.mathparse.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mathparse.expr.AngleUnit;
import com.mathparse.expr.BatchFailureMode;
import com.mathparse.expr.EvaluationConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParserSettingsTest {

    @Test
    public void testDefaults() {
        ParserSettings settings = new ParserSettings();
        assertEquals(AngleUnit.DEGREES, settings.getAngleUnit());
        assertEquals(BatchFailureMode.WARNING, settings.getFailureMode());
        assertEquals("INFO", settings.getLoggingLevel());
        assertTrue(settings.isConsoleLoggingEnabled());
        assertFalse(settings.isFileLoggingEnabled());
        assertEquals(EvaluationConfig.defaults(), settings.toEvaluationConfig());
    }

    @Test
    public void testLoadFromFile() throws Exception {
        ParserSettings settings = new ParserSettings("src/test/resources/parser_settings_test.json");

        assertEquals(AngleUnit.RADIANS, settings.getAngleUnit());
        assertEquals(BatchFailureMode.EXCEPTION, settings.getFailureMode());
        assertEquals("DEBUG", settings.getLoggingLevel());
        assertFalse(settings.isConsoleLoggingEnabled());
        assertFalse(settings.isFileLoggingEnabled());
        assertEquals("parser-test.log", settings.getLogFileName());
        assertEquals(AngleUnit.RADIANS, settings.toEvaluationConfig().getAngleUnit());
    }

    @Test
    public void testMissingFileKeepsDefaults() throws Exception {
        ParserSettings settings = new ParserSettings("src/test/resources/does_not_exist.json");
        assertEquals(AngleUnit.DEGREES, settings.getAngleUnit());
        assertEquals(BatchFailureMode.WARNING, settings.getFailureMode());
    }

    @Test
    public void testPartialDocument() throws Exception {
        ParserSettings settings = new ParserSettings();
        settings.apply(new ObjectMapper().readTree("{\"angleUnit\": \"RADIANS\"}"));

        assertEquals(AngleUnit.RADIANS, settings.getAngleUnit());
        assertEquals(BatchFailureMode.WARNING, settings.getFailureMode());
        assertEquals("INFO", settings.getLoggingLevel());
    }

    @Test
    public void testInvalidAngleUnit() throws Exception {
        ParserSettings settings = new ParserSettings();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> settings.apply(new ObjectMapper().readTree("{\"angleUnit\": \"GRADIANS\"}")));
        assertTrue(e.getMessage().contains("GRADIANS"));
    }

    @Test
    public void testBundledResource() throws Exception {
        ParserSettings settings = ParserSettings.fromClasspath();
        assertEquals(AngleUnit.DEGREES, settings.getAngleUnit());
        assertEquals(BatchFailureMode.WARNING, settings.getFailureMode());
        assertEquals("mathparse.log", settings.getLogFileName());
    }
}
