package com.richcorabbithole.pipeline.shared;

import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class AppConfigTest {

    private final AppConfig config = AppConfig.fromMap(Map.of(
            "TABLE_NAME", "tasks",
            "WAIT_TIME_SECONDS", "10",
            "BLANK", "  ",
            "BROKEN_INT", "ten"));

    @Test
    public void testRequiredValue() {
        assertEquals("tasks", config.getString("TABLE_NAME"));
    }

    @Test
    public void testMissingRequiredValueFailsFast() {
        try {
            config.getString("BUCKET_NAME");
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals("Missing required environment variable: BUCKET_NAME", e.getMessage());
        }
    }

    @Test
    public void testBlankCountsAsMissing() {
        assertEquals("fallback", config.getOptional("BLANK", "fallback"));
    }

    @Test
    public void testIntValues() {
        assertEquals(10, config.getIntOptional("WAIT_TIME_SECONDS", 20));
        assertEquals(20, config.getIntOptional("NOT_SET", 20));
    }

    @Test(expected = IllegalStateException.class)
    public void testMalformedIntIsAnError() {
        config.getIntOptional("BROKEN_INT", 1);
    }
}
