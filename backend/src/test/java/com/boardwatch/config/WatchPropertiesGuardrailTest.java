package com.boardwatch.config;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WatchPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToDefault() {
        WatchProperties properties = new WatchProperties();
        properties.getBoard().setUserAgent("   ");
        assertTrue(properties.getBoard().getUserAgent().contains("board-watch/0.1"));
    }

    @Test
    void baseUrlsLoseTrailingSlash() {
        WatchProperties properties = new WatchProperties();
        properties.getBoard().setBaseUrl("https://www.ptt.cc/");
        properties.getDelivery().setApiBaseUrl("https://api.telegram.org/");
        assertEquals("https://www.ptt.cc", properties.getBoard().getBaseUrl());
        assertEquals("https://api.telegram.org", properties.getDelivery().getApiBaseUrl());
    }

    @Test
    void numericSettingsAreClamped() {
        WatchProperties properties = new WatchProperties();
        properties.getBoard().setMaxPages(0);
        properties.getBoard().setPerHostDelayMs(-5);
        properties.getDelivery().setMaxAttempts(0);
        properties.getJobs().setDefaultPostCount(500);
        properties.getDaemon().setPollIntervalSeconds(1);
        properties.getSchedule().setDefaultIntervalMinutes(-1);

        assertEquals(1, properties.getBoard().getMaxPages());
        assertEquals(0, properties.getBoard().getPerHostDelayMs());
        assertEquals(1, properties.getDelivery().getMaxAttempts());
        assertEquals(100, properties.getJobs().getDefaultPostCount());
        assertEquals(10, properties.getDaemon().getPollIntervalSeconds());
        assertEquals(1, properties.getSchedule().getDefaultIntervalMinutes());
    }

    @Test
    void scheduleZoneDefaultsToUtc() {
        WatchProperties properties = new WatchProperties();
        properties.getSchedule().setZone(" ");
        assertEquals(ZoneOffset.UTC, properties.getSchedule().zoneId());
        properties.getSchedule().setZone("Asia/Taipei");
        assertEquals(ZoneId.of("Asia/Taipei"), properties.getSchedule().zoneId());
    }
}
