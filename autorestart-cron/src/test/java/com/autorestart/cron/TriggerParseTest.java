package com.autorestart.cron;

import com.autorestart.common.config.PluginConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class TriggerParseTest {

    // =========================================================================
    // parse
    // =========================================================================

    @Test
    void digits_areIntervalSeconds() {
        RestartTrigger trigger = TriggerParse.parse(" 3600 ");
        assertEquals(RestartTrigger.Kind.INTERVAL, trigger.kind());
        assertEquals(3600, trigger.intervalSeconds());
    }

    @Test
    void clockTime_isDaily() {
        RestartTrigger trigger = TriggerParse.parse("3:05");
        assertEquals(RestartTrigger.Kind.DAILY_TIME, trigger.kind());
        assertEquals(LocalTime.of(3, 5), trigger.timeOfDay());
        assertEquals("daily at 03:05", trigger.describe());
    }

    @Test
    void fiveFields_isCronAndNormalized() {
        RestartTrigger trigger = TriggerParse.parse("0   3 *  * *");
        assertEquals(RestartTrigger.Kind.CRON, trigger.kind());
        assertEquals("0 3 * * *", trigger.cronExpression());
    }

    @Test
    void wrongFieldCount_reportsCronError() {
        SchedulingError error = assertThrows(SchedulingError.class, () -> TriggerParse.parse("* *"));
        assertTrue(error.getMessage().contains("5 fields"), error.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "0", "24:00", "12:60", "noon", "99999999999999999999", "99999999999999999", "31622401", "61 * * * *"})
    void invalidInput_isRejected(String input) {
        assertThrows(SchedulingError.class, () -> TriggerParse.parse(input));
    }

    @Test
    void interval_upToOneLeapYear_isAccepted() {
        assertEquals(31_622_400, TriggerParse.parse("31622400").intervalSeconds());
    }

    // =========================================================================
    // fromConfig
    // =========================================================================

    @Test
    void fromConfig_cronWinsOverTimeAndInterval() {
        PluginConfig config = new PluginConfig();
        config.setRestartCron("30 4 * * 1");
        config.setRestartTime("03:00");
        config.setRestartInterval(60L);

        assertEquals(RestartTrigger.cron("30 4 * * 1"), TriggerParse.fromConfig(config));
    }

    @Test
    void fromConfig_timeWinsOverInterval() {
        PluginConfig config = new PluginConfig();
        config.setRestartTime("03:00");
        config.setRestartInterval(60L);

        assertEquals(RestartTrigger.dailyAt(3, 0), TriggerParse.fromConfig(config));
    }

    @Test
    void fromConfig_interval() {
        PluginConfig config = new PluginConfig();
        config.setRestartCron("");
        config.setRestartInterval(7200L);

        assertEquals(RestartTrigger.interval(7200), TriggerParse.fromConfig(config));
    }

    @Test
    void fromConfig_nothingSet_isNone() {
        PluginConfig config = new PluginConfig();
        config.setRestartInterval(0L);

        assertTrue(TriggerParse.fromConfig(config).isNone());
    }

    @Test
    void fromConfig_hugeInterval_isRejected() {
        PluginConfig config = new PluginConfig();
        config.setRestartInterval(Long.MAX_VALUE);

        assertThrows(SchedulingError.class, () -> TriggerParse.fromConfig(config));
    }

    @Test
    void fromConfig_badTime_isRejected() {
        PluginConfig config = new PluginConfig();
        config.setRestartTime("3 o'clock");

        assertThrows(SchedulingError.class, () -> TriggerParse.fromConfig(config));
    }
}
