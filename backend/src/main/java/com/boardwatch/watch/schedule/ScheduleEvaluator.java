package com.boardwatch.watch.schedule;

import com.boardwatch.config.WatchProperties;
import com.boardwatch.watch.model.ScheduleDescriptor;
import com.boardwatch.watch.model.WatchConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

@Component
public class ScheduleEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ScheduleEvaluator.class);
    private static final LocalTime FALLBACK_DAILY_TIME = LocalTime.of(9, 0);
    private static final Duration HOURLY = Duration.ofHours(1);

    private final ZoneId zone;
    private final LocalTime defaultDailyTime;
    private final int defaultIntervalMinutes;

    public ScheduleEvaluator(WatchProperties properties) {
        WatchProperties.Schedule schedule = properties.getSchedule();
        this.zone = schedule.zoneId();
        this.defaultDailyTime = parseTimeOfDay(schedule.getDefaultDailyTime()).orElse(FALLBACK_DAILY_TIME);
        this.defaultIntervalMinutes = schedule.getDefaultIntervalMinutes();
    }

    public boolean isDue(WatchConfiguration config, Instant now) {
        try {
            if (config.lastExecutedAt() == null) {
                log.info("Config '{}' ({}) has never been executed; marking as due", config.displayName(), config.id());
                return true;
            }
            return evaluate(config, now);
        } catch (RuntimeException e) {
            log.warn("Failed to evaluate schedule for config {}; treating as not due", config == null ? null : config.id(), e);
            return false;
        }
    }

    public Optional<Instant> nextExecutionAt(WatchConfiguration config, Instant now) {
        ScheduleDescriptor schedule = config.schedule();
        if (schedule instanceof ScheduleDescriptor.Hourly) {
            return Optional.of(now.atZone(zone).truncatedTo(ChronoUnit.HOURS).plusHours(1).toInstant());
        }
        if (schedule instanceof ScheduleDescriptor.Daily daily) {
            ZonedDateTime current = now.atZone(zone);
            ZonedDateTime next = current.toLocalDate().atTime(dailyTime(daily)).atZone(zone);
            if (!next.isAfter(current)) {
                next = next.plusDays(1);
            }
            return Optional.of(next.toInstant());
        }
        if (schedule instanceof ScheduleDescriptor.Custom custom) {
            return Optional.of(now.plus(Duration.ofMinutes(intervalMinutes(custom))));
        }
        return Optional.empty();
    }

    private boolean evaluate(WatchConfiguration config, Instant now) {
        ScheduleDescriptor schedule = config.schedule();
        Instant lastExecuted = config.lastExecutedAt();
        if (schedule instanceof ScheduleDescriptor.Hourly) {
            Instant nextDue = lastExecuted.plus(HOURLY);
            boolean due = !now.isBefore(nextDue);
            log.debug("Hourly schedule for {}: next due {}, due={}", config.id(), nextDue, due);
            return due;
        }
        if (schedule instanceof ScheduleDescriptor.Daily daily) {
            ZonedDateTime current = now.atZone(zone);
            ZonedDateTime todayScheduled = current.toLocalDate().atTime(dailyTime(daily)).atZone(zone);
            boolean notYetToday = lastExecuted.atZone(zone).toLocalDate().isBefore(current.toLocalDate());
            boolean due = notYetToday && !current.isBefore(todayScheduled);
            log.debug("Daily schedule for {}: today at {}, last run {}, due={}", config.id(), todayScheduled, lastExecuted, due);
            return due;
        }
        if (schedule instanceof ScheduleDescriptor.Custom custom) {
            Instant nextDue = lastExecuted.plus(Duration.ofMinutes(intervalMinutes(custom)));
            boolean due = !now.isBefore(nextDue);
            log.debug("Custom schedule for {}: next due {}, due={}", config.id(), nextDue, due);
            return due;
        }
        log.warn(
            "Unknown schedule type '{}' for config '{}' ({}); marking as not due",
            schedule == null ? null : schedule.type(),
            config.displayName(),
            config.id()
        );
        return false;
    }

    private LocalTime dailyTime(ScheduleDescriptor.Daily daily) {
        Optional<LocalTime> parsed = parseTimeOfDay(daily.timeOfDay());
        if (parsed.isEmpty() && daily.timeOfDay() != null) {
            log.warn("Invalid daily time '{}', using {}", daily.timeOfDay(), defaultDailyTime);
        }
        return parsed.orElse(defaultDailyTime);
    }

    private int intervalMinutes(ScheduleDescriptor.Custom custom) {
        Integer interval = custom.intervalMinutes();
        if (interval == null || interval <= 0) {
            return defaultIntervalMinutes;
        }
        return interval;
    }

    static Optional<LocalTime> parseTimeOfDay(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String[] parts = raw.trim().split(":");
        if (parts.length != 2) {
            return Optional.empty();
        }
        try {
            int hour = Integer.parseInt(parts[0]);
            int minute = Integer.parseInt(parts[1]);
            if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
                return Optional.empty();
            }
            return Optional.of(LocalTime.of(hour, minute));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
