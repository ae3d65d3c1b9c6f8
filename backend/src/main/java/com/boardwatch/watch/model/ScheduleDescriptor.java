package com.boardwatch.watch.model;

import java.util.Locale;

public sealed interface ScheduleDescriptor
    permits ScheduleDescriptor.Hourly, ScheduleDescriptor.Daily, ScheduleDescriptor.Custom, ScheduleDescriptor.Unknown {

    String TYPE_HOURLY = "hourly";
    String TYPE_DAILY = "daily";
    String TYPE_CUSTOM = "custom";

    String type();

    static ScheduleDescriptor of(String type, String timeOfDay, Integer intervalMinutes) {
        String normalized = type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case TYPE_HOURLY -> new Hourly();
            case TYPE_DAILY -> new Daily(timeOfDay);
            case TYPE_CUSTOM -> new Custom(intervalMinutes);
            default -> new Unknown(type);
        };
    }

    record Hourly() implements ScheduleDescriptor {
        @Override
        public String type() {
            return TYPE_HOURLY;
        }
    }

    record Daily(String timeOfDay) implements ScheduleDescriptor {
        @Override
        public String type() {
            return TYPE_DAILY;
        }
    }

    record Custom(Integer intervalMinutes) implements ScheduleDescriptor {
        @Override
        public String type() {
            return TYPE_CUSTOM;
        }
    }

    record Unknown(String rawType) implements ScheduleDescriptor {
        @Override
        public String type() {
            return rawType;
        }
    }
}
