package com.boardwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "watch")
public class WatchProperties {
    private Board board = new Board();
    private Delivery delivery = new Delivery();
    private Schedule schedule = new Schedule();
    private Secrets secrets = new Secrets();
    private Jobs jobs = new Jobs();
    private Cli cli = new Cli();
    private Daemon daemon = new Daemon();

    public Board getBoard() {
        return board;
    }

    public void setBoard(Board board) {
        this.board = board;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public void setDelivery(Delivery delivery) {
        this.delivery = delivery;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Secrets getSecrets() {
        return secrets;
    }

    public void setSecrets(Secrets secrets) {
        this.secrets = secrets;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Daemon getDaemon() {
        return daemon;
    }

    public void setDaemon(Daemon daemon) {
        this.daemon = daemon;
    }

    public static class Board {
        private static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (compatible; board-watch/0.1; +https://github.com/boardwatch)";

        private String baseUrl = "https://www.ptt.cc";
        private String userAgent;
        private int requestTimeoutSeconds = 30;
        private int requestMaxRetries = 2;
        private int requestRetryBaseDelayMs = 1000;
        private int requestRetryMaxDelayMs = 10000;
        private int perHostDelayMs = 250;
        private int maxPages = 5;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = stripTrailingSlash(baseUrl);
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public int getRequestMaxRetries() {
            return Math.max(0, requestMaxRetries);
        }

        public void setRequestMaxRetries(int requestMaxRetries) {
            this.requestMaxRetries = Math.max(0, requestMaxRetries);
        }

        public int getRequestRetryBaseDelayMs() {
            return Math.max(0, requestRetryBaseDelayMs);
        }

        public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
            this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
        }

        public int getRequestRetryMaxDelayMs() {
            return Math.max(0, requestRetryMaxDelayMs);
        }

        public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
            this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
        }

        public int getPerHostDelayMs() {
            return Math.max(0, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(0, perHostDelayMs);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public static String normalizeUserAgent(String candidate) {
            if (candidate == null || candidate.isBlank()) {
                return DEFAULT_USER_AGENT;
            }
            return candidate.trim();
        }
    }

    public static class Delivery {
        private String apiBaseUrl = "https://api.telegram.org";
        private int maxAttempts = 3;
        private int baseDelayMs = 1000;
        private int maxDelayMs = 10000;
        private int pacingDelayMs = 1000;
        private String parseMode = "Markdown";
        private boolean disableWebPagePreview = true;
        private int requestTimeoutSeconds = 30;

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = stripTrailingSlash(apiBaseUrl);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }

        public int getPacingDelayMs() {
            return Math.max(0, pacingDelayMs);
        }

        public void setPacingDelayMs(int pacingDelayMs) {
            this.pacingDelayMs = Math.max(0, pacingDelayMs);
        }

        public String getParseMode() {
            return parseMode;
        }

        public void setParseMode(String parseMode) {
            this.parseMode = parseMode;
        }

        public boolean isDisableWebPagePreview() {
            return disableWebPagePreview;
        }

        public void setDisableWebPagePreview(boolean disableWebPagePreview) {
            this.disableWebPagePreview = disableWebPagePreview;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }
    }

    public static class Schedule {
        private String zone = "UTC";
        private String defaultDailyTime = "09:00";
        private int defaultIntervalMinutes = 60;

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public ZoneId zoneId() {
            if (zone == null || zone.isBlank()) {
                return ZoneOffset.UTC;
            }
            return ZoneId.of(zone.trim());
        }

        public String getDefaultDailyTime() {
            return defaultDailyTime;
        }

        public void setDefaultDailyTime(String defaultDailyTime) {
            this.defaultDailyTime = defaultDailyTime;
        }

        public int getDefaultIntervalMinutes() {
            return Math.max(1, defaultIntervalMinutes);
        }

        public void setDefaultIntervalMinutes(int defaultIntervalMinutes) {
            this.defaultIntervalMinutes = Math.max(1, defaultIntervalMinutes);
        }
    }

    public static class Secrets {
        private String botTokenName = "telegram-bot-token";
        private Map<String, String> values = new LinkedHashMap<>();

        public String getBotTokenName() {
            return botTokenName;
        }

        public void setBotTokenName(String botTokenName) {
            this.botTokenName = botTokenName;
        }

        public Map<String, String> getValues() {
            return values;
        }

        public void setValues(Map<String, String> values) {
            this.values = values == null ? new LinkedHashMap<>() : values;
        }
    }

    public static class Jobs {
        private int defaultPostCount = 20;

        public int getDefaultPostCount() {
            return Math.max(1, Math.min(100, defaultPostCount));
        }

        public void setDefaultPostCount(int defaultPostCount) {
            this.defaultPostCount = defaultPostCount;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Daemon {
        private boolean enabled;
        private int pollIntervalSeconds = 300;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPollIntervalSeconds() {
            return Math.max(10, pollIntervalSeconds);
        }

        public void setPollIntervalSeconds(int pollIntervalSeconds) {
            this.pollIntervalSeconds = pollIntervalSeconds;
        }
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
