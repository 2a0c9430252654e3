package com.linkshelf.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "refresh")
public class RefreshProperties {
    private static final String DEFAULT_USER_AGENT = "linkshelf-refresh/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 10;
    private Scheduler scheduler = new Scheduler();
    private Scraper scraper = new Scraper();
    private Github github = new Github();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Scraper getScraper() {
        return scraper;
    }

    public void setScraper(Scraper scraper) {
        this.scraper = scraper;
    }

    public Github getGithub() {
        return github;
    }

    public void setGithub(Github github) {
        this.github = github;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    // Range checks happen in SchedulerConfig.
    public static class Scheduler {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(24);
        private int batchSize = 50;
        private int jitterPercent = 20;
        private int maxConcurrency = 8;
        private int failureThreshold = 3;
        private boolean retryRepoUnavailable = false;
        private Duration shutdownTimeout = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getJitterPercent() {
            return jitterPercent;
        }

        public void setJitterPercent(int jitterPercent) {
            this.jitterPercent = jitterPercent;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public boolean isRetryRepoUnavailable() {
            return retryRepoUnavailable;
        }

        public void setRetryRepoUnavailable(boolean retryRepoUnavailable) {
            this.retryRepoUnavailable = retryRepoUnavailable;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Scraper {
        private int maxBodyBytes = 2_000_000;

        public int getMaxBodyBytes() {
            return Math.max(1, maxBodyBytes);
        }

        public void setMaxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = Math.max(1, maxBodyBytes);
        }
    }

    public static class Github {
        private String apiBaseUrl = "https://api.github.com";
        private String token;

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public boolean hasToken() {
            return token != null && !token.isBlank();
        }
    }
}
