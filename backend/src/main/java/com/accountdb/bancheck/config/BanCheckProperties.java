package com.accountdb.bancheck.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bancheck")
public class BanCheckProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";
    private static final String DEFAULT_PROFILE_BASE_URL = "https://steamcommunity.com/profiles";

    private String userAgent;
    private String profileBaseUrl = DEFAULT_PROFILE_BASE_URL;
    private int requestTimeoutSeconds = 25;
    private int taskTimeoutSeconds = 3600;
    private int maxConcurrentTasks = 4;
    private int maxIdentifiersPerTask = 10000;
    private int rateLimitPauseMs = 30000;
    private Api api = new Api();
    private Proxy proxy = new Proxy();
    private Balancing balancing = new Balancing();
    private Persistence persistence = new Persistence();
    private Identifiers identifiers = new Identifiers();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getProfileBaseUrl() {
        return normalizeBaseUrl(profileBaseUrl);
    }

    public void setProfileBaseUrl(String profileBaseUrl) {
        this.profileBaseUrl = normalizeBaseUrl(profileBaseUrl);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getTaskTimeoutSeconds() {
        return Math.max(1, taskTimeoutSeconds);
    }

    public void setTaskTimeoutSeconds(int taskTimeoutSeconds) {
        this.taskTimeoutSeconds = Math.max(1, taskTimeoutSeconds);
    }

    public int getMaxConcurrentTasks() {
        return Math.max(1, maxConcurrentTasks);
    }

    public void setMaxConcurrentTasks(int maxConcurrentTasks) {
        this.maxConcurrentTasks = Math.max(1, maxConcurrentTasks);
    }

    public int getMaxIdentifiersPerTask() {
        return Math.max(1, maxIdentifiersPerTask);
    }

    public void setMaxIdentifiersPerTask(int maxIdentifiersPerTask) {
        this.maxIdentifiersPerTask = Math.max(1, maxIdentifiersPerTask);
    }

    public int getRateLimitPauseMs() {
        return Math.max(0, rateLimitPauseMs);
    }

    public void setRateLimitPauseMs(int rateLimitPauseMs) {
        this.rateLimitPauseMs = Math.max(0, rateLimitPauseMs);
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Proxy getProxy() {
        return proxy;
    }

    public void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    public Balancing getBalancing() {
        return balancing;
    }

    public void setBalancing(Balancing balancing) {
        this.balancing = balancing;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Identifiers getIdentifiers() {
        return identifiers;
    }

    public void setIdentifiers(Identifiers identifiers) {
        this.identifiers = identifiers;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static String normalizeBaseUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_PROFILE_BASE_URL;
        }
        String value = candidate.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    public static class Api {
        private int defaultListLimit = 50;
        private int maxListLimit = 100;
        private int pollWindowSeconds = 10;
        private int pollMaxRequestsPerWindow = 30;

        public int getDefaultListLimit() {
            return Math.max(1, defaultListLimit);
        }

        public void setDefaultListLimit(int defaultListLimit) {
            this.defaultListLimit = Math.max(1, defaultListLimit);
        }

        public int getMaxListLimit() {
            return Math.max(1, maxListLimit);
        }

        public void setMaxListLimit(int maxListLimit) {
            this.maxListLimit = Math.max(1, maxListLimit);
        }

        public int getPollWindowSeconds() {
            return Math.max(1, pollWindowSeconds);
        }

        public void setPollWindowSeconds(int pollWindowSeconds) {
            this.pollWindowSeconds = Math.max(1, pollWindowSeconds);
        }

        public int getPollMaxRequestsPerWindow() {
            return Math.max(1, pollMaxRequestsPerWindow);
        }

        public void setPollMaxRequestsPerWindow(int pollMaxRequestsPerWindow) {
            this.pollMaxRequestsPerWindow = Math.max(1, pollMaxRequestsPerWindow);
        }
    }

    public static class Proxy {
        private int failureThreshold = 3;
        private int cooldownSeconds = 120;
        private boolean requireProxies = false;
        private boolean allowDirectFallback = true;
        private String defaultProxyFile = "";

        public int getFailureThreshold() {
            return Math.max(1, failureThreshold);
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = Math.max(1, failureThreshold);
        }

        public int getCooldownSeconds() {
            return Math.max(0, cooldownSeconds);
        }

        public void setCooldownSeconds(int cooldownSeconds) {
            this.cooldownSeconds = Math.max(0, cooldownSeconds);
        }

        public boolean isRequireProxies() {
            return requireProxies;
        }

        public void setRequireProxies(boolean requireProxies) {
            this.requireProxies = requireProxies;
        }

        public boolean isAllowDirectFallback() {
            return allowDirectFallback;
        }

        public void setAllowDirectFallback(boolean allowDirectFallback) {
            this.allowDirectFallback = allowDirectFallback;
        }

        public String getDefaultProxyFile() {
            return defaultProxyFile;
        }

        public void setDefaultProxyFile(String defaultProxyFile) {
            this.defaultProxyFile = defaultProxyFile == null ? "" : defaultProxyFile.trim();
        }
    }

    public static class Balancing {
        private int maxTotalConcurrency = 50;

        public int getMaxTotalConcurrency() {
            return Math.max(1, maxTotalConcurrency);
        }

        public void setMaxTotalConcurrency(int maxTotalConcurrency) {
            this.maxTotalConcurrency = Math.max(1, maxTotalConcurrency);
        }
    }

    public static class Persistence {
        private int maxAttempts = 3;
        private int retryBaseDelayMs = 200;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }
    }

    public static class Identifiers {
        private boolean requireSteamId64 = false;

        public boolean isRequireSteamId64() {
            return requireSteamId64;
        }

        public void setRequireSteamId64(boolean requireSteamId64) {
            this.requireSteamId64 = requireSteamId64;
        }
    }
}
