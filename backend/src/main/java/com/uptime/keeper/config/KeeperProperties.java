package com.uptime.keeper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "keeper")
public class KeeperProperties {
    private static final String DEFAULT_USER_AGENT = "uptime-keeper/0.1 (+health-probe)";

    private String userAgent;
    private Scheduler scheduler = new Scheduler();
    private Probe probe = new Probe();
    private Redeploy redeploy = new Redeploy();
    private Health health = new Health();
    private Defaults defaults = new Defaults();
    private Notifier notifier = new Notifier();
    private Providers providers = new Providers();
    private Seed seed = new Seed();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Probe getProbe() {
        return probe;
    }

    public void setProbe(Probe probe) {
        this.probe = probe;
    }

    public Redeploy getRedeploy() {
        return redeploy;
    }

    public void setRedeploy(Redeploy redeploy) {
        this.redeploy = redeploy;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Notifier getNotifier() {
        return notifier;
    }

    public void setNotifier(Notifier notifier) {
        this.notifier = notifier;
    }

    public Providers getProviders() {
        return providers;
    }

    public void setProviders(Providers providers) {
        this.providers = providers;
    }

    public Seed getSeed() {
        return seed;
    }

    public void setSeed(Seed seed) {
        this.seed = seed;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int tickMillis = 1000;
        private int poolSize = 5;
        private int shutdownTimeoutSeconds = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTickMillis() {
            return Math.max(50, tickMillis);
        }

        public void setTickMillis(int tickMillis) {
            this.tickMillis = Math.max(50, tickMillis);
        }

        public int getPoolSize() {
            return Math.max(1, poolSize);
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = Math.max(1, poolSize);
        }

        public int getShutdownTimeoutSeconds() {
            return Math.max(1, shutdownTimeoutSeconds);
        }

        public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
            this.shutdownTimeoutSeconds = Math.max(1, shutdownTimeoutSeconds);
        }
    }

    public static class Probe {
        private int maxTimeoutSeconds = 30;

        public int getMaxTimeoutSeconds() {
            return Math.max(1, maxTimeoutSeconds);
        }

        public void setMaxTimeoutSeconds(int maxTimeoutSeconds) {
            this.maxTimeoutSeconds = Math.max(1, maxTimeoutSeconds);
        }
    }

    public static class Redeploy {
        private int providerTimeoutSeconds = 60;
        private int historySize = 10;
        private int poolSize = 2;

        public int getProviderTimeoutSeconds() {
            return Math.max(1, providerTimeoutSeconds);
        }

        public void setProviderTimeoutSeconds(int providerTimeoutSeconds) {
            this.providerTimeoutSeconds = Math.max(1, providerTimeoutSeconds);
        }

        public int getHistorySize() {
            return Math.max(1, historySize);
        }

        public void setHistorySize(int historySize) {
            this.historySize = Math.max(1, historySize);
        }

        public int getPoolSize() {
            return Math.max(1, poolSize);
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = Math.max(1, poolSize);
        }
    }

    public static class Health {
        private int degradedAfterFailures = 2;

        public int getDegradedAfterFailures() {
            return Math.max(1, degradedAfterFailures);
        }

        public void setDegradedAfterFailures(int degradedAfterFailures) {
            this.degradedAfterFailures = Math.max(1, degradedAfterFailures);
        }
    }

    public static class Defaults {
        private long probeIntervalSeconds = 300;
        private int failureThreshold = 3;
        private long redeployCooldownSeconds = 300;

        public long getProbeIntervalSeconds() {
            return Math.max(1, probeIntervalSeconds);
        }

        public void setProbeIntervalSeconds(long probeIntervalSeconds) {
            this.probeIntervalSeconds = Math.max(1, probeIntervalSeconds);
        }

        public int getFailureThreshold() {
            return Math.max(1, failureThreshold);
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = Math.max(1, failureThreshold);
        }

        public long getRedeployCooldownSeconds() {
            return Math.max(0, redeployCooldownSeconds);
        }

        public void setRedeployCooldownSeconds(long redeployCooldownSeconds) {
            this.redeployCooldownSeconds = Math.max(0, redeployCooldownSeconds);
        }
    }

    public static class Notifier {
        private String webhookUrl;
        private int recentEventsLimit = 100;

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public int getRecentEventsLimit() {
            return Math.max(1, recentEventsLimit);
        }

        public void setRecentEventsLimit(int recentEventsLimit) {
            this.recentEventsLimit = Math.max(1, recentEventsLimit);
        }
    }

    public static class Providers {
        private Koyeb koyeb = new Koyeb();

        public Koyeb getKoyeb() {
            return koyeb;
        }

        public void setKoyeb(Koyeb koyeb) {
            this.koyeb = koyeb;
        }
    }

    public static class Koyeb {
        private String apiBaseUrl = "https://app.koyeb.com";
        private String apiToken = "";

        public String getApiBaseUrl() {
            if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
                return "https://app.koyeb.com";
            }
            String trimmed = apiBaseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken;
        }
    }

    public static class Seed {
        private String file = "";

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }
    }
}
