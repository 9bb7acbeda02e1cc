package com.taskforge.core.config;

import com.taskforge.core.model.StepCategory;
import com.taskforge.core.model.Tier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "taskforge")
public class EngineProperties {

    private WorkspaceSettings workspace = new WorkspaceSettings();
    private Execution execution = new Execution();
    private Verification verification = new Verification();
    private Events events = new Events();
    private Routing routing = new Routing();
    private Tiers tiers = new Tiers();

    // -- Execution accessors (delegate to nested) --
    public int getMaxConcurrentTasks() { return execution.maxConcurrentTasks; }
    public int getMaxRetries() { return execution.maxRetries; }
    public int getSoftRetryCount() { return execution.softRetryCount; }
    public int getMaxDepth() { return execution.maxDepth; }
    public Duration getBackendTimeout() { return Duration.ofSeconds(execution.backendTimeoutSeconds); }
    public long getLockPollMillis() { return execution.lockPollMillis; }

    public Duration getVerificationTimeout() { return Duration.ofSeconds(verification.timeoutSeconds); }

    /**
     * Verification command for a category: the configured override when present,
     * otherwise the category's built-in default.
     */
    public String verificationCommandFor(StepCategory category) {
        String override = verification.commands.get(category);
        return override != null && !override.isBlank() ? override : category.defaultVerificationCommand();
    }

    /** Settings for one tier. */
    public TierSettings tier(Tier tier) {
        return switch (tier) {
            case LOCAL -> tiers.local;
            case MID -> tiers.mid;
            case PREMIUM -> tiers.premium;
        };
    }

    public WorkspaceSettings getWorkspace() { return workspace; }
    public void setWorkspace(WorkspaceSettings workspace) { this.workspace = workspace; }
    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Verification getVerification() { return verification; }
    public void setVerification(Verification verification) { this.verification = verification; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }
    public Routing getRouting() { return routing; }
    public void setRouting(Routing routing) { this.routing = routing; }
    public Tiers getTiers() { return tiers; }
    public void setTiers(Tiers tiers) { this.tiers = tiers; }

    public static class WorkspaceSettings {
        private String root = ".";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
    }

    public static class Execution {
        private int maxConcurrentTasks = 4;
        private int maxRetries = 3;
        private int softRetryCount = 2;
        private int maxDepth = 3;
        private int backendTimeoutSeconds = 300;
        private long lockPollMillis = 50;

        public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
        public void setMaxConcurrentTasks(int maxConcurrentTasks) { this.maxConcurrentTasks = maxConcurrentTasks; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public int getSoftRetryCount() { return softRetryCount; }
        public void setSoftRetryCount(int softRetryCount) { this.softRetryCount = softRetryCount; }
        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
        public int getBackendTimeoutSeconds() { return backendTimeoutSeconds; }
        public void setBackendTimeoutSeconds(int backendTimeoutSeconds) { this.backendTimeoutSeconds = backendTimeoutSeconds; }
        public long getLockPollMillis() { return lockPollMillis; }
        public void setLockPollMillis(long lockPollMillis) { this.lockPollMillis = lockPollMillis; }
    }

    public static class Verification {
        private int timeoutSeconds = 300;
        private Map<StepCategory, String> commands = new EnumMap<>(StepCategory.class);

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public Map<StepCategory, String> getCommands() { return commands; }
        public void setCommands(Map<StepCategory, String> commands) { this.commands = commands; }
    }

    public static class Events {
        private int queueCapacity = 1024;

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    /** Starting tier per step category; categories not listed start at {@code defaultTier}. */
    public static class Routing {
        private Tier defaultTier = Tier.LOCAL;
        private Map<StepCategory, Tier> categoryTiers = new EnumMap<>(StepCategory.class);

        public Tier getDefaultTier() { return defaultTier; }
        public void setDefaultTier(Tier defaultTier) { this.defaultTier = defaultTier; }
        public Map<StepCategory, Tier> getCategoryTiers() { return categoryTiers; }
        public void setCategoryTiers(Map<StepCategory, Tier> categoryTiers) { this.categoryTiers = categoryTiers; }
    }

    public static class Tiers {
        private TierSettings local = new TierSettings(0.0);
        private TierSettings mid = new TierSettings(0.002);
        private TierSettings premium = new TierSettings(0.015);

        public TierSettings getLocal() { return local; }
        public void setLocal(TierSettings local) { this.local = local; }
        public TierSettings getMid() { return mid; }
        public void setMid(TierSettings mid) { this.mid = mid; }
        public TierSettings getPremium() { return premium; }
        public void setPremium(TierSettings premium) { this.premium = premium; }
    }

    public static class TierSettings {
        private boolean enabled = true;
        private String command = "";
        private double cost;

        public TierSettings() {}

        TierSettings(double cost) {
            this.cost = cost;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public double getCost() { return cost; }
        public void setCost(double cost) { this.cost = cost; }
    }
}
