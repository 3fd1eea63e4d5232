package io.github.hunghhdev.cohortttl.core;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Engine-wide settings. Build with {@link #builder()}; every value has a default.
 *
 * @since 1.0.0
 */
public final class CleanupOptions {

    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_LEASE_TTL = Duration.ofSeconds(15);
    public static final Duration DEFAULT_COLD_START_OBSERVATION_WINDOW = Duration.ofSeconds(15);
    public static final int DEFAULT_MISSED_HEARTBEAT_THRESHOLD = 3;
    public static final Duration DEFAULT_ELECTION_JITTER = Duration.ofMillis(250);
    public static final int DEFAULT_MAX_ELECTION_ROUNDS = 3;
    public static final Duration DEFAULT_PER_RECORD_TIMEOUT = Duration.ofSeconds(30);

    private final int batchSize;
    private final Map<Granularity, FireSchedule> schedules;
    private final boolean enableCoordinator;
    private final Duration heartbeatInterval;
    private final Duration leaseTtl;
    private final Duration coldStartObservationWindow;
    private final int missedHeartbeatThreshold;
    private final Duration startupJitter;
    private final Duration electionJitter;
    private final int maxElectionRounds;
    private final String workerId;
    private final String indexResourceName;
    private final String leaseResourceName;
    private final String leaseName;
    private final String cursorResourceName;
    private final Duration perRecordTimeout;
    private final Duration callbackRetryDelay;
    private final Set<String> resourceAllowlist;
    private final Set<String> resourceBlocklist;

    private CleanupOptions(Builder builder, Map<Granularity, FireSchedule> schedules) {
        this.batchSize = builder.batchSize;
        this.schedules = Collections.unmodifiableMap(schedules);
        this.enableCoordinator = builder.enableCoordinator;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.leaseTtl = builder.leaseTtl;
        this.coldStartObservationWindow = builder.skipColdStart ? Duration.ZERO : builder.coldStartObservationWindow;
        this.missedHeartbeatThreshold = builder.missedHeartbeatThreshold;
        this.startupJitter = builder.startupJitter;
        this.electionJitter = builder.electionJitter;
        this.maxElectionRounds = builder.maxElectionRounds;
        this.workerId = builder.workerId != null ? builder.workerId : "worker-" + UUID.randomUUID();
        this.indexResourceName = builder.indexResourceName;
        this.leaseResourceName = builder.leaseResourceName;
        this.leaseName = builder.leaseName;
        this.cursorResourceName = builder.cursorResourceName;
        this.perRecordTimeout = builder.perRecordTimeout;
        this.callbackRetryDelay = builder.callbackRetryDelay;
        this.resourceAllowlist = Collections.unmodifiableSet(new LinkedHashSet<>(builder.resourceAllowlist));
        this.resourceBlocklist = Collections.unmodifiableSet(new LinkedHashSet<>(builder.resourceBlocklist));
    }

    public static CleanupOptions defaults() {
        return builder().build();
    }

    /**
     * @return true if rules for {@code resource} pass the allowlist and blocklist
     */
    public boolean accepts(String resource) {
        if (!resourceAllowlist.isEmpty() && !resourceAllowlist.contains(resource)) {
            return false;
        }
        return !resourceBlocklist.contains(resource);
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Map<Granularity, FireSchedule> getSchedules() {
        return schedules;
    }

    public boolean isEnableCoordinator() {
        return enableCoordinator;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration getLeaseTtl() {
        return leaseTtl;
    }

    public Duration getColdStartObservationWindow() {
        return coldStartObservationWindow;
    }

    public int getMissedHeartbeatThreshold() {
        return missedHeartbeatThreshold;
    }

    public Duration getStartupJitter() {
        return startupJitter;
    }

    public Duration getElectionJitter() {
        return electionJitter;
    }

    public int getMaxElectionRounds() {
        return maxElectionRounds;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getIndexResourceName() {
        return indexResourceName;
    }

    public String getLeaseResourceName() {
        return leaseResourceName;
    }

    public String getLeaseName() {
        return leaseName;
    }

    public String getCursorResourceName() {
        return cursorResourceName;
    }

    public Duration getPerRecordTimeout() {
        return perRecordTimeout;
    }

    /**
     * @return the delay before a declined callback record is retried, or null for "next cohort"
     */
    public Duration getCallbackRetryDelay() {
        return callbackRetryDelay;
    }

    public Set<String> getResourceAllowlist() {
        return resourceAllowlist;
    }

    public Set<String> getResourceBlocklist() {
        return resourceBlocklist;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private final Map<Granularity, String> schedules = new EnumMap<>(Granularity.class);
        private boolean enableCoordinator = true;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration leaseTtl = DEFAULT_LEASE_TTL;
        private Duration coldStartObservationWindow = DEFAULT_COLD_START_OBSERVATION_WINDOW;
        private boolean skipColdStart = false;
        private int missedHeartbeatThreshold = DEFAULT_MISSED_HEARTBEAT_THRESHOLD;
        private Duration startupJitter = Duration.ZERO;
        private Duration electionJitter = DEFAULT_ELECTION_JITTER;
        private int maxElectionRounds = DEFAULT_MAX_ELECTION_ROUNDS;
        private String workerId;
        private String indexResourceName = ExpirationIndex.DEFAULT_RESOURCE_NAME;
        private String leaseResourceName = DocumentLeaseStore.DEFAULT_RESOURCE_NAME;
        private String leaseName = DocumentLeaseStore.DEFAULT_LEASE_NAME;
        private String cursorResourceName = ScanCursorStore.DEFAULT_RESOURCE_NAME;
        private Duration perRecordTimeout = DEFAULT_PER_RECORD_TIMEOUT;
        private Duration callbackRetryDelay;
        private final Set<String> resourceAllowlist = new LinkedHashSet<>();
        private final Set<String> resourceBlocklist = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the scan schedule of one granularity: an ISO-8601 interval ({@code PT30S}) or a cron expression.
         */
        public Builder schedule(Granularity granularity, String expression) {
            this.schedules.put(granularity, expression);
            return this;
        }

        /**
         * With the coordinator disabled this instance always scans. Only safe for single-instance deployments.
         */
        public Builder enableCoordinator(boolean enableCoordinator) {
            this.enableCoordinator = enableCoordinator;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder leaseTtl(Duration leaseTtl) {
            this.leaseTtl = leaseTtl;
            return this;
        }

        public Builder coldStartObservationWindow(Duration coldStartObservationWindow) {
            this.coldStartObservationWindow = coldStartObservationWindow;
            return this;
        }

        public Builder skipColdStart(boolean skipColdStart) {
            this.skipColdStart = skipColdStart;
            return this;
        }

        public Builder missedHeartbeatThreshold(int missedHeartbeatThreshold) {
            this.missedHeartbeatThreshold = missedHeartbeatThreshold;
            return this;
        }

        /**
         * Upper bound of a random delay before the observation window starts.
         */
        public Builder startupJitter(Duration startupJitter) {
            this.startupJitter = startupJitter;
            return this;
        }

        /**
         * Upper bound of the random wait between writing a claim and reading it back.
         */
        public Builder electionJitter(Duration electionJitter) {
            this.electionJitter = electionJitter;
            return this;
        }

        public Builder maxElectionRounds(int maxElectionRounds) {
            this.maxElectionRounds = maxElectionRounds;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder indexResourceName(String indexResourceName) {
            this.indexResourceName = indexResourceName;
            return this;
        }

        public Builder leaseResourceName(String leaseResourceName) {
            this.leaseResourceName = leaseResourceName;
            return this;
        }

        public Builder leaseName(String leaseName) {
            this.leaseName = leaseName;
            return this;
        }

        /**
         * Resource holding how far each resource has been scanned, shared by all instances.
         */
        public Builder cursorResourceName(String cursorResourceName) {
            this.cursorResourceName = cursorResourceName;
            return this;
        }

        public Builder perRecordTimeout(Duration perRecordTimeout) {
            this.perRecordTimeout = perRecordTimeout;
            return this;
        }

        public Builder callbackRetryDelay(Duration callbackRetryDelay) {
            this.callbackRetryDelay = callbackRetryDelay;
            return this;
        }

        public Builder resourceAllowlist(Collection<String> resources) {
            this.resourceAllowlist.addAll(resources);
            return this;
        }

        public Builder resourceBlocklist(Collection<String> resources) {
            this.resourceBlocklist.addAll(resources);
            return this;
        }

        /**
         * @throws ConfigurationException if a value is out of range or a schedule does not parse
         */
        public CleanupOptions build() {
            if (batchSize <= 0) {
                throw new ConfigurationException("batchSize must be positive, got " + batchSize);
            }
            requirePositive("heartbeatInterval", heartbeatInterval);
            requirePositive("leaseTtl", leaseTtl);
            requirePositive("perRecordTimeout", perRecordTimeout);
            requireNotNegative("coldStartObservationWindow", coldStartObservationWindow);
            requireNotNegative("startupJitter", startupJitter);
            requireNotNegative("electionJitter", electionJitter);
            if (callbackRetryDelay != null) {
                requirePositive("callbackRetryDelay", callbackRetryDelay);
            }
            if (leaseTtl.compareTo(heartbeatInterval) <= 0) {
                throw new ConfigurationException(
                    "leaseTtl (" + leaseTtl + ") must be longer than heartbeatInterval (" + heartbeatInterval + ")");
            }
            if (missedHeartbeatThreshold < 1) {
                throw new ConfigurationException("missedHeartbeatThreshold must be at least 1");
            }
            if (maxElectionRounds < 1) {
                throw new ConfigurationException("maxElectionRounds must be at least 1");
            }
            if (workerId != null && workerId.trim().isEmpty()) {
                throw new ConfigurationException("workerId cannot be empty");
            }
            requireName("indexResourceName", indexResourceName);
            requireName("leaseResourceName", leaseResourceName);
            requireName("leaseName", leaseName);
            requireName("cursorResourceName", cursorResourceName);
            if (indexResourceName.equals(leaseResourceName) || indexResourceName.equals(cursorResourceName)
                || leaseResourceName.equals(cursorResourceName)) {
                throw new ConfigurationException("Index, lease and cursor resources must differ");
            }

            Map<Granularity, FireSchedule> parsed = new EnumMap<>(Granularity.class);
            for (Granularity granularity : Granularity.values()) {
                String expression = schedules.getOrDefault(granularity, granularity.getDefaultSchedule());
                parsed.put(granularity, FireSchedule.parse(expression));
            }
            return new CleanupOptions(this, parsed);
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new ConfigurationException(name + " must be positive, got " + value);
            }
        }

        private static void requireNotNegative(String name, Duration value) {
            if (value == null || value.isNegative()) {
                throw new ConfigurationException(name + " cannot be negative, got " + value);
            }
        }

        private static void requireName(String name, String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new ConfigurationException(name + " cannot be null or empty");
            }
        }
    }
}
