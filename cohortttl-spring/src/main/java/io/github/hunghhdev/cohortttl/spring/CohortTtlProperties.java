package io.github.hunghhdev.cohortttl.spring;

import io.github.hunghhdev.cohortttl.core.CleanupOptions;
import io.github.hunghhdev.cohortttl.core.DocumentLeaseStore;
import io.github.hunghhdev.cohortttl.core.ExpirationIndex;
import io.github.hunghhdev.cohortttl.core.Granularity;
import io.github.hunghhdev.cohortttl.core.ScanCursorStore;
import io.github.hunghhdev.cohortttl.core.TtlRule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the cohort TTL engine.
 * Supports YAML/Properties configuration via application.yml or application.properties.
 *
 * <pre>
 * cohortttl:
 *   resources:
 *     sessions:
 *       ttl: 30m
 *       on-expire: hard-delete
 *     orders:
 *       ttl: 1d
 *       on-expire: archive
 *       archive-resource: archive_orders
 *       keep-original-id: true
 * </pre>
 */
@ConfigurationProperties(prefix = "cohortttl")
public class CohortTtlProperties {

    /**
     * Whether the cleanup engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Index entries read per page during a scan.
     */
    private int batchSize = CleanupOptions.DEFAULT_BATCH_SIZE;

    /**
     * Resource holding the expiration index.
     */
    private String indexResourceName = ExpirationIndex.DEFAULT_RESOURCE_NAME;

    /**
     * Resource holding the coordinator lease.
     */
    private String leaseResourceName = DocumentLeaseStore.DEFAULT_RESOURCE_NAME;

    /**
     * Lease id; engines with different lease names elect independently.
     */
    private String leaseName = DocumentLeaseStore.DEFAULT_LEASE_NAME;

    /**
     * Resource holding how far each resource has been scanned.
     */
    private String cursorResourceName = ScanCursorStore.DEFAULT_RESOURCE_NAME;

    /**
     * Table of the PostgreSQL document store created from the application's DataSource.
     */
    private String tableName = "cohortttl_documents";

    /**
     * Whether to create the document table if it doesn't exist.
     */
    private boolean autoCreateTable = true;

    /**
     * Upper bound for disposing of one record.
     */
    private Duration perRecordTimeout = CleanupOptions.DEFAULT_PER_RECORD_TIMEOUT;

    /**
     * Delay before a record kept by its callback is offered again. If null, the next cohort.
     */
    private Duration callbackRetryDelay;

    /**
     * Only these resources are cleaned up, if set.
     */
    private List<String> resourceAllowlist = new ArrayList<>();

    /**
     * These resources are never cleaned up.
     */
    private List<String> resourceBlocklist = new ArrayList<>();

    /**
     * Scan schedules per granularity.
     */
    private Schedules schedules = new Schedules();

    /**
     * Coordinator election configuration.
     */
    private Coordinator coordinator = new Coordinator();

    /**
     * Per-resource TTL rules, keyed by resource name.
     */
    private Map<String, ResourceRule> resources = new LinkedHashMap<>();

    /**
     * Builds engine options from these properties.
     */
    public CleanupOptions toOptions() {
        CleanupOptions.Builder builder = CleanupOptions.builder()
            .batchSize(batchSize)
            .indexResourceName(indexResourceName)
            .leaseResourceName(leaseResourceName)
            .leaseName(leaseName)
            .cursorResourceName(cursorResourceName)
            .perRecordTimeout(perRecordTimeout)
            .callbackRetryDelay(callbackRetryDelay)
            .resourceAllowlist(resourceAllowlist)
            .resourceBlocklist(resourceBlocklist)
            .enableCoordinator(coordinator.isEnabled())
            .heartbeatInterval(coordinator.getHeartbeatInterval())
            .leaseTtl(coordinator.getLeaseTtl())
            .coldStartObservationWindow(coordinator.getColdStartObservationWindow())
            .skipColdStart(coordinator.isSkipColdStart())
            .missedHeartbeatThreshold(coordinator.getMissedHeartbeatThreshold())
            .startupJitter(coordinator.getStartupJitter())
            .workerId(coordinator.getWorkerId());
        schedules.applyTo(builder);
        return builder.build();
    }

    /**
     * Builds one rule per configured resource.
     */
    public List<TtlRule> toRules() {
        List<TtlRule> rules = new ArrayList<>();
        resources.forEach((name, rule) -> rules.add(rule.toRule(name)));
        return rules;
    }

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public String getIndexResourceName() {
        return indexResourceName;
    }

    public void setIndexResourceName(String indexResourceName) {
        this.indexResourceName = indexResourceName;
    }

    public String getLeaseResourceName() {
        return leaseResourceName;
    }

    public void setLeaseResourceName(String leaseResourceName) {
        this.leaseResourceName = leaseResourceName;
    }

    public String getLeaseName() {
        return leaseName;
    }

    public void setLeaseName(String leaseName) {
        this.leaseName = leaseName;
    }

    public String getCursorResourceName() {
        return cursorResourceName;
    }

    public void setCursorResourceName(String cursorResourceName) {
        this.cursorResourceName = cursorResourceName;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public boolean isAutoCreateTable() {
        return autoCreateTable;
    }

    public void setAutoCreateTable(boolean autoCreateTable) {
        this.autoCreateTable = autoCreateTable;
    }

    public Duration getPerRecordTimeout() {
        return perRecordTimeout;
    }

    public void setPerRecordTimeout(Duration perRecordTimeout) {
        this.perRecordTimeout = perRecordTimeout;
    }

    public Duration getCallbackRetryDelay() {
        return callbackRetryDelay;
    }

    public void setCallbackRetryDelay(Duration callbackRetryDelay) {
        this.callbackRetryDelay = callbackRetryDelay;
    }

    public List<String> getResourceAllowlist() {
        return resourceAllowlist;
    }

    public void setResourceAllowlist(List<String> resourceAllowlist) {
        this.resourceAllowlist = resourceAllowlist;
    }

    public List<String> getResourceBlocklist() {
        return resourceBlocklist;
    }

    public void setResourceBlocklist(List<String> resourceBlocklist) {
        this.resourceBlocklist = resourceBlocklist;
    }

    public Schedules getSchedules() {
        return schedules;
    }

    public void setSchedules(Schedules schedules) {
        this.schedules = schedules;
    }

    public Coordinator getCoordinator() {
        return coordinator;
    }

    public void setCoordinator(Coordinator coordinator) {
        this.coordinator = coordinator;
    }

    public Map<String, ResourceRule> getResources() {
        return resources;
    }

    public void setResources(Map<String, ResourceRule> resources) {
        this.resources = resources;
    }

    /**
     * Scan schedules: ISO-8601 intervals ({@code PT30S}) or cron expressions. Unset granularities keep their
     * defaults.
     */
    public static class Schedules {

        private String minute;
        private String hour;
        private String day;
        private String week;

        void applyTo(CleanupOptions.Builder builder) {
            if (minute != null) {
                builder.schedule(Granularity.MINUTE, minute);
            }
            if (hour != null) {
                builder.schedule(Granularity.HOUR, hour);
            }
            if (day != null) {
                builder.schedule(Granularity.DAY, day);
            }
            if (week != null) {
                builder.schedule(Granularity.WEEK, week);
            }
        }

        public String getMinute() {
            return minute;
        }

        public void setMinute(String minute) {
            this.minute = minute;
        }

        public String getHour() {
            return hour;
        }

        public void setHour(String hour) {
            this.hour = hour;
        }

        public String getDay() {
            return day;
        }

        public void setDay(String day) {
            this.day = day;
        }

        public String getWeek() {
            return week;
        }

        public void setWeek(String week) {
            this.week = week;
        }
    }

    /**
     * Coordinator election configuration.
     */
    public static class Coordinator {

        /**
         * Whether to elect a coordinator. Disable only for single-instance deployments.
         */
        private boolean enabled = true;

        private Duration heartbeatInterval = CleanupOptions.DEFAULT_HEARTBEAT_INTERVAL;

        private Duration leaseTtl = CleanupOptions.DEFAULT_LEASE_TTL;

        private Duration coldStartObservationWindow = CleanupOptions.DEFAULT_COLD_START_OBSERVATION_WINDOW;

        private boolean skipColdStart = false;

        private int missedHeartbeatThreshold = CleanupOptions.DEFAULT_MISSED_HEARTBEAT_THRESHOLD;

        private Duration startupJitter = Duration.ZERO;

        /**
         * Worker id of this instance. If null, a random one is generated.
         */
        private String workerId;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getLeaseTtl() {
            return leaseTtl;
        }

        public void setLeaseTtl(Duration leaseTtl) {
            this.leaseTtl = leaseTtl;
        }

        public Duration getColdStartObservationWindow() {
            return coldStartObservationWindow;
        }

        public void setColdStartObservationWindow(Duration coldStartObservationWindow) {
            this.coldStartObservationWindow = coldStartObservationWindow;
        }

        public boolean isSkipColdStart() {
            return skipColdStart;
        }

        public void setSkipColdStart(boolean skipColdStart) {
            this.skipColdStart = skipColdStart;
        }

        public int getMissedHeartbeatThreshold() {
            return missedHeartbeatThreshold;
        }

        public void setMissedHeartbeatThreshold(int missedHeartbeatThreshold) {
            this.missedHeartbeatThreshold = missedHeartbeatThreshold;
        }

        public Duration getStartupJitter() {
            return startupJitter;
        }

        public void setStartupJitter(Duration startupJitter) {
            this.startupJitter = startupJitter;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }
    }

    /**
     * TTL rule of one resource.
     */
    public static class ResourceRule {

        /**
         * Time to live after the timestamp field. If null, the field holds the absolute expiry.
         */
        private Duration ttl;

        /**
         * Timestamp attribute. Defaults to {@value TtlRule#DEFAULT_TIMESTAMP_FIELD} for relative rules.
         */
        private String field;

        /**
         * soft-delete, hard-delete, archive or callback.
         */
        private String onExpire;

        private String deleteField;

        private String deletedFlagField;

        private String archiveResource;

        private boolean keepOriginalId = false;

        /**
         * Name of the {@code ExpiryCallback} bean for the callback strategy.
         */
        private String callback;

        /**
         * minute, hour, day or week. If null, derived from the ttl.
         */
        private String granularity;

        TtlRule toRule(String resourceName) {
            TtlRule.Builder builder = TtlRule.builder(resourceName)
                .field(field)
                .ttl(ttl)
                .onExpire(onExpire)
                .deleteField(deleteField)
                .deletedFlagField(deletedFlagField)
                .archiveResource(archiveResource)
                .keepOriginalId(keepOriginalId)
                .callback(callback);
            if (granularity != null) {
                builder.granularity(Granularity.fromValue(granularity));
            }
            return builder.build();
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public String getField() {
            return field;
        }

        public void setField(String field) {
            this.field = field;
        }

        public String getOnExpire() {
            return onExpire;
        }

        public void setOnExpire(String onExpire) {
            this.onExpire = onExpire;
        }

        public String getDeleteField() {
            return deleteField;
        }

        public void setDeleteField(String deleteField) {
            this.deleteField = deleteField;
        }

        public String getDeletedFlagField() {
            return deletedFlagField;
        }

        public void setDeletedFlagField(String deletedFlagField) {
            this.deletedFlagField = deletedFlagField;
        }

        public String getArchiveResource() {
            return archiveResource;
        }

        public void setArchiveResource(String archiveResource) {
            this.archiveResource = archiveResource;
        }

        public boolean isKeepOriginalId() {
            return keepOriginalId;
        }

        public void setKeepOriginalId(boolean keepOriginalId) {
            this.keepOriginalId = keepOriginalId;
        }

        public String getCallback() {
            return callback;
        }

        public void setCallback(String callback) {
            this.callback = callback;
        }

        public String getGranularity() {
            return granularity;
        }

        public void setGranularity(String granularity) {
            this.granularity = granularity;
        }
    }
}
