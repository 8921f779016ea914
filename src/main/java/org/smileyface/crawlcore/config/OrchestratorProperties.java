package org.smileyface.crawlcore.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.crawlcore.frontier.BackoffPolicy;
import org.smileyface.crawlcore.frontier.FrontierPolicy;
import org.smileyface.crawlcore.model.ProxyType;
import org.smileyface.crawlcore.proxy.ProxyHealthPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the orchestration core.
 *
 * Defaults come from the classpath resource {@code CrawlOrchestratorConfig.json}; Spring then
 * binds {@code orchestrator.*} from application properties on top. Fleet-specific overrides live
 * under {@code orchestrator.fleets.<name>} and are merged by {@link #resolve(String)}.
 */
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    public static final String DEFAULTS_RESOURCE = "CrawlOrchestratorConfig.json";

    Logger log = LogManager.getLogger(OrchestratorProperties.class);

    private Store store = new Store();
    private Queue queue = new Queue();
    private Frontier frontier = new Frontier();
    private Proxy proxy = new Proxy();
    private Resources resources = new Resources();
    private Runs runs = new Runs();
    private Workers workers = new Workers();
    private Map<String, FleetOverrides> fleets = new LinkedHashMap<>();

    public OrchestratorProperties() {
        this(DEFAULTS_RESOURCE);
    }

    /**
     * Loads defaults from the given classpath resource. A missing resource keeps the built-in
     * values; a malformed one is logged and ignored so startup still reaches {@link #validate()}.
     */
    public OrchestratorProperties(String defaultsResource) {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(defaultsResource)) {
            if (in != null) {
                ObjectMapper mapper = new ObjectMapper()
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
                applyDefaults(mapper.readValue(in, CrawlOrchestratorConfig.class));
            }
        } catch (Exception e) {
            log.error("Failed to load default orchestrator configuration from classpath resource {}", defaultsResource, e);
        }
    }

    private void applyDefaults(CrawlOrchestratorConfig cfg) {
        if (cfg.store != null) {
            if (notBlank(cfg.store.type)) store.type = cfg.store.type;
            if (cfg.store.initializeSchema != null) store.initializeSchema = cfg.store.initializeSchema;
        }
        if (cfg.queue != null) {
            if (cfg.queue.heartbeatExpiryMs != null) queue.heartbeatExpiry = Duration.ofMillis(cfg.queue.heartbeatExpiryMs);
            if (cfg.queue.heartbeatIntervalMs != null) queue.heartbeatInterval = Duration.ofMillis(cfg.queue.heartbeatIntervalMs);
            if (cfg.queue.maxAttempts != null) queue.maxAttempts = cfg.queue.maxAttempts;
            if (cfg.queue.claimBatchSize != null) queue.claimBatchSize = cfg.queue.claimBatchSize;
        }
        if (cfg.frontier != null) {
            if (notBlank(cfg.frontier.type)) frontier.type = cfg.frontier.type;
            if (notBlank(cfg.frontier.namespace)) frontier.namespace = cfg.frontier.namespace;
            if (cfg.frontier.politenessDelayMs != null) frontier.politenessDelay = Duration.ofMillis(cfg.frontier.politenessDelayMs);
            if (cfg.frontier.backoffBaseMs != null) frontier.backoffBase = Duration.ofMillis(cfg.frontier.backoffBaseMs);
            if (cfg.frontier.backoffCapMs != null) frontier.backoffCap = Duration.ofMillis(cfg.frontier.backoffCapMs);
            if (cfg.frontier.retryLimit != null) frontier.retryLimit = cfg.frontier.retryLimit;
            if (cfg.frontier.maxDepth != null) frontier.maxDepth = cfg.frontier.maxDepth;
            if (cfg.frontier.scanLimit != null) frontier.scanLimit = cfg.frontier.scanLimit;
        }
        if (cfg.proxy != null) {
            if (cfg.proxy.failureThreshold != null) proxy.failureThreshold = cfg.proxy.failureThreshold;
            if (cfg.proxy.cooldownMs != null) proxy.cooldown = Duration.ofMillis(cfg.proxy.cooldownMs);
            if (cfg.proxy.emaAlpha != null) proxy.emaAlpha = cfg.proxy.emaAlpha;
            if (cfg.proxy.initialHealth != null) proxy.initialHealth = cfg.proxy.initialHealth;
            if (cfg.proxy.minHealthyScore != null) proxy.minHealthyScore = cfg.proxy.minHealthyScore;
            if (cfg.proxy.endpoints != null) proxy.endpoints = new ArrayList<>(cfg.proxy.endpoints);
        }
        if (cfg.resources != null && cfg.resources.orphanMaxAgeMs != null) {
            resources.orphanMaxAge = Duration.ofMillis(cfg.resources.orphanMaxAgeMs);
        }
        if (cfg.runs != null) {
            if (cfg.runs.staleRunMaxIdleMs != null) runs.staleRunMaxIdle = Duration.ofMillis(cfg.runs.staleRunMaxIdleMs);
            if (cfg.runs.maintenanceEnabled != null) runs.maintenanceEnabled = cfg.runs.maintenanceEnabled;
        }
        if (cfg.workers != null) {
            if (cfg.workers.count != null) workers.count = cfg.workers.count;
            if (cfg.workers.idleBackoffMs != null) workers.idleBackoff = Duration.ofMillis(cfg.workers.idleBackoffMs);
            if (cfg.workers.localRetries != null) workers.localRetries = cfg.workers.localRetries;
            if (cfg.workers.awaitTimeoutMs != null) workers.awaitTimeout = Duration.ofMillis(cfg.workers.awaitTimeoutMs);
        }
    }

    /**
     * Merges the global defaults with the overrides configured for {@code fleetName}.
     * Unknown fleets get the global defaults.
     */
    public FleetSettings resolve(String fleetName) {
        FleetOverrides o = fleetName == null ? null : fleets.get(fleetName);
        if (o == null) o = new FleetOverrides();

        Duration backoffBase = pick(o.backoffBase, frontier.backoffBase);
        Duration backoffCap = pick(o.backoffCap, frontier.backoffCap);
        FrontierPolicy frontierPolicy = new FrontierPolicy(
                pick(o.politenessDelay, frontier.politenessDelay),
                new BackoffPolicy(backoffBase, backoffCap),
                pick(o.retryLimit, frontier.retryLimit),
                pick(o.maxDepth, frontier.maxDepth));

        FleetSettings settings = new FleetSettings(
                fleetName,
                pick(o.heartbeatExpiry, queue.heartbeatExpiry),
                pick(o.heartbeatInterval, queue.heartbeatInterval),
                pick(o.maxAttempts, queue.maxAttempts),
                pick(o.claimBatchSize, queue.claimBatchSize),
                frontierPolicy,
                pick(o.staleRunMaxIdle, runs.staleRunMaxIdle),
                pick(o.workerCount, workers.count),
                pick(o.idleBackoff, workers.idleBackoff),
                pick(o.localRetries, workers.localRetries),
                pick(o.awaitTimeout, workers.awaitTimeout));
        checkFleet(settings);
        return settings;
    }

    public ProxyHealthPolicy proxyHealthPolicy() {
        return new ProxyHealthPolicy(proxy.failureThreshold, proxy.cooldown, proxy.emaAlpha,
                proxy.initialHealth, proxy.minHealthyScore);
    }

    /**
     * Fails startup on inconsistent values instead of letting a worker discover them mid-run.
     */
    @PostConstruct
    public void validate() {
        try {
            requireOneOf("orchestrator.store.type", store.type, "in-memory", "jdbc");
            requireOneOf("orchestrator.frontier.type", frontier.type, "in-memory", "redis");
            if ("jdbc".equals(normalizedStoreType()) && !notBlank(store.jdbcUrl)) {
                throw new IllegalStateException("orchestrator.store.jdbc-url is required when orchestrator.store.type=jdbc");
            }
            if (frontier.scanLimit < 1) {
                throw new IllegalStateException("orchestrator.frontier.scan-limit must be >= 1");
            }
            requirePositive("orchestrator.resources.orphan-max-age", resources.orphanMaxAge);
            proxyHealthPolicy();
            for (ProxyEndpointConfig e : proxy.endpoints) {
                if (e == null || !notBlank(e.getId()) || !notBlank(e.getAddress())) {
                    throw new IllegalStateException("orchestrator.proxy.endpoints entries need an id and an address");
                }
            }
            resolve(null);
            for (String fleet : fleets.keySet()) {
                resolve(fleet);
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid orchestrator configuration: " + e.getMessage(), e);
        }
        log.info("Orchestrator configuration validated: store={}, frontier={}, fleets={}",
                normalizedStoreType(), normalizedFrontierType(), fleets.keySet());
    }

    private void checkFleet(FleetSettings s) {
        String scope = s.fleetName() == null ? "orchestrator" : "orchestrator.fleets." + s.fleetName();
        requirePositive(scope + ".heartbeat-expiry", s.heartbeatExpiry());
        requirePositive(scope + ".heartbeat-interval", s.heartbeatInterval());
        if (s.heartbeatInterval().compareTo(s.heartbeatExpiry()) >= 0) {
            throw new IllegalStateException(scope + ": heartbeat-interval " + s.heartbeatInterval()
                    + " must be shorter than heartbeat-expiry " + s.heartbeatExpiry());
        }
        if (s.maxAttempts() < 1) throw new IllegalStateException(scope + ".max-attempts must be >= 1");
        if (s.claimBatchSize() < 1) throw new IllegalStateException(scope + ".claim-batch-size must be >= 1");
        if (s.workerCount() < 1) throw new IllegalStateException(scope + ".worker-count must be >= 1");
        if (s.localRetries() < 0) throw new IllegalStateException(scope + ".local-retries must be >= 0");
        requirePositive(scope + ".stale-run-max-idle", s.staleRunMaxIdle());
        requirePositive(scope + ".idle-backoff", s.idleBackoff());
        requirePositive(scope + ".await-timeout", s.awaitTimeout());
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new IllegalStateException(name + " must be a positive duration, was " + d);
        }
    }

    private static void requireOneOf(String name, String value, String... allowed) {
        String v = value == null ? "" : value.trim().toLowerCase();
        for (String a : allowed) {
            if (a.equals(v)) return;
        }
        throw new IllegalStateException(name + " must be one of " + List.of(allowed) + ", was '" + value + "'");
    }

    private static <T> T pick(T override, T fallback) {
        return override != null ? override : fallback;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    public String normalizedStoreType() {
        return store.type == null ? "in-memory" : store.type.trim().toLowerCase();
    }

    public String normalizedFrontierType() {
        return frontier.type == null ? "in-memory" : frontier.type.trim().toLowerCase();
    }

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public Queue getQueue() { return queue; }
    public void setQueue(Queue queue) { this.queue = queue; }

    public Frontier getFrontier() { return frontier; }
    public void setFrontier(Frontier frontier) { this.frontier = frontier; }

    public Proxy getProxy() { return proxy; }
    public void setProxy(Proxy proxy) { this.proxy = proxy; }

    public Resources getResources() { return resources; }
    public void setResources(Resources resources) { this.resources = resources; }

    public Runs getRuns() { return runs; }
    public void setRuns(Runs runs) { this.runs = runs; }

    public Workers getWorkers() { return workers; }
    public void setWorkers(Workers workers) { this.workers = workers; }

    public Map<String, FleetOverrides> getFleets() { return fleets; }
    public void setFleets(Map<String, FleetOverrides> fleets) {
        this.fleets = fleets != null ? fleets : new LinkedHashMap<>();
    }

    // --------- Bound property groups ---------

    public static class Store {
        /** in-memory | jdbc */
        private String type = "in-memory";
        private String jdbcUrl;
        private String username;
        private String password;
        /** Apply schema/orchestrator-postgres.sql at startup (statements are idempotent). */
        private boolean initializeSchema = true;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getJdbcUrl() { return jdbcUrl; }
        public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public boolean isInitializeSchema() { return initializeSchema; }
        public void setInitializeSchema(boolean initializeSchema) { this.initializeSchema = initializeSchema; }
    }

    public static class Queue {
        private Duration heartbeatExpiry = Duration.ofMinutes(2);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private int claimBatchSize = 10;

        public Duration getHeartbeatExpiry() { return heartbeatExpiry; }
        public void setHeartbeatExpiry(Duration heartbeatExpiry) { this.heartbeatExpiry = heartbeatExpiry; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public int getClaimBatchSize() { return claimBatchSize; }
        public void setClaimBatchSize(int claimBatchSize) { this.claimBatchSize = claimBatchSize; }
    }

    public static class Frontier {
        /** in-memory | redis */
        private String type = "in-memory";
        /** Key prefix for the Redis frontier. */
        private String namespace = "frontier";
        private Duration politenessDelay = Duration.ofSeconds(1);
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration backoffCap = Duration.ofMinutes(5);
        private int retryLimit = 3;
        private int maxDepth = 3;
        /** Queue entries inspected per nextBatch call before giving up on throttled domains. */
        private int scanLimit = 200;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) {
            this.namespace = (namespace == null || namespace.isBlank()) ? "frontier" : namespace;
        }
        public Duration getPolitenessDelay() { return politenessDelay; }
        public void setPolitenessDelay(Duration politenessDelay) { this.politenessDelay = politenessDelay; }
        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
        public Duration getBackoffCap() { return backoffCap; }
        public void setBackoffCap(Duration backoffCap) { this.backoffCap = backoffCap; }
        public int getRetryLimit() { return retryLimit; }
        public void setRetryLimit(int retryLimit) { this.retryLimit = retryLimit; }
        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
        public int getScanLimit() { return scanLimit; }
        public void setScanLimit(int scanLimit) { this.scanLimit = scanLimit; }
    }

    public static class Proxy {
        private int failureThreshold = 3;
        private Duration cooldown = Duration.ofMinutes(5);
        private double emaAlpha = 0.3;
        private double initialHealth = 1.0;
        private double minHealthyScore = 0.5;
        /** Endpoints registered into the pool at startup. */
        private List<ProxyEndpointConfig> endpoints = new ArrayList<>();

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
        public double getEmaAlpha() { return emaAlpha; }
        public void setEmaAlpha(double emaAlpha) { this.emaAlpha = emaAlpha; }
        public double getInitialHealth() { return initialHealth; }
        public void setInitialHealth(double initialHealth) { this.initialHealth = initialHealth; }
        public double getMinHealthyScore() { return minHealthyScore; }
        public void setMinHealthyScore(double minHealthyScore) { this.minHealthyScore = minHealthyScore; }
        public List<ProxyEndpointConfig> getEndpoints() { return endpoints; }
        public void setEndpoints(List<ProxyEndpointConfig> endpoints) {
            this.endpoints = endpoints != null ? endpoints : new ArrayList<>();
        }
    }

    public static class Resources {
        private Duration orphanMaxAge = Duration.ofMinutes(30);

        public Duration getOrphanMaxAge() { return orphanMaxAge; }
        public void setOrphanMaxAge(Duration orphanMaxAge) { this.orphanMaxAge = orphanMaxAge; }
    }

    public static class Runs {
        private Duration staleRunMaxIdle = Duration.ofMinutes(10);
        private Duration maintenanceInterval = Duration.ofMinutes(1);
        private boolean maintenanceEnabled = true;

        public Duration getStaleRunMaxIdle() { return staleRunMaxIdle; }
        public void setStaleRunMaxIdle(Duration staleRunMaxIdle) { this.staleRunMaxIdle = staleRunMaxIdle; }
        public Duration getMaintenanceInterval() { return maintenanceInterval; }
        public void setMaintenanceInterval(Duration maintenanceInterval) { this.maintenanceInterval = maintenanceInterval; }
        public boolean isMaintenanceEnabled() { return maintenanceEnabled; }
        public void setMaintenanceEnabled(boolean maintenanceEnabled) { this.maintenanceEnabled = maintenanceEnabled; }
    }

    public static class Workers {
        private int count = 4;
        private Duration idleBackoff = Duration.ofMillis(500);
        private int localRetries = 2;
        private Duration awaitTimeout = Duration.ofHours(1);

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
        public Duration getIdleBackoff() { return idleBackoff; }
        public void setIdleBackoff(Duration idleBackoff) { this.idleBackoff = idleBackoff; }
        public int getLocalRetries() { return localRetries; }
        public void setLocalRetries(int localRetries) { this.localRetries = localRetries; }
        public Duration getAwaitTimeout() { return awaitTimeout; }
        public void setAwaitTimeout(Duration awaitTimeout) { this.awaitTimeout = awaitTimeout; }
    }

    /**
     * Per-fleet overrides; a null field falls back to the global value.
     */
    public static class FleetOverrides {
        private Duration heartbeatExpiry;
        private Duration heartbeatInterval;
        private Integer maxAttempts;
        private Integer claimBatchSize;
        private Duration politenessDelay;
        private Duration backoffBase;
        private Duration backoffCap;
        private Integer retryLimit;
        private Integer maxDepth;
        private Duration staleRunMaxIdle;
        private Integer workerCount;
        private Duration idleBackoff;
        private Integer localRetries;
        private Duration awaitTimeout;

        public Duration getHeartbeatExpiry() { return heartbeatExpiry; }
        public void setHeartbeatExpiry(Duration heartbeatExpiry) { this.heartbeatExpiry = heartbeatExpiry; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
        public Integer getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(Integer maxAttempts) { this.maxAttempts = maxAttempts; }
        public Integer getClaimBatchSize() { return claimBatchSize; }
        public void setClaimBatchSize(Integer claimBatchSize) { this.claimBatchSize = claimBatchSize; }
        public Duration getPolitenessDelay() { return politenessDelay; }
        public void setPolitenessDelay(Duration politenessDelay) { this.politenessDelay = politenessDelay; }
        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
        public Duration getBackoffCap() { return backoffCap; }
        public void setBackoffCap(Duration backoffCap) { this.backoffCap = backoffCap; }
        public Integer getRetryLimit() { return retryLimit; }
        public void setRetryLimit(Integer retryLimit) { this.retryLimit = retryLimit; }
        public Integer getMaxDepth() { return maxDepth; }
        public void setMaxDepth(Integer maxDepth) { this.maxDepth = maxDepth; }
        public Duration getStaleRunMaxIdle() { return staleRunMaxIdle; }
        public void setStaleRunMaxIdle(Duration staleRunMaxIdle) { this.staleRunMaxIdle = staleRunMaxIdle; }
        public Integer getWorkerCount() { return workerCount; }
        public void setWorkerCount(Integer workerCount) { this.workerCount = workerCount; }
        public Duration getIdleBackoff() { return idleBackoff; }
        public void setIdleBackoff(Duration idleBackoff) { this.idleBackoff = idleBackoff; }
        public Integer getLocalRetries() { return localRetries; }
        public void setLocalRetries(Integer localRetries) { this.localRetries = localRetries; }
        public Duration getAwaitTimeout() { return awaitTimeout; }
        public void setAwaitTimeout(Duration awaitTimeout) { this.awaitTimeout = awaitTimeout; }
    }

    public static class ProxyEndpointConfig {

        public ProxyEndpointConfig() {} // for JSON mapping
        public ProxyEndpointConfig(String id, String address, String countryCode, ProxyType type) {
            this.id = id;
            this.address = address;
            this.countryCode = countryCode;
            this.type = type;
        }

        private String id;
        private String address;
        private String username;
        private String password;
        private String countryCode;
        private ProxyType type = ProxyType.DATACENTER;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public String getCountryCode() { return countryCode; }
        public void setCountryCode(String countryCode) { this.countryCode = countryCode; }
        public ProxyType getType() { return type; }
        public void setType(ProxyType type) { this.type = type; }
    }

    // --------- JSON defaults DTO ---------
    public static class CrawlOrchestratorConfig {
        public StoreConfig store;
        public QueueConfig queue;
        public FrontierConfig frontier;
        public ProxyConfig proxy;
        public ResourcesConfig resources;
        public RunsConfig runs;
        public WorkersConfig workers;
    }

    public static class StoreConfig {
        public String type;
        public Boolean initializeSchema;
    }

    public static class QueueConfig {
        public Long heartbeatExpiryMs;
        public Long heartbeatIntervalMs;
        public Integer maxAttempts;
        public Integer claimBatchSize;
    }

    public static class FrontierConfig {
        public String type;
        public String namespace;
        public Long politenessDelayMs;
        public Long backoffBaseMs;
        public Long backoffCapMs;
        public Integer retryLimit;
        public Integer maxDepth;
        public Integer scanLimit;
    }

    public static class ProxyConfig {
        public Integer failureThreshold;
        public Long cooldownMs;
        public Double emaAlpha;
        public Double initialHealth;
        public Double minHealthyScore;
        public List<ProxyEndpointConfig> endpoints;
    }

    public static class ResourcesConfig {
        public Long orphanMaxAgeMs;
    }

    public static class RunsConfig {
        public Long staleRunMaxIdleMs;
        public Boolean maintenanceEnabled;
    }

    public static class WorkersConfig {
        public Integer count;
        public Long idleBackoffMs;
        public Integer localRetries;
        public Long awaitTimeoutMs;
    }
}
