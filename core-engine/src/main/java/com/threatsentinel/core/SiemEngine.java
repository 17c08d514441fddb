package com.threatsentinel.core;

import com.threatsentinel.core.baseline.BehavioralBaselineStore;
import com.threatsentinel.core.bus.SecurityEventBus;
import com.threatsentinel.core.bus.Subscription;
import com.threatsentinel.core.bus.Topic;
import com.threatsentinel.core.config.RulesConfig;
import com.threatsentinel.core.config.RulesLoader;
import com.threatsentinel.core.config.SiemConfig;
import com.threatsentinel.core.containment.ContainmentDispatcher;
import com.threatsentinel.core.containment.ContainmentEnforcer;
import com.threatsentinel.core.containment.LoggingContainmentEnforcer;
import com.threatsentinel.core.correlation.CorrelationEngine;
import com.threatsentinel.core.detection.DetectionContext;
import com.threatsentinel.core.detection.RuleEngine;
import com.threatsentinel.core.detection.RuleTestReport;
import com.threatsentinel.core.detection.RuleTester;
import com.threatsentinel.core.detection.ThreatIntelCatalog;
import com.threatsentinel.core.escalation.EscalationService;
import com.threatsentinel.core.escalation.NotificationDispatcher;
import com.threatsentinel.core.ingress.EventIngress;
import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.model.RawSecurityEvent;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.query.EventFilter;
import com.threatsentinel.core.query.EventQueryService;
import com.threatsentinel.core.query.EventSearch;
import com.threatsentinel.core.query.SecurityAnalytics;
import com.threatsentinel.core.rule.DetectionRule;
import com.threatsentinel.core.rule.IndicatorType;
import com.threatsentinel.core.spi.LoggingNotificationSender;
import com.threatsentinel.core.spi.LoggingRecordStore;
import com.threatsentinel.core.spi.NotificationSender;
import com.threatsentinel.core.spi.SecurityRecordStore;
import com.threatsentinel.core.window.EventBuffer;
import com.threatsentinel.core.window.WindowCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Facade wiring the whole detection pipeline.
 *
 * <pre>
 * SiemEngine engine = SiemEngine.builder()
 *         .config(SiemConfigLoader.load())
 *         .containmentEnforcer(identityService)
 *         .build();
 * engine.initialize();
 * engine.submit(RawSecurityEvent.of("auth:failure").with("userId", "U1"));
 * </pre>
 *
 * <p>
 * {@link #initialize()} loads the default rule set; until it succeeds the
 * engine refuses events and rule changes.
 * </p>
 *
 * @since 1.0.0
 */
public class SiemEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SiemEngine.class);

    private final SiemConfig config;
    private final Clock clock;
    private final Supplier<RulesConfig> rulesSource;
    private final ExecutorService ownedExecutor;

    private final EventBuffer buffer;
    private final WindowCounterStore counters;
    private final BehavioralBaselineStore baselines;
    private final SecurityEventBus bus;
    private final RuleEngine ruleEngine;
    private final CorrelationEngine correlationEngine;
    private final EscalationService escalation;
    private final EventIngress ingress;
    private final RuleTester ruleTester;
    private final EventQueryService queries;
    private final MaintenanceScheduler maintenance;

    private volatile boolean initialized;

    private SiemEngine(Builder builder) {
        this.config = builder.config;
        this.config.validate();
        this.clock = builder.clock;
        this.rulesSource = builder.rulesSource;

        Executor executor = builder.executor;
        if (executor == null) {
            this.ownedExecutor = Executors.newFixedThreadPool(2, r -> {
                Thread t = new Thread(r, "threat-sentinel-async");
                t.setDaemon(true);
                return t;
            });
            executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
        }

        ThreatIntelCatalog threatIntel = builder.threatIntel.withSource(IndicatorType.IP,
                ThreatIntelCatalog.BLACKLIST_SOURCE, config.getBlacklistedIps());

        this.buffer = new EventBuffer(config.getMaxEventsInMemory());
        this.counters = new WindowCounterStore(clock);
        this.baselines = new BehavioralBaselineStore();
        this.bus = new SecurityEventBus();
        this.ruleEngine = new RuleEngine(new DetectionContext(clock, counters, baselines, buffer, threatIntel));
        this.correlationEngine = new CorrelationEngine(counters, clock);
        this.escalation = new EscalationService(config, builder.recordStore,
                new NotificationDispatcher(config, builder.notificationSender, executor),
                new ContainmentDispatcher(builder.containmentEnforcer), bus, executor, clock);
        this.ingress = new EventIngress(buffer, counters, baselines, ruleEngine, correlationEngine, escalation,
                bus, builder.recordStore, executor, clock);
        this.ruleTester = new RuleTester(buffer, threatIntel, escalation::isReferencedByAlert, clock);
        this.queries = new EventQueryService(buffer);
        this.maintenance = new MaintenanceScheduler(config, counters, buffer, escalation, clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Load the default detection and correlation rules, binding threshold
     * categories from the configuration.
     *
     * @throws IllegalStateException if the rule set cannot be loaded; the
     *                               engine stays uninitialized
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        try {
            RulesConfig rules = Objects.requireNonNull(rulesSource.get(), "Rules source returned null");
            List<DetectionRule> detectionRules = rules.getRules().stream().map(DetectionRule::copy).toList();
            int bound = config.bindThresholds(detectionRules);
            ruleEngine.loadDefaults(detectionRules);
            correlationEngine.setRules(rules.getCorrelationRules());
            initialized = true;
            LOG.info("Threat Sentinel initialized: {} detection rule(s) ({} bound to thresholds), "
                    + "{} correlation rule(s)", detectionRules.size(), bound, rules.getCorrelationRules().size());
        } catch (RuntimeException e) {
            LOG.error("Threat Sentinel failed to initialize", e);
            throw new IllegalStateException("Failed to initialize detection engine", e);
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Start periodic maintenance.
     */
    public void startMaintenance() {
        maintenance.start();
    }

    /**
     * Stop maintenance and release the engine-owned executor.
     */
    public void shutdown() {
        maintenance.stop();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        initialized = false;
        LOG.info("Threat Sentinel shut down");
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if the engine is not initialized
     * @throws com.threatsentinel.core.ingress.InvalidSecurityEventException
     *                               if the event has no type
     */
    public SecurityEvent submit(RawSecurityEvent event) {
        requireInitialized();
        return ingress.submit(event);
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Detection engine is not initialized");
        }
    }

    // ---------------------------------------------------------------
    // Rule administration
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if the engine is not initialized
     */
    public void addRule(DetectionRule rule) {
        requireInitialized();
        ruleEngine.addRule(rule);
    }

    /**
     * @throws IllegalStateException if the engine is not initialized
     */
    public boolean updateRule(String ruleId, Consumer<DetectionRule> patch) {
        requireInitialized();
        return ruleEngine.updateRule(ruleId, patch);
    }

    /**
     * @throws IllegalStateException if the engine is not initialized
     */
    public boolean deleteRule(String ruleId) {
        requireInitialized();
        return ruleEngine.deleteRule(ruleId);
    }

    public List<DetectionRule> getRules() {
        return ruleEngine.getRules();
    }

    public void resetRulesToDefaults() {
        requireInitialized();
        ruleEngine.resetToDefaults();
    }

    public RuleTestReport testRule(DetectionRule rule) {
        return ruleTester.test(rule);
    }

    // ---------------------------------------------------------------
    // Event queries
    // ---------------------------------------------------------------

    /**
     * @return up to {@code limit} buffered events matching the filter,
     *         newest first
     */
    public List<SecurityEvent> getRecentEvents(EventFilter filter, int limit) {
        return queries.recentEvents(filter, limit);
    }

    public List<SecurityEvent> getRecentEvents() {
        return queries.recentEvents(EventFilter.all(), EventQueryService.DEFAULT_LIMIT);
    }

    public List<SecurityEvent> searchEvents(EventSearch search) {
        return queries.search(search);
    }

    public SecurityAnalytics getSecurityAnalytics(EventFilter filter) {
        return queries.analytics(filter);
    }

    // ---------------------------------------------------------------
    // Observation
    // ---------------------------------------------------------------

    public <T> Subscription subscribe(Topic<T> topic, Consumer<? super T> listener) {
        return bus.subscribe(topic, listener);
    }

    public List<Alert> recentAlerts() {
        return escalation.recentAlerts();
    }

    public SecurityEventBus getBus() {
        return bus;
    }

    public WindowCounterStore getCounters() {
        return counters;
    }

    public BehavioralBaselineStore getBaselines() {
        return baselines;
    }

    public EventBuffer getBuffer() {
        return buffer;
    }

    public CorrelationEngine getCorrelationEngine() {
        return correlationEngine;
    }

    public MaintenanceScheduler getMaintenance() {
        return maintenance;
    }

    public SiemConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link SiemEngine}. Every collaborator has a
     * default: built-in configuration, the classpath rule set and threat
     * intel, logging-only record store, notifier and enforcer, the system UTC
     * clock and an engine-owned async pool.
     */
    public static class Builder {
        private SiemConfig config = SiemConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private Supplier<RulesConfig> rulesSource = RulesLoader::load;
        private ThreatIntelCatalog threatIntel;
        private SecurityRecordStore recordStore = new LoggingRecordStore();
        private NotificationSender notificationSender = new LoggingNotificationSender();
        private ContainmentEnforcer containmentEnforcer = new LoggingContainmentEnforcer();
        private Executor executor;

        public Builder config(SiemConfig config) {
            this.config = Objects.requireNonNull(config, "SiemConfig must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock must not be null");
            return this;
        }

        public Builder rulesSource(Supplier<RulesConfig> rulesSource) {
            this.rulesSource = Objects.requireNonNull(rulesSource, "Rules source must not be null");
            return this;
        }

        public Builder threatIntel(ThreatIntelCatalog threatIntel) {
            this.threatIntel = Objects.requireNonNull(threatIntel, "ThreatIntelCatalog must not be null");
            return this;
        }

        public Builder recordStore(SecurityRecordStore recordStore) {
            this.recordStore = Objects.requireNonNull(recordStore, "SecurityRecordStore must not be null");
            return this;
        }

        public Builder notificationSender(NotificationSender notificationSender) {
            this.notificationSender = Objects.requireNonNull(notificationSender,
                    "NotificationSender must not be null");
            return this;
        }

        public Builder containmentEnforcer(ContainmentEnforcer containmentEnforcer) {
            this.containmentEnforcer = Objects.requireNonNull(containmentEnforcer,
                    "ContainmentEnforcer must not be null");
            return this;
        }

        /**
         * @param executor runs persistence and notifications; pass
         *                 {@code Runnable::run} for synchronous execution
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "Executor must not be null");
            return this;
        }

        /**
         * @throws IllegalStateException if the configuration is invalid
         */
        public SiemEngine build() {
            if (threatIntel == null) {
                threatIntel = ThreatIntelCatalog.loadDefault();
            }
            return new SiemEngine(this);
        }
    }
}
