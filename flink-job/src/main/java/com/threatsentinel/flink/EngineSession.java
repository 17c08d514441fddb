package com.threatsentinel.flink;

import com.threatsentinel.core.SiemEngine;
import com.threatsentinel.core.bus.Topics;
import com.threatsentinel.core.config.RulesConfig;
import com.threatsentinel.core.config.RulesLoader;
import com.threatsentinel.core.config.SiemConfig;
import com.threatsentinel.core.config.SiemConfigLoader;
import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.model.Incident;
import com.threatsentinel.core.model.RawSecurityEvent;
import com.threatsentinel.core.model.SecurityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One {@link SiemEngine} per parallel task, with the bus outputs of each
 * submitted event captured for emission downstream.
 *
 * <p>
 * Containment is not enforced in-process: every request is turned into a
 * {@link ContainmentCommand} for the identity service. Persistence and
 * notification use the engine's logging defaults and run on the task thread.
 * </p>
 *
 * <p>
 * Not thread-safe; owned by a single Flink task.
 * </p>
 */
public class EngineSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EngineSession.class);

    private final SiemEngine engine;
    private final Clock clock;
    private final List<Alert> alerts = new ArrayList<>();
    private final List<Incident> incidents = new ArrayList<>();
    private final List<ContainmentCommand> commands = new ArrayList<>();

    EngineSession(SiemConfig siemConfig, Supplier<RulesConfig> rules, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.engine = SiemEngine.builder()
                .config(siemConfig)
                .rulesSource(rules)
                .clock(clock)
                .executor(Runnable::run)
                .containmentEnforcer((action, userId) ->
                        commands.add(new ContainmentCommand(action, userId, this.clock.instant())))
                .build();
        engine.initialize();
        engine.subscribe(Topics.ALERT, alerts::add);
        engine.subscribe(Topics.INCIDENT, incidents::add);
    }

    /**
     * Build a session from the job's file locations, falling back to the
     * engine's own environment/classpath resolution when a path is blank.
     *
     * @throws IllegalStateException if the configuration or rule set is
     *                               invalid
     */
    public static EngineSession open(JobConfig config) {
        Objects.requireNonNull(config, "JobConfig must not be null");
        SiemConfig siemConfig = config.getSiemConfigPath().isBlank()
                ? SiemConfigLoader.load()
                : SiemConfigLoader.fromFile(config.getSiemConfigPath());
        String rulesPath = config.getRulesConfigPath();
        Supplier<RulesConfig> rules = rulesPath.isBlank()
                ? RulesLoader::load
                : () -> RulesLoader.fromFile(rulesPath);
        EngineSession session = new EngineSession(siemConfig, rules, Clock.systemUTC());
        session.engine.startMaintenance();
        LOG.info("Engine session opened with {} detection rule(s)", session.engine.getRules().size());
        return session;
    }

    /**
     * Run one event through the engine.
     *
     * @return everything the event raised
     * @throws com.threatsentinel.core.ingress.InvalidSecurityEventException if
     *         the event has no type
     */
    public Output process(RawSecurityEvent raw) {
        alerts.clear();
        incidents.clear();
        commands.clear();
        SecurityEvent event = engine.submit(raw);
        return new Output(event, List.copyOf(alerts), List.copyOf(incidents), List.copyOf(commands));
    }

    SiemEngine getEngine() {
        return engine;
    }

    @Override
    public void close() {
        engine.shutdown();
    }

    /**
     * What one event produced.
     */
    public static final class Output {
        private final SecurityEvent event;
        private final List<Alert> alerts;
        private final List<Incident> incidents;
        private final List<ContainmentCommand> containmentCommands;

        Output(SecurityEvent event, List<Alert> alerts, List<Incident> incidents,
                List<ContainmentCommand> containmentCommands) {
            this.event = event;
            this.alerts = alerts;
            this.incidents = incidents;
            this.containmentCommands = containmentCommands;
        }

        public SecurityEvent getEvent() {
            return event;
        }

        public List<Alert> getAlerts() {
            return alerts;
        }

        public List<Incident> getIncidents() {
            return incidents;
        }

        public List<ContainmentCommand> getContainmentCommands() {
            return containmentCommands;
        }
    }
}
