package com.threatsentinel.flink;

import com.threatsentinel.core.ingress.InvalidSecurityEventException;
import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.model.Incident;
import com.threatsentinel.core.model.RawSecurityEvent;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that feeds every security event through
 * the detection engine.
 *
 * <p>
 * The stream is keyed by the actor field (normally {@code userId}) so that all
 * of one actor's events reach the same task, which keeps per-user windows,
 * sequences, baselines and correlations complete within a single engine.
 * </p>
 *
 * <h3>Outputs</h3>
 * <ul>
 * <li>main output: {@link Alert}s</li>
 * <li>{@link #INCIDENTS}: {@link Incident}s</li>
 * <li>{@link #CONTAINMENT}: {@link ContainmentCommand}s</li>
 * </ul>
 *
 * <h3>State</h3>
 * <p>
 * The engine's windows and baselines live on the task heap and are rebuilt
 * from the stream after a restart; they are not part of Flink checkpoints.
 * </p>
 *
 * @since 1.0.0
 */
public class SiemProcessFunction extends KeyedProcessFunction<String, RawSecurityEvent, Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SiemProcessFunction.class);

    public static final OutputTag<Incident> INCIDENTS = new OutputTag<Incident>("incidents") {
    };
    public static final OutputTag<ContainmentCommand> CONTAINMENT = new OutputTag<ContainmentCommand>(
            "containment") {
    };

    private final JobConfig config;

    private transient EngineSession session;
    private transient SentinelMetrics metrics;

    public SiemProcessFunction(JobConfig config) {
        this.config = Objects.requireNonNull(config, "JobConfig must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        session = EngineSession.open(config);
        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("SiemProcessFunction opened on subtask {}", getRuntimeContext().getIndexOfThisSubtask());
    }

    @Override
    public void close() {
        if (session != null) {
            session.close();
        }
        LOG.info("SiemProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(RawSecurityEvent event,
            KeyedProcessFunction<String, RawSecurityEvent, Alert>.Context ctx,
            Collector<Alert> out) {
        long startNanos = System.nanoTime();

        EngineSession.Output output;
        try {
            output = session.process(event);
        } catch (InvalidSecurityEventException e) {
            LOG.warn("Rejected security event for key {}: {}", ctx.getCurrentKey(), e.getMessage());
            metrics.incrementEventsRejected();
            return;
        }

        output.getAlerts().forEach(out::collect);
        output.getIncidents().forEach(incident -> ctx.output(INCIDENTS, incident));
        output.getContainmentCommands().forEach(command -> ctx.output(CONTAINMENT, command));

        metrics.record(output);
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }
}
