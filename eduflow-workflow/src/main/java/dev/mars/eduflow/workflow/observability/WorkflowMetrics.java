/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.eduflow.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the EduFlow workflow engine.
 *
 * Provides 7 engine metrics:
 * - eduflow.workflow.applied (counter) - Templates applied to content
 * - eduflow.workflow.transitions (counter) - Transitions executed
 * - eduflow.workflow.transitions.failed (counter) - Rejected transitions, by error kind
 * - eduflow.workflow.removed (counter) - Templates removed from content
 * - eduflow.audit.sink.failures (counter) - Audit entries the sink failed to accept
 * - eduflow.workflow.transition.duration.seconds (histogram) - Transition latency
 * - eduflow.workflow.instances.active (gauge) - Content items currently tracked
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "eduflow-workflow";

    // Singleton instance
    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter templatesApplied;
    private final LongCounter transitionsTotal;
    private final LongCounter transitionsFailed;
    private final LongCounter templatesRemoved;
    private final LongCounter auditSinkFailures;

    // Histograms
    private final DoubleHistogram transitionDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeInstances = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> TEMPLATE_ID_KEY = AttributeKey.stringKey("template.id");
    private static final AttributeKey<String> TRANSITION_ID_KEY = AttributeKey.stringKey("transition.id");
    private static final AttributeKey<String> ERROR_KIND_KEY = AttributeKey.stringKey("error.kind");

    private WorkflowMetrics(Meter meter) {
        templatesApplied = meter.counterBuilder("eduflow.workflow.applied")
                .setDescription("Number of templates applied to content")
                .setUnit("1")
                .build();

        transitionsTotal = meter.counterBuilder("eduflow.workflow.transitions")
                .setDescription("Number of transitions executed")
                .setUnit("1")
                .build();

        transitionsFailed = meter.counterBuilder("eduflow.workflow.transitions.failed")
                .setDescription("Number of rejected transitions")
                .setUnit("1")
                .build();

        templatesRemoved = meter.counterBuilder("eduflow.workflow.removed")
                .setDescription("Number of templates removed from content")
                .setUnit("1")
                .build();

        auditSinkFailures = meter.counterBuilder("eduflow.audit.sink.failures")
                .setDescription("Number of audit entries the sink failed to accept")
                .setUnit("1")
                .build();

        transitionDuration = meter.histogramBuilder("eduflow.workflow.transition.duration.seconds")
                .setDescription("Transition execution time in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("eduflow.workflow.instances.active")
                .setDescription("Number of content items with an applied template")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeInstances.get()));

        logger.info("WorkflowMetrics initialized");
    }

    /**
     * Get the singleton instance of WorkflowMetrics.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    /**
     * Metrics bound to a no-op meter, for engines with metrics disabled.
     */
    public static WorkflowMetrics noop() {
        return new WorkflowMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public void recordTemplateApplied(String templateId) {
        templatesApplied.add(1, Attributes.of(TEMPLATE_ID_KEY, templateId));
    }

    public void recordTransition(String templateId, String transitionId, double durationSeconds) {
        Attributes attrs = Attributes.builder()
                .put(TEMPLATE_ID_KEY, templateId)
                .put(TRANSITION_ID_KEY, transitionId)
                .build();
        transitionsTotal.add(1, attrs);
        transitionDuration.record(durationSeconds, attrs);
    }

    public void recordTransitionFailed(String transitionId, String errorKind) {
        Attributes attrs = Attributes.builder()
                .put(TRANSITION_ID_KEY, transitionId != null ? transitionId : "unknown")
                .put(ERROR_KIND_KEY, errorKind != null ? errorKind : "unknown")
                .build();
        transitionsFailed.add(1, attrs);
    }

    public void recordTemplateRemoved(String templateId) {
        templatesRemoved.add(1, Attributes.of(TEMPLATE_ID_KEY, templateId));
    }

    public void recordAuditSinkFailure() {
        auditSinkFailures.add(1);
    }

    public void setActiveInstances(long count) {
        activeInstances.set(count);
    }

    public long getActiveInstances() {
        return activeInstances.get();
    }
}
