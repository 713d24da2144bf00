package com.reporting.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.reporting.domain.condition.ConditionEvaluator;
import com.reporting.domain.evaluation.DataNodes;
import com.reporting.domain.evaluation.RuleEvaluator;
import com.reporting.domain.exception.AggregationCancelledException;
import com.reporting.domain.exception.RuleExecutionException;
import com.reporting.domain.model.AggregationRequest;
import com.reporting.domain.model.AggregationResult;
import com.reporting.domain.model.AggregationRule;
import com.reporting.domain.model.AggregationSchema;
import com.reporting.domain.model.AggregationStatus;
import com.reporting.domain.model.AggregationSummary;
import com.reporting.domain.model.RuleFailure;
import com.reporting.infrastructure.store.SchemaRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Rule-based aggregation pipeline.
 *
 * Pipeline Flow:
 * 1. Validate the request
 * 2. Resolve the rule set (schema, else inline rules, else empty)
 * 3. Apply rules in order; each applied rule's output feeds the next one
 * 4. Derive status and summary, return an immutable result
 *
 * Rule failures are isolated: a failing rule is recorded and the run moves on
 * to the next rule. Only validation errors and cancellation abort a run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {

    private final SchemaRegistry schemaRegistry;
    private final RuleEvaluator ruleEvaluator;
    private final ConditionEvaluator conditionEvaluator;
    private final AggregationRequestValidator validator;
    private final MeterRegistry meterRegistry;

    @Value("${app.aggregation.timeout-seconds:10}")
    private int timeoutSeconds;

    /**
     * Synchronous run bounded by the configured timeout.
     */
    public AggregationResult aggregate(AggregationRequest request) {
        CancellationToken token = timeoutSeconds > 0
                ? CancellationToken.withTimeout(Duration.ofSeconds(timeoutSeconds))
                : CancellationToken.none();
        return aggregate(request, token, ProgressListener.NONE);
    }

    public AggregationResult aggregate(AggregationRequest request,
                                       CancellationToken token,
                                       ProgressListener progressListener) {
        validator.validate(request);

        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        List<AggregationRule> rules = resolveRules(request);
        List<String> groupBy = request.getGroupBy() != null ? request.getGroupBy() : Collections.emptyList();

        JsonNode originalData = request.getData().deepCopy();
        JsonNode workingData = originalData;

        List<AggregationRule> applied = new ArrayList<>();
        List<AggregationRule> skipped = new ArrayList<>();
        List<RuleFailure> failed = new ArrayList<>();

        try {
            int processed = 0;
            for (AggregationRule rule : rules) {
                token.throwIfCancelled();

                if (!rule.isEnabled()) {
                    log.debug("Skipping disabled rule {} on '{}'", rule.getOperation(), rule.getField());
                    skipped.add(rule);
                } else {
                    try {
                        if (rule.hasCondition() && !conditionEvaluator.evaluate(rule.getCondition(), workingData)) {
                            log.debug("Condition not met, skipping rule {} on '{}'",
                                    rule.getOperation(), rule.getField());
                            skipped.add(rule);
                        } else {
                            workingData = ruleEvaluator.apply(workingData, rule, groupBy);
                            applied.add(rule);
                        }
                    } catch (RuleExecutionException e) {
                        log.warn("Rule {} on '{}' failed: {}", rule.getOperation(), rule.getField(), e.getMessage());
                        failed.add(RuleFailure.builder().rule(rule).error(e.getMessage()).build());
                    } catch (RuntimeException e) {
                        log.error("Unexpected error in rule {} on '{}'", rule.getOperation(), rule.getField(), e);
                        failed.add(RuleFailure.builder()
                                .rule(rule)
                                .error("unexpected error: " + e.getMessage())
                                .build());
                    }
                }

                processed++;
                progressListener.onProgress(processed, rules.size());
            }
        } catch (AggregationCancelledException e) {
            log.info("Aggregation cancelled after {} applied rules: {}", applied.size(), e.getMessage());
            Counter.builder("aggregation.executed")
                    .tag("status", "cancelled")
                    .register(meterRegistry)
                    .increment();
            throw e;
        }

        AggregationStatus status = AggregationStatus.derive(applied.size(), failed.size());
        int total = rules.size();

        AggregationSummary summary = AggregationSummary.builder()
                .totalRules(total)
                .appliedCount(applied.size())
                .skippedCount(skipped.size())
                .failedCount(failed.size())
                .successRate(total == 0 ? 0.0 : (double) applied.size() / total)
                .dataCount(DataNodes.records(workingData).size())
                .build();

        long processingTime = System.currentTimeMillis() - startTime;

        AggregationResult result = AggregationResult.builder()
                .aggregationId("agg_" + UUID.randomUUID())
                .status(status)
                .originalData(originalData)
                .aggregatedData(workingData)
                .appliedRules(List.copyOf(applied))
                .skippedRules(List.copyOf(skipped))
                .failedRules(List.copyOf(failed))
                .summary(summary)
                .aggregatedAt(Instant.now())
                .processingTimeMs(processingTime)
                .build();

        recordMetrics(sample, request, summary, status);

        log.info("Aggregation {} ({}): {} applied, {} skipped, {} failed, {} ms",
                result.getAggregationId(), status.getValue(),
                summary.getAppliedCount(), summary.getSkippedCount(), summary.getFailedCount(), processingTime);

        return result;
    }

    /**
     * Schema rules when {@code schemaId} resolves, otherwise the inline rules,
     * stably sorted by {@code order}.
     */
    List<AggregationRule> resolveRules(AggregationRequest request) {
        List<AggregationRule> source = null;

        if (request.getSchemaId() != null && !request.getSchemaId().isBlank()) {
            Optional<AggregationSchema> schema = schemaRegistry.find(request.getSchemaId());
            if (schema.isPresent()) {
                source = schema.get().getRules();
                log.debug("Using schema {} (version {})", schema.get().getId(), schema.get().getVersion());
            } else {
                log.warn("Schema {} not found, falling back to inline rules", request.getSchemaId());
            }
        }
        if (source == null) {
            source = request.getRules();
        }
        if (source == null) {
            return new ArrayList<>();
        }

        List<AggregationRule> ordered = source.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(ArrayList::new));
        ordered.sort(Comparator.comparingInt(AggregationRule::getOrder));
        return ordered;
    }

    private void recordMetrics(Timer.Sample sample,
                               AggregationRequest request,
                               AggregationSummary summary,
                               AggregationStatus status) {
        sample.stop(Timer.builder("aggregation.latency")
                .tag("type", request.getAggregationType().trim().toLowerCase(Locale.ROOT))
                .register(meterRegistry));

        Counter.builder("aggregation.executed")
                .tag("status", status.getValue())
                .register(meterRegistry)
                .increment();

        Counter.builder("aggregation.rules")
                .tag("outcome", "applied")
                .register(meterRegistry)
                .increment(summary.getAppliedCount());
        Counter.builder("aggregation.rules")
                .tag("outcome", "skipped")
                .register(meterRegistry)
                .increment(summary.getSkippedCount());
        Counter.builder("aggregation.rules")
                .tag("outcome", "failed")
                .register(meterRegistry)
                .increment(summary.getFailedCount());
    }
}
