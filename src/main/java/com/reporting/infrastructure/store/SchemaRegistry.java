package com.reporting.infrastructure.store;

import com.reporting.domain.exception.NotFoundException;
import com.reporting.domain.exception.ValidationException;
import com.reporting.domain.model.AggregationRule;
import com.reporting.domain.model.AggregationSchema;
import com.reporting.domain.model.AggregationType;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * In-memory store of named, versioned rule sets.
 *
 * Entries are immutable {@link AggregationSchema} values in a concurrent map,
 * so readers always see either the previous or the new version of a schema,
 * never a partial one. Registering an existing id replaces it.
 */
@Slf4j
public class SchemaRegistry {

    public static final String BUSINESS_METRICS_DEFAULT = "business_metrics_default";
    public static final String RISK_ASSESSMENT_DEFAULT = "risk_assessment_default";

    private final ConcurrentMap<String, AggregationSchema> schemas = new ConcurrentHashMap<>();

    /**
     * Registry pre-populated with the default schemas.
     */
    public static SchemaRegistry withDefaults() {
        SchemaRegistry registry = new SchemaRegistry();
        registry.register(businessMetricsDefault());
        registry.register(riskAssessmentDefault());
        return registry;
    }

    public AggregationSchema register(AggregationSchema schema) {
        if (schema == null || schema.getId() == null || schema.getId().isBlank()) {
            throw new ValidationException("schema id is required");
        }
        Instant now = Instant.now();
        AggregationSchema stored = schemas.compute(schema.getId(), (id, previous) -> schema.toBuilder()
                .createdAt(previous != null ? previous.getCreatedAt()
                        : schema.getCreatedAt() != null ? schema.getCreatedAt() : now)
                .updatedAt(now)
                .build());

        log.info("Registered schema {} (version {}, {} rules)",
                stored.getId(), stored.getVersion(), stored.getRules().size());
        return stored;
    }

    public Optional<AggregationSchema> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(schemas.get(id));
    }

    public AggregationSchema get(String id) {
        return find(id).orElseThrow(() -> new NotFoundException("schema", id));
    }

    /**
     * @param type aggregation type to filter by, or null for every schema
     */
    public List<AggregationSchema> list(String type) {
        return schemas.values().stream()
                .filter(schema -> type == null || type.equalsIgnoreCase(schema.getType()))
                .sorted(Comparator.comparing(AggregationSchema::getId))
                .collect(Collectors.toList());
    }

    public boolean remove(String id) {
        boolean removed = id != null && schemas.remove(id) != null;
        if (removed) {
            log.info("Removed schema {}", id);
        }
        return removed;
    }

    public int size() {
        return schemas.size();
    }

    static AggregationSchema businessMetricsDefault() {
        return AggregationSchema.builder()
                .id(BUSINESS_METRICS_DEFAULT)
                .name("Business metrics")
                .description("Revenue totals and averages")
                .type(AggregationType.BUSINESS_METRICS.getValue())
                .version("1.0.0")
                .rule(AggregationRule.builder()
                        .field("revenue")
                        .operation("sum")
                        .order(1)
                        .description("Total revenue")
                        .build())
                .rule(AggregationRule.builder()
                        .field("revenue")
                        .operation("average")
                        .order(2)
                        .description("Average revenue")
                        .build())
                .build();
    }

    static AggregationSchema riskAssessmentDefault() {
        return AggregationSchema.builder()
                .id(RISK_ASSESSMENT_DEFAULT)
                .name("Risk assessment")
                .description("Risk score distribution")
                .type(AggregationType.RISK_ASSESSMENT.getValue())
                .version("1.0.0")
                .rule(AggregationRule.builder()
                        .field("risk_score")
                        .operation("average")
                        .order(1)
                        .description("Average risk score")
                        .build())
                .rule(AggregationRule.builder()
                        .field("risk_score")
                        .operation("percentile")
                        .parameter("percentile", 95)
                        .order(2)
                        .description("95th percentile risk score")
                        .build())
                .build();
    }
}
