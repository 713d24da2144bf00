package com.reporting.api;

import com.reporting.domain.model.AggregationJob;
import com.reporting.domain.model.AggregationRequest;
import com.reporting.domain.model.AggregationResult;
import com.reporting.domain.model.AggregationSchema;
import com.reporting.domain.model.JobPage;
import com.reporting.domain.model.JobSubmission;
import com.reporting.domain.service.AggregationJobProcessor;
import com.reporting.domain.service.AggregationService;
import com.reporting.infrastructure.store.SchemaRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for the aggregation engine.
 *
 * Endpoints:
 * - POST /api/v1/aggregation/aggregate - Run an aggregation synchronously
 * - POST /api/v1/aggregation/jobs - Submit an aggregation job
 * - GET  /api/v1/aggregation/jobs/{jobId} - Get job status and result
 * - GET  /api/v1/aggregation/jobs - List jobs (filtered, paginated)
 * - POST /api/v1/aggregation/jobs/{jobId}/cancel - Cancel a pending or running job
 * - GET  /api/v1/aggregation/schemas/{schemaId} - Get a schema
 * - GET  /api/v1/aggregation/schemas - List schemas
 * - POST /api/v1/aggregation/schemas - Register or replace a schema
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/aggregation")
@RequiredArgsConstructor
public class AggregationController {

    private final AggregationService aggregationService;
    private final AggregationJobProcessor jobProcessor;
    private final SchemaRegistry schemaRegistry;

    /**
     * Run an aggregation and return the completed result.
     *
     * Request body:
     * {
     *   "aggregation_type": "business_metrics",
     *   "data": [ { "revenue": 120 }, { "revenue": 80 } ],
     *   "rules": [ { "field": "revenue", "operation": "sum", "order": 1 } ]
     * }
     */
    @PostMapping("/aggregate")
    public ResponseEntity<AggregationResult> aggregate(@Valid @RequestBody AggregationRequest request) {
        log.info("Aggregate: type={}, business={}, schema={}",
                request.getAggregationType(), request.getBusinessId(), request.getSchemaId());

        return ResponseEntity.ok(aggregationService.aggregate(request));
    }

    /**
     * Submit an aggregation job.
     *
     * Response (202):
     * {
     *   "job_id": "job_...",
     *   "status": "pending",
     *   "created_at": "..."
     * }
     */
    @PostMapping("/jobs")
    public ResponseEntity<JobSubmission> submitJob(@Valid @RequestBody AggregationRequest request) {
        log.info("Submit aggregation job: type={}, business={}",
                request.getAggregationType(), request.getBusinessId());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(jobProcessor.submitJob(request));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AggregationJob> getJob(@PathVariable String jobId) {
        log.debug("Get job: jobId={}", jobId);
        return ResponseEntity.ok(jobProcessor.getJob(jobId));
    }

    /**
     * GET /api/v1/aggregation/jobs?business_id=xxx&status=completed&aggregation_type=xxx&page=1&limit=20
     *
     * limit defaults to 20 (max 100), page defaults to 1.
     */
    @GetMapping("/jobs")
    public ResponseEntity<JobPage> listJobs(
            @RequestParam(name = "business_id", required = false) String businessId,
            @RequestParam(required = false) String status,
            @RequestParam(name = "aggregation_type", required = false) String aggregationType,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        return ResponseEntity.ok(jobProcessor.listJobs(businessId, status, aggregationType, page, limit));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelJob(@PathVariable String jobId) {
        log.info("Cancel job: jobId={}", jobId);

        boolean cancelled = jobProcessor.cancelJob(jobId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", jobId);
        body.put("cancelled", cancelled);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/schemas/{schemaId}")
    public ResponseEntity<AggregationSchema> getSchema(@PathVariable String schemaId) {
        return ResponseEntity.ok(schemaRegistry.get(schemaId));
    }

    @GetMapping("/schemas")
    public ResponseEntity<List<AggregationSchema>> listSchemas(@RequestParam(required = false) String type) {
        return ResponseEntity.ok(schemaRegistry.list(type));
    }

    @PostMapping("/schemas")
    public ResponseEntity<AggregationSchema> registerSchema(@RequestBody AggregationSchema schema) {
        log.info("Register schema: id={}, version={}", schema.getId(), schema.getVersion());
        return ResponseEntity.status(HttpStatus.CREATED).body(schemaRegistry.register(schema));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
