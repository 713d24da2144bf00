package com.reporting.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Page of job summaries plus pagination metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobPage {

    private List<AggregationJobSummary> jobs;
    private Pagination pagination;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pagination {
        private int page;
        private int limit;
        private long total;
        private int totalPages;
    }
}
