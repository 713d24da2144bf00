package com.reporting.domain.service;

/**
 * Notified after each rule of a pipeline run has been processed.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (processedRules, totalRules) -> { };

    void onProgress(int processedRules, int totalRules);
}
