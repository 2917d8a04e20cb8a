package com.workflowplatform.orchestrator.service;

import java.time.Duration;

/**
 * Process-wide executor tuning.
 *
 * @param defaultStageTimeout timeout for a stage when neither the stage, the run nor the workflow sets one
 * @param maxConcurrency      upper bound on concurrently running members of one parallel group
 */
public record ExecutorSettings(Duration defaultStageTimeout, int maxConcurrency) {}
