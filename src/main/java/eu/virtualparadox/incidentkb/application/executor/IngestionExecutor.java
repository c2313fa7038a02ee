package eu.virtualparadox.incidentkb.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs knowledge-base initialization in the background.
 */
public class IngestionExecutor extends ThreadPoolTaskExecutor {
}
