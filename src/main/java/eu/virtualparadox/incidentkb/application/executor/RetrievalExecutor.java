package eu.virtualparadox.incidentkb.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

public class RetrievalExecutor extends ThreadPoolTaskExecutor {
}
