package eu.virtualparadox.incidentkb.application.startup;

import eu.virtualparadox.incidentkb.application.executor.IngestionExecutor;
import eu.virtualparadox.incidentkb.knowledge.KnowledgeOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Initializes the knowledge base in the background once the application has started.
 * <p>A failed initialization is logged; queries are then rejected as not ready.</p>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KnowledgeBootstrap {

    private final KnowledgeOrchestrator orchestrator;
    private final IngestionExecutor ingestionExecutor;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        ingestionExecutor.submit(() -> {
            try {
                log.info("Asynchronous knowledge base initialization started");
                orchestrator.initialize();
                log.info("Asynchronous knowledge base initialization completed: {}", orchestrator.stats().chunksCreated());
            } catch (Exception e) {
                log.error("Asynchronous knowledge base initialization failed", e);
            }
        });
    }
}
