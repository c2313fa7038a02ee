package eu.virtualparadox.incidentkb.application.config;

import eu.virtualparadox.incidentkb.application.executor.EmbeddingExecutor;
import eu.virtualparadox.incidentkb.application.executor.IngestionExecutor;
import eu.virtualparadox.incidentkb.application.executor.RetrievalExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public IngestionExecutor ingestionExecutor() {
        IngestionExecutor executor = new IngestionExecutor();
        executor.setCorePoolSize(1);        // a single initialization at a time
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public EmbeddingExecutor embeddingExecutor() {
        EmbeddingExecutor executor = new EmbeddingExecutor();
        executor.setCorePoolSize(4);        // concurrent provider batches
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("embed-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public RetrievalExecutor retrievalExecutor() {
        RetrievalExecutor executor = new RetrievalExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("retrieve-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
