package eu.virtualparadox.incidentkb.application.config;

import eu.virtualparadox.incidentkb.rag.retriever.model.ESearchType;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "incidentkb")
@Getter @Setter
public class KnowledgeProperties {

    /** Folder holding the plain-text methodology documents. */
    private Path docs = Path.of("docs");
    /** Root folder of persisted index collections. */
    private Path index = Path.of("vectorstore");
    private String collection = "security_knowledge";
    private String language = "es";
    private String domain = "cybersecurity";

    private Embedding embedding = new Embedding();
    private Retriever retriever = new Retriever();

    @Getter @Setter
    public static class Embedding {
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private String model = "text-embedding-3-small";
        private int dimensions = 1024;
        private int batchSize = 100;
        private int maxAttempts = 3;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Getter @Setter
    public static class Retriever {
        private ESearchType searchType = ESearchType.MMR;
        private int k = 8;
        private int fetchK = 16;
        private double lambda = 0.7;
        private double scoreThreshold = 0.5;
    }

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (index != null) Files.createDirectories(index);
    }
}
