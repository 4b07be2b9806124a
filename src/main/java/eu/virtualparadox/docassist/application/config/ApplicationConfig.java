package eu.virtualparadox.docassist.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "docassist")
@Getter @Setter
public class ApplicationConfig {

    /** Maximum characters per chunk. */
    private int chunkSize = 1000;

    /** Characters shared by consecutive chunks. */
    private int chunkOverlap = 200;

    /** Chunks retrieved per question. */
    private int topK = 4;

    /** Chunks sampled for a document summary. */
    private int summarySampleSize = 3;

    /** Characters of each source chunk returned with an answer. */
    private int sourcePreviewLength = 200;

    /** Think/act/observe cycles before the agent is forced to finish. */
    private int agentMaxIterations = 3;

    /** {@code memory} (exact brute force) or {@code lucene} (HNSW). */
    private String indexType = "memory";
}
