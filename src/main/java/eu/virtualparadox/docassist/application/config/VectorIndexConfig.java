package eu.virtualparadox.docassist.application.config;

import eu.virtualparadox.docassist.exception.ConfigException;
import eu.virtualparadox.docassist.rag.index.InMemoryVectorIndex;
import eu.virtualparadox.docassist.rag.index.LuceneVectorIndex;
import eu.virtualparadox.docassist.rag.index.VectorIndexFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Chooses the vector index implementation handed to new document sessions.
 */
@Configuration
@Slf4j
public class VectorIndexConfig {

    @Bean
    public VectorIndexFactory vectorIndexFactory(final ApplicationConfig config) {
        final String type = config.getIndexType() == null ? "" : config.getIndexType().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "memory":
                log.info("Document sessions use the exact in-memory vector index");
                return InMemoryVectorIndex::new;
            case "lucene":
                log.info("Document sessions use the Lucene HNSW vector index");
                return LuceneVectorIndex::new;
            default:
                throw new ConfigException("Unknown docassist.index-type '" + config.getIndexType()
                        + "', expected 'memory' or 'lucene'");
        }
    }
}
