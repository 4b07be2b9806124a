package eu.virtualparadox.docassist.ingest.loader;

import java.io.IOException;
import java.util.Set;

/**
 * Format-specific text extraction from raw file bytes.
 */
public interface TextExtractor {

    /**
     * @return lowercase declared types (file extensions) this extractor reads
     */
    Set<String> supportedTypes();

    ExtractedText extract(final String declaredType, final byte[] content) throws IOException;
}
