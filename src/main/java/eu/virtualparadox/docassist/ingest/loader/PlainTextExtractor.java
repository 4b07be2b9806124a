package eu.virtualparadox.docassist.ingest.loader;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Set;

@Component
public final class PlainTextExtractor implements TextExtractor {

    @Override
    public Set<String> supportedTypes() {
        return Set.of("txt");
    }

    @Override
    public ExtractedText extract(final String declaredType, final byte[] content) {
        return ExtractedText.withoutPages(new String(content, StandardCharsets.UTF_8));
    }
}
