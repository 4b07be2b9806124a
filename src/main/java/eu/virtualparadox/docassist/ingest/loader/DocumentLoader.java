package eu.virtualparadox.docassist.ingest.loader;

import eu.virtualparadox.docassist.exception.UnsupportedFormatException;
import eu.virtualparadox.docassist.ingest.cleaner.CleaningResult;
import eu.virtualparadox.docassist.ingest.cleaner.TextCleaner;
import eu.virtualparadox.docassist.ingest.model.Document;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Turns uploaded bytes into a normalized {@link Document}.
 * <ol>
 *   <li>Resolve the declared type from the file name extension</li>
 *   <li>Delegate to the {@link TextExtractor} registered for that type</li>
 *   <li>Clean the text with {@link TextCleaner}, keeping any page map aligned</li>
 * </ol>
 */
@Service
@Slf4j
public class DocumentLoader {

    /** Declared types accepted for upload, in display order. */
    public static final List<String> SUPPORTED_FORMATS = List.of("pdf", "docx", "doc", "txt");

    private final Map<String, TextExtractor> extractorsByType = new HashMap<>();
    private final TextCleaner textCleaner;

    public DocumentLoader(final List<TextExtractor> extractors, final TextCleaner textCleaner) {
        this.textCleaner = textCleaner;
        for (final TextExtractor extractor : extractors) {
            for (final String type : extractor.supportedTypes()) {
                final TextExtractor previous = extractorsByType.putIfAbsent(type, extractor);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate extractor for type " + type);
                }
            }
        }
    }

    public List<String> supportedFormats() {
        return SUPPORTED_FORMATS;
    }

    /**
     * Loads a file whose type is derived from its name.
     *
     * @param fileName original file name (the extension decides the format)
     * @param content  file bytes
     * @return the normalized document
     * @throws UnsupportedFormatException if the extension is missing or not supported
     */
    public Document load(final String fileName, final byte[] content) {
        return load(fileName, declaredType(fileName), content);
    }

    /**
     * Loads a file with an explicitly declared type.
     *
     * @throws UnsupportedFormatException if {@code declaredType} is not supported or the file cannot be parsed
     */
    public Document load(final String fileName, final String declaredType, final byte[] content) {
        final String type = declaredType == null ? "" : declaredType.trim().toLowerCase(Locale.ROOT);
        final TextExtractor extractor = extractorsByType.get(type);
        if (extractor == null || !SUPPORTED_FORMATS.contains(type)) {
            throw new UnsupportedFormatException("Unsupported file type: " + (type.isEmpty() ? "<none>" : type));
        }
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }

        final ExtractedText extracted;
        try {
            extracted = extractor.extract(type, content);
        } catch (IOException | RuntimeException e) {
            // corrupt files surface as IOException from PDFBox and as unchecked exceptions from POI
            throw new UnsupportedFormatException("Could not read " + fileName + " as " + type + ": " + e.getMessage(), e);
        }

        final CleaningResult cleaned = textCleaner.clean(extracted.text(), extracted.pageMap());
        log.info("Loaded {} ({}): {} raw chars, {} after cleaning",
                fileName, type, extracted.text().length(), cleaned.text().length());

        return new Document(generateId(), fileName, type, cleaned.text(), cleaned.pageMap());
    }

    /**
     * @return the lowercase extension without the dot, or an empty string if none found
     */
    static String declaredType(final String fileName) {
        if (fileName == null) {
            return "";
        }
        final int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        return fileName.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
    }

    private static String generateId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
