package eu.virtualparadox.docassist.ingest.loader;

import org.apache.poi.hwpf.HWPFDocument;
import org.apache.poi.hwpf.extractor.WordExtractor;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Set;

/**
 * Word documents via Apache POI: OOXML ({@code .docx}) through XWPF and the legacy binary
 * format ({@code .doc}) through HWPF.
 */
@Component
public final class WordTextExtractor implements TextExtractor {

    @Override
    public Set<String> supportedTypes() {
        return Set.of("docx", "doc");
    }

    @Override
    public ExtractedText extract(final String declaredType, final byte[] content) throws IOException {
        if ("doc".equals(declaredType)) {
            try (WordExtractor extractor = new WordExtractor(new HWPFDocument(new ByteArrayInputStream(content)))) {
                return ExtractedText.withoutPages(extractor.getText());
            }
        }
        try (XWPFWordExtractor extractor = new XWPFWordExtractor(new XWPFDocument(new ByteArrayInputStream(content)))) {
            return ExtractedText.withoutPages(extractor.getText());
        }
    }
}
