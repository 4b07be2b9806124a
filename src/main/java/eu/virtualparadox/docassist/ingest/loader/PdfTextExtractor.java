package eu.virtualparadox.docassist.ingest.loader;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * PDF extractor based on Apache PDFBox producing:
 * <ul>
 *   <li>a continuous string concatenating all pages in order, and</li>
 *   <li>a per-character {@code int[]} page map (1-based), aligned to the text length.</li>
 * </ul>
 * <p>Chunks may then cross page boundaries while still reporting the page span they cover.</p>
 */
@Component
public final class PdfTextExtractor implements TextExtractor {

    @Override
    public Set<String> supportedTypes() {
        return Set.of("pdf");
    }

    @Override
    public ExtractedText extract(final String declaredType, final byte[] content) throws IOException {
        try (PDDocument pdf = PDDocument.load(content)) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final StringBuilder rawText = new StringBuilder();
            final List<Integer> rawPageMap = new ArrayList<>();

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC);
                rawText.append(pageText);
                for (int i = 0; i < pageText.length(); i++) {
                    rawPageMap.add(page);
                }
            }

            final int[] pageMap = rawPageMap.stream().mapToInt(Integer::intValue).toArray();
            return new ExtractedText(rawText.toString(), pageMap);
        }
    }
}
