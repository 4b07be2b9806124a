package eu.virtualparadox.docassist.ingest.loader;

import eu.virtualparadox.docassist.exception.UnsupportedFormatException;
import eu.virtualparadox.docassist.ingest.cleaner.TextCleaner;
import eu.virtualparadox.docassist.ingest.model.Document;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentLoaderTest {

    private final DocumentLoader loader = new DocumentLoader(
            List.of(new PdfTextExtractor(), new WordTextExtractor(), new PlainTextExtractor()),
            new TextCleaner());

    private static byte[] pdfWithPages(String... pages) throws IOException {
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String text : pages) {
                PDPage page = new PDPage();
                doc.addPage(page);
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(PDType1Font.HELVETICA, 12);
                    cs.newLineAtOffset(50, 700);
                    cs.showText(text);
                    cs.endText();
                }
            }
            doc.save(out);
            return out.toByteArray();
        }
    }

    private static byte[] docx(String... paragraphs) throws IOException {
        try (XWPFDocument doc = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String paragraph : paragraphs) {
                doc.createParagraph().createRun().setText(paragraph);
            }
            doc.write(out);
            return out.toByteArray();
        }
    }

    @Test
    @DisplayName("Plain text is decoded as UTF-8 and cleaned")
    void loadsTxt() {
        byte[] content = "First line\n\nSecond   line\n".getBytes(StandardCharsets.UTF_8);

        Document document = loader.load("notes.TXT", content);

        assertThat(document.text()).isEqualTo("First line Second line");
        assertThat(document.sourceType()).isEqualTo("txt");
        assertThat(document.name()).isEqualTo("notes.TXT");
        assertThat(document.id()).hasSize(32).doesNotContain("-");
        assertThat(document.pageMap()).isNull();
        assertThat(document.metadata())
                .containsEntry(Document.META_SOURCE, "notes.TXT")
                .containsEntry(Document.META_FILE_TYPE, "txt");
    }

    @Test
    @DisplayName("PDF text keeps a page map aligned with the cleaned text")
    void loadsPdfWithPages() throws IOException {
        Document document = loader.load("report.pdf", pdfWithPages("Alpha page one", "Bravo page two"));

        assertThat(document.text()).contains("Alpha page one").contains("Bravo page two");
        int[] pageMap = document.pageMap();
        assertThat(pageMap).hasSize(document.text().length());
        assertThat(pageMap[0]).isEqualTo(1);
        assertThat(pageMap[pageMap.length - 1]).isEqualTo(2);
        assertThat(pageMap[document.text().indexOf("Bravo")]).isEqualTo(2);
    }

    @Test
    @DisplayName("DOCX paragraphs are extracted without pages")
    void loadsDocx() throws IOException {
        Document document = loader.load("memo.docx", docx("Quarterly results.", "Revenue grew."));

        assertThat(document.text()).isEqualTo("Quarterly results. Revenue grew.");
        assertThat(document.sourceType()).isEqualTo("docx");
        assertThat(document.pageMap()).isNull();
    }

    @Test
    @DisplayName("Unknown or missing extensions are rejected with the offending type")
    void rejectsUnsupported() {
        assertThatThrownBy(() -> loader.load("image.png", new byte[]{1, 2, 3}))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessage("Unsupported file type: png");
        assertThatThrownBy(() -> loader.load("README", new byte[0]))
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    @DisplayName("Corrupt files are reported as unreadable")
    void rejectsCorruptPdf() {
        byte[] garbage = "definitely not a pdf".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> loader.load("broken.pdf", garbage))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageStartingWith("Could not read broken.pdf as pdf");
    }

    @Test
    @DisplayName("Supported formats are listed in display order")
    void supportedFormats() {
        assertThat(loader.supportedFormats()).containsExactly("pdf", "docx", "doc", "txt");
        assertThat(DocumentLoader.declaredType("a.b.DOCX")).isEqualTo("docx");
        assertThat(DocumentLoader.declaredType(null)).isEmpty();
    }

    @Test
    @DisplayName("Two extractors claiming the same type is a wiring error")
    void duplicateExtractors() {
        assertThatThrownBy(() -> new DocumentLoader(
                List.of(new PlainTextExtractor(), new PlainTextExtractor()), new TextCleaner()))
                .isInstanceOf(IllegalStateException.class);
    }
}
