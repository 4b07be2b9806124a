package eu.virtualparadox.docassist.ingest.loader;

/**
 * Raw text pulled out of an uploaded file.
 *
 * @param text    extracted text, not yet cleaned
 * @param pageMap optional 1-based page index per character, {@code null} for formats without pages
 */
public record ExtractedText(String text, int[] pageMap) {

    public static ExtractedText withoutPages(final String text) {
        return new ExtractedText(text, null);
    }
}
