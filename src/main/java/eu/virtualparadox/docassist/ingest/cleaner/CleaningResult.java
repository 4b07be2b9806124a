package eu.virtualparadox.docassist.ingest.cleaner;

/**
 * Result of text cleaning.
 *
 * @param text    cleaned text
 * @param pageMap page index per character of {@code text}, or {@code null} when none was supplied
 */
public record CleaningResult(String text, int[] pageMap) {

    public CleaningResult {
        if (pageMap != null && text.length() != pageMap.length) {
            throw new IllegalStateException(
                    "Cleaning broke the invariant: text length " + text.length()
                            + " != pageMap length " + pageMap.length);
        }
    }
}
