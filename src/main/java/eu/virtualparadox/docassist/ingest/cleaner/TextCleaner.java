package eu.virtualparadox.docassist.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Normalizes extracted document text before chunking.
 * <ul>
 *   <li>line breaks, tabs, non-breaking spaces and format characters (zero-width space, BOM,
 *       bidi marks) become a space</li>
 *   <li>soft hyphens and remaining control characters are removed</li>
 *   <li>whitespace runs collapse to a single space; the result is trimmed</li>
 * </ul>
 * A page map, when given, is kept aligned with the cleaned text: removed characters drop their
 * entry and a collapsed whitespace run keeps the page of its first character.
 */
@Component
public class TextCleaner {

    private static final int REMOVE = -1;

    public String clean(final String input) {
        return clean(input, null).text();
    }

    /**
     * Cleans {@code input} in a single pass.
     *
     * @param input   raw text, may be {@code null}
     * @param pageMap optional per-character page index; must match {@code input} length when present
     * @return cleaned text and the adjusted page map
     */
    public CleaningResult clean(final String input, final int[] pageMap) {
        if (input == null || input.isEmpty()) {
            return new CleaningResult("", pageMap == null ? null : new int[0]);
        }
        if (pageMap != null && pageMap.length != input.length()) {
            throw new IllegalArgumentException("Text length must equal page map length");
        }

        final StringBuilder out = new StringBuilder(input.length());
        final int[] outMap = new int[input.length()];
        int written = 0;

        boolean pendingSpace = false;
        int pendingPage = 0;

        for (int i = 0; i < input.length(); i++) {
            final int mapped = normalize(input.charAt(i));
            if (mapped == REMOVE) {
                continue;
            }
            final int page = pageMap == null ? 0 : pageMap[i];

            if (Character.isWhitespace(mapped)) {
                // leading whitespace is dropped, runs keep the page of their first char
                if (!pendingSpace && written > 0) {
                    pendingSpace = true;
                    pendingPage = page;
                }
                continue;
            }

            if (pendingSpace) {
                out.append(' ');
                outMap[written++] = pendingPage;
                pendingSpace = false;
            }
            out.append((char) mapped);
            outMap[written++] = page;
        }

        return new CleaningResult(out.toString(), pageMap == null ? null : Arrays.copyOf(outMap, written));
    }

    private static int normalize(final char c) {
        if (c == '\r' || c == '\n' || c == '\t' || c == '\u00A0') {
            return ' ';
        }
        if (c == '\u00AD') {
            return REMOVE;
        }
        final int type = Character.getType(c);
        if (type == Character.FORMAT) {
            return ' ';
        }
        if (type == Character.CONTROL) {
            return REMOVE;
        }
        return c;
    }
}
