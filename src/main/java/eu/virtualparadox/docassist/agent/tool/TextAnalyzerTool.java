package eu.virtualparadox.docassist.agent.tool;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Basic statistics over a piece of text: counts, reading time and frequent words.
 */
@Component
public class TextAnalyzerTool extends AbstractTool {

    public static final String NAME = "text_analyzer";

    private static final String DESCRIPTION = "Useful for analyzing text content. Can count words, characters, "
            + "sentences, find keywords, and provide basic text statistics. Input should be the text to analyze.";

    static final int WORDS_PER_MINUTE = 200;
    static final int TOP_WORDS = 5;
    private static final int MIN_KEYWORD_LENGTH = 4;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Computed statistics; {@code topWords} keeps first-occurrence order among equal counts.
     */
    public record TextStats(int words,
                            int characters,
                            int charactersNoSpaces,
                            int sentences,
                            int paragraphs,
                            int readingMinutes,
                            List<Map.Entry<String, Integer>> topWords) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return DESCRIPTION;
    }

    @Override
    protected String execute(final String input) {
        final TextStats stats = analyze(input);

        final StringBuilder sb = new StringBuilder()
                .append("Text Analysis Results:\n")
                .append("- Word count: ").append(stats.words()).append('\n')
                .append("- Character count: ").append(stats.characters()).append('\n')
                .append("- Character count (no spaces): ").append(stats.charactersNoSpaces()).append('\n')
                .append("- Sentence count: ").append(stats.sentences()).append('\n')
                .append("- Paragraph count: ").append(stats.paragraphs()).append('\n')
                .append("- Estimated reading time: ").append(stats.readingMinutes()).append(" minute(s)\n")
                .append('\n')
                .append("Top ").append(TOP_WORDS).append(" most frequent words:\n");
        for (final Map.Entry<String, Integer> word : stats.topWords()) {
            sb.append("- ").append(word.getKey()).append(": ").append(word.getValue()).append(" times\n");
        }
        return sb.toString();
    }

    @Override
    protected String describeFailure(final Exception e) {
        return "Error analyzing text: " + messageOf(e);
    }

    public TextStats analyze(final String text) {
        final String trimmed = text.strip();
        final int words = trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;

        int sentences = 0;
        final Matcher sentenceMatcher = SENTENCE_END.matcher(text);
        while (sentenceMatcher.find()) {
            sentences++;
        }

        int paragraphs = 0;
        for (final String paragraph : text.split("\n\n")) {
            if (!paragraph.isBlank()) {
                paragraphs++;
            }
        }

        final Map<String, Integer> frequencies = new LinkedHashMap<>();
        final Matcher wordMatcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (wordMatcher.find()) {
            final String word = wordMatcher.group();
            if (word.length() >= MIN_KEYWORD_LENGTH) {
                frequencies.merge(word, 1, Integer::sum);
            }
        }
        final List<Map.Entry<String, Integer>> ranked = new ArrayList<>(frequencies.entrySet());
        // List.sort is stable, ties stay in first-occurrence order
        ranked.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        final List<Map.Entry<String, Integer>> top = new ArrayList<>();
        for (final Map.Entry<String, Integer> entry : ranked.subList(0, Math.min(TOP_WORDS, ranked.size()))) {
            top.add(Map.entry(entry.getKey(), entry.getValue()));
        }

        return new TextStats(
                words,
                text.length(),
                text.replace(" ", "").length(),
                sentences,
                paragraphs,
                (words + WORDS_PER_MINUTE - 1) / WORDS_PER_MINUTE,
                top);
    }
}
