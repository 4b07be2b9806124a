package eu.virtualparadox.docassist.rag.answer;

import java.util.List;

/**
 * @param question the question as asked
 * @param text     generated answer
 * @param sources  supporting chunks in retrieval order
 */
public record Answer(String question, String text, List<SourcePreview> sources) {

    public Answer {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
