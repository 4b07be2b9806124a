package eu.virtualparadox.docassist.rag.chat;

import eu.virtualparadox.docassist.application.config.ApplicationConfig;
import eu.virtualparadox.docassist.exception.EmbeddingException;
import eu.virtualparadox.docassist.exception.GatewayException;
import eu.virtualparadox.docassist.exception.NotReadyException;
import eu.virtualparadox.docassist.ingest.chunker.Chunker;
import eu.virtualparadox.docassist.ingest.loader.DocumentLoader;
import eu.virtualparadox.docassist.ingest.model.Chunk;
import eu.virtualparadox.docassist.ingest.model.Document;
import eu.virtualparadox.docassist.rag.answer.Answer;
import eu.virtualparadox.docassist.rag.answer.GenerationGateway;
import eu.virtualparadox.docassist.rag.answer.SourcePreview;
import eu.virtualparadox.docassist.rag.embed.EmbeddingGateway;
import eu.virtualparadox.docassist.rag.index.IndexEntry;
import eu.virtualparadox.docassist.rag.retriever.Retriever;
import eu.virtualparadox.docassist.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.docassist.rag.retriever.model.ScoredChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Retrieval-augmented chat over a single uploaded document.
 * <p>
 * Composes {@link Chunker} -> {@link EmbeddingGateway} -> session index on ingest, and
 * {@link Retriever} -> {@link GenerationGateway} on every question. All state lives in the
 * {@link DocumentSession} passed in by the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentChatService {

    static final String SUMMARY_QUERY = "summary overview content";
    static final String NO_DOCUMENT = "No document uploaded.";
    static final String SUMMARY_FALLBACK = "Unable to generate summary at this time.";

    private final Chunker chunker;
    private final EmbeddingGateway embeddingGateway;
    private final Retriever retriever;
    private final GenerationGateway generationGateway;
    private final ApplicationConfig config;

    /**
     * Replaces the session's document with {@code document}.
     * <p>
     * The index and the conversation are cleared first. Every chunk is embedded before anything
     * is added, so a failed embedding leaves the session {@link ESessionState#EMPTY} with an empty
     * index; the caller retries the whole ingestion.
     *
     * @return number of chunks indexed
     * @throws EmbeddingException       if any chunk cannot be embedded
     * @throws IllegalArgumentException if the document contains no text
     */
    public int ingest(final DocumentSession session, final Document document) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(document, "document must not be null");

        session.reset();

        final List<Chunk> chunks = chunker.split(document);
        if (chunks.isEmpty()) {
            throw new IllegalArgumentException("Document '" + document.name() + "' contains no extractable text");
        }

        final List<IndexEntry> entries = new ArrayList<>(chunks.size());
        for (final Chunk chunk : chunks) {
            try {
                entries.add(new IndexEntry(embeddingGateway.embed(chunk.text()), chunk));
            } catch (final EmbeddingException e) {
                log.error("Ingestion of {} aborted at chunk {}/{}; index left empty",
                        document.name(), chunk.sequence() + 1, chunks.size(), e);
                throw e;
            }
        }

        session.getIndex().add(entries);
        session.markIndexed(document, chunks.size());

        log.info("Session {}: indexed '{}' ({}) as {} chunks", session.getId(), document.name(),
                document.sourceType(), chunks.size());
        return chunks.size();
    }

    /**
     * Answers a question from the indexed document and the session's conversation so far.
     *
     * @throws NotReadyException if no document is indexed
     * @throws EmbeddingException if the question cannot be embedded
     * @throws GatewayException   if the language model fails; the exchange is not recorded
     */
    public Answer ask(final DocumentSession session, final String question) {
        Objects.requireNonNull(session, "session must not be null");
        session.requireIndexed();
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }

        session.markAnswering();
        try {
            final RetrievalResult retrieved = retriever.retrieve(session.getIndex(), question, config.getTopK());
            final String prompt = buildAnswerPrompt(question, retrieved);
            final String answer = generationGateway.generate(prompt, session.getMemory());

            session.getMemory().appendExchange(question, answer);
            log.info("Session {}: answered question using {} chunks", session.getId(), retrieved.size());

            return new Answer(question, answer, toPreviews(retrieved));
        } finally {
            session.markAnswered();
        }
    }

    /**
     * Best-effort summary from a small sample of chunks. Never throws for model failures.
     */
    public String summarize(final DocumentSession session) {
        Objects.requireNonNull(session, "session must not be null");
        if (!session.isReady() || session.getIndex().size() == 0) {
            return NO_DOCUMENT;
        }

        try {
            final RetrievalResult sample = retriever.retrieve(session.getIndex(), SUMMARY_QUERY,
                    config.getSummarySampleSize());
            final StringBuilder combined = new StringBuilder();
            for (final Chunk chunk : sample.chunks()) {
                if (combined.length() > 0) {
                    combined.append("\n\n");
                }
                combined.append(chunk.text());
            }

            final String prompt = String.join("\n",
                    "Please provide a concise summary of the following document content:",
                    "",
                    combined.toString(),
                    "",
                    "Summary:");
            return generationGateway.generate(prompt);
        } catch (final GatewayException | EmbeddingException e) {
            log.warn("Summary for session {} failed, returning fallback: {}", session.getId(), e.getMessage());
            return SUMMARY_FALLBACK;
        }
    }

    /**
     * Drops the document, its index entries and the conversation.
     */
    public void clear(final DocumentSession session) {
        Objects.requireNonNull(session, "session must not be null");
        session.reset();
        log.info("Session {}: cleared", session.getId());
    }

    public List<String> getSupportedFormats() {
        return DocumentLoader.SUPPORTED_FORMATS;
    }

    private String buildAnswerPrompt(final String question, final RetrievalResult retrieved) {
        final StringBuilder context = new StringBuilder();
        for (final Chunk chunk : retrieved.chunks()) {
            context.append(chunk.text()).append("\n\n");
        }

        return String.join("\n",
                "Use the following pieces of context to answer the question at the end.",
                "If you don't know the answer, just say that you don't know, don't try to make up an answer.",
                "Take the earlier conversation into account when the question refers to it.",
                "",
                context.toString().trim(),
                "",
                "Question: " + question,
                "Helpful Answer:");
    }

    private List<SourcePreview> toPreviews(final RetrievalResult retrieved) {
        final List<SourcePreview> previews = new ArrayList<>(retrieved.size());
        for (final ScoredChunk hit : retrieved.hits()) {
            previews.add(new SourcePreview(
                    SourcePreview.truncate(hit.chunk().text(), config.getSourcePreviewLength()),
                    hit.chunk().metadata(),
                    hit.score()));
        }
        return previews;
    }
}
