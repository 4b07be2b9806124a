package eu.virtualparadox.docassist.rag.index;

import eu.virtualparadox.docassist.ingest.model.Chunk;
import eu.virtualparadox.docassist.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.docassist.rag.retriever.model.ScoredChunk;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static eu.virtualparadox.docassist.util.LuceneConstants.*;

/**
 * Lucene-backed {@link VectorIndex} using the HNSW k-NN graph over an in-memory directory.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code ordinal}: stored int: insertion position, also the key into the chunk list</li>
 *   <li>{@code docId}, {@code chunkId}: stored identifiers</li>
 *   <li>{@code text}: stored chunk text</li>
 *   <li>{@code vector}: {@link KnnFloatVectorField} with {@link VectorSimilarityFunction#COSINE}</li>
 * </ul>
 *
 * <p>Lucene reports cosine hits as {@code (1 + cos) / 2}; scores are mapped back to plain cosine
 * similarity so both index implementations rank on the same scale. Vectors must be non-zero,
 * which Lucene enforces for cosine fields.</p>
 *
 * <p>HNSW search is approximate. For the graph sizes of a single document it visits every node,
 * but {@link InMemoryVectorIndex} remains the exact default.</p>
 */
@Slf4j
public final class LuceneVectorIndex implements VectorIndex {

    private final Directory directory;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    private final List<Chunk> chunks = new ArrayList<>();
    private final DimensionGuard dimensionGuard = new DimensionGuard();

    public LuceneVectorIndex() {
        try {
            this.directory = new ByteBuffersDirectory();
            this.writer = new IndexWriter(directory, new IndexWriterConfig()
                    .setOpenMode(IndexWriterConfig.OpenMode.CREATE));
            this.searcherManager = new SearcherManager(writer, null);
        } catch (final IOException e) {
            throw new IllegalStateException("Unable to open in-memory Lucene index", e);
        }
    }

    @Override
    public void add(final List<IndexEntry> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        for (final IndexEntry entry : entries) {
            Objects.requireNonNull(entry, "entries must not contain null elements");
            dimensionGuard.accept(entry.vector());
        }
        if (entries.isEmpty()) {
            return;
        }

        try {
            for (final IndexEntry entry : entries) {
                final int ordinal = chunks.size();
                writer.addDocument(buildLuceneDocument(ordinal, entry));
                chunks.add(entry.chunk());
            }
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (final IOException e) {
            throw new IllegalStateException("Failed to write vectors to Lucene index", e);
        }
    }

    @Override
    public RetrievalResult search(final float[] queryVector, final int k) {
        Objects.requireNonNull(queryVector, "queryVector must not be null");
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, was " + k);
        }
        if (chunks.isEmpty()) {
            return RetrievalResult.empty();
        }
        dimensionGuard.checkQuery(queryVector);

        final int limit = Math.min(k, chunks.size());
        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            final TopDocs topDocs = searcher.search(new KnnFloatVectorQuery(FIELD_VECTOR, queryVector, limit), limit);
            final StoredFields storedFields = searcher.storedFields();

            final List<OrderedHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                final int ordinal = storedFields.document(sd.doc).getField(FIELD_ORDINAL).numericValue().intValue();
                hits.add(new OrderedHit(ordinal, 2.0 * sd.score - 1.0));
            }
            hits.sort(Comparator.comparingDouble(OrderedHit::score).reversed()
                    .thenComparingInt(OrderedHit::ordinal));

            final List<ScoredChunk> result = new ArrayList<>(hits.size());
            for (final OrderedHit hit : hits) {
                result.add(new ScoredChunk(chunks.get(hit.ordinal()), hit.score()));
            }
            return new RetrievalResult(result);
        } catch (final IOException e) {
            throw new IllegalStateException("Lucene k-NN search failed", e);
        } finally {
            release(searcher);
        }
    }

    @Override
    public void clear() {
        try {
            writer.deleteAll();
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (final IOException e) {
            throw new IllegalStateException("Failed to clear Lucene index", e);
        }
        chunks.clear();
        dimensionGuard.reset();
    }

    @Override
    public int size() {
        return chunks.size();
    }

    /**
     * Ensures Lucene resources are closed cleanly.
     */
    @Override
    public void close() {
        chunks.clear();
        try { searcherManager.close(); } catch (IOException e) {
            log.error("Unable to close SearcherManager", e);
        }

        try { writer.close(); } catch (IOException e) {
            log.error("Unable to close IndexWriter", e);
        }

        try { directory.close(); } catch (IOException e) {
            log.error("Unable to close Directory", e);
        }
    }

    private Document buildLuceneDocument(final int ordinal, final IndexEntry entry) {
        final Chunk c = entry.chunk();
        final Document d = new Document();

        d.add(new StoredField(FIELD_ORDINAL, ordinal));
        d.add(new StringField(FIELD_DOC_ID, c.docId(), Field.Store.YES));
        d.add(new StringField(FIELD_CHUNK_ID, c.chunkId(), Field.Store.YES));
        d.add(new StoredField(FIELD_TEXT, c.text()));
        d.add(new KnnFloatVectorField(FIELD_VECTOR, entry.vector(), VectorSimilarityFunction.COSINE));

        return d;
    }

    private void release(final IndexSearcher searcher) {
        if (searcher == null) {
            return;
        }
        try {
            searcherManager.release(searcher);
        } catch (final IOException e) {
            log.warn("Unable to release searcher", e);
        }
    }

    private record OrderedHit(int ordinal, double score) {
    }
}
