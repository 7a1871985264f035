package com.williamcallahan.knowledgeindex.store;

import com.williamcallahan.knowledgeindex.domain.document.DocumentChunk;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BM25 keyword index over chunk text backed by Apache Lucene.
 *
 * <p>Writes go through one shared {@link IndexWriter}. Every query acquires its own
 * {@link IndexSearcher} from a {@link SearcherManager}, so concurrent queries never share a reader
 * session with each other or with in-flight writes.</p>
 */
public class LuceneKeywordIndex implements KeywordIndex, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LuceneKeywordIndex.class);

    static final String FIELD_CHUNK_ID = "chunkId";
    static final String FIELD_DOCUMENT_ID = "documentId";
    static final String FIELD_SCOPE_ID = "scopeId";
    static final String FIELD_PATH = "path";
    static final String FIELD_CONTENT = "content";

    private static final int MAX_QUERY_TERMS = 64;

    private final Directory directory;
    private final Analyzer analyzer;
    private final IndexWriter indexWriter;
    private final SearcherManager searcherManager;

    /**
     * Opens an index held entirely in memory.
     */
    public static LuceneKeywordIndex inMemory() {
        return new LuceneKeywordIndex(new ByteBuffersDirectory());
    }

    /**
     * Opens (or creates) an index persisted under the given directory.
     */
    public static LuceneKeywordIndex onDisk(Path indexDirectory) {
        try {
            Files.createDirectories(indexDirectory);
            return new LuceneKeywordIndex(FSDirectory.open(indexDirectory));
        } catch (IOException ioException) {
            throw new UncheckedIOException("Unable to open keyword index at " + indexDirectory, ioException);
        }
    }

    LuceneKeywordIndex(Directory directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.analyzer = new StandardAnalyzer();
        try {
            IndexWriterConfig writerConfig = new IndexWriterConfig(analyzer);
            writerConfig.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            this.indexWriter = new IndexWriter(directory, writerConfig);
            this.searcherManager = new SearcherManager(indexWriter, null);
        } catch (IOException ioException) {
            throw new UncheckedIOException("Unable to initialize keyword index", ioException);
        }
        log.info("[LUCENE] Keyword index ready ({})", directory.getClass().getSimpleName());
    }

    @Override
    public void index(List<DocumentChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return;
        }
        try {
            for (DocumentChunk chunk : chunks) {
                indexWriter.updateDocument(new Term(FIELD_CHUNK_ID, chunk.id()), toLuceneDocument(chunk));
            }
            indexWriter.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (IOException ioException) {
            throw new UncheckedIOException("Failed to index " + chunks.size() + " chunks", ioException);
        }
        log.debug("[LUCENE] Indexed {} chunks", chunks.size());
    }

    @Override
    public List<KeywordMatch> search(String query, int topK, SearchFilter filter) {
        Objects.requireNonNull(filter, "filter");
        if (query == null || query.isBlank() || topK <= 0) {
            return List.of();
        }
        Set<String> queryTerms = analyze(query);
        if (queryTerms.isEmpty()) {
            return List.of();
        }

        BooleanQuery.Builder termsQuery = new BooleanQuery.Builder();
        for (String queryTerm : queryTerms) {
            termsQuery.add(new TermQuery(new Term(FIELD_CONTENT, queryTerm)), BooleanClause.Occur.SHOULD);
        }
        BooleanQuery.Builder scopedQuery = new BooleanQuery.Builder()
                .add(termsQuery.build(), BooleanClause.Occur.MUST)
                .add(new TermQuery(new Term(FIELD_SCOPE_ID, filter.scopeId())), BooleanClause.Occur.FILTER);
        if (filter.hasPathPrefix()) {
            scopedQuery.add(new PrefixQuery(new Term(FIELD_PATH, filter.pathPrefix())), BooleanClause.Occur.FILTER);
        }

        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            TopDocs topDocs = searcher.search(scopedQuery.build(), topK);
            StoredFields storedFields = searcher.storedFields();
            List<KeywordMatch> matches = new ArrayList<>(topDocs.scoreDocs.length);
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                Document stored = storedFields.document(scoreDoc.doc);
                matches.add(new KeywordMatch(
                        stored.get(FIELD_CHUNK_ID),
                        stored.get(FIELD_DOCUMENT_ID),
                        stored.get(FIELD_CONTENT),
                        scoreDoc.score));
            }
            return List.copyOf(matches);
        } catch (IOException ioException) {
            throw new UncheckedIOException("Keyword search failed", ioException);
        } finally {
            releaseQuietly(searcher);
        }
    }

    @Override
    public void deleteByDocumentId(String documentId) {
        try {
            indexWriter.deleteDocuments(new Term(FIELD_DOCUMENT_ID, documentId));
            indexWriter.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (IOException ioException) {
            throw new UncheckedIOException("Failed to delete keyword entries for document " + documentId, ioException);
        }
    }

    @Override
    public long countByDocumentId(String documentId) {
        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            return searcher.count(new TermQuery(new Term(FIELD_DOCUMENT_ID, documentId)));
        } catch (IOException ioException) {
            throw new UncheckedIOException("Keyword count failed", ioException);
        } finally {
            releaseQuietly(searcher);
        }
    }

    @Override
    public void close() throws IOException {
        searcherManager.close();
        indexWriter.close();
        directory.close();
        analyzer.close();
    }

    private Set<String> analyze(String text) {
        Set<String> terms = new LinkedHashSet<>();
        try (TokenStream tokenStream = analyzer.tokenStream(FIELD_CONTENT, text)) {
            CharTermAttribute termAttribute = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken() && terms.size() < MAX_QUERY_TERMS) {
                terms.add(termAttribute.toString());
            }
            tokenStream.end();
        } catch (IOException ioException) {
            throw new UncheckedIOException("Failed to analyze keyword query", ioException);
        }
        return terms;
    }

    private void releaseQuietly(IndexSearcher searcher) {
        if (searcher == null) {
            return;
        }
        try {
            searcherManager.release(searcher);
        } catch (IOException ioException) {
            log.warn("[LUCENE] Failed to release searcher: {}", ioException.getMessage());
        }
    }

    private static Document toLuceneDocument(DocumentChunk chunk) {
        Document document = new Document();
        document.add(new StringField(FIELD_CHUNK_ID, chunk.id(), Field.Store.YES));
        document.add(new StringField(FIELD_DOCUMENT_ID, chunk.documentId(), Field.Store.YES));
        document.add(new StringField(FIELD_SCOPE_ID, chunk.scopeId(), Field.Store.YES));
        document.add(new StringField(FIELD_PATH, chunk.path(), Field.Store.YES));
        document.add(new TextField(FIELD_CONTENT, chunk.content(), Field.Store.YES));
        return document;
    }
}
