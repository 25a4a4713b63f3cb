package com.reviewsearch.indexer.backend;

import com.reviewsearch.indexer.document.IndexDocument;
import com.reviewsearch.indexer.document.IndexField;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes documents to a local Lucene index directory.
 *
 * <p>Tokenized fields become {@link TextField}s analyzed by {@link StandardAnalyzer};
 * untokenized fields become {@link StringField}s, indexed as a single exact term so that
 * deletes by id match.</p>
 */
public class LuceneSearchBackend implements SearchBackend {

    private static final Logger logger = LoggerFactory.getLogger(LuceneSearchBackend.class);

    private final Path indexDir;

    public LuceneSearchBackend(Path indexDir) {
        this.indexDir = indexDir;
    }

    @Override
    public String name() {
        return "lucene";
    }

    public Path indexDir() {
        return indexDir;
    }

    @Override
    public IndexWriterSession open(boolean truncate) throws SearchBackendException {
        Directory directory = null;
        try {
            Files.createDirectories(indexDir);
            directory = FSDirectory.open(indexDir);
            IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
            config.setOpenMode(truncate
                    ? IndexWriterConfig.OpenMode.CREATE
                    : IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            // only commit() publishes; closing an uncommitted session keeps the previous index
            config.setCommitOnClose(false);
            IndexWriter writer = new IndexWriter(directory, config);
            logger.info("Opened Lucene index at {} (truncate: {})", indexDir, truncate);
            return new LuceneWriterSession(directory, writer);
        } catch (IOException e) {
            closeQuietly(directory);
            throw new SearchBackendException("Failed to open Lucene index at " + indexDir, e);
        }
    }

    static Document toLuceneDocument(IndexDocument document) {
        Document doc = new Document();
        for (IndexField field : document.fields()) {
            Field.Store store = field.stored() ? Field.Store.YES : Field.Store.NO;
            String value = field.value() != null ? field.value() : "";
            if (field.tokenized()) {
                doc.add(new TextField(field.name(), value, store));
            } else {
                doc.add(new StringField(field.name(), value, store));
            }
        }
        return doc;
    }

    private static void closeQuietly(Directory directory) {
        if (directory == null) {
            return;
        }
        try {
            directory.close();
        } catch (IOException e) {
            logger.warn("Failed to close Lucene directory", e);
        }
    }

    private static final class LuceneWriterSession implements IndexWriterSession {

        private final Directory directory;
        private final IndexWriter writer;

        LuceneWriterSession(Directory directory, IndexWriter writer) {
            this.directory = directory;
            this.writer = writer;
        }

        @Override
        public void deleteDocument(String field, String value) throws IOException {
            writer.deleteDocuments(new Term(field, value));
        }

        @Override
        public void addDocument(IndexDocument document) throws IOException {
            writer.addDocument(toLuceneDocument(document));
        }

        @Override
        public void commit() throws IOException {
            writer.commit();
        }

        @Override
        public void optimize() throws IOException {
            writer.forceMerge(1);
        }

        @Override
        public void close() throws IOException {
            try {
                if (writer.hasUncommittedChanges()) {
                    logger.warn("Discarding uncommitted changes to Lucene index {}", directory);
                }
                writer.rollback();
            } finally {
                directory.close();
            }
        }
    }
}
