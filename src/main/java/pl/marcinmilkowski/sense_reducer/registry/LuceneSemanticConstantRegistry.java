package pl.marcinmilkowski.sense_reducer.registry;

import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_reducer.model.ConstantStatus;
import pl.marcinmilkowski.sense_reducer.model.SemanticConstant;
import pl.marcinmilkowski.sense_reducer.model.WitnessKey;
import pl.marcinmilkowski.sense_reducer.normalize.GlossNormalizer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Registry persisted in an embedded Lucene index, one document per constant.
 *
 * <p>Every mutation is written through and committed before it becomes visible, so the
 * store survives restarts. All constants are read back into memory when the index is
 * opened. Any I/O failure surfaces as {@link RegistryUnavailableException}.</p>
 */
public class LuceneSemanticConstantRegistry extends AbstractSemanticConstantRegistry {

    private static final Logger logger = LoggerFactory.getLogger(LuceneSemanticConstantRegistry.class);

    static final String SCHEMA_VERSION = "1";

    static final String FIELD_CONSTANT_ID = "constant_id";
    static final String FIELD_CANONICAL_LABEL = "canonical_label";
    static final String FIELD_DESCRIPTION = "description";
    static final String FIELD_DOMAINS = "domains";
    static final String FIELD_STATUS = "status";
    static final String FIELD_CREATED_FROM = "created_from";
    static final String FIELD_CREATED_AT = "created_at";
    static final String FIELD_CURATED_AT = "curated_at";
    static final String FIELD_SCHEMA_VERSION = "schema_version";

    private final Path indexPath;
    private final Directory directory;
    private final IndexWriter writer;

    private LuceneSemanticConstantRegistry(Path indexPath, Directory directory, IndexWriter writer,
                                           GlossNormalizer normalizer, double matchThreshold, Clock clock) {
        super(normalizer, matchThreshold, clock);
        this.indexPath = indexPath;
        this.directory = directory;
        this.writer = writer;
    }

    /**
     * Open (or create) the registry index at {@code indexPath} and load its constants.
     *
     * @throws RegistryUnavailableException if the index cannot be opened or read
     */
    public static LuceneSemanticConstantRegistry open(Path indexPath, GlossNormalizer normalizer,
                                                      double matchThreshold, Clock clock) {
        Directory directory;
        try {
            Files.createDirectories(indexPath);
            directory = FSDirectory.open(indexPath);
        } catch (IOException e) {
            throw new RegistryUnavailableException("Cannot open registry at " + indexPath + ": " + e.getMessage(), e);
        }
        return open(indexPath, directory, normalizer, matchThreshold, clock);
    }

    /**
     * Open the registry on an already opened directory. The registry takes ownership of
     * {@code directory} and closes it, also when opening fails.
     */
    static LuceneSemanticConstantRegistry open(Path indexPath, Directory directory, GlossNormalizer normalizer,
                                               double matchThreshold, Clock clock) {
        IndexWriter writer = null;
        try {
            IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            writer = new IndexWriter(directory, config);

            LuceneSemanticConstantRegistry registry = new LuceneSemanticConstantRegistry(
                indexPath, directory, writer, normalizer, matchThreshold, clock);
            List<SemanticConstant> stored = readAll(writer);
            registry.preload(stored);
            logger.info("Opened semantic constant registry at {} ({} constants)", indexPath, stored.size());
            return registry;
        } catch (IOException | RuntimeException e) {
            closeAfterFailure(writer, directory, e);
            throw new RegistryUnavailableException("Cannot open registry at " + indexPath + ": " + e.getMessage(), e);
        }
    }

    public static LuceneSemanticConstantRegistry open(Path indexPath, GlossNormalizer normalizer) {
        return open(indexPath, normalizer, DEFAULT_MATCH_THRESHOLD, Clock.systemUTC());
    }

    /**
     * Write and commit one constant. When the write or commit fails, uncommitted changes are
     * rolled back and the writer is closed, so a later commit can never persist a constant
     * the cache did not accept. The registry is unavailable from then on.
     */
    @Override
    protected void persist(SemanticConstant constant) {
        if (!writer.isOpen()) {
            throw new RegistryUnavailableException("Registry at " + indexPath + " is closed");
        }
        try {
            writer.updateDocument(new Term(FIELD_CONSTANT_ID, constant.constantId()), toDocument(constant));
            writer.commit();
        } catch (IOException | AlreadyClosedException e) {
            RegistryUnavailableException failure = new RegistryUnavailableException(
                "Cannot write constant " + constant.constantId() + " to " + indexPath + ": " + e.getMessage(), e);
            rollbackAfterFailure(failure);
            throw failure;
        }
    }

    private void rollbackAfterFailure(RegistryUnavailableException failure) {
        if (!writer.isOpen()) {
            return;
        }
        try {
            writer.rollback();
            logger.warn("Rolled back registry at {} after a failed write; registry closed", indexPath);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public void close() {
        try {
            writer.close();
            directory.close();
            logger.debug("Closed semantic constant registry at {}", indexPath);
        } catch (IOException e) {
            throw new RegistryUnavailableException("Cannot close registry at " + indexPath + ": " + e.getMessage(), e);
        }
    }

    static Document toDocument(SemanticConstant constant) {
        Document doc = new Document();
        doc.add(new StringField(FIELD_CONSTANT_ID, constant.constantId(), Field.Store.YES));
        doc.add(new StoredField(FIELD_CANONICAL_LABEL, constant.canonicalLabel()));
        doc.add(new StoredField(FIELD_DESCRIPTION, constant.description()));
        for (String domain : constant.domains()) {
            doc.add(new StoredField(FIELD_DOMAINS, domain));
        }
        doc.add(new StringField(FIELD_STATUS, constant.status().getCode(), Field.Store.YES));
        for (WitnessKey key : constant.createdFrom()) {
            doc.add(new StoredField(FIELD_CREATED_FROM, key.toString()));
        }
        doc.add(new StoredField(FIELD_CREATED_AT, constant.createdAt().toString()));
        if (constant.curatedAt() != null) {
            doc.add(new StoredField(FIELD_CURATED_AT, constant.curatedAt().toString()));
        }
        doc.add(new StoredField(FIELD_SCHEMA_VERSION, SCHEMA_VERSION));
        return doc;
    }

    static SemanticConstant fromDocument(Document doc) {
        String id = doc.get(FIELD_CONSTANT_ID);
        String version = doc.get(FIELD_SCHEMA_VERSION);
        if (!SCHEMA_VERSION.equals(version)) {
            throw new IllegalStateException("Constant " + id + " has unsupported schema version " + version);
        }
        Set<String> domains = new LinkedHashSet<>();
        for (IndexableField field : doc.getFields(FIELD_DOMAINS)) {
            domains.add(field.stringValue());
        }
        List<WitnessKey> createdFrom = new ArrayList<>();
        for (IndexableField field : doc.getFields(FIELD_CREATED_FROM)) {
            createdFrom.add(WitnessKey.parse(field.stringValue()));
        }
        try {
            String curatedAt = doc.get(FIELD_CURATED_AT);
            return new SemanticConstant(
                id,
                doc.get(FIELD_CANONICAL_LABEL),
                doc.get(FIELD_DESCRIPTION),
                domains,
                ConstantStatus.fromCode(doc.get(FIELD_STATUS)),
                createdFrom,
                Instant.parse(doc.get(FIELD_CREATED_AT)),
                curatedAt != null ? Instant.parse(curatedAt) : null);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Constant " + id + " has an invalid timestamp", e);
        }
    }

    private static List<SemanticConstant> readAll(IndexWriter writer) throws IOException {
        List<SemanticConstant> constants = new ArrayList<>();
        try (DirectoryReader reader = DirectoryReader.open(writer)) {
            IndexSearcher searcher = new IndexSearcher(reader);
            int count = searcher.count(new MatchAllDocsQuery());
            if (count == 0) {
                return constants;
            }
            TopDocs docs = searcher.search(new MatchAllDocsQuery(), count);
            StoredFields storedFields = searcher.storedFields();
            for (ScoreDoc hit : docs.scoreDocs) {
                constants.add(fromDocument(storedFields.document(hit.doc)));
            }
        }
        return constants;
    }

    private static void closeAfterFailure(IndexWriter writer, Directory directory, Exception failure) {
        try {
            if (writer != null) writer.close();
            if (directory != null) directory.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
