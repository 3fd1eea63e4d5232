package io.github.hunghhdev.cohortttl.core;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import javax.sql.DataSource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PgDocumentStore: {@link DocumentStore} over a single PostgreSQL table with a JSONB body column.
 *
 * <p>All resources share the table; rows are keyed by {@code (resource, id)} and carry the value of the
 * resource's declared partition attribute in {@code partition_key} for indexed partition listings.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Table initialization uses double-checked locking pattern</li>
 *   <li>Jackson ObjectMapper is thread-safe for read operations</li>
 *   <li>DataSource connections are obtained per operation</li>
 * </ul>
 */
public class PgDocumentStore implements DocumentStore {
    private static final Logger logger = LoggerFactory.getLogger(PgDocumentStore.class);
    private static final String DEFAULT_TABLE_NAME = "cohortttl_documents";
    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]{0,62}");
    private static final TypeReference<LinkedHashMap<String, Object>> BODY_TYPE =
        new TypeReference<LinkedHashMap<String, Object>>() {};

    // Connection retry configuration
    private static final int MAX_RETRY_ATTEMPTS = 3;
    private static final int RETRY_DELAY_MS = 100;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final String tableName;
    private final Map<String, String> partitionFields = new ConcurrentHashMap<>();
    private final DocumentHookDispatcher hooks = new DocumentHookDispatcher();

    // Thread-safe initialization flag using double-checked locking pattern
    private volatile boolean tableInitialized = false;

    private PgDocumentStore(DataSource dataSource, ObjectMapper objectMapper, String tableName, boolean autoCreateTable) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
        this.tableName = tableName;

        if (autoCreateTable) {
            initializeTable();
        }
    }

    /**
     * Initializes the document table if it doesn't exist.
     * Uses double-checked locking pattern for thread safety.
     */
    private void initializeTable() {
        if (!tableInitialized) {
            synchronized (this) {
                if (!tableInitialized) {
                    performTableInitialization();
                    tableInitialized = true;
                }
            }
        }
    }

    private void performTableInitialization() {
        try (Connection conn = getValidatedConnection();
             Statement stmt = conn.createStatement()) {

            boolean tableExists;
            try (ResultSet rs = conn.getMetaData().getTables(null, null, tableName, new String[] {"TABLE"})) {
                tableExists = rs.next();
            }

            stmt.execute("CREATE TABLE IF NOT EXISTS " + tableName + " (" +
                "  resource TEXT NOT NULL, " +
                "  id TEXT NOT NULL, " +
                "  partition_key TEXT, " +
                "  body JSONB NOT NULL, " +
                "  updated_at TIMESTAMP DEFAULT now(), " +
                "  PRIMARY KEY (resource, id)" +
                ")");
            // Partition listings are keyset-paginated by id
            stmt.execute("CREATE INDEX IF NOT EXISTS " + tableName + "_partition_idx " +
                "ON " + tableName + " (resource, partition_key, id) " +
                "WHERE partition_key IS NOT NULL");

            if (!tableExists) {
                logger.info("Table '{}' was created successfully", tableName);
            } else {
                logger.debug("Table '{}' already exists, skipping creation", tableName);
            }
        } catch (SQLException e) {
            logger.error("Failed to initialize document table", e);
            throw new StorageException("Failed to initialize document table", e);
        }
    }

    @Override
    public void declareResource(String resource, String partitionField) {
        requireResource(resource);
        if (partitionField != null) {
            partitionFields.put(resource, partitionField);
        } else {
            partitionFields.remove(resource);
        }
    }

    @Override
    public Optional<Document> get(String resource, String id) {
        requireResource(resource);
        if (id == null) {
            return Optional.empty();
        }
        String sql = "SELECT body FROM " + tableName + " WHERE resource = ? AND id = ?";

        try (Connection conn = getValidatedConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, resource);
            stmt.setString(2, id);

            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readBody(id, rs.getString("body")));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read '" + resource + ":" + id + "'", e);
        }
    }

    @Override
    public Document insert(String resource, Document document) {
        requireResource(resource);
        Document toStore = document.hasId() ? document : document.with(Document.ID, UUID.randomUUID().toString());

        String sql = "INSERT INTO " + tableName +
                     " (resource, id, partition_key, body, updated_at) " +
                     "VALUES (?, ?, ?, ?::jsonb, now()) " +
                     "ON CONFLICT (resource, id) DO NOTHING";

        int inserted;
        try (Connection conn = getValidatedConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, resource);
            stmt.setString(2, toStore.getId());
            stmt.setString(3, partitionValue(resource, toStore));
            stmt.setString(4, writeBody(toStore));

            inserted = stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to insert into '" + resource + "'", e);
        }
        if (inserted == 0) {
            throw new StorageException("Document '" + toStore.getId() + "' already exists in '" + resource + "'");
        }
        hooks.fireAfterInsert(resource, toStore);
        return toStore;
    }

    @Override
    public Document put(String resource, Document document) {
        requireResource(resource);
        if (!document.hasId()) {
            throw new StorageException("Document id is required for put into '" + resource + "'");
        }

        // xmax is 0 only for rows created by this statement
        String sql = "INSERT INTO " + tableName +
                     " (resource, id, partition_key, body, updated_at) " +
                     "VALUES (?, ?, ?, ?::jsonb, now()) " +
                     "ON CONFLICT (resource, id) DO UPDATE SET " +
                     "partition_key = EXCLUDED.partition_key, " +
                     "body = EXCLUDED.body, " +
                     "updated_at = EXCLUDED.updated_at " +
                     "RETURNING (xmax = 0) AS inserted";

        boolean created;
        try (Connection conn = getValidatedConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, resource);
            stmt.setString(2, document.getId());
            stmt.setString(3, partitionValue(resource, document));
            stmt.setString(4, writeBody(document));

            try (ResultSet rs = stmt.executeQuery()) {
                created = rs.next() && rs.getBoolean("inserted");
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to put '" + resource + ":" + document.getId() + "'", e);
        }
        if (created) {
            hooks.fireAfterInsert(resource, document);
        } else {
            hooks.fireAfterUpdate(resource, document);
        }
        return document;
    }

    @Override
    public Optional<Document> update(String resource, String id, Map<String, ?> changes) {
        requireResource(resource);
        if (id == null) {
            return Optional.empty();
        }
        Map<String, Object> patch = new LinkedHashMap<>(changes);
        patch.remove(Document.ID);

        String partitionField = partitionFields.get(resource);
        boolean movesPartition = partitionField != null && patch.containsKey(partitionField);
        String sql = "UPDATE " + tableName +
                     " SET body = body || ?::jsonb, " +
                     (movesPartition ? "partition_key = ?, " : "") +
                     "updated_at = now() " +
                     "WHERE resource = ? AND id = ? " +
                     "RETURNING body";

        Document updated;
        try (Connection conn = getValidatedConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            int index = 1;
            stmt.setString(index++, writeBody(patch));
            if (movesPartition) {
                Object value = patch.get(partitionField);
                stmt.setString(index++, value != null ? value.toString() : null);
            }
            stmt.setString(index++, resource);
            stmt.setString(index, id);

            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                updated = readBody(id, rs.getString("body"));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to update '" + resource + ":" + id + "'", e);
        }
        hooks.fireAfterUpdate(resource, updated);
        return Optional.of(updated);
    }

    @Override
    public boolean delete(String resource, String id) {
        requireResource(resource);
        if (id == null) {
            return false;
        }
        String sql = "DELETE FROM " + tableName + " WHERE resource = ? AND id = ?";

        int deleted;
        try (Connection conn = getValidatedConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, resource);
            stmt.setString(2, id);
            deleted = stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to delete '" + resource + ":" + id + "'", e);
        }
        if (deleted > 0) {
            hooks.fireAfterDelete(resource, id);
            return true;
        }
        return false;
    }

    @Override
    public DocumentPage listByPartition(String resource, String partitionValue, String afterId, int limit) {
        requireResource(resource);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (!partitionFields.containsKey(resource)) {
            throw new StorageException("Resource '" + resource + "' has no partition declared");
        }

        // One extra row tells whether another page follows
        String sql = "SELECT id, body FROM " + tableName +
                     " WHERE resource = ? AND partition_key = ?" +
                     (afterId != null ? " AND id > ?" : "") +
                     " ORDER BY id LIMIT ?";

        try (Connection conn = getValidatedConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            int index = 1;
            stmt.setString(index++, resource);
            stmt.setString(index++, partitionValue);
            if (afterId != null) {
                stmt.setString(index++, afterId);
            }
            stmt.setInt(index, limit + 1);

            List<Document> documents = new ArrayList<>();
            boolean more = false;
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    if (documents.size() == limit) {
                        more = true;
                        break;
                    }
                    documents.add(readBody(rs.getString("id"), rs.getString("body")));
                }
            }
            String nextCursor = more ? documents.get(documents.size() - 1).getId() : null;
            return new DocumentPage(documents, nextCursor);
        } catch (SQLException e) {
            throw new StorageException("Failed to list partition '" + partitionValue + "' of '" + resource + "'", e);
        }
    }

    @Override
    public List<String> listPartitions(String resource) {
        requireResource(resource);
        if (!partitionFields.containsKey(resource)) {
            throw new StorageException("Resource '" + resource + "' has no partition declared");
        }
        String sql = "SELECT DISTINCT partition_key FROM " + tableName +
                     " WHERE resource = ? AND partition_key IS NOT NULL ORDER BY partition_key";

        try (Connection conn = getValidatedConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, resource);
            List<String> partitions = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    partitions.add(rs.getString("partition_key"));
                }
            }
            return partitions;
        } catch (SQLException e) {
            throw new StorageException("Failed to list partitions of '" + resource + "'", e);
        }
    }

    @Override
    public void addHook(DocumentHook hook) {
        hooks.add(hook);
    }

    @Override
    public void removeHook(DocumentHook hook) {
        hooks.remove(hook);
    }

    /**
     * Checks if the document table exists in the database.
     *
     * @return true if the table exists, false otherwise
     */
    public boolean tableExists() {
        try (Connection conn = getValidatedConnection()) {
            try (ResultSet tables = conn.getMetaData().getTables(null, null, tableName, new String[] {"TABLE"})) {
                return tables.next();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to check if table exists", e);
        }
    }

    public String getTableName() {
        return tableName;
    }

    private String partitionValue(String resource, Document document) {
        String partitionField = partitionFields.get(resource);
        return partitionField != null ? document.getString(partitionField) : null;
    }

    private String writeBody(Document document) {
        return writeBody(document.asMap());
    }

    private String writeBody(Map<String, ?> fields) {
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize document", e);
        }
    }

    private Document readBody(String id, String json) {
        try {
            LinkedHashMap<String, Object> fields = objectMapper.readValue(json, BODY_TYPE);
            fields.put(Document.ID, id);
            return new Document(fields);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to deserialize document '" + id + "'", e);
        }
    }

    /**
     * Gets a connection from the DataSource with retry logic for transient failures.
     *
     * @return a database connection
     * @throws SQLException if unable to obtain a connection after retries
     */
    private Connection getValidatedConnection() throws SQLException {
        SQLException lastException = null;

        for (int attempt = 1; attempt <= MAX_RETRY_ATTEMPTS; attempt++) {
            try {
                return dataSource.getConnection();
            } catch (SQLException e) {
                lastException = e;
                logger.warn("Connection attempt {} failed: {}", attempt, e.getMessage());

                if (attempt < MAX_RETRY_ATTEMPTS) {
                    try {
                        Thread.sleep((long) RETRY_DELAY_MS * attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new SQLException("Connection retry interrupted", ie);
                    }
                }
            }
        }

        throw new SQLException("Failed to obtain connection after " + MAX_RETRY_ATTEMPTS + " attempts", lastException);
    }

    private static void requireResource(String resource) {
        if (resource == null || resource.isEmpty()) {
            throw new StorageException("Resource name cannot be null or empty");
        }
    }

    /**
     * Creates a builder for PgDocumentStore.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for PgDocumentStore.
     */
    public static class Builder {
        private DataSource dataSource;
        private ObjectMapper objectMapper;
        private String tableName = DEFAULT_TABLE_NAME;
        private boolean autoCreateTable = true;

        private Builder() {
        }

        /**
         * Sets the data source.
         *
         * @param dataSource the PostgreSQL data source
         * @return this builder
         */
        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        /**
         * Sets the object mapper used for the JSONB body. Defaults to a mapper with
         * {@link JavaTimeModule} registered and ISO-8601 date output.
         *
         * @param objectMapper the object mapper
         * @return this builder
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Sets the table that holds all documents.
         *
         * @param tableName an unquoted PostgreSQL identifier
         * @return this builder
         */
        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        /**
         * Sets whether to automatically create the table if it doesn't exist.
         *
         * @param autoCreateTable true to auto-create table, false otherwise
         * @return this builder
         */
        public Builder autoCreateTable(boolean autoCreateTable) {
            this.autoCreateTable = autoCreateTable;
            return this;
        }

        /**
         * Builds a new PgDocumentStore instance.
         *
         * @return a new PgDocumentStore instance
         * @throws IllegalStateException if dataSource is not set
         * @throws ConfigurationException if the table name is not a plain identifier
         */
        public PgDocumentStore build() {
            if (dataSource == null) {
                throw new IllegalStateException("DataSource must be set");
            }
            if (tableName == null || !TABLE_NAME_PATTERN.matcher(tableName).matches()) {
                throw new ConfigurationException("Invalid table name: " + tableName);
            }
            if (objectMapper == null) {
                objectMapper = new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            }
            return new PgDocumentStore(dataSource, objectMapper, tableName, autoCreateTable);
        }
    }
}
