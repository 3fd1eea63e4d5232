package io.github.hunghhdev.cohortttl.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PgDocumentStoreTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Mock
    private PreparedStatement preparedStatement;

    @Mock
    private ResultSet resultSet;

    private PgDocumentStore store;
    private List<String> hookEvents;

    @BeforeEach
    void setUp() throws SQLException {
        // Use lenient() to prevent "unnecessary stubbing" errors
        lenient().when(dataSource.getConnection()).thenReturn(connection);
        lenient().when(connection.createStatement()).thenReturn(statement);
        lenient().when(connection.prepareStatement(anyString())).thenReturn(preparedStatement);
        lenient().when(preparedStatement.executeQuery()).thenReturn(resultSet);

        store = PgDocumentStore.builder()
                .dataSource(dataSource)
                .objectMapper(new ObjectMapper())
                .autoCreateTable(false)
                .build();

        hookEvents = new ArrayList<>();
        store.addHook(new DocumentHook() {
            @Override
            public void afterInsert(String resource, Document document) {
                hookEvents.add("insert:" + document.getId());
            }

            @Override
            public void afterUpdate(String resource, Document document) {
                hookEvents.add("update:" + document.getId());
            }

            @Override
            public void afterDelete(String resource, String id) {
                hookEvents.add("delete:" + id);
            }
        });
    }

    @Test
    void testInitializeTable() throws SQLException {
        // Arrange - Mock DatabaseMetaData
        DatabaseMetaData metaData = mock(DatabaseMetaData.class);
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getTables(null, null, "cohortttl_documents", new String[]{"TABLE"}))
                .thenReturn(resultSet);
        when(resultSet.next()).thenReturn(false); // Table doesn't exist

        // Act
        PgDocumentStore created = PgDocumentStore.builder()
                .dataSource(dataSource)
                .autoCreateTable(true)
                .build();

        // Assert
        assertEquals("cohortttl_documents", created.getTableName());
        verify(statement).execute(contains("CREATE TABLE IF NOT EXISTS cohortttl_documents"));
        verify(statement).execute(contains("CREATE INDEX IF NOT EXISTS cohortttl_documents_partition_idx"));
    }

    @Test
    void testGetReadsBodyAndRestoresId() throws SQLException {
        // Arrange
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getString("body")).thenReturn("{\"name\":\"alpha\",\"createdAt\":\"2024-03-01T10:00:00Z\"}");

        // Act
        Optional<Document> document = store.get("items", "1");

        // Assert
        assertTrue(document.isPresent());
        assertEquals("1", document.get().getId());
        assertEquals("alpha", document.get().getString("name"));
        verify(preparedStatement).setString(1, "items");
        verify(preparedStatement).setString(2, "1");
    }

    @Test
    void testGetMissingDocument() throws SQLException {
        when(resultSet.next()).thenReturn(false);

        assertFalse(store.get("items", "1").isPresent());
    }

    @Test
    void testInsertDuplicateThrows() throws SQLException {
        when(preparedStatement.executeUpdate()).thenReturn(0);

        assertThrows(StorageException.class, () -> store.insert("items", Document.of("1")));
        assertTrue(hookEvents.isEmpty());
    }

    @Test
    void testInsertStoresPartitionKey() throws SQLException {
        // Arrange
        store.declareResource("index", "cohort");
        when(preparedStatement.executeUpdate()).thenReturn(1);

        // Act
        store.insert("index", Document.of("e1", Collections.singletonMap("cohort", "2024-03-01T10")));

        // Assert
        verify(preparedStatement).setString(1, "index");
        verify(preparedStatement).setString(2, "e1");
        verify(preparedStatement).setString(3, "2024-03-01T10");
        assertEquals(Collections.singletonList("insert:e1"), hookEvents);
    }

    @Test
    void testPutFiresInsertThenUpdateHook() throws SQLException {
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getBoolean("inserted")).thenReturn(true, false);

        store.put("items", Document.of("1"));
        store.put("items", Document.of("1"));

        assertEquals(List.of("insert:1", "update:1"), hookEvents);
        verify(connection, times(2)).prepareStatement(contains("ON CONFLICT (resource, id) DO UPDATE"));
    }

    @Test
    void testPutRequiresId() {
        assertThrows(StorageException.class,
            () -> store.put("items", new Document(Collections.singletonMap("name", "a"))));
    }

    @Test
    void testUpdateMergesPatchWithoutId() throws SQLException {
        // Arrange
        store.declareResource("index", "cohort");
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getString("body")).thenReturn("{\"cohort\":\"2024-03-01T11\",\"recordId\":\"r1\"}");
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("id", "ignored");
        changes.put("cohort", "2024-03-01T11");

        // Act
        Optional<Document> updated = store.update("index", "e1", changes);

        // Assert
        assertTrue(updated.isPresent());
        assertEquals("e1", updated.get().getId());
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertTrue(sql.getValue().contains("body = body || ?::jsonb"));
        assertTrue(sql.getValue().contains("partition_key = ?"));
        verify(preparedStatement).setString(1, "{\"cohort\":\"2024-03-01T11\"}");
        verify(preparedStatement).setString(2, "2024-03-01T11");
        assertEquals(Collections.singletonList("update:e1"), hookEvents);
    }

    @Test
    void testUpdateMissingDocument() throws SQLException {
        when(resultSet.next()).thenReturn(false);

        assertFalse(store.update("items", "1", Collections.singletonMap("a", 1)).isPresent());
        assertTrue(hookEvents.isEmpty());
    }

    @Test
    void testDeleteFiresHookOnlyWhenRowRemoved() throws SQLException {
        when(preparedStatement.executeUpdate()).thenReturn(1, 0);

        assertTrue(store.delete("items", "1"));
        assertFalse(store.delete("items", "1"));

        assertEquals(Collections.singletonList("delete:1"), hookEvents);
    }

    @Test
    void testListByPartitionFetchesOneExtraRow() throws SQLException {
        // Arrange
        store.declareResource("index", "cohort");
        when(resultSet.next()).thenReturn(true, true, true, false);
        when(resultSet.getString("id")).thenReturn("a", "b");
        when(resultSet.getString("body")).thenReturn("{}");

        // Act
        DocumentPage page = store.listByPartition("index", "2024-03-01T10", "0", 2);

        // Assert
        assertEquals(2, page.getDocuments().size());
        assertEquals("b", page.getNextCursor());
        verify(connection).prepareStatement(contains("AND id > ?"));
        verify(preparedStatement).setString(3, "0");
        verify(preparedStatement).setInt(4, 3);
    }

    @Test
    void testListByPartitionRequiresDeclaredPartition() {
        assertThrows(StorageException.class, () -> store.listByPartition("items", "x", null, 10));
        assertThrows(StorageException.class, () -> store.listPartitions("items"));
    }

    @Test
    void testListPartitionsReadsDistinctValues() throws SQLException {
        // Arrange
        store.declareResource("index", "cohort");
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getString("partition_key")).thenReturn("2024-03-01T10", "2024-03-01T10:05");

        // Act
        List<String> partitions = store.listPartitions("index");

        // Assert
        assertEquals(List.of("2024-03-01T10", "2024-03-01T10:05"), partitions);
        verify(connection).prepareStatement(contains("SELECT DISTINCT partition_key"));
        verify(preparedStatement).setString(1, "index");
    }

    @Test
    void testSqlExceptionIsWrapped() throws SQLException {
        when(connection.prepareStatement(anyString())).thenThrow(new SQLException("relation does not exist"));

        StorageException e = assertThrows(StorageException.class, () -> store.get("items", "1"));
        assertTrue(e.getCause() instanceof SQLException);
    }

    @Test
    void testConnectionIsRetried() throws SQLException {
        when(dataSource.getConnection())
                .thenThrow(new SQLException("connection reset"))
                .thenReturn(connection);
        when(preparedStatement.executeUpdate()).thenReturn(1);

        assertTrue(store.delete("items", "1"));
        verify(dataSource, times(2)).getConnection();
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalStateException.class, () -> PgDocumentStore.builder().build());
        assertThrows(ConfigurationException.class,
            () -> PgDocumentStore.builder().dataSource(dataSource).tableName("docs; DROP TABLE x").build());
    }
}
