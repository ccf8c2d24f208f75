package com.pubannotator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Service for persisting annotated records to PostgreSQL.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Creates the {@code annotated_records} table (primary key {@code id}) on demand.</li>
 *   <li>Writes entries with {@code INSERT ... ON CONFLICT (id) DO UPDATE}; an identical rewrite
 *       matches no row in the update's {@code WHERE} clause and leaves the row untouched.</li>
 *   <li>Stores the annotation and metadata as JSONB, serialized with Jackson.</li>
 *   <li>Reports every {@link SQLException} as a {@link PersistenceException}; nothing is retried here.</li>
 * </ul>
 * A new connection is opened per call, so concurrent upserts for different ids are independent.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public class PostgresService implements PersistenceServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> ANNOTATION_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private static final String COLUMNS = "id, identity_key, source_locator, status, title, category, content, "
        + "annotation, metadata, attempts, last_error, created_at, updated_at";

    private static final String UPSERT_SQL = "INSERT INTO annotated_records (" + COLUMNS + ") "
        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
        + "ON CONFLICT (id) DO UPDATE SET "
        + "identity_key = EXCLUDED.identity_key, source_locator = EXCLUDED.source_locator, "
        + "status = EXCLUDED.status, title = EXCLUDED.title, category = EXCLUDED.category, "
        + "content = EXCLUDED.content, annotation = EXCLUDED.annotation, metadata = EXCLUDED.metadata, "
        + "attempts = EXCLUDED.attempts, last_error = EXCLUDED.last_error, updated_at = EXCLUDED.updated_at "
        + "WHERE (annotated_records.identity_key, annotated_records.source_locator, annotated_records.status, "
        + "annotated_records.title, annotated_records.category, annotated_records.content, "
        + "annotated_records.annotation, annotated_records.metadata, annotated_records.attempts, "
        + "annotated_records.last_error) IS DISTINCT FROM (EXCLUDED.identity_key, EXCLUDED.source_locator, "
        + "EXCLUDED.status, EXCLUDED.title, EXCLUDED.category, EXCLUDED.content, EXCLUDED.annotation, "
        + "EXCLUDED.metadata, EXCLUDED.attempts, EXCLUDED.last_error)";

    private final String url;
    private final String user;
    private final String password;

    /**
     * Constructs a PostgresService with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresService(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public void createTables() throws PersistenceException {
        String table = "CREATE TABLE IF NOT EXISTS annotated_records (" +
                "id TEXT PRIMARY KEY, " +
                "identity_key TEXT NOT NULL, " +
                "source_locator TEXT, " +
                "status TEXT NOT NULL, " +
                "title TEXT, category TEXT, content TEXT, " +
                "annotation JSONB, metadata JSONB, " +
                "attempts INTEGER NOT NULL DEFAULT 0, last_error TEXT, " +
                "created_at TIMESTAMPTZ NOT NULL, updated_at TIMESTAMPTZ NOT NULL" +
                ")";
        String index = "CREATE INDEX IF NOT EXISTS annotated_records_identity_key_idx ON annotated_records (identity_key)";
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(table);
            stmt.execute(index);
            logger.info("Ensured annotated_records table exists.");
        } catch (SQLException e) {
            throw new PersistenceException("Error creating tables: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean alreadyProcessed(String id) throws PersistenceException {
        return exists("SELECT 1 FROM annotated_records WHERE id = ? AND annotation IS NOT NULL", id);
    }

    @Override
    public boolean markedFailed(String id) throws PersistenceException {
        return exists("SELECT 1 FROM annotated_records WHERE id = ? AND status = '" + RecordStatus.FAILED.name() + "'", id);
    }

    private boolean exists(String sql, String id) throws PersistenceException {
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Error looking up entry " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, String> idsByIdentityKey() throws PersistenceException {
        String sql = "SELECT identity_key, id FROM annotated_records ORDER BY created_at, id";
        Map<String, String> ids = new HashMap<>();
        try (Connection conn = connect(); Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                ids.putIfAbsent(rs.getString("identity_key"), rs.getString("id"));
            }
        } catch (SQLException e) {
            throw new PersistenceException("Error reading stored ids: " + e.getMessage(), e);
        }
        logger.debug("Loaded {} stored id(s).", ids.size());
        return ids;
    }

    @Override
    public void upsert(PersistedEntry entry) throws PersistenceException {
        if (entry == null) {
            throw new PersistenceException("Cannot upsert a null entry");
        }
        String annotationJson;
        String metadataJson;
        try {
            annotationJson = entry.annotation() == null ? null : MAPPER.writeValueAsString(entry.annotation());
            metadataJson = MAPPER.writeValueAsString(entry.metadata());
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Error serializing entry " + entry.id() + ": " + e.getMessage(), e);
        }
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, entry.id());
            ps.setString(2, entry.identityKey());
            ps.setString(3, entry.sourceLocator());
            ps.setString(4, entry.status().name());
            ps.setString(5, entry.title());
            ps.setString(6, entry.category());
            ps.setString(7, entry.content());
            ps.setObject(8, annotationJson, Types.OTHER);
            ps.setObject(9, metadataJson, Types.OTHER);
            ps.setInt(10, entry.attempts());
            ps.setString(11, entry.lastError());
            ps.setObject(12, toTimestamp(entry.createdAt()));
            ps.setObject(13, toTimestamp(entry.updatedAt()));
            int changed = ps.executeUpdate();
            logger.debug("Upserted entry {} ({} row(s) changed).", entry.id(), changed);
        } catch (SQLException e) {
            throw new PersistenceException("Error upserting entry " + entry.id() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<PersistedEntry> find(String id) throws PersistenceException {
        String sql = "SELECT " + COLUMNS + " FROM annotated_records WHERE id = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                String annotation = rs.getString("annotation");
                String metadata = rs.getString("metadata");
                return Optional.of(new PersistedEntry(
                    rs.getString("id"),
                    rs.getString("identity_key"),
                    rs.getString("source_locator"),
                    RecordStatus.valueOf(rs.getString("status")),
                    rs.getString("title"),
                    rs.getString("category"),
                    rs.getString("content"),
                    annotation == null ? null : MAPPER.readValue(annotation, ANNOTATION_TYPE),
                    metadata == null ? Map.of() : MAPPER.readValue(metadata, METADATA_TYPE),
                    rs.getInt("attempts"),
                    rs.getString("last_error"),
                    rs.getObject("created_at", OffsetDateTime.class).toInstant(),
                    rs.getObject("updated_at", OffsetDateTime.class).toInstant()
                ));
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new PersistenceException("Error reading entry " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int count() throws PersistenceException {
        try (Connection conn = connect(); Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM annotated_records")) {
            rs.next();
            return rs.getInt(1);
        } catch (SQLException e) {
            throw new PersistenceException("Error counting entries: " + e.getMessage(), e);
        }
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant == null ? Instant.now() : instant, ZoneOffset.UTC);
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(Paths.get(dataDir))
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (Exception e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new IllegalStateException("Embedded PostgreSQL did not start", e);
        }
    }
}
