package com.newsenricher.core.cache;

import com.newsenricher.core.error.CacheUnavailableException;
import com.newsenricher.core.model.CacheStats;
import com.newsenricher.core.model.ContentRecord;
import com.newsenricher.core.model.ResolutionRecord;
import com.newsenricher.core.util.ContentHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite 단일 파일 캐시.
 *
 * <ul>
 *   <li>스키마는 {@code schema.sql}을 시작 시마다 적용(IF NOT EXISTS라 재실행 안전).</li>
 *   <li>SQL은 {@link SqlLoader}로 {@code sql/*.sql}에서 읽는다.</li>
 *   <li>WAL 저널 + busy timeout: 여러 워커의 동시 읽기와 단일 쓰기를 허용.</li>
 *   <li>작업마다 커넥션을 열고 닫는다. 쓰기는 Java 쪽 락으로 직렬화.</li>
 *   <li>시각은 UTC {@code yyyy-MM-dd'T'HH:mm:ss.SSS} 문자열(사전순 = 시간순).</li>
 * </ul>
 */
public class SqliteCacheStore implements CacheStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteCacheStore.class);

    static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");
    static final int BUSY_TIMEOUT_MS = 5000;

    private final String dbUrl;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public SqliteCacheStore(Path dbFile) {
        this(dbFile, Clock.systemUTC());
    }

    public SqliteCacheStore(Path dbFile, Clock clock) {
        Objects.requireNonNull(dbFile, "dbFile");
        this.clock = Objects.requireNonNull(clock, "clock");
        Path abs = dbFile.toAbsolutePath();
        try {
            if (abs.getParent() != null) Files.createDirectories(abs.getParent());
        } catch (IOException e) {
            throw new CacheUnavailableException("Cannot create cache directory: " + abs.getParent(), e);
        }
        this.dbUrl = "jdbc:sqlite:" + abs;
        initialize();
    }

    Connection getConnection() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        Properties props = config.toProperties();
        return DriverManager.getConnection(dbUrl, props);
    }

    private void initialize() {
        LOG.info("Initializing cache at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new CacheUnavailableException("Cache initialization failed: " + dbUrl, e);
        }
    }

    /** schema.sql을 세미콜론 기준으로 나눠 한 문장씩 실행 */
    private void applySchema(Connection conn) throws SQLException {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql");
             Statement stmt = conn.createStatement()) {

            if (schemaStream == null) {
                throw new SQLException("schema.sql not found in classpath");
            }
            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            conn.setAutoCommit(false);
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty()) continue;
                stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.debug("Cache schema applied.");
        } catch (IOException | SQLException e) {
            if (!conn.getAutoCommit()) conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }

    // =====================================================================
    // Resolution
    // =====================================================================

    @Override
    public Optional<ResolutionRecord> getResolution(String indirectUrl) {
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-resolution"))) {
            ps.setString(1, indirectUrl);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapResolution(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new CacheUnavailableException("Resolution lookup failed", e);
        }
    }

    @Override
    public void saveResolution(String indirectUrl, String directUrl, String method, boolean success) {
        writeLock.lock();
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-resolution"))) {
            ps.setString(1, indirectUrl);
            ps.setString(2, directUrl);
            ps.setString(3, method);
            ps.setString(4, format(clock.instant()));
            ps.setBoolean(5, success);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new CacheUnavailableException("Resolution save failed", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<ResolutionRecord> successfulResolutions() {
        List<ResolutionRecord> out = new ArrayList<>();
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-successful-resolutions"));
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(mapResolution(rs));
            return out;
        } catch (SQLException e) {
            throw new CacheUnavailableException("Resolution listing failed", e);
        }
    }

    // =====================================================================
    // Content
    // =====================================================================

    @Override
    public Optional<ContentRecord> getContent(String url) {
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-content"))) {
            ps.setString(1, url);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapContent(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new CacheUnavailableException("Content lookup failed", e);
        }
    }

    @Override
    public void saveContent(String url, ContentRecord data) {
        Objects.requireNonNull(data, "data");
        String content = data.getContent();
        writeLock.lock();
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-content"))) {
            int i = 1;
            ps.setString(i++, url);
            ps.setString(i++, data.getTitle());
            ps.setString(i++, content);
            ps.setString(i++, data.getDateRaw());
            ps.setString(i++, data.getDateIso());
            ps.setString(i++, data.getAuthor());
            ps.setString(i++, data.getDescription());
            ps.setInt(i++, ContentHash.wordCount(content));
            ps.setInt(i++, data.getHttpStatus());
            ps.setString(i++, data.getExtractionMethod());
            ps.setString(i++, format(clock.instant()));
            ps.setString(i++, ContentHash.of(content));
            ps.setDouble(i, data.getConfidence());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new CacheUnavailableException("Content save failed", e);
        } finally {
            writeLock.unlock();
        }
    }

    // =====================================================================
    // Maintenance
    // =====================================================================

    @Override
    public int cleanup(int olderThanDays) {
        String cutoff = format(clock.instant().minus(Duration.ofDays(Math.max(0, olderThanDays))));
        writeLock.lock();
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement r = conn.prepareStatement(SqlLoader.load("delete-old-resolutions"));
                 PreparedStatement c = conn.prepareStatement(SqlLoader.load("delete-old-content"))) {
                r.setString(1, cutoff);
                c.setString(1, cutoff);
                int removed = r.executeUpdate() + c.executeUpdate();
                conn.commit();
                LOG.info("Cache cleanup: removed {} rows older than {} days", removed, olderThanDays);
                return removed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new CacheUnavailableException("Cache cleanup failed", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-cache-stats"));
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return new CacheStats(0, 0, 0);
            return new CacheStats(rs.getLong("total_resolutions"),
                    rs.getLong("successful_resolutions"),
                    rs.getLong("content_rows"));
        } catch (SQLException e) {
            throw new CacheUnavailableException("Cache stats failed", e);
        }
    }

    // =====================================================================
    // Row Mapping
    // =====================================================================

    private static ResolutionRecord mapResolution(ResultSet rs) throws SQLException {
        return new ResolutionRecord(
                rs.getString("indirect_url"),
                rs.getString("direct_url"),
                rs.getString("method"),
                parse(rs.getString("resolved_at")),
                Math.max(1, rs.getInt("attempts")),
                rs.getBoolean("success"));
    }

    private static ContentRecord mapContent(ResultSet rs) throws SQLException {
        return ContentRecord.builder()
                .url(rs.getString("url"))
                .title(rs.getString("title"))
                .content(rs.getString("content"))
                .dateRaw(rs.getString("date_raw"))
                .dateIso(rs.getString("date_iso"))
                .author(rs.getString("author"))
                .description(rs.getString("description"))
                .httpStatus(rs.getInt("http_status"))
                .extractionMethod(rs.getString("extraction_method"))
                .confidence(rs.getDouble("confidence"))
                .cachedAt(parse(rs.getString("cached_at")))
                .build();
    }

    static String format(Instant t) {
        return TS.format(LocalDateTime.ofInstant(t, ZoneOffset.UTC));
    }

    /** 저장 형식 외에 ISO(T 유무)도 허용. 못 읽으면 null */
    static Instant parse(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return LocalDateTime.parse(s, TS).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignore) {
            // 다른 형식 시도
        }
        try {
            return LocalDateTime.parse(s.trim().replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            LOG.debug("Unparseable cache timestamp: {}", s);
            return null;
        }
    }
}
