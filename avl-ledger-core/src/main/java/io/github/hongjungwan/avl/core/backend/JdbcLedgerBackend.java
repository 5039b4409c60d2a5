package io.github.hongjungwan.avl.core.backend;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import io.github.hongjungwan.avl.api.config.AvlConfig;
import io.github.hongjungwan.avl.api.domain.BackendStats;
import io.github.hongjungwan.avl.api.domain.ChainTail;
import io.github.hongjungwan.avl.api.domain.Checkpoint;
import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.RecordKind;
import io.github.hongjungwan.avl.api.domain.RecordSignature;
import io.github.hongjungwan.avl.api.domain.SearchQuery;
import io.github.hongjungwan.avl.api.exception.BackendUnavailableException;
import io.github.hongjungwan.avl.core.canonical.CanonicalEncoder;
import io.github.hongjungwan.avl.spi.LedgerBackend;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 관계형 DB 저장소 (HikariCP 커넥션 풀 + 순수 JDBC).
 *
 * <p>{@code UNIQUE(anchor_id, seq)} 제약이 같은 위치에 대한 경합 쓰기를 막는다.
 * 모든 statement는 operationTimeout 기반 query timeout을 사용하고, 커넥션 획득도 같은 시간으로 제한된다.</p>
 */
@Slf4j
public class JdbcLedgerBackend implements LedgerBackend {

    public static final String NAME = "durable";

    private static final String RECORD_COLUMNS = "record_id, anchor_id, seq, slot, kind, ts, prev_hash, record_hash,"
            + " payload, sig_alg, sig_key_ref, sig, producer, schema_version";

    private static final String CHECKPOINT_COLUMNS = "checkpoint_id, anchor_id, range_start_seq, range_end_seq,"
            + " range_start, range_end, merkle_root, prev_root, hash_alg, sig_alg, sig_key_ref, sig,"
            + " created_at, record_count";

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final int queryTimeoutSeconds;
    private final CanonicalEncoder encoder;

    public JdbcLedgerBackend(DataSource dataSource, SqlDialect dialect, Duration operationTimeout,
                             CanonicalEncoder encoder) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.queryTimeoutSeconds = (int) Math.max(1, (operationTimeout.toMillis() + 999) / 1000);
        this.encoder = encoder;
        initializeSchema();
    }

    /**
     * 설정으로 커넥션 풀을 만들고 스키마를 준비.
     *
     * @throws BackendUnavailableException DB에 연결할 수 없음
     */
    public static JdbcLedgerBackend connect(AvlConfig config, CanonicalEncoder encoder) {
        long timeoutMs = Math.max(250, config.getOperationTimeout().toMillis());

        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("avl-ledger");
        hikari.setJdbcUrl(config.getJdbcUrl());
        hikari.setUsername(config.getJdbcUsername());
        hikari.setPassword(config.getJdbcPassword());
        hikari.setMaximumPoolSize(config.getPoolSize());
        hikari.setMinimumIdle(Math.min(1, config.getPoolSize()));
        hikari.setConnectionTimeout(timeoutMs);
        hikari.setValidationTimeout(Math.min(timeoutMs, 5_000));
        hikari.setInitializationFailTimeout(timeoutMs);

        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(hikari);
        } catch (HikariPool.PoolInitializationException e) {
            throw new BackendUnavailableException(NAME, "Cannot open connection pool to " + redact(config.getJdbcUrl()), e);
        }

        try {
            JdbcLedgerBackend backend = new JdbcLedgerBackend(dataSource, SqlDialect.fromJdbcUrl(config.getJdbcUrl()),
                    config.getOperationTimeout(), encoder);
            log.info("Durable backend connected: {} (pool size {})", redact(config.getJdbcUrl()), config.getPoolSize());
            return backend;
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    private static String redact(String jdbcUrl) {
        int query = jdbcUrl.indexOf('?');
        return query < 0 ? jdbcUrl : jdbcUrl.substring(0, query);
    }

    private void initializeSchema() {
        inConnection("initialize schema", connection -> {
            try (Statement statement = connection.createStatement()) {
                statement.setQueryTimeout(queryTimeoutSeconds);
                for (String ddl : dialect.schemaStatements()) {
                    statement.execute(ddl);
                }
            }
            return null;
        });
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<ChainTail> tail(String anchorId) {
        return inConnection("tail", connection -> {
            try (PreparedStatement ps = prepare(connection,
                    "SELECT seq, record_hash, record_id FROM avl_records WHERE anchor_id = ? ORDER BY seq DESC LIMIT 1")) {
                ps.setString(1, anchorId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new ChainTail(rs.getLong(1), rs.getString(2), rs.getString(3)));
                }
            }
        });
    }

    @Override
    public void append(LedgerRecord record) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = prepare(connection,
                     "INSERT INTO avl_records (" + RECORD_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            bindRecord(ps, record);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new SequenceConflictException(record.getAnchorId(), record.getSequence(), e);
            }
            throw unavailable("append", e);
        }
    }

    /** 단일 트랜잭션 배치 insert (backfill) */
    @Override
    public void appendAll(List<LedgerRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        LedgerRecord current = records.get(0);
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try (PreparedStatement ps = prepare(connection,
                    "INSERT INTO avl_records (" + RECORD_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                for (LedgerRecord record : records) {
                    current = record;
                    bindRecord(ps, record);
                    ps.executeUpdate();
                }
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new SequenceConflictException(current.getAnchorId(), current.getSequence(), e);
            }
            throw unavailable("appendAll", e);
        }
    }

    @Override
    public List<LedgerRecord> fetch(String anchorId, long fromSeq, long toSeq, int limit) {
        if (limit <= 0 || toSeq < fromSeq) {
            return List.of();
        }
        return inConnection("fetch", connection -> {
            try (PreparedStatement ps = prepare(connection, "SELECT " + RECORD_COLUMNS
                    + " FROM avl_records WHERE anchor_id = ? AND seq BETWEEN ? AND ? ORDER BY seq LIMIT ?")) {
                ps.setString(1, anchorId);
                ps.setLong(2, fromSeq);
                ps.setLong(3, toSeq);
                ps.setInt(4, limit);
                return readRecords(ps);
            }
        });
    }

    @Override
    public Optional<LedgerRecord> findById(String recordId) {
        return findOne("findById", "record_id", recordId);
    }

    @Override
    public Optional<LedgerRecord> findByHash(String hash) {
        return findOne("findByHash", "record_hash", hash);
    }

    private Optional<LedgerRecord> findOne(String operation, String column, String value) {
        return inConnection(operation, connection -> {
            try (PreparedStatement ps = prepare(connection,
                    "SELECT " + RECORD_COLUMNS + " FROM avl_records WHERE " + column + " = ?")) {
                ps.setString(1, value);
                return readRecords(ps).stream().findFirst();
            }
        });
    }

    @Override
    public List<LedgerRecord> search(SearchQuery query) {
        StringBuilder sql = new StringBuilder("SELECT ").append(RECORD_COLUMNS).append(" FROM avl_records WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (query.getSlot() != null) {
            sql.append(" AND slot = ?");
            params.add(query.getSlot());
        }
        if (query.getKind() != null) {
            sql.append(" AND kind = ?");
            params.add(query.getKind().code());
        }
        if (query.getSince() != null) {
            sql.append(" AND ts >= ?");
            params.add(toOffset(query.getSince()));
        }
        sql.append(" ORDER BY ts DESC, record_id DESC LIMIT ?");
        params.add(Math.max(0, query.getLimit()));

        return inConnection("search", connection -> {
            try (PreparedStatement ps = prepare(connection, sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    ps.setObject(i + 1, params.get(i));
                }
                return readRecords(ps);
            }
        });
    }

    @Override
    public List<String> anchors() {
        return inConnection("anchors", connection -> {
            try (PreparedStatement ps = prepare(connection,
                    "SELECT DISTINCT anchor_id FROM avl_records ORDER BY anchor_id");
                 ResultSet rs = ps.executeQuery()) {
                List<String> anchors = new ArrayList<>();
                while (rs.next()) {
                    anchors.add(rs.getString(1));
                }
                return anchors;
            }
        });
    }

    @Override
    public void appendCheckpoint(Checkpoint checkpoint) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = prepare(connection, "INSERT INTO avl_checkpoints (" + CHECKPOINT_COLUMNS
                     + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, checkpoint.getCheckpointId());
            ps.setString(2, checkpoint.getAnchorId());
            ps.setLong(3, checkpoint.getRangeStartSeq());
            ps.setLong(4, checkpoint.getRangeEndSeq());
            ps.setString(5, checkpoint.getRangeStartRecordId());
            ps.setString(6, checkpoint.getRangeEndRecordId());
            ps.setString(7, checkpoint.getMerkleRoot());
            ps.setString(8, checkpoint.getPrevRoot());
            ps.setString(9, checkpoint.getHashAlgorithm());
            setSignature(ps, 10, checkpoint.getSignature());
            ps.setObject(13, toOffset(checkpoint.getCreatedAt()));
            ps.setLong(14, checkpoint.getRecordCount());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new SequenceConflictException(checkpoint.getAnchorId(), checkpoint.getRangeStartSeq(), e);
            }
            throw unavailable("appendCheckpoint", e);
        }
    }

    @Override
    public Optional<Checkpoint> findCheckpoint(String checkpointId) {
        return queryCheckpoints("findCheckpoint",
                "SELECT " + CHECKPOINT_COLUMNS + " FROM avl_checkpoints WHERE checkpoint_id = ?", checkpointId)
                .stream().findFirst();
    }

    @Override
    public Optional<Checkpoint> latestCheckpoint(String anchorId) {
        return queryCheckpoints("latestCheckpoint", "SELECT " + CHECKPOINT_COLUMNS
                + " FROM avl_checkpoints WHERE anchor_id = ? ORDER BY range_start_seq DESC LIMIT 1", anchorId)
                .stream().findFirst();
    }

    @Override
    public List<Checkpoint> checkpoints(String anchorId) {
        return queryCheckpoints("checkpoints", "SELECT " + CHECKPOINT_COLUMNS
                + " FROM avl_checkpoints WHERE anchor_id = ? ORDER BY range_start_seq", anchorId);
    }

    private List<Checkpoint> queryCheckpoints(String operation, String sql, String param) {
        return inConnection(operation, connection -> {
            try (PreparedStatement ps = prepare(connection, sql)) {
                ps.setString(1, param);
                try (ResultSet rs = ps.executeQuery()) {
                    List<Checkpoint> result = new ArrayList<>();
                    while (rs.next()) {
                        result.add(Checkpoint.builder()
                                .checkpointId(rs.getString(1))
                                .anchorId(rs.getString(2))
                                .rangeStartSeq(rs.getLong(3))
                                .rangeEndSeq(rs.getLong(4))
                                .rangeStartRecordId(rs.getString(5))
                                .rangeEndRecordId(rs.getString(6))
                                .merkleRoot(rs.getString(7))
                                .prevRoot(rs.getString(8))
                                .hashAlgorithm(rs.getString(9))
                                .signature(readSignature(rs, 10))
                                .createdAt(rs.getObject(13, OffsetDateTime.class).toInstant())
                                .recordCount(rs.getLong(14))
                                .build());
                    }
                    return result;
                }
            }
        });
    }

    @Override
    public BackendStats stats() {
        return inConnection("stats", connection -> new BackendStats(
                count(connection, "SELECT COUNT(*) FROM avl_records"),
                count(connection, "SELECT COUNT(DISTINCT anchor_id) FROM avl_records"),
                count(connection, "SELECT COUNT(*) FROM avl_checkpoints")));
    }

    private long count(Connection connection, String sql) throws SQLException {
        try (PreparedStatement ps = prepare(connection, sql);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    @Override
    public boolean isHealthy() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(queryTimeoutSeconds);
        } catch (SQLException e) {
            log.debug("Durable health probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari && !hikari.isClosed()) {
            hikari.close();
            log.info("Durable backend connection pool closed");
        }
    }

    private PreparedStatement prepare(Connection connection, String sql) throws SQLException {
        PreparedStatement ps = connection.prepareStatement(sql);
        ps.setQueryTimeout(queryTimeoutSeconds);
        return ps;
    }

    private List<LedgerRecord> readRecords(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            List<LedgerRecord> records = new ArrayList<>();
            while (rs.next()) {
                records.add(LedgerRecord.builder()
                        .recordId(rs.getString(1))
                        .anchorId(rs.getString(2))
                        .sequence(rs.getLong(3))
                        .slot(rs.getString(4))
                        .kind(RecordKind.of(rs.getString(5)))
                        .timestamp(rs.getObject(6, OffsetDateTime.class).toInstant())
                        .prevHash(rs.getString(7))
                        .hash(rs.getString(8))
                        .payload(encoder.parsePayload(rs.getString(9)))
                        .signature(readSignature(rs, 10))
                        .producer(rs.getString(13))
                        .schemaVersion(rs.getInt(14))
                        .build());
            }
            return records;
        }
    }

    private void bindRecord(PreparedStatement ps, LedgerRecord record) throws SQLException {
        ps.setString(1, record.getRecordId());
        ps.setString(2, record.getAnchorId());
        ps.setLong(3, record.getSequence());
        ps.setString(4, record.getSlot());
        ps.setString(5, record.getKind().code());
        ps.setObject(6, toOffset(record.getTimestamp()));
        ps.setString(7, record.getPrevHash());
        ps.setString(8, record.getHash());
        ps.setString(9, encoder.payloadJson(record.getPayload()));
        setSignature(ps, 10, record.getSignature());
        ps.setString(13, record.getProducer());
        ps.setInt(14, record.getSchemaVersion());
    }

    /** sig_alg, sig_key_ref, sig (base64) 세 컬럼 */
    private static void setSignature(PreparedStatement ps, int firstIndex, RecordSignature signature) throws SQLException {
        if (signature == null) {
            ps.setNull(firstIndex, Types.VARCHAR);
            ps.setNull(firstIndex + 1, Types.VARCHAR);
            ps.setNull(firstIndex + 2, Types.VARCHAR);
            return;
        }
        ps.setString(firstIndex, signature.algorithm());
        ps.setString(firstIndex + 1, signature.keyRef());
        ps.setString(firstIndex + 2, signature.valueBase64());
    }

    private static RecordSignature readSignature(ResultSet rs, int firstIndex) throws SQLException {
        String algorithm = rs.getString(firstIndex);
        if (algorithm == null) {
            return null;
        }
        return RecordSignature.ofBase64(algorithm, rs.getString(firstIndex + 1), rs.getString(firstIndex + 2));
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static boolean isConstraintViolation(SQLException e) {
        return e instanceof SQLIntegrityConstraintViolationException
                || (e.getSQLState() != null && e.getSQLState().startsWith("23"));
    }

    private BackendUnavailableException unavailable(String operation, SQLException e) {
        log.error("Durable {} failed: {} (SQLState {})", operation, e.getMessage(), e.getSQLState());
        return new BackendUnavailableException(NAME, operation + " failed: " + e.getMessage(), e);
    }

    private <T> T inConnection(String operation, SqlFunction<T> work) {
        try (Connection connection = dataSource.getConnection()) {
            return work.apply(connection);
        } catch (SQLException e) {
            throw unavailable(operation, e);
        }
    }

    @FunctionalInterface
    private interface SqlFunction<T> {
        T apply(Connection connection) throws SQLException;
    }
}
