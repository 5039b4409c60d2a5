package io.github.hongjungwan.avl.core.backend;

import java.util.List;

/**
 * JDBC URL별 DDL 차이. 대용량 텍스트 컬럼 타입만 다르다.
 */
public enum SqlDialect {
    POSTGRESQL("TEXT"),
    H2("CHARACTER LARGE OBJECT"),
    GENERIC("CLOB");

    private final String largeTextType;

    SqlDialect(String largeTextType) {
        this.largeTextType = largeTextType;
    }

    public static SqlDialect fromJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return GENERIC;
        }
        if (jdbcUrl.startsWith("jdbc:postgresql:")) {
            return POSTGRESQL;
        }
        if (jdbcUrl.startsWith("jdbc:h2:")) {
            return H2;
        }
        return GENERIC;
    }

    /** 스키마 생성 문 (멱등) */
    public List<String> schemaStatements() {
        return List.of(
                "CREATE TABLE IF NOT EXISTS avl_records ("
                        + " record_id VARCHAR(36) PRIMARY KEY,"
                        + " anchor_id VARCHAR(255) NOT NULL,"
                        + " seq BIGINT NOT NULL,"
                        + " slot VARCHAR(255) NOT NULL,"
                        + " kind VARCHAR(64) NOT NULL,"
                        + " ts TIMESTAMP WITH TIME ZONE NOT NULL,"
                        + " prev_hash VARCHAR(128) NOT NULL,"
                        + " record_hash VARCHAR(128) NOT NULL,"
                        + " payload " + largeTextType + " NOT NULL,"
                        + " sig_alg VARCHAR(64),"
                        + " sig_key_ref VARCHAR(255),"
                        + " sig " + largeTextType + ","
                        + " producer VARCHAR(255),"
                        + " schema_version INT NOT NULL,"
                        + " CONSTRAINT uq_avl_records_hash UNIQUE (record_hash),"
                        + " CONSTRAINT uq_avl_records_anchor_seq UNIQUE (anchor_id, seq))",
                "CREATE INDEX IF NOT EXISTS idx_avl_records_anchor_ts ON avl_records (anchor_id, ts)",
                "CREATE TABLE IF NOT EXISTS avl_checkpoints ("
                        + " checkpoint_id VARCHAR(36) PRIMARY KEY,"
                        + " anchor_id VARCHAR(255) NOT NULL,"
                        + " range_start_seq BIGINT NOT NULL,"
                        + " range_end_seq BIGINT NOT NULL,"
                        + " range_start VARCHAR(36) NOT NULL,"
                        + " range_end VARCHAR(36) NOT NULL,"
                        + " merkle_root VARCHAR(128) NOT NULL,"
                        + " prev_root VARCHAR(128),"
                        + " hash_alg VARCHAR(32) NOT NULL,"
                        + " sig_alg VARCHAR(64),"
                        + " sig_key_ref VARCHAR(255),"
                        + " sig " + largeTextType + ","
                        + " created_at TIMESTAMP WITH TIME ZONE NOT NULL,"
                        + " record_count BIGINT NOT NULL,"
                        + " CONSTRAINT uq_avl_checkpoints_anchor_start UNIQUE (anchor_id, range_start_seq))"
        );
    }
}
