package com.aitimeline.api.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * 앱 시작 시 실행
 * 1. 이전 버전 DB 에 누락된 컬럼/인덱스 추가 (schema.sql 은 CREATE TABLE IF NOT EXISTS 만 수행)
 * 2. 비정상 종료로 진행 중 상태에 멈춘 세그먼트/작업/타임라인 복구
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class DatabaseInitializer implements ApplicationRunner {

    static final String INTERRUPTED_MESSAGE = "Interrupted by server restart";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running database schema migrations...");

        addColumnIfNotExists("segments", "version",
            "ALTER TABLE segments ADD COLUMN version INT NOT NULL DEFAULT 0 COMMENT '생성 lease 카운터' AFTER error_message");

        addColumnIfNotExists("segments", "enhance_error",
            "ALTER TABLE segments ADD COLUMN enhance_error TEXT NULL AFTER enhanced_video_url");

        addColumnIfNotExists("enhancement_jobs", "preserve_audio",
            "ALTER TABLE enhancement_jobs ADD COLUMN preserve_audio TINYINT(1) NOT NULL DEFAULT 1 AFTER target_resolution");

        addColumnIfNotExists("upscaler_models", "provider_version",
            "ALTER TABLE upscaler_models ADD COLUMN provider_version VARCHAR(100) NULL AFTER priority");

        // 기존 중복 position 이 있으면 실패하고 경고만 남긴다
        addIndexIfNotExists("segments", "uk_segments_timeline_position",
            "ALTER TABLE segments ADD UNIQUE KEY uk_segments_timeline_position (timeline_id, position)");

        log.info("Database schema migrations completed.");

        recoverInterruptedWork();
    }

    /**
     * 생성/업스케일 도중 프로세스가 종료되면 generating / processing 상태가 남는다.
     * 재시작 시점에는 진행 중인 작업이 있을 수 없으므로 실패 상태로 정리한다.
     */
    void recoverInterruptedWork() {
        try {
            int segments = jdbcTemplate.update(
                "UPDATE segments SET status = 'error', error_message = ? WHERE status = 'generating'",
                INTERRUPTED_MESSAGE);

            int jobs = jdbcTemplate.update(
                "UPDATE enhancement_jobs SET status = 'failed', output_url = NULL, error_message = ?, completed_at = NOW() " +
                "WHERE status = 'processing'",
                INTERRUPTED_MESSAGE);

            int projections = jdbcTemplate.update(
                "UPDATE segments SET enhance_status = 'failed', enhance_error = ? WHERE enhance_status = 'processing'",
                INTERRUPTED_MESSAGE);

            int timelines = jdbcTemplate.update(
                "UPDATE timelines SET status = 'ready' WHERE status = 'generating'");

            log.info("[Recovery] segments={} jobs={} projections={} timelines={} reset after restart",
                    segments, jobs, projections, timelines);
        } catch (Exception e) {
            log.warn("[Recovery] Failed to recover interrupted work: {}", e.getMessage());
        }
    }

    private void addColumnIfNotExists(String tableName, String columnName, String alterSql) {
        try {
            String checkSql = """
                SELECT COUNT(*) FROM information_schema.COLUMNS
                WHERE TABLE_SCHEMA = DATABASE()
                AND TABLE_NAME = ?
                AND COLUMN_NAME = ?
                """;

            Integer count = jdbcTemplate.queryForObject(checkSql, Integer.class, tableName, columnName);

            if (count == null || count == 0) {
                log.info("Adding column {} to table {}...", columnName, tableName);
                jdbcTemplate.execute(alterSql);
                log.info("Column {} added successfully.", columnName);
            } else {
                log.debug("Column {} already exists in table {}.", columnName, tableName);
            }
        } catch (Exception e) {
            log.warn("Failed to add column {} to {}: {}", columnName, tableName, e.getMessage());
        }
    }

    private void addIndexIfNotExists(String tableName, String indexName, String alterSql) {
        try {
            String checkSql = """
                SELECT COUNT(*) FROM information_schema.STATISTICS
                WHERE TABLE_SCHEMA = DATABASE()
                AND TABLE_NAME = ?
                AND INDEX_NAME = ?
                """;

            Integer count = jdbcTemplate.queryForObject(checkSql, Integer.class, tableName, indexName);

            if (count == null || count == 0) {
                log.info("Adding index {} to table {}...", indexName, tableName);
                jdbcTemplate.execute(alterSql);
                log.info("Index {} added successfully.", indexName);
            } else {
                log.debug("Index {} already exists in table {}.", indexName, tableName);
            }
        } catch (Exception e) {
            log.warn("Failed to add index {} to {}: {}", indexName, tableName, e.getMessage());
        }
    }
}
