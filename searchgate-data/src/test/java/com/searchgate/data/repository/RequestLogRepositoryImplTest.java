package com.searchgate.data.repository;

import com.searchgate.data.entity.RequestLogEntity;
import com.searchgate.data.entity.ResultStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 在内存 SQLite 上验证动态 SQL。
 */
@DisplayName("RequestLogRepositoryImpl")
class RequestLogRepositoryImplTest {

    private SingleConnectionDataSource dataSource;
    private NamedParameterJdbcTemplate jdbc;
    private RequestLogRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        dataSource = new SingleConnectionDataSource("jdbc:sqlite::memory:", true);
        dataSource.setDriverClassName("org.sqlite.JDBC");
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        jdbc = new NamedParameterJdbcTemplate(dataSource);
        repository = new RequestLogRepositoryImpl(jdbc);
    }

    @AfterEach
    void tearDown() {
        dataSource.destroy();
    }

    private void insert(String keyId, String tokenId, ResultStatus result, long createdAt) {
        jdbc.update("INSERT INTO t_request_log (key_id, auth_token_id, method, path, http_status, result_status, "
                        + "created_at) VALUES (:keyId, :tokenId, 'POST', '/mcp', 200, :result, :createdAt)",
                new MapSqlParameterSource()
                        .addValue("keyId", keyId)
                        .addValue("tokenId", tokenId)
                        .addValue("result", result.name())
                        .addValue("createdAt", createdAt));
    }

    @Test
    @DisplayName("锚点之后写入的记录不出现在分页结果里")
    void anchorHidesLaterRows() {
        for (int i = 1; i <= 5; i++) {
            insert("k001", "ab12", ResultStatus.SUCCESS, 1000 + i);
        }
        long anchor = 5;
        insert("k001", "ab12", ResultStatus.SUCCESS, 2000);

        List<RequestLogEntity> first = repository.findPage(RequestLogFilter.none(), anchor, null, 2, 0);
        List<RequestLogEntity> second = repository.findPage(RequestLogFilter.none(), anchor, null, 2, 2);

        assertThat(first).extracting(RequestLogEntity::getId).containsExactly(5L, 4L);
        assertThat(second).extracting(RequestLogEntity::getId).containsExactly(3L, 2L);
        assertThat(repository.countMatching(RequestLogFilter.none(), anchor)).isEqualTo(5);
    }

    @Test
    @DisplayName("before 游标与条件过滤")
    void cursorAndFilters() {
        insert("k001", "ab12", ResultStatus.SUCCESS, 1000);
        insert("k002", "ab12", ResultStatus.QUOTA_EXHAUSTED, 1100);
        insert("k001", "cd34", ResultStatus.ERROR, 1200);
        insert("k001", "ab12", ResultStatus.SUCCESS, 1300);

        RequestLogFilter byToken = RequestLogFilter.builder().authTokenId("ab12").build();
        assertThat(repository.findPage(byToken, 4, 4L, 10, 0))
                .extracting(RequestLogEntity::getId).containsExactly(2L, 1L);

        RequestLogFilter byKeyAndTime = RequestLogFilter.builder().keyId("k001").since(1100L).until(1300L).build();
        assertThat(repository.findPage(byKeyAndTime, 4, null, 10, 0))
                .extracting(RequestLogEntity::getResultStatus).containsExactly(ResultStatus.ERROR);
    }

    @Test
    @DisplayName("按结果计数，没有记录的结果为 0")
    void countsByResult() {
        insert("k001", "ab12", ResultStatus.SUCCESS, 1000);
        insert("k001", "ab12", ResultStatus.SUCCESS, 1001);
        insert("k002", "ab12", ResultStatus.ERROR, 1002);

        Map<ResultStatus, Long> counts = repository.countByResult(RequestLogFilter.none());

        assertThat(counts).containsEntry(ResultStatus.SUCCESS, 2L)
                .containsEntry(ResultStatus.ERROR, 1L)
                .containsEntry(ResultStatus.QUOTA_EXHAUSTED, 0L);
        assertThat(repository.findLastActivity(RequestLogFilter.none())).isEqualTo(1002L);
        assertThat(repository.findLastActivity(RequestLogFilter.builder().keyId("none").build())).isNull();
    }

    @Test
    @DisplayName("按小时桶聚合")
    void aggregatesHourlyBuckets() {
        insert("k001", "ab12", ResultStatus.SUCCESS, 3600);
        insert("k001", "ab12", ResultStatus.ERROR, 3700);
        insert("k001", "ab12", ResultStatus.QUOTA_EXHAUSTED, 7300);

        List<UsageBucket> buckets = repository.aggregateBuckets(RequestLogFilter.none(), 3600);

        assertThat(buckets).containsExactly(
                new UsageBucket(3600, 1, 1, 0),
                new UsageBucket(7200, 0, 0, 1));
    }
}
