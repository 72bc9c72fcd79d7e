package com.searchgate.data.repository;

import com.searchgate.data.entity.RequestLogEntity;
import com.searchgate.data.entity.ResultStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
public class RequestLogRepositoryImpl implements RequestLogRepositoryCustom {

    private static final String COLUMNS = "id, key_id, auth_token_id, method, path, query, http_status, "
            + "upstream_status, result_status, error_message, request_body, response_body, "
            + "forwarded_headers, dropped_headers, created_at";

    private static final RowMapper<RequestLogEntity> ROW_MAPPER = RequestLogRepositoryImpl::mapRow;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public List<RequestLogEntity> findPage(RequestLogFilter filter, long anchorId, Long beforeId,
                                           int limit, long offset) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder where = whereClause(filter, params);
        where.append(" AND id <= :anchorId");
        params.addValue("anchorId", anchorId);
        if (beforeId != null) {
            where.append(" AND id < :beforeId");
            params.addValue("beforeId", beforeId);
        }
        params.addValue("limit", limit);
        params.addValue("offset", offset);
        String sql = "SELECT " + COLUMNS + " FROM t_request_log" + where
                + " ORDER BY id DESC LIMIT :limit OFFSET :offset";
        return jdbc.query(sql, params, ROW_MAPPER);
    }

    @Override
    public long countMatching(RequestLogFilter filter, long anchorId) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder where = whereClause(filter, params);
        where.append(" AND id <= :anchorId");
        params.addValue("anchorId", anchorId);
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM t_request_log" + where, params, Long.class);
        return count == null ? 0 : count;
    }

    @Override
    public Map<ResultStatus, Long> countByResult(RequestLogFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder where = whereClause(filter, params);
        Map<ResultStatus, Long> result = new EnumMap<>(ResultStatus.class);
        for (ResultStatus status : ResultStatus.values()) {
            result.put(status, 0L);
        }
        jdbc.query("SELECT result_status, COUNT(*) AS cnt FROM t_request_log" + where + " GROUP BY result_status",
                params, rs -> {
                    String raw = rs.getString("result_status");
                    if (raw != null) {
                        result.put(ResultStatus.valueOf(raw), rs.getLong("cnt"));
                    }
                });
        return result;
    }

    @Override
    public Long findLastActivity(RequestLogFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder where = whereClause(filter, params);
        List<Long> rows = jdbc.query("SELECT MAX(created_at) AS last_at FROM t_request_log" + where, params,
                (rs, i) -> {
                    long v = rs.getLong("last_at");
                    return rs.wasNull() ? null : v;
                });
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public List<UsageBucket> aggregateBuckets(RequestLogFilter filter, long bucketSecs) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder where = whereClause(filter, params);
        params.addValue("bucketSecs", bucketSecs);
        String sql = "SELECT (created_at / :bucketSecs) * :bucketSecs AS bucket_start, "
                + "SUM(CASE WHEN result_status = 'SUCCESS' THEN 1 ELSE 0 END) AS success_count, "
                + "SUM(CASE WHEN result_status = 'ERROR' THEN 1 ELSE 0 END) AS system_failure_count, "
                + "SUM(CASE WHEN result_status = 'QUOTA_EXHAUSTED' THEN 1 ELSE 0 END) AS external_failure_count "
                + "FROM t_request_log" + where + " GROUP BY bucket_start ORDER BY bucket_start";
        return jdbc.query(sql, params, (rs, i) -> new UsageBucket(
                rs.getLong("bucket_start"),
                rs.getLong("success_count"),
                rs.getLong("system_failure_count"),
                rs.getLong("external_failure_count")));
    }

    private static StringBuilder whereClause(RequestLogFilter filter, MapSqlParameterSource params) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        if (filter == null) {
            return where;
        }
        if (filter.getKeyId() != null) {
            where.append(" AND key_id = :keyId");
            params.addValue("keyId", filter.getKeyId());
        }
        if (filter.getAuthTokenId() != null) {
            where.append(" AND auth_token_id = :authTokenId");
            params.addValue("authTokenId", filter.getAuthTokenId());
        }
        if (filter.getResultStatus() != null) {
            where.append(" AND result_status = :resultStatus");
            params.addValue("resultStatus", filter.getResultStatus().name());
        }
        if (filter.getSince() != null) {
            where.append(" AND created_at >= :since");
            params.addValue("since", filter.getSince());
        }
        if (filter.getUntil() != null) {
            where.append(" AND created_at < :until");
            params.addValue("until", filter.getUntil());
        }
        return where;
    }

    private static RequestLogEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
        String result = rs.getString("result_status");
        return RequestLogEntity.builder()
                .id(rs.getLong("id"))
                .keyId(rs.getString("key_id"))
                .authTokenId(rs.getString("auth_token_id"))
                .method(rs.getString("method"))
                .path(rs.getString("path"))
                .query(rs.getString("query"))
                .httpStatus(nullableInt(rs, "http_status"))
                .upstreamStatus(nullableInt(rs, "upstream_status"))
                .resultStatus(result == null ? null : ResultStatus.valueOf(result))
                .errorMessage(rs.getString("error_message"))
                .requestBody(rs.getString("request_body"))
                .responseBody(rs.getString("response_body"))
                .forwardedHeaders(rs.getString("forwarded_headers"))
                .droppedHeaders(rs.getString("dropped_headers"))
                .createdAt(rs.getLong("created_at"))
                .build();
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }
}
