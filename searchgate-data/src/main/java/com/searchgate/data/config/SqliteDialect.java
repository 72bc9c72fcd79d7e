package com.searchgate.data.config;

import org.springframework.data.relational.core.dialect.AbstractDialect;
import org.springframework.data.relational.core.dialect.LimitClause;
import org.springframework.data.relational.core.dialect.LockClause;
import org.springframework.data.relational.core.sql.LockOptions;

/**
 * Spring Data JDBC 的 SQLite 方言。
 * <p>
 * 派生查询（findAll(Pageable) 等）用 LIMIT/OFFSET 分页；SQLite 没有行锁，
 * 锁子句输出为空，Key 池与配额的并发由服务层的进程内锁保证。
 */
public class SqliteDialect extends AbstractDialect {

    public static final SqliteDialect INSTANCE = new SqliteDialect();

    private static final LimitClause LIMIT_OFFSET = new LimitClause() {

        @Override
        public String getLimit(long limit) {
            return "LIMIT " + limit;
        }

        /** SQLite 不接受单独的 OFFSET，用 LIMIT -1 表示不限条数 */
        @Override
        public String getOffset(long offset) {
            return "LIMIT -1 OFFSET " + offset;
        }

        @Override
        public String getLimitOffset(long limit, long offset) {
            return getLimit(limit) + " OFFSET " + offset;
        }

        @Override
        public Position getClausePosition() {
            return Position.AFTER_ORDER_BY;
        }
    };

    private static final LockClause NO_LOCK = new LockClause() {

        @Override
        public String getLock(LockOptions lockOptions) {
            return "";
        }

        @Override
        public Position getClausePosition() {
            return Position.AFTER_ORDER_BY;
        }
    };

    private SqliteDialect() {
    }

    @Override
    public LimitClause limit() {
        return LIMIT_OFFSET;
    }

    @Override
    public LockClause lock() {
        return NO_LOCK;
    }
}
