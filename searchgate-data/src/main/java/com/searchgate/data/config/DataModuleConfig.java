package com.searchgate.data.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.relational.core.dialect.Dialect;

/**
 * 数据模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.searchgate.data")
public class DataModuleConfig {

    /**
     * 注册 SQLite 方言：Spring Data JDBC 内置不认识 SQLite，需手动提供。
     */
    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }
}
