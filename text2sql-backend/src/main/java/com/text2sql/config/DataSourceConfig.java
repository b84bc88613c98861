package com.text2sql.config;

import com.text2sql.util.HikariSqlExceptionOverride;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Connection pool for the relational store that generated queries run against.
 */
@Slf4j
@Configuration
public class DataSourceConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(Text2SqlProperties properties) {
        Text2SqlProperties.Datasource ds = properties.getDatasource();
        if (ds.getUrl() == null || ds.getUrl().isBlank()) {
            throw new IllegalStateException("text2sql.datasource.url is required");
        }

        HikariConfig config = hikariConfig(ds);
        log.info("Creating connection pool (url={}, max_pool_size={}, read_only={})",
                maskUrl(ds.getUrl()), ds.getMaximumPoolSize(), ds.isReadOnly());
        return new HikariDataSource(config);
    }

    static HikariConfig hikariConfig(Text2SqlProperties.Datasource ds) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(ds.getUrl());
        config.setUsername(ds.getUsername());
        config.setPassword(ds.getPassword());
        if (ds.getUrl().startsWith("jdbc:postgresql:")) {
            config.addDataSourceProperty("ApplicationName", "text2sql");
            if (ds.isReadOnly()) {
                // pgjdbc ignores setReadOnly under autocommit unless readOnlyMode is "always"
                config.addDataSourceProperty("readOnlyMode", "always");
            }
        }
        config.setReadOnly(ds.isReadOnly());
        config.setConnectionTimeout(ds.getConnectionTimeoutMs());
        config.setMaximumPoolSize(ds.getMaximumPoolSize());
        config.setMinimumIdle(ds.getMinimumIdle());
        config.setPoolName("text2sql-pool");
        // Start without a reachable database; requests report the connection error instead.
        config.setInitializationFailTimeout(-1);
        return config;
    }

    private static String maskUrl(String url) {
        return url.replaceAll(":[^@:/]+@", ":****@").replaceAll("(?i)(password=)[^&;]*", "$1****");
    }
}
