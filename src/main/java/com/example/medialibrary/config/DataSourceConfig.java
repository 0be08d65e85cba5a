package com.example.medialibrary.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

@Configuration
@Slf4j
public class DataSourceConfig {

    /**
     * SQLite allows a single writer. One pooled connection serializes every transaction of the process.
     */
    @Bean
    public DataSource dataSource(LibraryLayout layout) {
        Path databasePath = layout.databasePath();
        try {
            layout.ensureDirectory(databasePath.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось создать директорию базы данных: " + databasePath.getParent(), e);
        }

        HikariConfig config = new HikariConfig();
        config.setPoolName("library-pool");
        config.setDriverClassName("org.sqlite.JDBC");
        config.setJdbcUrl("jdbc:sqlite:" + databasePath);
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(60_000);
        config.addDataSourceProperty("foreign_keys", "true");
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("busy_timeout", "10000");

        log.info("Библиотека: {}", databasePath);

        return new HikariDataSource(config);
    }
}
