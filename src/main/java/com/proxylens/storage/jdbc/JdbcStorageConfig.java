package com.proxylens.storage.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the PostgreSQL record store.
 * Active only with {@code proxylens.storage.type=jdbc}.
 */
@Configuration
@ConditionalOnProperty(name = "proxylens.storage.type", havingValue = "jdbc")
public class JdbcStorageConfig {

    private static final Logger logger = LoggerFactory.getLogger(JdbcStorageConfig.class);

    @Value("${proxylens.storage.jdbc.url:jdbc:postgresql://localhost:5432/proxylens}")
    private String url;

    @Value("${proxylens.storage.jdbc.username:proxylens}")
    private String username;

    @Value("${proxylens.storage.jdbc.password:}")
    private String password;

    @Value("${proxylens.storage.jdbc.pool-size:10}")
    private int poolSize;

    @Value("${proxylens.storage.jdbc.init-schema:true}")
    private boolean initSchema;

    /**
     * Create the pooled DataSource and apply schema.sql when enabled
     */
    @Bean(name = "proxylensDataSource")
    public DataSource proxylensDataSource() {
        try {
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(url);
            config.setUsername(username);
            config.setPassword(password);
            config.setDriverClassName("org.postgresql.Driver");

            // Connection pool settings
            config.setMaximumPoolSize(poolSize);
            config.setMinimumIdle(2);
            config.setConnectionTimeout(30000);
            config.setIdleTimeout(600000);
            config.setMaxLifetime(1800000);

            HikariDataSource dataSource = new HikariDataSource(config);

            if (initSchema) {
                ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource("schema.sql"));
                DatabasePopulatorUtils.execute(populator, dataSource);
                logger.info("Applied schema.sql to {}", url);
            }

            logger.info("PostgreSQL DataSource initialized: {}", url);
            return dataSource;

        } catch (Exception e) {
            logger.error("Failed to initialize PostgreSQL DataSource", e);
            throw new IllegalStateException("PostgreSQL DataSource initialization failed", e);
        }
    }

    @Bean
    public JdbcTemplate proxylensJdbcTemplate(DataSource proxylensDataSource) {
        return new JdbcTemplate(proxylensDataSource);
    }

    @Bean
    public TransactionTemplate proxylensTransactionTemplate(DataSource proxylensDataSource) {
        return new TransactionTemplate(new DataSourceTransactionManager(proxylensDataSource));
    }
}
