package com.di.modelnova.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Datasource for the JDBC stores. Only created with {@code modelnova.persistence-enabled=true}
 * (see {@code application-persistent.yml}); the schema comes from {@code schema.sql}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "true")
public class PersistenceConfig {

    @Bean(destroyMethod = "close")
    public DataSource lifecycleDataSource(
            @Value("${modelnova.datasource.url}") String url,
            @Value("${modelnova.datasource.username:}") String username,
            @Value("${modelnova.datasource.password:}") String password,
            @Value("${modelnova.datasource.driver-class-name:org.postgresql.Driver}") String driverClassName,
            @Value("${modelnova.datasource.maximum-pool-size:10}") int maximumPoolSize) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName(driverClassName);
        config.setMaximumPoolSize(maximumPoolSize);
        config.setPoolName("modelnova-pool");
        log.info("[PERSISTENCE] JDBC stores enabled: url={} poolSize={}", url, maximumPoolSize);
        return new HikariDataSource(config);
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource lifecycleDataSource) {
        return new JdbcTemplate(lifecycleDataSource);
    }
}
