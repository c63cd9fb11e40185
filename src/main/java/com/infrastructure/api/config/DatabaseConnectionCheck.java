package com.infrastructure.api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Logs where the datastore is expected and whether a pooled connection can be obtained.
 * A failure is logged only; the API keeps serving and reports datastore errors per request.
 */
@Component
public class DatabaseConnectionCheck {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConnectionCheck.class);

    private final DataSource dataSource;
    private final String url;
    private final String username;

    public DatabaseConnectionCheck(DataSource dataSource,
                                   @Value("${spring.datasource.url:}") String url,
                                   @Value("${spring.datasource.username:}") String username) {
        this.dataSource = dataSource;
        this.url = url;
        this.username = username;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void checkConnection() {
        logger.info("Attempting database connection with url={} user={}", url, username);
        try (Connection connection = dataSource.getConnection()) {
            logger.info("Connected to database {} {} successfully",
                    connection.getMetaData().getDatabaseProductName(),
                    connection.getMetaData().getDatabaseProductVersion());
        } catch (SQLException e) {
            logger.error("Database connection failed: {}", e.getMessage(), e);
        }
    }
}
