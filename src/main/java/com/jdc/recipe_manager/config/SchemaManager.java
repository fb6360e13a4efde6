package com.jdc.recipe_manager.config;

import com.jdc.recipe_manager.exception.SchemaInitializationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Creates the tables on startup and checks that all of them are present.
 * The DDL scripts only use IF NOT EXISTS forms, so running them against an
 * existing database changes nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaManager implements InitializingBean {

    public static final List<String> REQUIRED_TABLES = List.of(
            "users", "recipes", "categories", "recipe_categories",
            "recipe_ingredients", "recipe_events", "user_recipe_views");

    private final DataSource dataSource;
    private final ResourceLoader resourceLoader;
    private final RecipeManagerProperties properties;

    @Override
    public void afterPropertiesSet() {
        if (!properties.getSchema().isEnabled()) {
            log.info("Schema provisioning disabled; expecting an externally managed schema");
            return;
        }
        initialize();
    }

    public void initialize() {
        String location = "classpath:schema/schema-" + properties.getSchema().getPlatform() + ".sql";
        Resource script = resourceLoader.getResource(location);
        if (!script.exists()) {
            log.error("Schema script {} not found", location);
            throw new SchemaInitializationException("Schema script not found: " + location);
        }

        try {
            ResourceDatabasePopulator populator = new ResourceDatabasePopulator(script);
            populator.setSqlScriptEncoding("UTF-8");
            populator.execute(dataSource);
        } catch (DataAccessException e) {
            log.error("Failed to run schema script {}", location, e);
            throw new SchemaInitializationException("Failed to run schema script: " + location, e);
        }

        verifyTables();
        log.info("Database schema ready ({})", location);
    }

    private void verifyTables() {
        Set<String> present = new HashSet<>();
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            try (ResultSet tables = metaData.getTables(connection.getCatalog(), null, "%", new String[]{"TABLE"})) {
                while (tables.next()) {
                    present.add(tables.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read database metadata", e);
            throw new SchemaInitializationException("Failed to verify schema", e);
        }

        List<String> missing = new ArrayList<>();
        for (String table : REQUIRED_TABLES) {
            if (!present.contains(table)) {
                missing.add(table);
            }
        }
        if (!missing.isEmpty()) {
            log.error("Schema is missing tables {}", missing);
            throw new SchemaInitializationException("Missing tables: " + missing);
        }
    }
}
