package com.rally.leaguesync.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Startup checks for the import target.
 *
 * Flyway owns the schema, so any Hibernate ddl-auto mode that writes DDL aborts startup outside
 * test profiles. A missing league data directory or an in-memory datasource is only logged.
 */
@Configuration
public class DatabaseSafetyConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSafetyConfig.class);

    @Value("${spring.profiles.active:default}")
    private String activeProfiles;

    @Value("${spring.jpa.hibernate.ddl-auto:none}")
    private String ddlAuto;

    @Value("${spring.datasource.url:}")
    private String datasourceUrl;

    private final LeagueSyncProperties properties;

    public DatabaseSafetyConfig(LeagueSyncProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void verifyImportTarget() {
        String ddl = safeLower(ddlAuto).replace('_', '-');
        String dsUrl = datasourceUrl == null ? "" : datasourceUrl;
        log.info("[DB_SAFETY] Active profiles='{}', ddl-auto='{}', datasource='{}', data-dir='{}'",
                activeProfiles, ddlAuto, dsUrl, properties.getDataDir());

        if (!isSchemaSafe(ddl) && !safeLower(activeProfiles).contains("test")) {
            throw new IllegalStateException("ddl-auto '" + ddlAuto + "' would alter the Flyway-managed schema; aborting startup");
        }
        if (dsUrl.toLowerCase(Locale.ROOT).contains("mem:")) {
            log.warn("[DB_SAFETY] In-memory database detected, imported league data will not survive a restart");
        }
        if (!Files.isDirectory(Path.of(properties.getDataDir()))) {
            log.warn("[DB_SAFETY] League data directory {} does not exist yet", Path.of(properties.getDataDir()).toAbsolutePath());
        }
    }

    static boolean isSchemaSafe(String ddlAuto) {
        return ddlAuto.isEmpty() || "none".equals(ddlAuto) || "validate".equals(ddlAuto);
    }

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
