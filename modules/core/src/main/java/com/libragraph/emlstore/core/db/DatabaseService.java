package com.libragraph.emlstore.core.db;

import com.libragraph.emlstore.core.dao.DatabaseDao;
import com.libragraph.emlstore.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.sql.DatabaseMetaData;

/**
 * Root infrastructure service that gates access to the database.
 * Starts eagerly at boot via {@code @Startup}, verifies connectivity,
 * and exposes {@link #jdbi()} only when RUNNING.
 */
@ApplicationScoped
@Startup
public class DatabaseService extends AbstractManagedService {

    @Inject
    Jdbi jdbi;

    private String productVersion;

    @Override
    public String serviceId() {
        return "database";
    }

    @Override
    protected void doStart() throws Exception {
        productVersion = jdbi.withHandle(h -> {
            DatabaseMetaData meta = h.getConnection().getMetaData();
            return meta.getDatabaseProductName() + " " + meta.getDatabaseProductVersion();
        });
        log.infof("Connected to: %s", productVersion);
    }

    @Override
    protected void doStop() {
        log.info("DatabaseService stopping (Agroal manages pool shutdown)");
    }

    /** Returns the JDBI instance. Throws if service is not RUNNING. */
    public Jdbi jdbi() {
        if (!isRunning()) {
            throw new IllegalStateException(
                    "DatabaseService is not running (state=" + state() + ")");
        }
        return jdbi;
    }

    /** Executes SELECT 1 to verify connectivity. Calls {@link #fail} on error. */
    public boolean ping() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            return true;
        } catch (Exception e) {
            fail(e);
            return false;
        }
    }

    /** Database product name and version from the startup connection check. */
    public String productVersion() {
        return productVersion;
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("DatabaseService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping DatabaseService", e);
        }
    }
}
