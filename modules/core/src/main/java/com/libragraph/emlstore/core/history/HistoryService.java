package com.libragraph.emlstore.core.history;

import com.libragraph.emlstore.core.db.DatabaseService;
import com.libragraph.emlstore.core.db.JdbiMetadataStore;
import com.libragraph.emlstore.core.service.AbstractManagedService;
import com.libragraph.emlstore.core.service.DependsOn;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;

/**
 * Owns the application's {@link HistoryStore}. On start it opens the store over the
 * configured base directory and the database, repairs whatever a previous run left
 * behind, and relays every published snapshot as a {@link HistoryChangedEvent}.
 */
@ApplicationScoped
@Startup
@DependsOn(DatabaseService.class)
public class HistoryService extends AbstractManagedService {

    @Inject
    DatabaseService databaseService;

    @Inject
    Event<HistoryChangedEvent> historyChanged;

    @ConfigProperty(name = "emlstore.base-dir")
    String baseDir;

    @ConfigProperty(name = "emlstore.history.limit", defaultValue = "0")
    int historyLimit;

    @ConfigProperty(name = "emlstore.history.dedup-policy", defaultValue = "UNIQUE_CONTENT")
    DedupPolicy dedupPolicy;

    private HistoryStore store;
    private HistoryStore.Subscription subscription;

    @Override
    public String serviceId() {
        return "history";
    }

    @Override
    protected void doStart() {
        HistoryStoreConfig config = HistoryStoreConfig.of(Path.of(baseDir))
                .withHistoryLimit(historyLimit)
                .withDedupPolicy(dedupPolicy);
        store = HistoryStore.open(config, new JdbiMetadataStore(databaseService.jdbi()));

        ReconcileReport report = store.reconcile();
        if (!report.isClean()) {
            log.warnf("Repaired history store on startup: %s", report);
        }
        subscription = store.subscribe(snapshot -> historyChanged.fire(new HistoryChangedEvent(snapshot)));
        log.infof("History ready: %d records, %d bytes",
                store.getCacheStats().entryCount(), store.getCacheStats().totalSizeBytes());
    }

    @Override
    protected void doStop() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
        log.info("HistoryService stopping");
    }

    /** Returns the history store. Throws if service is not RUNNING. */
    public HistoryStore store() {
        if (!isRunning()) {
            throw new IllegalStateException("HistoryService is not running (state=" + state() + ")");
        }
        return store;
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("HistoryService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping HistoryService", e);
        }
    }
}
