package com.libragraph.emlstore.core.health;

import com.libragraph.emlstore.core.history.CacheStats;
import com.libragraph.emlstore.core.history.HistoryService;
import com.libragraph.emlstore.core.storage.FilesystemContentStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

@Readiness
@ApplicationScoped
public class HistoryStoreHealthCheck implements HealthCheck {

    @Inject
    HistoryService historyService;

    @Override
    public HealthCheckResponse call() {
        try {
            Path casDir = historyService.store().config().baseDir().resolve(FilesystemContentStore.CAS_DIR);
            if (!Files.isDirectory(casDir) || !Files.isWritable(casDir)) {
                return HealthCheckResponse.named("history")
                        .down()
                        .withData("error", "blob directory not writable: " + casDir)
                        .build();
            }
            CacheStats stats = historyService.store().getCacheStats();
            return HealthCheckResponse.named("history")
                    .up()
                    .withData("entries", stats.entryCount())
                    .withData("bytes", stats.totalSizeBytes())
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("history")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
