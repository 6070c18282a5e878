package com.libragraph.emlstore.core.health;

import com.libragraph.emlstore.core.db.DatabaseService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    DatabaseService databaseService;

    @Override
    public HealthCheckResponse call() {
        if (!databaseService.isRunning() || !databaseService.ping()) {
            Throwable failure = databaseService.lastFailure();
            return HealthCheckResponse.named("database")
                    .down()
                    .withData("state", databaseService.state().name())
                    .withData("error", failure != null ? String.valueOf(failure.getMessage()) : "unavailable")
                    .build();
        }
        return HealthCheckResponse.named("database")
                .up()
                .withData("version", databaseService.productVersion())
                .build();
    }
}
