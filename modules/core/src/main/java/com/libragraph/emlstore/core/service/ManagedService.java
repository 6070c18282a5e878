package com.libragraph.emlstore.core.service;

/**
 * Lifecycle of the startup services: the {@code database} service opens the
 * datasource and runs migrations, and {@code history} opens the blob store on
 * top of it. Each transition fires a {@link ServiceStateChangedEvent}; a
 * {@code FAILED} service fails everything declared {@link DependsOn} it.
 *
 * <p>{@link #start()} and {@link #stop()} may throw whatever the underlying
 * resource throws; the service moves to {@code FAILED} before rethrowing.
 */
public interface ManagedService {

    enum State { STOPPED, STARTING, RUNNING, STOPPING, FAILED }

    String serviceId();

    State state();

    void start() throws Exception;

    void stop() throws Exception;

    void fail(Throwable cause);

    default boolean isRunning() {
        return state() == State.RUNNING;
    }
}
