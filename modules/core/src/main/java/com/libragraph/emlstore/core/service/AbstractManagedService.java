package com.libragraph.emlstore.core.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.event.Event;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

/**
 * Base class for {@link ManagedService} implementations. Provides:
 * <ul>
 *   <li>Thread-safe state machine via {@link AtomicReference}</li>
 *   <li>CDI event firing on every state transition</li>
 *   <li>{@code @DependsOn} validation before start</li>
 *   <li>The cause of the most recent failure, for health reporting</li>
 * </ul>
 * Failure cascade is handled by {@link ServiceDependencyCascade}.
 * <p>
 * Subclasses implement {@link #doStart()} and {@link #doStop()}.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final AtomicReference<Throwable> lastFailure = new AtomicReference<>();

    @Inject
    Event<ServiceStateChangedEvent> stateEvent;

    @Inject
    Instance<ManagedService> allServices;

    protected final Logger log = Logger.getLogger(getClass());

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public void start() throws Exception {
        if (state.get() == State.RUNNING) {
            return;
        }

        verifyDependencies();

        transition(State.STARTING);
        try {
            doStart();
            lastFailure.set(null);
            transition(State.RUNNING);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void stop() throws Exception {
        if (state.get() == State.STOPPED) {
            return;
        }

        transition(State.STOPPING);
        try {
            doStop();
            transition(State.STOPPED);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void fail(Throwable cause) {
        State old = state.get();
        if (old == State.FAILED) {
            return;
        }
        lastFailure.set(cause);
        log.errorf(cause, "Service '%s' failed (was %s): %s", serviceId(), old, cause.getMessage());
        transition(State.FAILED);
    }

    /** Cause passed to the most recent {@link #fail}, cleared by a successful start. */
    public Throwable lastFailure() {
        return lastFailure.get();
    }

    /**
     * Sets state without firing events or lifecycle callbacks.
     * Lets tests restore a service after deliberately failing it.
     */
    public void forceState(State newState) {
        state.set(newState);
    }

    /** Returns the {@code @DependsOn} classes declared on this service. */
    public List<Class<? extends ManagedService>> getDependencies() {
        List<Class<? extends ManagedService>> deps = new ArrayList<>();
        for (DependsOn d : getClass().getAnnotationsByType(DependsOn.class)) {
            deps.add(d.value());
        }
        return deps;
    }

    private void transition(State newState) {
        State old = state.getAndSet(newState);
        log.infof("Service '%s': %s -> %s", serviceId(), old, newState);
        if (stateEvent != null) {
            stateEvent.fire(new ServiceStateChangedEvent(
                    serviceId(), old, newState, Instant.now()));
        }
    }

    private void verifyDependencies() {
        if (allServices == null) {
            return;
        }
        for (Class<? extends ManagedService> dep : getDependencies()) {
            for (ManagedService svc : allServices) {
                if (dep.isInstance(svc) && !svc.isRunning()) {
                    throw new IllegalStateException(
                            "Cannot start '" + serviceId() + "': dependency '"
                                    + svc.serviceId() + "' is " + svc.state());
                }
            }
        }
    }
}
