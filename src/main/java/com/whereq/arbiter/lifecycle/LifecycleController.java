package com.whereq.arbiter.lifecycle;

import com.whereq.arbiter.config.ArbiterProperties;
import com.whereq.arbiter.exception.LifecycleControlException;
import com.whereq.arbiter.model.LifecycleState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Powers on-demand capacity on when the fleet is offline and off again after inactivity.
 *
 * Only capacity this controller started itself ({@code autoStarted}) is ever stopped.
 * The idle timer is a single deadline checked by a periodic tick; re-arming overwrites it.
 */
@Slf4j
@Service
public class LifecycleController {

    private final ComputeControl computeControl;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final boolean enabled;
    private final Duration idleShutdown;

    private LifecycleState state = LifecycleState.initial();
    private boolean stopping;

    private Counter startCounter;
    private Counter stopCounter;
    private Counter failureCounter;

    @Autowired
    public LifecycleController(ComputeControl computeControl,
                               Clock clock,
                               MeterRegistry meterRegistry,
                               ArbiterProperties properties) {
        this(computeControl, clock, meterRegistry,
            properties.getLifecycle().isEnabled(), properties.getLifecycle().getIdleShutdown());
    }

    public LifecycleController(ComputeControl computeControl,
                               Clock clock,
                               MeterRegistry meterRegistry,
                               boolean enabled,
                               Duration idleShutdown) {
        this.computeControl = computeControl;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.enabled = enabled;
        this.idleShutdown = idleShutdown;
    }

    @PostConstruct
    public void initialize() {
        startCounter = Counter.builder("arbiter.lifecycle.starts")
            .description("Number of capacity starts issued by the controller")
            .register(meterRegistry);

        stopCounter = Counter.builder("arbiter.lifecycle.stops")
            .description("Number of idle shutdowns issued by the controller")
            .register(meterRegistry);

        failureCounter = Counter.builder("arbiter.lifecycle.failures")
            .description("Number of failed start or stop commands")
            .register(meterRegistry);

        Gauge.builder("arbiter.lifecycle.auto-started", () -> state().isAutoStarted() ? 1 : 0)
            .description("1 while capacity started by the controller is up")
            .register(meterRegistry);

        log.info("LifecycleController initialized: enabled={}, idle shutdown={}", enabled, idleShutdown);
    }

    /**
     * Make sure on-demand capacity is coming up.
     * No-op while a start is in flight or after this controller already started it.
     *
     * @return Mono with what happened; never errors
     */
    public Mono<CapacityOutcome> ensureCapacity() {
        if (!enabled) {
            return Mono.just(CapacityOutcome.DISABLED);
        }

        synchronized (this) {
            if (state.isStarting() || state.isAutoStarted()) {
                // new activity cancels a pending shutdown; the caller re-arms it
                state.setShutdownDeadline(null);
                log.debug("Capacity already started or starting, not issuing another start");
                return Mono.just(CapacityOutcome.ALREADY_STARTED);
            }
            state.setStarting(true);
        }

        return computeControl.start()
            .switchIfEmpty(Mono.error(new LifecycleControlException("Start command returned no result")))
            .map(transition -> {
                synchronized (this) {
                    state.setStarting(false);
                    if (transition == PowerTransition.STARTED) {
                        state.setAutoStarted(true);
                        state.setStartedAt(clock.instant());
                        startCounter.increment();
                        log.info("On-demand capacity started at {}", state.getStartedAt());
                        return CapacityOutcome.STARTED;
                    }
                    log.info("On-demand capacity was already running, leaving it unmanaged");
                    return CapacityOutcome.ALREADY_RUNNING;
                }
            })
            .onErrorResume(e -> {
                synchronized (this) {
                    state.setStarting(false);
                }
                failureCounter.increment();
                log.warn("Failed to start on-demand capacity: {}", e.getMessage());
                return Mono.just(CapacityOutcome.FAILED);
            });
    }

    /**
     * (Re)schedule the idle shutdown using the configured delay
     */
    public void armIdleShutdown() {
        armIdleShutdown(idleShutdown);
    }

    /**
     * (Re)schedule the idle shutdown; replaces any pending deadline.
     * Nothing is armed unless this controller started the capacity.
     */
    public synchronized void armIdleShutdown(Duration delay) {
        if (!enabled || !(state.isAutoStarted() || state.isStarting())) {
            return;
        }
        Instant deadline = clock.instant().plus(delay);
        state.setShutdownDeadline(deadline);
        log.debug("Idle shutdown armed for {}", deadline);
    }

    /**
     * Stop the capacity if this controller started it.
     *
     * @return Mono with true when a stop command was issued successfully; never errors
     */
    public Mono<Boolean> onIdleTimeout() {
        synchronized (this) {
            state.setShutdownDeadline(null);
            if (!state.isAutoStarted()) {
                log.debug("Idle timeout with no auto-started capacity, nothing to stop");
                return Mono.just(false);
            }
            if (stopping) {
                return Mono.just(false);
            }
            stopping = true;
        }

        log.info("Idle timeout reached, stopping on-demand capacity");
        return computeControl.stop()
            .switchIfEmpty(Mono.error(new LifecycleControlException("Stop command returned no result")))
            .map(transition -> {
                synchronized (this) {
                    stopping = false;
                    state = LifecycleState.initial();
                }
                stopCounter.increment();
                log.info("On-demand capacity stop result: {}", transition);
                return true;
            })
            .onErrorResume(e -> {
                synchronized (this) {
                    stopping = false;
                }
                failureCounter.increment();
                log.warn("Failed to stop on-demand capacity, will retry on next activity: {}", e.getMessage());
                return Mono.just(false);
            });
    }

    /**
     * Fire the idle shutdown when its deadline has passed
     *
     * @return Mono with true when a stop was issued
     */
    public Mono<Boolean> checkDeadline() {
        synchronized (this) {
            Instant deadline = state.getShutdownDeadline();
            if (deadline == null || clock.instant().isBefore(deadline)) {
                return Mono.just(false);
            }
        }
        return onIdleTimeout();
    }

    @Scheduled(fixedDelayString = "${arbiter.lifecycle.tick-interval:15000}")
    public void tick() {
        checkDeadline().subscribe();
    }

    /**
     * Operator-requested start. The capacity is not owned by this controller afterwards,
     * so it is never stopped by the idle timer.
     *
     * @return Mono with the power transition; errors with {@link LifecycleControlException}
     */
    public Mono<PowerTransition> manualStart() {
        log.info("Manual start of on-demand capacity requested");
        return computeControl.start()
            .switchIfEmpty(Mono.error(new LifecycleControlException("Start command returned no result")))
            .doOnError(e -> failureCounter.increment());
    }

    /**
     * Operator-requested stop. A successful stop also drops ownership and any pending idle shutdown.
     *
     * @return Mono with the power transition; errors with {@link LifecycleControlException}
     */
    public Mono<PowerTransition> manualStop() {
        log.info("Manual stop of on-demand capacity requested");
        return computeControl.stop()
            .switchIfEmpty(Mono.error(new LifecycleControlException("Stop command returned no result")))
            .doOnNext(transition -> {
                synchronized (this) {
                    state = LifecycleState.initial();
                }
            })
            .doOnError(e -> failureCounter.increment());
    }

    /**
     * Power status as reported by the control plane, e.g. RUNNING or TERMINATED
     */
    public Mono<String> capacityStatus() {
        return computeControl.status();
    }

    /**
     * Copy of the current state
     */
    public synchronized LifecycleState state() {
        return state.toBuilder().build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getIdleShutdown() {
        return idleShutdown;
    }
}
