package com.astroplatform.snapshot.job;

import com.astroplatform.snapshot.service.SnapshotService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;

/**
 * Computes and stores today's snapshot on a fixed cadence.
 *
 * <pre>
 *   delay(initial) → computeAndStore(today UTC) → delay(interval) → repeat
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} whose terminal {@code subscribe()} schedules the
 * next one; {@code Mono.delay()} holds no thread while waiting. A failed cycle is logged
 * and the loop continues after {@code fallback-interval}.
 */
@Component
public class DailySnapshotScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailySnapshotScheduler.class);

    private final SnapshotService snapshotService;
    private final Clock clock;

    @Value("${astro.scheduler.enabled:true}")
    private boolean enabled;

    @Value("${astro.scheduler.initial-delay:30s}")
    private Duration initialDelay;

    @Value("${astro.scheduler.interval:24h}")
    private Duration interval;

    @Value("${astro.scheduler.fallback-interval:1h}")
    private Duration fallbackInterval;

    private volatile Disposable pending;
    private volatile boolean stopped;

    @Autowired
    public DailySnapshotScheduler(SnapshotService snapshotService) {
        this(snapshotService, Clock.systemUTC());
    }

    DailySnapshotScheduler(SnapshotService snapshotService, Clock clock) {
        this.snapshotService = snapshotService;
        this.clock           = clock;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Daily snapshot scheduler disabled");
            return;
        }
        log.info("Daily snapshot scheduler started. initialDelay={} interval={}", initialDelay, interval);
        scheduleNextCycle(initialDelay);
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable d = pending;
        if (d != null) {
            d.dispose();
        }
    }

    void scheduleNextCycle(Duration delay) {
        if (stopped) {
            return;
        }
        pending = Mono.delay(delay)
            .then(Mono.defer(this::runCycle))
            .subscribe(
                date -> {
                    log.info("DAILY_SNAPSHOT_DONE date={} nextInSeconds={}", date, interval.toSeconds());
                    scheduleNextCycle(interval);
                },
                err -> {
                    log.error("Daily snapshot cycle failed, rescheduling in {}", fallbackInterval, err);
                    scheduleNextCycle(fallbackInterval);
                }
            );
    }

    /** One cycle: computes and stores the snapshot for the current UTC date. */
    Mono<LocalDate> runCycle() {
        LocalDate today = LocalDate.now(clock);
        log.info("Triggering daily snapshot. date={}", today);
        return snapshotService.computeAndStore(today).thenReturn(today);
    }
}
