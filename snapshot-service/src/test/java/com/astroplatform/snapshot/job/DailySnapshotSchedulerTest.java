package com.astroplatform.snapshot.job;

import com.astroplatform.snapshot.SnapshotFixtures;
import com.astroplatform.snapshot.service.SnapshotService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DailySnapshotSchedulerTest {

    private static final Clock LATE_EVENING = Clock.fixed(Instant.parse("2024-03-15T23:30:00Z"), ZoneOffset.UTC);

    @Mock private SnapshotService snapshotService;

    @Test
    void cycleComputesTodayUtc() {
        LocalDate today = LocalDate.of(2024, 3, 15);
        when(snapshotService.computeAndStore(today)).thenReturn(Mono.just(SnapshotFixtures.snapshot()));

        DailySnapshotScheduler scheduler = new DailySnapshotScheduler(snapshotService, LATE_EVENING);

        StepVerifier.create(scheduler.runCycle())
            .expectNext(today)
            .verifyComplete();
        verify(snapshotService).computeAndStore(today);
    }

    @Test
    void disabledSchedulerNeverTriggers() {
        DailySnapshotScheduler scheduler = new DailySnapshotScheduler(snapshotService, LATE_EVENING);

        scheduler.start();
        scheduler.stop();

        verifyNoInteractions(snapshotService);
    }
}
