package com.astroplatform.snapshot.service;

import com.astroplatform.common.ephemeris.EphemerisProvider;
import com.astroplatform.common.ephemeris.EphemerisProviderFactory;
import com.astroplatform.common.ephemeris.EphemerisReading;
import com.astroplatform.common.ephemeris.FixedEphemerisProvider;
import com.astroplatform.common.exception.EngineConfigurationException;
import com.astroplatform.common.exception.InvalidInstantException;
import com.astroplatform.common.model.CelestialBody;
import com.astroplatform.common.snapshot.SnapshotAssembler;
import com.astroplatform.snapshot.SnapshotFixtures;
import com.astroplatform.snapshot.dto.SnapshotSummaryDTO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SnapshotBatchServiceTest {

    private static final LocalDate FROM = LocalDate.of(2024, 3, 1);
    private static final LocalDate TO   = LocalDate.of(2024, 3, 10);

    @Mock private SnapshotService snapshotService;

    private final AtomicInteger opened = new AtomicInteger();

    private SnapshotBatchService batch(EphemerisProviderFactory factory, int workers) {
        EphemerisProviderFactory counting = () -> {
            opened.incrementAndGet();
            return factory.open();
        };
        return new SnapshotBatchService(new SnapshotAssembler(SnapshotFixtures.sky().build()),
                                        counting, snapshotService, workers);
    }

    private SnapshotBatchService batch() {
        FixedEphemerisProvider fixed = SnapshotFixtures.sky().build();
        return batch(() -> fixed, 4);
    }

    @Nested
    @DisplayName("run()")
    class RunTests {

        @Test
        @DisplayName("every date computed once, in date order, one provider per chunk")
        void computesRangeInOrder() {
            StepVerifier.create(batch().run(FROM, TO, false))
                .assertNext(result -> {
                    assertEquals(10, result.requested());
                    assertEquals(10, result.computed());
                    assertEquals(0, result.failed());
                    assertEquals(0L, result.stored());
                    assertEquals(FROM.datesUntil(TO.plusDays(1)).toList(),
                                 result.snapshots().stream().map(SnapshotSummaryDTO::tradeDate).toList());
                })
                .verifyComplete();
            assertEquals(4, opened.get());
            verifyNoInteractions(snapshotService);
        }

        @Test
        @DisplayName("a failing date is counted and skipped")
        void failingDateSkipped() {
            Instant bad = SnapshotService.snapshotInstant(LocalDate.of(2024, 3, 5));
            FixedEphemerisProvider fixed = SnapshotFixtures.sky().build();
            EphemerisProvider gap = new EphemerisProvider() {
                @Override
                public EphemerisReading position(Instant instant, CelestialBody body) {
                    return fixed.position(instant, body);
                }

                @Override
                public boolean supports(Instant instant) {
                    return !instant.equals(bad);
                }
            };

            StepVerifier.create(batch(() -> gap, 3).run(FROM, TO, false))
                .assertNext(result -> {
                    assertEquals(9, result.computed());
                    assertEquals(1, result.failed());
                    assertEquals(List.of(LocalDate.of(2024, 3, 5)), result.failedDates());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("store=true upserts each computed date; a failed write is not counted")
        void storesComputedDates() {
            when(snapshotService.store(any(), any())).thenReturn(Mono.empty());
            when(snapshotService.store(eq(LocalDate.of(2024, 3, 2)), any()))
                .thenReturn(Mono.error(new IllegalStateException("db down")));

            StepVerifier.create(batch().run(FROM, LocalDate.of(2024, 3, 4), true))
                .assertNext(result -> {
                    assertEquals(4, result.computed());
                    assertEquals(3L, result.stored());
                })
                .verifyComplete();
            verify(snapshotService, times(4)).store(any(), any());
        }

        @Test
        @DisplayName("single-day range")
        void singleDay() {
            StepVerifier.create(batch().run(FROM, FROM, false))
                .assertNext(result -> assertEquals(1, result.computed()))
                .verifyComplete();
            assertEquals(1, opened.get());
        }

        @Test
        @DisplayName("inverted range → InvalidInstantException")
        void invertedRange() {
            StepVerifier.create(batch().run(TO, FROM, false))
                .expectError(InvalidInstantException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("chunk()")
    class ChunkTests {

        @Test
        @DisplayName("contiguous, order-preserving, no more chunks than workers")
        void splits() {
            List<Integer> items = IntStream.rangeClosed(1, 10).boxed().toList();
            List<List<Integer>> chunks = SnapshotBatchService.chunk(items, 4);

            assertEquals(List.of(List.of(1, 2, 3), List.of(4, 5, 6), List.of(7, 8, 9), List.of(10)), chunks);
        }

        @Test
        @DisplayName("fewer items than workers → one item per chunk")
        void fewItems() {
            assertEquals(3, SnapshotBatchService.chunk(List.of(1, 2, 3), 4).size());
            assertTrue(SnapshotBatchService.chunk(List.of(), 4).isEmpty());
        }
    }

    @Test
    @DisplayName("zero workers → configuration error")
    void zeroWorkers() {
        assertThrows(EngineConfigurationException.class, () -> batch(() -> null, 0));
    }
}
