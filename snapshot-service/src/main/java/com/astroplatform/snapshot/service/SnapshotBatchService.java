package com.astroplatform.snapshot.service;

import com.astroplatform.common.ephemeris.EphemerisProviderFactory;
import com.astroplatform.common.exception.EngineConfigurationException;
import com.astroplatform.common.exception.InvalidInstantException;
import com.astroplatform.common.model.DailySnapshot;
import com.astroplatform.common.snapshot.SnapshotAssembler;
import com.astroplatform.snapshot.dto.BatchResultDTO;
import com.astroplatform.snapshot.dto.SnapshotSummaryDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes snapshots for an inclusive date range.
 *
 * <p>The range is split into contiguous chunks, one per worker. Each chunk runs on
 * {@code boundedElastic} with its own provider from the {@link EphemerisProviderFactory}
 * and an assembler bound to it; chunk results are concatenated back in date order.
 * A date that fails to compute is logged and counted, never retried.
 */
@Service
public class SnapshotBatchService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotBatchService.class);

    static final int MAX_RANGE_DAYS = 366 * 50;

    private final SnapshotAssembler assembler;
    private final EphemerisProviderFactory providerFactory;
    private final SnapshotService snapshotService;
    private final int workers;

    public SnapshotBatchService(SnapshotAssembler assembler,
                                EphemerisProviderFactory providerFactory,
                                SnapshotService snapshotService,
                                @Value("${astro.batch.workers:4}") int workers) {
        if (workers < 1) {
            throw new EngineConfigurationException("SnapshotBatchService", "astro.batch.workers must be >= 1, got " + workers);
        }
        this.assembler       = assembler;
        this.providerFactory = providerFactory;
        this.snapshotService = snapshotService;
        this.workers         = workers;
    }

    public Mono<BatchResultDTO> run(LocalDate from, LocalDate to, boolean store) {
        if (from == null || to == null || from.isAfter(to)) {
            return Mono.error(new InvalidInstantException("invalid date range " + from + " .. " + to));
        }
        List<LocalDate> dates = from.datesUntil(to.plusDays(1)).toList();
        if (dates.size() > MAX_RANGE_DAYS) {
            return Mono.error(new InvalidInstantException(
                "date range of " + dates.size() + " days exceeds " + MAX_RANGE_DAYS));
        }
        List<List<LocalDate>> chunks = chunk(dates, workers);
        log.info("BATCH_STARTED from={} to={} days={} chunks={} store={}", from, to, dates.size(), chunks.size(), store);

        return Flux.fromIterable(chunks)
            .flatMapSequential(chunk -> Mono.fromCallable(() -> computeChunk(chunk))
                                            .subscribeOn(Schedulers.boundedElastic()),
                               workers)
            .collectList()
            .flatMap(results -> {
                List<Dated> computed = new ArrayList<>();
                List<LocalDate> failed = new ArrayList<>();
                for (ChunkResult r : results) {
                    computed.addAll(r.computed());
                    failed.addAll(r.failed());
                }
                Mono<Long> stored = store ? storeAll(computed) : Mono.just(0L);
                return stored.map(n -> new BatchResultDTO(
                    from, to, dates.size(), computed.size(), failed.size(), n, failed,
                    computed.stream().map(d -> SnapshotSummaryDTO.of(d.date(), d.snapshot())).toList()));
            })
            .doOnSuccess(r -> log.info("BATCH_COMPLETED from={} to={} computed={} failed={} stored={}",
                                       from, to, r.computed(), r.failed(), r.stored()))
            .doOnError(e -> log.error("Batch failed. from={} to={}", from, to, e));
    }

    /** Splits {@code dates} into at most {@code parts} contiguous, order-preserving chunks. */
    static <T> List<List<T>> chunk(List<T> dates, int parts) {
        List<List<T>> chunks = new ArrayList<>();
        if (dates.isEmpty()) {
            return chunks;
        }
        int size = (dates.size() + parts - 1) / parts;
        for (int i = 0; i < dates.size(); i += size) {
            chunks.add(dates.subList(i, Math.min(i + size, dates.size())));
        }
        return chunks;
    }

    private ChunkResult computeChunk(List<LocalDate> chunk) {
        SnapshotAssembler worker = assembler.withProvider(providerFactory.open());
        List<Dated> computed = new ArrayList<>();
        List<LocalDate> failed = new ArrayList<>();
        for (LocalDate date : chunk) {
            try {
                computed.add(new Dated(date, worker.assemble(SnapshotService.snapshotInstant(date))));
            } catch (RuntimeException e) {
                log.error("BATCH_DATE_FAILED date={} reason={}", date, e.getMessage(), e);
                failed.add(date);
            }
        }
        log.debug("BATCH_CHUNK_DONE first={} last={} computed={} failed={}",
                  chunk.get(0), chunk.get(chunk.size() - 1), computed.size(), failed.size());
        return new ChunkResult(computed, failed);
    }

    private Mono<Long> storeAll(List<Dated> computed) {
        return Flux.fromIterable(computed)
            .concatMap(d -> snapshotService.store(d.date(), d.snapshot())
                .thenReturn(1L)
                .onErrorResume(e -> {
                    log.warn("BATCH_STORE_FAILED date={} reason={}", d.date(), e.getMessage());
                    return Mono.just(0L);
                }))
            .reduce(0L, Long::sum);
    }

    private record Dated(LocalDate date, DailySnapshot snapshot) {}

    private record ChunkResult(List<Dated> computed, List<LocalDate> failed) {}
}
