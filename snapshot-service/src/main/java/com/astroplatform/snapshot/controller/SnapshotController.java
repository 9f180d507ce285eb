package com.astroplatform.snapshot.controller;

import com.astroplatform.common.exception.InvalidInstantException;
import com.astroplatform.common.model.DailySnapshot;
import com.astroplatform.snapshot.dto.BatchResultDTO;
import com.astroplatform.snapshot.index.SnapshotMetadataMapper;
import com.astroplatform.snapshot.persistence.SnapshotPersistenceException;
import com.astroplatform.snapshot.service.SnapshotBatchService;
import com.astroplatform.snapshot.service.SnapshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/snapshots")
public class SnapshotController {

    private static final Logger log = LoggerFactory.getLogger(SnapshotController.class);

    private final SnapshotService snapshotService;
    private final SnapshotBatchService batchService;
    private final SnapshotMetadataMapper metadataMapper;

    public SnapshotController(SnapshotService snapshotService,
                              SnapshotBatchService batchService,
                              SnapshotMetadataMapper metadataMapper) {
        this.snapshotService = snapshotService;
        this.batchService    = batchService;
        this.metadataMapper  = metadataMapper;
    }

    @GetMapping("/health")
    public Mono<String> health() {
        return Mono.just("OK");
    }

    @GetMapping("/{date}")
    public Mono<ResponseEntity<DailySnapshot>> get(@PathVariable String date) {
        LocalDate tradeDate = parseDate(date);
        log.info("Snapshot query received. date={}", tradeDate);
        return snapshotService.findByDate(tradeDate)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Snapshot query error. date={}", tradeDate, e));
    }

    @PostMapping("/{date}/compute")
    public Mono<ResponseEntity<DailySnapshot>> compute(@PathVariable String date) {
        LocalDate tradeDate = parseDate(date);
        log.info("Snapshot compute requested. date={}", tradeDate);
        return snapshotService.computeAndStore(tradeDate)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{date}/preview")
    public Mono<ResponseEntity<DailySnapshot>> preview(@PathVariable String date) {
        LocalDate tradeDate = parseDate(date);
        log.info("Snapshot preview requested. date={}", tradeDate);
        return snapshotService.compute(tradeDate)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{date}/metadata")
    public Mono<ResponseEntity<Map<String, Object>>> metadata(@PathVariable String date) {
        LocalDate tradeDate = parseDate(date);
        log.info("Snapshot metadata requested. date={}", tradeDate);
        return snapshotService.findByDate(tradeDate)
            .map(snapshot -> ResponseEntity.ok(metadataMapper.toMetadata(tradeDate, snapshot)))
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping
    public Flux<DailySnapshot> range(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        log.info("Snapshot range query received. from={} to={}", from, to);
        return snapshotService.findRange(from, to);
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<BatchResultDTO>> batch(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "true") boolean store) {
        log.info("Snapshot batch requested. from={} to={} store={}", from, to, store);
        return batchService.run(from, to, store)
            .map(ResponseEntity::ok);
    }

    // ── error mapping ───────────────────────────────────────────────────────

    @ExceptionHandler(InvalidInstantException.class)
    public ResponseEntity<Map<String, String>> invalidInstant(InvalidInstantException e) {
        log.warn("Rejected request. component={} reason={}", e.getComponent(), e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(SnapshotPersistenceException.class)
    public ResponseEntity<Map<String, String>> persistenceFailure(SnapshotPersistenceException e) {
        log.error("Stored snapshot unreadable", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
    }

    private static LocalDate parseDate(String raw) {
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new InvalidInstantException("invalid date '" + raw + "', expected yyyy-MM-dd", e);
        }
    }
}
