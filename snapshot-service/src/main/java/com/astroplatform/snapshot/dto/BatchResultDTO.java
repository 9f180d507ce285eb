package com.astroplatform.snapshot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of a date-range batch. {@code snapshots} is in date order and holds only the
 * dates that computed; {@code failedDates} the ones that did not.
 */
public record BatchResultDTO(
    @JsonProperty("from")        LocalDate from,
    @JsonProperty("to")          LocalDate to,
    @JsonProperty("requested")   int requested,
    @JsonProperty("computed")    int computed,
    @JsonProperty("failed")      int failed,
    @JsonProperty("stored")      long stored,
    @JsonProperty("failedDates") List<LocalDate> failedDates,
    @JsonProperty("snapshots")   List<SnapshotSummaryDTO> snapshots
) {}
