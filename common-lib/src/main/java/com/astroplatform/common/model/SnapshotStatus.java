package com.astroplatform.common.model;

/**
 * Completeness of a {@link DailySnapshot}. An absent snapshot is never represented here:
 * an invalid instant fails with {@link com.astroplatform.common.exception.InvalidInstantException}.
 */
public enum SnapshotStatus {
    /** Every tracked body was resolved. */
    COMPLETE,
    /** At least one body failed and was excluded; the snapshot is still usable. */
    PARTIAL
}
