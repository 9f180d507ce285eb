package com.astroplatform.snapshot.persistence;

import com.astroplatform.common.exception.AstroEngineException;

/** A snapshot could not be converted to or from its stored form. */
public class SnapshotPersistenceException extends AstroEngineException {

    public SnapshotPersistenceException(String message, Throwable cause) {
        super("DailyConditionsMapper", message, cause);
    }
}
