package com.regimeplatform.forecast.exception;

import com.regimeplatform.common.exception.ForecastException;

public class SnapshotNotFoundException extends ForecastException {

    public SnapshotNotFoundException(String name) {
        super("NOT_FOUND", "Snapshot not found: " + name);
    }
}
