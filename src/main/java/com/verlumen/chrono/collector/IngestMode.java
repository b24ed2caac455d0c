package com.verlumen.chrono.collector;

import com.google.common.base.Ascii;
import com.verlumen.chrono.execution.ConfigurationException;

/** Where forwarded batches go: a remote ingestion API, or a gateway running in this process. */
public enum IngestMode {
    HTTP,
    LOCAL;

    public static IngestMode fromString(String name) {
        try {
            return IngestMode.valueOf(Ascii.toUpperCase(name));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown ingest mode: " + name, e);
        }
    }
}
