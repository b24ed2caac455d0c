package com.verlumen.chrono.marketdata;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import java.time.Duration;

/**
 * Outcome of ingesting one batch. {@code ingested + failed} always equals the number of feeds
 * submitted.
 */
public record IngestResult(
        Status status,
        int ingested,
        int failed,
        Duration latency,
        String message,
        ImmutableList<IngestError> errors) {

    public enum Status {
        SUCCESS,
        PARTIAL,
        ERROR;

        public String wireName() {
            return Ascii.toLowerCase(name());
        }

        public static Status fromWireName(String name) {
            return valueOf(Ascii.toUpperCase(name));
        }

        /** Classifies per-item counts of a non-empty batch. */
        public static Status of(int ingested, int failed) {
            if (failed == 0) {
                return SUCCESS;
            }
            return ingested > 0 ? PARTIAL : ERROR;
        }
    }

    public IngestResult {
        checkArgument(ingested >= 0 && failed >= 0, "Counts must not be negative");
    }

    /** A whole-batch rejection; nothing from the batch was stored. */
    public static IngestResult rejected(int submitted, Duration latency, String message) {
        return new IngestResult(Status.ERROR, 0, submitted, latency, message, ImmutableList.of());
    }

    public int submitted() {
        return ingested + failed;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
