/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

import static io.docvalue.util.CheckNull.requireNonNull;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * An instant in UTC with nanosecond precision, held as seconds since the
 * Epoch plus a nanosecond adjustment. Values range from
 * 0001-01-01T00:00:00Z to 9999-12-31T23:59:59.999999999Z, so every value
 * has an ISO 8601 form; that form is also its JSON form.
 */
public final class TimestampValue extends FieldValue {

    /** 0001-01-01T00:00:00Z */
    public static final long MIN_SECONDS = -62135596800L;

    /** 9999-12-31T23:59:59Z */
    public static final long MAX_SECONDS = 253402300799L;

    private static final int NANOS_PER_SECOND = 1_000_000_000;

    private final long seconds;
    private final int nanos;

    /**
     * @param seconds seconds since 1970-01-01T00:00:00Z, between
     * {@link #MIN_SECONDS} and {@link #MAX_SECONDS}
     * @param nanos the nanosecond adjustment, from 0 to 999,999,999
     *
     * @throws IllegalArgumentException if either argument is out of range
     */
    public TimestampValue(long seconds, int nanos) {
        if (seconds < MIN_SECONDS || seconds > MAX_SECONDS) {
            throw new IllegalArgumentException(
                "TimestampValue: seconds out of range: " + seconds);
        }
        if (nanos < 0 || nanos >= NANOS_PER_SECOND) {
            throw new IllegalArgumentException(
                "TimestampValue: nanos out of range: " + nanos);
        }
        this.seconds = seconds;
        this.nanos = nanos;
    }

    /**
     * @param millis milliseconds since 1970-01-01T00:00:00Z
     *
     * @throws IllegalArgumentException if the instant is out of range
     */
    public TimestampValue(long millis) {
        this(Math.floorDiv(millis, 1000L),
             (int) Math.floorMod(millis, 1000L) * 1_000_000);
    }

    /**
     * @param instant the instant
     *
     * @throws IllegalArgumentException if the instant is out of range
     */
    public TimestampValue(Instant instant) {
        this(requireInstant(instant).getEpochSecond(), instant.getNano());
    }

    private static Instant requireInstant(Instant instant) {
        requireNonNull(instant, "TimestampValue: instant must be non-null");
        return instant;
    }

    /**
     * @return the current time
     */
    public static TimestampValue now() {
        return new TimestampValue(Instant.now());
    }

    @Override
    public Type getType() {
        return Type.TIMESTAMP;
    }

    public long getSeconds() {
        return seconds;
    }

    public int getNanos() {
        return nanos;
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(seconds, nanos);
    }

    /**
     * @return the ISO 8601 form in UTC, for example 2024-05-01T10:15:30Z
     */
    public String toIsoString() {
        return DateTimeFormatter.ISO_INSTANT.format(toInstant());
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof TimestampValue)) {
            return false;
        }
        TimestampValue ts = (TimestampValue) other;
        return seconds == ts.seconds && nanos == ts.nanos;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(seconds) + nanos;
    }
}
