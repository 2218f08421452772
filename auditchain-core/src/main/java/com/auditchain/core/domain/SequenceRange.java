package com.auditchain.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Inclusive range of chain sequences. A range with {@code to < from} is empty.
 */
public record SequenceRange(long from, long to) {

    private static final SequenceRange EMPTY = new SequenceRange(0, -1);

    public static SequenceRange empty() {
        return EMPTY;
    }

    public static SequenceRange of(long from, long to) {
        return to < from ? new SequenceRange(from, from - 1) : new SequenceRange(from, to);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return to < from;
    }

    @JsonIgnore
    public long size() {
        return isEmpty() ? 0 : to - from + 1;
    }

    public boolean contains(long sequence) {
        return sequence >= from && sequence <= to;
    }

    @Override
    public String toString() {
        return isEmpty() ? "[]" : "[" + from + "," + to + "]";
    }
}
