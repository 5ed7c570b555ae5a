package com.accesslog.risk.model;

import java.time.Instant;
import java.util.Comparator;

public record WindowKey(String address, Instant windowStart) implements Comparable<WindowKey> {

    private static final Comparator<WindowKey> ORDER = Comparator
            .comparing(WindowKey::address)
            .thenComparing(WindowKey::windowStart);

    @Override
    public int compareTo(WindowKey other) {
        return ORDER.compare(this, other);
    }
}
