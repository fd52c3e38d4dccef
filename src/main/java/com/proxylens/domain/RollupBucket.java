package com.proxylens.domain;

import java.util.Objects;

/**
 * Count of events matching exactly one {@link RollupKey}.
 * Derived state, rebuilt from the event store on demand.
 */
public final class RollupBucket {

    private final RollupKey key;
    private final long total;

    public RollupBucket(RollupKey key, long total) {
        this.key = Objects.requireNonNull(key, "key");
        this.total = total;
    }

    public RollupKey getKey() {
        return key;
    }

    public long getTotal() {
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RollupBucket that = (RollupBucket) o;
        return total == that.total && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, total);
    }

    @Override
    public String toString() {
        return "RollupBucket{" + key + ", total=" + total + '}';
    }
}
