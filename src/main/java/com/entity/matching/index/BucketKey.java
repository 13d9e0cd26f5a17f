package com.entity.matching.index;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Identifies one bucket of a {@link BlockingIndex}: a tuple of field values,
 * or a tuple of other bucket keys for composite indices. Parts may be null.
 */
public record BucketKey(List<Object> parts) {

    public BucketKey {
        parts = Collections.unmodifiableList(Arrays.asList(parts.toArray()));
    }

    public static BucketKey of(Object... parts) {
        return new BucketKey(Arrays.asList(parts));
    }

    @Override
    public String toString() {
        return parts.toString();
    }
}
