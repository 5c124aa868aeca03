package com.prpulse.pipeline.client;

import java.util.List;

/**
 * One page of a remote collection. {@code nextCursor} is opaque to callers and
 * is passed back unchanged to fetch the following page.
 */
public record Page<T>(List<T> items, String nextCursor) {

    public Page {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static <T> Page<T> last(List<T> items) {
        return new Page<>(items, null);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
