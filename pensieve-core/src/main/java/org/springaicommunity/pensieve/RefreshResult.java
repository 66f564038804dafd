package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of {@link CacheManager#refresh()}.
 *
 * @param aggregation the live aggregation, unfiltered
 * @param snapshot the snapshot current after the refresh, or null if there is none
 * @param written whether a new snapshot was persisted
 */
public record RefreshResult(AggregationResult aggregation, @Nullable CacheSnapshot snapshot, boolean written) {
}
