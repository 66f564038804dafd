package org.springaicommunity.pensieve;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The persisted copy of the most recent aggregate view.
 *
 * @param version format version; files with any other version are ignored
 * @param capturedAt when the aggregation that produced the snapshot ran
 * @param stores names of the stores the snapshot covers, in configuration order
 * @param repositories every cached repository, unfiltered, in display order
 */
public record CacheSnapshot(int version, @JsonProperty("captured_at") Instant capturedAt, List<String> stores,
		List<Repository> repositories) {

	public static final int CURRENT_VERSION = 1;

	public CacheSnapshot {
		Objects.requireNonNull(capturedAt, "captured_at");
		Objects.requireNonNull(stores, "stores");
		Objects.requireNonNull(repositories, "repositories");
		stores = List.copyOf(stores);
		repositories = List.copyOf(repositories);
	}

	public static CacheSnapshot of(Instant capturedAt, List<String> stores, List<Repository> repositories) {
		return new CacheSnapshot(CURRENT_VERSION, capturedAt, stores, repositories);
	}

}
