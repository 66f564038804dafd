package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Owns the cached aggregate view and keeps it coherent with the stores.
 *
 * <p>
 * The snapshot is read lazily from the {@link SnapshotStore} on first use. Freshness is
 * not stored: it is derived on every call from the snapshot's capture time, the maximum
 * age and the clock.
 */
public class CacheManager {

	private static final Logger logger = LoggerFactory.getLogger(CacheManager.class);

	private final SnapshotStore snapshotStore;

	private final Aggregator aggregator;

	private final Map<String, Store> stores;

	private final Duration maxAge;

	private final Clock clock;

	private @Nullable CacheSnapshot current;

	private boolean loaded;

	public CacheManager(SnapshotStore snapshotStore, Aggregator aggregator, Map<String, Store> stores,
			Duration maxAge, Clock clock) {
		this.snapshotStore = snapshotStore;
		this.aggregator = aggregator;
		this.stores = stores;
		this.maxAge = maxAge;
		this.clock = clock;
	}

	/**
	 * The current snapshot, if any.
	 */
	public synchronized Optional<CacheSnapshot> snapshot() {
		if (!loaded) {
			current = snapshotStore.read().orElse(null);
			loaded = true;
		}
		return Optional.ofNullable(current);
	}

	public CacheState state() {
		Optional<CacheSnapshot> snapshot = snapshot();
		if (snapshot.isEmpty()) {
			return CacheState.ABSENT;
		}
		Instant expiry = snapshot.get().capturedAt().plus(maxAge);
		return clock.instant().isAfter(expiry) ? CacheState.STALE : CacheState.FRESH;
	}

	/**
	 * Aggregate all stores and replace the snapshot with the result.
	 *
	 * <p>
	 * Stores that failed keep the entries the previous snapshot had for them. When every
	 * store failed the previous snapshot is kept and nothing is written.
	 * @return the live aggregation and the snapshot now current
	 */
	public synchronized RefreshResult refresh() {
		CacheSnapshot previous = snapshot().orElse(null);
		AggregationResult result = aggregator.collect(stores.values());

		if (result.isTotalFailure()) {
			logger.warn("Every store failed; keeping the previous cache");
			return new RefreshResult(result, previous, false);
		}

		List<Repository> repositories = new ArrayList<>(result.repositories());
		if (previous != null && !result.failures().isEmpty()) {
			Set<String> failed = result.failures()
				.stream()
				.map(StoreFailure::storeName)
				.collect(Collectors.toSet());
			previous.repositories()
				.stream()
				.filter(repository -> failed.contains(repository.storeName()))
				.forEach(repositories::add);
		}
		repositories.sort(Aggregator.DISPLAY_ORDER);

		CacheSnapshot refreshed = CacheSnapshot.of(clock.instant(), List.copyOf(stores.keySet()), repositories);
		try {
			snapshotStore.write(refreshed);
		}
		catch (PensieveException e) {
			logger.error("Could not update the cache: {}", e.getMessage());
			return new RefreshResult(result, previous, false);
		}
		current = refreshed;
		logger.debug("Cache refreshed with {} repositories", repositories.size());
		return new RefreshResult(result, refreshed, true);
	}

	/**
	 * Answer a query from the snapshot alone. Never contacts a store.
	 * @return the values, empty when there is no snapshot
	 */
	public List<String> cachedQuery(CachedQueryKind kind) {
		Optional<CacheSnapshot> snapshot = snapshot();
		if (snapshot.isEmpty()) {
			return List.of();
		}
		List<Repository> repositories = snapshot.get().repositories();
		switch (kind) {
			case STORES:
				return snapshot.get().stores();
			case TOPICS:
				Set<String> topics = new TreeSet<>();
				for (Repository repository : repositories) {
					if (repository.topics() != null) {
						topics.addAll(repository.topics());
					}
				}
				return List.copyOf(topics);
			case NAMES:
				return repositories.stream().map(Repository::locator).toList();
			default:
				throw new IllegalArgumentException("Unsupported cached query: " + kind);
		}
	}

}
