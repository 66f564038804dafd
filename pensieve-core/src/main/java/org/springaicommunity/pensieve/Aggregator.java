package org.springaicommunity.pensieve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lists every store concurrently and merges the answers into one view.
 *
 * <p>
 * Each store is listed on its own thread, so the total latency is that of the slowest
 * store. A store that fails or misses the deadline is reported in
 * {@link AggregationResult#failures()} and does not affect the others. The merged view is
 * sorted by repository name, then store name, then owner, independent of the order in
 * which stores answered. Repositories with the same name on different stores are kept as
 * separate entries.
 */
public class Aggregator {

	private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);

	static final Comparator<Repository> DISPLAY_ORDER = Comparator.comparing(Repository::name)
		.thenComparing(Repository::storeName)
		.thenComparing(Repository::owner, Comparator.nullsFirst(Comparator.naturalOrder()));

	private final Duration storeTimeout;

	public Aggregator(Duration storeTimeout) {
		this.storeTimeout = storeTimeout;
	}

	/**
	 * List all stores, merge, filter and sort.
	 * @param stores stores to query
	 * @param filter topic filter
	 * @return filtered view and per-store failures
	 */
	public AggregationResult aggregate(Collection<Store> stores, RepositoryFilter filter) {
		AggregationResult collected = collect(stores);
		return new AggregationResult(filter(collected.repositories(), filter), collected.failures(),
				collected.succeededStores());
	}

	/**
	 * List all stores and merge without filtering.
	 * @param stores stores to query
	 * @return every listed repository, sorted, and per-store failures
	 */
	public AggregationResult collect(Collection<Store> stores) {
		if (stores.isEmpty()) {
			return new AggregationResult(List.of(), List.of(), List.of());
		}

		ExecutorService executor = Executors.newFixedThreadPool(stores.size(), new StoreThreadFactory());
		try {
			Map<Store, Future<List<Repository>>> pending = new LinkedHashMap<>();
			for (Store store : stores) {
				pending.put(store, executor.submit(store::listRepositories));
			}

			long deadline = System.nanoTime() + storeTimeout.toNanos();
			List<Repository> merged = new ArrayList<>();
			List<StoreFailure> failures = new ArrayList<>();
			List<String> succeeded = new ArrayList<>();

			for (Map.Entry<Store, Future<List<Repository>>> entry : pending.entrySet()) {
				String storeName = entry.getKey().name();
				try {
					List<Repository> listed = await(entry.getValue(), deadline);
					for (Repository repository : listed) {
						merged.add(repository.withStoreName(storeName));
					}
					succeeded.add(storeName);
				}
				catch (ExecutionException e) {
					Throwable cause = e.getCause() != null ? e.getCause() : e;
					logger.warn("Could not list store {}: {}", storeName, cause.getMessage());
					failures.add(new StoreFailure(storeName, cause instanceof FetchException ? cause
							: new FetchException(storeName, String.valueOf(cause.getMessage()), cause)));
				}
				catch (TimeoutException e) {
					entry.getValue().cancel(true);
					logger.warn("Store {} did not answer within {}s", storeName, storeTimeout.toSeconds());
					failures.add(new StoreFailure(storeName, new FetchException(storeName,
							"No answer within " + storeTimeout.toSeconds() + "s", e)));
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					failures.add(new StoreFailure(storeName,
							new FetchException(storeName, "Interrupted while waiting for the listing", e)));
				}
			}

			merged.sort(DISPLAY_ORDER);
			logger.debug("Aggregated {} repositories from {} stores ({} failed)", merged.size(), succeeded.size(),
					failures.size());
			return new AggregationResult(merged, failures, succeeded);
		}
		finally {
			executor.shutdownNow();
		}
	}

	/**
	 * Apply a topic filter to an already sorted view.
	 */
	public static List<Repository> filter(List<Repository> repositories, RepositoryFilter filter) {
		return repositories.stream().filter(filter::includes).toList();
	}

	private static List<Repository> await(Future<List<Repository>> future, long deadline)
			throws ExecutionException, TimeoutException, InterruptedException {
		long remaining = Math.max(0, deadline - System.nanoTime());
		return future.get(remaining, TimeUnit.NANOSECONDS);
	}

	private static final class StoreThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "pensieve-store-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
