package org.springaicommunity.pensieve;

import java.util.List;

/**
 * Merged listing across stores together with the stores that failed.
 *
 * @param repositories merged repositories, sorted for display
 * @param failures stores that could not be listed, in configuration order
 * @param succeededStores names of the stores that answered, in configuration order
 */
public record AggregationResult(List<Repository> repositories, List<StoreFailure> failures,
		List<String> succeededStores) {

	public AggregationResult {
		repositories = List.copyOf(repositories);
		failures = List.copyOf(failures);
		succeededStores = List.copyOf(succeededStores);
	}

	public boolean isPartial() {
		return !failures.isEmpty() && !succeededStores.isEmpty();
	}

	public boolean isTotalFailure() {
		return !failures.isEmpty() && succeededStores.isEmpty();
	}

}
