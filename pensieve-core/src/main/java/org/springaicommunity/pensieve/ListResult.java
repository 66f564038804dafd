package org.springaicommunity.pensieve;

import java.util.List;

/**
 * Outcome of a {@code list} command.
 *
 * @param repositories filtered, sorted repositories
 * @param failures stores that could not be listed
 * @param fromCache true if every store failed and the previous snapshot was served
 */
public record ListResult(List<Repository> repositories, List<StoreFailure> failures, boolean fromCache) {

	public ListResult {
		repositories = List.copyOf(repositories);
		failures = List.copyOf(failures);
	}

}
