package org.springaicommunity.pensieve;

import java.util.Locale;

/**
 * What a {@code cached} query returns.
 */
public enum CachedQueryKind {

	/** Names of the stores covered by the snapshot. */
	STORES,

	/** Every topic label used by a cached repository. */
	TOPICS,

	/** Locators of every cached repository. */
	NAMES;

	public static CachedQueryKind fromArgument(String value) {
		try {
			return valueOf(value.toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e) {
			throw new IllegalArgumentException(
					"Invalid cached query '" + value + "': must be 'stores', 'topics', or 'names'");
		}
	}

}
