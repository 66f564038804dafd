package org.springaicommunity.pensieve;

/**
 * Derived state of the repository cache. Never persisted; recomputed on every read.
 */
public enum CacheState {

	ABSENT, FRESH, STALE

}
