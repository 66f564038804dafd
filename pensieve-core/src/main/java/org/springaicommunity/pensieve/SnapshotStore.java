package org.springaicommunity.pensieve;

import java.util.Optional;

/**
 * Persistence of the repository cache snapshot.
 *
 * <p>
 * Abstracts file system operations so that {@link CacheManager} can be tested with an
 * in-memory implementation.
 */
public interface SnapshotStore {

	/**
	 * Read the persisted snapshot.
	 * @return the snapshot, or empty if none exists or it cannot be used
	 */
	Optional<CacheSnapshot> read();

	/**
	 * Replace the persisted snapshot. Readers observe either the old or the new snapshot,
	 * never a partial one.
	 * @param snapshot the snapshot to persist
	 * @throws PensieveException if the snapshot could not be written
	 */
	void write(CacheSnapshot snapshot);

}
