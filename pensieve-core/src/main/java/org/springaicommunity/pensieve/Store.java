package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One configured remote backend holding git repositories.
 *
 * <p>
 * Implementations hold only their own immutable configuration, so calls on different
 * stores may run concurrently. Failures are thrown to the caller and never swallowed;
 * whether a failure aborts a command is decided by the caller.
 */
public interface Store {

	/**
	 * The name this store is configured under.
	 */
	String name();

	/**
	 * Enumerate every repository the backend currently exposes. Does not change backend
	 * state. Blocks for a network or SSH round trip.
	 * @return repositories tagged with {@link #name()}
	 * @throws FetchException if the backend cannot be reached or answers with an error
	 */
	List<Repository> listRepositories();

	/**
	 * Create a repository. Issues exactly one creation request.
	 * @param name repository name
	 * @param owner owner to create it under, or null for the store's default
	 * @return the created repository
	 * @throws CreateException if the repository exists or the backend refuses or cannot
	 * be reached
	 */
	Repository createRepository(String name, @Nullable String owner);

	/**
	 * Resolve what {@code git clone} needs to fetch a repository. Does not run git.
	 * @param name repository name
	 * @param owner owner, or null for the store's default
	 * @return clone source
	 * @throws NotFoundException if the store answered that no such repository exists
	 * @throws FetchException if the store could not be asked
	 */
	CloneSource cloneSource(String name, @Nullable String owner);

	/**
	 * The configured identity used when a locator omits the owner, or null for stores
	 * without an owner concept.
	 */
	@Nullable
	String defaultOwner();

}
