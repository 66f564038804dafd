package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a repository could not be created on a store.
 *
 * <p>
 * {@link Reason#ALREADY_EXISTS} is an ordinary outcome of a user request, while
 * {@link Reason#UNREACHABLE} signals an infrastructure failure.
 */
public class CreateException extends PensieveException {

	public enum Reason {

		/** A repository with that name is already on the store. */
		ALREADY_EXISTS,

		/** The store could not be reached or did not answer. */
		UNREACHABLE,

		/** The store answered but refused the request for another reason. */
		REJECTED

	}

	private final String storeName;

	private final String repositoryName;

	private final Reason reason;

	public CreateException(String storeName, String repositoryName, Reason reason, String message) {
		this(storeName, repositoryName, reason, message, null);
	}

	public CreateException(String storeName, String repositoryName, Reason reason, String message,
			@Nullable Throwable cause) {
		super(message, cause);
		this.storeName = storeName;
		this.repositoryName = repositoryName;
		this.reason = reason;
	}

	public static CreateException alreadyExists(String storeName, String repositoryName) {
		return new CreateException(storeName, repositoryName, Reason.ALREADY_EXISTS,
				"Repository \"" + storeName + ":" + repositoryName + "\" already exists.");
	}

	public String getStoreName() {
		return storeName;
	}

	public String getRepositoryName() {
		return repositoryName;
	}

	public Reason getReason() {
		return reason;
	}

	public boolean isAlreadyExists() {
		return reason == Reason.ALREADY_EXISTS;
	}

}
