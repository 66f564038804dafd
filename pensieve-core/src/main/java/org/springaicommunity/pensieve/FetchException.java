package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a store cannot be queried: network or SSH failure, bad credentials, a
 * non-zero agent exit, or a timeout.
 */
public class FetchException extends PensieveException {

	private final String storeName;

	public FetchException(String storeName, String message) {
		this(storeName, message, null);
	}

	public FetchException(String storeName, String message, @Nullable Throwable cause) {
		super("Store \"" + storeName + "\": " + message, cause);
		this.storeName = storeName;
	}

	public String getStoreName() {
		return storeName;
	}

}
