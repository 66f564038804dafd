package org.springaicommunity.pensieve;

/**
 * A store whose listing could not be obtained during an aggregation.
 *
 * @param storeName the configured store name
 * @param cause why the listing failed
 */
public record StoreFailure(String storeName, Throwable cause) {

	public String message() {
		return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
	}

}
