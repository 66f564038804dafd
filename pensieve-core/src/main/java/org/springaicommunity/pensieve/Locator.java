package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;

/**
 * A parsed {@code store:[owner/]name} reference to a repository on a configured store.
 *
 * @param storeName the configured store name
 * @param owner the explicit or inferred owner, or null when the store has none
 * @param name the repository name
 */
public record Locator(String storeName, @Nullable String owner, String name) {

	public String fullName() {
		return owner != null ? owner + "/" + name : name;
	}

	@Override
	public String toString() {
		return storeName + ":" + fullName();
	}

}
