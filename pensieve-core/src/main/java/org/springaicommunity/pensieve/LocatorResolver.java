package org.springaicommunity.pensieve;

import java.util.Map;

/**
 * Parses {@code store:name} and {@code store:owner/name} into a {@link Locator}.
 *
 * <p>
 * When the owner is omitted it is taken from the store's {@link Store#defaultOwner()},
 * which is static configuration: resolving never touches the network.
 */
public class LocatorResolver {

	private final Map<String, Store> stores;

	public LocatorResolver(Map<String, Store> stores) {
		this.stores = Map.copyOf(stores);
	}

	/**
	 * Resolve locator text.
	 * @param text e.g. {@code github:acme/steve}
	 * @return the locator
	 * @throws LocatorParseException if the text is malformed or names an unknown store
	 */
	public Locator resolve(String text) {
		int colon = text.indexOf(':');
		if (colon < 0) {
			throw new LocatorParseException(text, "Must include store name.");
		}
		if (text.indexOf(':', colon + 1) >= 0) {
			throw new LocatorParseException(text, "Locator \"" + text + "\" must contain exactly one ':'.");
		}

		String storeName = text.substring(0, colon);
		String rest = text.substring(colon + 1);

		Store store = stores.get(storeName);
		if (store == null) {
			throw new LocatorParseException(text, storeName + " not a valid store.");
		}
		if (rest.isEmpty()) {
			throw new LocatorParseException(text, "Locator \"" + text + "\" is missing a repository name.");
		}

		int slash = rest.indexOf('/');
		if (slash < 0) {
			return new Locator(storeName, store.defaultOwner(), rest);
		}

		String owner = rest.substring(0, slash);
		String name = rest.substring(slash + 1);
		if (owner.isEmpty() || name.isEmpty() || name.indexOf('/') >= 0) {
			throw new LocatorParseException(text,
					"Locator \"" + text + "\" must have the form <store>:<owner>/<name> or <store>:<name>.");
		}
		return new Locator(storeName, owner, name);
	}

	/**
	 * The store a locator refers to.
	 * @throws LocatorParseException if the store is not configured
	 */
	public Store storeFor(Locator locator) {
		Store store = stores.get(locator.storeName());
		if (store == null) {
			throw new LocatorParseException(locator.toString(), locator.storeName() + " not a valid store.");
		}
		return store;
	}

}
