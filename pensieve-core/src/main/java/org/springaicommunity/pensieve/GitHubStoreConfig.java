package org.springaicommunity.pensieve;

/**
 * A store backed by a GitHub account.
 *
 * @param user the authenticated account; default owner of new repositories
 * @param token API token used as bearer credential
 */
public record GitHubStoreConfig(String user, String token) implements StoreConfig {

	public static final String TYPE = "github";

	@Override
	public String type() {
		return TYPE;
	}

	@Override
	public String toString() {
		return "GitHubStoreConfig[user=" + user + ", token=****]";
	}

}
