package org.springaicommunity.pensieve;

/**
 * A store of bare repositories on an SSH host, managed by the pensieve agent.
 *
 * @param host {@code user@hostname:port}; the port may be omitted
 * @param path the store's directory on the remote filesystem
 * @param agent the agent command run on the remote host
 */
public record PensieveStoreConfig(String host, String path, String agent) implements StoreConfig {

	public static final String TYPE = "pensieve";

	@Override
	public String type() {
		return TYPE;
	}

	/**
	 * The host as an {@code ssh://} URL prefix, e.g. {@code ssh://tester@0.0.0.0:1234}.
	 */
	public String sshUrl() {
		return "ssh://" + host;
	}

}
