package org.springaicommunity.pensieve;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Creates {@link Store} instances from their configuration, choosing the implementation
 * by the configuration's type.
 */
public class StoreFactory {

	private final ObjectMapper objectMapper;

	private final Function<GitHubStoreConfig, GitHubClient> gitHubClients;

	private final Function<PensieveStoreConfig, AgentTransport> agentTransports;

	public StoreFactory(ObjectMapper objectMapper, Function<GitHubStoreConfig, GitHubClient> gitHubClients,
			Function<PensieveStoreConfig, AgentTransport> agentTransports) {
		this.objectMapper = objectMapper;
		this.gitHubClients = gitHubClients;
		this.agentTransports = agentTransports;
	}

	public Store create(String name, StoreConfig config) {
		if (config instanceof GitHubStoreConfig github) {
			return new GitHubStore(name, github, gitHubClients.apply(github), objectMapper);
		}
		if (config instanceof PensieveStoreConfig pensieve) {
			return new PensieveStore(name, pensieve, agentTransports.apply(pensieve), objectMapper);
		}
		throw new ConfigurationException("Unknown store type " + config.type() + " for store \"" + name + "\"");
	}

	/**
	 * Create every configured store, keeping configuration order.
	 */
	public Map<String, Store> createAll(Map<String, StoreConfig> configs) {
		Map<String, Store> stores = new LinkedHashMap<>();
		configs.forEach((name, config) -> stores.put(name, create(name, config)));
		return stores;
	}

}
