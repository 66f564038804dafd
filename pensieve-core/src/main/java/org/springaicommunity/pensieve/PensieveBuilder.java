package org.springaicommunity.pensieve;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.function.Function;

/**
 * Builder wiring a {@link PensieveService} from the dotfile in a pensieve directory.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Stores from ./.pensieve.yaml, cache in ./.cache.json
 * PensieveService pensieve = PensieveBuilder.create()
 *     .directory(Path.of("."))
 *     .build();
 *
 * // For testing without network access
 * PensieveService testPensieve = PensieveBuilder.create()
 *     .storeConfigs(Map.of("github", new GitHubStoreConfig("octocat", "token")))
 *     .gitHubClientFactory(config -> mockClient)
 *     .snapshotStore(inMemorySnapshots)
 *     .build();
 * }
 * </pre>
 */
public class PensieveBuilder {

	private Path directory = Path.of(".");

	private PensieveProperties properties = new PensieveProperties();

	private @Nullable ObjectMapper objectMapper;

	private @Nullable Map<String, StoreConfig> storeConfigs;

	private @Nullable Function<GitHubStoreConfig, GitHubClient> gitHubClientFactory;

	private @Nullable Function<PensieveStoreConfig, AgentTransport> agentTransportFactory;

	private @Nullable SnapshotStore snapshotStore;

	private Clock clock = Clock.systemUTC();

	private PensieveBuilder() {
	}

	public static PensieveBuilder create() {
		return new PensieveBuilder();
	}

	/**
	 * Directory holding the dotfile and the cache file.
	 * @param directory the pensieve directory
	 * @return this builder
	 */
	public PensieveBuilder directory(Path directory) {
		this.directory = directory;
		return this;
	}

	/**
	 * Set Pensieve properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public PensieveBuilder properties(@Nullable PensieveProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	public PensieveBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Use these store definitions instead of reading the dotfile.
	 * @param storeConfigs store definitions by name, in display order
	 * @return this builder
	 */
	public PensieveBuilder storeConfigs(@Nullable Map<String, StoreConfig> storeConfigs) {
		this.storeConfigs = storeConfigs;
		return this;
	}

	/**
	 * Set how GitHub stores obtain their HTTP client. Useful for testing with mocks.
	 * @param gitHubClientFactory client per store configuration (null to use default)
	 * @return this builder
	 */
	public PensieveBuilder gitHubClientFactory(
			@Nullable Function<GitHubStoreConfig, GitHubClient> gitHubClientFactory) {
		this.gitHubClientFactory = gitHubClientFactory;
		return this;
	}

	/**
	 * Set how pensieve stores reach their agent. Useful for testing with mocks.
	 * @param agentTransportFactory transport per store configuration (null to use SSH)
	 * @return this builder
	 */
	public PensieveBuilder agentTransportFactory(
			@Nullable Function<PensieveStoreConfig, AgentTransport> agentTransportFactory) {
		this.agentTransportFactory = agentTransportFactory;
		return this;
	}

	/**
	 * Set a custom SnapshotStore implementation.
	 * @param snapshotStore snapshot persistence (null to use the cache file)
	 * @return this builder
	 */
	public PensieveBuilder snapshotStore(@Nullable SnapshotStore snapshotStore) {
		this.snapshotStore = snapshotStore;
		return this;
	}

	public PensieveBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the service.
	 * @return configured PensieveService
	 * @throws ConfigurationException if the dotfile is missing or invalid
	 */
	public PensieveService build() {
		ObjectMapper mapper = objectMapper != null ? objectMapper : ObjectMapperFactory.create();
		Map<String, StoreConfig> configs = storeConfigs != null ? storeConfigs
				: new DotfileLoader().load(directory.resolve(properties.getDotfileName()));

		Function<GitHubStoreConfig, GitHubClient> gitHubClients = gitHubClientFactory != null ? gitHubClientFactory
				: this::defaultGitHubClient;
		Function<PensieveStoreConfig, AgentTransport> agentTransports = agentTransportFactory != null
				? agentTransportFactory : config -> SshAgentTransport.fromEnvironment(config, properties);
		Map<String, Store> stores = new StoreFactory(mapper, gitHubClients, agentTransports).createAll(configs);

		SnapshotStore snapshots = snapshotStore != null ? snapshotStore
				: new FileSystemSnapshotStore(directory.resolve(properties.getCacheFileName()), mapper);
		CacheManager cacheManager = new CacheManager(snapshots, new Aggregator(properties.getStoreTimeout()), stores,
				properties.getCacheMaxAge(), clock);
		return new PensieveService(stores, cacheManager, properties, clock);
	}

	private GitHubClient defaultGitHubClient(GitHubStoreConfig config) {
		GitHubHttpClient http = new GitHubHttpClient(config.token(), properties.getGithubApiUrl(),
				properties.getStoreTimeout());
		return RetryingGitHubClient.builder()
			.wrapping(http)
			.maxRetries(properties.getGithubMaxRetries())
			.budget(properties.getStoreTimeout())
			.build();
	}

}
