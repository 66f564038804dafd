package org.springaicommunity.pensieve;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests of {@link PensieveService} wired by {@link PensieveBuilder}, with
 * GitHub and SSH replaced by mocks.
 */
@DisplayName("PensieveService Tests")
class PensieveServiceTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

	private static final String GITHUB_PAGE = "[{\"name\":\"pensieve\",\"owner\":{\"login\":\"octocat\"},"
			+ "\"permissions\":{\"admin\":true},\"description\":\"Multi-store tool\",\"topics\":[\"tools\"]},"
			+ "{\"name\":\"retired\",\"owner\":{\"login\":\"octocat\"},"
			+ "\"permissions\":{\"admin\":true},\"topics\":[\"archived\"]}]";

	private static final String AGENT_LISTING = "{\"error\":{\"code\":0,\"msg\":\"\"},"
			+ "\"data\":{\"thesis\":{\"description\":\"PhD\",\"topics\":[\"writing\"]}}}";

	@TempDir
	Path tempDir;

	private GitHubClient gitHubClient;

	private AgentTransport transport;

	private PensieveService pensieve;

	@BeforeEach
	void setUp() {
		gitHubClient = mock(GitHubClient.class);
		transport = mock(AgentTransport.class);

		Map<String, StoreConfig> stores = new LinkedHashMap<>();
		stores.put("github", new GitHubStoreConfig("octocat", "token"));
		stores.put("home", new PensieveStoreConfig("tester@0.0.0.0:1234", "/srv/pensieve", "agent"));

		pensieve = PensieveBuilder.create()
			.directory(tempDir)
			.storeConfigs(stores)
			.gitHubClientFactory(config -> gitHubClient)
			.agentTransportFactory(config -> transport)
			.clock(CLOCK)
			.build();
	}

	@Nested
	@DisplayName("List Tests")
	class ListTest {

		@Test
		@DisplayName("Should merge both stores, hide archived repositories and write the cache")
		void shouldListAndCache() {
			when(gitHubClient.get(startsWith("/user/repos"))).thenReturn(GITHUB_PAGE);
			when(transport.exchange(anyString())).thenReturn(AGENT_LISTING);

			ListResult result = pensieve.list(RepositoryFilter.defaults());

			assertThat(result.repositories()).extracting(Repository::locator)
				.containsExactly("github:octocat/pensieve", "home:thesis");
			assertThat(result.failures()).isEmpty();
			assertThat(result.fromCache()).isFalse();
			assertThat(tempDir.resolve(".cache.json")).exists();
			assertThat(pensieve.cacheState()).isEqualTo(CacheState.FRESH);
			assertThat(pensieve.cachedQuery(CachedQueryKind.NAMES)).containsExactly("github:octocat/pensieve",
					"github:octocat/retired", "home:thesis");
		}

		@Test
		@DisplayName("Should report a failing store next to the healthy one")
		void shouldReportPartialFailure() {
			when(gitHubClient.get(anyString()))
				.thenThrow(new GitHubHttpClient.GitHubApiException("GitHub authentication failed", 401, "{}"));
			when(transport.exchange(anyString())).thenReturn(AGENT_LISTING);

			ListResult result = pensieve.list(RepositoryFilter.defaults());

			assertThat(result.repositories()).extracting(Repository::locator).containsExactly("home:thesis");
			assertThat(result.failures()).extracting(StoreFailure::storeName).containsExactly("github");
		}

		@Test
		@DisplayName("Should serve the previous snapshot when every store fails")
		void shouldFallBackToCache() {
			when(gitHubClient.get(startsWith("/user/repos"))).thenReturn(GITHUB_PAGE);
			when(transport.exchange(anyString())).thenReturn(AGENT_LISTING);
			pensieve.list(RepositoryFilter.defaults());

			reset(gitHubClient, transport);
			when(gitHubClient.get(anyString()))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Network error", new RuntimeException("down")));
			when(transport.exchange(anyString()))
				.thenThrow(new AgentTransport.AgentTransportException("Connection failed with error: down"));

			ListResult result = pensieve.list(RepositoryFilter.topic("archived"));

			assertThat(result.fromCache()).isTrue();
			assertThat(result.failures()).hasSize(2);
			assertThat(result.repositories()).extracting(Repository::locator)
				.containsExactly("github:octocat/retired");
		}

	}

	@Nested
	@DisplayName("Single Store Tests")
	class SingleStoreTest {

		@Test
		@DisplayName("Should create on the resolved store and owner")
		void shouldCreate() {
			when(gitHubClient.post(eq("/orgs/acme/repos"), anyString())).thenReturn("{}");

			Repository created = pensieve.create(pensieve.resolveLocator("github:acme/site"));

			assertThat(created.locator()).isEqualTo("github:acme/site");
		}

		@Test
		@DisplayName("Should surface a name conflict as ALREADY_EXISTS")
		void shouldSurfaceAlreadyExists() {
			when(transport.exchange(anyString()))
				.thenReturn("{\"error\":{\"code\":1,\"msg\":\"Repository exists.\"},\"data\":null}");

			assertThatThrownBy(() -> pensieve.create(pensieve.resolveLocator("home:thesis")))
				.isInstanceOfSatisfying(CreateException.class, e -> assertThat(e.isAlreadyExists()).isTrue());
		}

		@Test
		@DisplayName("Should resolve clone sources")
		void shouldResolveCloneSource() {
			when(transport.exchange(anyString())).thenReturn(AGENT_LISTING);

			CloneSource source = pensieve.cloneSource(pensieve.resolveLocator("home:thesis"));

			assertThat(source.url()).isEqualTo("ssh://tester@0.0.0.0:1234/srv/pensieve/thesis/repo.git");
		}

		@Test
		@DisplayName("Should reject locators for unknown stores")
		void shouldRejectUnknownStore() {
			assertThatThrownBy(() -> pensieve.resolveLocator("gitlab:x")).isInstanceOf(LocatorParseException.class);
		}

	}

	@Nested
	@DisplayName("Cache Tests")
	class CacheTest {

		@Test
		@DisplayName("Should report ABSENT and empty queries before the first listing")
		void shouldStartAbsent() {
			assertThat(pensieve.cacheState()).isEqualTo(CacheState.ABSENT);
			assertThat(pensieve.cachedQuery(CachedQueryKind.STORES)).isEmpty();
			verifyNoInteractions(gitHubClient, transport);
		}

		@Test
		@DisplayName("Should read a cache written by an earlier process")
		void shouldReadExistingCacheFile() throws Exception {
			Files.writeString(tempDir.resolve(".cache.json"),
					"{\"version\":1,\"captured_at\":\"2024-02-01T00:00:00Z\",\"stores\":[\"github\",\"home\"],"
							+ "\"repositories\":[{\"store_name\":\"home\",\"owner\":null,\"name\":\"thesis\","
							+ "\"description\":\"PhD\",\"topics\":[\"writing\"]}]}");

			assertThat(pensieve.cacheState()).isEqualTo(CacheState.STALE);
			assertThat(pensieve.cachedQuery(CachedQueryKind.STORES)).containsExactly("github", "home");
			assertThat(pensieve.cachedQuery(CachedQueryKind.TOPICS)).containsExactly("writing");
		}

	}

	@Test
	@DisplayName("Should prefix names with the current date")
	void shouldPrefixDate() {
		assertThat(pensieve.datePrefixed("notes")).isEqualTo("__2024-03-01__notes");
	}

	@Test
	@DisplayName("Should fail to build without a dotfile")
	void shouldRequireDotfile() {
		assertThatThrownBy(() -> PensieveBuilder.create().directory(tempDir).build())
			.isInstanceOf(ConfigurationException.class)
			.hasMessage("Pensieve dotfile not found. Is this a pensieve?");
	}

}
