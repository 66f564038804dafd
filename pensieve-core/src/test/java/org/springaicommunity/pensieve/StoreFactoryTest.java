package org.springaicommunity.pensieve;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link StoreFactory}.
 */
@DisplayName("StoreFactory Tests")
class StoreFactoryTest {

	private final StoreFactory factory = new StoreFactory(ObjectMapperFactory.create(),
			config -> mock(GitHubClient.class), config -> mock(AgentTransport.class));

	@Test
	@DisplayName("Should create the implementation matching the configuration type")
	void shouldChooseImplementationByType() {
		Store github = factory.create("gh", new GitHubStoreConfig("octocat", "token"));
		Store home = factory.create("home", new PensieveStoreConfig("me@box", "/srv", "agent"));

		assertThat(github).isInstanceOf(GitHubStore.class);
		assertThat(github.name()).isEqualTo("gh");
		assertThat(github.defaultOwner()).isEqualTo("octocat");
		assertThat(home).isInstanceOf(PensieveStore.class);
		assertThat(home.defaultOwner()).isNull();
	}

	@Test
	@DisplayName("Should keep configuration order")
	void shouldKeepOrder() {
		Map<String, StoreConfig> configs = new LinkedHashMap<>();
		configs.put("zeta", new PensieveStoreConfig("me@box", "/srv", "agent"));
		configs.put("alpha", new GitHubStoreConfig("octocat", "token"));

		assertThat(factory.createAll(configs).keySet()).containsExactly("zeta", "alpha");
	}

	@Test
	@DisplayName("Should reject configuration types it does not know")
	void shouldRejectUnknownType() {
		StoreConfig unknown = () -> "gitlab";

		assertThatThrownBy(() -> factory.create("lab", unknown)).isInstanceOf(ConfigurationException.class)
			.hasMessageContaining("gitlab");
	}

}
