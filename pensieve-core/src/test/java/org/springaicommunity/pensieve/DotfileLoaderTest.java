package org.springaicommunity.pensieve;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DotfileLoader}.
 */
@DisplayName("DotfileLoader Tests")
class DotfileLoaderTest {

	private final DotfileLoader loader = new DotfileLoader(ObjectMapperFactory.createYaml(),
			name -> "GITHUB_TOKEN".equals(name) ? "env-token" : null);

	private Map<String, StoreConfig> load(String yaml) {
		return loader.load(new StringReader(yaml));
	}

	@Nested
	@DisplayName("Valid Dotfile Tests")
	class ValidDotfileTest {

		@Test
		@DisplayName("Should read flat store definitions in order")
		void shouldReadFlatDefinitions() {
			Map<String, StoreConfig> stores = load("""
					stores:
					  github:
					    type: github
					    user: octocat
					    token: abc123
					  home:
					    type: pensieve
					    host: tester@0.0.0.0:1234
					    path: /srv/pensieve
					    agent: pensieve-agent
					""");

			assertThat(stores).containsOnlyKeys("github", "home");
			assertThat(stores.keySet()).containsExactly("github", "home");
			assertThat(stores.get("github")).isEqualTo(new GitHubStoreConfig("octocat", "abc123"));
			assertThat(stores.get("home"))
				.isEqualTo(new PensieveStoreConfig("tester@0.0.0.0:1234", "/srv/pensieve", "pensieve-agent"));
		}

		@Test
		@DisplayName("Should read parameters nested under config")
		void shouldReadNestedConfig() {
			Map<String, StoreConfig> stores = load("""
					stores:
					  github:
					    type: github
					    config:
					      user: octocat
					      token: abc123
					""");

			assertThat(stores.get("github")).isEqualTo(new GitHubStoreConfig("octocat", "abc123"));
		}

		@Test
		@DisplayName("Should fall back to GITHUB_TOKEN when no token is given")
		void shouldFallBackToEnvironmentToken() {
			Map<String, StoreConfig> stores = load("""
					stores:
					  github:
					    type: github
					    user: octocat
					""");

			assertThat(((GitHubStoreConfig) stores.get("github")).token()).isEqualTo("env-token");
		}

		@Test
		@DisplayName("Should accept an empty store map")
		void shouldAcceptNoStores() {
			assertThat(load("stores: {}\n")).isEmpty();
		}

		@Test
		@DisplayName("Should never print the token")
		void shouldMaskToken() {
			assertThat(new GitHubStoreConfig("octocat", "abc123").toString()).doesNotContain("abc123");
		}

	}

	@Nested
	@DisplayName("Invalid Dotfile Tests")
	class InvalidDotfileTest {

		@Test
		@DisplayName("Should require the stores key")
		void shouldRequireStoresKey() {
			assertThatThrownBy(() -> load("other: 1\n")).isInstanceOf(ConfigurationException.class)
				.hasMessage("Invalid dotfile. Missing \"stores\" key.");
		}

		@Test
		@DisplayName("Should require a type for every store")
		void shouldRequireType() {
			assertThatThrownBy(() -> load("""
					stores:
					  github:
					    user: octocat
					""")).isInstanceOf(ConfigurationException.class)
				.hasMessage("Invalid \"github\" definition in dotfile. Missing a \"type\" key.");
		}

		@Test
		@DisplayName("Should reject unknown store types")
		void shouldRejectUnknownType() {
			assertThatThrownBy(() -> load("""
					stores:
					  lab:
					    type: gitlab
					""")).isInstanceOf(ConfigurationException.class).hasMessageContaining("Unknown client type gitlab.");
		}

		@Test
		@DisplayName("Should reject missing parameters")
		void shouldRejectMissingParameters() {
			assertThatThrownBy(() -> load("""
					stores:
					  home:
					    type: pensieve
					    host: box
					""")).isInstanceOf(ConfigurationException.class)
				.hasMessage("Invalid \"home\" definition in dotfile. Missing or unknown parameters.");
		}

		@Test
		@DisplayName("Should reject unknown parameters")
		void shouldRejectUnknownParameters() {
			assertThatThrownBy(() -> load("""
					stores:
					  github:
					    type: github
					    user: octocat
					    token: abc
					    colour: blue
					""")).isInstanceOf(ConfigurationException.class).hasMessageContaining("Missing or unknown parameters.");
		}

		@Test
		@DisplayName("Should reject malformed YAML")
		void shouldRejectMalformedYaml() {
			assertThatThrownBy(() -> load("stores: [unclosed\n")).isInstanceOf(ConfigurationException.class)
				.hasMessage("Problem decoding the YAML dotfile.");
		}

		@Test
		@DisplayName("Should report a missing dotfile")
		void shouldReportMissingFile(@TempDir Path tempDir) {
			assertThatThrownBy(() -> loader.load(tempDir.resolve(".pensieve.yaml")))
				.isInstanceOf(ConfigurationException.class)
				.hasMessage("Pensieve dotfile not found. Is this a pensieve?");
		}

		@Test
		@DisplayName("Should read a dotfile from disk")
		void shouldReadFromDisk(@TempDir Path tempDir) throws Exception {
			Path dotfile = tempDir.resolve(".pensieve.yaml");
			Files.writeString(dotfile, "stores:\n  gh:\n    type: github\n    user: me\n    token: t\n");

			assertThat(loader.load(dotfile)).containsOnlyKeys("gh");
		}

	}

}
