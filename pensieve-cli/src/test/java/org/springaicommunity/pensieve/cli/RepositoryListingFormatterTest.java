package org.springaicommunity.pensieve.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springaicommunity.pensieve.FetchException;
import org.springaicommunity.pensieve.Repository;
import org.springaicommunity.pensieve.StoreFailure;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RepositoryListingFormatter} and {@link ConsoleStyle}.
 */
@DisplayName("RepositoryListingFormatter Tests")
class RepositoryListingFormatterTest {

	private final RepositoryListingFormatter plain = new RepositoryListingFormatter(new ConsoleStyle(false));

	@Test
	@DisplayName("Should print name, store, description and sorted topics")
	void shouldFormatRepository() {
		Repository repository = new Repository("github", "octocat", "pensieve", "Multi-store tool",
				Set.of("tools", "python"));

		assertThat(plain.format(repository)).isEqualTo("""
				pensieve :: github
				    description: Multi-store tool
				    topics: python, tools
				""");
	}

	@Test
	@DisplayName("Should print None for missing description and topics")
	void shouldPrintNone() {
		assertThat(plain.format(new Repository("home", null, "scratch", null, Set.of()))).isEqualTo("""
				scratch :: home
				    description: None
				    topics: None
				""");
	}

	@Test
	@DisplayName("Should format repositories in the given order")
	void shouldKeepOrder() {
		String output = plain.format(List.of(new Repository("home", null, "a", null, null),
				new Repository("home", null, "b", null, null)));

		assertThat(output.indexOf("a :: home")).isLessThan(output.indexOf("b :: home"));
	}

	@Test
	@DisplayName("Should describe store failures")
	void shouldFormatFailure() {
		StoreFailure failure = new StoreFailure("github", new FetchException("github", "Bad credentials"));

		assertThat(plain.formatFailure(failure)).isEqualTo("Warning: Store \"github\": Bad credentials");
	}

	@Test
	@DisplayName("Should colour output unless PENSIEVE_COLOR is no")
	void shouldHonourColourSetting() {
		ConsoleStyle coloured = ConsoleStyle.fromEnvironment(name -> null);
		ConsoleStyle uncoloured = ConsoleStyle.fromEnvironment(Map.of("PENSIEVE_COLOR", "no")::get);

		assertThat(coloured.isEnabled()).isTrue();
		assertThat(coloured.good("ok")).isEqualTo("\u001B[32mok\u001B[0m");
		assertThat(uncoloured.isEnabled()).isFalse();
		assertThat(uncoloured.good("ok")).isEqualTo("ok");
	}

}
