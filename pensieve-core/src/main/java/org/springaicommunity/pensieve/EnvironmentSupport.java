package org.springaicommunity.pensieve;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The environment variables Pensieve reads, looked up through {@code .env} files as well
 * as the process environment.
 *
 * <p>
 * A variable is taken from the {@code .env} of the working directory (which also exposes
 * the process environment) and then from {@code ~/.env}. Both files are optional and
 * read once.
 */
public final class EnvironmentSupport {

	private static final Logger logger = LoggerFactory.getLogger(EnvironmentSupport.class);

	/** Token for GitHub stores whose definition has none. */
	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	/** {@code no} turns off coloured terminal output. */
	public static final String PENSIEVE_COLOR = "PENSIEVE_COLOR";

	/** Extra options passed to every ssh invocation, separated by whitespace. */
	public static final String PENSIEVE_SSH_OPTIONS = "PENSIEVE_SSH_OPTIONS";

	/** ssh connect timeout in seconds. */
	public static final String PENSIEVE_TIMEOUT = "PENSIEVE_TIMEOUT";

	/** Agent command used instead of the one named by the store definition. */
	public static final String PENSIEVE_AGENT_COMMAND = "PENSIEVE_AGENT_COMMAND";

	private static final Dotenv WORKING_DIRECTORY = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final @Nullable Dotenv HOME = loadHome();

	private EnvironmentSupport() {
	}

	private static @Nullable Dotenv loadHome() {
		String home = System.getProperty("user.home");
		if (home == null || Path.of(home).toAbsolutePath().equals(Path.of("").toAbsolutePath())) {
			return null;
		}
		return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
	}

	/**
	 * The value of a variable, or {@code null} when it is unset.
	 */
	public static @Nullable String get(String name) {
		String value = WORKING_DIRECTORY.get(name);
		if (value == null && HOME != null) {
			value = HOME.get(name);
		}
		return value;
	}

	static Optional<String> nonBlank(String name) {
		return Optional.ofNullable(get(name)).map(String::strip).filter(value -> !value.isEmpty());
	}

	/**
	 * The agent command to run on pensieve hosts, {@code configured} unless overridden.
	 */
	public static String agentCommand(String configured) {
		return nonBlank(PENSIEVE_AGENT_COMMAND).orElse(configured);
	}

	public static List<String> sshOptions() {
		return nonBlank(PENSIEVE_SSH_OPTIONS).map(SshAgentTransport::splitOptions).orElse(List.of());
	}

	/**
	 * The ssh connect timeout, {@code configured} when unset or not a whole number.
	 */
	public static int connectTimeoutSeconds(int configured) {
		Optional<String> override = nonBlank(PENSIEVE_TIMEOUT);
		if (override.isEmpty()) {
			return configured;
		}
		try {
			return Integer.parseInt(override.get());
		}
		catch (NumberFormatException e) {
			logger.warn("Ignoring {}='{}': not a whole number of seconds", PENSIEVE_TIMEOUT, override.get());
			return configured;
		}
	}

}
