package org.springaicommunity.pensieve.cli;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.pensieve.EnvironmentSupport;

import java.util.function.Function;

/**
 * ANSI colouring of console messages. Disabled entirely by {@code PENSIEVE_COLOR=no}.
 */
public class ConsoleStyle {

	private static final String RESET = "\u001B[0m";

	private static final String FADED = "\u001B[30;1m";

	private static final String INFO = "\u001B[35m";

	private static final String INFO_HEADING = "\u001B[34m";

	private static final String HIGHLIGHT = "\u001B[37;1m";

	private static final String BAD = "\u001B[31m";

	private static final String GOOD = "\u001B[32m";

	private final boolean enabled;

	public ConsoleStyle(boolean enabled) {
		this.enabled = enabled;
	}

	/**
	 * Style honouring the {@code PENSIEVE_COLOR} variable.
	 * @param environment variable lookup
	 */
	public static ConsoleStyle fromEnvironment(Function<String, @Nullable String> environment) {
		String color = environment.apply(EnvironmentSupport.PENSIEVE_COLOR);
		return new ConsoleStyle(!"no".equals(color));
	}

	public boolean isEnabled() {
		return enabled;
	}

	public String faded(String message) {
		return wrap(FADED, message);
	}

	public String info(String message) {
		return wrap(INFO, message);
	}

	public String infoHeading(String message) {
		return wrap(INFO_HEADING, message);
	}

	public String highlight(String message) {
		return wrap(HIGHLIGHT, message);
	}

	public String bad(String message) {
		return wrap(BAD, message);
	}

	public String good(String message) {
		return wrap(GOOD, message);
	}

	private String wrap(String code, String message) {
		return enabled ? code + message + RESET : message;
	}

}
