package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the dotfile is missing or does not describe a valid set of stores.
 */
public class ConfigurationException extends PensieveException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, @Nullable Throwable cause) {
		super(message, cause);
	}

}
