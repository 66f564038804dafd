package org.springaicommunity.pensieve;

/**
 * Thrown when locator text is malformed or names a store that is not configured.
 */
public class LocatorParseException extends PensieveException {

	private final String input;

	public LocatorParseException(String input, String message) {
		super(message);
		this.input = input;
	}

	public String getInput() {
		return input;
	}

}
