package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;

/**
 * Base class of every error Pensieve reports to its caller.
 */
public class PensieveException extends RuntimeException {

	public PensieveException(String message) {
		super(message);
	}

	public PensieveException(String message, @Nullable Throwable cause) {
		super(message, cause);
	}

}
