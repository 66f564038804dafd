package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;

/**
 * Carries one JSON request to a pensieve agent and returns its JSON response.
 */
public interface AgentTransport {

	/**
	 * Send a request and wait for the agent's answer.
	 * @param request JSON request document
	 * @return the agent's standard output
	 * @throws AgentTransportException if the agent could not be reached, exited with an
	 * error or did not answer in time
	 */
	String exchange(String request);

	/**
	 * Raised when the agent could not be run or did not produce an answer.
	 */
	class AgentTransportException extends RuntimeException {

		public AgentTransportException(String message) {
			super(message);
		}

		public AgentTransportException(String message, @Nullable Throwable cause) {
			super(message, cause);
		}

	}

}
