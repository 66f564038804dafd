package org.springaicommunity.pensieve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link AgentTransport} that runs the agent through the local {@code ssh} executable.
 *
 * <p>
 * The request is written to the agent's standard input and the response read from its
 * standard output. The remote command changes into the store's directory before
 * starting the agent:
 *
 * <pre>
 * ssh -o ConnectTimeout=5 [options] -p 1234 tester@host 'bash -c "cd /srv/pensieve &amp;&amp; agent"'
 * </pre>
 */
public class SshAgentTransport implements AgentTransport {

	private static final Logger logger = LoggerFactory.getLogger(SshAgentTransport.class);

	private final PensieveStoreConfig config;

	private final String agentCommand;

	private final List<String> sshOptions;

	private final int connectTimeoutSeconds;

	private final Duration timeout;

	public SshAgentTransport(PensieveStoreConfig config, String agentCommand, List<String> sshOptions,
			int connectTimeoutSeconds, Duration timeout) {
		this.config = config;
		this.agentCommand = agentCommand;
		this.sshOptions = List.copyOf(sshOptions);
		this.connectTimeoutSeconds = connectTimeoutSeconds;
		this.timeout = timeout;
	}

	/**
	 * Transport honouring the {@link EnvironmentSupport} overrides for the agent command,
	 * ssh options and connect timeout.
	 */
	public static SshAgentTransport fromEnvironment(PensieveStoreConfig config, PensieveProperties properties) {
		return new SshAgentTransport(config, EnvironmentSupport.agentCommand(config.agent()),
				EnvironmentSupport.sshOptions(),
				EnvironmentSupport.connectTimeoutSeconds(properties.getSshConnectTimeoutSeconds()),
				properties.getStoreTimeout());
	}

	@Override
	public String exchange(String request) {
		List<String> command = command();
		logger.debug("Running {}", command);

		Process process;
		try {
			process = new ProcessBuilder(command).start();
		}
		catch (IOException e) {
			throw new AgentTransportException("Could not start ssh: " + e.getMessage(), e);
		}

		CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> read(process.getInputStream()));
		CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()));

		try {
			try (OutputStream stdin = process.getOutputStream()) {
				stdin.write(request.getBytes(StandardCharsets.UTF_8));
			}

			if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				process.destroyForcibly();
				throw new AgentTransportException(
						"No answer from " + config.host() + " within " + timeout.toSeconds() + "s");
			}

			String out = stdout.get().strip();
			String err = stderr.get().strip();

			if (process.exitValue() != 0) {
				logger.debug("ssh exited with {}: {} {}", process.exitValue(), out, err);
				if (out.contains("No such file") || err.contains("No such file")) {
					throw new AgentTransportException("The server has no pensieve \"" + config.path() + "\".");
				}
				throw new AgentTransportException("Connection failed with error: " + (out + " " + err).strip());
			}
			return out;
		}
		catch (IOException e) {
			process.destroyForcibly();
			throw new AgentTransportException("Could not send the request to the agent: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			process.destroyForcibly();
			Thread.currentThread().interrupt();
			throw new AgentTransportException("Interrupted while waiting for the agent", e);
		}
		catch (ExecutionException e) {
			throw new AgentTransportException("Could not read the agent's output", e.getCause());
		}
	}

	/**
	 * The ssh command line used to reach the agent.
	 */
	List<String> command() {
		List<String> command = new ArrayList<>();
		command.add("ssh");
		command.add("-o");
		command.add("ConnectTimeout=" + connectTimeoutSeconds);
		command.addAll(sshOptions);

		String host = config.host();
		int colon = host.lastIndexOf(':');
		if (colon > host.indexOf('@')) {
			command.add("-p");
			command.add(host.substring(colon + 1));
			host = host.substring(0, colon);
		}
		command.add(host);
		command.add("bash -c \"cd " + config.path() + " && " + agentCommand + "\"");
		return command;
	}

	static List<String> splitOptions(String options) {
		String trimmed = options.strip();
		return trimmed.isEmpty() ? List.of() : List.of(trimmed.split("\\s+"));
	}

	private static String read(InputStream stream) {
		try (stream) {
			return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

}
