package org.springaicommunity.pensieve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link Store} of bare repositories on an SSH host, managed by the pensieve agent.
 *
 * <p>
 * Every operation is one request/response exchange with the agent:
 *
 * <pre>
 * request:  {"command": "list" | "new", "data": {...}}
 * response: {"error": {"code": 0, "msg": ""}, "data": ...}
 * </pre>
 *
 * A non-zero {@code error.code} means the agent ran and refused the request. Repositories
 * on such a store have no owner; each lives at {@code <path>/<name>/repo.git}.
 */
public class PensieveStore implements Store {

	private static final Logger logger = LoggerFactory.getLogger(PensieveStore.class);

	static final String LIST_COMMAND = "list";

	static final String NEW_COMMAND = "new";

	private final String name;

	private final PensieveStoreConfig config;

	private final AgentTransport transport;

	private final ObjectMapper objectMapper;

	public PensieveStore(String name, PensieveStoreConfig config, AgentTransport transport,
			ObjectMapper objectMapper) {
		this.name = name;
		this.config = config;
		this.transport = transport;
		this.objectMapper = objectMapper;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public @Nullable String defaultOwner() {
		return null;
	}

	@Override
	public List<Repository> listRepositories() {
		JsonNode data;
		try {
			data = invoke(LIST_COMMAND, objectMapper.createObjectNode());
		}
		catch (AgentTransport.AgentTransportException | AgentRefusedException e) {
			throw new FetchException(name, e.getMessage(), e);
		}

		if (!data.isObject()) {
			throw new FetchException(name, "Agent listing is not an object: " + data);
		}

		List<Repository> repositories = new ArrayList<>();
		Iterator<Map.Entry<String, JsonNode>> entries = data.fields();
		while (entries.hasNext()) {
			Map.Entry<String, JsonNode> entry = entries.next();
			repositories.add(RepositoryNormalizer.normalize(name, null, entry.getKey(), entry.getValue()));
		}

		logger.debug("Store {} lists {} repositories", name, repositories.size());
		return repositories;
	}

	@Override
	public Repository createRepository(String repositoryName, @Nullable String owner) {
		warnIfOwnerGiven(owner);

		ObjectNode request = objectMapper.createObjectNode().put("name", repositoryName);
		try {
			invoke(NEW_COMMAND, request);
		}
		catch (AgentRefusedException e) {
			if (e.getMessage().toLowerCase(Locale.ROOT).contains("exist")) {
				logger.info("Repository {}:{} already exists", name, repositoryName);
				throw CreateException.alreadyExists(name, repositoryName);
			}
			throw new CreateException(name, repositoryName, CreateException.Reason.REJECTED,
					"The agent refused to create \"" + repositoryName + "\": " + e.getMessage(), e);
		}
		catch (AgentTransport.AgentTransportException e) {
			logger.error("Store {} unreachable while creating {}: {}", name, repositoryName, e.getMessage());
			throw new CreateException(name, repositoryName, CreateException.Reason.UNREACHABLE, e.getMessage(), e);
		}

		logger.info("Created repository {}:{}", name, repositoryName);
		return new Repository(name, null, repositoryName, null, null);
	}

	@Override
	public CloneSource cloneSource(String repositoryName, @Nullable String owner) {
		warnIfOwnerGiven(owner);

		boolean exists = listRepositories().stream().anyMatch(r -> r.name().equals(repositoryName));
		if (!exists) {
			throw new NotFoundException(name, repositoryName);
		}
		return new CloneSource(cloneUrl(repositoryName), repositoryName);
	}

	/**
	 * {@code ssh://user@host:port/<path>/<name>/repo.git}. A relative store path is taken
	 * relative to the remote user's home directory.
	 */
	String cloneUrl(String repositoryName) {
		String path = config.path();
		if (!path.startsWith("/")) {
			path = "/~/" + path;
		}
		if (!path.endsWith("/")) {
			path = path + "/";
		}
		return config.sshUrl() + path + repositoryName + "/repo.git";
	}

	private JsonNode invoke(String command, JsonNode data) {
		ObjectNode message = objectMapper.createObjectNode();
		message.put("command", command);
		message.set("data", data);

		String sent = message.toString();
		String received = transport.exchange(sent);

		JsonNode response;
		try {
			response = objectMapper.readTree(received);
		}
		catch (JsonProcessingException e) {
			throw new AgentTransport.AgentTransportException("Problem decoding when communicating JSON over SSH."
					+ "\nSent: " + sent + "\nReceived: " + received, e);
		}

		JsonNode error = response.path("error");
		if (error.path("code").asInt(0) != 0) {
			throw new AgentRefusedException(error.path("msg").asText("agent error " + error.path("code").asText()));
		}
		return response.path("data");
	}

	private void warnIfOwnerGiven(@Nullable String owner) {
		if (owner != null) {
			logger.warn("Store {} has no owners; ignoring owner \"{}\"", name, owner);
		}
	}

	/**
	 * The agent ran and answered with a non-zero error code.
	 */
	static class AgentRefusedException extends RuntimeException {

		AgentRefusedException(String message) {
			super(message);
		}

		@Override
		public String getMessage() {
			String message = super.getMessage();
			return message != null ? message : "";
		}

	}

}
