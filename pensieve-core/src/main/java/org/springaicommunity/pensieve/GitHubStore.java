package org.springaicommunity.pensieve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link Store} backed by the GitHub REST API.
 *
 * <p>
 * Lists every repository the configured user administers, across their own account and
 * their organizations. Locators without an owner refer to the configured user's account.
 */
public class GitHubStore implements Store {

	private static final Logger logger = LoggerFactory.getLogger(GitHubStore.class);

	static final int PAGE_SIZE = 100;

	private static final String CLONE_URL_PREFIX = "ssh://git@github.com/";

	private final String name;

	private final GitHubStoreConfig config;

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	public GitHubStore(String name, GitHubStoreConfig config, GitHubClient client, ObjectMapper objectMapper) {
		this.name = name;
		this.config = config;
		this.client = client;
		this.objectMapper = objectMapper;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public @Nullable String defaultOwner() {
		return config.user();
	}

	@Override
	public List<Repository> listRepositories() {
		List<Repository> repositories = new ArrayList<>();

		for (int page = 1;; page++) {
			JsonNode items = fetchPage(page);
			if (items.isEmpty()) {
				break;
			}

			for (JsonNode item : items) {
				if (!JsonNodeUtils.getBoolean(item, "permissions", "admin")) {
					continue;
				}
				Repository repository = toRepository(item);
				if (repository != null) {
					repositories.add(repository);
				}
			}

			if (items.size() < PAGE_SIZE) {
				break;
			}
		}

		logger.debug("Store {} lists {} repositories", name, repositories.size());
		return repositories;
	}

	@Override
	public Repository createRepository(String repositoryName, @Nullable String owner) {
		String effectiveOwner = owner != null ? owner : config.user();
		String path = effectiveOwner.equals(config.user()) ? "/user/repos" : "/orgs/" + effectiveOwner + "/repos";
		String fullName = effectiveOwner + "/" + repositoryName;

		Map<String, Object> body = new LinkedHashMap<>();
		body.put("name", repositoryName);
		body.put("private", true);

		String response;
		try {
			response = client.post(path, objectMapper.writeValueAsString(body));
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			throw toCreateException(fullName, e);
		}
		catch (JsonProcessingException e) {
			throw new CreateException(name, fullName, CreateException.Reason.REJECTED,
					"Could not encode the creation request for \"" + fullName + "\"", e);
		}

		logger.info("Created repository {}:{}", name, fullName);
		try {
			Repository created = toRepository(objectMapper.readTree(response));
			if (created != null) {
				return created;
			}
		}
		catch (JsonProcessingException e) {
			logger.warn("Store {} returned an unreadable body for created repository {}: {}", name, fullName,
					e.getMessage());
		}
		return new Repository(name, effectiveOwner, repositoryName, null, null);
	}

	@Override
	public CloneSource cloneSource(String repositoryName, @Nullable String owner) {
		String effectiveOwner = owner != null ? owner : config.user();
		String fullName = effectiveOwner + "/" + repositoryName;

		try {
			client.get("/repos/" + fullName);
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.isNotFound()) {
				throw new NotFoundException(name, fullName);
			}
			throw new FetchException(name, e.getMessage(), e);
		}

		return new CloneSource(CLONE_URL_PREFIX + fullName, repositoryName);
	}

	private JsonNode fetchPage(int page) {
		String path = "/user/repos?per_page=" + PAGE_SIZE + "&page=" + page;
		try {
			JsonNode items = objectMapper.readTree(client.get(path));
			if (!items.isArray()) {
				throw new FetchException(name, "Unexpected response listing repositories: " + abbreviate(items));
			}
			return items;
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			throw new FetchException(name, e.getMessage(), e);
		}
		catch (JsonProcessingException e) {
			throw new FetchException(name, "Could not decode repository listing", e);
		}
	}

	private @Nullable Repository toRepository(JsonNode item) {
		String repositoryName = JsonNodeUtils.getString(item, "name").orElse(null);
		if (repositoryName == null) {
			logger.warn("Store {} returned a repository without a name; skipping", name);
			return null;
		}
		String owner = JsonNodeUtils.getString(item, "owner", "login").orElse(config.user());
		return RepositoryNormalizer.normalize(name, owner, repositoryName, item);
	}

	private CreateException toCreateException(String fullName, GitHubHttpClient.GitHubApiException e) {
		if (!e.isClientError()) {
			logger.error("Store {} unreachable while creating {}: {}", name, fullName, e.getMessage());
			return new CreateException(name, fullName, CreateException.Reason.UNREACHABLE, e.getMessage(), e);
		}

		String detail = errorMessage(e.getResponseBody());
		if (e.getStatusCode() == 422 && detail.contains("already exists")) {
			logger.info("Repository {}:{} already exists", name, fullName);
			return CreateException.alreadyExists(name, fullName);
		}
		return new CreateException(name, fullName, CreateException.Reason.REJECTED,
				"GitHub refused to create \"" + fullName + "\": " + detail, e);
	}

	/**
	 * Joins GitHub's top-level {@code message} with the first entry of {@code errors}.
	 */
	private String errorMessage(@Nullable String body) {
		if (body == null || body.isBlank()) {
			return "(no details)";
		}
		try {
			JsonNode json = objectMapper.readTree(body);
			String message = JsonNodeUtils.getString(json, "message").orElse("");
			List<JsonNode> errors = JsonNodeUtils.getArray(json, "errors");
			if (!errors.isEmpty()) {
				message = (message + " " + JsonNodeUtils.getString(errors.get(0), "message").orElse("")).trim();
			}
			return message.isEmpty() ? body : message;
		}
		catch (JsonProcessingException e) {
			return body;
		}
	}

	private static String abbreviate(JsonNode node) {
		String text = node.toString();
		return text.length() > 200 ? text.substring(0, 200) + "..." : text;
	}

}
