package org.springaicommunity.pensieve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads store definitions from a {@code .pensieve.yaml} dotfile.
 *
 * <pre>
 * stores:
 *     home:
 *         type: pensieve
 *         host: tester@0.0.0.0:1234
 *         path: /home/tester/pensieve
 *         agent: /home/tester/env/bin/_pensieve-agent
 *     github:
 *         type: github
 *         user: pensieve-test-user
 *         token: abcdef
 * </pre>
 *
 * A store's parameters may also be nested under a {@code config:} key. A GitHub store
 * without {@code token} uses {@code GITHUB_TOKEN}. Stores keep the order of the file.
 */
public class DotfileLoader {

	private static final Logger logger = LoggerFactory.getLogger(DotfileLoader.class);

	private static final Set<String> GITHUB_KEYS = Set.of("user", "token");

	private static final Set<String> PENSIEVE_KEYS = Set.of("host", "path", "agent");

	private final ObjectMapper yamlMapper;

	private final Function<String, @Nullable String> environment;

	public DotfileLoader() {
		this(ObjectMapperFactory.createYaml(), EnvironmentSupport::get);
	}

	public DotfileLoader(ObjectMapper yamlMapper, Function<String, @Nullable String> environment) {
		this.yamlMapper = yamlMapper;
		this.environment = environment;
	}

	/**
	 * Read the dotfile at the given path.
	 * @throws ConfigurationException if the file is missing or invalid
	 */
	public Map<String, StoreConfig> load(Path dotfile) {
		try (Reader reader = Files.newBufferedReader(dotfile, StandardCharsets.UTF_8)) {
			logger.debug("Reading stores from {}", dotfile);
			return load(reader);
		}
		catch (NoSuchFileException e) {
			throw new ConfigurationException("Pensieve dotfile not found. Is this a pensieve?", e);
		}
		catch (IOException e) {
			throw new ConfigurationException("Could not read the dotfile " + dotfile + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Read a dotfile document.
	 * @throws ConfigurationException if the document is invalid
	 */
	public Map<String, StoreConfig> load(Reader reader) {
		JsonNode root;
		try {
			root = yamlMapper.readTree(reader);
		}
		catch (IOException e) {
			throw new ConfigurationException("Problem decoding the YAML dotfile.", e);
		}

		JsonNode stores = root == null ? null : root.get("stores");
		if (stores == null || !stores.isObject()) {
			throw new ConfigurationException("Invalid dotfile. Missing \"stores\" key.");
		}

		Map<String, StoreConfig> configs = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> entries = stores.fields();
		while (entries.hasNext()) {
			Map.Entry<String, JsonNode> entry = entries.next();
			configs.put(entry.getKey(), parseStore(entry.getKey(), entry.getValue()));
		}
		return configs;
	}

	private StoreConfig parseStore(String store, JsonNode definition) {
		String invalid = "Invalid \"" + store + "\" definition in dotfile. ";
		if (!definition.isObject()) {
			throw new ConfigurationException(invalid + "Expected a mapping.");
		}

		JsonNode type = definition.get("type");
		if (type == null || !type.isTextual()) {
			throw new ConfigurationException(invalid + "Missing a \"type\" key.");
		}

		JsonNode parameters = definition.has("config") ? definition.get("config") : definition;
		if (!parameters.isObject()) {
			throw new ConfigurationException(invalid + "Missing or unknown parameters.");
		}

		return switch (type.asText()) {
			case GitHubStoreConfig.TYPE -> {
				requireKnownKeys(invalid, parameters, GITHUB_KEYS);
				String token = optional(parameters, "token");
				if (token == null) {
					token = environment.apply(EnvironmentSupport.GITHUB_TOKEN);
				}
				yield new GitHubStoreConfig(required(invalid, parameters, "user"), required(invalid, "token", token));
			}
			case PensieveStoreConfig.TYPE -> {
				requireKnownKeys(invalid, parameters, PENSIEVE_KEYS);
				yield new PensieveStoreConfig(required(invalid, parameters, "host"),
						required(invalid, parameters, "path"), required(invalid, parameters, "agent"));
			}
			default -> throw new ConfigurationException(invalid + "Unknown client type " + type.asText() + ".");
		};
	}

	private static void requireKnownKeys(String invalid, JsonNode parameters, Set<String> allowed) {
		Iterator<String> names = parameters.fieldNames();
		while (names.hasNext()) {
			String key = names.next();
			if (!allowed.contains(key) && !key.equals("type")) {
				throw new ConfigurationException(invalid + "Missing or unknown parameters.");
			}
		}
	}

	private static @Nullable String optional(JsonNode parameters, String key) {
		JsonNode value = parameters.get(key);
		return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
	}

	private static String required(String invalid, JsonNode parameters, String key) {
		return required(invalid, key, optional(parameters, key));
	}

	private static String required(String invalid, String key, @Nullable String value) {
		if (value == null || value.isBlank()) {
			logger.debug("Dotfile parameter {} missing", key);
			throw new ConfigurationException(invalid + "Missing or unknown parameters.");
		}
		return value;
	}

}
