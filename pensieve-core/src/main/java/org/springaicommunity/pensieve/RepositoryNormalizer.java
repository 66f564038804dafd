package org.springaicommunity.pensieve;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * Builds {@link Repository} records from raw backend metadata.
 *
 * <p>
 * Malformed values degrade to {@code null} instead of failing: a non-string
 * {@code description} is dropped, a {@code topics} field that is not an array is treated
 * as absent and non-string topic elements are skipped. Older agents report topics under
 * {@code tags}; that key is read only when {@code topics} is missing.
 */
public final class RepositoryNormalizer {

	static final String DESCRIPTION = "description";

	static final String TOPICS = "topics";

	static final String LEGACY_TOPICS = "tags";

	private RepositoryNormalizer() {
	}

	public static Repository normalize(String storeName, @Nullable String owner, String name, JsonNode metadata) {
		String description = JsonNodeUtils.getString(metadata, DESCRIPTION).orElse(null);
		return new Repository(storeName, owner, name, description, topics(metadata));
	}

	@Nullable
	static Set<String> topics(JsonNode metadata) {
		if (metadata.has(TOPICS)) {
			return JsonNodeUtils.getStringSet(metadata, TOPICS);
		}
		return JsonNodeUtils.getStringSet(metadata, LEGACY_TOPICS);
	}

}
