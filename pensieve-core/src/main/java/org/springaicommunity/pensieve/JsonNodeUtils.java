package org.springaicommunity.pensieve;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lenient {@link JsonNode} navigation. Values of an unexpected type are reported as
 * absent rather than raising an error.
 */
public final class JsonNodeUtils {

	private JsonNodeUtils() {
	}

	/**
	 * Text at the given path, if every step exists and the target is a JSON string.
	 */
	public static Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isTextual() ? Optional.of(target.asText()) : Optional.empty();
	}

	public static boolean getBoolean(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isBoolean() && target.asBoolean();
	}

	/**
	 * Elements of the array at the given path; empty when the target is not an array.
	 */
	public static List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);

		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}

		return List.of();
	}

	/**
	 * String elements of the array field, in order, without duplicates.
	 * @return the strings, or null when the field is absent or not an array
	 */
	@Nullable
	public static Set<String> getStringSet(JsonNode node, String field) {
		JsonNode target = node.path(field);
		if (!target.isArray()) {
			return null;
		}
		Set<String> values = new LinkedHashSet<>();
		for (JsonNode element : target) {
			if (element.isTextual()) {
				values.add(element.asText());
			}
		}
		return values;
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
