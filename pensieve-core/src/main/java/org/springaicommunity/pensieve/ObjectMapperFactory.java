package org.springaicommunity.pensieve;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for consistently configured {@link ObjectMapper}s.
 *
 * <p>
 * The JSON mapper uses {@link PropertyNamingStrategies#SNAKE_CASE} so that record
 * components such as {@code capturedAt} are written as {@code captured_at}, and writes
 * timestamps as ISO-8601 strings. Unknown properties are ignored so that older readers
 * tolerate newer cache files and agent responses.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create the JSON mapper used for the cache file and backend payloads.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

	/**
	 * Create the YAML mapper used to read the dotfile.
	 * @return configured ObjectMapper backed by a {@link YAMLFactory}
	 */
	public static ObjectMapper createYaml() {
		return new ObjectMapper(new YAMLFactory());
	}

}
