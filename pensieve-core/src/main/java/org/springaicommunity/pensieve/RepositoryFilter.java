package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;

/**
 * Topic filter applied to an aggregate view.
 *
 * <p>
 * Without a topic, repositories labelled {@value #ARCHIVED_TOPIC} are hidden. With a
 * topic, only repositories carrying it are shown, archived or not.
 *
 * @param topic the requested topic, or null for the default view
 */
public record RepositoryFilter(@Nullable String topic) {

	public static final String ARCHIVED_TOPIC = "archived";

	public static RepositoryFilter defaults() {
		return new RepositoryFilter(null);
	}

	public static RepositoryFilter topic(String topic) {
		return new RepositoryFilter(topic);
	}

	public boolean includes(Repository repository) {
		if (topic != null) {
			return repository.hasTopic(topic);
		}
		return !repository.hasTopic(ARCHIVED_TOPIC);
	}

}
