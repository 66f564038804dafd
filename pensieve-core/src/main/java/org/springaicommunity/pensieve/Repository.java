package org.springaicommunity.pensieve;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Normalized metadata for one repository on a store, independent of the backend that
 * reported it.
 *
 * <p>
 * {@code topics} distinguishes "no topics field at all" ({@code null}) from "an empty
 * topic list" (empty set).
 *
 * @param storeName the configured name of the owning store
 * @param owner the account or organization, or null for backends with no owner concept
 * @param name the repository name, unique within {@code (storeName, owner)}
 * @param description free-text description, or null when absent or malformed
 * @param topics topic labels, or null when the backend reported none
 */
public record Repository(@JsonProperty("store_name") String storeName, @Nullable String owner, String name,
		@Nullable String description, @Nullable Set<String> topics) {

	public Repository {
		Objects.requireNonNull(storeName, "store_name");
		Objects.requireNonNull(name, "name");
		if (topics != null) {
			topics = Collections.unmodifiableSortedSet(new TreeSet<>(topics));
		}
	}

	/**
	 * Copy of this repository attributed to another store.
	 * @param storeName the store name to tag the copy with
	 * @return the tagged copy
	 */
	public Repository withStoreName(String storeName) {
		return new Repository(storeName, owner, name, description, topics);
	}

	/**
	 * Returns true if the repository carries the given topic label.
	 * @param topic the label to look for
	 * @return true if present
	 */
	public boolean hasTopic(String topic) {
		return topics != null && topics.contains(topic);
	}

	/**
	 * Owner-qualified name, e.g. {@code octocat/pensieve}, or the bare name when the
	 * repository has no owner.
	 */
	public String fullName() {
		return owner != null ? owner + "/" + name : name;
	}

	/**
	 * The locator string that resolves back to this repository, e.g.
	 * {@code github:octocat/pensieve}.
	 */
	public String locator() {
		return storeName + ":" + fullName();
	}

}
