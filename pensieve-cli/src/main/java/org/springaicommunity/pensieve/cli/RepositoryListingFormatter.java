package org.springaicommunity.pensieve.cli;

import org.springaicommunity.pensieve.Repository;
import org.springaicommunity.pensieve.StoreFailure;

import java.util.List;
import java.util.Set;

/**
 * Renders the output of {@code pensieve list}.
 *
 * <pre>
 * notes :: github
 *     description: Lecture notes
 *     topics: teaching, writing
 * </pre>
 */
public class RepositoryListingFormatter {

	static final String INDENT = "    ";

	static final String NONE = "None";

	private final ConsoleStyle style;

	public RepositoryListingFormatter(ConsoleStyle style) {
		this.style = style;
	}

	public String format(Repository repository) {
		StringBuilder out = new StringBuilder();
		out.append(style.highlight(repository.name())).append(style.faded(" :: " + repository.storeName())).append('\n');
		String description = repository.description() != null ? repository.description() : NONE;
		out.append(INDENT).append(style.infoHeading("description")).append(": ").append(style.info(description));
		out.append('\n');
		out.append(INDENT).append(style.infoHeading("topics")).append(": ").append(style.info(topics(repository)));
		out.append('\n');
		return out.toString();
	}

	public String format(List<Repository> repositories) {
		StringBuilder out = new StringBuilder();
		repositories.forEach(repository -> out.append(format(repository)));
		return out.toString();
	}

	public String formatFailure(StoreFailure failure) {
		return style.bad("Warning: " + failure.message());
	}

	private static String topics(Repository repository) {
		Set<String> topics = repository.topics();
		if (topics == null || topics.isEmpty()) {
			return NONE;
		}
		return String.join(", ", topics);
	}

}
