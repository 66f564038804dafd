package org.springaicommunity.pensieve.cli;

import org.springaicommunity.pensieve.CachedQueryKind;

/**
 * Parsed command-line arguments.
 */
public class ParsedCommand {

	public static final String NEW = "new";

	public static final String CLONE = "clone";

	public static final String LIST = "list";

	public static final String CACHED = "cached";

	// Subcommand; null only when help was requested
	public String command;

	// new / clone
	public String locator;

	public boolean datePrefix = false;

	// list
	public String topic;

	// cached
	public CachedQueryKind cachedQuery;

	public boolean verbose = false;

	public boolean helpRequested = false;

}
