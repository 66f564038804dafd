package org.springaicommunity.pensieve.cli;

import org.springaicommunity.pensieve.CachedQueryKind;
import org.springaicommunity.pensieve.PensieveProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the pensieve CLI. Pure Java with no framework
 * dependencies for testability.
 */
public class ArgumentParser {

	private static final List<String> COMMANDS = List.of(ParsedCommand.NEW, ParsedCommand.CLONE, ParsedCommand.LIST,
			ParsedCommand.CACHED);

	private final PensieveProperties defaultProperties;

	public ArgumentParser(PensieveProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments.
	 * @param args Command-line arguments
	 * @return Parsed command
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedCommand parseAndValidate(String[] args) {
		ParsedCommand command = new ParsedCommand();
		List<String> positionals = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-h", "--help":
					command.helpRequested = true;
					break;

				case "-v", "--verbose":
					command.verbose = true;
					break;

				case "--date":
					command.datePrefix = true;
					break;

				case "-t", "--topic":
					command.topic = getRequiredValue(args, i, "topic");
					i++; // Skip next argument since we consumed it
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					positionals.add(arg);
					break;
			}
		}

		if (command.helpRequested) {
			return command;
		}
		if (positionals.isEmpty()) {
			throw new IllegalArgumentException("Missing command: must be one of " + String.join(", ", COMMANDS));
		}

		command.command = positionals.get(0);
		List<String> operands = positionals.subList(1, positionals.size());
		switch (command.command) {
			case ParsedCommand.NEW, ParsedCommand.CLONE:
				command.locator = singleOperand(command.command, operands, "repository locator");
				break;
			case ParsedCommand.LIST:
				if (!operands.isEmpty()) {
					throw new IllegalArgumentException("Unexpected argument for list: " + operands.get(0));
				}
				break;
			case ParsedCommand.CACHED:
				command.cachedQuery = CachedQueryKind.fromArgument(singleOperand(command.command, operands, "query"));
				break;
			default:
				throw new IllegalArgumentException(
						"Unknown command '" + command.command + "': must be one of " + String.join(", ", COMMANDS));
		}

		validate(command);
		return command;
	}

	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: pensieve [OPTIONS] COMMAND [ARGS]\n");
		help.append("\n");
		help.append("Manage repositories spread over several stores from one directory.\n");
		help.append("Stores are read from ").append(defaultProperties.getDotfileName()).append(".\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    new LOCATOR [--date]    Create a repository and clone it here\n");
		help.append("                            --date prefixes the name with today's date\n");
		help.append("    clone LOCATOR           Clone a repository here\n");
		help.append("    list [--topic TOPIC]    List repositories on every store\n");
		help.append("                            Archived repositories are listed only with --topic archived\n");
		help.append("    cached WHAT             Print cached stores, topics or names, one per line\n");
		help.append("\n");
		help.append("LOCATOR:\n");
		help.append("    store:name or store:owner/name, e.g. github:notes or github:acme/notes\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT:\n");
		help.append("    GITHUB_TOKEN            Token for GitHub stores that define none\n");
		help.append("    PENSIEVE_COLOR=no       Disable coloured output\n");
		help.append("    PENSIEVE_SSH_OPTIONS    Extra options for ssh\n");
		help.append("    PENSIEVE_TIMEOUT        SSH connect timeout in seconds (default: ")
			.append(defaultProperties.getSshConnectTimeoutSeconds())
			.append(")\n");
		help.append("    PENSIEVE_AGENT_COMMAND  Agent command run on pensieve servers\n");
		return help.toString();
	}

	private void validate(ParsedCommand command) {
		if (command.datePrefix && !ParsedCommand.NEW.equals(command.command)) {
			throw new IllegalArgumentException("--date is only valid for the new command");
		}
		if (command.topic != null && !ParsedCommand.LIST.equals(command.command)) {
			throw new IllegalArgumentException("--topic is only valid for the list command");
		}
	}

	private String singleOperand(String commandName, List<String> operands, String what) {
		if (operands.isEmpty()) {
			throw new IllegalArgumentException("Missing " + what + " for " + commandName);
		}
		if (operands.size() > 1) {
			throw new IllegalArgumentException("Unexpected argument for " + commandName + ": " + operands.get(1));
		}
		return operands.get(0);
	}

	private String getRequiredValue(String[] args, int index, String optionName) {
		if (index + 1 >= args.length) {
			throw new IllegalArgumentException("Option --" + optionName + " requires a value");
		}
		return args[index + 1];
	}

}
