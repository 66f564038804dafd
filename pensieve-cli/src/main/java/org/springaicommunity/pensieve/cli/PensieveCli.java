package org.springaicommunity.pensieve.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.pensieve.CloneSource;
import org.springaicommunity.pensieve.EnvironmentSupport;
import org.springaicommunity.pensieve.ListResult;
import org.springaicommunity.pensieve.Locator;
import org.springaicommunity.pensieve.PensieveBuilder;
import org.springaicommunity.pensieve.PensieveException;
import org.springaicommunity.pensieve.PensieveProperties;
import org.springaicommunity.pensieve.PensieveService;
import org.springaicommunity.pensieve.Repository;
import org.springaicommunity.pensieve.RepositoryFilter;
import org.springaicommunity.pensieve.StoreFailure;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Pensieve CLI Application
 *
 * Manages repositories spread over GitHub accounts and self-hosted pensieve servers from
 * a directory holding a {@code .pensieve.yaml} dotfile.
 *
 * Usage: java -jar pensieve-cli.jar COMMAND [ARGS]
 *
 * Examples: pensieve list --topic teaching, pensieve new github:notes --date, pensieve
 * clone home:thesis, pensieve cached names
 */
public class PensieveCli {

	private static final Logger logger = LoggerFactory.getLogger(PensieveCli.class);

	private static final String BASE_PACKAGE = "org.springaicommunity.pensieve";

	private final Path directory;

	private final Function<Path, PensieveService> services;

	private final RepositoryCloner cloner;

	private final PrintStream out;

	private final PrintStream err;

	private final ConsoleStyle style;

	public PensieveCli(Path directory, Function<Path, PensieveService> services, RepositoryCloner cloner,
			PrintStream out, PrintStream err, ConsoleStyle style) {
		this.directory = directory;
		this.services = services;
		this.cloner = cloner;
		this.out = out;
		this.err = err;
		this.style = style;
	}

	public static void main(String[] args) {
		PensieveCli cli = new PensieveCli(Path.of("").toAbsolutePath(),
				directory -> PensieveBuilder.create().directory(directory).build(), new GitCloner(), System.out,
				System.err, ConsoleStyle.fromEnvironment(EnvironmentSupport::get));
		int exitCode = cli.run(args);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	public int run(String[] args) {
		ArgumentParser argumentParser = new ArgumentParser(new PensieveProperties());

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		try {
			ParsedCommand command = argumentParser.parseAndValidate(args);
			if (command.verbose) {
				enableVerboseLogging();
			}
			PensieveService pensieve = services.apply(directory);

			switch (command.command) {
				case ParsedCommand.NEW:
					return runNew(pensieve, command);
				case ParsedCommand.CLONE:
					return runClone(pensieve, command);
				case ParsedCommand.LIST:
					return runList(pensieve, command);
				default:
					pensieve.cachedQuery(command.cachedQuery).forEach(out::println);
					return 0;
			}
		}
		catch (IllegalArgumentException e) {
			err.println(style.bad("Error: " + e.getMessage()));
			err.println("Use --help for usage.");
			return 1;
		}
		catch (PensieveException e) {
			logger.debug("Command failed", e);
			err.println(style.bad("Error: " + e.getMessage()));
			return 1;
		}
	}

	private int runNew(PensieveService pensieve, ParsedCommand command) {
		Locator locator = pensieve.resolveLocator(command.locator);
		if (command.datePrefix) {
			locator = new Locator(locator.storeName(), locator.owner(), pensieve.datePrefixed(locator.name()));
		}
		Repository created = pensieve.create(locator);
		out.println("New repository \"" + created.locator() + "\" created.");

		cloner.cloneInto(pensieve.cloneSource(locator), directory);
		return 0;
	}

	private int runClone(PensieveService pensieve, ParsedCommand command) {
		Locator locator = pensieve.resolveLocator(command.locator);
		CloneSource source = pensieve.cloneSource(locator);
		cloner.cloneInto(source, directory);
		out.println(style.good("Cloned repository \"" + locator + "\"."));
		return 0;
	}

	private int runList(PensieveService pensieve, ParsedCommand command) {
		RepositoryFilter filter = command.topic != null ? RepositoryFilter.topic(command.topic)
				: RepositoryFilter.defaults();
		ListResult result = pensieve.list(filter);
		RepositoryListingFormatter formatter = new RepositoryListingFormatter(style);

		out.print(formatter.format(result.repositories()));
		for (StoreFailure failure : result.failures()) {
			err.println(formatter.formatFailure(failure));
		}
		if (result.fromCache()) {
			err.println(style.faded("No store answered; showing the cached listing."));
		}

		boolean everyStoreFailed = !result.failures().isEmpty()
				&& result.failures().size() == pensieve.storeNames().size();
		return everyStoreFailed && !result.fromCache() ? 1 : 0;
	}

	private static void enableVerboseLogging() {
		org.slf4j.Logger pensieveLogger = LoggerFactory.getLogger(BASE_PACKAGE);
		if (pensieveLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

}
