package org.springaicommunity.pensieve.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.pensieve.CloneSource;
import org.springaicommunity.pensieve.PensieveException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link RepositoryCloner} running {@code git clone}.
 */
public class GitCloner implements RepositoryCloner {

	private static final Logger logger = LoggerFactory.getLogger(GitCloner.class);

	private final String gitExecutable;

	public GitCloner() {
		this("git");
	}

	public GitCloner(String gitExecutable) {
		this.gitExecutable = gitExecutable;
	}

	List<String> command(CloneSource source) {
		return List.of(gitExecutable, "clone", source.url(), source.directoryName());
	}

	@Override
	public void cloneInto(CloneSource source, Path directory) {
		List<String> command = command(source);
		logger.debug("Running {} in {}", command, directory);
		try {
			Process process = new ProcessBuilder(command).directory(directory.toFile())
				.redirectErrorStream(true)
				.redirectInput(ProcessBuilder.Redirect.PIPE)
				.start();
			process.getOutputStream().close();
			String output;
			try (InputStream in = process.getInputStream()) {
				output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
			}
			int exitCode = process.waitFor();
			if (exitCode != 0) {
				throw new PensieveException(output.isBlank() ? "git clone exited with status " + exitCode
						: output.strip());
			}
		}
		catch (IOException e) {
			throw new PensieveException("Could not run git: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PensieveException("Interrupted while cloning " + source.url(), e);
		}
	}

}
