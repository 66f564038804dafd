package org.springaicommunity.pensieve.cli;

import org.springaicommunity.pensieve.CloneSource;

import java.nio.file.Path;

/**
 * Materialises a repository as a local working copy.
 */
public interface RepositoryCloner {

	/**
	 * Clone into {@code directory}, creating a child directory named after the source.
	 * @throws org.springaicommunity.pensieve.PensieveException if cloning fails
	 */
	void cloneInto(CloneSource source, Path directory);

}
