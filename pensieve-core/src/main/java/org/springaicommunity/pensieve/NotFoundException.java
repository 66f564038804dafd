package org.springaicommunity.pensieve;

/**
 * Thrown when a store was reachable and answered that a repository does not exist.
 */
public class NotFoundException extends PensieveException {

	private final String storeName;

	private final String repositoryName;

	public NotFoundException(String storeName, String repositoryName) {
		super("Repository \"" + storeName + ":" + repositoryName + "\" does not exist.");
		this.storeName = storeName;
		this.repositoryName = repositoryName;
	}

	public String getStoreName() {
		return storeName;
	}

	public String getRepositoryName() {
		return repositoryName;
	}

}
