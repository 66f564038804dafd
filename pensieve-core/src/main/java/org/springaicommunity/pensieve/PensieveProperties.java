package org.springaicommunity.pensieve;

import java.time.Duration;

/**
 * Tunables for Pensieve.
 *
 * <p>
 * Defaults suit interactive use against a handful of stores. Pass a customised instance
 * to {@link PensieveBuilder#properties(PensieveProperties)}.
 */
public class PensieveProperties {

	/**
	 * Name of the dotfile that defines the stores, looked up in the working directory.
	 */
	private String dotfileName = ".pensieve.yaml";

	/**
	 * Name of the cache file, kept next to the dotfile.
	 */
	private String cacheFileName = ".cache.json";

	/**
	 * Deadline for one store's listing during an aggregation.
	 */
	private Duration storeTimeout = Duration.ofSeconds(30);

	/**
	 * Age after which a snapshot is reported as stale.
	 */
	private Duration cacheMaxAge = Duration.ofHours(24);

	/**
	 * SSH {@code ConnectTimeout} for pensieve agent stores, in seconds.
	 */
	private int sshConnectTimeoutSeconds = 5;

	/**
	 * Base URL of the GitHub REST API.
	 */
	private String githubApiUrl = GitHubHttpClient.GITHUB_API_BASE;

	/**
	 * Retries for failed GitHub read requests. Creation requests are never retried.
	 */
	private int githubMaxRetries = 2;

	/**
	 * Date pattern used by {@code new --date}.
	 */
	private String datePrefixFormat = "yyyy-MM-dd";

	/**
	 * Marker placed before and after the date by {@code new --date}.
	 */
	private String datePrefixHighlight = "__";

	public String getDotfileName() {
		return dotfileName;
	}

	public void setDotfileName(String dotfileName) {
		this.dotfileName = dotfileName;
	}

	public String getCacheFileName() {
		return cacheFileName;
	}

	public void setCacheFileName(String cacheFileName) {
		this.cacheFileName = cacheFileName;
	}

	public Duration getStoreTimeout() {
		return storeTimeout;
	}

	public void setStoreTimeout(Duration storeTimeout) {
		this.storeTimeout = storeTimeout;
	}

	public Duration getCacheMaxAge() {
		return cacheMaxAge;
	}

	public void setCacheMaxAge(Duration cacheMaxAge) {
		this.cacheMaxAge = cacheMaxAge;
	}

	public int getSshConnectTimeoutSeconds() {
		return sshConnectTimeoutSeconds;
	}

	public void setSshConnectTimeoutSeconds(int sshConnectTimeoutSeconds) {
		this.sshConnectTimeoutSeconds = sshConnectTimeoutSeconds;
	}

	public String getGithubApiUrl() {
		return githubApiUrl;
	}

	public void setGithubApiUrl(String githubApiUrl) {
		this.githubApiUrl = githubApiUrl;
	}

	public int getGithubMaxRetries() {
		return githubMaxRetries;
	}

	public void setGithubMaxRetries(int githubMaxRetries) {
		this.githubMaxRetries = githubMaxRetries;
	}

	public String getDatePrefixFormat() {
		return datePrefixFormat;
	}

	public void setDatePrefixFormat(String datePrefixFormat) {
		this.datePrefixFormat = datePrefixFormat;
	}

	public String getDatePrefixHighlight() {
		return datePrefixHighlight;
	}

	public void setDatePrefixHighlight(String datePrefixHighlight) {
		this.datePrefixHighlight = datePrefixHighlight;
	}

}
