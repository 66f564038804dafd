package org.springaicommunity.pensieve;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Keeps {@link GitHubStore} independent of the transport so it can be tested with mocks
 * and decorated (see {@link RetryingGitHubClient}).
 */
public interface GitHubClient {

	/**
	 * Execute a GET request against the GitHub REST API.
	 * @param path API path including any query string (e.g. "/user/repos?page=2") or a
	 * full URL
	 * @return response body
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a POST request with a JSON body against the GitHub REST API.
	 * @param path API path (e.g. "/user/repos")
	 * @param jsonBody request body
	 * @return response body
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String post(String path, String jsonBody);

}
