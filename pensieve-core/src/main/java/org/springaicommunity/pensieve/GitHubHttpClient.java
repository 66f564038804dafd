package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.OptionalLong;

/**
 * {@link GitHubClient} backed by the JDK {@link HttpClient}, authenticating with a bearer
 * token.
 *
 * <p>
 * Non-2xx responses are raised as {@link GitHubApiException} carrying the status code,
 * the body and the rate limit headers, so callers can decide whether to retry.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	public static final String GITHUB_API_BASE = "https://api.github.com";

	private static final String API_VERSION = "2022-11-28";

	/** Remaining requests below which every response logs the rate limit. */
	private static final int LOW_RATE_LIMIT = 100;

	private final HttpClient httpClient;

	private final String apiBase;

	private final String token;

	private final Duration requestTimeout;

	public GitHubHttpClient(String token) {
		this(token, GITHUB_API_BASE, Duration.ofSeconds(30));
	}

	public GitHubHttpClient(String token, String apiBase, Duration requestTimeout) {
		this.token = token;
		this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(requestTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public String get(String path) {
		return send(request(path).GET().build());
	}

	@Override
	public String post(String path, String jsonBody) {
		return send(request(path).header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(jsonBody))
			.build());
	}

	private HttpRequest.Builder request(String path) {
		URI uri = URI.create(path.startsWith("http") ? path : apiBase + path);
		return HttpRequest.newBuilder(uri)
			.timeout(requestTimeout)
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github+json")
			.header("X-GitHub-Api-Version", API_VERSION)
			.header("User-Agent", "pensieve");
	}

	private String send(HttpRequest request) {
		String description = request.method() + " " + request.uri();
		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (HttpTimeoutException e) {
			throw new GitHubApiException(description + " timed out after " + requestTimeout.toSeconds() + "s", e);
		}
		catch (IOException e) {
			throw new GitHubApiException(description + " failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException(description + " interrupted", e);
		}

		int status = response.statusCode();
		int remaining = (int) header(response, "X-RateLimit-Remaining").orElse(-1);
		long reset = header(response, "X-RateLimit-Reset").orElse(-1);
		logger.debug("{} -> {}", description, status);
		if (remaining >= 0 && remaining < LOW_RATE_LIMIT) {
			logger.info("GitHub rate limit low: {} requests left until epoch {}", remaining, reset);
		}

		if (status / 100 == 2) {
			return response.body();
		}
		throw new GitHubApiException(failureMessage(request, status, remaining, reset), status, response.body(),
				remaining, reset);
	}

	private static String failureMessage(HttpRequest request, int status, int remaining, long reset) {
		return switch (status) {
			case 401 -> "GitHub rejected the token (401). Check the store's token or GITHUB_TOKEN.";
			case 404 -> "Not found on GitHub: " + request.uri().getPath();
			case 429 -> "GitHub rate limit hit (429); resets at epoch " + reset;
			case 403 -> remaining == 0 ? "GitHub rate limit exhausted; resets at epoch " + reset
					: "GitHub refused " + request.method() + " " + request.uri().getPath() + " (403)";
			default -> "GitHub answered " + status + " to " + request.method() + " " + request.uri().getPath();
		};
	}

	private static OptionalLong header(HttpResponse<?> response, String name) {
		try {
			return response.headers()
				.firstValue(name)
				.map(value -> OptionalLong.of(Long.parseLong(value.trim())))
				.orElse(OptionalLong.empty());
		}
		catch (NumberFormatException e) {
			return OptionalLong.empty();
		}
	}

	/**
	 * A GitHub request that failed, either with an error status or without any response.
	 */
	public static class GitHubApiException extends RuntimeException {

		/** Status of a request that got no HTTP response at all. */
		public static final int NO_RESPONSE = -1;

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				int rateLimitRemaining, long resetEpochSeconds) {
			this(message, null, statusCode, responseBody, rateLimitRemaining, resetEpochSeconds);
		}

		public GitHubApiException(String message, Throwable cause) {
			this(message, cause, NO_RESPONSE, null, -1, -1);
		}

		private GitHubApiException(String message, @Nullable Throwable cause, int statusCode,
				@Nullable String responseBody, int rateLimitRemaining, long resetEpochSeconds) {
			super(message, cause);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		public boolean isRateLimitError() {
			return statusCode == 429 || (statusCode == 403 && rateLimitRemaining == 0);
		}

		/**
		 * True for 4xx answers: the server was reached and refused the request.
		 */
		public boolean isClientError() {
			return statusCode >= 400 && statusCode < 500;
		}

		public boolean isNotFound() {
			return statusCode == 404;
		}

	}

}
