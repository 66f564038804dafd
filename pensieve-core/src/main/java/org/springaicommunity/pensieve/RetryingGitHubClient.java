package org.springaicommunity.pensieve;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * {@link GitHubClient} that repeats failed reads while they can still finish within a
 * time budget.
 *
 * <p>
 * A GitHub listing runs under the aggregator's per-store deadline, so retrying past it
 * only produces an answer nobody waits for. Every wait is therefore checked against the
 * budget, measured from the first attempt, and the last failure is rethrown as soon as
 * the next attempt could not start in time.
 *
 * <p>
 * Transport errors and 5xx answers are retried after a doubling backoff. A rate limit
 * answer is retried once its {@code X-RateLimit-Reset} has passed, if that is within the
 * budget. Other 4xx answers are final. Creation requests go through
 * {@link #post(String, String)} exactly once: a POST that timed out may still have
 * created the repository.
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	private final GitHubClient delegate;

	private final int maxRetries;

	private final Duration backoff;

	private final Duration budget;

	private final Clock clock;

	private final Sleeper sleeper;

	private RetryingGitHubClient(Builder builder, GitHubClient delegate) {
		this.delegate = delegate;
		this.maxRetries = builder.maxRetries;
		this.backoff = builder.backoff;
		this.budget = builder.budget;
		this.clock = builder.clock;
		this.sleeper = builder.sleeper;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		Instant giveUpAt = clock.instant().plus(budget);
		Duration nextBackoff = backoff;
		int attempt = 1;

		while (true) {
			GitHubHttpClient.GitHubApiException failure;
			try {
				return delegate.get(path);
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				if (e.isClientError() && !e.isRateLimitError()) {
					throw e;
				}
				failure = e;
			}

			Duration wait = failure.isRateLimitError() ? untilReset(failure, nextBackoff) : nextBackoff;
			if (attempt > maxRetries || clock.instant().plus(wait).isAfter(giveUpAt)) {
				logger.warn("GET {} failed after {} attempt(s): {}", path, attempt, failure.getMessage());
				throw failure;
			}

			logger.debug("GET {} failed (attempt {}): {}. Retrying in {}ms", path, attempt, failure.getMessage(),
					wait.toMillis());
			pause(wait, failure);
			nextBackoff = nextBackoff.multipliedBy(2);
			attempt++;
		}
	}

	@Override
	public String post(String path, String jsonBody) {
		return delegate.post(path, jsonBody);
	}

	private Duration untilReset(GitHubHttpClient.GitHubApiException e, Duration fallback) {
		if (e.getResetEpochSeconds() <= 0) {
			return fallback;
		}
		Duration wait = Duration.between(clock.instant(), Instant.ofEpochSecond(e.getResetEpochSeconds() + 1));
		return wait.isNegative() ? Duration.ZERO : wait;
	}

	private void pause(Duration wait, GitHubHttpClient.GitHubApiException failure) {
		try {
			sleeper.sleep(wait);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			failure.addSuppressed(e);
			throw failure;
		}
	}

	/**
	 * Waits between attempts.
	 */
	@FunctionalInterface
	interface Sleeper {

		void sleep(Duration duration) throws InterruptedException;

	}

	/**
	 * Builder for {@link RetryingGitHubClient}. By default a read is tried at most three
	 * times, 500ms apart at first, within 30 seconds.
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private int maxRetries = 2;

		private Duration backoff = Duration.ofMillis(500);

		private Duration budget = Duration.ofSeconds(30);

		private Clock clock = Clock.systemUTC();

		private Sleeper sleeper = duration -> Thread.sleep(duration.toMillis());

		private Builder() {
		}

		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Wait before the first retry; each further retry waits twice as long.
		 */
		public Builder backoff(Duration backoff) {
			this.backoff = backoff;
			return this;
		}

		/**
		 * Time after the first attempt beyond which no retry starts.
		 */
		public Builder budget(Duration budget) {
			this.budget = budget;
			return this;
		}

		Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * @throws IllegalStateException if no client to wrap was given or a setting is
		 * out of range
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("No GitHubClient to retry; call wrapping() first");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must not be negative, was " + maxRetries);
			}
			if (backoff.isNegative() || backoff.isZero()) {
				throw new IllegalStateException("backoff must be positive, was " + backoff);
			}
			return new RetryingGitHubClient(this, delegate);
		}

	}

}
