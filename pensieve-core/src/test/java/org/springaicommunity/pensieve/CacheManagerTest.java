package org.springaicommunity.pensieve;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.pensieve.FakeStore.repo;

/**
 * Unit tests for {@link CacheManager}.
 *
 * Tests state derivation, refresh coherency and cached queries.
 */
@DisplayName("CacheManager Tests")
class CacheManagerTest {

	private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

	private static final Duration MAX_AGE = Duration.ofHours(24);

	private InMemorySnapshotStore snapshotStore;

	private Map<String, Store> stores;

	@BeforeEach
	void setUp() {
		snapshotStore = new InMemorySnapshotStore();
		stores = new LinkedHashMap<>();
	}

	private CacheManager manager(Instant now) {
		return new CacheManager(snapshotStore, new Aggregator(Duration.ofSeconds(5)), stores, MAX_AGE,
				Clock.fixed(now, ZoneOffset.UTC));
	}

	private void addStore(FakeStore store) {
		stores.put(store.name(), store);
	}

	@Nested
	@DisplayName("State Tests")
	class StateTest {

		@Test
		@DisplayName("Should be ABSENT without a snapshot")
		void shouldBeAbsentWithoutSnapshot() {
			assertThat(manager(NOW).state()).isEqualTo(CacheState.ABSENT);
		}

		@Test
		@DisplayName("Should be FRESH within the maximum age")
		void shouldBeFreshWithinMaxAge() {
			snapshotStore = new InMemorySnapshotStore(
					CacheSnapshot.of(NOW.minus(Duration.ofHours(23)), List.of(), List.of()));

			assertThat(manager(NOW).state()).isEqualTo(CacheState.FRESH);
		}

		@Test
		@DisplayName("Should become STALE when time passes without a refresh")
		void shouldBecomeStaleAsTimePasses() {
			snapshotStore = new InMemorySnapshotStore(CacheSnapshot.of(NOW, List.of(), List.of()));

			assertThat(manager(NOW).state()).isEqualTo(CacheState.FRESH);
			assertThat(manager(NOW.plus(Duration.ofHours(25))).state()).isEqualTo(CacheState.STALE);
		}

		@Test
		@DisplayName("Should be FRESH right after a refresh")
		void shouldBeFreshAfterRefresh() {
			snapshotStore = new InMemorySnapshotStore(
					CacheSnapshot.of(NOW.minus(Duration.ofDays(3)), List.of(), List.of()));
			addStore(new FakeStore("home", repo("home", "notes")));
			CacheManager manager = manager(NOW);

			assertThat(manager.state()).isEqualTo(CacheState.STALE);
			manager.refresh();

			assertThat(manager.state()).isEqualTo(CacheState.FRESH);
		}

	}

	@Nested
	@DisplayName("Refresh Tests")
	class RefreshTest {

		@Test
		@DisplayName("Should write a snapshot of every store")
		void shouldWriteSnapshot() {
			addStore(new FakeStore("github", repo("github", "pensieve", "tools")));
			addStore(new FakeStore("home", repo("home", "thesis")));

			RefreshResult result = manager(NOW).refresh();

			assertThat(result.written()).isTrue();
			CacheSnapshot written = snapshotStore.current();
			assertThat(written).isNotNull();
			assertThat(written.version()).isEqualTo(CacheSnapshot.CURRENT_VERSION);
			assertThat(written.capturedAt()).isEqualTo(NOW);
			assertThat(written.stores()).containsExactly("github", "home");
			assertThat(written.repositories()).extracting(Repository::locator)
				.containsExactly("github:pensieve", "home:thesis");
		}

		@Test
		@DisplayName("Should keep archived repositories in the snapshot")
		void shouldNotFilterSnapshot() {
			addStore(new FakeStore("home", repo("home", "old", "archived")));

			manager(NOW).refresh();

			assertThat(snapshotStore.current().repositories()).extracting(Repository::name).containsExactly("old");
		}

		@Test
		@DisplayName("Should keep the previous snapshot when every store fails")
		void shouldKeepSnapshotOnTotalFailure() {
			CacheSnapshot previous = CacheSnapshot.of(NOW.minus(Duration.ofHours(1)), List.of("github"),
					List.of(repo("github", "pensieve")));
			snapshotStore = new InMemorySnapshotStore(previous);
			addStore(new FakeStore("github").failing("unreachable"));
			CacheManager manager = manager(NOW);

			RefreshResult result = manager.refresh();

			assertThat(result.written()).isFalse();
			assertThat(result.aggregation().isTotalFailure()).isTrue();
			assertThat(result.snapshot()).isEqualTo(previous);
			assertThat(snapshotStore.writes).isZero();
			assertThat(manager.cachedQuery(CachedQueryKind.NAMES)).containsExactly("github:pensieve");
		}

		@Test
		@DisplayName("Should carry forward cached entries of a store that failed")
		void shouldCarryForwardFailedStoreEntries() {
			snapshotStore = new InMemorySnapshotStore(CacheSnapshot.of(NOW.minus(Duration.ofHours(1)),
					List.of("github", "home"), List.of(repo("github", "pensieve"), repo("home", "stale-thesis"))));
			addStore(new FakeStore("github").failing("Bad credentials"));
			addStore(new FakeStore("home", repo("home", "thesis")));

			RefreshResult result = manager(NOW).refresh();

			assertThat(result.written()).isTrue();
			assertThat(result.aggregation().repositories()).extracting(Repository::locator)
				.containsExactly("home:thesis");
			assertThat(snapshotStore.current().repositories()).extracting(Repository::locator)
				.containsExactly("github:pensieve", "home:thesis");
		}

		@Test
		@DisplayName("Should keep the in-memory snapshot when the write fails")
		void shouldSurviveWriteFailure() {
			CacheSnapshot previous = CacheSnapshot.of(NOW.minus(Duration.ofHours(1)), List.of(), List.of());
			snapshotStore = new InMemorySnapshotStore(previous);
			snapshotStore.failWrites = true;
			addStore(new FakeStore("home", repo("home", "thesis")));

			RefreshResult result = manager(NOW).refresh();

			assertThat(result.written()).isFalse();
			assertThat(result.snapshot()).isEqualTo(previous);
			assertThat(result.aggregation().repositories()).hasSize(1);
		}

	}

	@Nested
	@DisplayName("Cached Query Tests")
	class CachedQueryTest {

		@BeforeEach
		void seedSnapshot() {
			snapshotStore = new InMemorySnapshotStore(CacheSnapshot.of(NOW, List.of("github", "home"),
					List.of(new Repository("github", "octocat", "pensieve", null, Set.of("tools", "python")),
							new Repository("home", null, "thesis", "PhD", Set.of("writing", "tools")),
							new Repository("home", null, "scratch", null, null))));
		}

		@Test
		@DisplayName("Should list stores in snapshot order")
		void shouldListStores() {
			assertThat(manager(NOW).cachedQuery(CachedQueryKind.STORES)).containsExactly("github", "home");
		}

		@Test
		@DisplayName("Should list the sorted union of topics")
		void shouldListTopics() {
			assertThat(manager(NOW).cachedQuery(CachedQueryKind.TOPICS)).containsExactly("python", "tools",
					"writing");
		}

		@Test
		@DisplayName("Should list locators that resolve back to each repository")
		void shouldListNames() {
			assertThat(manager(NOW).cachedQuery(CachedQueryKind.NAMES)).containsExactly("github:octocat/pensieve",
					"home:thesis", "home:scratch");
		}

		@Test
		@DisplayName("Should never contact a store")
		void shouldNotContactStores() {
			FakeStore github = new FakeStore("github");
			addStore(github);
			CacheManager manager = manager(NOW);

			manager.cachedQuery(CachedQueryKind.NAMES);
			manager.cachedQuery(CachedQueryKind.TOPICS);

			assertThat(github.listCalls).hasValue(0);
		}

		@Test
		@DisplayName("Should give the same answer when repeated")
		void shouldBeIdempotent() {
			CacheManager manager = manager(NOW);

			assertThat(manager.cachedQuery(CachedQueryKind.NAMES))
				.isEqualTo(manager.cachedQuery(CachedQueryKind.NAMES));
		}

		@Test
		@DisplayName("Should answer empty without a snapshot")
		void shouldAnswerEmptyWhenAbsent() {
			snapshotStore = new InMemorySnapshotStore();

			assertThat(manager(NOW).cachedQuery(CachedQueryKind.STORES)).isEmpty();
			assertThat(manager(NOW).cachedQuery(CachedQueryKind.TOPICS)).isEmpty();
			assertThat(manager(NOW).cachedQuery(CachedQueryKind.NAMES)).isEmpty();
		}

	}

}
