package org.springaicommunity.pensieve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Entry point for every Pensieve operation.
 *
 * <p>
 * Obtain an instance from {@link PensieveBuilder}. Single-store operations
 * ({@link #create}, {@link #cloneSource}) surface their store's error; {@link #list}
 * reports failing stores alongside the healthy ones' repositories.
 */
public class PensieveService {

	private static final Logger logger = LoggerFactory.getLogger(PensieveService.class);

	private final Map<String, Store> stores;

	private final LocatorResolver resolver;

	private final CacheManager cacheManager;

	private final PensieveProperties properties;

	private final Clock clock;

	public PensieveService(Map<String, Store> stores, CacheManager cacheManager, PensieveProperties properties,
			Clock clock) {
		this.stores = stores;
		this.resolver = new LocatorResolver(stores);
		this.cacheManager = cacheManager;
		this.properties = properties;
		this.clock = clock;
	}

	public List<String> storeNames() {
		return List.copyOf(stores.keySet());
	}

	public Locator resolveLocator(String text) {
		return resolver.resolve(text);
	}

	/**
	 * List every store, refreshing the cache on the way.
	 *
	 * <p>
	 * When no store answers, the last snapshot is served instead, flagged with
	 * {@link ListResult#fromCache()}.
	 */
	public ListResult list(RepositoryFilter filter) {
		RefreshResult refresh = cacheManager.refresh();
		AggregationResult aggregation = refresh.aggregation();
		if (aggregation.isTotalFailure() && refresh.snapshot() != null) {
			logger.info("Serving the cached listing from {}", refresh.snapshot().capturedAt());
			return new ListResult(Aggregator.filter(refresh.snapshot().repositories(), filter),
					aggregation.failures(), true);
		}
		return new ListResult(Aggregator.filter(aggregation.repositories(), filter), aggregation.failures(), false);
	}

	public Repository create(Locator locator) {
		Store store = resolver.storeFor(locator);
		try {
			Repository created = store.createRepository(locator.name(), locator.owner());
			logger.info("Created {}", created.locator());
			return created;
		}
		catch (CreateException e) {
			if (e.isAlreadyExists()) {
				logger.info("{}", e.getMessage());
			}
			else {
				logger.error("Could not create {}: {}", locator, e.getMessage());
			}
			throw e;
		}
	}

	public CloneSource cloneSource(Locator locator) {
		return resolver.storeFor(locator).cloneSource(locator.name(), locator.owner());
	}

	public List<String> cachedQuery(CachedQueryKind kind) {
		return cacheManager.cachedQuery(kind);
	}

	public CacheState cacheState() {
		return cacheManager.state();
	}

	/**
	 * Prefix a repository name with today's date, e.g. {@code __2024-03-01__notes}.
	 */
	public String datePrefixed(String name) {
		String date = LocalDate.now(clock).format(DateTimeFormatter.ofPattern(properties.getDatePrefixFormat()));
		String marker = properties.getDatePrefixHighlight();
		return marker + date + marker + name;
	}

}
