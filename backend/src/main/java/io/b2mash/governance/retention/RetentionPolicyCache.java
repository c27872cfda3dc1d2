package io.b2mash.governance.retention;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Time-boxed cache of the active retention policies.
 *
 * <p>The policy list is held under a single Caffeine key. Caffeine collapses concurrent refreshes
 * of that key into one in-flight load, and a failed refresh keeps the previous snapshot. The
 * caller that triggered a failed refresh receives the error; callers served from a fresh snapshot
 * never do.
 */
@Component
public class RetentionPolicyCache {

  private static final Logger log = LoggerFactory.getLogger(RetentionPolicyCache.class);

  private static final String ACTIVE_POLICIES = "active-policies";

  private final RetentionPolicyRepository policyRepository;
  private final Ticker ticker;
  private final long refreshIntervalNanos;
  private final LoadingCache<String, PolicySnapshot> cache;

  @Autowired
  public RetentionPolicyCache(
      RetentionPolicyRepository policyRepository, RetentionProperties properties) {
    this(
        policyRepository,
        properties.policyCacheRefreshInterval(),
        Ticker.systemTicker(),
        ForkJoinPool.commonPool());
  }

  RetentionPolicyCache(
      RetentionPolicyRepository policyRepository,
      Duration refreshInterval,
      Ticker ticker,
      Executor refreshExecutor) {
    this.policyRepository = policyRepository;
    this.ticker = ticker;
    this.refreshIntervalNanos = refreshInterval.toNanos();
    this.cache = Caffeine.newBuilder().executor(refreshExecutor).build(key -> load());
  }

  /**
   * Returns the cached policies, reloading them when forced or when the snapshot is older than
   * the refresh interval.
   */
  public List<RetentionPolicy> refresh(boolean force) {
    PolicySnapshot snapshot = cache.getIfPresent(ACTIVE_POLICIES);
    if (snapshot == null) {
      return cache.get(ACTIVE_POLICIES).policies();
    }
    if (force || isStale(snapshot)) {
      return await(refreshAsync()).policies();
    }
    return snapshot.policies();
  }

  public List<RetentionPolicy> listActivePolicies(boolean forceRefresh) {
    return refresh(forceRefresh).stream().filter(RetentionPolicy::active).toList();
  }

  public Optional<RetentionPolicy> getPolicyById(Long id, boolean forceRefresh) {
    return refresh(forceRefresh).stream().filter(policy -> policy.id().equals(id)).findFirst();
  }

  public void invalidate() {
    cache.invalidateAll();
  }

  /** Starts (or joins) a reload of the policy list. */
  CompletableFuture<PolicySnapshot> refreshAsync() {
    return cache.refresh(ACTIVE_POLICIES);
  }

  private boolean isStale(PolicySnapshot snapshot) {
    return ticker.read() - snapshot.loadedAtNanos() >= refreshIntervalNanos;
  }

  private PolicySnapshot load() {
    List<RetentionPolicy> policies = List.copyOf(policyRepository.findActive());
    log.info("Loaded {} active retention policies", policies.size());
    return new PolicySnapshot(policies, ticker.read());
  }

  private static PolicySnapshot await(CompletableFuture<PolicySnapshot> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Failed to refresh retention policies", e.getCause());
    }
  }

  record PolicySnapshot(List<RetentionPolicy> policies, long loadedAtNanos) {}
}
