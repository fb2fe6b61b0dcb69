package com.ai.codeindex.credential;

import com.ai.codeindex.exception.CredentialUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the upstream credential. Callers always go through {@link #getActiveCredential()},
 * which refreshes proactively inside the refresh window. Only one refresh runs at a time;
 * concurrent callers wait for it and reuse its result.
 *
 * <p>After {@code failureThreshold} consecutive refresh failures the breaker opens and
 * callers fail fast until the cooldown elapses. The first caller after the cooldown
 * probes the sources again.
 */
public class CredentialSupervisor {

    private static final Logger log = LoggerFactory.getLogger(CredentialSupervisor.class);

    private final List<CredentialSource> sources;
    private final Clock clock;
    private final Duration refreshThreshold;
    private final Duration acquireTimeout;
    private final int failureThreshold;
    private final Duration cooldown;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicReference<Credential> active = new AtomicReference<>();
    private final AtomicLong refreshCount = new AtomicLong();

    private volatile boolean running;
    private volatile boolean refreshing;
    private volatile int consecutiveFailures;
    private volatile Instant breakerOpenedAt;
    private volatile String lastFailure;

    public CredentialSupervisor(List<CredentialSource> sources, Clock clock, Duration refreshThreshold,
                                Duration acquireTimeout, int failureThreshold, Duration cooldown) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("At least one credential source is required");
        }
        this.sources = List.copyOf(sources);
        this.clock = clock;
        this.refreshThreshold = refreshThreshold;
        this.acquireTimeout = acquireTimeout;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.cooldown = cooldown;
    }

    /**
     * Marks the supervisor usable and tries a first refresh. A failing first refresh is
     * logged, not thrown: callers retry lazily.
     */
    public void start() {
        running = true;
        log.info("[CredentialSupervisor] Starting with sources {}", sources.stream().map(CredentialSource::type).toList());
        try {
            refresh();
        } catch (CredentialUnavailableException e) {
            log.warn("[CredentialSupervisor] Initial refresh failed: {}", e.getMessage());
        }
    }

    public void shutdown() {
        running = false;
        active.set(null);
        log.info("[CredentialSupervisor] Stopped");
    }

    public Credential getActiveCredential() {
        ensureRunning();
        Instant now = clock.instant();
        Credential current = active.get();
        if (current != null && !needsRefresh(current, now)) {
            return current;
        }
        if (isBreakerOpen(now)) {
            throw new CredentialUnavailableException("Credential refresh circuit is open until "
                    + breakerOpenedAt.plus(cooldown) + " (last failure: " + lastFailure + ")");
        }
        return refreshUnderLock(current);
    }

    /**
     * Forces a refresh regardless of the remaining lifetime.
     */
    public Credential refresh() {
        ensureRunning();
        acquireLock();
        try {
            return doRefresh(active.get());
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Called when the upstream rejected {@code credential}. The next caller refreshes.
     */
    public void reportRejected(Credential credential) {
        if (credential != null && active.compareAndSet(credential, null)) {
            log.warn("[CredentialSupervisor] Credential from {} was rejected upstream, dropping it", credential.source());
        }
    }

    public SupervisorState state() {
        if (breakerOpenedAt != null) {
            return SupervisorState.DEGRADED;
        }
        if (refreshing) {
            return SupervisorState.REFRESHING;
        }
        Credential current = active.get();
        if (current == null || needsRefresh(current, clock.instant())) {
            return SupervisorState.NEAR_EXPIRY;
        }
        return SupervisorState.VALID;
    }

    /**
     * False only while the breaker is open and the cooldown has not elapsed.
     */
    public boolean isAcceptingRequests() {
        return !isBreakerOpen(clock.instant());
    }

    public CredentialStatus status() {
        Credential current = active.get();
        Instant openedAt = breakerOpenedAt;
        return new CredentialStatus(
                state(),
                current != null ? current.source() : null,
                current != null ? current.expiresAt() : null,
                consecutiveFailures,
                openedAt != null ? openedAt.plus(cooldown) : null,
                refreshCount.get(),
                lastFailure);
    }

    private Credential refreshUnderLock(Credential seen) {
        acquireLock();
        try {
            Instant now = clock.instant();
            Credential latest = active.get();
            // another caller refreshed while we waited
            if (latest != null && latest != seen && !needsRefresh(latest, now)) {
                return latest;
            }
            if (isBreakerOpen(now)) {
                throw new CredentialUnavailableException("Credential refresh circuit is open until "
                        + breakerOpenedAt.plus(cooldown));
            }
            return doRefresh(latest);
        } finally {
            refreshLock.unlock();
        }
    }

    private Credential doRefresh(Credential previous) {
        refreshing = true;
        try {
            List<String> failures = new ArrayList<>();
            for (CredentialSource source : sources) {
                CredentialResult result = fetchQuietly(source);
                if (result instanceof CredentialResult.Success success) {
                    Credential credential = success.credential();
                    active.set(credential);
                    long count = refreshCount.incrementAndGet();
                    if (breakerOpenedAt != null) {
                        log.info("[CredentialSupervisor] Circuit closed after successful probe");
                    }
                    consecutiveFailures = 0;
                    breakerOpenedAt = null;
                    lastFailure = null;
                    log.info("[CredentialSupervisor] Refreshed credential #{} from {} (expires at {})",
                            count, credential.source(), credential.expiresAt());
                    return credential;
                }
                CredentialResult.Failure failure = (CredentialResult.Failure) result;
                failures.add(failure.source() + ": " + failure.reason());
            }

            Instant now = clock.instant();
            consecutiveFailures++;
            lastFailure = String.join("; ", failures);
            log.warn("[CredentialSupervisor] Refresh failed ({} consecutive): {}", consecutiveFailures, lastFailure);
            if (consecutiveFailures >= failureThreshold) {
                breakerOpenedAt = now;
                log.error("[CredentialSupervisor] Circuit opened for {}s after {} consecutive failures",
                        cooldown.toSeconds(), consecutiveFailures);
            }
            if (previous != null && !previous.isExpired(now) && breakerOpenedAt == null) {
                log.warn("[CredentialSupervisor] Keeping current credential until it expires at {}", previous.expiresAt());
                return previous;
            }
            throw new CredentialUnavailableException("No credential source succeeded: " + lastFailure);
        } finally {
            refreshing = false;
        }
    }

    private CredentialResult fetchQuietly(CredentialSource source) {
        try {
            return source.fetch();
        } catch (RuntimeException e) {
            log.warn("[CredentialSupervisor] Source {} threw: {}", source.type(), e.getMessage());
            return CredentialResult.failure(source.type(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void acquireLock() {
        try {
            if (!refreshLock.tryLock(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new CredentialUnavailableException("Timed out after " + acquireTimeout.toMillis()
                        + " ms waiting for a credential refresh");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CredentialUnavailableException("Interrupted while waiting for a credential refresh", e);
        }
    }

    private boolean needsRefresh(Credential credential, Instant now) {
        return credential.expiresWithin(refreshThreshold, now);
    }

    private boolean isBreakerOpen(Instant now) {
        Instant openedAt = breakerOpenedAt;
        return openedAt != null && now.isBefore(openedAt.plus(cooldown));
    }

    private void ensureRunning() {
        if (!running) {
            throw new CredentialUnavailableException("Credential supervisor is not running");
        }
    }
}
