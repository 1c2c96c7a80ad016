package fr.lapetina.sessionpool.infrastructure.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers the last authentication probe result per worker for a fixed TTL.
 * Thread-safe.
 */
public final class AuthenticationStatusCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public AuthenticationStatusCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public AuthenticationStatusCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    /**
     * Returns the cached result if it is still fresh.
     */
    public Optional<Boolean> get(String workerId) {
        Entry entry = entries.get(workerId);
        if (entry == null) {
            return Optional.empty();
        }
        if (Duration.between(entry.checkedAt(), clock.instant()).compareTo(ttl) >= 0) {
            entries.remove(workerId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.authenticated());
    }

    public void put(String workerId, boolean authenticated) {
        entries.put(workerId, new Entry(authenticated, clock.instant()));
    }

    public void forget(String workerId) {
        entries.remove(workerId);
    }

    private record Entry(boolean authenticated, Instant checkedAt) {
    }
}
