package com.candidateprep.coach.session;

import com.candidateprep.coach.config.CoachProperties;
import com.candidateprep.coach.exception.NoActiveSessionException;
import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One {@link SessionStateStore} per client. All work on a client's store runs
 * while holding that store's monitor, so one client's requests never interleave.
 * Only {@link #withStore} creates a store; lookups for unknown clients leave the
 * registry untouched.
 */
@Component
public class SessionRegistry {

    public static final String CLIENT_HEADER = "X-Client-Id";
    public static final String DEFAULT_CLIENT = "default";
    private static final int MAX_CLIENT_ID_CHARS = 100;

    private final ConcurrentMap<String, SessionStateStore> stores = new ConcurrentHashMap<>();
    private final CoachProperties properties;
    private final Clock clock;

    public SessionRegistry(CoachProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public <T> T withStore(String clientId, Function<SessionStateStore, T> action) {
        SessionStateStore store = stores.computeIfAbsent(normalize(clientId),
            id -> new SessionStateStore(clock, properties.getConversationWindow()));
        synchronized (store) {
            return action.apply(store);
        }
    }

    /** Runs against an existing store; throws {@link NoActiveSessionException} when the client has none. */
    public <T> T withExistingStore(String clientId, Function<SessionStateStore, T> action) {
        return withExistingStore(clientId, action, () -> {
            throw new NoActiveSessionException();
        });
    }

    public <T> T withExistingStore(String clientId, Function<SessionStateStore, T> action, Supplier<T> whenAbsent) {
        SessionStateStore store = stores.get(normalize(clientId));
        if (store == null) return whenAbsent.get();
        synchronized (store) {
            return action.apply(store);
        }
    }

    /** Clears the client's session and forgets its store. */
    public boolean remove(String clientId) {
        SessionStateStore removed = stores.remove(normalize(clientId));
        if (removed == null) return false;
        synchronized (removed) {
            removed.clear();
        }
        return true;
    }

    public int clientCount() {
        return stores.size();
    }

    public long activeSessionCount() {
        return stores.values().stream().filter(store -> {
            synchronized (store) {
                return store.hasSession();
            }
        }).count();
    }

    static String normalize(String clientId) {
        if (clientId == null || clientId.isBlank()) return DEFAULT_CLIENT;
        String trimmed = clientId.strip();
        if (trimmed.length() > MAX_CLIENT_ID_CHARS) {
            throw new IllegalArgumentException(CLIENT_HEADER + " exceeds maximum length of " + MAX_CLIENT_ID_CHARS + " characters.");
        }
        return trimmed;
    }
}
