package com.phillippitts.voicebridge.service.session;

import com.phillippitts.voicebridge.util.TokenGenerator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * In-memory registry of live sessions keyed by session id.
 *
 * <p>Lookups and inserts are per-key atomic; there is no global lock.
 */
@Component
public class SessionStore {

    /** Ids are used as file names for the history cache, so they are restricted to a safe alphabet. */
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final int ID_BYTES = 4;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Supplier<String> idSource;

    public SessionStore() {
        this(() -> TokenGenerator.hex(ID_BYTES));
    }

    SessionStore(Supplier<String> idSource) {
        this.idSource = idSource;
    }

    public static boolean isValidId(String id) {
        return id != null && VALID_ID.matcher(id).matches();
    }

    /**
     * Registers a session under a freshly minted id (8 lowercase hex characters).
     * The id is drawn and claimed in one step, so concurrent callers never share a session.
     */
    public Session createWithNewId(Function<String, Session> factory) {
        String id;
        Session session;
        do {
            id = idSource.get();
            session = factory.apply(id);
        } while (sessions.putIfAbsent(id, session) != null);
        return session;
    }

    public Optional<Session> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(sessions.get(id));
    }

    /**
     * Returns the session for {@code id}, creating it atomically with {@code factory} when absent.
     */
    public Session getOrCreate(String id, Function<String, Session> factory) {
        return sessions.computeIfAbsent(id, factory);
    }

    /**
     * Removes the session only if it is still the one registered under its id.
     */
    public boolean remove(Session session) {
        return sessions.remove(session.id(), session);
    }

    public List<Session> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
