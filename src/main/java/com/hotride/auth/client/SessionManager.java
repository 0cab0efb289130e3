package com.hotride.auth.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single on-device session.
 * <p>
 * The session lives in two slots, {@value #TOKEN_SLOT} and {@value #USER_SLOT}. Either both are present
 * or the rider is signed out: a lone slot found on restore is deleted, and a failed write during
 * {@link #establish} puts back the token it replaced. {@link #restore()} must run once before
 * {@link #currentSession()} is consulted.
 */
public class SessionManager {

    public static final String TOKEN_SLOT = "auth_token";
    public static final String USER_SLOT = "user_data";

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final SecureSessionStore store;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Optional<Session> current = Optional.empty();
    private volatile boolean restored;

    public SessionManager(SecureSessionStore store) {
        this(store, new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public SessionManager(SecureSessionStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
        if (!store.guarantee().isSecure()) {
            logger.warn("Session store offers {} protection only; tokens are not stored securely", store.guarantee());
        }
    }

    public StorageGuarantee storageGuarantee() {
        return store.guarantee();
    }

    /**
     * Load the persisted session, if a complete one exists.
     */
    public Optional<Session> restore() {
        lock.lock();
        try {
            Optional<String> token = store.get(TOKEN_SLOT);
            Optional<String> userJson = store.get(USER_SLOT);

            Optional<Session> session = Optional.empty();
            if (token.isPresent() && userJson.isPresent()) {
                try {
                    session = Optional.of(new Session(token.get(),
                            objectMapper.readValue(userJson.get(), UserSnapshot.class)));
                } catch (JsonProcessingException e) {
                    logger.warn("Stored user data is unreadable, discarding session");
                    deleteBothSlots();
                }
            } else if (token.isPresent() || userJson.isPresent()) {
                logger.warn("Found an incomplete stored session, discarding it");
                deleteBothSlots();
            }

            restored = true;
            update(session);
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws IllegalStateException if called before {@link #restore()}
     */
    public Optional<Session> currentSession() {
        if (!restored) {
            throw new IllegalStateException("Session has not been restored yet");
        }
        return current;
    }

    public boolean isAuthenticated() {
        return currentSession().isPresent();
    }

    /**
     * Persist a new session. On failure the previous session stands in memory and in storage. If even that
     * cannot be restored the rider is signed out in both.
     *
     * @throws SessionStoreException if either slot could not be written
     */
    public Session establish(String token, UserSnapshot user) {
        if (token == null || token.isBlank() || user == null) {
            throw new IllegalArgumentException("A session needs both a token and a user");
        }
        String userJson = writeUser(user);
        lock.lock();
        try {
            Optional<String> previousToken = store.get(TOKEN_SLOT);
            store.put(TOKEN_SLOT, token);
            try {
                store.put(USER_SLOT, userJson);
            } catch (SessionStoreException e) {
                logger.error("Failed to store user data, restoring previous session token");
                rollBackToken(previousToken, e);
                throw e;
            }
            Session session = new Session(token, user);
            restored = true;
            update(Optional.of(session));
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the cached user of the current session, e.g. after a profile change. No-op when signed out.
     */
    public void updateUser(UserSnapshot user) {
        lock.lock();
        try {
            Optional<Session> existing = current;
            if (existing.isEmpty()) {
                return;
            }
            store.put(USER_SLOT, writeUser(user));
            update(Optional.of(new Session(existing.get().token(), user)));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sign out. Both slots are deleted even if the first delete fails; the in-memory session is always
     * dropped.
     *
     * @throws SessionStoreException if a slot could not be deleted
     */
    public void clear() {
        lock.lock();
        try {
            SessionStoreException failure = deleteBothSlots();
            restored = true;
            update(Optional.empty());
            if (failure != null) {
                throw failure;
            }
        } finally {
            lock.unlock();
        }
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    private void rollBackToken(Optional<String> previousToken, SessionStoreException cause) {
        try {
            if (previousToken.isPresent()) {
                store.put(TOKEN_SLOT, previousToken.get());
            } else {
                store.delete(TOKEN_SLOT);
            }
        } catch (SessionStoreException rollbackFailure) {
            // The slots no longer hold the previous session, so sign out in memory and in storage.
            logger.error("Failed to restore previous session token, signing out");
            cause.addSuppressed(rollbackFailure);
            SessionStoreException clearFailure = deleteBothSlots();
            if (clearFailure != null) {
                cause.addSuppressed(clearFailure);
            }
            update(Optional.empty());
        }
    }

    private SessionStoreException deleteBothSlots() {
        SessionStoreException failure = null;
        for (String slot : List.of(TOKEN_SLOT, USER_SLOT)) {
            try {
                store.delete(slot);
            } catch (SessionStoreException e) {
                logger.error("Failed to delete session slot {}", slot, e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        return failure;
    }

    private String writeUser(UserSnapshot user) {
        try {
            return objectMapper.writeValueAsString(user);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("User snapshot cannot be serialized", e);
        }
    }

    private void update(Optional<Session> session) {
        current = session;
        for (SessionListener listener : listeners) {
            listener.onSessionChanged(session);
        }
    }
}
