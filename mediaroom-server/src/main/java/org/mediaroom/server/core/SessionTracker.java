package org.mediaroom.server.core;

import com.google.gson.JsonObject;
import org.mediaroom.server.storage.MetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Segments the history of every room in sessions. A session opens when the
 * room goes from empty to occupied and is flushed to the {@link MetadataStore}
 * when the room empties again.
 */
public class SessionTracker {

    private static final Logger log = LoggerFactory.getLogger(SessionTracker.class);

    private static final String ID_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final MetadataStore metadataStore;
    private final Executor flushExecutor;

    private final ConcurrentMap<String, Session> openSessions = new ConcurrentHashMap<>();

    public SessionTracker(MetadataStore metadataStore, Executor flushExecutor) {
        this.metadataStore = metadataStore;
        this.flushExecutor = flushExecutor;
    }

    /**
     * Must be called with the room lock held, right after the first peer has
     * been inserted.
     */
    public Session openSession(Room room) {
        Session session = new Session(generateSessionId(), room.getRoomId(), System.currentTimeMillis());
        session.participantJoined();
        Session previous = openSessions.put(room.getRoomId(), session);
        if (previous != null) {
            log.warn("ROOM {}: session {} was still open when session {} started", room.getRoomId(),
                    previous.getSessionId(), session.getSessionId());
        }
        room.setSessionId(session.getSessionId());
        log.info("ROOM {}: session {} started", room.getRoomId(), session.getSessionId());
        return session;
    }

    public void onParticipantJoined(Room room) {
        Session session = openSessions.get(room.getRoomId());
        if (session != null) {
            session.participantJoined();
        }
    }

    public void onMessage(String roomId, JsonObject message) {
        Session session = openSessions.get(roomId);
        if (session != null) {
            session.messageSent(message);
        }
    }

    public void onPoll(String roomId) {
        Session session = openSessions.get(roomId);
        if (session != null) {
            session.pollCreated();
        }
    }

    public Session getSession(String roomId) {
        return openSessions.get(roomId);
    }

    /**
     * Closes the open session of the room and flushes it asynchronously.
     * Must be called with the room lock held, once the room is empty.
     *
     * @return completes when the flush has finished, successfully or not
     */
    public CompletableFuture<Void> closeSession(Room room) {
        Session session = openSessions.remove(room.getRoomId());
        if (session == null) {
            return CompletableFuture.completedFuture(null);
        }
        session.close(System.currentTimeMillis());
        room.setSessionId(null);
        log.info("ROOM {}: session {} ended after {} ms ({} participants, {} messages)", room.getRoomId(),
                session.getSessionId(), session.getEndedAt() - session.getStartedAt(), session.getParticipants(),
                session.getMessages());
        return CompletableFuture.runAsync(() -> metadataStore.saveSession(session.toJson()), flushExecutor)
                .exceptionally(t -> {
                    log.error("ROOM {}: error flushing session {}", session.getRoomId(), session.getSessionId(), t);
                    return null;
                });
    }

    static String generateSessionId() {
        StringBuilder sb = new StringBuilder("SESS-").append(System.currentTimeMillis()).append('-');
        for (int i = 0; i < 9; i++) {
            sb.append(ID_CHARS.charAt(RANDOM.nextInt(ID_CHARS.length())));
        }
        return sb.toString();
    }
}
