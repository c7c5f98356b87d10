package org.mediaroom.server.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.client.internal.ProtocolElements;
import org.mediaroom.server.engine.EngineProducer;
import org.mediaroom.server.engine.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Peers sharing one routing context. Every mutation of the peer map and of the
 * host assignment must be done while holding {@link #getLock()}.
 */
public class Room {

    private static final Logger log = LoggerFactory.getLogger(Room.class);

    private final String roomId;
    private final RoutingContext routingContext;
    private final String password;
    private final long createdAt;

    private final Object lock = new Object();

    private final Map<String, Peer> peers = new LinkedHashMap<>();
    private final JsonObject settings = new JsonObject();
    private final Map<String, Poll> polls = new LinkedHashMap<>();

    private volatile String hostId;
    private volatile String sessionId;
    private volatile String activeRecordingId;
    private volatile boolean closed = false;

    private ScheduledFuture<?> evictionTimer;

    private final AtomicBoolean contextReleased = new AtomicBoolean(false);

    public Room(String roomId, RoutingContext routingContext, String password) {
        this.roomId = roomId;
        this.routingContext = routingContext;
        this.password = (password == null || password.isEmpty()) ? null : password;
        this.createdAt = System.currentTimeMillis();
    }

    public String getRoomId() {
        return roomId;
    }

    public RoutingContext getRoutingContext() {
        return routingContext;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public Object getLock() {
        return lock;
    }

    public boolean hasPassword() {
        return password != null;
    }

    public boolean checkPassword(String candidate) {
        return password == null || password.equals(candidate);
    }

    public String getHostId() {
        return hostId;
    }

    public String getSessionId() {
        return sessionId;
    }

    void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getActiveRecordingId() {
        return activeRecordingId;
    }

    public void setActiveRecordingId(String activeRecordingId) {
        this.activeRecordingId = activeRecordingId;
    }

    public boolean isRecording() {
        return activeRecordingId != null;
    }

    public boolean isClosed() {
        return closed;
    }

    void markClosed() {
        this.closed = true;
    }

    /**
     * Inserts the peer and makes it host if the room has none and the peer is
     * not a recorder.
     *
     * @return true if the peer became host
     */
    boolean addPeer(Peer peer) {
        synchronized (lock) {
            peers.put(peer.getPeerId(), peer);
            if (hostId == null && !peer.isRecorder()) {
                hostId = peer.getPeerId();
                peer.setHost(true);
                return true;
            }
            return false;
        }
    }

    /**
     * Removes the peer. If it was the host, hands the role to the surviving
     * non-recorder peer that joined first.
     *
     * @return the new host, or <code>null</code> if the host did not change or
     * no eligible peer remains
     */
    Peer removePeer(String peerId) {
        synchronized (lock) {
            Peer removed = peers.remove(peerId);
            if (removed == null) {
                throw new MediaRoomException(Code.PEER_NOT_FOUND_ERROR_CODE,
                        "Peer '" + peerId + "' not found in room '" + roomId + "'");
            }
            removed.setHost(false);
            if (!peerId.equals(hostId)) {
                return null;
            }
            Peer newHost = selectNextHost();
            if (newHost != null) {
                hostId = newHost.getPeerId();
                newHost.setHost(true);
                log.info("ROOM {}: host migrated from {} to {}", roomId, peerId, hostId);
            } else {
                hostId = null;
                log.info("ROOM {}: host {} left and no eligible peer remains", roomId, peerId);
            }
            return newHost;
        }
    }

    /**
     * Earliest join timestamp among non-recorder peers. Ties are resolved by
     * insertion order.
     */
    private Peer selectNextHost() {
        Peer candidate = null;
        for (Peer peer : peers.values()) {
            if (peer.isRecorder()) {
                continue;
            }
            if (candidate == null || peer.getJoinedAt() < candidate.getJoinedAt()) {
                candidate = peer;
            }
        }
        return candidate;
    }

    public Peer getPeer(String peerId) {
        synchronized (lock) {
            Peer peer = peers.get(peerId);
            if (peer == null) {
                throw new MediaRoomException(Code.PEER_NOT_FOUND_ERROR_CODE,
                        "Peer '" + peerId + "' not found in room '" + roomId + "'");
            }
            return peer;
        }
    }

    public List<Peer> getPeers() {
        synchronized (lock) {
            return new ArrayList<>(peers.values());
        }
    }

    public int getPeerCount() {
        synchronized (lock) {
            return peers.size();
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return peers.isEmpty();
        }
    }

    /**
     * @throws MediaRoomException PRODUCER_NOT_FOUND_ERROR_CODE
     */
    public EngineProducer findProducer(String producerId) {
        synchronized (lock) {
            for (Peer peer : peers.values()) {
                EngineProducer producer = peer.getProducer(producerId);
                if (producer != null) {
                    return producer;
                }
            }
        }
        throw new MediaRoomException(Code.PRODUCER_NOT_FOUND_ERROR_CODE,
                "Producer '" + producerId + "' not found in room '" + roomId + "'");
    }

    /**
     * @return every producer of every peer but the excluded one, as
     * <code>{peerId, producerId, kind}</code>
     */
    public JsonArray producersJson(String excludedPeerId) {
        JsonArray array = new JsonArray();
        synchronized (lock) {
            for (Peer peer : peers.values()) {
                if (peer.getPeerId().equals(excludedPeerId)) {
                    continue;
                }
                for (EngineProducer producer : peer.getProducers()) {
                    JsonObject json = new JsonObject();
                    json.addProperty(ProtocolElements.PEERID_PARAM, peer.getPeerId());
                    json.addProperty(ProtocolElements.PRODUCERID_PARAM, producer.getId());
                    json.addProperty(ProtocolElements.KIND_PARAM, producer.getKind().getValue());
                    array.add(json);
                }
            }
        }
        return array;
    }

    public JsonObject getSettings() {
        synchronized (lock) {
            return settings.deepCopy();
        }
    }

    void mergeSettings(JsonObject update) {
        synchronized (lock) {
            for (Map.Entry<String, JsonElement> entry : update.entrySet()) {
                settings.add(entry.getKey(), entry.getValue());
            }
        }
    }

    void addPoll(Poll poll) {
        synchronized (lock) {
            polls.put(poll.getPollId(), poll);
        }
    }

    /**
     * @throws MediaRoomException POLL_NOT_FOUND_ERROR_CODE
     */
    Poll getPoll(String pollId) {
        synchronized (lock) {
            Poll poll = pollId != null ? polls.get(pollId) : null;
            if (poll == null) {
                throw new MediaRoomException(Code.POLL_NOT_FOUND_ERROR_CODE,
                        "Poll '" + pollId + "' not found in room '" + roomId + "'");
            }
            return poll;
        }
    }

    public JsonArray pollsJson() {
        JsonArray array = new JsonArray();
        synchronized (lock) {
            for (Poll poll : polls.values()) {
                array.add(poll.toStateJson());
            }
        }
        return array;
    }

    void setEvictionTimer(ScheduledFuture<?> timer) {
        synchronized (lock) {
            cancelEvictionTimer();
            this.evictionTimer = timer;
        }
    }

    /**
     * @return true if a pending timer was cancelled
     */
    boolean cancelEvictionTimer() {
        synchronized (lock) {
            if (evictionTimer == null) {
                return false;
            }
            boolean cancelled = evictionTimer.cancel(false);
            evictionTimer = null;
            return cancelled;
        }
    }

    boolean hasEvictionTimer() {
        synchronized (lock) {
            return evictionTimer != null;
        }
    }

    /**
     * Destroys the routing context. Only the first call has effect.
     *
     * @return true if this call released it
     */
    boolean releaseRoutingContext() {
        if (!contextReleased.compareAndSet(false, true)) {
            return false;
        }
        try {
            routingContext.close();
            log.info("ROOM {}: routing context {} closed", roomId, routingContext.getId());
        } catch (RuntimeException e) {
            log.error("ROOM {}: error closing routing context {}", roomId, routingContext.getId(), e);
        }
        return true;
    }

    @Override
    public String toString() {
        return "[roomId=" + roomId + ", hostId=" + hostId + ", peers=" + getPeerCount() + ", closed=" + closed + "]";
    }
}
