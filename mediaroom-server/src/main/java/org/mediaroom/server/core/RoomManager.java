package org.mediaroom.server.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.client.internal.ProtocolElements;
import org.mediaroom.server.engine.CapabilityRegistry;
import org.mediaroom.server.engine.EngineProducer;
import org.mediaroom.server.engine.RoutingContext;
import org.mediaroom.server.engine.RoutingContextPool;
import org.mediaroom.server.storage.MetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registry of live rooms and of the peers in them.
 * <p>
 * Rooms are created lazily by the first join and closed by the inactivity
 * timer once they stay empty for the configured delay. Every change of a room's
 * peer map happens while holding that room's lock; notifications and listener
 * callbacks are sent after the lock has been released.
 */
public class RoomManager {

    private static final Logger log = LoggerFactory.getLogger(RoomManager.class);

    private final RoutingContextPool routingContextPool;
    private final CapabilityRegistry capabilityRegistry;
    private final SessionTracker sessionTracker;
    private final RoomEventsHandler roomEventsHandler;
    private final MetadataStore metadataStore;
    private final ScheduledExecutorService evictionScheduler;
    private final Executor asyncExecutor;
    private final long evictionDelayMillis;

    private final ConcurrentMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<Room>> roomsInCreation = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> peerRooms = new ConcurrentHashMap<>();

    private final List<RoomListener> listeners = new CopyOnWriteArrayList<>();

    public RoomManager(RoutingContextPool routingContextPool, CapabilityRegistry capabilityRegistry,
                       SessionTracker sessionTracker, RoomEventsHandler roomEventsHandler, MetadataStore metadataStore,
                       ScheduledExecutorService evictionScheduler, Executor asyncExecutor, long evictionDelayMillis) {
        this.routingContextPool = routingContextPool;
        this.capabilityRegistry = capabilityRegistry;
        this.sessionTracker = sessionTracker;
        this.roomEventsHandler = roomEventsHandler;
        this.metadataStore = metadataStore;
        this.evictionScheduler = evictionScheduler;
        this.asyncExecutor = asyncExecutor;
        this.evictionDelayMillis = evictionDelayMillis;
    }

    public void addListener(RoomListener listener) {
        listeners.add(listener);
    }

    /**
     * Returns the live room with the given id, creating it (and acquiring its
     * routing context) when absent. Concurrent callers for the same id share
     * a single creation.
     *
     * @throws MediaRoomException RESOURCE_EXHAUSTED_ERROR_CODE if no routing
     *                            context can be obtained
     */
    public Room getOrCreateRoom(String roomId, String password) {
        Room room = rooms.get(roomId);
        if (room != null) {
            return room;
        }
        CompletableFuture<Room> creation = new CompletableFuture<>();
        CompletableFuture<Room> inFlight = roomsInCreation.putIfAbsent(roomId, creation);
        if (inFlight != null) {
            log.warn("Room '{}' is being created by a concurrent initialization, waiting for it", roomId);
            return awaitCreation(roomId, inFlight);
        }
        try {
            room = rooms.get(roomId);
            if (room == null) {
                RoutingContext routingContext = routingContextPool.acquire();
                room = new Room(roomId, routingContext, password);
                rooms.put(roomId, room);
                log.info("ROOM {}: created with routing context {}{}", roomId, routingContext.getId(),
                        room.hasPassword() ? " (password protected)" : "");
                JsonObject details = new JsonObject();
                details.addProperty("routingContextId", routingContext.getId());
                details.addProperty("passwordProtected", room.hasPassword());
                saveRoomEventAsync(roomId, MetadataStore.ROOM_CREATED, details);
            }
            creation.complete(room);
            return room;
        } catch (RuntimeException e) {
            creation.completeExceptionally(e);
            throw e;
        } finally {
            roomsInCreation.remove(roomId, creation);
        }
    }

    private Room awaitCreation(String roomId, CompletableFuture<Room> inFlight) {
        try {
            return inFlight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof MediaRoomException) {
                throw (MediaRoomException) e.getCause();
            }
            throw new MediaRoomException(Code.GENERIC_ERROR_CODE, "Error creating room '" + roomId + "'",
                    e.getCause());
        }
    }

    /**
     * Adds a peer to a room, creating the room if needed.
     *
     * @return <code>{rtpCapabilities, isHost, peers, producers, isRecording,
     * sessionId, settings}</code>
     */
    public JsonObject joinRoom(String roomId, String peerId, String username, String password, boolean recorder) {
        RoomValidator.validateRoomId(roomId);
        String effectiveUsername = RoomValidator.validateUsername(username, recorder);
        if (peerRooms.containsKey(peerId)) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                    "Peer '" + peerId + "' is already in room '" + peerRooms.get(peerId) + "'");
        }

        while (true) {
            Room room = recorder ? getRoom(roomId) : getOrCreateRoom(roomId, password);
            Peer peer;
            JsonObject response;
            synchronized (room.getLock()) {
                if (room.isClosed()) {
                    if (recorder) {
                        throw new MediaRoomException(Code.ROOM_NOT_FOUND_ERROR_CODE,
                                "Room '" + roomId + "' was closed");
                    }
                    // evicted between lookup and lock, retry with a fresh room
                    log.debug("ROOM {}: closed while peer {} was joining, retrying", roomId, peerId);
                    continue;
                }
                if (!room.checkPassword(password)) {
                    throw new MediaRoomException(Code.INVALID_PASSWORD_ERROR_CODE,
                            "Invalid password for room '" + roomId + "'");
                }
                if (peerRooms.putIfAbsent(peerId, roomId) != null) {
                    throw new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                            "Peer '" + peerId + "' is already in a room");
                }
                if (room.cancelEvictionTimer()) {
                    log.info("ROOM {}: inactivity eviction cancelled", roomId);
                }
                boolean wasEmpty = room.isEmpty();
                peer = new Peer(peerId, roomId, effectiveUsername, System.currentTimeMillis(), recorder);
                room.addPeer(peer);
                if (wasEmpty) {
                    sessionTracker.openSession(room);
                } else {
                    sessionTracker.onParticipantJoined(room);
                }
                response = joinResponse(room, peer);
            }
            log.info("ROOM {}: peer {} ({}) joined{}{}", roomId, peerId, effectiveUsername,
                    peer.isHost() ? " as host" : "", recorder ? " as recorder" : "");
            roomEventsHandler.onPeerJoined(room, peer);
            return response;
        }
    }

    private JsonObject joinResponse(Room room, Peer peer) {
        JsonObject response = new JsonObject();
        response.add(ProtocolElements.JOINROOM_RTPCAPABILITIES_PARAM, capabilityRegistry.getRtpCapabilities());
        response.addProperty(ProtocolElements.JOINROOM_ISHOST_PARAM, peer.isHost());
        JsonArray peers = new JsonArray();
        for (Peer other : room.getPeers()) {
            if (!other.getPeerId().equals(peer.getPeerId())) {
                peers.add(other.toJson());
            }
        }
        response.add(ProtocolElements.JOINROOM_PEERS_PARAM, peers);
        response.add(ProtocolElements.JOINROOM_PRODUCERS_PARAM, room.producersJson(peer.getPeerId()));
        response.addProperty(ProtocolElements.JOINROOM_ISRECORDING_PARAM, room.isRecording());
        response.addProperty(ProtocolElements.JOINROOM_SESSIONID_PARAM, room.getSessionId());
        response.add(ProtocolElements.JOINROOM_SETTINGS_PARAM, room.getSettings());
        response.add(ProtocolElements.JOINROOM_POLLS_PARAM, room.pollsJson());
        return response;
    }

    /**
     * Removes the peer from its room, releasing its media resources and every
     * consumer other peers had of its producers.
     */
    public void leaveRoom(String peerId, EndReason reason) {
        Room room = getRoomOfPeer(peerId);
        Peer peer;
        Peer newHost;
        List<Peer> remaining;
        boolean emptied;
        synchronized (room.getLock()) {
            peer = room.getPeer(peerId);
            for (EngineProducer producer : peer.getProducers()) {
                for (Peer other : room.getPeers()) {
                    if (other != peer) {
                        other.closeConsumersOf(producer.getId());
                    }
                }
            }
            peer.close();
            newHost = room.removePeer(peerId);
            peerRooms.remove(peerId, room.getRoomId());
            remaining = room.getPeers();
            emptied = remaining.isEmpty();
            if (emptied) {
                sessionTracker.closeSession(room);
                scheduleEviction(room);
            }
        }
        log.info("ROOM {}: peer {} left ({}), {} peers remaining", room.getRoomId(), peerId, reason,
                remaining.size());
        roomEventsHandler.onPeerLeft(remaining, peer, reason);
        if (newHost != null) {
            roomEventsHandler.onHostChanged(remaining, newHost);
        }
        if (emptied) {
            fireRoomEmptied(room, EndReason.lastParticipantLeft);
        }
    }

    private void scheduleEviction(Room room) {
        ScheduledFuture<?> timer = evictionScheduler.schedule(() -> evictRoom(room), evictionDelayMillis,
                TimeUnit.MILLISECONDS);
        room.setEvictionTimer(timer);
        log.info("ROOM {}: empty, will be closed in {} ms unless someone joins", room.getRoomId(),
                evictionDelayMillis);
    }

    /**
     * Inactivity timer body. Does nothing if the room has been reoccupied or
     * closed in the meantime.
     */
    void evictRoom(Room room) {
        synchronized (room.getLock()) {
            if (room.isClosed() || !room.isEmpty()) {
                log.debug("ROOM {}: eviction skipped", room.getRoomId());
                return;
            }
            room.markClosed();
            rooms.remove(room.getRoomId(), room);
        }
        log.info("ROOM {}: closed after {} ms of inactivity", room.getRoomId(), evictionDelayMillis);
        room.releaseRoutingContext();
        JsonObject details = new JsonObject();
        details.addProperty(ProtocolElements.REASON_PARAM, EndReason.inactivityTimeout.name());
        saveRoomEventAsync(room.getRoomId(), MetadataStore.ROOM_CLOSED, details);
    }

    /**
     * Closes a room immediately, releasing every peer in it.
     *
     * @return the peers that were in the room
     */
    public Collection<Peer> closeRoom(String roomId, EndReason reason) {
        Room room = getRoom(roomId);
        List<Peer> evicted;
        synchronized (room.getLock()) {
            if (room.isClosed()) {
                return new ArrayList<>();
            }
            evicted = room.getPeers();
            for (Peer peer : evicted) {
                peer.close();
                room.removePeer(peer.getPeerId());
                peerRooms.remove(peer.getPeerId(), roomId);
            }
            room.cancelEvictionTimer();
            sessionTracker.closeSession(room);
            room.markClosed();
            rooms.remove(roomId, room);
        }
        log.info("ROOM {}: closed ({}), {} peers evicted", roomId, reason, evicted.size());
        for (Peer peer : evicted) {
            roomEventsHandler.onPeerLeft(evicted, peer, reason);
        }
        fireRoomEmptied(room, reason);
        room.releaseRoutingContext();
        JsonObject details = new JsonObject();
        details.addProperty(ProtocolElements.REASON_PARAM, reason.name());
        saveRoomEventAsync(roomId, MetadataStore.ROOM_CLOSED, details);
        return evicted;
    }

    /**
     * Merges the given keys into the room settings. Only the host may do it.
     *
     * @return the whole settings object after the merge
     */
    public JsonObject updateRoomSettings(String peerId, JsonObject update) {
        Room room = getRoomOfPeer(peerId);
        JsonObject settings;
        synchronized (room.getLock()) {
            checkHost(room, peerId);
            room.mergeSettings(update);
            settings = room.getSettings();
        }
        log.info("ROOM {}: settings updated by {}: {}", room.getRoomId(), peerId, update);
        roomEventsHandler.onRoomSettingsUpdated(room, settings);
        JsonObject details = new JsonObject();
        details.addProperty(ProtocolElements.PEERID_PARAM, peerId);
        details.add(ProtocolElements.UPDATEROOMSETTINGS_SETTINGS_PARAM, update.deepCopy());
        saveRoomEventAsync(room.getRoomId(), MetadataStore.SETTINGS_UPDATED, details);
        return settings;
    }

    public void muteParticipant(String peerId, String targetPeerId, String kind) {
        Room room = getRoomOfPeer(peerId);
        synchronized (room.getLock()) {
            checkHost(room, peerId);
            room.getPeer(targetPeerId);
        }
        log.info("ROOM {}: host {} muted {} of {}", room.getRoomId(), peerId, kind, targetPeerId);
        roomEventsHandler.onForceMute(targetPeerId, kind);
    }

    public void peerTrackStatus(String peerId, String kind, boolean enabled) {
        Room room = getRoomOfPeer(peerId);
        roomEventsHandler.onPeerTrackStatus(room, peerId, kind, enabled);
    }

    /**
     * Sends a chat message to the whole room, or to a single peer when
     * <code>toPeerId</code> is not null.
     *
     * @return the message as delivered
     */
    public JsonObject sendMessage(String peerId, String text, String toPeerId) {
        RoomValidator.validateMessage(text);
        Room room = getRoomOfPeer(peerId);
        Peer sender = room.getPeer(peerId);
        if (toPeerId != null) {
            room.getPeer(toPeerId);
        }
        JsonObject message = new JsonObject();
        message.addProperty(ProtocolElements.ID_PARAM, UUID.randomUUID().toString());
        message.addProperty(ProtocolElements.PEERID_PARAM, peerId);
        message.addProperty(ProtocolElements.USERNAME_PARAM, sender.getUsername());
        message.addProperty(ProtocolElements.SENDMESSAGE_MESSAGE_PARAM, text);
        message.addProperty("timestamp", System.currentTimeMillis());
        message.addProperty("isPrivate", toPeerId != null);
        if (toPeerId != null) {
            message.addProperty(ProtocolElements.SENDMESSAGE_TO_PARAM, toPeerId);
        }
        sessionTracker.onMessage(room.getRoomId(), message);
        roomEventsHandler.onChatMessage(room, message, peerId, toPeerId);
        return message;
    }

    /**
     * @return the poll as announced to the room
     */
    public JsonObject createPoll(String peerId, String question, JsonArray options, boolean allowMultiple,
                                 boolean anonymous) {
        List<String> optionTexts = RoomValidator.validatePoll(question, options);
        Room room = getRoomOfPeer(peerId);
        Poll poll;
        synchronized (room.getLock()) {
            Peer creator = room.getPeer(peerId);
            poll = new Poll(UUID.randomUUID().toString(), question, optionTexts, peerId, creator.getUsername(),
                    allowMultiple, anonymous, System.currentTimeMillis());
            room.addPoll(poll);
        }
        log.info("ROOM {}: poll {} created by {}", room.getRoomId(), poll.getPollId(), peerId);
        JsonObject announced = poll.toJson();
        sessionTracker.onPoll(room.getRoomId());
        roomEventsHandler.onNewPoll(room, announced);
        return announced;
    }

    /**
     * Records the vote of a peer, replacing any earlier vote of it.
     *
     * @return <code>{pollId, results, totalVotes}</code>
     */
    public JsonObject submitVote(String peerId, String pollId, JsonArray selectedOptions) {
        Room room = getRoomOfPeer(peerId);
        JsonObject results;
        synchronized (room.getLock()) {
            room.getPeer(peerId);
            Poll poll = room.getPoll(pollId);
            poll.vote(peerId, selectedOptions);
            results = poll.resultsJson(ProtocolElements.POLLUPDATED_RESULTS_PARAM);
        }
        log.debug("ROOM {}: peer {} voted in poll {}", room.getRoomId(), peerId, pollId);
        roomEventsHandler.onPollUpdated(room, results);
        return results;
    }

    /**
     * Closes a poll. Only its creator may do it.
     *
     * @return <code>{pollId, finalResults, totalVotes}</code>
     */
    public JsonObject closePoll(String peerId, String pollId) {
        Room room = getRoomOfPeer(peerId);
        JsonObject results;
        synchronized (room.getLock()) {
            room.getPeer(peerId);
            Poll poll = room.getPoll(pollId);
            poll.close(peerId);
            results = poll.resultsJson(ProtocolElements.POLLCLOSED_FINALRESULTS_PARAM);
        }
        log.info("ROOM {}: poll {} closed by {}", room.getRoomId(), pollId, peerId);
        roomEventsHandler.onPollClosed(room, results);
        return results;
    }

    private void checkHost(Room room, String peerId) {
        if (!peerId.equals(room.getHostId())) {
            throw new MediaRoomException(Code.NOT_HOST_ERROR_CODE,
                    "Only the host of room '" + room.getRoomId() + "' can do this");
        }
    }

    /**
     * Fires {@link RoomListener#onProducerAdded} for a freshly created
     * producer.
     */
    public void producerAdded(Room room, Peer peer, EngineProducer producer) {
        for (RoomListener listener : listeners) {
            try {
                listener.onProducerAdded(room, peer, producer);
            } catch (RuntimeException e) {
                log.error("ROOM {}: listener failed on new producer {}", room.getRoomId(), producer.getId(), e);
            }
        }
    }

    private void fireRoomEmptied(Room room, EndReason reason) {
        for (RoomListener listener : listeners) {
            try {
                listener.onRoomEmptied(room, reason);
            } catch (RuntimeException e) {
                log.error("ROOM {}: listener failed on room emptied", room.getRoomId(), e);
            }
        }
    }

    private void saveRoomEventAsync(String roomId, String action, JsonObject details) {
        CompletableFuture.runAsync(() -> metadataStore.saveRoomEvent(roomId, action, details), asyncExecutor)
                .exceptionally(t -> {
                    log.error("ROOM {}: error saving {} event", roomId, action, t);
                    return null;
                });
    }

    /**
     * @throws MediaRoomException ROOM_NOT_FOUND_ERROR_CODE
     */
    public Room getRoom(String roomId) {
        Room room = roomId != null ? rooms.get(roomId) : null;
        if (room == null) {
            throw new MediaRoomException(Code.ROOM_NOT_FOUND_ERROR_CODE, "Room '" + roomId + "' not found");
        }
        return room;
    }

    public Room findRoom(String roomId) {
        return roomId != null ? rooms.get(roomId) : null;
    }

    public Collection<Room> getRooms() {
        return new ArrayList<>(rooms.values());
    }

    /**
     * @throws MediaRoomException PEER_NOT_FOUND_ERROR_CODE if the peer is in no
     *                            room
     */
    public Room getRoomOfPeer(String peerId) {
        String roomId = peerId != null ? peerRooms.get(peerId) : null;
        if (roomId == null) {
            throw new MediaRoomException(Code.PEER_NOT_FOUND_ERROR_CODE, "Peer '" + peerId + "' is in no room");
        }
        return getRoom(roomId);
    }

    public Peer getPeer(String peerId) {
        return getRoomOfPeer(peerId).getPeer(peerId);
    }

    public boolean isInRoom(String peerId) {
        return peerRooms.containsKey(peerId);
    }

    @PreDestroy
    public void close() {
        log.info("Closing all rooms");
        for (Room room : getRooms()) {
            try {
                closeRoom(room.getRoomId(), EndReason.mediaRoomServerStopped);
            } catch (MediaRoomException e) {
                log.warn("Error closing room {}: {}", room.getRoomId(), e.getMessage());
            }
        }
    }
}
