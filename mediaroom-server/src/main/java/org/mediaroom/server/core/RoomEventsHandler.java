package org.mediaroom.server.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.mediaroom.client.internal.ProtocolElements;
import org.mediaroom.java.client.RecordingFile;
import org.mediaroom.java.client.RecordingInfo;
import org.mediaroom.server.engine.EngineProducer;
import org.mediaroom.server.rpc.RpcNotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Builds and sends every room-scoped notification. Delivery is best effort.
 */
public class RoomEventsHandler {

    private static final Logger log = LoggerFactory.getLogger(RoomEventsHandler.class);

    protected final RpcNotificationService rpcNotificationService;

    public RoomEventsHandler(RpcNotificationService rpcNotificationService) {
        this.rpcNotificationService = rpcNotificationService;
    }

    public void onPeerJoined(Room room, Peer peer) {
        JsonObject params = peer.toJson();
        broadcast(room.getPeers(), peer.getPeerId(), ProtocolElements.USERJOINED_METHOD, params);
    }

    public void onPeerLeft(Collection<Peer> remainingPeers, Peer peer, EndReason reason) {
        JsonObject params = new JsonObject();
        params.addProperty(ProtocolElements.PEERID_PARAM, peer.getPeerId());
        params.addProperty(ProtocolElements.USERNAME_PARAM, peer.getUsername());
        params.addProperty(ProtocolElements.REASON_PARAM, reason != null ? reason.name() : "");
        broadcast(remainingPeers, null, ProtocolElements.USERLEFT_METHOD, params);
    }

    public void onHostChanged(Collection<Peer> remainingPeers, Peer newHost) {
        JsonObject params = new JsonObject();
        params.addProperty(ProtocolElements.HOSTCHANGED_NEWHOSTID_PARAM, newHost.getPeerId());
        params.addProperty(ProtocolElements.USERNAME_PARAM, newHost.getUsername());
        broadcast(remainingPeers, null, ProtocolElements.HOSTCHANGED_METHOD, params);
    }

    public void onNewProducer(Room room, Peer peer, EngineProducer producer) {
        JsonObject params = new JsonObject();
        params.addProperty(ProtocolElements.PEERID_PARAM, peer.getPeerId());
        params.addProperty(ProtocolElements.PRODUCERID_PARAM, producer.getId());
        params.addProperty(ProtocolElements.KIND_PARAM, producer.getKind().getValue());
        broadcast(room.getPeers(), peer.getPeerId(), ProtocolElements.NEWPRODUCER_METHOD, params);
    }

    public void onProducerClosed(Collection<Peer> peers, String peerId, String producerId) {
        JsonObject params = new JsonObject();
        params.addProperty(ProtocolElements.PEERID_PARAM, peerId);
        params.addProperty(ProtocolElements.PRODUCERID_PARAM, producerId);
        broadcast(peers, peerId, ProtocolElements.PRODUCERCLOSED_METHOD, params);
    }

    public void onIceCandidate(String peerId, String transportId, JsonObject candidate) {
        JsonObject params = new JsonObject();
        params.addProperty(ProtocolElements.TRANSPORTID_PARAM, transportId);
        params.add(ProtocolElements.ONICECANDIDATE_CANDIDATE_PARAM, candidate);
        rpcNotificationService.sendNotification(peerId, ProtocolElements.ICECANDIDATE_METHOD, params);
    }

    public void sendRecordingStartedNotification(Room room, RecordingInfo recordingInfo) {
        JsonObject params = new JsonObject();
        params.addProperty(ProtocolElements.RECORDINGID_PARAM, recordingInfo.getId());
        params.addProperty(ProtocolElements.STARTEDAT_PARAM, recordingInfo.getStartedAt());
        params.addProperty("startedBy", recordingInfo.getStartedBy());
        params.addProperty("outputMode", recordingInfo.getOutputMode().name());
        broadcast(room.getPeers(), null, ProtocolElements.RECORDINGSTARTED_METHOD, params);
    }

    public void sendRecordingStoppedNotification(Room room, RecordingInfo recordingInfo, EndReason reason) {
        JsonObject params = filesResult(recordingInfo);
        params.addProperty(ProtocolElements.REASON_PARAM, reason != null ? reason.name() : "");
        broadcast(room.getPeers(), null, ProtocolElements.RECORDINGSTOPPED_METHOD, params);
    }

    /**
     * @return <code>{recordingId, files: [{peerId, filename, size}]}</code>
     */
    public static JsonObject filesResult(RecordingInfo recordingInfo) {
        JsonObject result = new JsonObject();
        result.addProperty(ProtocolElements.RECORDINGID_PARAM, recordingInfo.getId());
        JsonArray files = new JsonArray();
        for (RecordingFile file : recordingInfo.getFiles()) {
            JsonObject json = new JsonObject();
            json.addProperty(ProtocolElements.PEERID_PARAM, file.getPeerId());
            json.addProperty(ProtocolElements.USERNAME_PARAM, file.getUsername());
            json.addProperty("filename", file.getFile());
            json.addProperty("size", file.getSize());
            json.addProperty("audioOnly", !file.hasVideo());
            files.add(json);
        }
        result.add(ProtocolElements.FILES_PARAM, files);
        return result;
    }

    public void onForceMute(String targetPeerId, String kind) {
        JsonObject params = new JsonObject();
        params.addProperty(ProtocolElements.KIND_PARAM, kind);
        rpcNotificationService.sendNotification(targetPeerId, ProtocolElements.FORCEMUTE_METHOD, params);
    }

    public void onPeerTrackStatus(Room room, String peerId, String kind, boolean enabled) {
        JsonObject params = new JsonObject();
        params.addProperty(ProtocolElements.PEERID_PARAM, peerId);
        params.addProperty(ProtocolElements.KIND_PARAM, kind);
        params.addProperty(ProtocolElements.PEERTRACKSTATUS_ENABLED_PARAM, enabled);
        broadcast(room.getPeers(), null, ProtocolElements.PEERTRACKSTATUS_METHOD, params);
    }

    public void onRoomSettingsUpdated(Room room, JsonObject settings) {
        broadcast(room.getPeers(), null, ProtocolElements.ROOMSETTINGSUPDATED_METHOD, settings);
    }

    /**
     * Public messages go to the whole room. Private messages go to the
     * recipient and are echoed to the sender.
     */
    public void onChatMessage(Room room, JsonObject message, String senderId, String toPeerId) {
        if (toPeerId != null) {
            rpcNotificationService.sendNotification(toPeerId, ProtocolElements.CHATMESSAGE_METHOD, message);
            rpcNotificationService.sendNotification(senderId, ProtocolElements.CHATMESSAGE_METHOD, message);
        } else {
            broadcast(room.getPeers(), null, ProtocolElements.CHATMESSAGE_METHOD, message);
        }
    }

    public void onNewPoll(Room room, JsonObject poll) {
        broadcast(room.getPeers(), null, ProtocolElements.NEWPOLL_METHOD, poll);
    }

    public void onPollUpdated(Room room, JsonObject results) {
        broadcast(room.getPeers(), null, ProtocolElements.POLLUPDATED_METHOD, results);
    }

    public void onPollClosed(Room room, JsonObject results) {
        broadcast(room.getPeers(), null, ProtocolElements.POLLCLOSED_METHOD, results);
    }

    protected void broadcast(Collection<Peer> peers, String excludedPeerId, String method, JsonObject params) {
        for (Peer peer : peers) {
            if (peer.getPeerId().equals(excludedPeerId)) {
                continue;
            }
            rpcNotificationService.sendNotification(peer.getPeerId(), method, params);
        }
        log.debug("Notification {} sent to {} peers", method, peers.size());
    }
}
