package org.mediaroom.server.rpc;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.kurento.jsonrpc.message.Request;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.client.internal.ProtocolElements;
import org.mediaroom.java.client.RecordingInfo;
import org.mediaroom.java.client.RecordingProperties;
import org.mediaroom.server.config.MediaRoomConfig;
import org.mediaroom.server.core.EndReason;
import org.mediaroom.server.core.MediaNegotiationService;
import org.mediaroom.server.core.RoomEventsHandler;
import org.mediaroom.server.core.RoomManager;
import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.engine.TransportDirection;
import org.mediaroom.server.recording.service.RecordingManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Room signaling: one handler method per {@link RpcMethod}. The peer id of a
 * connection is its private id.
 */
public class RpcRoomHandler extends RpcHandler {

    private static final Logger logger = LoggerFactory.getLogger(RpcRoomHandler.class);

    private final RoomManager roomManager;
    private final MediaNegotiationService negotiationService;
    private final RecordingManager recordingManager;
    private final MediaRoomConfig mediaRoomConfig;

    public RpcRoomHandler(RpcNotificationService notificationService, RoomManager roomManager,
                          MediaNegotiationService negotiationService, RecordingManager recordingManager,
                          MediaRoomConfig mediaRoomConfig) {
        super(notificationService);
        this.roomManager = roomManager;
        this.negotiationService = negotiationService;
        this.recordingManager = recordingManager;
        this.mediaRoomConfig = mediaRoomConfig;
    }

    @Override
    protected void dispatch(RpcMethod method, RpcConnection rpcConnection, Request<JsonObject> request) {
        switch (method) {
            case KEEP_LIVE:
                keepLive(rpcConnection, request);
                break;
            case JOIN_ROOM:
                joinRoom(rpcConnection, request);
                break;
            case LEAVE_ROOM:
                leaveRoom(rpcConnection, request);
                break;
            case CREATE_TRANSPORT:
                createTransport(rpcConnection, request);
                break;
            case CONNECT_TRANSPORT:
                connectTransport(rpcConnection, request);
                break;
            case ON_ICE_CANDIDATE:
                onIceCandidate(rpcConnection, request);
                break;
            case PRODUCE:
                produce(rpcConnection, request);
                break;
            case CLOSE_PRODUCER:
                closeProducer(rpcConnection, request);
                break;
            case CONSUME:
                consume(rpcConnection, request);
                break;
            case RESUME_CONSUMER:
                resumeConsumer(rpcConnection, request);
                break;
            case GET_PRODUCERS:
                getProducers(rpcConnection, request);
                break;
            case START_RECORDING:
                startRecording(rpcConnection, request);
                break;
            case STOP_RECORDING:
                stopRecording(rpcConnection, request);
                break;
            case APPEND_TRANSCRIPT:
                appendTranscript(rpcConnection, request);
                break;
            case MUTE_PARTICIPANT:
                muteParticipant(rpcConnection, request);
                break;
            case PEER_TRACK_STATUS:
                peerTrackStatus(rpcConnection, request);
                break;
            case UPDATE_ROOM_SETTINGS:
                updateRoomSettings(rpcConnection, request);
                break;
            case SEND_MESSAGE:
                sendMessage(rpcConnection, request);
                break;
            case CREATE_POLL:
                createPoll(rpcConnection, request);
                break;
            case SUBMIT_VOTE:
                submitVote(rpcConnection, request);
                break;
            case CLOSE_POLL:
                closePoll(rpcConnection, request);
                break;
        }
    }

    private void keepLive(RpcConnection rpcConnection, Request<JsonObject> request) {
        JsonObject result = new JsonObject();
        result.addProperty(ProtocolElements.KEEPLIVE_METHOD, "OK");
        respond(rpcConnection, request, result);
    }

    private void joinRoom(RpcConnection rpcConnection, Request<JsonObject> request) {
        String roomId = getStringParam(request, ProtocolElements.JOINROOM_ROOM_PARAM);
        String username = getOptionalStringParam(request, ProtocolElements.JOINROOM_USER_PARAM);
        String password = getOptionalStringParam(request, ProtocolElements.JOINROOM_PASSWORD_PARAM);
        boolean recorder = getOptionalBooleanParam(request, ProtocolElements.JOINROOM_RECORDER_PARAM);
        JsonObject result = roomManager.joinRoom(roomId, rpcConnection.getParticipantPrivateId(), username,
                password, recorder);
        rpcConnection.setRoomId(roomId);
        respond(rpcConnection, request, result);
    }

    private void leaveRoom(RpcConnection rpcConnection, Request<JsonObject> request) {
        roomManager.leaveRoom(rpcConnection.getParticipantPrivateId(), EndReason.leaveRoom);
        rpcConnection.setRoomId(null);
        respond(rpcConnection, request, new JsonObject());
    }

    private void createTransport(RpcConnection rpcConnection, Request<JsonObject> request) {
        TransportDirection direction = TransportDirection.fromString(
                getStringParam(request, ProtocolElements.CREATETRANSPORT_DIRECTION_PARAM));
        respond(rpcConnection, request,
                negotiationService.createTransport(rpcConnection.getParticipantPrivateId(), direction));
    }

    private void connectTransport(RpcConnection rpcConnection, Request<JsonObject> request) {
        String transportId = getStringParam(request, ProtocolElements.CONNECTTRANSPORT_TRANSPORTID_PARAM);
        JsonObject dtlsParameters = getObjectParam(request, ProtocolElements.CONNECTTRANSPORT_DTLSPARAMETERS_PARAM);
        respond(rpcConnection, request, negotiationService.connectTransport(rpcConnection.getParticipantPrivateId(),
                transportId, dtlsParameters));
    }

    private void onIceCandidate(RpcConnection rpcConnection, Request<JsonObject> request) {
        String transportId = getStringParam(request, ProtocolElements.ONICECANDIDATE_TRANSPORTID_PARAM);
        JsonObject candidate = getObjectParam(request, ProtocolElements.ONICECANDIDATE_CANDIDATE_PARAM);
        negotiationService.addIceCandidate(rpcConnection.getParticipantPrivateId(), transportId, candidate);
        respond(rpcConnection, request, new JsonObject());
    }

    private void produce(RpcConnection rpcConnection, Request<JsonObject> request) {
        String transportId = getStringParam(request, ProtocolElements.PRODUCE_TRANSPORTID_PARAM);
        MediaKind kind = MediaKind.fromString(getStringParam(request, ProtocolElements.PRODUCE_KIND_PARAM));
        JsonObject rtpParameters = request.getParams().has(ProtocolElements.PRODUCE_RTPPARAMETERS_PARAM)
                ? getObjectParam(request, ProtocolElements.PRODUCE_RTPPARAMETERS_PARAM)
                : new JsonObject();
        String producerId = negotiationService.produce(rpcConnection.getParticipantPrivateId(), transportId, kind,
                rtpParameters);
        JsonObject result = new JsonObject();
        result.addProperty(ProtocolElements.ID_PARAM, producerId);
        respond(rpcConnection, request, result);
    }

    private void closeProducer(RpcConnection rpcConnection, Request<JsonObject> request) {
        String producerId = getStringParam(request, ProtocolElements.CLOSEPRODUCER_PRODUCERID_PARAM);
        negotiationService.closeProducer(rpcConnection.getParticipantPrivateId(), producerId);
        respond(rpcConnection, request, new JsonObject());
    }

    private void consume(RpcConnection rpcConnection, Request<JsonObject> request) {
        String transportId = getStringParam(request, ProtocolElements.CONSUME_TRANSPORTID_PARAM);
        String producerId = getStringParam(request, ProtocolElements.CONSUME_PRODUCERID_PARAM);
        JsonObject rtpCapabilities = getObjectParam(request, ProtocolElements.CONSUME_RTPCAPABILITIES_PARAM);
        respond(rpcConnection, request, negotiationService.consume(rpcConnection.getParticipantPrivateId(),
                transportId, producerId, rtpCapabilities));
    }

    private void resumeConsumer(RpcConnection rpcConnection, Request<JsonObject> request) {
        String consumerId = getStringParam(request, ProtocolElements.RESUMECONSUMER_CONSUMERID_PARAM);
        negotiationService.resumeConsumer(rpcConnection.getParticipantPrivateId(), consumerId);
        respond(rpcConnection, request, new JsonObject());
    }

    private void getProducers(RpcConnection rpcConnection, Request<JsonObject> request) {
        JsonObject result = new JsonObject();
        result.add(ProtocolElements.JOINROOM_PRODUCERS_PARAM,
                negotiationService.getProducers(rpcConnection.getParticipantPrivateId()));
        respond(rpcConnection, request, result);
    }

    private void startRecording(RpcConnection rpcConnection, Request<JsonObject> request) {
        checkRecordingEnabled();
        RecordingProperties.Builder builder = new RecordingProperties.Builder()
                .outputMode(mediaRoomConfig.getDefaultOutputMode());
        String outputMode = getOptionalStringParam(request, ProtocolElements.STARTRECORDING_OUTPUTMODE_PARAM);
        if (outputMode != null) {
            try {
                builder.outputMode(RecordingInfo.OutputMode.valueOf(outputMode.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Unknown output mode '" + outputMode + "'");
            }
        }
        String name = getOptionalStringParam(request, ProtocolElements.STARTRECORDING_NAME_PARAM);
        if (name != null) {
            builder.name(name);
        }
        RecordingInfo info = recordingManager.startRecording(rpcConnection.getRoomId(),
                rpcConnection.getParticipantPrivateId(), builder.build());
        JsonObject result = new JsonObject();
        result.addProperty(ProtocolElements.RECORDINGID_PARAM, info.getId());
        result.addProperty(ProtocolElements.STARTEDAT_PARAM, info.getStartedAt());
        respond(rpcConnection, request, result);
    }

    private void stopRecording(RpcConnection rpcConnection, Request<JsonObject> request) {
        checkRecordingEnabled();
        RecordingInfo info = recordingManager.stopRecording(rpcConnection.getRoomId(),
                EndReason.recordingStoppedByUser);
        respond(rpcConnection, request, RoomEventsHandler.filesResult(info));
    }

    private void appendTranscript(RpcConnection rpcConnection, Request<JsonObject> request) {
        checkRecordingEnabled();
        String text = getStringParam(request, ProtocolElements.APPENDTRANSCRIPT_TEXT_PARAM);
        recordingManager.appendTranscript(rpcConnection.getRoomId(), rpcConnection.getParticipantPrivateId(), text);
        respond(rpcConnection, request, new JsonObject());
    }

    private void muteParticipant(RpcConnection rpcConnection, Request<JsonObject> request) {
        String target = getStringParam(request, ProtocolElements.MUTEPARTICIPANT_TARGET_PARAM);
        String kind = MediaKind.fromString(getStringParam(request, ProtocolElements.MUTEPARTICIPANT_KIND_PARAM))
                .getValue();
        roomManager.muteParticipant(rpcConnection.getParticipantPrivateId(), target, kind);
        respond(rpcConnection, request, new JsonObject());
    }

    private void peerTrackStatus(RpcConnection rpcConnection, Request<JsonObject> request) {
        String kind = MediaKind.fromString(getStringParam(request, ProtocolElements.PEERTRACKSTATUS_KIND_PARAM))
                .getValue();
        boolean enabled = getBooleanParam(request, ProtocolElements.PEERTRACKSTATUS_ENABLED_PARAM);
        roomManager.peerTrackStatus(rpcConnection.getParticipantPrivateId(), kind, enabled);
        respond(rpcConnection, request, new JsonObject());
    }

    private void updateRoomSettings(RpcConnection rpcConnection, Request<JsonObject> request) {
        JsonObject settings = getObjectParam(request, ProtocolElements.UPDATEROOMSETTINGS_SETTINGS_PARAM);
        JsonObject result = new JsonObject();
        result.add(ProtocolElements.UPDATEROOMSETTINGS_SETTINGS_PARAM,
                roomManager.updateRoomSettings(rpcConnection.getParticipantPrivateId(), settings));
        respond(rpcConnection, request, result);
    }

    private void sendMessage(RpcConnection rpcConnection, Request<JsonObject> request) {
        String message = getStringParam(request, ProtocolElements.SENDMESSAGE_MESSAGE_PARAM);
        String toPeerId = getOptionalStringParam(request, ProtocolElements.SENDMESSAGE_TO_PARAM);
        respond(rpcConnection, request,
                roomManager.sendMessage(rpcConnection.getParticipantPrivateId(), message, toPeerId));
    }

    private void createPoll(RpcConnection rpcConnection, Request<JsonObject> request) {
        String question = getStringParam(request, ProtocolElements.CREATEPOLL_QUESTION_PARAM);
        JsonArray optionList = getArrayParam(request, ProtocolElements.CREATEPOLL_OPTIONS_PARAM);
        boolean allowMultiple = getOptionalBooleanParam(request, ProtocolElements.CREATEPOLL_ALLOWMULTIPLE_PARAM);
        boolean anonymous = getOptionalBooleanParam(request, ProtocolElements.CREATEPOLL_ANONYMOUS_PARAM);
        respond(rpcConnection, request, roomManager.createPoll(rpcConnection.getParticipantPrivateId(), question,
                optionList, allowMultiple, anonymous));
    }

    private void submitVote(RpcConnection rpcConnection, Request<JsonObject> request) {
        String pollId = getStringParam(request, ProtocolElements.SUBMITVOTE_POLLID_PARAM);
        JsonArray selectedOptions = getArrayParam(request, ProtocolElements.SUBMITVOTE_SELECTEDOPTIONS_PARAM);
        respond(rpcConnection, request,
                roomManager.submitVote(rpcConnection.getParticipantPrivateId(), pollId, selectedOptions));
    }

    private void closePoll(RpcConnection rpcConnection, Request<JsonObject> request) {
        String pollId = getStringParam(request, ProtocolElements.CLOSEPOLL_POLLID_PARAM);
        respond(rpcConnection, request, roomManager.closePoll(rpcConnection.getParticipantPrivateId(), pollId));
    }

    @Override
    protected void onConnectionLost(RpcConnection rpcConnection, boolean networkFailure) {
        String peerId = rpcConnection.getParticipantPrivateId();
        if (rpcConnection.getRoomId() == null || !roomManager.isInRoom(peerId)) {
            return;
        }
        logger.info("Connection {} closed while in room {}, leaving it", peerId, rpcConnection.getRoomId());
        roomManager.leaveRoom(peerId, networkFailure ? EndReason.networkDisconnect : EndReason.disconnect);
        rpcConnection.setRoomId(null);
    }

    private void checkRecordingEnabled() {
        if (!mediaRoomConfig.isRecordingModuleEnable()) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Recording is disabled on this server");
        }
    }

    private void respond(RpcConnection rpcConnection, Request<JsonObject> request, JsonObject result) {
        notificationService.sendResponse(rpcConnection.getParticipantPrivateId(), request.getId(), result);
    }
}
