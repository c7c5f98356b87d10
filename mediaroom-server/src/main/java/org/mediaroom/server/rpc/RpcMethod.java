package org.mediaroom.server.rpc;

import org.mediaroom.client.internal.ProtocolElements;

/**
 * Every request method the signaling endpoint accepts.
 */
public enum RpcMethod {

    KEEP_LIVE(ProtocolElements.KEEPLIVE_METHOD, false),
    JOIN_ROOM(ProtocolElements.JOINROOM_METHOD, false),
    LEAVE_ROOM(ProtocolElements.LEAVEROOM_METHOD, true),
    CREATE_TRANSPORT(ProtocolElements.CREATETRANSPORT_METHOD, true),
    CONNECT_TRANSPORT(ProtocolElements.CONNECTTRANSPORT_METHOD, true),
    ON_ICE_CANDIDATE(ProtocolElements.ONICECANDIDATE_METHOD, true),
    PRODUCE(ProtocolElements.PRODUCE_METHOD, true),
    CLOSE_PRODUCER(ProtocolElements.CLOSEPRODUCER_METHOD, true),
    CONSUME(ProtocolElements.CONSUME_METHOD, true),
    RESUME_CONSUMER(ProtocolElements.RESUMECONSUMER_METHOD, true),
    GET_PRODUCERS(ProtocolElements.GETPRODUCERS_METHOD, true),
    START_RECORDING(ProtocolElements.STARTRECORDING_METHOD, true),
    STOP_RECORDING(ProtocolElements.STOPRECORDING_METHOD, true),
    APPEND_TRANSCRIPT(ProtocolElements.APPENDTRANSCRIPT_METHOD, true),
    MUTE_PARTICIPANT(ProtocolElements.MUTEPARTICIPANT_METHOD, true),
    PEER_TRACK_STATUS(ProtocolElements.PEERTRACKSTATUS_METHOD, true),
    UPDATE_ROOM_SETTINGS(ProtocolElements.UPDATEROOMSETTINGS_METHOD, true),
    SEND_MESSAGE(ProtocolElements.SENDMESSAGE_ROOM_METHOD, true),
    CREATE_POLL(ProtocolElements.CREATEPOLL_METHOD, true),
    SUBMIT_VOTE(ProtocolElements.SUBMITVOTE_METHOD, true),
    CLOSE_POLL(ProtocolElements.CLOSEPOLL_METHOD, true);

    private final String methodName;
    private final boolean requiresRoom;

    RpcMethod(String methodName, boolean requiresRoom) {
        this.methodName = methodName;
        this.requiresRoom = requiresRoom;
    }

    public String getMethodName() {
        return methodName;
    }

    /**
     * @return whether the connection must have joined a room before sending it
     */
    public boolean requiresRoom() {
        return requiresRoom;
    }

    /**
     * @return the method, or <code>null</code> if the name is not part of the
     * protocol
     */
    public static RpcMethod fromMethodName(String methodName) {
        for (RpcMethod method : values()) {
            if (method.methodName.equals(methodName)) {
                return method;
            }
        }
        return null;
    }
}
