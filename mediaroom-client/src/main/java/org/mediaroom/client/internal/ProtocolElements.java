/*
 * (C) Copyright 2017-2019 OpenVidu (https://openvidu.io/)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.mediaroom.client.internal;

/**
 * This class defines constant values of client-server messages and their
 * parameters.
 */
public class ProtocolElements {

    // ---------------------------- CLIENT REQUESTS -----------------------

    public static final String KEEPLIVE_METHOD = "keepLive";

    public static final String JOINROOM_METHOD = "joinRoom";
    public static final String JOINROOM_ROOM_PARAM = "roomId";
    public static final String JOINROOM_USER_PARAM = "username";
    public static final String JOINROOM_PASSWORD_PARAM = "password";
    public static final String JOINROOM_RECORDER_PARAM = "recorder";
    public static final String JOINROOM_RTPCAPABILITIES_PARAM = "rtpCapabilities";
    public static final String JOINROOM_ISHOST_PARAM = "isHost";
    public static final String JOINROOM_PEERS_PARAM = "peers";
    public static final String JOINROOM_PRODUCERS_PARAM = "producers";
    public static final String JOINROOM_ISRECORDING_PARAM = "isRecording";
    public static final String JOINROOM_SESSIONID_PARAM = "sessionId";
    public static final String JOINROOM_SETTINGS_PARAM = "settings";
    public static final String JOINROOM_POLLS_PARAM = "polls";

    public static final String LEAVEROOM_METHOD = "leaveRoom";

    public static final String CREATETRANSPORT_METHOD = "createTransport";
    public static final String CREATETRANSPORT_DIRECTION_PARAM = "direction";

    public static final String CONNECTTRANSPORT_METHOD = "connectTransport";
    public static final String CONNECTTRANSPORT_TRANSPORTID_PARAM = "transportId";
    public static final String CONNECTTRANSPORT_DTLSPARAMETERS_PARAM = "dtlsParameters";

    public static final String ONICECANDIDATE_METHOD = "onIceCandidate";
    public static final String ONICECANDIDATE_TRANSPORTID_PARAM = "transportId";
    public static final String ONICECANDIDATE_CANDIDATE_PARAM = "candidate";

    public static final String PRODUCE_METHOD = "produce";
    public static final String PRODUCE_TRANSPORTID_PARAM = "transportId";
    public static final String PRODUCE_KIND_PARAM = "kind";
    public static final String PRODUCE_RTPPARAMETERS_PARAM = "rtpParameters";

    public static final String CLOSEPRODUCER_METHOD = "closeProducer";
    public static final String CLOSEPRODUCER_PRODUCERID_PARAM = "producerId";

    public static final String CONSUME_METHOD = "consume";
    public static final String CONSUME_TRANSPORTID_PARAM = "transportId";
    public static final String CONSUME_PRODUCERID_PARAM = "producerId";
    public static final String CONSUME_RTPCAPABILITIES_PARAM = "rtpCapabilities";

    public static final String RESUMECONSUMER_METHOD = "resumeConsumer";
    public static final String RESUMECONSUMER_CONSUMERID_PARAM = "consumerId";

    public static final String GETPRODUCERS_METHOD = "getProducers";

    public static final String STARTRECORDING_METHOD = "startRecording";
    public static final String STARTRECORDING_OUTPUTMODE_PARAM = "outputMode";
    public static final String STARTRECORDING_NAME_PARAM = "name";

    public static final String STOPRECORDING_METHOD = "stopRecording";

    public static final String APPENDTRANSCRIPT_METHOD = "appendTranscript";
    public static final String APPENDTRANSCRIPT_TEXT_PARAM = "text";

    public static final String MUTEPARTICIPANT_METHOD = "muteParticipant";
    public static final String MUTEPARTICIPANT_TARGET_PARAM = "targetPeerId";
    public static final String MUTEPARTICIPANT_KIND_PARAM = "kind";

    public static final String PEERTRACKSTATUS_METHOD = "peerTrackStatus";
    public static final String PEERTRACKSTATUS_KIND_PARAM = "kind";
    public static final String PEERTRACKSTATUS_ENABLED_PARAM = "enabled";

    public static final String UPDATEROOMSETTINGS_METHOD = "updateRoomSettings";
    public static final String UPDATEROOMSETTINGS_SETTINGS_PARAM = "settings";

    public static final String SENDMESSAGE_ROOM_METHOD = "sendMessage";
    public static final String SENDMESSAGE_MESSAGE_PARAM = "message";
    public static final String SENDMESSAGE_TO_PARAM = "toPeerId";

    public static final String CREATEPOLL_METHOD = "createPoll";
    public static final String CREATEPOLL_QUESTION_PARAM = "question";
    public static final String CREATEPOLL_OPTIONS_PARAM = "options";
    public static final String CREATEPOLL_ALLOWMULTIPLE_PARAM = "allowMultiple";
    public static final String CREATEPOLL_ANONYMOUS_PARAM = "isAnonymous";

    public static final String SUBMITVOTE_METHOD = "submitVote";
    public static final String SUBMITVOTE_POLLID_PARAM = "pollId";
    public static final String SUBMITVOTE_SELECTEDOPTIONS_PARAM = "selectedOptions";

    public static final String CLOSEPOLL_METHOD = "closePoll";
    public static final String CLOSEPOLL_POLLID_PARAM = "pollId";

    // ---------------------------- SERVER RESPONSES & EVENTS -----------------

    public static final String USERJOINED_METHOD = "userJoined";
    public static final String USERLEFT_METHOD = "userLeft";
    public static final String HOSTCHANGED_METHOD = "hostChanged";
    public static final String HOSTCHANGED_NEWHOSTID_PARAM = "newHostId";
    public static final String NEWPRODUCER_METHOD = "newProducer";
    public static final String PRODUCERCLOSED_METHOD = "producerClosed";
    public static final String ICECANDIDATE_METHOD = "iceCandidate";
    public static final String RECORDINGSTARTED_METHOD = "recordingStarted";
    public static final String RECORDINGSTOPPED_METHOD = "recordingStopped";
    public static final String FORCEMUTE_METHOD = "forceMute";
    public static final String ROOMSETTINGSUPDATED_METHOD = "roomSettingsUpdated";
    public static final String CHATMESSAGE_METHOD = "chatMessage";
    public static final String NEWPOLL_METHOD = "newPoll";
    public static final String POLLUPDATED_METHOD = "pollUpdated";
    public static final String POLLUPDATED_RESULTS_PARAM = "results";
    public static final String POLLCLOSED_METHOD = "pollClosed";
    public static final String POLLCLOSED_FINALRESULTS_PARAM = "finalResults";
    public static final String POLLID_PARAM = "pollId";
    public static final String TOTALVOTES_PARAM = "totalVotes";

    public static final String PEERID_PARAM = "peerId";
    public static final String USERNAME_PARAM = "username";
    public static final String ISHOST_PARAM = "isHost";
    public static final String PRODUCERID_PARAM = "producerId";
    public static final String TRANSPORTID_PARAM = "transportId";
    public static final String KIND_PARAM = "kind";
    public static final String ID_PARAM = "id";
    public static final String REASON_PARAM = "reason";
    public static final String RECORDINGID_PARAM = "recordingId";
    public static final String STARTEDAT_PARAM = "startedAt";
    public static final String FILES_PARAM = "files";
    public static final String ERROR_PARAM = "error";

    public static final String RECORDER_USERNAME = "System Recorder";
}
