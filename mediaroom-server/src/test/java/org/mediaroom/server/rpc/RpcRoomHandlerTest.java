package org.mediaroom.server.rpc;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kurento.jsonrpc.Session;
import org.kurento.jsonrpc.Transaction;
import org.kurento.jsonrpc.message.Request;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.client.internal.ProtocolElements;
import org.mediaroom.server.config.MediaRoomConfig;
import org.mediaroom.server.core.MediaNegotiationService;
import org.mediaroom.server.core.RoomEventsHandler;
import org.mediaroom.server.core.RoomManager;
import org.mediaroom.server.core.SessionTracker;
import org.mediaroom.server.engine.CapabilityRegistry;
import org.mediaroom.server.engine.FakeMediaEngine;
import org.mediaroom.server.engine.RoutingContextPool;
import org.mediaroom.server.recording.service.RecordingManager;
import org.mediaroom.server.storage.MetadataStore;
import org.mockito.ArgumentCaptor;

import java.io.EOFException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RpcRoomHandlerTest {

    private final RpcNotificationService notificationService = new RpcNotificationService();
    private final RecordingManager recordingManager = mock(RecordingManager.class);
    private final MediaRoomConfig config = new MediaRoomConfig();
    private final AtomicInteger requestIds = new AtomicInteger();

    private RoomManager roomManager;
    private RpcRoomHandler handler;

    @BeforeEach
    void setUp() {
        FakeMediaEngine engine = new FakeMediaEngine();
        MetadataStore metadataStore = mock(MetadataStore.class);
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        doReturn(mock(ScheduledFuture.class)).when(scheduler)
                .schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        CapabilityRegistry registry = new CapabilityRegistry(engine);
        RoomEventsHandler eventsHandler = new RoomEventsHandler(notificationService);
        roomManager = new RoomManager(new RoutingContextPool(engine, 0), registry,
                new SessionTracker(metadataStore, Runnable::run), eventsHandler, metadataStore, scheduler,
                Runnable::run, 30_000L);
        config.setRecordingModuleEnable(false);
        config.setRecordingOutputMode("INDIVIDUAL");
        handler = new RpcRoomHandler(notificationService, roomManager,
                new MediaNegotiationService(roomManager, registry, eventsHandler), recordingManager, config);
    }

    /**
     * One websocket: every request gets its own transaction on the same
     * session.
     */
    private class Client {

        final Session session = mock(Session.class);

        Client(String sessionId) {
            when(session.getSessionId()).thenReturn(sessionId);
        }

        Transaction call(String method, JsonObject params) throws Exception {
            Transaction transaction = mock(Transaction.class);
            when(transaction.getSession()).thenReturn(session);
            handler.handleRequest(transaction, new Request<>(requestIds.incrementAndGet(), method, params));
            return transaction;
        }

        JsonObject result(String method, JsonObject params) throws Exception {
            Transaction transaction = call(method, params);
            ArgumentCaptor<Object> result = ArgumentCaptor.forClass(Object.class);
            verify(transaction).sendResponse(result.capture());
            return (JsonObject) result.getValue();
        }

        int errorCode(String method, JsonObject params) throws Exception {
            Transaction transaction = call(method, params);
            ArgumentCaptor<Integer> code = ArgumentCaptor.forClass(Integer.class);
            verify(transaction).sendError(code.capture(), anyString(), anyString());
            verify(transaction, never()).sendResponse(any());
            return code.getValue();
        }

        JsonObject join(String roomId, String username) throws Exception {
            JsonObject params = new JsonObject();
            params.addProperty(ProtocolElements.JOINROOM_ROOM_PARAM, roomId);
            params.addProperty(ProtocolElements.JOINROOM_USER_PARAM, username);
            return result(ProtocolElements.JOINROOM_METHOD, params);
        }
    }

    private static JsonObject params(String... keyValues) {
        JsonObject params = new JsonObject();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.addProperty(keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    @Test
    void joinIsRequiredBeforeRoomMethods() throws Exception {
        Client client = new Client("s1");

        assertThat(client.errorCode(ProtocolElements.GETPRODUCERS_METHOD, new JsonObject()))
                .isEqualTo(Code.TRANSPORT_ERROR_CODE.getValue());
    }

    @Test
    void unknownMethodIsRejected() throws Exception {
        assertThat(new Client("s1").errorCode("teleport", new JsonObject()))
                .isEqualTo(Code.VALIDATION_ERROR_CODE.getValue());
    }

    @Test
    void keepLiveNeedsNoRoom() throws Exception {
        JsonObject result = new Client("s1").result(ProtocolElements.KEEPLIVE_METHOD, new JsonObject());

        assertThat(result.get(ProtocolElements.KEEPLIVE_METHOD).getAsString()).isEqualTo("OK");
    }

    @Test
    void joinAnswersAndNotifiesTheRoom() throws Exception {
        Client alice = new Client("s1");
        Client bob = new Client("s2");

        JsonObject first = alice.join("room1", "alice");
        JsonObject second = bob.join("room1", "bob");

        assertThat(first.get("isHost").getAsBoolean()).isTrue();
        assertThat(second.get("isHost").getAsBoolean()).isFalse();
        assertThat(notificationService.getRpcConnection("s2").getRoomId()).isEqualTo("room1");
        verify(alice.session).sendNotification(eq(ProtocolElements.USERJOINED_METHOD), any(JsonObject.class));
        verify(bob.session, never()).sendNotification(eq(ProtocolElements.USERJOINED_METHOD), any());
    }

    @Test
    void missingParameterIsAValidationError() throws Exception {
        Client alice = new Client("s1");

        assertThat(alice.errorCode(ProtocolElements.JOINROOM_METHOD, new JsonObject()))
                .isEqualTo(Code.VALIDATION_ERROR_CODE.getValue());
    }

    @Test
    void produceAndConsumeAcrossPeers() throws Exception {
        Client alice = new Client("s1");
        Client bob = new Client("s2");
        alice.join("room1", "alice");
        bob.join("room1", "bob");

        JsonObject sendTransport = alice.result(ProtocolElements.CREATETRANSPORT_METHOD,
                params(ProtocolElements.CREATETRANSPORT_DIRECTION_PARAM, "send"));
        String transportId = sendTransport.get(ProtocolElements.ID_PARAM).getAsString();
        JsonObject produced = alice.result(ProtocolElements.PRODUCE_METHOD,
                params(ProtocolElements.PRODUCE_TRANSPORTID_PARAM, transportId,
                        ProtocolElements.PRODUCE_KIND_PARAM, "audio"));
        String producerId = produced.get(ProtocolElements.ID_PARAM).getAsString();
        verify(bob.session).sendNotification(eq(ProtocolElements.NEWPRODUCER_METHOD), any(JsonObject.class));

        JsonArray producers = bob.result(ProtocolElements.GETPRODUCERS_METHOD, new JsonObject())
                .getAsJsonArray(ProtocolElements.JOINROOM_PRODUCERS_PARAM);
        assertThat(producers).hasSize(1);

        JsonObject recvTransport = bob.result(ProtocolElements.CREATETRANSPORT_METHOD,
                params(ProtocolElements.CREATETRANSPORT_DIRECTION_PARAM, "recv"));
        JsonObject consumeParams = params(
                ProtocolElements.CONSUME_TRANSPORTID_PARAM, recvTransport.get(ProtocolElements.ID_PARAM).getAsString(),
                ProtocolElements.CONSUME_PRODUCERID_PARAM, producerId);
        JsonObject capabilities = new JsonObject();
        JsonArray codecs = new JsonArray();
        codecs.add(CapabilityRegistry.MEDIA_CODECS.get(0).toJson());
        capabilities.add("codecs", codecs);
        consumeParams.add(ProtocolElements.CONSUME_RTPCAPABILITIES_PARAM, capabilities);
        JsonObject consumer = bob.result(ProtocolElements.CONSUME_METHOD, consumeParams);

        assertThat(consumer.get("producerId").getAsString()).isEqualTo(producerId);
        assertThat(consumer.get("paused").getAsBoolean()).isTrue();
        bob.result(ProtocolElements.RESUMECONSUMER_METHOD, params(ProtocolElements.RESUMECONSUMER_CONSUMERID_PARAM,
                consumer.get(ProtocolElements.ID_PARAM).getAsString()));
        assertThat(roomManager.getPeer("s2").getConsumer(consumer.get(ProtocolElements.ID_PARAM).getAsString())
                .isPaused()).isFalse();
    }

    @Test
    void producingOnAReceiveTransportFails() throws Exception {
        Client alice = new Client("s1");
        alice.join("room1", "alice");
        JsonObject transport = alice.result(ProtocolElements.CREATETRANSPORT_METHOD,
                params(ProtocolElements.CREATETRANSPORT_DIRECTION_PARAM, "recv"));

        assertThat(alice.errorCode(ProtocolElements.PRODUCE_METHOD,
                params(ProtocolElements.PRODUCE_TRANSPORTID_PARAM, transport.get("id").getAsString(),
                        ProtocolElements.PRODUCE_KIND_PARAM, "video")))
                .isEqualTo(Code.VALIDATION_ERROR_CODE.getValue());
        assertThat(alice.errorCode(ProtocolElements.PRODUCE_METHOD,
                params(ProtocolElements.PRODUCE_TRANSPORTID_PARAM, "nope", ProtocolElements.PRODUCE_KIND_PARAM,
                        "video")))
                .isEqualTo(Code.TRANSPORT_NOT_FOUND_ERROR_CODE.getValue());
    }

    @Test
    void recordingMethodsNeedTheModule() throws Exception {
        Client alice = new Client("s1");
        alice.join("room1", "alice");

        assertThat(alice.errorCode(ProtocolElements.STARTRECORDING_METHOD, new JsonObject()))
                .isEqualTo(Code.VALIDATION_ERROR_CODE.getValue());
        verify(recordingManager, never()).startRecording(anyString(), anyString(), any());
    }

    @Test
    void unknownOutputModeIsRejected() throws Exception {
        config.setRecordingModuleEnable(true);
        Client alice = new Client("s1");
        alice.join("room1", "alice");

        assertThat(alice.errorCode(ProtocolElements.STARTRECORDING_METHOD,
                params(ProtocolElements.STARTRECORDING_OUTPUTMODE_PARAM, "hologram")))
                .isEqualTo(Code.VALIDATION_ERROR_CODE.getValue());
    }

    @Test
    void leaveRoomDetachesTheConnection() throws Exception {
        Client alice = new Client("s1");
        alice.join("room1", "alice");

        alice.result(ProtocolElements.LEAVEROOM_METHOD, new JsonObject());

        assertThat(roomManager.isInRoom("s1")).isFalse();
        assertThat(alice.errorCode(ProtocolElements.GETPRODUCERS_METHOD, new JsonObject()))
                .isEqualTo(Code.TRANSPORT_ERROR_CODE.getValue());
    }

    @Test
    void lostConnectionLeavesTheRoom() throws Exception {
        Client alice = new Client("s1");
        Client bob = new Client("s2");
        alice.join("room1", "alice");
        bob.join("room1", "bob");

        handler.handleTransportError(alice.session, new EOFException());
        handler.afterConnectionClosed(alice.session, "closed");

        assertThat(roomManager.isInRoom("s1")).isFalse();
        assertThat(notificationService.getRpcConnection("s1")).isNull();
        ArgumentCaptor<Object> left = ArgumentCaptor.forClass(Object.class);
        verify(bob.session, atLeastOnce()).sendNotification(eq(ProtocolElements.USERLEFT_METHOD), left.capture());
        JsonElement reason = ((JsonObject) left.getValue()).get(ProtocolElements.REASON_PARAM);
        assertThat(reason.getAsString()).isEqualTo("networkDisconnect");
        verify(bob.session).sendNotification(eq(ProtocolElements.HOSTCHANGED_METHOD), any(JsonObject.class));
    }

    @Test
    void domainErrorsKeepTheirCode() throws Exception {
        Client alice = new Client("s1");
        Client bob = new Client("s2");
        alice.join("room1", "alice");
        bob.join("room1", "bob");
        JsonObject settings = new JsonObject();
        settings.addProperty("locked", true);
        JsonObject params = new JsonObject();
        params.add(ProtocolElements.UPDATEROOMSETTINGS_SETTINGS_PARAM, settings);

        assertThat(bob.errorCode(ProtocolElements.UPDATEROOMSETTINGS_METHOD, params))
                .isEqualTo(Code.NOT_HOST_ERROR_CODE.getValue());
        assertThat(alice.result(ProtocolElements.UPDATEROOMSETTINGS_METHOD, params)
                .getAsJsonObject(ProtocolElements.UPDATEROOMSETTINGS_SETTINGS_PARAM).get("locked").getAsBoolean())
                .isTrue();
    }

    @Test
    void pollIsCreatedVotedAndClosedOverRpc() throws Exception {
        Client alice = new Client("s1");
        Client bob = new Client("s2");
        alice.join("room1", "alice");
        bob.join("room1", "bob");
        JsonObject create = params(ProtocolElements.CREATEPOLL_QUESTION_PARAM, "Lunch?");
        JsonArray options = new JsonArray();
        options.add("pizza");
        options.add("sushi");
        create.add(ProtocolElements.CREATEPOLL_OPTIONS_PARAM, options);
        create.addProperty(ProtocolElements.CREATEPOLL_ALLOWMULTIPLE_PARAM, true);
        String pollId = alice.result(ProtocolElements.CREATEPOLL_METHOD, create).get("id").getAsString();

        JsonObject vote = params(ProtocolElements.SUBMITVOTE_POLLID_PARAM, pollId);
        JsonArray selected = new JsonArray();
        selected.add(0);
        selected.add(1);
        vote.add(ProtocolElements.SUBMITVOTE_SELECTEDOPTIONS_PARAM, selected);
        JsonObject updated = bob.result(ProtocolElements.SUBMITVOTE_METHOD, vote);

        assertThat(updated.get(ProtocolElements.TOTALVOTES_PARAM).getAsInt()).isEqualTo(2);
        verify(alice.session).sendNotification(ProtocolElements.POLLUPDATED_METHOD, updated);

        JsonObject close = params(ProtocolElements.CLOSEPOLL_POLLID_PARAM, pollId);
        assertThat(bob.errorCode(ProtocolElements.CLOSEPOLL_METHOD, close))
                .isEqualTo(Code.VALIDATION_ERROR_CODE.getValue());
        JsonObject closed = alice.result(ProtocolElements.CLOSEPOLL_METHOD, close);

        verify(bob.session).sendNotification(ProtocolElements.POLLCLOSED_METHOD, closed);
        assertThat(bob.errorCode(ProtocolElements.SUBMITVOTE_METHOD, vote))
                .isEqualTo(Code.VALIDATION_ERROR_CODE.getValue());
        assertThat(bob.errorCode(ProtocolElements.CLOSEPOLL_METHOD,
                params(ProtocolElements.CLOSEPOLL_POLLID_PARAM, "missing")))
                .isEqualTo(Code.POLL_NOT_FOUND_ERROR_CODE.getValue());
    }

    @Test
    void voteNeedsAListOfOptions() throws Exception {
        Client alice = new Client("s1");
        alice.join("room1", "alice");

        JsonObject vote = params(ProtocolElements.SUBMITVOTE_POLLID_PARAM, "any",
                ProtocolElements.SUBMITVOTE_SELECTEDOPTIONS_PARAM, "0");

        assertThat(alice.errorCode(ProtocolElements.SUBMITVOTE_METHOD, vote))
                .isEqualTo(Code.VALIDATION_ERROR_CODE.getValue());
    }
}
