package org.mediaroom.server.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.server.engine.CapabilityRegistry;
import org.mediaroom.server.engine.EngineConsumer;
import org.mediaroom.server.engine.EngineProducer;
import org.mediaroom.server.engine.FakeMediaEngine;
import org.mediaroom.server.engine.FakeMediaEngine.FakeClientTransport;
import org.mediaroom.server.engine.FakeMediaEngine.FakeRoutingContext;
import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.engine.RoutingContextPool;
import org.mediaroom.server.engine.TransportDirection;
import org.mediaroom.server.storage.MetadataStore;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class MediaNegotiationServiceTest {

    private final FakeMediaEngine engine = new FakeMediaEngine();
    private final RoomEventsHandler eventsHandler = mock(RoomEventsHandler.class);
    private final MetadataStore metadataStore = mock(MetadataStore.class);

    private RoomManager roomManager;
    private MediaNegotiationService service;

    @BeforeEach
    void setUp() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        doReturn(mock(ScheduledFuture.class)).when(scheduler)
                .schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        CapabilityRegistry registry = new CapabilityRegistry(engine);
        roomManager = new RoomManager(new RoutingContextPool(engine, 0), registry,
                new SessionTracker(metadataStore, Runnable::run), eventsHandler, metadataStore, scheduler,
                Runnable::run, 30_000L);
        service = new MediaNegotiationService(roomManager, registry, eventsHandler);
        roomManager.joinRoom("room1", "alice", "alice", null, false);
        roomManager.joinRoom("room1", "bob", "bob", null, false);
    }

    private static JsonObject capabilitiesFor(String mimeType, int clockRate) {
        JsonObject codec = new JsonObject();
        codec.addProperty("mimeType", mimeType);
        codec.addProperty("clockRate", clockRate);
        JsonArray codecs = new JsonArray();
        codecs.add(codec);
        JsonObject capabilities = new JsonObject();
        capabilities.add("codecs", codecs);
        return capabilities;
    }

    private String transport(String peerId, TransportDirection direction) {
        return service.createTransport(peerId, direction).get("id").getAsString();
    }

    @Test
    void createdTransportForwardsLocalCandidates() {
        JsonObject created = service.createTransport("alice", TransportDirection.SEND);

        assertThat(created.get("direction").getAsString()).isEqualTo("send");
        assertThat(created.get("negotiation").getAsString()).isEqualTo("fake");
        FakeRoutingContext context = (FakeRoutingContext) roomManager.getRoom("room1").getRoutingContext();
        FakeClientTransport transport = context.getClientTransports().get(0);
        JsonObject candidate = new JsonObject();
        candidate.addProperty("candidate", "candidate:1 1 UDP 2122 10.0.0.1 5000 typ host");
        transport.gatherCandidate(candidate);

        verify(eventsHandler).onIceCandidate("alice", transport.getId(), candidate);
    }

    @Test
    void connectAndRemoteCandidatesReachTheTransport() {
        String transportId = transport("alice", TransportDirection.RECV);
        FakeClientTransport transport = ((FakeRoutingContext) roomManager.getRoom("room1").getRoutingContext())
                .getClientTransports().get(0);
        JsonObject dtls = new JsonObject();
        dtls.addProperty("role", "client");
        JsonObject candidate = new JsonObject();
        candidate.addProperty("candidate", "remote");

        JsonObject ack = service.connectTransport("alice", transportId, dtls);
        service.addIceCandidate("alice", transportId, candidate);

        assertThat(ack.get("connected").getAsBoolean()).isTrue();
        assertThat(transport.getConnectedWith()).isEqualTo(dtls);
        assertThat(transport.getRemoteCandidates()).containsExactly(candidate);
    }

    @Test
    void unknownTransportIsReported() {
        assertThatThrownBy(() -> service.connectTransport("alice", "missing", new JsonObject()))
                .isInstanceOfSatisfying(MediaRoomException.class,
                        e -> assertThat(e.getCode()).isEqualTo(Code.TRANSPORT_NOT_FOUND_ERROR_CODE));
    }

    @Test
    void produceRequiresASendTransport() {
        String recv = transport("alice", TransportDirection.RECV);

        assertThatThrownBy(() -> service.produce("alice", recv, MediaKind.AUDIO, new JsonObject()))
                .isInstanceOfSatisfying(MediaRoomException.class,
                        e -> assertThat(e.getCode()).isEqualTo(Code.VALIDATION_ERROR_CODE));
        assertThat(roomManager.getPeer("alice").hasProducers()).isFalse();
    }

    @Test
    void produceResolvesTheCodecAndAnnouncesIt() {
        String send = transport("alice", TransportDirection.SEND);
        JsonObject rtpParameters = new JsonObject();
        JsonArray codecs = new JsonArray();
        JsonObject h264 = new JsonObject();
        h264.addProperty("mimeType", "video/H264");
        h264.addProperty("clockRate", 90000);
        h264.addProperty("payloadType", 102);
        codecs.add(h264);
        rtpParameters.add("codecs", codecs);

        String producerId = service.produce("alice", send, MediaKind.VIDEO, rtpParameters);

        EngineProducer producer = roomManager.getPeer("alice").getProducer(producerId);
        assertThat(producer.getCodec().getMimeType()).isEqualTo("video/H264");
        assertThat(producer.getCodec().getPayloadType()).isEqualTo(102);
        verify(eventsHandler).onNewProducer(any(Room.class), eq(roomManager.getPeer("alice")), eq(producer));
    }

    @Test
    void consumeChecksCapabilitiesAndStartsPaused() {
        String producerId = service.produce("alice", transport("alice", TransportDirection.SEND), MediaKind.AUDIO,
                new JsonObject());
        String recv = transport("bob", TransportDirection.RECV);

        assertThatThrownBy(() -> service.consume("bob", recv, producerId, capabilitiesFor("audio/PCMU", 8000)))
                .isInstanceOfSatisfying(MediaRoomException.class,
                        e -> assertThat(e.getCode()).isEqualTo(Code.INCOMPATIBLE_CAPABILITIES_ERROR_CODE));
        assertThat(roomManager.getPeer("bob").getConsumerCount()).isZero();

        JsonObject consumer = service.consume("bob", recv, producerId, capabilitiesFor("audio/opus", 48000));

        assertThat(consumer.get("producerId").getAsString()).isEqualTo(producerId);
        assertThat(consumer.get("kind").getAsString()).isEqualTo("audio");
        assertThat(consumer.get("paused").getAsBoolean()).isTrue();
        service.resumeConsumer("bob", consumer.get("id").getAsString());
        assertThat(roomManager.getPeer("bob").getConsumer(consumer.get("id").getAsString()).isPaused()).isFalse();
    }

    @Test
    void consumingAnUnknownProducerFails() {
        String recv = transport("bob", TransportDirection.RECV);

        assertThatThrownBy(() -> service.consume("bob", recv, "ghost", capabilitiesFor("audio/opus", 48000)))
                .isInstanceOf(MediaRoomException.class);
    }

    @Test
    void closingAProducerClosesItsConsumers() {
        String producerId = service.produce("alice", transport("alice", TransportDirection.SEND), MediaKind.AUDIO,
                new JsonObject());
        JsonObject consumer = service.consume("bob", transport("bob", TransportDirection.RECV), producerId,
                capabilitiesFor("audio/opus", 48000));
        EngineConsumer engineConsumer = roomManager.getPeer("bob").getConsumer(consumer.get("id").getAsString());

        service.closeProducer("alice", producerId);

        assertThat(engineConsumer.isClosed()).isTrue();
        assertThat(roomManager.getPeer("bob").getConsumerCount()).isZero();
        assertThat(roomManager.getPeer("alice").hasProducers()).isFalse();
        verify(eventsHandler).onProducerClosed(any(), eq("alice"), eq(producerId));
    }

    @Test
    void closingSomeoneElsesProducerIsRejected() {
        String producerId = service.produce("alice", transport("alice", TransportDirection.SEND), MediaKind.AUDIO,
                new JsonObject());

        assertThatThrownBy(() -> service.closeProducer("bob", producerId))
                .isInstanceOfSatisfying(MediaRoomException.class,
                        e -> assertThat(e.getCode()).isEqualTo(Code.PRODUCER_NOT_FOUND_ERROR_CODE));
        verify(eventsHandler, never()).onProducerClosed(any(), any(), any());
    }

    @Test
    void getProducersListsOnlyOtherPeers() {
        service.produce("alice", transport("alice", TransportDirection.SEND), MediaKind.AUDIO, new JsonObject());
        service.produce("bob", transport("bob", TransportDirection.SEND), MediaKind.VIDEO, new JsonObject());

        JsonArray seenByBob = service.getProducers("bob");

        assertThat(seenByBob).hasSize(1);
        assertThat(seenByBob.get(0).getAsJsonObject().get("peerId").getAsString()).isEqualTo("alice");
    }
}
