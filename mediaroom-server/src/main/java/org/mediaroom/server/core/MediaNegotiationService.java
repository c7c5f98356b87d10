package org.mediaroom.server.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.client.internal.ProtocolElements;
import org.mediaroom.server.engine.CapabilityRegistry;
import org.mediaroom.server.engine.ClientTransport;
import org.mediaroom.server.engine.EngineConsumer;
import org.mediaroom.server.engine.EngineProducer;
import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.engine.RtpCodec;
import org.mediaroom.server.engine.TransportDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport, producer and consumer handshake of the peers of a room. The
 * server is the only source of truth about who produces what; every change is
 * broadcast to the rest of the room.
 */
public class MediaNegotiationService {

    private static final Logger log = LoggerFactory.getLogger(MediaNegotiationService.class);

    private final RoomManager roomManager;
    private final CapabilityRegistry capabilityRegistry;
    private final RoomEventsHandler roomEventsHandler;

    public MediaNegotiationService(RoomManager roomManager, CapabilityRegistry capabilityRegistry,
                                   RoomEventsHandler roomEventsHandler) {
        this.roomManager = roomManager;
        this.capabilityRegistry = capabilityRegistry;
        this.roomEventsHandler = roomEventsHandler;
    }

    /**
     * @return <code>{id, direction, ...connection parameters}</code>
     */
    public JsonObject createTransport(String peerId, TransportDirection direction) {
        Room room = roomManager.getRoomOfPeer(peerId);
        ClientTransport transport;
        synchronized (room.getLock()) {
            Peer peer = room.getPeer(peerId);
            transport = room.getRoutingContext().createClientTransport(direction,
                    (transportId, candidate) -> roomEventsHandler.onIceCandidate(peerId, transportId, candidate));
            peer.addTransport(transport);
        }
        log.info("PEER {}: {} transport {} created", peerId, direction.getValue(), transport.getId());
        JsonObject result = transport.getConnectionParameters().deepCopy();
        result.addProperty(ProtocolElements.ID_PARAM, transport.getId());
        result.addProperty(ProtocolElements.CREATETRANSPORT_DIRECTION_PARAM, direction.getValue());
        return result;
    }

    public JsonObject connectTransport(String peerId, String transportId, JsonObject dtlsParameters) {
        Peer peer = roomManager.getPeer(peerId);
        ClientTransport transport = peer.getTransport(transportId);
        JsonObject ack = transport.connect(dtlsParameters);
        log.debug("PEER {}: transport {} connected", peerId, transportId);
        return ack;
    }

    public void addIceCandidate(String peerId, String transportId, JsonObject candidate) {
        Peer peer = roomManager.getPeer(peerId);
        peer.getTransport(transportId).addRemoteCandidate(candidate);
    }

    /**
     * Starts receiving a track from the peer, announces it to the rest of the
     * room and hands it to the room listeners.
     *
     * @return the producer id
     */
    public String produce(String peerId, String transportId, MediaKind kind, JsonObject rtpParameters) {
        Room room = roomManager.getRoomOfPeer(peerId);
        Peer peer;
        EngineProducer producer;
        synchronized (room.getLock()) {
            peer = room.getPeer(peerId);
            ClientTransport transport = peer.getTransport(transportId);
            if (transport.getDirection() != TransportDirection.SEND) {
                throw new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                        "Transport '" + transportId + "' cannot send media");
            }
            RtpCodec codec = capabilityRegistry.resolveProducerCodec(kind, rtpParameters);
            producer = transport.produce(kind, codec, rtpParameters);
            peer.addProducer(producer);
        }
        log.info("PEER {}: producing {} ({}) as {}", peerId, kind.getValue(), producer.getCodec().getMimeType(),
                producer.getId());
        roomEventsHandler.onNewProducer(room, peer, producer);
        roomManager.producerAdded(room, peer, producer);
        return producer.getId();
    }

    public void closeProducer(String peerId, String producerId) {
        Room room = roomManager.getRoomOfPeer(peerId);
        synchronized (room.getLock()) {
            Peer peer = room.getPeer(peerId);
            EngineProducer producer = peer.removeProducer(producerId);
            for (Peer other : room.getPeers()) {
                other.closeConsumersOf(producerId);
            }
            producer.close();
        }
        log.info("PEER {}: producer {} closed", peerId, producerId);
        roomEventsHandler.onProducerClosed(room.getPeers(), peerId, producerId);
    }

    /**
     * Creates a paused consumer of another peer's producer. The consumer map of
     * the peer is left untouched when this fails.
     *
     * @return <code>{id, producerId, kind, rtpParameters, paused}</code>
     */
    public JsonObject consume(String peerId, String transportId, String producerId, JsonObject rtpCapabilities) {
        Room room = roomManager.getRoomOfPeer(peerId);
        EngineConsumer consumer;
        synchronized (room.getLock()) {
            Peer peer = room.getPeer(peerId);
            ClientTransport transport = peer.getTransport(transportId);
            EngineProducer producer = room.findProducer(producerId);
            if (!capabilityRegistry.canConsume(producer, rtpCapabilities)) {
                throw new MediaRoomException(Code.INCOMPATIBLE_CAPABILITIES_ERROR_CODE,
                        "Peer '" + peerId + "' cannot consume " + producer.getCodec().getMimeType());
            }
            consumer = transport.consume(producer, true);
            peer.addConsumer(consumer);
        }
        log.info("PEER {}: consuming producer {} as {}", peerId, producerId, consumer.getId());
        JsonObject result = new JsonObject();
        result.addProperty(ProtocolElements.ID_PARAM, consumer.getId());
        result.addProperty(ProtocolElements.PRODUCERID_PARAM, producerId);
        result.addProperty(ProtocolElements.KIND_PARAM, consumer.getKind().getValue());
        result.add(ProtocolElements.PRODUCE_RTPPARAMETERS_PARAM, consumer.getRtpParameters());
        result.addProperty("paused", consumer.isPaused());
        return result;
    }

    public void resumeConsumer(String peerId, String consumerId) {
        Peer peer = roomManager.getPeer(peerId);
        peer.getConsumer(consumerId).resume();
        log.debug("PEER {}: consumer {} resumed", peerId, consumerId);
    }

    /**
     * @return every producer in the room not owned by the peer
     */
    public JsonArray getProducers(String peerId) {
        Room room = roomManager.getRoomOfPeer(peerId);
        room.getPeer(peerId);
        return room.producersJson(peerId);
    }
}
