package org.mediaroom.server.core;

import com.google.gson.JsonObject;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.client.internal.ProtocolElements;
import org.mediaroom.server.engine.ClientTransport;
import org.mediaroom.server.engine.EngineConsumer;
import org.mediaroom.server.engine.EngineProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A participant of a room. Owns its client transports and the producers and
 * consumers created on them. The room is referenced by id only.
 */
public class Peer {

    private static final Logger log = LoggerFactory.getLogger(Peer.class);

    private final String peerId;
    private final String roomId;
    private final String username;
    private final long joinedAt;
    private final boolean recorder;

    private volatile boolean host = false;

    private final Map<String, ClientTransport> transports = new ConcurrentHashMap<>();
    private final Map<String, EngineProducer> producers = new ConcurrentHashMap<>();
    private final Map<String, EngineConsumer> consumers = new ConcurrentHashMap<>();

    public Peer(String peerId, String roomId, String username, long joinedAt, boolean recorder) {
        this.peerId = peerId;
        this.roomId = roomId;
        this.username = username;
        this.joinedAt = joinedAt;
        this.recorder = recorder;
    }

    public String getPeerId() {
        return peerId;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getUsername() {
        return username;
    }

    public long getJoinedAt() {
        return joinedAt;
    }

    /**
     * @return true for the system-internal capture client, which can never be
     * host and is never recorded
     */
    public boolean isRecorder() {
        return recorder;
    }

    public boolean isHost() {
        return host;
    }

    void setHost(boolean host) {
        this.host = host;
    }

    public void addTransport(ClientTransport transport) {
        transports.put(transport.getId(), transport);
    }

    public ClientTransport getTransport(String transportId) {
        ClientTransport transport = transportId != null ? transports.get(transportId) : null;
        if (transport == null) {
            throw new MediaRoomException(Code.TRANSPORT_NOT_FOUND_ERROR_CODE,
                    "Transport '" + transportId + "' not found for peer '" + peerId + "'");
        }
        return transport;
    }

    public void addProducer(EngineProducer producer) {
        producers.put(producer.getId(), producer);
    }

    public EngineProducer getProducer(String producerId) {
        return producerId != null ? producers.get(producerId) : null;
    }

    public EngineProducer removeProducer(String producerId) {
        EngineProducer producer = producerId != null ? producers.remove(producerId) : null;
        if (producer == null) {
            throw new MediaRoomException(Code.PRODUCER_NOT_FOUND_ERROR_CODE,
                    "Producer '" + producerId + "' not found for peer '" + peerId + "'");
        }
        return producer;
    }

    public Collection<EngineProducer> getProducers() {
        return new ArrayList<>(producers.values());
    }

    public boolean hasProducers() {
        return !producers.isEmpty();
    }

    public void addConsumer(EngineConsumer consumer) {
        consumers.put(consumer.getId(), consumer);
    }

    public EngineConsumer getConsumer(String consumerId) {
        EngineConsumer consumer = consumerId != null ? consumers.get(consumerId) : null;
        if (consumer == null) {
            throw new MediaRoomException(Code.CONSUMER_NOT_FOUND_ERROR_CODE,
                    "Consumer '" + consumerId + "' not found for peer '" + peerId + "'");
        }
        return consumer;
    }

    public int getConsumerCount() {
        return consumers.size();
    }

    public int getTransportCount() {
        return transports.size();
    }

    /**
     * Closes and forgets every consumer receiving the given producer.
     */
    public List<String> closeConsumersOf(String producerId) {
        List<String> closed = new ArrayList<>();
        for (EngineConsumer consumer : new ArrayList<>(consumers.values())) {
            if (consumer.getProducerId().equals(producerId)) {
                consumers.remove(consumer.getId());
                closeQuietly(consumer.getId(), consumer::close);
                closed.add(consumer.getId());
            }
        }
        return closed;
    }

    /**
     * Releases consumers, then producers, then transports.
     */
    public void close() {
        for (EngineConsumer consumer : consumers.values()) {
            closeQuietly(consumer.getId(), consumer::close);
        }
        consumers.clear();
        for (EngineProducer producer : producers.values()) {
            closeQuietly(producer.getId(), producer::close);
        }
        producers.clear();
        for (ClientTransport transport : transports.values()) {
            closeQuietly(transport.getId(), transport::close);
        }
        transports.clear();
        log.debug("PEER {}: media resources released", peerId);
    }

    private void closeQuietly(String elementId, Runnable close) {
        try {
            close.run();
        } catch (RuntimeException e) {
            log.warn("PEER {}: error closing media element {}: {}", peerId, elementId, e.getMessage());
        }
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty(ProtocolElements.PEERID_PARAM, peerId);
        json.addProperty(ProtocolElements.USERNAME_PARAM, username);
        json.addProperty(ProtocolElements.ISHOST_PARAM, host);
        return json;
    }

    @Override
    public String toString() {
        return "[peerId=" + peerId + ", username=" + username + ", roomId=" + roomId + ", host=" + host
                + ", recorder=" + recorder + "]";
    }
}
