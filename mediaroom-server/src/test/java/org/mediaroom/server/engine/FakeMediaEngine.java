package org.mediaroom.server.engine;

import com.google.gson.JsonObject;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory media engine: contexts, transports, producers and consumers that
 * only record what was asked of them.
 */
public class FakeMediaEngine implements MediaEngine {

    private static final AtomicInteger IDS = new AtomicInteger();

    private final List<RoutingContext> createdContexts = new CopyOnWriteArrayList<>();
    private final List<EngineFatalListener> fatalListeners = new CopyOnWriteArrayList<>();
    private volatile boolean failing = false;
    private volatile boolean closed = false;

    static String nextId(String prefix) {
        return prefix + "-" + IDS.incrementAndGet();
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public List<RoutingContext> getCreatedContexts() {
        return createdContexts;
    }

    public void fireFatal(String reason) {
        for (EngineFatalListener listener : fatalListeners) {
            listener.onEngineFatal(reason, null);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public List<RtpCodec> getSupportedCodecs() {
        return new ArrayList<>(CapabilityRegistry.MEDIA_CODECS);
    }

    @Override
    public RoutingContext createRoutingContext() {
        if (failing) {
            throw new MediaRoomException(Code.RESOURCE_EXHAUSTED_ERROR_CODE, "engine is failing");
        }
        FakeRoutingContext context = new FakeRoutingContext();
        createdContexts.add(context);
        return context;
    }

    @Override
    public void addFatalListener(EngineFatalListener listener) {
        fatalListeners.add(listener);
    }

    @Override
    public void close() {
        closed = true;
    }

    public static class FakeRoutingContext implements RoutingContext {

        private final String id = nextId("ctx");
        private final List<FakeClientTransport> clientTransports = new CopyOnWriteArrayList<>();
        private final List<FakeCaptureTransport> captureTransports = new CopyOnWriteArrayList<>();
        private final AtomicInteger captureTransportCalls = new AtomicInteger();
        private volatile int failingCaptureTransport = -1;
        private volatile boolean closed = false;

        @Override
        public String getId() {
            return id;
        }

        @Override
        public ClientTransport createClientTransport(TransportDirection direction,
                                                     CandidateListener candidateListener) {
            FakeClientTransport transport = new FakeClientTransport(direction, candidateListener);
            clientTransports.add(transport);
            return transport;
        }

        @Override
        public CaptureTransport createCaptureTransport(String listenIp) {
            if (captureTransportCalls.incrementAndGet() == failingCaptureTransport) {
                throw new MediaRoomException(Code.RESOURCE_EXHAUSTED_ERROR_CODE, "no capture transport left");
            }
            FakeCaptureTransport transport = new FakeCaptureTransport();
            captureTransports.add(transport);
            return transport;
        }

        public List<FakeClientTransport> getClientTransports() {
            return clientTransports;
        }

        /**
         * Makes the n-th (from 1) capture transport creation fail.
         */
        public void setFailingCaptureTransport(int ordinal) {
            this.failingCaptureTransport = ordinal;
        }

        public List<FakeCaptureTransport> getCaptureTransports() {
            return captureTransports;
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    public static class FakeClientTransport implements ClientTransport {

        private final String id = nextId("transport");
        private final TransportDirection direction;
        private final CandidateListener candidateListener;
        private final List<JsonObject> remoteCandidates = new CopyOnWriteArrayList<>();
        private volatile JsonObject connectedWith;
        private volatile boolean closed = false;

        public FakeClientTransport(TransportDirection direction, CandidateListener candidateListener) {
            this.direction = direction;
            this.candidateListener = candidateListener;
        }

        public void gatherCandidate(JsonObject candidate) {
            candidateListener.onLocalCandidate(id, candidate);
        }

        public JsonObject getConnectedWith() {
            return connectedWith;
        }

        public List<JsonObject> getRemoteCandidates() {
            return remoteCandidates;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public TransportDirection getDirection() {
            return direction;
        }

        @Override
        public JsonObject getConnectionParameters() {
            JsonObject params = new JsonObject();
            params.addProperty("negotiation", "fake");
            return params;
        }

        @Override
        public JsonObject connect(JsonObject dtlsParameters) {
            connectedWith = dtlsParameters;
            JsonObject ack = new JsonObject();
            ack.addProperty("connected", true);
            return ack;
        }

        @Override
        public void addRemoteCandidate(JsonObject candidate) {
            remoteCandidates.add(candidate);
        }

        @Override
        public EngineProducer produce(MediaKind kind, RtpCodec codec, JsonObject rtpParameters) {
            return new FakeProducer(kind, codec);
        }

        @Override
        public EngineConsumer consume(EngineProducer producer, boolean paused) {
            return new FakeConsumer(producer, paused);
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    public static class FakeCaptureTransport implements CaptureTransport {

        private final String id = nextId("capture");
        private final List<FakeConsumer> consumers = new CopyOnWriteArrayList<>();
        private volatile String remoteIp;
        private volatile int remotePort = -1;
        private volatile boolean closed = false;

        public List<FakeConsumer> getConsumers() {
            return consumers;
        }

        public String getRemoteIp() {
            return remoteIp;
        }

        public int getRemotePort() {
            return remotePort;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public int getLocalPort() {
            return 40000;
        }

        @Override
        public EngineConsumer consume(EngineProducer producer, boolean paused) {
            FakeConsumer consumer = new FakeConsumer(producer, paused);
            consumers.add(consumer);
            return consumer;
        }

        @Override
        public void connect(String ip, int port) {
            this.remoteIp = ip;
            this.remotePort = port;
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            closed = true;
            for (FakeConsumer consumer : consumers) {
                consumer.close();
            }
        }
    }

    public static class FakeProducer implements EngineProducer {

        private final String id = nextId("producer");
        private final MediaKind kind;
        private final RtpCodec codec;
        private volatile boolean closed = false;

        public FakeProducer(MediaKind kind, RtpCodec codec) {
            this.kind = kind;
            this.codec = codec;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public MediaKind getKind() {
            return kind;
        }

        @Override
        public RtpCodec getCodec() {
            return codec;
        }

        @Override
        public JsonObject getRtpParameters() {
            JsonObject params = new JsonObject();
            params.addProperty("mimeType", codec.getMimeType());
            return params;
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    public static class FakeConsumer implements EngineConsumer {

        private final String id = nextId("consumer");
        private final EngineProducer producer;
        private volatile boolean paused;
        private volatile boolean closed = false;

        public FakeConsumer(EngineProducer producer, boolean paused) {
            this.producer = producer;
            this.paused = paused;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getProducerId() {
            return producer.getId();
        }

        @Override
        public MediaKind getKind() {
            return producer.getKind();
        }

        @Override
        public RtpCodec getCodec() {
            return producer.getCodec();
        }

        @Override
        public JsonObject getRtpParameters() {
            return producer.getRtpParameters();
        }

        @Override
        public void pause() {
            paused = true;
        }

        @Override
        public void resume() {
            paused = false;
        }

        @Override
        public boolean isPaused() {
            return paused;
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
