package org.mediaroom.server.kurento.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;
import org.kurento.client.KurentoClient;
import org.kurento.client.KurentoConnectionListener;
import org.kurento.client.MediaPipeline;
import org.kurento.jsonrpc.JsonUtils;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.server.engine.CapabilityRegistry;
import org.mediaroom.server.engine.EngineFatalListener;
import org.mediaroom.server.engine.MediaEngine;
import org.mediaroom.server.engine.RoutingContext;
import org.mediaroom.server.engine.RtpCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Media engine made of one or more Kurento Media Server connections. Routing
 * contexts are spread over them round-robin.
 */
public class KurentoMediaEngine implements MediaEngine {

    private static final Logger log = LoggerFactory.getLogger(KurentoMediaEngine.class);

    public static final String KMS_URIS_PROPERTY = "kms.uris";

    private final List<String> kmsUris;
    private final int workers;
    private final List<KurentoClient> clients = new CopyOnWriteArrayList<>();
    private final List<EngineFatalListener> fatalListeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger next = new AtomicInteger();

    /**
     * @param kmsUris JSON array of KMS websocket uris, e.g.
     *                <code>["ws://localhost:8888/kurento"]</code>
     * @param workers number of connections to open
     */
    public KurentoMediaEngine(String kmsUris, int workers) {
        JsonArray uris = JsonParser.parseString(kmsUris).getAsJsonArray();
        this.kmsUris = JsonUtils.toStringList(uris);
        if (this.kmsUris.isEmpty()) {
            throw new IllegalArgumentException(KMS_URIS_PROPERTY + " should contain at least one kms url");
        }
        this.workers = Math.max(1, workers);
    }

    public void connect() {
        for (int i = 0; i < workers; i++) {
            String uri = kmsUris.get(i % kmsUris.size());
            final int worker = i;
            KurentoClient client = createClient(uri, new KurentoConnectionListener() {
                @Override
                public void connected() {
                    log.info("Engine worker {} connected to {}", worker, uri);
                }

                @Override
                public void connectionFailed() {
                    fireFatal("Engine worker " + worker + " could not connect to " + uri, null);
                }

                @Override
                public void disconnected() {
                    fireFatal("Engine worker " + worker + " lost its connection to " + uri, null);
                }

                @Override
                public void reconnected(boolean sameServer) {
                    log.warn("Engine worker {} reconnected to {} (same server: {})", worker, uri, sameServer);
                }
            });
            clients.add(client);
        }
        log.info("Media engine started with {} worker(s) over {}", clients.size(), kmsUris);
    }

    protected KurentoClient createClient(String uri, KurentoConnectionListener listener) {
        return KurentoClient.create(uri, listener);
    }

    @Override
    public List<RtpCodec> getSupportedCodecs() {
        return new ArrayList<>(CapabilityRegistry.MEDIA_CODECS);
    }

    @Override
    public RoutingContext createRoutingContext() {
        if (clients.isEmpty()) {
            throw new MediaRoomException(Code.RESOURCE_EXHAUSTED_ERROR_CODE, "Media engine is not connected");
        }
        KurentoClient client = clients.get(Math.floorMod(next.getAndIncrement(), clients.size()));
        try {
            MediaPipeline pipeline = client.createMediaPipeline();
            log.debug("Created MediaPipeline {}", pipeline.getId());
            return new KurentoRoutingContext(pipeline);
        } catch (RuntimeException e) {
            log.error("Unable to create media pipeline", e);
            throw new MediaRoomException(Code.RESOURCE_EXHAUSTED_ERROR_CODE,
                    "Unable to create media pipeline: " + e.getMessage(), e);
        }
    }

    @Override
    public void addFatalListener(EngineFatalListener listener) {
        fatalListeners.add(listener);
    }

    private void fireFatal(String reason, Throwable cause) {
        log.error(reason);
        for (EngineFatalListener listener : fatalListeners) {
            listener.onEngineFatal(reason, cause);
        }
    }

    @Override
    public void close() {
        for (KurentoClient client : clients) {
            try {
                client.destroy();
            } catch (RuntimeException e) {
                log.warn("Error closing engine connection: {}", e.getMessage());
            }
        }
        clients.clear();
    }
}
