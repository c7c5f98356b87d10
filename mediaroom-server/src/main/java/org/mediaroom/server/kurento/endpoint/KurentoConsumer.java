package org.mediaroom.server.kurento.endpoint;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.kurento.client.MediaElement;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.server.engine.EngineConsumer;
import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.engine.RtpCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Flow of one producer into a sink endpoint. Paused means disconnected: the
 * producing element is only connected to the sink while resumed.
 */
public class KurentoConsumer implements EngineConsumer {

    private static final Logger log = LoggerFactory.getLogger(KurentoConsumer.class);

    private final String id = UUID.randomUUID().toString();
    private final KurentoProducer producer;
    private final MediaElement sink;

    private boolean paused;
    private boolean closed = false;

    public KurentoConsumer(KurentoProducer producer, MediaElement sink, boolean paused) {
        this.producer = producer;
        this.sink = sink;
        this.paused = true;
        if (!paused) {
            resume();
        }
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
        JsonObject rtpParameters = new JsonObject();
        JsonArray codecs = new JsonArray();
        codecs.add(producer.getCodec().toJson());
        rtpParameters.add("codecs", codecs);
        return rtpParameters;
    }

    @Override
    public synchronized void pause() {
        if (closed || paused) {
            return;
        }
        producer.getElement().disconnect(sink, producer.getMediaType());
        paused = true;
    }

    @Override
    public synchronized void resume() {
        if (closed) {
            throw new MediaRoomException(Code.CONSUMER_NOT_FOUND_ERROR_CODE, "Consumer '" + id + "' is closed");
        }
        if (!paused) {
            return;
        }
        producer.getElement().connect(sink, producer.getMediaType());
        paused = false;
    }

    @Override
    public synchronized boolean isPaused() {
        return paused;
    }

    @Override
    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        if (!paused) {
            try {
                producer.getElement().disconnect(sink, producer.getMediaType());
            } catch (RuntimeException e) {
                log.debug("Consumer {}: error disconnecting from producer {}: {}", id, producer.getId(),
                        e.getMessage());
            }
        }
        closed = true;
    }
}
