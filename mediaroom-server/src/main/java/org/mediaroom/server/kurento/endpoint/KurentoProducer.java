package org.mediaroom.server.kurento.endpoint;

import com.google.gson.JsonObject;
import org.kurento.client.MediaElement;
import org.kurento.client.MediaType;
import org.mediaroom.server.engine.EngineProducer;
import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.engine.RtpCodec;

import java.util.UUID;

/**
 * One track of a {@link KurentoClientTransport}. Several producers may share
 * the same endpoint, one per media type.
 */
public class KurentoProducer implements EngineProducer {

    private final String id = UUID.randomUUID().toString();
    private final MediaElement element;
    private final MediaKind kind;
    private final RtpCodec codec;
    private final JsonObject rtpParameters;
    private volatile boolean closed = false;

    public KurentoProducer(MediaElement element, MediaKind kind, RtpCodec codec, JsonObject rtpParameters) {
        this.element = element;
        this.kind = kind;
        this.codec = codec;
        this.rtpParameters = rtpParameters != null ? rtpParameters.deepCopy() : new JsonObject();
    }

    @Override
    public String getId() {
        return id;
    }

    public MediaElement getElement() {
        return element;
    }

    public MediaType getMediaType() {
        return toMediaType(kind);
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
        return rtpParameters.deepCopy();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /**
     * The endpoint is owned by the transport and released with it.
     */
    @Override
    public void close() {
        closed = true;
    }

    static MediaType toMediaType(MediaKind kind) {
        return kind == MediaKind.AUDIO ? MediaType.AUDIO : MediaType.VIDEO;
    }

    static KurentoProducer cast(EngineProducer producer) {
        if (!(producer instanceof KurentoProducer)) {
            throw new IllegalArgumentException("Producer " + producer.getId() + " does not belong to Kurento");
        }
        return (KurentoProducer) producer;
    }
}
