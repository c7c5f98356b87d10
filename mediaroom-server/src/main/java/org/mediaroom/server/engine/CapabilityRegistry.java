package org.mediaroom.server.engine;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Set of media formats every room of this server routes. Computed once, when
 * the engine becomes available, as the configured codecs the engine supports.
 * Read-only afterwards.
 */
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    public static final List<RtpCodec> MEDIA_CODECS = Collections.unmodifiableList(Arrays.asList(
            new RtpCodec(MediaKind.AUDIO, "audio/opus", 48000, 2, 111,
                    params("sprop-stereo", 1, "usedtx", 1, "maxaveragebitrate", 128000)),
            new RtpCodec(MediaKind.VIDEO, "video/VP8", 90000, 1, 96,
                    params("x-google-start-bitrate", 800)),
            new RtpCodec(MediaKind.VIDEO, "video/H264", 90000, 1, 125,
                    params("packetization-mode", 1, "profile-level-id", "42e01f", "level-asymmetry-allowed", 1))));

    private final List<RtpCodec> codecs;
    private final JsonObject rtpCapabilities;

    public CapabilityRegistry(MediaEngine engine) {
        this(MEDIA_CODECS, engine.getSupportedCodecs());
    }

    CapabilityRegistry(List<RtpCodec> configured, List<RtpCodec> supported) {
        List<RtpCodec> negotiated = new ArrayList<>();
        for (RtpCodec codec : configured) {
            boolean engineSupports = supported.stream()
                    .anyMatch(s -> s.matches(codec.getMimeType(), codec.getClockRate()));
            if (engineSupports) {
                negotiated.add(codec);
            } else {
                log.warn("Codec {} is not supported by the media engine and will not be offered", codec);
            }
        }
        if (negotiated.isEmpty()) {
            throw new MediaRoomException(Code.RESOURCE_EXHAUSTED_ERROR_CODE,
                    "Media engine does not support any of the configured codecs");
        }
        this.codecs = Collections.unmodifiableList(negotiated);

        JsonArray codecsJson = new JsonArray();
        for (RtpCodec codec : this.codecs) {
            codecsJson.add(codec.toJson());
        }
        this.rtpCapabilities = new JsonObject();
        this.rtpCapabilities.add("codecs", codecsJson);
        log.info("Negotiated router capabilities: {}", this.codecs);
    }

    public List<RtpCodec> getCodecs() {
        return codecs;
    }

    /**
     * @return a copy of the capability set sent to joining clients
     */
    public JsonObject getRtpCapabilities() {
        return rtpCapabilities.deepCopy();
    }

    /**
     * @return the preferred codec of the given kind, or <code>null</code> if
     * the kind is not routed
     */
    public RtpCodec getCodec(MediaKind kind) {
        for (RtpCodec codec : codecs) {
            if (codec.getKind() == kind) {
                return codec;
            }
        }
        return null;
    }

    /**
     * Resolves the codec a producer sends with from the first codec of its RTP
     * parameters, keeping the payload type the client chose. Falls back to the
     * preferred codec of the kind.
     */
    public RtpCodec resolveProducerCodec(MediaKind kind, JsonObject rtpParameters) {
        if (rtpParameters != null && rtpParameters.has("codecs")
                && rtpParameters.getAsJsonArray("codecs").size() > 0) {
            JsonObject first = rtpParameters.getAsJsonArray("codecs").get(0).getAsJsonObject();
            String mimeType = first.get("mimeType").getAsString();
            int clockRate = first.has("clockRate") ? first.get("clockRate").getAsInt() : -1;
            for (RtpCodec codec : codecs) {
                if (codec.getKind() == kind && codec.matches(mimeType, clockRate)) {
                    return first.has("payloadType") ? codec.withPayloadType(first.get("payloadType").getAsInt())
                            : codec;
                }
            }
            throw new MediaRoomException(Code.INCOMPATIBLE_CAPABILITIES_ERROR_CODE,
                    "Codec " + mimeType + "/" + clockRate + " is not supported by this server");
        }
        RtpCodec codec = getCodec(kind);
        if (codec == null) {
            throw new MediaRoomException(Code.INCOMPATIBLE_CAPABILITIES_ERROR_CODE,
                    "No " + kind + " codec is supported by this server");
        }
        return codec;
    }

    /**
     * Compatibility predicate between a producer and the capabilities of the
     * transport that wants to consume it.
     */
    public boolean canConsume(EngineProducer producer, JsonObject rtpCapabilities) {
        if (producer == null || rtpCapabilities == null || !rtpCapabilities.has("codecs")) {
            return false;
        }
        RtpCodec produced = producer.getCodec();
        boolean routed = codecs.stream().anyMatch(c -> c.matches(produced.getMimeType(), produced.getClockRate()));
        if (!routed) {
            return false;
        }
        for (JsonElement element : rtpCapabilities.getAsJsonArray("codecs")) {
            JsonObject codec = element.getAsJsonObject();
            if (!codec.has("mimeType") || !codec.has("clockRate")) {
                continue;
            }
            if (produced.matches(codec.get("mimeType").getAsString(), codec.get("clockRate").getAsInt())) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
