package org.mediaroom.server.engine;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Media format of a stream: mime type, RTP clock rate, channel count and the
 * payload type it is carried with.
 */
public class RtpCodec {

    private final MediaKind kind;
    private final String mimeType;
    private final int clockRate;
    private final int channels;
    private final int payloadType;
    private final Map<String, Object> parameters;

    public RtpCodec(MediaKind kind, String mimeType, int clockRate, int channels, int payloadType,
                    Map<String, Object> parameters) {
        this.kind = kind;
        this.mimeType = mimeType;
        this.clockRate = clockRate;
        this.channels = channels;
        this.payloadType = payloadType;
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Collections.emptyMap();
    }

    public static RtpCodec fromJson(JsonObject json) {
        String mimeType = json.get("mimeType").getAsString();
        MediaKind kind = json.has("kind")
                ? MediaKind.fromString(json.get("kind").getAsString())
                : MediaKind.fromString(mimeType.substring(0, mimeType.indexOf('/')));
        int channels = json.has("channels") ? json.get("channels").getAsInt() : 1;
        int payloadType = json.has("payloadType") ? json.get("payloadType").getAsInt() : -1;
        Map<String, Object> parameters = new LinkedHashMap<>();
        if (json.has("parameters")) {
            for (Map.Entry<String, JsonElement> entry : json.getAsJsonObject("parameters").entrySet()) {
                parameters.put(entry.getKey(), entry.getValue().getAsString());
            }
        }
        return new RtpCodec(kind, mimeType, json.get("clockRate").getAsInt(), channels, payloadType, parameters);
    }

    public MediaKind getKind() {
        return kind;
    }

    public String getMimeType() {
        return mimeType;
    }

    /**
     * @return the subtype of the mime type, e.g. <code>opus</code> for
     * <code>audio/opus</code>
     */
    public String getName() {
        return mimeType.substring(mimeType.indexOf('/') + 1);
    }

    public int getClockRate() {
        return clockRate;
    }

    public int getChannels() {
        return channels;
    }

    public int getPayloadType() {
        return payloadType;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    /**
     * Same format regardless of payload type and parameters.
     */
    public boolean matches(String otherMimeType, int otherClockRate) {
        return mimeType.equalsIgnoreCase(otherMimeType) && clockRate == otherClockRate;
    }

    public RtpCodec withPayloadType(int newPayloadType) {
        return new RtpCodec(kind, mimeType, clockRate, channels, newPayloadType, parameters);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("kind", kind.getValue());
        json.addProperty("mimeType", mimeType);
        json.addProperty("clockRate", clockRate);
        if (kind == MediaKind.AUDIO) {
            json.addProperty("channels", channels);
        }
        if (payloadType >= 0) {
            json.addProperty("payloadType", payloadType);
        }
        JsonObject params = new JsonObject();
        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Number) {
                params.addProperty(entry.getKey(), (Number) value);
            } else {
                params.addProperty(entry.getKey(), String.valueOf(value));
            }
        }
        json.add("parameters", params);
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RtpCodec)) return false;
        RtpCodec that = (RtpCodec) o;
        return clockRate == that.clockRate && channels == that.channels && payloadType == that.payloadType
                && kind == that.kind && mimeType.equalsIgnoreCase(that.mimeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, mimeType.toLowerCase(), clockRate, channels, payloadType);
    }

    @Override
    public String toString() {
        return mimeType + "/" + clockRate + (kind == MediaKind.AUDIO ? "/" + channels : "") + " pt=" + payloadType;
    }
}
