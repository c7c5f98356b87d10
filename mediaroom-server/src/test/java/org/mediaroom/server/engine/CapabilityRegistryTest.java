package org.mediaroom.server.engine;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.server.engine.FakeMediaEngine.FakeProducer;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityRegistryTest {

    private final CapabilityRegistry registry = new CapabilityRegistry(new FakeMediaEngine());

    private static JsonObject capabilities(String mimeType, int clockRate) {
        JsonObject codec = new JsonObject();
        codec.addProperty("mimeType", mimeType);
        codec.addProperty("clockRate", clockRate);
        JsonArray codecs = new JsonArray();
        codecs.add(codec);
        JsonObject caps = new JsonObject();
        caps.add("codecs", codecs);
        return caps;
    }

    @Test
    void exposesEveryCodecTheEngineSupports() {
        assertThat(registry.getCodecs()).hasSize(3);
        assertThat(registry.getRtpCapabilities().getAsJsonArray("codecs")).hasSize(3);
        assertThat(registry.getCodec(MediaKind.AUDIO).getMimeType()).isEqualTo("audio/opus");
        assertThat(registry.getCodec(MediaKind.VIDEO).getMimeType()).isEqualTo("video/VP8");
    }

    @Test
    void dropsCodecsTheEngineLacks() {
        RtpCodec vp8 = CapabilityRegistry.MEDIA_CODECS.get(1);
        CapabilityRegistry onlyVideo = new CapabilityRegistry(CapabilityRegistry.MEDIA_CODECS,
                Collections.singletonList(vp8));

        assertThat(onlyVideo.getCodecs()).containsExactly(vp8);
        assertThat(onlyVideo.getCodec(MediaKind.AUDIO)).isNull();
    }

    @Test
    void failsWhenNothingIsSupported() {
        assertThatThrownBy(() -> new CapabilityRegistry(CapabilityRegistry.MEDIA_CODECS, Collections.emptyList()))
                .isInstanceOf(MediaRoomException.class)
                .extracting(e -> ((MediaRoomException) e).getCode())
                .isEqualTo(Code.RESOURCE_EXHAUSTED_ERROR_CODE);
    }

    @Test
    void resolvesProducerCodecKeepingClientPayloadType() {
        JsonObject codec = capabilities("video/H264", 90000).getAsJsonArray("codecs").get(0).getAsJsonObject();
        codec.addProperty("payloadType", 102);
        JsonArray codecs = new JsonArray();
        codecs.add(codec);
        JsonObject rtpParameters = new JsonObject();
        rtpParameters.add("codecs", codecs);

        RtpCodec resolved = registry.resolveProducerCodec(MediaKind.VIDEO, rtpParameters);

        assertThat(resolved.getMimeType()).isEqualTo("video/H264");
        assertThat(resolved.getPayloadType()).isEqualTo(102);
    }

    @Test
    void resolvesPreferredCodecWithoutParameters() {
        assertThat(registry.resolveProducerCodec(MediaKind.AUDIO, null).getPayloadType()).isEqualTo(111);
    }

    @Test
    void rejectsUnknownProducerCodec() {
        assertThatThrownBy(() -> registry.resolveProducerCodec(MediaKind.VIDEO, capabilities("video/AV1", 90000)))
                .isInstanceOf(MediaRoomException.class)
                .extracting(e -> ((MediaRoomException) e).getCode())
                .isEqualTo(Code.INCOMPATIBLE_CAPABILITIES_ERROR_CODE);
    }

    @Test
    void canConsumeOnlyWithMatchingCapabilities() {
        FakeProducer producer = new FakeProducer(MediaKind.VIDEO, registry.getCodec(MediaKind.VIDEO));

        assertThat(registry.canConsume(producer, capabilities("video/vp8", 90000))).isTrue();
        assertThat(registry.canConsume(producer, capabilities("video/H264", 90000))).isFalse();
        assertThat(registry.canConsume(producer, new JsonObject())).isFalse();
        assertThat(registry.canConsume(null, capabilities("video/VP8", 90000))).isFalse();
    }
}
