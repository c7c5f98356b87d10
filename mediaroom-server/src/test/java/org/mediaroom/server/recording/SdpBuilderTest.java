package org.mediaroom.server.recording;

import org.junit.jupiter.api.Test;
import org.mediaroom.server.engine.CapabilityRegistry;
import org.mediaroom.server.engine.FakeMediaEngine.FakeCaptureTransport;
import org.mediaroom.server.engine.FakeMediaEngine.FakeConsumer;
import org.mediaroom.server.engine.FakeMediaEngine.FakeProducer;
import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.engine.RtpCodec;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class SdpBuilderTest {

    static CaptureInput input(MediaKind kind, RtpCodec codec, int port) {
        FakeProducer producer = new FakeProducer(kind, codec);
        return new CaptureInput("peer1", "alice", producer.getId(), port, new FakeCaptureTransport(),
                new FakeConsumer(producer, false));
    }

    @Test
    void declaresEveryStreamInOrder() {
        CaptureInput audio = input(MediaKind.AUDIO, CapabilityRegistry.MEDIA_CODECS.get(0), 40000);
        CaptureInput video = input(MediaKind.VIDEO, CapabilityRegistry.MEDIA_CODECS.get(1).withPayloadType(100),
                40002);

        String sdp = SdpBuilder.build("127.0.0.1", Arrays.asList(audio, video));

        assertThat(sdp).startsWith("v=0\r\n");
        assertThat(sdp).contains("c=IN IP4 127.0.0.1\r\n");
        assertThat(sdp).contains("m=audio 40000 RTP/AVP 111\r\na=rtpmap:111 opus/48000/2\r\n");
        assertThat(sdp).contains("a=fmtp:111 sprop-stereo=1;usedtx=1;maxaveragebitrate=128000\r\n");
        assertThat(sdp).contains("m=video 40002 RTP/AVP 100\r\na=rtpmap:100 VP8/90000\r\n");
        assertThat(sdp.indexOf("m=audio")).isLessThan(sdp.indexOf("m=video"));
        assertThat(sdp.split("a=recvonly", -1)).hasSize(3);
    }

    @Test
    void describesASingleReceiver() {
        String sdp = SdpBuilder.describeReceiver("10.0.0.5", MediaKind.VIDEO, 40010,
                CapabilityRegistry.MEDIA_CODECS.get(2));

        assertThat(sdp).contains("m=video 40010 RTP/AVP 125\r\n");
        assertThat(sdp).contains("a=fmtp:125 packetization-mode=1;profile-level-id=42e01f;level-asymmetry-allowed=1");
        assertThat(sdp).doesNotContain("m=audio");
    }
}
