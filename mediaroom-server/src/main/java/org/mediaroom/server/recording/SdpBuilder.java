package org.mediaroom.server.recording;

import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.engine.RtpCodec;

import java.util.List;
import java.util.Map;

/**
 * Session description handed to the capture subprocess. It declares every
 * stream the subprocess must listen for: receive port, payload type, clock
 * rate and channel count.
 */
public final class SdpBuilder {

    private static final String CRLF = "\r\n";

    private SdpBuilder() {
    }

    public static String build(String ip, List<CaptureInput> inputs) {
        StringBuilder sdp = header(ip);
        for (CaptureInput input : inputs) {
            appendMedia(sdp, input.getKind().getValue(), input.getPort(), input.getCodec());
            sdp.append("a=recvonly").append(CRLF);
        }
        return sdp.toString();
    }

    /**
     * Description of a single receiver, as offered to the engine so that it
     * sends the stream to <code>ip:port</code>.
     */
    public static String describeReceiver(String ip, MediaKind kind, int port, RtpCodec codec) {
        StringBuilder sdp = header(ip);
        appendMedia(sdp, kind.getValue(), port, codec);
        sdp.append("a=recvonly").append(CRLF);
        return sdp.toString();
    }

    private static StringBuilder header(String ip) {
        long version = System.currentTimeMillis();
        StringBuilder sdp = new StringBuilder();
        sdp.append("v=0").append(CRLF);
        sdp.append("o=- ").append(version).append(' ').append(version).append(" IN IP4 ").append(ip).append(CRLF);
        sdp.append("s=MediaRoom Recording").append(CRLF);
        sdp.append("c=IN IP4 ").append(ip).append(CRLF);
        sdp.append("t=0 0").append(CRLF);
        return sdp;
    }

    static void appendMedia(StringBuilder sdp, String kind, int port, RtpCodec codec) {
        int pt = codec.getPayloadType();
        sdp.append("m=").append(kind).append(' ').append(port).append(" RTP/AVP ").append(pt).append(CRLF);
        sdp.append("a=rtpmap:").append(pt).append(' ').append(codec.getName()).append('/')
                .append(codec.getClockRate());
        if (codec.getChannels() > 1) {
            sdp.append('/').append(codec.getChannels());
        }
        sdp.append(CRLF);
        String fmtp = fmtp(codec.getParameters());
        if (!fmtp.isEmpty()) {
            sdp.append("a=fmtp:").append(pt).append(' ').append(fmtp).append(CRLF);
        }
    }

    static String fmtp(Map<String, Object> parameters) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            if (sb.length() > 0) {
                sb.append(';');
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
        }
        return sb.toString();
    }
}
