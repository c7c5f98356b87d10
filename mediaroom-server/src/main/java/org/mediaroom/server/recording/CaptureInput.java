package org.mediaroom.server.recording;

import org.mediaroom.server.engine.CaptureTransport;
import org.mediaroom.server.engine.EngineConsumer;
import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.engine.RtpCodec;

/**
 * One captured stream: the capture transport sending it, the consumer feeding
 * that transport and the port the subprocess receives it on.
 */
public class CaptureInput {

    private final String peerId;
    private final String username;
    private final String producerId;
    private final int port;
    private final CaptureTransport transport;
    private final EngineConsumer consumer;

    public CaptureInput(String peerId, String username, String producerId, int port, CaptureTransport transport,
                        EngineConsumer consumer) {
        this.peerId = peerId;
        this.username = username;
        this.producerId = producerId;
        this.port = port;
        this.transport = transport;
        this.consumer = consumer;
    }

    public String getPeerId() {
        return peerId;
    }

    public String getUsername() {
        return username;
    }

    public String getProducerId() {
        return producerId;
    }

    public MediaKind getKind() {
        return consumer.getKind();
    }

    public RtpCodec getCodec() {
        return consumer.getCodec();
    }

    public int getPort() {
        return port;
    }

    public CaptureTransport getTransport() {
        return transport;
    }

    public EngineConsumer getConsumer() {
        return consumer;
    }

    @Override
    public String toString() {
        return "[peerId=" + peerId + ", producerId=" + producerId + ", kind=" + getKind() + ", port=" + port + "]";
    }
}
