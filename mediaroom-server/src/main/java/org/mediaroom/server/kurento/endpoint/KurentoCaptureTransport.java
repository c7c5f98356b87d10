package org.mediaroom.server.kurento.endpoint;

import org.kurento.client.RtpEndpoint;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.server.engine.CaptureTransport;
import org.mediaroom.server.engine.EngineConsumer;
import org.mediaroom.server.engine.EngineProducer;
import org.mediaroom.server.recording.SdpBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain RTP sender over an {@link RtpEndpoint}. It carries a single consumed
 * stream; on connect the endpoint is offered an SDP describing the receiver
 * and starts sending to it.
 */
public class KurentoCaptureTransport implements CaptureTransport {

    private static final Logger log = LoggerFactory.getLogger(KurentoCaptureTransport.class);

    private static final Pattern MEDIA_PORT = Pattern.compile("^m=\\w+ (\\d+) ", Pattern.MULTILINE);

    private final RtpEndpoint endpoint;
    private final String listenIp;
    private KurentoConsumer consumer;
    private int localPort = -1;
    private volatile boolean closed = false;

    public KurentoCaptureTransport(RtpEndpoint endpoint, String listenIp) {
        this.endpoint = endpoint;
        this.listenIp = listenIp;
    }

    @Override
    public String getId() {
        return endpoint.getId();
    }

    /**
     * @return the port the endpoint sends from, -1 until connected
     */
    @Override
    public synchronized int getLocalPort() {
        return localPort;
    }

    @Override
    public synchronized EngineConsumer consume(EngineProducer producer, boolean paused) {
        checkClosed();
        if (consumer != null) {
            throw new IllegalStateException("Capture transport " + getId() + " already carries a stream");
        }
        consumer = new KurentoConsumer(KurentoProducer.cast(producer), endpoint, paused);
        return consumer;
    }

    @Override
    public synchronized void connect(String ip, int port) {
        checkClosed();
        if (consumer == null) {
            throw new IllegalStateException("Capture transport " + getId() + " has nothing to send");
        }
        String offer = SdpBuilder.describeReceiver(ip, consumer.getKind(), port, consumer.getCodec());
        String answer = endpoint.processOffer(offer);
        Matcher matcher = MEDIA_PORT.matcher(answer != null ? answer : "");
        if (matcher.find()) {
            localPort = Integer.parseInt(matcher.group(1));
        }
        log.info("Capture transport {}: sending {} from {}:{} to {}:{}", getId(), consumer.getKind().getValue(),
                listenIp, localPort, ip, port);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (consumer != null) {
            consumer.close();
        }
        endpoint.release();
    }

    private void checkClosed() {
        if (closed) {
            throw new MediaRoomException(Code.TRANSPORT_NOT_FOUND_ERROR_CODE,
                    "Capture transport '" + getId() + "' is closed");
        }
    }
}
