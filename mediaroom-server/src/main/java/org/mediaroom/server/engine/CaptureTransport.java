package org.mediaroom.server.engine;

public interface CaptureTransport extends EngineTransport {

    /**
     * @return port assigned by the engine on its side of the transport
     */
    int getLocalPort();

    /**
     * The returned consumer carries the producer's codec.
     */
    EngineConsumer consume(EngineProducer producer, boolean paused);

    /**
     * Starts sending RTP to the given receiver.
     */
    void connect(String ip, int port);
}
