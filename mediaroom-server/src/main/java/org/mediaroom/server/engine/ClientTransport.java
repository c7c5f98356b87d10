package org.mediaroom.server.engine;

import com.google.gson.JsonObject;

/**
 * Transport carrying a peer's own media to or from the engine.
 */
public interface ClientTransport extends EngineTransport {

    TransportDirection getDirection();

    /**
     * @return the parameters the client needs to build its side of the
     * transport
     */
    JsonObject getConnectionParameters();

    /**
     * @param dtlsParameters client-side security and session parameters
     * @return acknowledgement, possibly carrying engine-side parameters
     */
    JsonObject connect(JsonObject dtlsParameters);

    void addRemoteCandidate(JsonObject candidate);

    EngineProducer produce(MediaKind kind, RtpCodec codec, JsonObject rtpParameters);

    EngineConsumer consume(EngineProducer producer, boolean paused);
}
