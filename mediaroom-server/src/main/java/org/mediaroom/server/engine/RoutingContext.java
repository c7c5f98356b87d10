package org.mediaroom.server.engine;

public interface RoutingContext {

    String getId();

    ClientTransport createClientTransport(TransportDirection direction, CandidateListener candidateListener);

    /**
     * Server-internal transport sending one consumed stream as plain RTP. Never
     * exposed to any client.
     *
     * @param listenIp local address the engine binds to
     */
    CaptureTransport createCaptureTransport(String listenIp);

    boolean isClosed();

    /**
     * Releases the context and every transport created in it. Calling it more
     * than once has no effect.
     */
    void close();
}
