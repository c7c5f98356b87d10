package org.mediaroom.server.engine;

public interface EngineTransport {

    String getId();

    boolean isClosed();

    void close();
}
