package org.mediaroom.server.engine;

import com.google.gson.JsonObject;

public interface EngineConsumer {

    String getId();

    String getProducerId();

    MediaKind getKind();

    RtpCodec getCodec();

    JsonObject getRtpParameters();

    void pause();

    void resume();

    boolean isPaused();

    boolean isClosed();

    void close();
}
