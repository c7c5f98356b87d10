package org.mediaroom.server.engine;

import com.google.gson.JsonObject;

public interface EngineProducer {

    String getId();

    MediaKind getKind();

    RtpCodec getCodec();

    JsonObject getRtpParameters();

    boolean isClosed();

    void close();
}
