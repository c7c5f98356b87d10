package org.mediaroom.server.engine;

public interface EngineFatalListener {

    void onEngineFatal(String reason, Throwable cause);
}
