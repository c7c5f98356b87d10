package org.mediaroom.server.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Media engine death takes the whole server down. Rooms and recordings cannot
 * outlive their routing contexts.
 */
public class EngineFatalHandler implements EngineFatalListener {

    private static final Logger log = LoggerFactory.getLogger(EngineFatalHandler.class);

    @Override
    public void onEngineFatal(String reason, Throwable cause) {
        log.error("Media engine died: {}. Shutting down MediaRoom Server", reason, cause);
        exit(1);
    }

    protected void exit(int status) {
        System.exit(status);
    }
}
