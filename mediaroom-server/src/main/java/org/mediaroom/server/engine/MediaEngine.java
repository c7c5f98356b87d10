package org.mediaroom.server.engine;

import java.util.List;

/**
 * Media routing engine. Creates the routing contexts rooms interconnect their
 * peers through.
 */
public interface MediaEngine {

    /**
     * @return every codec the engine is able to route
     */
    List<RtpCodec> getSupportedCodecs();

    /**
     * Builds a new routing context. Blocks until the engine confirms it.
     *
     * @throws org.mediaroom.client.MediaRoomException with code
     *                                                 RESOURCE_EXHAUSTED_ERROR_CODE
     *                                                 if the engine cannot allocate it
     */
    RoutingContext createRoutingContext();

    void addFatalListener(EngineFatalListener listener);

    void close();
}
