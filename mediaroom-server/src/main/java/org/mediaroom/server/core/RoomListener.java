package org.mediaroom.server.core;

import org.mediaroom.server.engine.EngineProducer;

/**
 * Callbacks fired by {@link RoomManager} outside of any room lock.
 */
public interface RoomListener {

    /**
     * The last peer left the room, or the room was closed by the server.
     */
    default void onRoomEmptied(Room room, EndReason reason) {
    }

    /**
     * A peer started sending a new track.
     */
    default void onProducerAdded(Room room, Peer peer, EngineProducer producer) {
    }
}
