package org.mediaroom.server.storage;

import com.google.gson.JsonObject;

import java.util.List;

/**
 * Durable store for room history and recording metadata.
 */
public interface MetadataStore {

    String ROOM_CREATED = "ROOM_CREATED";
    String ROOM_CLOSED = "ROOM_CLOSED";
    String SETTINGS_UPDATED = "SETTINGS_UPDATED";

    void saveRoomEvent(String roomId, String action, JsonObject details);

    /**
     * Persists a closed occupancy period of a room.
     */
    void saveSession(JsonObject session);

    /**
     * Persists the sidecar metadata document of a finalized recording.
     */
    void saveRecording(JsonObject recordingMetadata);

    /**
     * @return metadata documents of every finalized recording of the room,
     * oldest first
     */
    List<JsonObject> getRecordings(String roomId);
}
