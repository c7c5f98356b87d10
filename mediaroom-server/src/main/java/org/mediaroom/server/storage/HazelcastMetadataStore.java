package org.mediaroom.server.storage;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link MetadataStore} kept in maps of an embedded Hazelcast member. Values
 * are stored as JSON text so that any member can read them without sharing
 * classes.
 */
public class HazelcastMetadataStore implements MetadataStore {

    private static final Logger log = LoggerFactory.getLogger(HazelcastMetadataStore.class);

    public static final String ROOM_EVENTS_MAP = "room-events";
    public static final String SESSIONS_MAP = "sessions";
    public static final String RECORDINGS_MAP = "recordings";

    private final IMap<String, String> roomEvents;
    private final IMap<String, String> sessions;
    private final IMap<String, String> recordings;

    public HazelcastMetadataStore(HazelcastInstance hazelcastInstance) {
        this.roomEvents = hazelcastInstance.getMap(ROOM_EVENTS_MAP);
        this.sessions = hazelcastInstance.getMap(SESSIONS_MAP);
        this.recordings = hazelcastInstance.getMap(RECORDINGS_MAP);
    }

    @Override
    public void saveRoomEvent(String roomId, String action, JsonObject details) {
        JsonObject event = details != null ? details.deepCopy() : new JsonObject();
        event.addProperty("roomId", roomId);
        event.addProperty("action", action);
        event.addProperty("timestamp", System.currentTimeMillis());
        String key = roomId + "/" + System.currentTimeMillis() + "-" + UUID.randomUUID();
        roomEvents.set(key, event.toString());
        log.debug("Room {} event {} stored", roomId, action);
    }

    @Override
    public void saveSession(JsonObject session) {
        String sessionId = session.get("sessionId").getAsString();
        sessions.set(sessionId, session.toString());
        log.info("Session {} of room {} stored", sessionId, session.get("roomId").getAsString());
    }

    @Override
    public void saveRecording(JsonObject recordingMetadata) {
        String roomId = recordingMetadata.get("roomId").getAsString();
        String recordingId = recordingMetadata.get("recordingId").getAsString();
        recordings.set(roomId + "/" + recordingId, recordingMetadata.toString());
        log.info("Metadata of recording {} stored", recordingId);
    }

    @Override
    public List<JsonObject> getRecordings(String roomId) {
        String prefix = roomId + "/";
        List<JsonObject> result = new ArrayList<>();
        for (Map.Entry<String, String> entry : recordings.entrySet()) {
            if (entry.getKey().startsWith(prefix)) {
                result.add(JsonParser.parseString(entry.getValue()).getAsJsonObject());
            }
        }
        result.sort(Comparator.comparingLong(json -> json.get("startedAt").getAsLong()));
        return result;
    }

    public JsonObject getSession(String sessionId) {
        String json = sessions.get(sessionId);
        return json != null ? JsonParser.parseString(json).getAsJsonObject() : null;
    }
}
