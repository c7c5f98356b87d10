package org.mediaroom.server.recording;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.mediaroom.server.core.RoomManager;
import org.mediaroom.server.recording.service.RecordingManager;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only HTTP surface: finished recordings of a room and a health summary.
 */
@RestController
public class RecordingsRestController {

    private final RoomManager roomManager;
    private final RecordingManager recordingManager;

    public RecordingsRestController(RoomManager roomManager, RecordingManager recordingManager) {
        this.roomManager = roomManager;
        this.recordingManager = recordingManager;
    }

    @GetMapping(value = "/api/recordings/{roomId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> getRecordings(@PathVariable String roomId) {
        JsonArray recordings = new JsonArray();
        for (JsonObject recording : recordingManager.getRecordings(roomId)) {
            recordings.add(recording);
        }
        JsonObject body = new JsonObject();
        body.addProperty("roomId", roomId);
        body.add("recordings", recordings);
        return ResponseEntity.ok(body.toString());
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> health() {
        JsonObject body = new JsonObject();
        body.addProperty("status", "ok");
        body.addProperty("activeRooms", roomManager.getRooms().size());
        body.addProperty("activeRecordings", recordingManager.getActiveRecordings().size());
        return ResponseEntity.ok(body.toString());
    }
}
