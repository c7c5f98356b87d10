package org.mediaroom.server.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One continuous occupancy period of a room.
 */
public class Session {

    private final String sessionId;
    private final String roomId;
    private final long startedAt;
    private volatile long endedAt;

    private final AtomicInteger messages = new AtomicInteger();
    private final AtomicInteger polls = new AtomicInteger();
    private final AtomicInteger participants = new AtomicInteger();

    private final List<JsonObject> chatHistory = new ArrayList<>();

    public Session(String sessionId, String roomId, long startedAt) {
        this.sessionId = sessionId;
        this.roomId = roomId;
        this.startedAt = startedAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getRoomId() {
        return roomId;
    }

    public long getStartedAt() {
        return startedAt;
    }

    public long getEndedAt() {
        return endedAt;
    }

    public boolean isClosed() {
        return endedAt > 0;
    }

    void close(long endedAt) {
        this.endedAt = endedAt;
    }

    void participantJoined() {
        participants.incrementAndGet();
    }

    void messageSent(JsonObject message) {
        messages.incrementAndGet();
        synchronized (chatHistory) {
            chatHistory.add(message);
        }
    }

    void pollCreated() {
        polls.incrementAndGet();
    }

    public int getMessages() {
        return messages.get();
    }

    public int getPolls() {
        return polls.get();
    }

    public int getParticipants() {
        return participants.get();
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("sessionId", sessionId);
        json.addProperty("roomId", roomId);
        json.addProperty("startedAt", startedAt);
        json.addProperty("endedAt", endedAt);
        json.addProperty("duration", endedAt > 0 ? endedAt - startedAt : 0);
        json.addProperty("messages", messages.get());
        json.addProperty("polls", polls.get());
        json.addProperty("participants", participants.get());
        JsonArray history = new JsonArray();
        synchronized (chatHistory) {
            for (JsonObject message : chatHistory) {
                history.add(message);
            }
        }
        json.add("chatHistory", history);
        return json;
    }
}
