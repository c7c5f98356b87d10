package org.mediaroom.server.core;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;
import org.mediaroom.server.engine.FakeMediaEngine.FakeRoutingContext;
import org.mediaroom.server.storage.MetadataStore;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SessionTrackerTest {

    private final MetadataStore metadataStore = mock(MetadataStore.class);
    private final SessionTracker tracker = new SessionTracker(metadataStore, Runnable::run);
    private final Room room = new Room("room1", new FakeRoutingContext(), null);

    @Test
    void sessionIdsHaveTheExpectedShape() {
        assertThat(SessionTracker.generateSessionId()).matches("SESS-\\d+-[a-z0-9]{9}");
        assertThat(SessionTracker.generateSessionId()).isNotEqualTo(SessionTracker.generateSessionId());
    }

    @Test
    void countsActivityUntilTheSessionCloses() {
        Session session = tracker.openSession(room);
        tracker.onParticipantJoined(room);
        JsonObject message = new JsonObject();
        message.addProperty("message", "hi");
        tracker.onMessage("room1", message);
        tracker.onPoll("room1");

        assertThat(room.getSessionId()).isEqualTo(session.getSessionId());
        assertThat(tracker.getSession("room1")).isSameAs(session);

        tracker.closeSession(room).join();

        ArgumentCaptor<JsonObject> flushed = ArgumentCaptor.forClass(JsonObject.class);
        verify(metadataStore).saveSession(flushed.capture());
        JsonObject json = flushed.getValue();
        assertThat(json.get("participants").getAsInt()).isEqualTo(2);
        assertThat(json.get("messages").getAsInt()).isEqualTo(1);
        assertThat(json.get("polls").getAsInt()).isEqualTo(1);
        assertThat(json.getAsJsonArray("chatHistory")).hasSize(1);
        assertThat(json.get("endedAt").getAsLong()).isGreaterThanOrEqualTo(json.get("startedAt").getAsLong());
        assertThat(room.getSessionId()).isNull();
        assertThat(tracker.getSession("room1")).isNull();
    }

    @Test
    void activityOutsideASessionIsIgnored() {
        tracker.onMessage("room1", new JsonObject());
        tracker.onPoll("room1");

        tracker.closeSession(room).join();

        verify(metadataStore, never()).saveSession(any());
    }

    @Test
    void flushFailureDoesNotFailTheClose() {
        doThrow(new IllegalStateException("store down")).when(metadataStore).saveSession(any());
        tracker.openSession(room);

        CompletableFuture<Void> flush = tracker.closeSession(room);

        assertThat(flush).isCompletedWithValue(null);
    }
}
