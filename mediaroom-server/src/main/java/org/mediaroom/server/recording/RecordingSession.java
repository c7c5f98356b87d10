package org.mediaroom.server.recording;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.mediaroom.java.client.RecordingInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of the recording of one room. Its life cycle is observed through two
 * futures: {@link #getActivation()} completes once capture is running (or
 * fails if the start was aborted) and {@link #getFinalization()} completes with
 * the sealed {@link RecordingInfo} once every file has been collected.
 */
public class RecordingSession {

    private static final Logger log = LoggerFactory.getLogger(RecordingSession.class);

    private final RecordingInfo recordingInfo;

    private volatile RecordingState state = RecordingState.IDLE;

    private final CompletableFuture<RecordingInfo> activation = new CompletableFuture<>();
    private final CompletableFuture<RecordingInfo> finalization = new CompletableFuture<>();

    private final List<CaptureSegment> segments = new CopyOnWriteArrayList<>();
    private final Set<String> capturedProducers = ConcurrentHashMap.newKeySet();
    private final AtomicInteger segmentCounter = new AtomicInteger();
    private final JsonArray transcripts = new JsonArray();

    public RecordingSession(RecordingInfo recordingInfo) {
        this.recordingInfo = recordingInfo;
    }

    public String getRecordingId() {
        return recordingInfo.getId();
    }

    public String getRoomId() {
        return recordingInfo.getRoomId();
    }

    public RecordingInfo getRecordingInfo() {
        return recordingInfo;
    }

    public RecordingState getState() {
        return state;
    }

    /**
     * @return false if the session is already past the requested state
     */
    public synchronized boolean moveTo(RecordingState next) {
        if (!state.canMoveTo(next)) {
            return false;
        }
        log.info("RECORDING {}: {} -> {}", getRecordingId(), state, next);
        state = next;
        return true;
    }

    public CompletableFuture<RecordingInfo> getActivation() {
        return activation;
    }

    public CompletableFuture<RecordingInfo> getFinalization() {
        return finalization;
    }

    /**
     * Marks the producer as captured.
     *
     * @return false if it already was
     */
    public boolean claimProducer(String producerId) {
        return capturedProducers.add(producerId);
    }

    public void releaseProducer(String producerId) {
        capturedProducers.remove(producerId);
    }

    public boolean isCaptured(String producerId) {
        return capturedProducers.contains(producerId);
    }

    public void addSegment(CaptureSegment segment) {
        segments.add(segment);
    }

    /**
     * @return a number unique within this recording, used to name segment files
     */
    public int nextSegmentIndex() {
        return segmentCounter.incrementAndGet();
    }

    public List<CaptureSegment> getSegments() {
        return new ArrayList<>(segments);
    }

    public void addTranscript(String peerId, String username, String text) {
        JsonObject entry = new JsonObject();
        entry.addProperty("peerId", peerId);
        entry.addProperty("username", username);
        entry.addProperty("text", text);
        entry.addProperty("timestamp", System.currentTimeMillis());
        synchronized (transcripts) {
            transcripts.add(entry);
        }
    }

    public JsonArray getTranscripts() {
        synchronized (transcripts) {
            return transcripts.deepCopy();
        }
    }

    /**
     * @return the metadata document: recording info plus transcripts
     */
    public JsonObject toMetadataJson() {
        JsonObject json = recordingInfo.toJson();
        json.add("transcripts", getTranscripts());
        return json;
    }

    @Override
    public String toString() {
        return "[recordingId=" + getRecordingId() + ", roomId=" + getRoomId() + ", state=" + state + ", segments="
                + segments.size() + "]";
    }
}
