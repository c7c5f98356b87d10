package org.mediaroom.server.recording.service;

import com.google.gson.JsonObject;
import org.apache.commons.io.FileUtils;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.java.client.RecordingFile;
import org.mediaroom.java.client.RecordingInfo;
import org.mediaroom.java.client.RecordingProperties;
import org.mediaroom.server.config.MediaRoomConfig;
import org.mediaroom.server.core.EndReason;
import org.mediaroom.server.core.Peer;
import org.mediaroom.server.core.Room;
import org.mediaroom.server.core.RoomEventsHandler;
import org.mediaroom.server.core.RoomListener;
import org.mediaroom.server.core.RoomManager;
import org.mediaroom.server.engine.EngineProducer;
import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.recording.CaptureSegment;
import org.mediaroom.server.recording.CaptureTarget;
import org.mediaroom.server.recording.RecordingSession;
import org.mediaroom.server.recording.RecordingState;
import org.mediaroom.server.storage.MetadataStore;
import org.mediaroom.server.storage.RecordingStorage;
import org.mediaroom.server.storage.StoragePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Entry point of the recording module. At most one recording per room and at
 * most <code>mediaroom.recording.max-concurrent</code> recordings overall.
 */
public class RecordingManager implements RoomListener {

    private static final Logger log = LoggerFactory.getLogger(RecordingManager.class);

    public static final String METADATA_FILE_SUFFIX = "-metadata.json";

    private final MediaRoomConfig mediaRoomConfig;
    private final RoomManager roomManager;
    private final RoomEventsHandler roomEventsHandler;
    private final MetadataStore metadataStore;
    private final RecordingStorage recordingStorage;
    private final RecordingService singleStreamRecordingService;
    private final RecordingService composedRecordingService;
    private final Executor recordingExecutor;

    private final ConcurrentMap<String, RecordingSession> sessionsRecordings = new ConcurrentHashMap<>();
    private final Semaphore recordingSlots;

    public RecordingManager(MediaRoomConfig mediaRoomConfig, RoomManager roomManager,
                            RoomEventsHandler roomEventsHandler, MetadataStore metadataStore,
                            RecordingStorage recordingStorage, RecordingService singleStreamRecordingService,
                            RecordingService composedRecordingService, Executor recordingExecutor) {
        this.mediaRoomConfig = mediaRoomConfig;
        this.roomManager = roomManager;
        this.roomEventsHandler = roomEventsHandler;
        this.metadataStore = metadataStore;
        this.recordingStorage = recordingStorage;
        this.singleStreamRecordingService = singleStreamRecordingService;
        this.composedRecordingService = composedRecordingService;
        this.recordingExecutor = recordingExecutor;
        this.recordingSlots = new Semaphore(mediaRoomConfig.getRecordingMaxConcurrent());
    }

    /**
     * Checks the recording path and starts listening to room events.
     *
     * @throws MediaRoomException RECORDING_PATH_NOT_VALID
     */
    public void initializeRecordingManager() throws MediaRoomException {
        this.checkRecordingPath(mediaRoomConfig.getRecordingPath());
        roomManager.addListener(this);
        log.info("Recording module ready: default mode {}, at most {} concurrent recordings",
                mediaRoomConfig.getRecordingOutputMode(), mediaRoomConfig.getRecordingMaxConcurrent());
    }

    private void checkRecordingPath(String recordingPath) throws MediaRoomException {
        log.info("Initializing recording path");
        Path path;
        try {
            path = Files.createDirectories(Paths.get(recordingPath));
        } catch (IOException e) {
            String errorMessage = "The recording path \"" + recordingPath
                    + "\" is not valid. Reason: MediaRoom Server cannot find path \"" + recordingPath
                    + "\" and doesn't have permissions to create it";
            log.error(errorMessage);
            throw new MediaRoomException(Code.RECORDING_PATH_NOT_VALID, errorMessage);
        }
        if (!Files.isWritable(path)) {
            String errorMessage = "The recording path \"" + recordingPath
                    + "\" is not valid. Reason: MediaRoom Server needs write permissions on it";
            log.error(errorMessage);
            throw new MediaRoomException(Code.RECORDING_PATH_NOT_VALID, errorMessage);
        }
        log.info("Recording path successfully initialized at {}", recordingPath);
    }

    /**
     * Starts recording every non-recorder peer of the room that has producers.
     * Returns once capture is running.
     *
     * @param initiatorPeerId <code>null</code> when started by the server
     */
    public RecordingInfo startRecording(String roomId, String initiatorPeerId, RecordingProperties properties) {
        Room room = roomManager.getRoom(roomId);
        String startedBy = startedBy(room, initiatorPeerId);
        String recordingId = roomId + "-" + System.currentTimeMillis();
        RecordingInfo recordingInfo = new RecordingInfo(roomId, recordingId, startedBy, properties);
        RecordingSession session = new RecordingSession(recordingInfo);

        RecordingSession existing = sessionsRecordings.putIfAbsent(roomId, session);
        if (existing != null) {
            throw new MediaRoomException(Code.ALREADY_RECORDING_ERROR_CODE,
                    "Room '" + roomId + "' is already being recorded (" + existing.getRecordingId() + ")");
        }
        if (!recordingSlots.tryAcquire()) {
            sessionsRecordings.remove(roomId, session);
            throw new MediaRoomException(Code.CAPACITY_EXCEEDED_ERROR_CODE,
                    "Maximum of " + mediaRoomConfig.getRecordingMaxConcurrent() + " concurrent recordings reached");
        }
        session.moveTo(RecordingState.STARTING);
        log.info("RECORDING {}: starting in room {} ({} mode), requested by {}", recordingId, roomId,
                properties.outputMode(), startedBy);

        try {
            List<CaptureTarget> targets = captureTargets(room, properties);
            getRecordingService(properties.outputMode()).startRecording(room, session, targets);
        } catch (RuntimeException e) {
            MediaRoomException error = e instanceof MediaRoomException ? (MediaRoomException) e
                    : new MediaRoomException(Code.SUBPROCESS_ERROR_CODE, e.getMessage(), e);
            throw failStartRecording(session, error);
        }

        session.moveTo(RecordingState.ACTIVE);
        recordingInfo.setStatus(RecordingInfo.Status.started);
        room.setActiveRecordingId(recordingId);
        generateRecordingMetadataFile(session);
        session.getActivation().complete(recordingInfo);
        roomEventsHandler.sendRecordingStartedNotification(room, recordingInfo);
        return recordingInfo;
    }

    /**
     * Aborts a start that cannot go on and runs a clean stop of whatever was
     * already captured.
     */
    private MediaRoomException failStartRecording(RecordingSession session, MediaRoomException error) {
        log.error("RECORDING {}: start failed: {}", session.getRecordingId(), error.getMessage());
        session.getRecordingInfo().setStatus(RecordingInfo.Status.failed);
        session.getActivation().completeExceptionally(error);
        try {
            finalizeRecording(session, EndReason.recordingSubprocessFailed);
        } catch (MediaRoomException e) {
            log.error("RECORDING {}: error cleaning up failed start: {}", session.getRecordingId(), e.getMessage());
        }
        return error;
    }

    private String startedBy(Room room, String initiatorPeerId) {
        if (initiatorPeerId == null) {
            return "server";
        }
        try {
            return room.getPeer(initiatorPeerId).getUsername();
        } catch (MediaRoomException e) {
            return initiatorPeerId;
        }
    }

    /**
     * Snapshot of what to capture, taken under the room lock. Recorder peers
     * and peers without producers are left out.
     */
    private List<CaptureTarget> captureTargets(Room room, RecordingProperties properties) {
        List<CaptureTarget> targets = new ArrayList<>();
        synchronized (room.getLock()) {
            for (Peer peer : room.getPeers()) {
                if (peer.isRecorder()) {
                    continue;
                }
                List<EngineProducer> producers = new ArrayList<>();
                for (EngineProducer producer : peer.getProducers()) {
                    if (isRecordable(producer, properties)) {
                        producers.add(producer);
                    }
                }
                if (producers.isEmpty()) {
                    log.debug("ROOM {}: peer {} has no producers, not recorded", room.getRoomId(), peer.getPeerId());
                    continue;
                }
                targets.add(new CaptureTarget(peer.getPeerId(), peer.getUsername(), producers));
            }
        }
        return targets;
    }

    private boolean isRecordable(EngineProducer producer, RecordingProperties properties) {
        if (producer.isClosed()) {
            return false;
        }
        return producer.getKind() == MediaKind.AUDIO ? properties.hasAudio() : properties.hasVideo();
    }

    /**
     * Stops the recording of the room and waits until its files are collected.
     * A stop racing with another one returns the same result.
     */
    public RecordingInfo stopRecording(String roomId, EndReason reason) {
        RecordingSession session = sessionsRecordings.get(roomId);
        if (session == null) {
            throw new MediaRoomException(Code.NOT_RECORDING_ERROR_CODE, "Room '" + roomId + "' is not being recorded");
        }
        try {
            session.getActivation().join();
        } catch (CompletionException e) {
            log.debug("RECORDING {}: start had failed, waiting for its cleanup", session.getRecordingId());
        }
        return finalizeRecording(session, reason);
    }

    private RecordingInfo finalizeRecording(RecordingSession session, EndReason reason) {
        boolean wasActive = session.getState() == RecordingState.ACTIVE;
        if (!session.moveTo(RecordingState.STOPPING)) {
            return awaitFinalization(session);
        }
        String roomId = session.getRoomId();
        RecordingInfo recordingInfo = session.getRecordingInfo();
        log.info("RECORDING {}: stopping ({})", session.getRecordingId(), reason);
        try {
            RecordingService service = getRecordingService(recordingInfo.getOutputMode());
            service.stopSegments(session);
            long endedAt = System.currentTimeMillis();
            recordingInfo.setEndedAt(endedAt);
            for (CaptureSegment segment : session.getSegments()) {
                RecordingFile file = service.collectFile(session, segment, endedAt);
                if (file != null) {
                    archive(session, file);
                    recordingInfo.addFile(file);
                }
            }
            if (!RecordingInfo.Status.failed.equals(recordingInfo.getStatus())) {
                recordingInfo.setStatus(RecordingInfo.Status.stopped);
            }
            sealRecordingMetadataFile(session);
            session.getFinalization().complete(recordingInfo);
        } catch (RuntimeException e) {
            log.error("RECORDING {}: error while stopping", session.getRecordingId(), e);
            recordingInfo.setStatus(RecordingInfo.Status.failed);
            session.getFinalization().completeExceptionally(e);
            throw e;
        } finally {
            cleanRecordingMaps(session);
            session.moveTo(RecordingState.FINALIZED);
        }
        log.info("RECORDING {}: finalized with {} file(s), {} bytes", session.getRecordingId(),
                recordingInfo.getFiles().size(), recordingInfo.getSize());

        Room room = roomManager.findRoom(roomId);
        if (room != null && wasActive) {
            roomEventsHandler.sendRecordingStoppedNotification(room, recordingInfo, reason);
        }
        return recordingInfo;
    }

    private RecordingInfo awaitFinalization(RecordingSession session) {
        try {
            return session.getFinalization().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof MediaRoomException) {
                throw (MediaRoomException) e.getCause();
            }
            throw new MediaRoomException(Code.GENERIC_ERROR_CODE, "Recording " + session.getRecordingId()
                    + " failed to stop", e.getCause());
        }
    }

    private void archive(RecordingSession session, RecordingFile file) {
        try {
            String location = recordingStorage.store(session.getRoomId(), session.getRecordingId(),
                    new File(file.getPath()));
            file.setPath(location);
        } catch (IOException e) {
            log.error("RECORDING {}: could not archive {}, keeping it at {}: {}", session.getRecordingId(),
                    file.getFile(), file.getPath(), e.getMessage());
        }
    }

    private void cleanRecordingMaps(RecordingSession session) {
        if (sessionsRecordings.remove(session.getRoomId(), session)) {
            recordingSlots.release();
        }
        Room room = roomManager.findRoom(session.getRoomId());
        if (room != null && session.getRecordingId().equals(room.getActiveRecordingId())) {
            room.setActiveRecordingId(null);
        }
    }

    /**
     * Captures a producer that appeared while the room is being recorded.
     * Runs asynchronously; existing captures are left untouched.
     */
    @Override
    public void onProducerAdded(Room room, Peer peer, EngineProducer producer) {
        RecordingSession session = sessionsRecordings.get(room.getRoomId());
        if (session == null || peer.isRecorder()) {
            return;
        }
        CompletableFuture.runAsync(() -> attachProducer(room, session, peer, producer), recordingExecutor)
                .exceptionally(t -> {
                    log.error("RECORDING {}: could not attach producer {} of peer {}", session.getRecordingId(),
                            producer.getId(), peer.getPeerId(), t);
                    return null;
                });
    }

    private void attachProducer(Room room, RecordingSession session, Peer peer, EngineProducer producer) {
        try {
            session.getActivation().join();
        } catch (CompletionException e) {
            return;
        }
        RecordingProperties properties = session.getRecordingInfo().getRecordingProperties();
        if (!isRecordable(producer, properties)) {
            return;
        }
        synchronized (session) {
            if (session.getState() != RecordingState.ACTIVE || session.isCaptured(producer.getId())) {
                return;
            }
            log.info("RECORDING {}: attaching late producer {} of peer {}", session.getRecordingId(),
                    producer.getId(), peer.getPeerId());
            getRecordingService(properties.outputMode()).attachProducer(room, session,
                    new CaptureTarget(peer.getPeerId(), peer.getUsername(), Collections.singletonList(producer)));
        }
    }

    /**
     * The last peer left: stop the recording of the room, if any.
     */
    @Override
    public void onRoomEmptied(Room room, EndReason reason) {
        if (!sessionsRecordings.containsKey(room.getRoomId())) {
            return;
        }
        log.info("ROOM {}: emptied while being recorded, stopping the recording", room.getRoomId());
        CompletableFuture.runAsync(() -> {
            try {
                stopRecording(room.getRoomId(), EndReason.automaticStop);
            } catch (MediaRoomException e) {
                if (e.getCode() != Code.NOT_RECORDING_ERROR_CODE) {
                    throw e;
                }
            }
        }, recordingExecutor).exceptionally(t -> {
            log.error("ROOM {}: automatic recording stop failed", room.getRoomId(), t);
            return null;
        });
    }

    /**
     * Adds a final transcript line to the metadata of the running recording.
     */
    public void appendTranscript(String roomId, String peerId, String text) {
        RecordingSession session = sessionsRecordings.get(roomId);
        if (session == null) {
            throw new MediaRoomException(Code.NOT_RECORDING_ERROR_CODE, "Room '" + roomId + "' is not being recorded");
        }
        if (text == null || text.trim().isEmpty()) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Empty transcript");
        }
        String username = roomManager.getRoom(roomId).getPeer(peerId).getUsername();
        session.addTranscript(peerId, username, text);
    }

    /**
     * Generates the metadata sidecar of the recording
     * (<code>&lt;recordingId&gt;-metadata.json</code> next to its files).
     */
    protected void generateRecordingMetadataFile(RecordingSession session) {
        File file = getMetadataFile(session);
        try {
            FileUtils.writeStringToFile(file, session.toMetadataJson().toString(), StandardCharsets.UTF_8);
            log.info("Generated recording metadata file at {}", file);
        } catch (IOException e) {
            log.error("RECORDING {}: could not write metadata file {}: {}", session.getRecordingId(), file,
                    e.getMessage());
        }
    }

    /**
     * Overwrites the metadata sidecar with the final values and hands the
     * document to the metadata store.
     */
    protected void sealRecordingMetadataFile(RecordingSession session) {
        JsonObject metadata = session.toMetadataJson();
        File file = getMetadataFile(session);
        try {
            FileUtils.writeStringToFile(file, metadata.toString(), StandardCharsets.UTF_8);
            log.info("Sealed recording metadata file at {}", file);
        } catch (IOException e) {
            log.error("RECORDING {}: could not seal metadata file {}: {}", session.getRecordingId(), file,
                    e.getMessage());
        }
        try {
            metadataStore.saveRecording(metadata);
        } catch (RuntimeException e) {
            log.error("RECORDING {}: could not save metadata: {}", session.getRecordingId(), e.getMessage());
        }
    }

    public File getMetadataFile(RecordingSession session) {
        File roomFolder = StoragePaths.childOf(new File(mediaRoomConfig.getRecordingPath()), session.getRoomId());
        return StoragePaths.childOf(roomFolder, session.getRecordingId() + METADATA_FILE_SUFFIX);
    }

    private RecordingService getRecordingService(RecordingInfo.OutputMode outputMode) {
        return RecordingInfo.OutputMode.COMPOSED.equals(outputMode) ? composedRecordingService
                : singleStreamRecordingService;
    }

    public boolean isRecording(String roomId) {
        return sessionsRecordings.containsKey(roomId);
    }

    public RecordingSession getRecordingSession(String roomId) {
        return sessionsRecordings.get(roomId);
    }

    public Collection<RecordingInfo> getActiveRecordings() {
        List<RecordingInfo> recordings = new ArrayList<>();
        for (RecordingSession session : sessionsRecordings.values()) {
            recordings.add(session.getRecordingInfo());
        }
        return recordings;
    }

    public List<JsonObject> getRecordings(String roomId) {
        return metadataStore.getRecordings(roomId);
    }

    @PreDestroy
    public void close() {
        for (String roomId : new ArrayList<>(sessionsRecordings.keySet())) {
            try {
                stopRecording(roomId, EndReason.mediaRoomServerStopped);
            } catch (MediaRoomException e) {
                log.warn("ROOM {}: error stopping recording on shutdown: {}", roomId, e.getMessage());
            }
        }
    }
}
