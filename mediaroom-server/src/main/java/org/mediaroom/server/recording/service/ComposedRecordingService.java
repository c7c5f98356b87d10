package org.mediaroom.server.recording.service;

import org.mediaroom.client.MediaRoomException;
import org.mediaroom.server.config.MediaRoomConfig;
import org.mediaroom.server.core.Room;
import org.mediaroom.server.recording.CapturePortAllocator;
import org.mediaroom.server.recording.CaptureSegment;
import org.mediaroom.server.recording.CaptureTarget;
import org.mediaroom.server.recording.RecordingSession;
import org.mediaroom.server.recording.process.CaptureProcessLauncher;
import org.mediaroom.server.recording.process.ReadinessProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * COMPOSED output mode: a single subprocess mixing every audio and tiling
 * every video into one file. Every capture port is declared up front in the
 * SDP, so producers arriving later are captured in separate segments.
 */
public class ComposedRecordingService extends RecordingService {

    private static final Logger log = LoggerFactory.getLogger(ComposedRecordingService.class);

    static final String COMPOSED_USERNAME = "composed";

    public ComposedRecordingService(MediaRoomConfig mediaRoomConfig, CaptureProcessLauncher launcher,
                                    ReadinessProbe readinessProbe, CapturePortAllocator portAllocator,
                                    Executor stopExecutor) {
        super(mediaRoomConfig, launcher, readinessProbe, portAllocator, stopExecutor);
    }

    /**
     * @throws MediaRoomException SUBPROCESS_ERROR_CODE if the only subprocess
     *                            cannot be started
     */
    @Override
    public void startRecording(Room room, RecordingSession session, List<CaptureTarget> targets) {
        CaptureSegment segment = startSegment(room, session, null, COMPOSED_USERNAME, targets, true);
        if (segment == null) {
            log.warn("RECORDING {}: nothing to compose yet, waiting for producers", session.getRecordingId());
        } else {
            log.info("RECORDING {}: composing {} stream(s) of {} peers", session.getRecordingId(),
                    segment.getInputs().size(), targets.size());
        }
    }
}
