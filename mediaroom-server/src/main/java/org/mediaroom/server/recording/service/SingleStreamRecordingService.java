package org.mediaroom.server.recording.service;

import org.mediaroom.client.MediaRoomException;
import org.mediaroom.server.config.MediaRoomConfig;
import org.mediaroom.server.core.Room;
import org.mediaroom.server.recording.CapturePortAllocator;
import org.mediaroom.server.recording.CaptureTarget;
import org.mediaroom.server.recording.RecordingSession;
import org.mediaroom.server.recording.process.CaptureProcessLauncher;
import org.mediaroom.server.recording.process.ReadinessProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * INDIVIDUAL output mode: one subprocess and one file per peer.
 */
public class SingleStreamRecordingService extends RecordingService {

    private static final Logger log = LoggerFactory.getLogger(SingleStreamRecordingService.class);

    public SingleStreamRecordingService(MediaRoomConfig mediaRoomConfig, CaptureProcessLauncher launcher,
                                        ReadinessProbe readinessProbe, CapturePortAllocator portAllocator,
                                        Executor stopExecutor) {
        super(mediaRoomConfig, launcher, readinessProbe, portAllocator, stopExecutor);
    }

    @Override
    public void startRecording(Room room, RecordingSession session, List<CaptureTarget> targets) {
        int started = 0;
        for (CaptureTarget target : targets) {
            try {
                if (startSegment(room, session, target.getPeerId(), target.getUsername(),
                        Collections.singletonList(target), false) != null) {
                    started++;
                }
            } catch (MediaRoomException e) {
                log.error("RECORDING {}: peer {} will not be recorded: {}", session.getRecordingId(),
                        target.getPeerId(), e.getMessage());
            }
        }
        log.info("RECORDING {}: {} of {} peers being recorded individually", session.getRecordingId(), started,
                targets.size());
    }
}
