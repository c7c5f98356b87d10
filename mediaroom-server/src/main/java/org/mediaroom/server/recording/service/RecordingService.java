package org.mediaroom.server.recording.service;

import org.apache.commons.io.FileUtils;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.java.client.RecordingFile;
import org.mediaroom.server.config.MediaRoomConfig;
import org.mediaroom.server.core.Room;
import org.mediaroom.server.engine.CaptureTransport;
import org.mediaroom.server.engine.EngineConsumer;
import org.mediaroom.server.engine.EngineProducer;
import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.recording.CaptureInput;
import org.mediaroom.server.recording.CapturePortAllocator;
import org.mediaroom.server.recording.CaptureSegment;
import org.mediaroom.server.recording.CaptureTarget;
import org.mediaroom.server.recording.RecordingSession;
import org.mediaroom.server.recording.SdpBuilder;
import org.mediaroom.server.recording.process.CaptureProcess;
import org.mediaroom.server.recording.process.CaptureProcessLauncher;
import org.mediaroom.server.recording.process.CaptureRequest;
import org.mediaroom.server.recording.process.ReadinessProbe;
import org.mediaroom.server.storage.StoragePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Capture strategy. Builds capture segments (capture transports, paused
 * consumers and one subprocess) and tears them down again.
 */
public abstract class RecordingService {

    private static final Logger log = LoggerFactory.getLogger(RecordingService.class);

    protected final MediaRoomConfig mediaRoomConfig;
    protected final CaptureProcessLauncher launcher;
    protected final ReadinessProbe readinessProbe;
    protected final CapturePortAllocator portAllocator;
    protected final Executor stopExecutor;

    RecordingService(MediaRoomConfig mediaRoomConfig, CaptureProcessLauncher launcher, ReadinessProbe readinessProbe,
                     CapturePortAllocator portAllocator, Executor stopExecutor) {
        this.mediaRoomConfig = mediaRoomConfig;
        this.launcher = launcher;
        this.readinessProbe = readinessProbe;
        this.portAllocator = portAllocator;
        this.stopExecutor = stopExecutor;
    }

    /**
     * Starts capturing every target. A target whose capture cannot be built is
     * logged and left out.
     *
     * @throws MediaRoomException SUBPROCESS_ERROR_CODE if the recording as a
     *                            whole cannot go on
     */
    public abstract void startRecording(Room room, RecordingSession session, List<CaptureTarget> targets);

    /**
     * Captures producers that appeared after the recording started, in a
     * segment of their own. Existing segments are not touched.
     */
    public void attachProducer(Room room, RecordingSession session, CaptureTarget target) {
        startSegment(room, session, target.getPeerId(), target.getUsername(), Collections.singletonList(target),
                false);
    }

    /**
     * Builds one capture segment for the given targets: allocate ports, open a
     * capture transport and a paused consumer per producer, write the SDP,
     * spawn the subprocess, wait until it listens, connect the transports and
     * finally resume the consumers.
     *
     * @return the segment, or <code>null</code> if no producer could be
     * captured
     */
    protected CaptureSegment startSegment(Room room, RecordingSession session, String peerId, String username,
                                          List<CaptureTarget> targets, boolean composed) {
        int producerCount = targets.stream().mapToInt(t -> t.getProducers().size()).sum();
        if (producerCount == 0) {
            return null;
        }
        File folder = StoragePaths.childOf(new File(mediaRoomConfig.getRecordingPath()), room.getRoomId());
        List<Integer> ports = portAllocator.allocate(producerCount);
        List<Integer> pendingPorts = new ArrayList<>(ports);
        List<CaptureInput> inputs = new ArrayList<>();
        int nextPort = 0;
        for (CaptureTarget target : targets) {
            List<CaptureInput> targetInputs = new ArrayList<>();
            List<String> claimed = new ArrayList<>();
            try {
                for (EngineProducer producer : target.getProducers()) {
                    if (!session.claimProducer(producer.getId())) {
                        continue;
                    }
                    claimed.add(producer.getId());
                    targetInputs.add(openInput(room, session, target, producer, ports.get(nextPort++)));
                }
                inputs.addAll(targetInputs);
            } catch (RuntimeException e) {
                log.error("RECORDING {}: cannot capture peer {}, leaving it out: {}", session.getRecordingId(),
                        target.getPeerId(), e.getMessage());
                closeInputs(session, targetInputs);
                for (CaptureInput input : targetInputs) {
                    pendingPorts.remove(Integer.valueOf(input.getPort()));
                }
                claimed.forEach(session::releaseProducer);
            }
        }
        // ports of opened inputs are released by closeInputs, the rest here
        List<Integer> usedPorts = new ArrayList<>();
        for (CaptureInput input : inputs) {
            usedPorts.add(input.getPort());
        }
        pendingPorts.removeAll(usedPorts);
        portAllocator.release(pendingPorts);
        if (inputs.isEmpty()) {
            return null;
        }

        long now = System.currentTimeMillis();
        String baseName = composed ? session.getRecordingId()
                : safeName(username) + "-" + now + "-" + session.nextSegmentIndex();
        boolean hasVideo = inputs.stream().anyMatch(i -> i.getKind() == MediaKind.VIDEO);
        File outputFile = new File(folder, baseName + (hasVideo ? ".mp4" : ".opus"));
        File sdpFile = new File(folder, baseName + ".sdp");
        String segmentName = session.getRecordingId() + "/" + baseName;

        CaptureProcess process = null;
        try {
            FileUtils.forceMkdir(folder);
            FileUtils.writeStringToFile(sdpFile, SdpBuilder.build(mediaRoomConfig.getRecordingListenIp(), inputs),
                    StandardCharsets.UTF_8);
            int[] resolution = session.getRecordingInfo().getRecordingProperties().resolutionDimensions();
            process = launcher.launch(new CaptureRequest(segmentName, sdpFile, outputFile, inputs, composed,
                    resolution[0], resolution[1]));
            awaitReadiness(process, usedPorts);
            for (CaptureInput input : inputs) {
                input.getTransport().connect(mediaRoomConfig.getRecordingListenIp(), input.getPort());
            }
            for (CaptureInput input : inputs) {
                input.getConsumer().resume();
            }
        } catch (IOException | RuntimeException e) {
            log.error("RECORDING {}: capture segment {} failed to start: {}", session.getRecordingId(), segmentName,
                    e.getMessage());
            if (process != null) {
                process.stop(0, mediaRoomConfig.getRecordingTerminateTimeout());
            }
            closeInputs(session, inputs);
            for (CaptureInput input : inputs) {
                session.releaseProducer(input.getProducerId());
            }
            if (e instanceof MediaRoomException) {
                throw (MediaRoomException) e;
            }
            throw new MediaRoomException(Code.SUBPROCESS_ERROR_CODE,
                    "Capture process for " + segmentName + " could not be started: " + e.getMessage(), e);
        }
        CaptureSegment segment = new CaptureSegment(segmentName, peerId, username, inputs, process, outputFile,
                sdpFile, now);
        session.addSegment(segment);
        log.info("RECORDING {}: capturing {} stream(s) into {}", session.getRecordingId(), inputs.size(),
                outputFile);
        return segment;
    }

    private CaptureInput openInput(Room room, RecordingSession session, CaptureTarget target,
                                   EngineProducer producer, int port) {
        CaptureTransport transport = room.getRoutingContext()
                .createCaptureTransport(mediaRoomConfig.getRecordingListenIp());
        try {
            EngineConsumer consumer = transport.consume(producer, true);
            log.debug("RECORDING {}: consumer {} of producer {} created on capture transport {}",
                    session.getRecordingId(), consumer.getId(), producer.getId(), transport.getId());
            return new CaptureInput(target.getPeerId(), target.getUsername(), producer.getId(), port, transport,
                    consumer);
        } catch (RuntimeException e) {
            transport.close();
            throw e;
        }
    }

    /**
     * Waits for the readiness signal. If it does not come in time the capture
     * goes on anyway.
     */
    private void awaitReadiness(CaptureProcess process, List<Integer> ports) {
        CompletableFuture<Void> ready = readinessProbe.awaitReady(process, mediaRoomConfig.getRecordingListenIp(),
                ports);
        try {
            ready.get(mediaRoomConfig.getRecordingReadinessTimeout(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            ready.cancel(false);
            log.warn("[{}] no readiness signal after {} ms, connecting anyway", process.getName(),
                    mediaRoomConfig.getRecordingReadinessTimeout());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof MediaRoomException) {
                throw (MediaRoomException) e.getCause();
            }
            throw new MediaRoomException(Code.SUBPROCESS_ERROR_CODE, e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ready.cancel(false);
            throw new MediaRoomException(Code.SUBPROCESS_ERROR_CODE, "Interrupted waiting for " + process.getName());
        }
    }

    /**
     * Stop sequence of every segment of the session: pause the consumers, let
     * the last packets drain, stop the subprocesses and only then close the
     * consumers and capture transports.
     */
    public void stopSegments(RecordingSession session) {
        List<CaptureSegment> segments = session.getSegments();
        for (CaptureSegment segment : segments) {
            for (CaptureInput input : segment.getInputs()) {
                try {
                    input.getConsumer().pause();
                } catch (RuntimeException e) {
                    log.warn("RECORDING {}: error pausing consumer {}: {}", session.getRecordingId(),
                            input.getConsumer().getId(), e.getMessage());
                }
            }
        }
        if (!segments.isEmpty() && mediaRoomConfig.getRecordingDrainInterval() > 0) {
            try {
                Thread.sleep(mediaRoomConfig.getRecordingDrainInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        List<CompletableFuture<Void>> stops = new ArrayList<>();
        for (CaptureSegment segment : segments) {
            stops.add(CompletableFuture.runAsync(() -> segment.getProcess().stop(
                    mediaRoomConfig.getRecordingGracefulStopTimeout(),
                    mediaRoomConfig.getRecordingTerminateTimeout()), stopExecutor));
        }
        CompletableFuture.allOf(stops.toArray(new CompletableFuture[0])).join();
        for (CaptureSegment segment : segments) {
            closeInputs(session, segment.getInputs());
        }
    }

    private void closeInputs(RecordingSession session, List<CaptureInput> inputs) {
        List<Integer> ports = new ArrayList<>();
        for (CaptureInput input : inputs) {
            try {
                input.getConsumer().close();
            } catch (RuntimeException e) {
                log.warn("RECORDING {}: error closing consumer {}: {}", session.getRecordingId(),
                        input.getConsumer().getId(), e.getMessage());
            }
            try {
                input.getTransport().close();
            } catch (RuntimeException e) {
                log.warn("RECORDING {}: error closing capture transport {}: {}", session.getRecordingId(),
                        input.getTransport().getId(), e.getMessage());
            }
            ports.add(input.getPort());
        }
        portAllocator.release(ports);
    }

    /**
     * @return the output of the segment, or <code>null</code> if it is missing
     * or too small to be a real capture
     */
    public RecordingFile collectFile(RecordingSession session, CaptureSegment segment, long endedAt) {
        File output = segment.getOutputFile();
        long size = output.isFile() ? output.length() : 0;
        FileUtils.deleteQuietly(segment.getSdpFile());
        if (size < mediaRoomConfig.getRecordingMinFileSize()) {
            log.warn("RECORDING {}: {} is {} bytes, discarded as a failed capture", session.getRecordingId(),
                    output, size);
            FileUtils.deleteQuietly(output);
            return null;
        }
        double duration = Math.max(0, endedAt - segment.getStartedAt()) / 1000.0;
        return new RecordingFile(segment.getPeerId(), segment.getUsername(), output.getName(),
                output.getAbsolutePath(), size, duration, segment.hasVideo());
    }

    static String safeName(String username) {
        String safe = username == null ? "" : username.replaceAll("[^A-Za-z0-9_-]", "_");
        return safe.isEmpty() ? "peer" : safe;
    }
}
