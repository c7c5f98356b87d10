package org.mediaroom.server.recording;

import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.recording.process.CaptureProcess;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One capture subprocess and the streams it receives. A per-peer recording
 * has one segment per peer plus one per late producer; a composed recording
 * has one segment for the whole room.
 */
public class CaptureSegment {

    private final String name;
    private final String peerId;
    private final String username;
    private final List<CaptureInput> inputs;
    private final CaptureProcess process;
    private final File outputFile;
    private final File sdpFile;
    private final long startedAt;

    public CaptureSegment(String name, String peerId, String username, List<CaptureInput> inputs,
                          CaptureProcess process, File outputFile, File sdpFile, long startedAt) {
        this.name = name;
        this.peerId = peerId;
        this.username = username;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.process = process;
        this.outputFile = outputFile;
        this.sdpFile = sdpFile;
        this.startedAt = startedAt;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the captured peer, or <code>null</code> for a composed segment
     */
    public String getPeerId() {
        return peerId;
    }

    public String getUsername() {
        return username;
    }

    public List<CaptureInput> getInputs() {
        return inputs;
    }

    public CaptureProcess getProcess() {
        return process;
    }

    public File getOutputFile() {
        return outputFile;
    }

    public File getSdpFile() {
        return sdpFile;
    }

    public long getStartedAt() {
        return startedAt;
    }

    public boolean hasVideo() {
        return inputs.stream().anyMatch(i -> i.getKind() == MediaKind.VIDEO);
    }

    public List<Integer> getPorts() {
        List<Integer> ports = new ArrayList<>();
        for (CaptureInput input : inputs) {
            ports.add(input.getPort());
        }
        return ports;
    }

    @Override
    public String toString() {
        return "[name=" + name + ", peerId=" + peerId + ", inputs=" + inputs + ", output=" + outputFile + "]";
    }
}
