package org.mediaroom.server.recording.process;

import org.mediaroom.server.engine.MediaKind;
import org.mediaroom.server.recording.CaptureInput;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a capture subprocess is asked to do: read the streams declared in the
 * SDP file and write them to the output file, side by side when composed.
 */
public class CaptureRequest {

    private final String name;
    private final File sdpFile;
    private final File outputFile;
    private final List<CaptureInput> inputs;
    private final boolean composed;
    private final int width;
    private final int height;

    public CaptureRequest(String name, File sdpFile, File outputFile, List<CaptureInput> inputs, boolean composed,
                          int width, int height) {
        this.name = name;
        this.sdpFile = sdpFile;
        this.outputFile = outputFile;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.composed = composed;
        this.width = width;
        this.height = height;
    }

    public String getName() {
        return name;
    }

    public File getSdpFile() {
        return sdpFile;
    }

    public File getOutputFile() {
        return outputFile;
    }

    public List<CaptureInput> getInputs() {
        return inputs;
    }

    public boolean isComposed() {
        return composed;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int count(MediaKind kind) {
        return (int) inputs.stream().filter(i -> i.getKind() == kind).count();
    }

    public boolean hasVideo() {
        return count(MediaKind.VIDEO) > 0;
    }
}
