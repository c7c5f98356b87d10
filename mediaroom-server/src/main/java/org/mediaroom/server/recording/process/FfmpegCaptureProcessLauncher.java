package org.mediaroom.server.recording.process;

import org.mediaroom.server.engine.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Spawns ffmpeg reading RTP as described by the SDP file.
 * <ul>
 * <li>Streams with video are transcoded to H.264/AAC MP4.</li>
 * <li>Audio-only streams are copied into an Ogg Opus file.</li>
 * <li>Composed captures tile every video in a grid and mix every audio.</li>
 * </ul>
 */
public class FfmpegCaptureProcessLauncher implements CaptureProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(FfmpegCaptureProcessLauncher.class);

    private static final List<String> VIDEO_ENCODING = Arrays.asList("-c:v", "libx264", "-preset", "ultrafast",
            "-tune", "zerolatency", "-b:v", "800k", "-c:a", "aac", "-b:a", "128k", "-movflags", "+faststart");

    private final String ffmpegPath;

    public FfmpegCaptureProcessLauncher(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    @Override
    public CaptureProcess launch(CaptureRequest request) throws IOException {
        List<String> command = buildCommand(request);
        log.info("[{}] launching {}", request.getName(), String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
        log.info("[{}] ffmpeg started with pid {}", request.getName(), process.pid());
        return new CaptureProcess(request.getName(), process);
    }

    List<String> buildCommand(CaptureRequest request) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.addAll(Arrays.asList("-hide_banner", "-loglevel", "info"));
        command.addAll(Arrays.asList("-protocol_whitelist", "file,rtp,udp"));
        command.addAll(Arrays.asList("-fflags", "+genpts"));
        command.addAll(Arrays.asList("-i", request.getSdpFile().getAbsolutePath()));
        if (request.isComposed()) {
            addComposedOutput(command, request);
        } else if (request.hasVideo()) {
            command.addAll(Arrays.asList("-map", "0:v?", "-map", "0:a?"));
            command.addAll(VIDEO_ENCODING);
        } else {
            command.addAll(Arrays.asList("-map", "0:a?", "-c:a", "copy"));
        }
        command.add("-y");
        command.add(request.getOutputFile().getAbsolutePath());
        return command;
    }

    private void addComposedOutput(List<String> command, CaptureRequest request) {
        int videos = request.count(MediaKind.VIDEO);
        int audios = request.count(MediaKind.AUDIO);
        List<String> graph = new ArrayList<>();
        if (videos > 0) {
            graph.add(videoGrid(videos, request.getWidth(), request.getHeight()));
        }
        if (audios > 0) {
            graph.add(audioMix(audios));
        }
        command.addAll(Arrays.asList("-filter_complex", String.join(";", graph)));
        if (videos > 0) {
            command.addAll(Arrays.asList("-map", "[vout]"));
        }
        if (audios > 0) {
            command.addAll(Arrays.asList("-map", "[aout]"));
        }
        if (videos > 0) {
            command.addAll(VIDEO_ENCODING);
        } else {
            command.addAll(Arrays.asList("-c:a", "libopus", "-b:a", "128k"));
        }
    }

    /**
     * Scales every video to one tile and stacks the tiles in a grid with as
     * many columns as the square root of the count, rounded up.
     */
    static String videoGrid(int count, int width, int height) {
        if (count == 1) {
            return "[0:v:0]scale=" + width + ":" + height + ",setsar=1[vout]";
        }
        int columns = (int) Math.ceil(Math.sqrt(count));
        int rows = (int) Math.ceil(count / (double) columns);
        int tileWidth = even(width / columns);
        int tileHeight = even(height / rows);
        StringBuilder graph = new StringBuilder();
        StringBuilder stackInputs = new StringBuilder();
        List<String> layout = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            graph.append("[0:v:").append(i).append("]scale=").append(tileWidth).append(':').append(tileHeight)
                    .append(",setsar=1[v").append(i).append("];");
            stackInputs.append("[v").append(i).append(']');
            layout.add((i % columns) * tileWidth + "_" + (i / columns) * tileHeight);
        }
        graph.append(stackInputs).append("xstack=inputs=").append(count).append(":layout=")
                .append(String.join("|", layout)).append(":fill=black[vout]");
        return graph.toString();
    }

    static String audioMix(int count) {
        if (count == 1) {
            return "[0:a:0]anull[aout]";
        }
        StringBuilder graph = new StringBuilder();
        for (int i = 0; i < count; i++) {
            graph.append("[0:a:").append(i).append(']');
        }
        graph.append("amix=inputs=").append(count).append(":duration=longest:dropout_transition=0[aout]");
        return graph.toString();
    }

    private static int even(int value) {
        return value % 2 == 0 ? value : value - 1;
    }
}
