package org.mediaroom.server.recording.process;

import java.io.IOException;

public interface CaptureProcessLauncher {

    /**
     * Spawns the subprocess. It returns as soon as the process exists, before
     * it is ready to receive media.
     */
    CaptureProcess launch(CaptureRequest request) throws IOException;
}
