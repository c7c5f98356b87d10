package org.mediaroom.server.recording.process;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;

/**
 * Tells when a capture subprocess is listening on its receive ports, so the
 * engine is not told to send RTP before anyone can receive it.
 */
public interface ReadinessProbe {

    /**
     * @return a future completed when every port is bound by the subprocess,
     * and completed exceptionally if the subprocess exits first. Cancelling it
     * stops probing.
     */
    CompletableFuture<Void> awaitReady(CaptureProcess process, String ip, Collection<Integer> ports);
}
