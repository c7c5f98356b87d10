package org.mediaroom.server.storage;

import java.io.File;
import java.io.IOException;

/**
 * Object store receiving the finished recording files.
 */
public interface RecordingStorage {

    /**
     * Hands one finished file over to the store.
     *
     * @return the location of the stored file
     */
    String store(String roomId, String recordingId, File file) throws IOException;
}
