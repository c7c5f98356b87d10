package org.mediaroom.server.storage;

import org.apache.commons.io.FileUtils;
import org.mediaroom.client.MediaRoomException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * {@link RecordingStorage} backed by a local (or mounted) directory. Files are
 * moved to <code>ARCHIVE_PATH/ROOM_ID/RECORDING_ID/</code>.
 */
public class LocalRecordingStorage implements RecordingStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalRecordingStorage.class);

    private final File archiveRoot;

    public LocalRecordingStorage(String archivePath) {
        this.archiveRoot = new File(archivePath);
    }

    @Override
    public String store(String roomId, String recordingId, File file) throws IOException {
        File targetDir;
        try {
            targetDir = StoragePaths.childOf(StoragePaths.childOf(archiveRoot, roomId), recordingId);
        } catch (MediaRoomException e) {
            throw new IOException("Cannot archive recording " + recordingId + ": " + e.getMessage(), e);
        }
        FileUtils.forceMkdir(targetDir);
        File target = new File(targetDir, file.getName());
        if (target.exists()) {
            FileUtils.forceDelete(target);
        }
        FileUtils.moveFileToDirectory(file, targetDir, true);
        log.info("Recording file {} archived at {}", file.getName(), target.getAbsolutePath());
        return target.getAbsolutePath();
    }

    public File getArchiveRoot() {
        return archiveRoot;
    }
}
