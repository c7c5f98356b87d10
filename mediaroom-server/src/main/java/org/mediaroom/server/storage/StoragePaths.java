package org.mediaroom.server.storage;

import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;

import java.io.File;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolution of room and recording names below a storage root.
 */
public final class StoragePaths {

    private StoragePaths() {
    }

    /**
     * @return <code>root/name</code>, normalized
     * @throws MediaRoomException RECORDING_PATH_NOT_VALID if the name is not a
     *                            single path element directly below the root
     */
    public static File childOf(File root, String name) {
        Path rootPath = root.toPath().toAbsolutePath().normalize();
        Path child = null;
        if (name != null && !name.isEmpty()) {
            try {
                child = rootPath.resolve(name).normalize();
            } catch (InvalidPathException e) {
                child = null;
            }
        }
        if (child == null || !rootPath.equals(child.getParent())) {
            throw new MediaRoomException(Code.RECORDING_PATH_NOT_VALID,
                    "'" + name + "' does not name a file directly below " + rootPath);
        }
        return child.toFile();
    }
}
