package org.mediaroom.server.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;

import java.io.File;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoragePathsTest {

    @TempDir
    File tempDir;

    @Test
    void plainNameResolvesDirectlyBelowTheRoot() {
        File root = new File(tempDir, "recordings");

        File child = StoragePaths.childOf(root, "room-1");

        assertThat(child.getParentFile()).isEqualTo(root.getAbsoluteFile());
        assertThat(child.getName()).isEqualTo("room-1");
    }

    @Test
    void namesLeavingTheRootAreRejected() {
        File root = new File(tempDir, "recordings");
        String outside = new File(tempDir, "elsewhere").getAbsolutePath();

        for (String name : new String[]{"../x", "a/b", "..", ".", "", null, outside}) {
            assertThatThrownBy(() -> StoragePaths.childOf(root, name))
                    .as(String.valueOf(name))
                    .isInstanceOf(MediaRoomException.class)
                    .extracting(e -> ((MediaRoomException) e).getCode())
                    .isEqualTo(Code.RECORDING_PATH_NOT_VALID);
        }
    }
}
