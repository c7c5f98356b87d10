package org.mediaroom.server.engine;

import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;

public enum MediaKind {

    AUDIO("audio"), VIDEO("video");

    private final String value;

    MediaKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MediaKind fromString(String kind) {
        for (MediaKind k : values()) {
            if (k.value.equalsIgnoreCase(kind)) {
                return k;
            }
        }
        throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Unknown media kind '" + kind + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
