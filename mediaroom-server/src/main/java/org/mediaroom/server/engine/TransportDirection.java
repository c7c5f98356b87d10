package org.mediaroom.server.engine;

import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;

public enum TransportDirection {

    SEND, RECV;

    public static TransportDirection fromString(String direction) {
        if ("send".equalsIgnoreCase(direction)) {
            return SEND;
        } else if ("recv".equalsIgnoreCase(direction) || "receive".equalsIgnoreCase(direction)) {
            return RECV;
        }
        throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Unknown transport direction '" + direction + "'");
    }

    public String getValue() {
        return name().toLowerCase();
    }
}
