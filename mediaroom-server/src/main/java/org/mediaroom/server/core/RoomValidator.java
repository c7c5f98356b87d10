package org.mediaroom.server.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.client.internal.ProtocolElements;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

final class RoomValidator {

    static final int ROOM_ID_MAX_LENGTH = 100;
    static final int USERNAME_MIN_LENGTH = 2;
    static final int USERNAME_MAX_LENGTH = 20;
    static final int POLL_MIN_OPTIONS = 2;

    private static final Pattern ROOM_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1," + ROOM_ID_MAX_LENGTH + "}");

    private RoomValidator() {
    }

    static void validateRoomId(String roomId) {
        if (roomId == null || !ROOM_ID_PATTERN.matcher(roomId).matches()) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Room id must be 1 to " + ROOM_ID_MAX_LENGTH
                    + " letters, digits, '-' or '_'");
        }
    }

    /**
     * @return the name the peer joins with
     */
    static String validateUsername(String username, boolean recorder) {
        if (recorder && (username == null || username.isEmpty())) {
            return ProtocolElements.RECORDER_USERNAME;
        }
        if (username == null || username.length() < USERNAME_MIN_LENGTH || username.length() > USERNAME_MAX_LENGTH) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Username must be between "
                    + USERNAME_MIN_LENGTH + " and " + USERNAME_MAX_LENGTH + " characters");
        }
        return username;
    }

    /**
     * @return the option texts
     */
    static List<String> validatePoll(String question, JsonArray options) {
        if (question == null || question.trim().isEmpty()) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Poll question is mandatory");
        }
        if (options == null || options.size() < POLL_MIN_OPTIONS) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE,
                    "A poll needs at least " + POLL_MIN_OPTIONS + " options");
        }
        List<String> texts = new ArrayList<>();
        for (JsonElement option : options) {
            if (!option.isJsonPrimitive() || option.getAsString().trim().isEmpty()) {
                throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Poll options must be non empty texts");
            }
            texts.add(option.getAsString());
        }
        return texts;
    }

    static void validateMessage(String message) {
        if (message == null || message.trim().isEmpty()) {
            throw new MediaRoomException(Code.VALIDATION_ERROR_CODE, "Empty chat message");
        }
    }
}
