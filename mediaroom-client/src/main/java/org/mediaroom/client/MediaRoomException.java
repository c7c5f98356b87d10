/*
 * (C) Copyright 2017-2019 OpenVidu (https://openvidu.io/)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.mediaroom.client;

/**
 * Error raised by any room, negotiation or recording operation. The code is
 * sent back to the client as the JSON-RPC error code.
 */
public class MediaRoomException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Code {
        GENERIC_ERROR_CODE(999),

        TRANSPORT_ERROR_CODE(803),
        VALIDATION_ERROR_CODE(801),

        ROOM_NOT_FOUND_ERROR_CODE(101),
        PEER_NOT_FOUND_ERROR_CODE(102),
        TRANSPORT_NOT_FOUND_ERROR_CODE(103),
        PRODUCER_NOT_FOUND_ERROR_CODE(104),
        CONSUMER_NOT_FOUND_ERROR_CODE(105),
        POLL_NOT_FOUND_ERROR_CODE(106),

        INVALID_PASSWORD_ERROR_CODE(201),
        NOT_HOST_ERROR_CODE(202),

        INCOMPATIBLE_CAPABILITIES_ERROR_CODE(301),
        RESOURCE_EXHAUSTED_ERROR_CODE(302),

        ALREADY_RECORDING_ERROR_CODE(401),
        NOT_RECORDING_ERROR_CODE(402),
        CAPACITY_EXCEEDED_ERROR_CODE(403),
        SUBPROCESS_ERROR_CODE(404),
        RECORDING_PATH_NOT_VALID(405);

        private int value;

        private Code(int value) {
            this.value = value;
        }

        public int getValue() {
            return this.value;
        }
    }

    private Code code;

    public MediaRoomException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public MediaRoomException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Code getCode() {
        return code;
    }

    public int getCodeValue() {
        return code.getValue();
    }

    /**
     * @return true for the family of errors raised when a room, peer,
     * transport, producer, consumer or poll could not be located
     */
    public boolean isResourceNotFound() {
        switch (code) {
            case ROOM_NOT_FOUND_ERROR_CODE:
            case PEER_NOT_FOUND_ERROR_CODE:
            case TRANSPORT_NOT_FOUND_ERROR_CODE:
            case PRODUCER_NOT_FOUND_ERROR_CODE:
            case CONSUMER_NOT_FOUND_ERROR_CODE:
            case POLL_NOT_FOUND_ERROR_CODE:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return "Code: " + getCodeValue() + " " + super.toString();
    }

}
