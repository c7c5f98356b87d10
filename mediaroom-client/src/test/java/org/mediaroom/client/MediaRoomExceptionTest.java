package org.mediaroom.client;

import org.junit.jupiter.api.Test;
import org.mediaroom.client.MediaRoomException.Code;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MediaRoomExceptionTest {

    @Test
    void codesAreUnique() {
        Set<Integer> values = new HashSet<>();
        Arrays.stream(Code.values()).forEach(code -> assertThat(values.add(code.getValue()))
                .as("duplicate value of %s", code).isTrue());
    }

    @Test
    void carriesItsCode() {
        MediaRoomException e = new MediaRoomException(Code.INVALID_PASSWORD_ERROR_CODE, "Wrong password");

        assertThat(e.getCode()).isEqualTo(Code.INVALID_PASSWORD_ERROR_CODE);
        assertThat(e.getCodeValue()).isEqualTo(201);
        assertThat(e.getMessage()).isEqualTo("Wrong password");
        assertThat(e.toString()).startsWith("Code: 201 ");
    }

    @Test
    void notFoundFamily() {
        assertThat(new MediaRoomException(Code.PRODUCER_NOT_FOUND_ERROR_CODE, "x").isResourceNotFound()).isTrue();
        assertThat(new MediaRoomException(Code.ROOM_NOT_FOUND_ERROR_CODE, "x").isResourceNotFound()).isTrue();
        assertThat(new MediaRoomException(Code.POLL_NOT_FOUND_ERROR_CODE, "x").isResourceNotFound()).isTrue();
        assertThat(new MediaRoomException(Code.NOT_HOST_ERROR_CODE, "x").isResourceNotFound()).isFalse();
        assertThat(new MediaRoomException(Code.NOT_RECORDING_ERROR_CODE, "x").isResourceNotFound()).isFalse();
    }
}
