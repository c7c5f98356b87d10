package org.mediaroom.java.client;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordingInfoTest {

    @Test
    void propertiesDefaults() {
        RecordingProperties individual = new RecordingProperties.Builder().build();
        RecordingProperties composed = new RecordingProperties.Builder()
                .outputMode(RecordingInfo.OutputMode.COMPOSED).build();

        assertThat(individual.outputMode()).isEqualTo(RecordingInfo.OutputMode.INDIVIDUAL);
        assertThat(individual.resolution()).isNull();
        assertThat(individual.hasAudio()).isTrue();
        assertThat(individual.hasVideo()).isTrue();
        assertThat(composed.resolution()).isEqualTo("1280x720");
        assertThat(composed.resolutionDimensions()).containsExactly(1280, 720);
    }

    @Test
    void customResolution() {
        RecordingProperties properties = new RecordingProperties.Builder()
                .outputMode(RecordingInfo.OutputMode.COMPOSED).resolution("1920x1080").build();

        assertThat(properties.resolutionDimensions()).containsExactly(1920, 1080);
    }

    @Test
    void audioOrVideoIsRequired() {
        assertThatThrownBy(() -> new RecordingProperties.Builder().hasAudio(false).hasVideo(false).build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void newRecordingIsStarting() {
        RecordingInfo info = new RecordingInfo("room1", "room1-1000", "alice",
                new RecordingProperties.Builder().name("weekly").build());

        assertThat(info.getStatus()).isEqualTo(RecordingInfo.Status.starting);
        assertThat(info.getName()).isEqualTo("weekly");
        assertThat(info.getFiles()).isEmpty();
        assertThat(info.getSize()).isZero();
        assertThat(info.getEndedAt()).isZero();
    }

    @Test
    void sealedMetadataIsReadBack() {
        RecordingInfo info = new RecordingInfo("room1", "room1-1000", "alice",
                new RecordingProperties.Builder().name("weekly").outputMode(RecordingInfo.OutputMode.COMPOSED)
                        .build());
        info.setStartedAt(1000L);
        info.setEndedAt(61000L);
        info.setStatus(RecordingInfo.Status.stopped);
        info.addFile(new RecordingFile(null, null, "room1-1000.webm", "/archive/room1-1000.webm", 2048, 60.0, true));
        info.addFile(new RecordingFile("p2", "bob", "bob-2000-1.webm", null, 1024, 30.5, false));

        JsonObject json = info.toJson();
        RecordingInfo read = new RecordingInfo(json);

        assertThat(json.get("recordingId").getAsString()).isEqualTo("room1-1000");
        assertThat(read.getRoomId()).isEqualTo("room1");
        assertThat(read.getStartedBy()).isEqualTo("alice");
        assertThat(read.getOutputMode()).isEqualTo(RecordingInfo.OutputMode.COMPOSED);
        assertThat(read.getStatus()).isEqualTo(RecordingInfo.Status.stopped);
        assertThat(read.getEndedAt()).isEqualTo(61000L);
        assertThat(read.getSize()).isEqualTo(3072L);
        assertThat(read.getFiles()).hasSize(2);
        assertThat(read.getFiles().get(0).getPeerId()).isNull();
        assertThat(read.getFiles().get(0).getPath()).isEqualTo("/archive/room1-1000.webm");
        assertThat(read.getFiles().get(1).getUsername()).isEqualTo("bob");
        assertThat(read.getFiles().get(1).hasVideo()).isFalse();
        assertThat(read.getFiles().get(1).getDuration()).isEqualTo(30.5);
    }
}
