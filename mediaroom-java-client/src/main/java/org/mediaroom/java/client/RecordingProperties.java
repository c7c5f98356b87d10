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
 *
 */

package org.mediaroom.java.client;

/**
 * Options of a recording start request
 */
public class RecordingProperties {

    private String name;
    private RecordingInfo.OutputMode outputMode;
    private String resolution;
    private boolean hasAudio;
    private boolean hasVideo;

    /**
     * Builder for {@link org.mediaroom.java.client.RecordingProperties}
     */
    public static class Builder {

        private String name = "";
        private RecordingInfo.OutputMode outputMode = RecordingInfo.OutputMode.INDIVIDUAL;
        private String resolution;
        private boolean hasAudio = true;
        private boolean hasVideo = true;

        /**
         * Builder for {@link org.mediaroom.java.client.RecordingProperties}
         */
        public RecordingProperties build() {
            if (!this.hasAudio && !this.hasVideo) {
                throw new IllegalStateException("Cannot record with both audio and video disabled");
            }
            if (RecordingInfo.OutputMode.COMPOSED.equals(this.outputMode)) {
                this.resolution = this.resolution != null ? this.resolution : "1280x720";
            }
            return new RecordingProperties(this.name, this.outputMode, this.resolution, this.hasAudio,
                    this.hasVideo);
        }

        /**
         * Call this method to set the name of the recording. You can access this same
         * value in your clients on recording events (<code>recordingStarted</code>,
         * <code>recordingStopped</code>)
         */
        public RecordingProperties.Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Call this method to set the mode of recording: COMPOSED for a single archive
         * in a grid layout or INDIVIDUAL for one archive for each peer
         */
        public RecordingProperties.Builder outputMode(RecordingInfo.OutputMode outputMode) {
            this.outputMode = outputMode;
            return this;
        }

        /**
         * Call this method to specify the size of the composed grid, with format
         * "WIDTHxHEIGHT". Will only have effect if
         * {@link org.mediaroom.java.client.RecordingProperties.Builder#outputMode(RecordingInfo.OutputMode)}
         * has been called with value {@link RecordingInfo.OutputMode#COMPOSED}
         */
        public RecordingProperties.Builder resolution(String resolution) {
            this.resolution = resolution;
            return this;
        }

        public RecordingProperties.Builder hasAudio(boolean hasAudio) {
            this.hasAudio = hasAudio;
            return this;
        }

        public RecordingProperties.Builder hasVideo(boolean hasVideo) {
            this.hasVideo = hasVideo;
            return this;
        }

    }

    protected RecordingProperties(String name, RecordingInfo.OutputMode outputMode, String resolution,
                                  boolean hasAudio, boolean hasVideo) {
        this.name = name;
        this.outputMode = outputMode;
        this.resolution = resolution;
        this.hasAudio = hasAudio;
        this.hasVideo = hasVideo;
    }

    public String name() {
        return this.name;
    }

    /**
     * Defines the mode of recording. Default to
     * {@link RecordingInfo.OutputMode#INDIVIDUAL}
     */
    public RecordingInfo.OutputMode outputMode() {
        return this.outputMode;
    }

    /**
     * Size of the composed grid. Default to "1280x720" for
     * {@link RecordingInfo.OutputMode#COMPOSED}, <code>null</code> otherwise
     */
    public String resolution() {
        return this.resolution;
    }

    public boolean hasAudio() {
        return this.hasAudio;
    }

    public boolean hasVideo() {
        return this.hasVideo;
    }

    /**
     * @return width and height parsed from {@link #resolution()}, 1280x720
     * when it is not set
     */
    public int[] resolutionDimensions() {
        String[] parts = (this.resolution != null ? this.resolution : "1280x720").split("x");
        return new int[]{Integer.parseInt(parts[0]), Integer.parseInt(parts[1])};
    }

}
