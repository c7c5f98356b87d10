/*
 * (C) Copyright 2017-2019 CloudMedia (https://cloudMedia.io/)
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

package org.mediaroom.server.config;

import lombok.Data;
import org.mediaroom.java.client.RecordingInfo;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Data
@Component
public class MediaRoomConfig {

    @Value("${server.port}")
    private String serverPort;

    @Value("${mediaroom.publicurl}")
    private String publicUrl; // local, [FINAL_URL]

    @Value("${kms.uris}")
    private String kmsUris;

    @Value("${mediaroom.engine.workers}")
    private int engineWorkers;

    @Value("${mediaroom.rtc.min-port}")
    private int rtcMinPort;

    @Value("${mediaroom.rtc.max-port}")
    private int rtcMaxPort;

    @Value("${mediaroom.routing.pool-size}")
    private int routingPoolSize;

    @Value("${mediaroom.room.eviction-delay}")
    private int roomEvictionDelay; // seconds

    @Value("${mediaroom.recording.enable}")
    private boolean recordingModuleEnable;

    @Value("${mediaroom.recording.path}")
    private String recordingPath;

    @Value("${mediaroom.recording.archive-path}")
    private String recordingArchivePath;

    @Value("${mediaroom.recording.public-access}")
    private boolean recordingPublicAccess;

    @Value("${mediaroom.recording.max-concurrent}")
    private int recordingMaxConcurrent;

    @Value("${mediaroom.recording.output-mode}")
    private String recordingOutputMode;

    @Value("${mediaroom.recording.listen-ip}")
    private String recordingListenIp;

    @Value("${mediaroom.recording.readiness-timeout}")
    private long recordingReadinessTimeout; // milliseconds

    @Value("${mediaroom.recording.drain-interval}")
    private long recordingDrainInterval;

    @Value("${mediaroom.recording.graceful-stop-timeout}")
    private long recordingGracefulStopTimeout;

    @Value("${mediaroom.recording.terminate-timeout}")
    private long recordingTerminateTimeout;

    @Value("${mediaroom.recording.min-file-size}")
    private long recordingMinFileSize; // bytes

    @Value("${mediaroom.recording.ffmpeg-path}")
    private String recordingFfmpegPath;

    @Value("#{'${spring.profiles.active:}'.length() > 0 ? '${spring.profiles.active:}'.split(',') : \"default\"}")
    private String springProfile;

    /**
     * https:url
     */
    private String finalUrl;

    /**
     * wsUrl
     */
    private String wsUrl;

    public int getEffectiveEngineWorkers() {
        return this.engineWorkers > 0 ? this.engineWorkers : Runtime.getRuntime().availableProcessors();
    }

    public RecordingInfo.OutputMode getDefaultOutputMode() {
        return RecordingInfo.OutputMode.valueOf(this.recordingOutputMode.trim().toUpperCase());
    }

}
