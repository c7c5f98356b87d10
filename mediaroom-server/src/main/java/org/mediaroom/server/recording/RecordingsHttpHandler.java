package org.mediaroom.server.recording;

import org.mediaroom.server.config.MediaRoomConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves archived recordings under <code>/recordings/**</code>.
 */
@Configuration
@ConditionalOnProperty(name = "mediaroom.recording.public-access", havingValue = "true")
public class RecordingsHttpHandler implements WebMvcConfigurer {

    @Autowired
    private MediaRoomConfig mediaRoomConfig;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String archivePath = mediaRoomConfig.getRecordingArchivePath();
        archivePath = archivePath.endsWith("/") ? archivePath : archivePath + "/";
        registry.addResourceHandler("/recordings/**").addResourceLocations("file:" + archivePath);
    }
}
