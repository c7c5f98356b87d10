package org.mediaroom.server;

import com.hazelcast.config.Config;
import com.hazelcast.config.XmlConfigBuilder;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import org.kurento.jsonrpc.internal.server.config.JsonRpcConfiguration;
import org.kurento.jsonrpc.server.JsonRpcConfigurer;
import org.kurento.jsonrpc.server.JsonRpcHandlerRegistry;
import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.mediaroom.server.config.MediaRoomConfig;
import org.mediaroom.server.core.MediaNegotiationService;
import org.mediaroom.server.core.RoomEventsHandler;
import org.mediaroom.server.core.RoomManager;
import org.mediaroom.server.core.SessionTracker;
import org.mediaroom.server.engine.CapabilityRegistry;
import org.mediaroom.server.engine.EngineFatalHandler;
import org.mediaroom.server.engine.MediaEngine;
import org.mediaroom.server.engine.RoutingContextPool;
import org.mediaroom.server.kurento.core.KurentoMediaEngine;
import org.mediaroom.server.recording.CapturePortAllocator;
import org.mediaroom.server.recording.process.CaptureProcessLauncher;
import org.mediaroom.server.recording.process.FfmpegCaptureProcessLauncher;
import org.mediaroom.server.recording.process.ReadinessProbe;
import org.mediaroom.server.recording.process.UdpPortReadinessProbe;
import org.mediaroom.server.recording.service.ComposedRecordingService;
import org.mediaroom.server.recording.service.RecordingManager;
import org.mediaroom.server.recording.service.SingleStreamRecordingService;
import org.mediaroom.server.rpc.RpcHandler;
import org.mediaroom.server.rpc.RpcNotificationService;
import org.mediaroom.server.rpc.RpcRoomHandler;
import org.mediaroom.server.storage.HazelcastMetadataStore;
import org.mediaroom.server.storage.LocalRecordingStorage;
import org.mediaroom.server.storage.MetadataStore;
import org.mediaroom.server.storage.RecordingStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.event.EventListener;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Import({JsonRpcConfiguration.class})
@SpringBootApplication
public class MediaRoomServerApplication implements JsonRpcConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(MediaRoomServerApplication.class);

    public static final String ROOM_ENDPOINT = "/room";

    @Autowired
    private MediaRoomConfig mediaRoomConfig;

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService mediaRoomScheduler() {
        return Executors.newScheduledThreadPool(2, threadFactory("mediaroom-timer-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService mediaRoomTaskExecutor() {
        return Executors.newCachedThreadPool(threadFactory("mediaroom-task-"));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public MediaEngine mediaEngine() {
        KurentoMediaEngine engine = new KurentoMediaEngine(mediaRoomConfig.getKmsUris(),
                mediaRoomConfig.getEffectiveEngineWorkers());
        engine.addFatalListener(new EngineFatalHandler());
        engine.connect();
        return engine;
    }

    @Bean
    @ConditionalOnMissingBean
    public CapabilityRegistry capabilityRegistry() {
        return new CapabilityRegistry(mediaEngine());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RoutingContextPool routingContextPool() {
        RoutingContextPool pool = new RoutingContextPool(mediaEngine(), mediaRoomConfig.getRoutingPoolSize(),
                mediaRoomTaskExecutor());
        pool.warmUp();
        return pool;
    }

    @Bean
    @ConditionalOnMissingBean
    public Config hazelcastConfig() {
        try (InputStream xml = MediaRoomServerApplication.class.getResourceAsStream("/mediaroom-hazelcast.xml")) {
            if (xml == null) {
                logger.warn("No mediaroom-hazelcast.xml found, using the default Hazelcast configuration");
                return new Config();
            }
            return new XmlConfigBuilder(xml).build();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read mediaroom-hazelcast.xml", e);
        }
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public HazelcastInstance hazelcastInstance() {
        return Hazelcast.newHazelcastInstance(hazelcastConfig());
    }

    @Bean
    @ConditionalOnMissingBean
    public MetadataStore metadataStore() {
        return new HazelcastMetadataStore(hazelcastInstance());
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordingStorage recordingStorage() {
        return new LocalRecordingStorage(mediaRoomConfig.getRecordingArchivePath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RpcNotificationService rpcNotificationService() {
        return new RpcNotificationService();
    }

    @Bean
    @ConditionalOnMissingBean
    public RoomEventsHandler roomEventsHandler() {
        return new RoomEventsHandler(rpcNotificationService());
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionTracker sessionTracker() {
        return new SessionTracker(metadataStore(), mediaRoomTaskExecutor());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RoomManager roomManager() {
        return new RoomManager(routingContextPool(), capabilityRegistry(), sessionTracker(), roomEventsHandler(),
                metadataStore(), mediaRoomScheduler(), mediaRoomTaskExecutor(),
                mediaRoomConfig.getRoomEvictionDelay() * 1000L);
    }

    @Bean
    @ConditionalOnMissingBean
    public MediaNegotiationService mediaNegotiationService() {
        return new MediaNegotiationService(roomManager(), capabilityRegistry(), roomEventsHandler());
    }

    @Bean
    @ConditionalOnMissingBean
    public CapturePortAllocator capturePortAllocator() {
        return new CapturePortAllocator(mediaRoomConfig.getRecordingListenIp(), mediaRoomConfig.getRtcMinPort(),
                mediaRoomConfig.getRtcMaxPort());
    }

    @Bean
    @ConditionalOnMissingBean
    public CaptureProcessLauncher captureProcessLauncher() {
        return new FfmpegCaptureProcessLauncher(mediaRoomConfig.getRecordingFfmpegPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReadinessProbe readinessProbe() {
        return new UdpPortReadinessProbe(mediaRoomScheduler(), 50);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RecordingManager recordingManager() {
        RecordingManager recordingManager = new RecordingManager(mediaRoomConfig, roomManager(),
                roomEventsHandler(), metadataStore(), recordingStorage(),
                new SingleStreamRecordingService(mediaRoomConfig, captureProcessLauncher(), readinessProbe(),
                        capturePortAllocator(), mediaRoomTaskExecutor()),
                new ComposedRecordingService(mediaRoomConfig, captureProcessLauncher(), readinessProbe(),
                        capturePortAllocator(), mediaRoomTaskExecutor()),
                mediaRoomTaskExecutor());
        if (mediaRoomConfig.isRecordingModuleEnable()) {
            try {
                recordingManager.initializeRecordingManager();
            } catch (MediaRoomException e) {
                String finalErrorMessage = e.getMessage();
                if (e.getCode() == Code.RECORDING_PATH_NOT_VALID) {
                    finalErrorMessage = "Error initializing recording path \"" + mediaRoomConfig.getRecordingPath()
                            + "\" set with property \"mediaroom.recording.path\"";
                }
                logger.error(finalErrorMessage + ". Shutting down MediaRoom Server");
                throw new IllegalStateException(finalErrorMessage, e);
            }
        }
        return recordingManager;
    }

    @Bean
    public RpcHandler rpcHandler() {
        return new RpcRoomHandler(rpcNotificationService(), roomManager(), mediaNegotiationService(),
                recordingManager(), mediaRoomConfig);
    }

    @Override
    public void registerJsonRpcHandlers(JsonRpcHandlerRegistry registry) {
        registry.addHandler(rpcHandler().withPingWatchdog(true), ROOM_ENDPOINT);
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static void main(String[] args) {
        logger.info("Using /dev/urandom for secure random generation");
        System.setProperty("java.security.egd", "file:/dev/./urandom");
        SpringApplication.run(MediaRoomServerApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void whenReady() {
        final String NEW_LINE = System.lineSeparator();
        String str = NEW_LINE +
                NEW_LINE + "    SIGNALING ENDPOINT   " +
                NEW_LINE + "-------------------------" +
                NEW_LINE + "ws://localhost:" + mediaRoomConfig.getServerPort() + ROOM_ENDPOINT +
                NEW_LINE + "-------------------------" +
                NEW_LINE + "recording: " + (mediaRoomConfig.isRecordingModuleEnable()
                ? mediaRoomConfig.getRecordingPath() : "disabled") +
                NEW_LINE;
        logger.info(str);
    }
}
