package org.mediaroom.server.engine;

import org.mediaroom.client.MediaRoomException;
import org.mediaroom.client.MediaRoomException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Small pool of pre-warmed routing contexts so that creating a room does not
 * wait for the engine. Every acquired context is replaced asynchronously.
 */
public class RoutingContextPool {

    private static final Logger log = LoggerFactory.getLogger(RoutingContextPool.class);

    private final MediaEngine engine;
    private final int poolSize;
    private final Queue<RoutingContext> idleContexts = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingBackfills = new AtomicInteger();
    private final ExecutorService backfillExecutor;

    private volatile boolean closed = false;

    public RoutingContextPool(MediaEngine engine, int poolSize) {
        this(engine, poolSize, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "routing-pool-backfill");
            t.setDaemon(true);
            return t;
        }));
    }

    public RoutingContextPool(MediaEngine engine, int poolSize, ExecutorService backfillExecutor) {
        this.engine = engine;
        this.poolSize = poolSize;
        this.backfillExecutor = backfillExecutor;
    }

    /**
     * Fills the pool up to its size. Contexts that fail to build are logged and
     * left to later backfills.
     */
    public void warmUp() {
        int created = 0;
        for (int i = idleContexts.size(); i < poolSize; i++) {
            try {
                idleContexts.add(engine.createRoutingContext());
                created++;
            } catch (MediaRoomException e) {
                log.error("Error pre-warming routing context: {}", e.getMessage());
            }
        }
        log.info("Routing context pool warmed up with {} contexts", created);
    }

    /**
     * @return a warm context, or a new one when the pool is empty
     * @throws MediaRoomException RESOURCE_EXHAUSTED_ERROR_CODE if no context
     *                            could be obtained
     */
    public RoutingContext acquire() {
        if (closed) {
            throw new MediaRoomException(Code.RESOURCE_EXHAUSTED_ERROR_CODE, "Routing context pool is closed");
        }
        RoutingContext context = poll();
        if (context == null) {
            log.info("Routing context pool is empty, creating a context on demand");
            try {
                context = engine.createRoutingContext();
            } catch (MediaRoomException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new MediaRoomException(Code.RESOURCE_EXHAUSTED_ERROR_CODE,
                        "Unable to create routing context: " + e.getMessage(), e);
            }
        }
        scheduleBackfill();
        return context;
    }

    private RoutingContext poll() {
        RoutingContext context;
        while ((context = idleContexts.poll()) != null) {
            if (!context.isClosed()) {
                return context;
            }
            log.warn("Discarding closed routing context {} found in pool", context.getId());
        }
        return null;
    }

    private void scheduleBackfill() {
        if (idleContexts.size() + pendingBackfills.get() >= poolSize) {
            return;
        }
        pendingBackfills.incrementAndGet();
        try {
            backfillExecutor.execute(() -> {
                try {
                    if (!closed) {
                        RoutingContext created = engine.createRoutingContext();
                        if (closed) {
                            created.close();
                        } else {
                            idleContexts.add(created);
                            log.debug("Routing context pool backfilled, {} idle", idleContexts.size());
                        }
                    }
                } catch (RuntimeException e) {
                    log.error("Error backfilling routing context pool: {}", e.getMessage());
                } finally {
                    pendingBackfills.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            pendingBackfills.decrementAndGet();
            log.warn("Routing context backfill rejected: {}", e.getMessage());
        }
    }

    public int getIdleCount() {
        return idleContexts.size();
    }

    public void close() {
        closed = true;
        backfillExecutor.shutdownNow();
        RoutingContext context;
        while ((context = idleContexts.poll()) != null) {
            context.close();
        }
        log.info("Routing context pool closed");
    }
}
