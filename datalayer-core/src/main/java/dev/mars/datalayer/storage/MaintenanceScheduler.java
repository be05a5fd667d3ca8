/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.datalayer.storage;

import dev.mars.datalayer.cluster.RegionId;
import dev.mars.datalayer.disk.Disk;
import dev.mars.datalayer.disk.ReturnCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Background loop keeping every resident disk healthy.
 * <p>
 * Each cycle works on a fresh {@link DiskTable#snapshot() snapshot} of the
 * table and runs three passes:
 * <ol>
 *   <li><b>Preallocation</b>, at most once per preallocation interval: walks a
 *       round-robin queue of regions, stopping at the first disk that made
 *       progress.</li>
 *   <li><b>Optimistic IO</b>, same policy with its own queue and interval.</li>
 *   <li><b>Flush</b>, every cycle and every disk. A buffer-full disk gets an
 *       immediate mandatory-IO call.</li>
 * </ol>
 * A cycle in which nothing made progress is followed by a short idle sleep;
 * otherwise the next cycle starts at once.
 * <p>
 * <b>Failure semantics:</b> every per-disk failure, returned or thrown, is
 * logged and skipped. The loop only ends on {@link #shutdown()}.
 * <p>
 * <b>Thread Safety:</b> the loop runs on a single dedicated thread; the
 * rotation queues and pass timestamps are confined to cycles, which are
 * serialized on the scheduler monitor.
 */
public final class MaintenanceScheduler implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final DiskTable table;
    private final Clock clock;
    private final int flushBudget;
    private final long idleSleepMillis;

    private final RoundRobinQueue<RegionId> preallocationQueue = new RoundRobinQueue<>();
    private final RoundRobinQueue<RegionId> optimisticQueue = new RoundRobinQueue<>();
    private final PassTimer preallocationTimer;
    private final PassTimer optimisticTimer;

    private final ExecutorService executor;
    private final AtomicLong cycles = new AtomicLong();
    private volatile boolean shutdown;
    private Future<?> loop;

    public MaintenanceScheduler(DiskTable table, DataLayerConfig config) {
        this(table, config, Clock.systemUTC());
    }

    /**
     * @param clock time source for the pass intervals
     */
    public MaintenanceScheduler(DiskTable table, DataLayerConfig config, Clock clock) {
        this.table = table;
        this.clock = clock;
        this.flushBudget = config.flushBudget();
        this.idleSleepMillis = config.idleSleep().toMillis();
        this.preallocationTimer = new PassTimer(config.preallocationInterval().toMillis());
        this.optimisticTimer = new PassTimer(config.optimisticIoInterval().toMillis());

        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "datalayer-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the background loop.
     *
     * @throws IllegalStateException if already started or shut down
     */
    public synchronized void start() {
        if (shutdown) {
            throw new IllegalStateException("maintenance scheduler is shut down");
        }
        if (loop != null) {
            throw new IllegalStateException("maintenance scheduler already started");
        }
        loop = executor.submit(this::run);
    }

    /**
     * Stops the loop and waits for it to exit. Disk calls already in flight
     * run to completion; the wait is bounded by one cycle plus the idle sleep.
     */
    public void shutdown() {
        shutdown = true;
        Future<?> running;
        synchronized (this) {
            running = loop;
        }
        executor.shutdown();
        if (running == null) {
            return;
        }
        try {
            running.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the maintenance thread to exit");
        } catch (ExecutionException e) {
            LOG.error("Maintenance loop terminated abnormally", e.getCause());
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /** Number of cycles completed so far. */
    public long cycles() {
        return cycles.get();
    }

    /**
     * Runs one maintenance cycle on the calling thread.
     *
     * @return true if any disk made progress
     */
    public synchronized boolean runCycle() {
        boolean progress = false;
        try (DiskTable.Snapshot disks = table.snapshot()) {
            for (RegionId region : disks.regions()) {
                preallocationQueue.offerIfAbsent(region);
                optimisticQueue.offerIfAbsent(region);
            }

            if (preallocationTimer.due(clock.millis())) {
                progress |= rotate(disks, preallocationQueue, Disk::preallocate, "Preallocation");
                preallocationTimer.ran(clock.millis());
            }

            if (optimisticTimer.due(clock.millis())) {
                progress |= rotate(disks, optimisticQueue, Disk::optimisticIo, "Optimistic IO");
                optimisticTimer.ran(clock.millis());
            }

            progress |= flushAll(disks);
        }
        cycles.incrementAndGet();
        return progress;
    }

    // ========================================================================
    // Loop
    // ========================================================================

    private void run() {
        LOG.info("Maintenance thread started: flushBudget={}, idleSleep={} ms", flushBudget, idleSleepMillis);
        while (!shutdown) {
            boolean progress;
            try {
                progress = runCycle();
            } catch (RuntimeException e) {
                LOG.error("Maintenance cycle failed: {}", e.getMessage(), e);
                progress = false;
            }
            if (progress || shutdown) {
                continue;
            }
            try {
                Thread.sleep(idleSleepMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Maintenance thread interrupted, stopping");
                break;
            }
        }
        LOG.info("Maintenance thread stopped after {} cycles", cycles.get());
    }

    // ========================================================================
    // Passes
    // ========================================================================

    /**
     * Walks the queue once, re-queueing regions that still have a disk,
     * until one disk reports progress.
     */
    private boolean rotate(DiskTable.Snapshot disks, RoundRobinQueue<RegionId> queue,
                           Function<Disk, ReturnCode> operation, String what) {
        int pending = queue.size();
        for (int i = 0; i < pending; i++) {
            RegionId region = queue.poll();
            Disk disk = disks.get(region);
            if (disk == null) {
                // region is gone; it leaves the rotation
                continue;
            }
            queue.offerIfAbsent(region);

            ReturnCode rc = invoke(region, disk, operation, what);
            if (rc == ReturnCode.SUCCESS) {
                return true;
            }
            if (rc != ReturnCode.DID_NOTHING) {
                LOG.warn("{} failed for {}: {}", what, region, rc);
            }
        }
        return false;
    }

    private boolean flushAll(DiskTable.Snapshot disks) {
        boolean progress = false;
        for (Map.Entry<RegionId, Disk> entry : disks.disks().entrySet()) {
            RegionId region = entry.getKey();
            Disk disk = entry.getValue();

            ReturnCode rc = invoke(region, disk, d -> d.flush(flushBudget), "Flush");
            switch (rc) {
                case SUCCESS -> progress = true;
                case DID_NOTHING -> LOG.trace("Nothing to flush for {}", region);
                case DATA_FULL, SEARCH_FULL -> {
                    ReturnCode io = invoke(region, disk, Disk::mandatoryIo, "Mandatory IO");
                    if (io != ReturnCode.SUCCESS && io != ReturnCode.DID_NOTHING) {
                        LOG.error("Mandatory IO for {} returned {}", region, io);
                    }
                }
                default -> LOG.error("Flush of {} returned {}", region, rc);
            }
        }
        return progress;
    }

    private static ReturnCode invoke(RegionId region, Disk disk, Function<Disk, ReturnCode> operation, String what) {
        try {
            return operation.apply(disk);
        } catch (RuntimeException e) {
            LOG.error("{} threw for {}: {}", what, region, e.getMessage(), e);
            return ReturnCode.IO_ERROR;
        }
    }

    /**
     * Last-run timestamp of one pass.
     */
    private static final class PassTimer {
        private final long intervalMillis;
        private long lastRunMillis;
        private boolean hasRun;

        private PassTimer(long intervalMillis) {
            this.intervalMillis = intervalMillis;
        }

        boolean due(long nowMillis) {
            return !hasRun || nowMillis - lastRunMillis >= intervalMillis;
        }

        void ran(long nowMillis) {
            lastRunMillis = nowMillis;
            hasRun = true;
        }
    }
}
