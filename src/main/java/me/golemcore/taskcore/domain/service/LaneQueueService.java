package me.golemcore.taskcore.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskcore.domain.model.DurableRecord;
import me.golemcore.taskcore.domain.model.LaneStatus;
import me.golemcore.taskcore.domain.model.WorkItem;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Per-lane ordered delivery of work items.
 *
 * <p>
 * Supports:
 * </p>
 * <ul>
 * <li>Strict FIFO within a lane: the next item starts only after the previous
 * handler has returned.</li>
 * <li>Independent lanes running concurrently on the shared worker pool.</li>
 * <li>Write-ahead records: every item is persisted before it is queued and
 * completed once its handler has returned, whatever the outcome.</li>
 * <li>Crash recovery through {@link #recoverOrphans(Function)}.</li>
 * </ul>
 *
 * <p>
 * A lane has at most one task on the executor at any time. When a task
 * finishes it hands the lane's next item to a fresh task, or marks the lane
 * idle.
 */
@Service
@Slf4j
public class LaneQueueService {

    private final DurableQueueStore durableQueueStore;
    private final ExecutorService laneWorkerExecutor;
    private final Clock clock;
    private final Duration shutdownGrace;

    private final Map<String, LaneRunner> runners = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    public LaneQueueService(DurableQueueStore durableQueueStore,
            @Qualifier("laneWorkerExecutor") ExecutorService laneWorkerExecutor, Clock clock,
            TaskCoreProperties properties) {
        this.durableQueueStore = durableQueueStore;
        this.laneWorkerExecutor = laneWorkerExecutor;
        this.clock = clock;
        this.shutdownGrace = properties.getLanes().getShutdownGrace();
    }

    /**
     * Persist the item, queue it on its lane and start the lane worker if the
     * lane is idle.
     *
     * @return the queued item, carrying its write-ahead record id
     */
    public WorkItem enqueue(String laneId, String payload, WorkItemHandler handler) {
        Objects.requireNonNull(laneId, "laneId");
        Objects.requireNonNull(handler, "handler");
        if (!accepting) {
            throw new IllegalStateException("Lane queue is shut down");
        }

        String recordId = durableQueueStore.write(laneId, payload);
        WorkItem item = WorkItem.builder()
                .recordId(recordId)
                .laneId(laneId)
                .payload(payload)
                .enqueuedAt(clock.instant())
                .recovered(false)
                .build();
        dispatch(item, handler);
        return item;
    }

    /**
     * Re-submit records left on disk by a previous process, lane by lane in
     * their original order. Each recovered item completes its original record.
     *
     * @return number of recovered items
     */
    public int recoverOrphans(Function<String, WorkItemHandler> handlerFactory) {
        List<DurableRecord> pending = durableQueueStore.loadPending();
        if (pending.isEmpty()) {
            return 0;
        }

        Map<String, List<DurableRecord>> byLane = new LinkedHashMap<>();
        for (DurableRecord record : pending) {
            byLane.computeIfAbsent(record.getLaneId(), k -> new ArrayList<>()).add(record);
        }

        for (Map.Entry<String, List<DurableRecord>> entry : byLane.entrySet()) {
            WorkItemHandler handler = handlerFactory.apply(entry.getKey());
            for (DurableRecord record : entry.getValue()) {
                dispatch(WorkItem.builder()
                        .recordId(record.getId())
                        .laneId(record.getLaneId())
                        .payload(record.getPayload())
                        .enqueuedAt(record.getEnqueuedAt())
                        .recovered(true)
                        .build(), handler);
            }
            log.info("[LaneQueue] recovered {} item(s) for lane {}", entry.getValue().size(), entry.getKey());
        }
        return pending.size();
    }

    public int queueDepth(String laneId) {
        LaneRunner runner = runners.get(laneId);
        return runner != null ? runner.status().depth() : 0;
    }

    public boolean isActive(String laneId) {
        LaneRunner runner = runners.get(laneId);
        return runner != null && runner.status().active();
    }

    public LaneStatus status(String laneId) {
        LaneRunner runner = runners.get(laneId);
        return runner != null ? runner.status() : new LaneStatus(laneId, 0, false);
    }

    /**
     * Depth and activity of every lane seen since startup, ordered by lane id.
     */
    public Map<String, LaneStatus> snapshot() {
        Map<String, LaneStatus> snapshot = new TreeMap<>();
        for (LaneRunner runner : runners.values()) {
            LaneStatus status = runner.status();
            snapshot.put(status.laneId(), status);
        }
        return snapshot;
    }

    @PreDestroy
    public void shutdown() {
        accepting = false;
        laneWorkerExecutor.shutdown();
        try {
            if (!laneWorkerExecutor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[LaneQueue] workers still busy after {}, interrupting; pending records stay on disk",
                        shutdownGrace);
                laneWorkerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            laneWorkerExecutor.shutdownNow();
        }
    }

    private void dispatch(WorkItem item, WorkItemHandler handler) {
        LaneRunner runner = runners.computeIfAbsent(item.getLaneId(), LaneRunner::new);
        runner.offer(new QueuedItem(item, handler));
    }

    private final class LaneRunner {

        private final String laneId;
        private final Object lock = new Object();
        private final Deque<QueuedItem> queue = new ArrayDeque<>();

        private boolean running = false;

        private LaneRunner(String laneId) {
            this.laneId = laneId;
        }

        void offer(QueuedItem queued) {
            QueuedItem toStart = null;
            synchronized (lock) {
                queue.addLast(queued);
                if (!running) {
                    running = true;
                    toStart = queue.pollFirst();
                }
            }
            if (toStart != null) {
                startRun(toStart);
            }
        }

        LaneStatus status() {
            synchronized (lock) {
                return new LaneStatus(laneId, queue.size(), running);
            }
        }

        private void startRun(QueuedItem queued) {
            try {
                laneWorkerExecutor.submit(() -> {
                    try {
                        process(queued);
                    } finally {
                        onRunComplete();
                    }
                });
            } catch (RejectedExecutionException e) {
                // Shutting down: the record stays on disk and is recovered on next start
                log.warn("[LaneQueue] worker rejected for lane {}, {} item(s) left for recovery",
                        laneId, status().depth() + 1);
                synchronized (lock) {
                    queue.clear();
                    running = false;
                }
            }
        }

        private void process(QueuedItem queued) {
            WorkItem item = queued.item();
            boolean interrupted = false;
            try {
                queued.handler().handle(item);
            } catch (Exception e) { // NOSONAR - must not kill the lane worker
                interrupted = handleRunFailure(item, e);
            }

            if (interrupted) {
                // Treated like a crash: keep the record so the item is redelivered
                return;
            }
            durableQueueStore.complete(item.getRecordId());
        }

        private boolean handleRunFailure(WorkItem item, Exception e) {
            if (e instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                Thread.currentThread().interrupt();
                log.info("[LaneQueue] run interrupted: lane={}, record={}", laneId, item.getRecordId());
                return true;
            }
            log.error("[LaneQueue] handler failed: lane={}, record={}: {}",
                    laneId, item.getRecordId(), e.getMessage(), e);
            return false;
        }

        private void onRunComplete() {
            QueuedItem next;
            synchronized (lock) {
                next = queue.pollFirst();
                if (next == null) {
                    running = false;
                }
            }
            if (next != null) {
                startRun(next);
            } else {
                log.debug("[LaneQueue] lane {} is idle", laneId);
            }
        }
    }

    private record QueuedItem(WorkItem item, WorkItemHandler handler) {
        private QueuedItem {
            Objects.requireNonNull(item, "item");
            Objects.requireNonNull(handler, "handler");
        }
    }
}
