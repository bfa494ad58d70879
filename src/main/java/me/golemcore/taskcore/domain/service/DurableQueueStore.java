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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskcore.domain.model.DurableRecord;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import me.golemcore.taskcore.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Write-ahead store for pending work items.
 *
 * <p>
 * One JSON file per item, named after the record id. A record is written
 * before the item is queued and deleted once its handler has returned, so
 * whatever is left on disk at startup was interrupted by a crash.
 *
 * <p>
 * Record ids have the form {@code <laneId>__<epochMillis>__<8 hex chars>}.
 * Enqueue timestamps are strictly increasing within the process so recovered
 * items keep their relative order.
 */
@Service
@Slf4j
public class DurableQueueStore {

    static final String FILE_SUFFIX = ".json";
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9_.-]");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;

    private final AtomicReference<Instant> lastTimestamp = new AtomicReference<>(Instant.EPOCH);

    public DurableQueueStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            TaskCoreProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getStorage().getDirectories().getQueue();
    }

    /**
     * Persist a pending item before it is processed.
     *
     * @return the record id, or {@code null} if the record could not be written
     */
    public String write(String laneId, String payload) {
        Instant enqueuedAt = nextTimestamp();
        String recordId = laneId + "__" + enqueuedAt.toEpochMilli() + "__"
                + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        DurableRecord record = DurableRecord.builder()
                .id(recordId)
                .laneId(laneId)
                .payload(payload)
                .enqueuedAt(enqueuedAt)
                .build();
        try {
            String json = objectMapper.writeValueAsString(record);
            storagePort.putTextAtomic(directory, fileName(recordId), json).join();
            log.debug("[DurableQueue] wrote record {}", recordId);
            return recordId;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[DurableQueue] failed to write record for lane {}: {}", laneId, e.getMessage());
            return null;
        }
    }

    /**
     * Remove a completed record. Unknown ids are ignored.
     */
    public void complete(String recordId) {
        if (recordId == null) {
            return;
        }
        try {
            storagePort.deleteObject(directory, fileName(recordId)).join();
            log.debug("[DurableQueue] completed record {}", recordId);
        } catch (RuntimeException e) {
            log.warn("[DurableQueue] failed to complete record {}: {}", recordId, e.getMessage());
        }
    }

    /**
     * Records written but never completed, oldest first.
     */
    public List<DurableRecord> loadPending() {
        List<String> files;
        try {
            files = storagePort.listObjects(directory).join();
        } catch (RuntimeException e) {
            log.warn("[DurableQueue] failed to list pending records: {}", e.getMessage());
            return List.of();
        }

        List<DurableRecord> records = new ArrayList<>();
        for (String file : files) {
            if (!file.endsWith(FILE_SUFFIX)) {
                continue;
            }
            DurableRecord record = readRecord(file);
            if (record != null) {
                records.add(record);
            }
        }
        records.sort(Comparator.comparing(DurableRecord::getEnqueuedAt)
                .thenComparing(DurableRecord::getId));
        log.info("[DurableQueue] found {} pending record(s)", records.size());
        return records;
    }

    private DurableRecord readRecord(String file) {
        try {
            String json = storagePort.getText(directory, file).join();
            if (json == null || json.isBlank()) {
                return null;
            }
            DurableRecord record = objectMapper.readValue(json, DurableRecord.class);
            if (record.getId() == null || record.getLaneId() == null) {
                log.warn("[DurableQueue] skipping incomplete record file {}", file);
                return null;
            }
            if (record.getEnqueuedAt() == null) {
                record.setEnqueuedAt(Instant.EPOCH);
            }
            return record;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[DurableQueue] skipping unreadable record file {}: {}", file, e.getMessage());
            return null;
        }
    }

    private Instant nextTimestamp() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        return lastTimestamp.updateAndGet(last -> now.isAfter(last) ? now : last.plus(1, ChronoUnit.MICROS));
    }

    static String fileName(String recordId) {
        return UNSAFE_FILE_CHARS.matcher(recordId).replaceAll("_") + FILE_SUFFIX;
    }
}
