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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskcore.domain.model.TaskResultEvent;
import me.golemcore.taskcore.domain.model.WorkItem;
import me.golemcore.taskcore.domain.system.toolloop.ToolCallingLoop;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import me.golemcore.taskcore.port.inbound.SubmissionPort;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Connects transports to the core: every submitted payload is queued on its
 * lane and answered by the primary assistant role through the tool-calling
 * loop.
 *
 * <p>
 * On startup, items left over by a crashed process are recovered and answered
 * again; their results are only published as {@link TaskResultEvent}s since
 * the original caller is gone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssistantTaskService implements SubmissionPort {

    private final LaneQueueService laneQueueService;
    private final ToolCallingLoop toolCallingLoop;
    private final RoleCatalog roleCatalog;
    private final ApplicationEventPublisher eventPublisher;
    private final TaskCoreProperties properties;

    @Override
    public void submit(String laneId, String payload, Consumer<String> onResult) {
        Objects.requireNonNull(onResult, "onResult");
        laneQueueService.enqueue(laneId, payload, item -> {
            String result = answer(item);
            eventPublisher.publishEvent(new TaskResultEvent(item.getLaneId(), item.getRecordId(),
                    item.getPayload(), result, false));
            onResult.accept(result);
        });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        if (!properties.getLanes().isRecoverOnStartup()) {
            log.info("[Assistant] startup recovery disabled");
            return;
        }
        int recovered = laneQueueService.recoverOrphans(laneId -> item -> {
            String result = answer(item);
            eventPublisher.publishEvent(new TaskResultEvent(item.getLaneId(), item.getRecordId(),
                    item.getPayload(), result, true));
        });
        if (recovered > 0) {
            log.info("[Assistant] re-submitted {} item(s) interrupted by the previous shutdown", recovered);
        }
    }

    String answer(WorkItem item) {
        try {
            return toolCallingLoop.run(roleCatalog.assistantRole(), item.getPayload());
        } catch (RuntimeException e) {
            log.error("[Assistant] failed to answer lane={}, record={}: {}", item.getLaneId(), item.getRecordId(),
                    e.getMessage(), e);
            return properties.getAssistant().getFailureReply();
        }
    }
}
