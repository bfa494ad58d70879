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

import me.golemcore.taskcore.domain.model.WorkItem;

import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Processes one work item on its lane worker. The lane does not start the next
 * item until this method has returned.
 */
@FunctionalInterface
public interface WorkItemHandler {

    void handle(WorkItem item) throws Exception;

    /**
     * Adapts an asynchronous handler: the lane worker waits for the returned
     * stage before moving on.
     */
    static WorkItemHandler awaiting(Function<WorkItem, ? extends CompletionStage<?>> asyncHandler) {
        return item -> asyncHandler.apply(item).toCompletableFuture().get();
    }
}
