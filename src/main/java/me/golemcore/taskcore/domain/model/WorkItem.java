package me.golemcore.taskcore.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Unit of work submitted to a lane.
 *
 * <p>
 * Carries the id of its write-ahead record so the lane worker can complete the
 * record once the handler has returned. {@code recordId} is {@code null} when
 * the write-ahead write failed; the item is still processed in memory.
 */
@Value
@Builder
public class WorkItem {

    String recordId;
    String laneId;
    String payload;
    Instant enqueuedAt;
    boolean recovered;
}
