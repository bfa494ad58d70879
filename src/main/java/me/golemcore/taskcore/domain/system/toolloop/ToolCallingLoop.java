package me.golemcore.taskcore.domain.system.toolloop;

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

import me.golemcore.taskcore.domain.model.RoleProfile;

/**
 * Drives one model conversation to a final answer, executing requested
 * capabilities under the role's whitelist.
 */
public interface ToolCallingLoop {

    ToolLoopTurnResult execute(RoleProfile role, String initialPrompt, String contextHint);

    default String run(RoleProfile role, String initialPrompt, String contextHint) {
        return execute(role, initialPrompt, contextHint).content();
    }

    default String run(RoleProfile role, String initialPrompt) {
        return run(role, initialPrompt, null);
    }
}
