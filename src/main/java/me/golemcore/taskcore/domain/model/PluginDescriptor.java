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

import java.nio.file.Path;
import java.util.List;

/**
 * Parsed declaration of a plugin file.
 */
@Value
@Builder(toBuilder = true)
public class PluginDescriptor {

    String name;
    String displayName;
    String description;
    String version;
    String author;
    @Builder.Default
    List<String> actions = List.of();
    /** Actions that are also exposed as their own capability. */
    @Builder.Default
    List<String> tools = List.of();
    @Builder.Default
    List<String> requiredEnv = List.of();
    /** Interpreter command tokens used to run the file, e.g. {@code [sh]}. */
    @Builder.Default
    List<String> interpreter = List.of();
    Path location;

    public boolean declaresAction(String action) {
        return actions.isEmpty() || actions.contains(action);
    }
}
