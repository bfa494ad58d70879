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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted metadata of a loaded plugin, refreshed on every load and reload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PluginManifest {

    public static final String DEFAULT_VERSION = "0.0.0";
    public static final String DEFAULT_AUTHOR = "local";
    public static final String SOURCE_LOCAL = "local";

    private String name;
    private String displayName;
    private String description;
    @Builder.Default
    private String version = DEFAULT_VERSION;
    @Builder.Default
    private String author = DEFAULT_AUTHOR;
    @Builder.Default
    private String source = SOURCE_LOCAL;
    @Builder.Default
    private List<String> declaredActions = new ArrayList<>();
    @Builder.Default
    private List<String> declaredTools = new ArrayList<>();
    @Builder.Default
    private List<String> requiredEnvVars = new ArrayList<>();
    private Instant loadedAt;
    private boolean enabled;
}
