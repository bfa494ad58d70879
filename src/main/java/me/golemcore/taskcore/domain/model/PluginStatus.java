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

import java.util.List;

/**
 * Loaded plugin with its computed readiness. A plugin is not ready while any of
 * its required environment variables is missing.
 */
public record PluginStatus(PluginManifest manifest, List<String> missingEnv, boolean ready) {

    public static PluginStatus of(PluginManifest manifest, List<String> missingEnv) {
        List<String> missing = missingEnv != null ? List.copyOf(missingEnv) : List.of();
        return new PluginStatus(manifest, missing, missing.isEmpty());
    }
}
