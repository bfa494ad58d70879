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
import me.golemcore.taskcore.domain.model.PluginManifest;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import me.golemcore.taskcore.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Persists one {@code <name>.json} manifest per plugin.
 */
@Service
@Slf4j
public class PluginManifestStore {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;

    public PluginManifestStore(StoragePort storagePort, ObjectMapper objectMapper, TaskCoreProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = properties.getStorage().getDirectories().getManifests();
    }

    /**
     * Write the manifest. A failed write is logged and does not affect the
     * loaded plugin.
     */
    public void save(PluginManifest manifest) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(manifest);
            storagePort.putTextAtomic(directory, manifest.getName() + ".json", json).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Plugins] failed to write manifest for '{}': {}", manifest.getName(), e.getMessage());
        }
    }

    public Optional<PluginManifest> find(String name) {
        try {
            String json = storagePort.getText(directory, name + ".json").join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, PluginManifest.class));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Plugins] unreadable manifest for '{}': {}", name, e.getMessage());
            return Optional.empty();
        }
    }
}
