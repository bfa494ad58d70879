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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskcore.domain.model.PluginDescriptor;
import me.golemcore.taskcore.domain.model.PluginInstallException;
import me.golemcore.taskcore.domain.model.PluginLoadException;
import me.golemcore.taskcore.domain.model.PluginManifest;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import me.golemcore.taskcore.port.outbound.PluginRuntimePort;
import me.golemcore.taskcore.port.outbound.PluginSourcePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Installs a plugin from a URL into the plugin directory.
 *
 * <p>
 * The source is validated before anything is written, and an existing file is
 * never overwritten.
 */
@Service
@Slf4j
public class PluginInstallService {

    private static final Pattern GITHUB_BLOB = Pattern
            .compile("^https?://github\\.com/([^/]+)/([^/]+)/blob/(.+)$");
    private static final Pattern FILE_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]*$");

    private final PluginHostService pluginHost;
    private final PluginRuntimePort runtime;
    private final PluginSourcePort sourcePort;
    private final TaskCoreProperties.PluginProperties settings;

    public PluginInstallService(PluginHostService pluginHost, PluginRuntimePort runtime,
            PluginSourcePort sourcePort, TaskCoreProperties properties) {
        this.pluginHost = pluginHost;
        this.runtime = runtime;
        this.sourcePort = sourcePort;
        this.settings = properties.getPlugins();
    }

    public PluginManifest installFromUrl(String url) {
        if (!settings.isEnabled() || !settings.isInstallEnabled()) {
            throw new PluginInstallException("Plugin installation is disabled");
        }
        if (url == null || url.isBlank()) {
            throw new PluginInstallException("URL is required");
        }

        String rawUrl = toRawUrl(url.trim());
        String fileName = fileNameOf(rawUrl);
        Path directory = pluginHost.getPluginDirectory();
        Path target = directory.resolve(fileName).normalize();
        if (!target.startsWith(directory)) {
            throw new PluginInstallException("Invalid file name: " + fileName);
        }
        if (Files.exists(target)) {
            throw new PluginInstallException("A plugin file named '" + fileName + "' already exists");
        }

        String source;
        try {
            source = sourcePort.fetch(rawUrl);
        } catch (IOException e) {
            throw new PluginInstallException("Download failed: " + e.getMessage(), e);
        }

        PluginDescriptor descriptor;
        try {
            descriptor = runtime.inspect(source);
        } catch (PluginLoadException e) {
            throw new PluginInstallException("Validation failed: " + e.getMessage(), e);
        }
        if (pluginHost.isLoaded(descriptor.getName())) {
            throw new PluginInstallException("A plugin named '" + descriptor.getName() + "' is already loaded");
        }

        try {
            Files.createDirectories(directory);
            Files.writeString(target, source, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        } catch (IOException e) {
            throw new PluginInstallException("Cannot write plugin file: " + e.getMessage(), e);
        }

        try {
            PluginManifest manifest = pluginHost.load(target, url.trim());
            log.info("[PluginInstall] installed '{}' from {}", manifest.getName(), url);
            return manifest;
        } catch (PluginLoadException e) {
            deleteQuietly(target);
            throw new PluginInstallException("Load failed: " + e.getMessage(), e);
        }
    }

    /**
     * Convert a GitHub file page URL into its raw content URL. Other URLs are
     * returned unchanged.
     */
    static String toRawUrl(String url) {
        Matcher matcher = GITHUB_BLOB.matcher(url);
        if (!matcher.matches()) {
            return url;
        }
        return "https://raw.githubusercontent.com/" + matcher.group(1) + "/" + matcher.group(2) + "/"
                + matcher.group(3);
    }

    static String fileNameOf(String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new PluginInstallException("Invalid URL: " + url, e);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new PluginInstallException("Only http and https URLs are supported");
        }
        String path = uri.getPath();
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            throw new PluginInstallException("URL does not name a file: " + url);
        }
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        if (!FILE_NAME.matcher(fileName).matches()) {
            throw new PluginInstallException("Invalid file name: " + fileName);
        }
        return fileName;
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[PluginInstall] failed to remove {}: {}", file, e.getMessage());
        }
    }
}
