package me.golemcore.taskcore.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.taskcore.adapter.inbound.web.dto.InstallPluginRequest;
import me.golemcore.taskcore.adapter.inbound.web.dto.PluginDto;
import me.golemcore.taskcore.adapter.inbound.web.dto.RunPluginRequest;
import me.golemcore.taskcore.domain.model.PluginLoadException;
import me.golemcore.taskcore.domain.model.PluginManifest;
import me.golemcore.taskcore.domain.model.PluginStatus;
import me.golemcore.taskcore.domain.service.PluginHostService;
import me.golemcore.taskcore.domain.service.PluginInstallService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Plugin management endpoints. Runs and installs block, so they are moved
 * off the event loop.
 */
@RestController
@RequestMapping("/api/plugins")
@RequiredArgsConstructor
public class PluginsController {

    private final PluginHostService pluginHost;
    private final PluginInstallService pluginInstallService;

    @GetMapping
    public Mono<ResponseEntity<List<PluginDto>>> listPlugins() {
        List<PluginDto> plugins = pluginHost.listPlugins().stream()
                .map(PluginsController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(plugins));
    }

    @PostMapping("/reload")
    public Mono<ResponseEntity<Map<String, Object>>> reloadAll() {
        return Mono.fromCallable(pluginHost::reloadAll)
                .subscribeOn(Schedulers.boundedElastic())
                .map(loaded -> ResponseEntity.ok(Map.<String, Object>of("loaded", loaded)));
    }

    @PostMapping("/{name}/reload")
    public Mono<ResponseEntity<PluginDto>> reload(@PathVariable String name) {
        if (!pluginHost.isLoaded(name)) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.fromCallable(() -> {
            try {
                pluginHost.reload(name);
            } catch (PluginLoadException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
            }
            return pluginHost.getPlugin(name)
                    .map(status -> ResponseEntity.ok(toDto(status)))
                    .orElseGet(() -> ResponseEntity.notFound().build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{name}/disable")
    public Mono<ResponseEntity<Map<String, String>>> disable(@PathVariable String name) {
        if (!pluginHost.disable(name)) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.ok(Map.of("status", "disabled")));
    }

    @PostMapping("/{name}/run")
    public Mono<ResponseEntity<Map<String, String>>> run(@PathVariable String name,
            @RequestBody RunPluginRequest request) {
        if (!pluginHost.isLoaded(name)) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        String action = request != null ? request.getAction() : null;
        Map<String, Object> arguments = request != null ? request.getArguments() : null;
        return Mono.fromCallable(() -> pluginHost.run(name, action, arguments))
                .subscribeOn(Schedulers.boundedElastic())
                .map(output -> ResponseEntity.ok(Map.of(
                        "plugin", name,
                        "action", action != null ? action : "",
                        "output", output)));
    }

    @PostMapping("/install")
    public Mono<ResponseEntity<PluginDto>> install(@RequestBody InstallPluginRequest request) {
        String url = request != null ? request.getUrl() : null;
        return Mono.fromCallable(() -> pluginInstallService.installFromUrl(url))
                .subscribeOn(Schedulers.boundedElastic())
                .map(PluginManifest::getName)
                .map(installed -> pluginHost.getPlugin(installed)
                        .map(status -> ResponseEntity.status(HttpStatus.CREATED).body(toDto(status)))
                        .orElseGet(() -> ResponseEntity.status(HttpStatus.CREATED).build()));
    }

    static PluginDto toDto(PluginStatus status) {
        PluginManifest manifest = status.manifest();
        return PluginDto.builder()
                .name(manifest.getName())
                .displayName(manifest.getDisplayName())
                .description(manifest.getDescription())
                .version(manifest.getVersion())
                .author(manifest.getAuthor())
                .source(manifest.getSource())
                .actions(manifest.getDeclaredActions())
                .tools(manifest.getDeclaredTools())
                .requiredEnv(manifest.getRequiredEnvVars())
                .missingEnv(status.missingEnv())
                .enabled(manifest.isEnabled())
                .ready(status.ready())
                .loadedAt(manifest.getLoadedAt())
                .build();
    }
}
