package me.golemcore.taskcore.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.taskcore.domain.model.CapabilityDefinition;
import me.golemcore.taskcore.domain.service.CapabilityRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/capabilities")
@RequiredArgsConstructor
public class CapabilitiesController {

    private final CapabilityRegistry registry;

    @GetMapping
    public Mono<ResponseEntity<List<CapabilityDefinition>>> listCapabilities() {
        return Mono.just(ResponseEntity.ok(registry.listDefinitions()));
    }
}
