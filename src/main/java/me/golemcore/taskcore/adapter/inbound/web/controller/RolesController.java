package me.golemcore.taskcore.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.taskcore.adapter.inbound.web.dto.DelegateRequest;
import me.golemcore.taskcore.adapter.inbound.web.dto.RoleDto;
import me.golemcore.taskcore.domain.model.RoleProfile;
import me.golemcore.taskcore.domain.service.RoleCatalog;
import me.golemcore.taskcore.domain.service.SubAgentService;
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
 * Sub-agent roles and direct delegation.
 */
@RestController
@RequestMapping("/api/roles")
@RequiredArgsConstructor
public class RolesController {

    private final RoleCatalog roleCatalog;
    private final SubAgentService subAgentService;

    @GetMapping
    public Mono<ResponseEntity<List<RoleDto>>> listRoles() {
        List<RoleDto> roles = roleCatalog.listRoles().stream()
                .map(RolesController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(roles));
    }

    @PostMapping("/{role}/delegate")
    public Mono<ResponseEntity<Map<String, String>>> delegate(@PathVariable String role,
            @RequestBody DelegateRequest request) {
        if (roleCatalog.find(role).isEmpty()) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        if (request == null || request.getMission() == null || request.getMission().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "mission is required"));
        }
        return Mono.fromCallable(() -> subAgentService.delegate(role, request.getMission(), request.getContext()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(Map.of("role", role, "result", result)));
    }

    private static RoleDto toDto(RoleProfile role) {
        return RoleDto.builder()
                .name(role.getName())
                .displayName(role.resolveDisplayName())
                .capabilities(role.isRestricted() ? role.getCapabilityWhitelist().stream().sorted().toList() : null)
                .maxReplyTokens(role.getMaxReplyTokens())
                .build();
    }
}
