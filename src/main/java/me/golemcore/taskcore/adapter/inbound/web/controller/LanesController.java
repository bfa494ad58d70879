package me.golemcore.taskcore.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.taskcore.adapter.inbound.web.dto.SubmitItemRequest;
import me.golemcore.taskcore.adapter.inbound.web.dto.SubmitItemResponse;
import me.golemcore.taskcore.domain.model.LaneStatus;
import me.golemcore.taskcore.domain.service.LaneQueueService;
import me.golemcore.taskcore.port.inbound.SubmissionPort;
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

import java.util.List;

/**
 * Lane submission and observability endpoints.
 */
@RestController
@RequestMapping("/api/lanes")
@RequiredArgsConstructor
public class LanesController {

    private final SubmissionPort submissionPort;
    private final LaneQueueService laneQueueService;

    /**
     * Queue a payload on the lane and answer once its result is ready.
     */
    @PostMapping("/{laneId}/items")
    public Mono<ResponseEntity<SubmitItemResponse>> submit(@PathVariable String laneId,
            @RequestBody SubmitItemRequest request) {
        if (request == null || request.getPayload() == null || request.getPayload().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "payload is required"));
        }
        return Mono.create(sink -> {
            try {
                submissionPort.submit(laneId, request.getPayload(),
                        result -> sink.success(ResponseEntity.ok(new SubmitItemResponse(laneId, result))));
            } catch (IllegalStateException e) {
                sink.error(e);
            }
        });
    }

    @GetMapping
    public Mono<ResponseEntity<List<LaneStatus>>> listLanes() {
        return Mono.just(ResponseEntity.ok(List.copyOf(laneQueueService.snapshot().values())));
    }

    @GetMapping("/{laneId}")
    public Mono<ResponseEntity<LaneStatus>> getLane(@PathVariable String laneId) {
        return Mono.just(ResponseEntity.ok(laneQueueService.status(laneId)));
    }
}
