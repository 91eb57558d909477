package com.tableadvisor.advisor.controller;

import com.tableadvisor.advisor.decoder.FrameDecoder;
import com.tableadvisor.advisor.dto.EngineDiagnostics;
import com.tableadvisor.advisor.dto.ReconcileOutcome;
import com.tableadvisor.advisor.dto.SessionStarted;
import com.tableadvisor.advisor.service.AdvisorService;
import com.tableadvisor.common.exception.AdvisorException;
import com.tableadvisor.common.model.PixelSignal;
import com.tableadvisor.common.model.UiState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/sessions")
public class AdvisorController {

    private static final Logger log = LoggerFactory.getLogger(AdvisorController.class);

    private final AdvisorService advisorService;
    private final FrameDecoder frameDecoder;

    public AdvisorController(AdvisorService advisorService, FrameDecoder frameDecoder) {
        this.advisorService = advisorService;
        this.frameDecoder = frameDecoder;
    }

    @PostMapping
    public Mono<ResponseEntity<SessionStarted>> start() {
        log.info("Session start requested");
        return advisorService.startSession()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Session start endpoint error", e));
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<Void>> stop(@PathVariable String sessionId) {
        log.info("Session stop requested. sessionId={}", sessionId);
        return advisorService.stopSession(sessionId)
            .map(stopped -> ResponseEntity.ok().<Void>build())
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Session stop endpoint error. sessionId={}", sessionId, e));
    }

    @PostMapping("/{sessionId}/reset")
    public Mono<ResponseEntity<UiState>> reset(@PathVariable String sessionId) {
        log.info("Session reset requested. sessionId={}", sessionId);
        return advisorService.resetSession(sessionId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Reset endpoint error. sessionId={}", sessionId, e));
    }

    @PostMapping(value = "/{sessionId}/frames",
                 consumes = {MediaType.IMAGE_PNG_VALUE, MediaType.IMAGE_JPEG_VALUE,
                             MediaType.APPLICATION_OCTET_STREAM_VALUE})
    public Mono<ResponseEntity<UiState>> frame(@PathVariable String sessionId, @RequestBody byte[] body) {
        log.debug("Received frame. sessionId={} bytes={}", sessionId, body.length);
        return Mono.fromCallable(() -> frameDecoder.decode(sessionId, body))
            .flatMap(frame -> advisorService.submitFrame(sessionId, frame))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .onErrorResume(AdvisorException.class, e -> {
                log.warn("Frame rejected. sessionId={} reason={}", sessionId, e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            })
            .doOnError(e -> log.error("Frame endpoint error. sessionId={}", sessionId, e));
    }

    @PostMapping("/{sessionId}/pixel-signal")
    public Mono<ResponseEntity<UiState>> pixelSignal(@PathVariable String sessionId,
                                                     @RequestBody PixelSignal signal) {
        log.debug("Received pixel signal. sessionId={} confidence={}", sessionId, signal.confidence());
        return advisorService.submitPixelSignal(sessionId, signal)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Pixel signal endpoint error. sessionId={}", sessionId, e));
    }

    @PostMapping(value = "/{sessionId}/responses", consumes = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<ReconcileOutcome>> response(@PathVariable String sessionId,
                                                           @RequestBody(required = false) String text) {
        log.info("Received response. sessionId={} chars={}", sessionId, text == null ? 0 : text.length());
        return advisorService.submitResponse(sessionId, text)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Response endpoint error. sessionId={}", sessionId, e));
    }

    @PostMapping(value = "/{sessionId}/responses/partial", consumes = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<ReconcileOutcome>> partial(@PathVariable String sessionId,
                                                          @RequestBody(required = false) String text) {
        log.debug("Received partial. sessionId={} chars={}", sessionId, text == null ? 0 : text.length());
        return advisorService.submitPartial(sessionId, text)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Partial endpoint error. sessionId={}", sessionId, e));
    }

    @PostMapping("/{sessionId}/controls/appeared")
    public Mono<ResponseEntity<UiState>> controlsAppeared(@PathVariable String sessionId) {
        return advisorService.controlAppeared(sessionId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Controls appeared endpoint error. sessionId={}", sessionId, e));
    }

    @PostMapping("/{sessionId}/controls/disappeared")
    public Mono<ResponseEntity<UiState>> controlsDisappeared(@PathVariable String sessionId) {
        return advisorService.controlDisappeared(sessionId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Controls disappeared endpoint error. sessionId={}", sessionId, e));
    }

    @GetMapping("/{sessionId}/state")
    public Mono<ResponseEntity<UiState>> state(@PathVariable String sessionId) {
        return advisorService.currentState(sessionId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{sessionId}/diagnostics")
    public Mono<ResponseEntity<EngineDiagnostics>> diagnostics(@PathVariable String sessionId) {
        log.info("Diagnostics query received. sessionId={}", sessionId);
        return advisorService.diagnostics(sessionId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Diagnostics endpoint error. sessionId={}", sessionId, e));
    }

    @GetMapping(value = "/{sessionId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<ResponseEntity<Flux<ServerSentEvent<UiState>>>> stream(@PathVariable String sessionId) {
        log.info("SSE stream client connected. sessionId={}", sessionId);
        return advisorService.stream(sessionId)
            .map(states -> ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(states.map(state -> ServerSentEvent.<UiState>builder()
                    .event("ui-state")
                    .data(state)
                    .build())))
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
