package com.github.spud.worksession.interfaces.rest;

import com.github.spud.worksession.domain.project.ProjectSummary;
import com.github.spud.worksession.domain.session.SessionStatusView;
import com.github.spud.worksession.domain.session.SessionTracker;
import com.github.spud.worksession.domain.session.SessionTracker.StartSessionRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Work session API. Tracker calls block on the database, so each one runs on the
 * bounded elastic scheduler; errors are rendered by {@link GlobalExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/sessions")
@RequiredArgsConstructor
public class WorkSessionController {

  private final SessionTracker tracker;

  @PostMapping
  public Mono<ResponseEntity<SessionIdResponse>> startSession(
    @Valid @RequestBody(required = false) StartSessionRequestDto request
  ) {
    StartSessionRequestDto body = request != null ? request : new StartSessionRequestDto();
    return Mono.fromCallable(() -> {
        log.info("Starting session: key={}, projectId={}", body.getTrackingKey(),
          body.getProjectId());
        UUID sessionId = tracker.startSession(StartSessionRequest.builder()
          .trackingKey(body.getTrackingKey())
          .projectId(body.getProjectId())
          .title(body.getTitle())
          .description(body.getDescription())
          .agentType(body.getAgentType())
          .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(new SessionIdResponse(sessionId));
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/active")
  public Mono<ResponseEntity<SessionIdResponse>> activeSession(
    @RequestParam(name = "key", required = false) String trackingKey
  ) {
    return Mono.fromCallable(() -> tracker.getActiveSession(trackingKey)
        .map(id -> ResponseEntity.ok(new SessionIdResponse(id)))
        .orElseGet(() -> ResponseEntity.noContent().build()))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{sessionId}/end")
  public Mono<ResponseEntity<SessionStatusView>> endSession(@PathVariable UUID sessionId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(tracker.endSession(sessionId)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{sessionId}/disconnect")
  public Mono<ResponseEntity<SessionStatusView>> disconnect(
    @PathVariable UUID sessionId,
    @RequestBody(required = false) DisconnectRequestDto request
  ) {
    String reason = request != null ? request.getReason() : null;
    return Mono.fromCallable(() -> ResponseEntity.ok(tracker.markDisconnected(sessionId, reason)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{sessionId}/tokens")
  public Mono<ResponseEntity<Void>> recordTokens(
    @PathVariable UUID sessionId,
    @Valid @RequestBody TokenUsageRequestDto request
  ) {
    return Mono.fromCallable(() -> {
        tracker.recordTokenUsage(sessionId, request.getInputTokens(), request.getOutputTokens());
        return ResponseEntity.noContent().<Void>build();
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{sessionId}/tasks")
  public Mono<ResponseEntity<Void>> recordTaskCreated(@PathVariable UUID sessionId) {
    return Mono.fromCallable(() -> {
        tracker.recordTaskCreated(sessionId);
        return ResponseEntity.noContent().<Void>build();
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{sessionId}/tasks/updates")
  public Mono<ResponseEntity<Void>> recordTaskUpdated(
    @PathVariable UUID sessionId,
    @RequestBody(required = false) TaskUpdateRequestDto request
  ) {
    boolean completed = request != null && request.isCompleted();
    return Mono.fromCallable(() -> {
        tracker.recordTaskUpdated(sessionId, completed);
        return ResponseEntity.noContent().<Void>build();
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{sessionId}/contexts")
  public Mono<ResponseEntity<Void>> recordContextCreated(@PathVariable UUID sessionId) {
    return Mono.fromCallable(() -> {
        tracker.recordContextCreated(sessionId);
        return ResponseEntity.noContent().<Void>build();
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{sessionId}/activity")
  public Mono<ResponseEntity<Void>> touchActivity(@PathVariable UUID sessionId) {
    return Mono.fromCallable(() -> {
        tracker.updateSessionActivity(sessionId);
        return ResponseEntity.noContent().<Void>build();
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PutMapping("/{sessionId}/project")
  public Mono<ResponseEntity<ProjectSummary>> assignProject(
    @PathVariable UUID sessionId,
    @Valid @RequestBody ProjectRefRequestDto request
  ) {
    return Mono.fromCallable(() -> ResponseEntity.ok(
        tracker.assignSessionToProject(sessionId, request.getProject())))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PatchMapping("/{sessionId}")
  public Mono<ResponseEntity<Void>> updateDetails(
    @PathVariable UUID sessionId,
    @Valid @RequestBody SessionDetailsRequestDto request
  ) {
    return Mono.fromCallable(() -> {
        tracker.updateSessionDetails(sessionId, request.getTitle(), request.getDescription());
        return ResponseEntity.noContent().<Void>build();
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{sessionId}/status")
  public Mono<ResponseEntity<SessionStatusView>> status(@PathVariable UUID sessionId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(tracker.getSessionStatus(sessionId)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/default-project")
  public Mono<ResponseEntity<ProjectSummary>> defaultProject() {
    return Mono.fromCallable(() -> tracker.currentDefaultProject()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build()))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PutMapping("/current-project")
  public Mono<ResponseEntity<ProjectSummary>> switchCurrentProject(
    @Valid @RequestBody CurrentProjectRequestDto request
  ) {
    return Mono.fromCallable(() -> ResponseEntity.ok(
        tracker.switchCurrentProject(request.getTrackingKey(), request.getProject())))
      .subscribeOn(Schedulers.boundedElastic());
  }

  // ===== DTOs =====

  @Data
  public static class StartSessionRequestDto {

    @Size(max = 255)
    private String trackingKey;
    private UUID projectId;
    @Size(max = 255)
    private String title;
    private String description;
    @Size(max = 50)
    private String agentType;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class SessionIdResponse {

    private UUID sessionId;
  }

  @Data
  public static class TokenUsageRequestDto {

    @NotNull
    @PositiveOrZero
    private Long inputTokens;

    @NotNull
    @PositiveOrZero
    private Long outputTokens;
  }

  @Data
  public static class TaskUpdateRequestDto {

    private boolean completed;
  }

  @Data
  public static class ProjectRefRequestDto {

    /**
     * Project id or name
     */
    @NotBlank
    private String project;
  }

  @Data
  public static class SessionDetailsRequestDto {

    @Size(max = 255)
    private String title;
    private String description;
  }

  @Data
  public static class DisconnectRequestDto {

    private String reason;
  }

  @Data
  public static class CurrentProjectRequestDto {

    private String trackingKey;

    @NotBlank
    private String project;
  }
}
