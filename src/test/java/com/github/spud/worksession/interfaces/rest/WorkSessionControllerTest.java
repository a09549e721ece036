package com.github.spud.worksession.interfaces.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.worksession.domain.project.ProjectNotFoundException;
import com.github.spud.worksession.domain.project.ProjectSummary;
import com.github.spud.worksession.domain.session.SessionCreationFailedException;
import com.github.spud.worksession.domain.session.SessionNotFoundException;
import com.github.spud.worksession.domain.session.SessionStatus;
import com.github.spud.worksession.domain.session.SessionStatusView;
import com.github.spud.worksession.domain.session.SessionTracker;
import com.github.spud.worksession.domain.session.SessionTracker.StartSessionRequest;
import com.github.spud.worksession.domain.session.TokenCounts;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * HTTP mapping and error rendering of the session API
 */
@WebFluxTest(WorkSessionController.class)
class WorkSessionControllerTest {

  @Autowired
  private WebTestClient webTestClient;

  @MockBean
  private SessionTracker tracker;

  private final UUID sessionId = UUID.randomUUID();

  @Test
  void shouldStartSessionWithRequestFields() {
    UUID projectId = UUID.randomUUID();
    when(tracker.startSession(any(StartSessionRequest.class))).thenReturn(sessionId);

    String requestBody = """
      {
        "trackingKey": "ide-1",
        "projectId": "%s",
        "title": "Refactor parser",
        "agentType": "cli"
      }
      """.formatted(projectId);

    webTestClient.post()
      .uri("/sessions")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(requestBody)
      .exchange()
      .expectStatus().isCreated()
      .expectBody()
      .jsonPath("$.sessionId").isEqualTo(sessionId.toString());

    ArgumentCaptor<StartSessionRequest> captor = ArgumentCaptor.forClass(StartSessionRequest.class);
    verify(tracker).startSession(captor.capture());
    assertThat(captor.getValue().getTrackingKey()).isEqualTo("ide-1");
    assertThat(captor.getValue().getProjectId()).isEqualTo(projectId);
    assertThat(captor.getValue().getTitle()).isEqualTo("Refactor parser");
    assertThat(captor.getValue().getAgentType()).isEqualTo("cli");
  }

  @Test
  void shouldStartSessionWithoutBody() {
    when(tracker.startSession(any(StartSessionRequest.class))).thenReturn(sessionId);

    webTestClient.post()
      .uri("/sessions")
      .exchange()
      .expectStatus().isCreated();
  }

  @Test
  void shouldRenderCreationFailureAsUnavailable() {
    when(tracker.startSession(any(StartSessionRequest.class)))
      .thenThrow(new SessionCreationFailedException("Session could not be created",
        new IllegalStateException("connection refused")));

    webTestClient.post()
      .uri("/sessions")
      .exchange()
      .expectStatus().isEqualTo(503)
      .expectBody()
      .jsonPath("$.code").isEqualTo("SESSION_CREATION_FAILED")
      .jsonPath("$.message").isEqualTo("Session could not be created");
  }

  @Test
  void shouldReturnActiveSessionOrNoContent() {
    when(tracker.getActiveSession("ide-1")).thenReturn(Optional.of(sessionId));
    when(tracker.getActiveSession("ide-2")).thenReturn(Optional.empty());

    webTestClient.get()
      .uri("/sessions/active?key=ide-1")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.sessionId").isEqualTo(sessionId.toString());

    webTestClient.get()
      .uri("/sessions/active?key=ide-2")
      .exchange()
      .expectStatus().isNoContent();
  }

  @Test
  void shouldEndSession() {
    when(tracker.endSession(sessionId)).thenReturn(SessionStatusView.builder()
      .sessionId(sessionId)
      .status(SessionStatus.INACTIVE)
      .startedAt(OffsetDateTime.parse("2025-01-06T09:00:00Z"))
      .endedAt(OffsetDateTime.parse("2025-01-06T10:00:00Z"))
      .duration(Duration.ofHours(1))
      .tokens(TokenCounts.of(120, 30))
      .productivityScore(2.5)
      .build());

    webTestClient.post()
      .uri("/sessions/{id}/end", sessionId)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.sessionId").isEqualTo(sessionId.toString())
      .jsonPath("$.status").isEqualTo("INACTIVE")
      .jsonPath("$.tokens.total").isEqualTo(150)
      .jsonPath("$.productivityScore").isEqualTo(2.5);
  }

  @Test
  void shouldRenderUnknownSessionAsNotFound() {
    when(tracker.endSession(sessionId)).thenThrow(new SessionNotFoundException(sessionId));

    webTestClient.post()
      .uri("/sessions/{id}/end", sessionId)
      .exchange()
      .expectStatus().isNotFound()
      .expectBody()
      .jsonPath("$.code").isEqualTo("SESSION_NOT_FOUND")
      .jsonPath("$.details.sessionId").isEqualTo(sessionId.toString());
  }

  @Test
  void shouldRecordTokenUsage() {
    webTestClient.post()
      .uri("/sessions/{id}/tokens", sessionId)
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("""
        {"inputTokens": 100, "outputTokens": 20}
        """)
      .exchange()
      .expectStatus().isNoContent();

    verify(tracker).recordTokenUsage(sessionId, 100L, 20L);
  }

  @Test
  void shouldRejectNegativeTokenCounts() {
    webTestClient.post()
      .uri("/sessions/{id}/tokens", sessionId)
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("""
        {"inputTokens": -1, "outputTokens": 20}
        """)
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody()
      .jsonPath("$.code").isEqualTo("VALIDATION_ERROR")
      .jsonPath("$.details.fieldErrors.inputTokens").exists();

    verify(tracker, never()).recordTokenUsage(any(UUID.class), anyLong(), anyLong());
  }

  @Test
  void shouldRecordCompletedTaskUpdate() {
    webTestClient.post()
      .uri("/sessions/{id}/tasks/updates", sessionId)
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("""
        {"completed": true}
        """)
      .exchange()
      .expectStatus().isNoContent();

    verify(tracker).recordTaskUpdated(sessionId, true);
  }

  @Test
  void shouldRenderRecordingAgainstClosedSessionAsNotFound() {
    doThrow(new SessionNotFoundException(sessionId)).when(tracker).recordContextCreated(sessionId);

    webTestClient.post()
      .uri("/sessions/{id}/contexts", sessionId)
      .exchange()
      .expectStatus().isNotFound();
  }

  @Test
  void shouldAssignProjectByReference() {
    ProjectSummary project = new ProjectSummary(UUID.randomUUID(), "backend", false);
    when(tracker.assignSessionToProject(sessionId, "backend")).thenReturn(project);

    webTestClient.put()
      .uri("/sessions/{id}/project", sessionId)
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("""
        {"project": "backend"}
        """)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.name").isEqualTo("backend")
      .jsonPath("$.id").isEqualTo(project.id().toString());
  }

  @Test
  void shouldRenderUnknownProjectAsNotFound() {
    when(tracker.assignSessionToProject(sessionId, "nope"))
      .thenThrow(new ProjectNotFoundException("Project 'nope' not found"));

    webTestClient.put()
      .uri("/sessions/{id}/project", sessionId)
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("""
        {"project": "nope"}
        """)
      .exchange()
      .expectStatus().isNotFound()
      .expectBody()
      .jsonPath("$.code").isEqualTo("PROJECT_NOT_FOUND");
  }

  @Test
  void shouldRejectEmptyDetailsUpdate() {
    doThrow(new IllegalArgumentException("Either title or description must be provided"))
      .when(tracker).updateSessionDetails(sessionId, null, null);

    webTestClient.patch()
      .uri("/sessions/{id}", sessionId)
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("{}")
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody()
      .jsonPath("$.code").isEqualTo("INVALID_ARGUMENT");
  }

  @Test
  void shouldRejectOverlongStartFields() {
    webTestClient.post()
      .uri("/sessions")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("""
        {"title": "%s", "agentType": "%s"}
        """.formatted("t".repeat(300), "a".repeat(51)))
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody()
      .jsonPath("$.code").isEqualTo("VALIDATION_ERROR")
      .jsonPath("$.details.fieldErrors.title").exists()
      .jsonPath("$.details.fieldErrors.agentType").exists();

    verify(tracker, never()).startSession(any(StartSessionRequest.class));
  }

  @Test
  void shouldRejectOverlongDetailsTitle() {
    webTestClient.patch()
      .uri("/sessions/{id}", sessionId)
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("""
        {"title": "%s"}
        """.formatted("t".repeat(256)))
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody()
      .jsonPath("$.code").isEqualTo("VALIDATION_ERROR")
      .jsonPath("$.details.fieldErrors.title").exists();

    verify(tracker, never()).updateSessionDetails(any(UUID.class), any(), any());
  }

  @Test
  void shouldRejectMalformedSessionId() {
    webTestClient.get()
      .uri("/sessions/not-a-uuid/status")
      .exchange()
      .expectStatus().isBadRequest();
  }

  @Test
  void shouldReturnNoContentWithoutDefaultProject() {
    when(tracker.currentDefaultProject()).thenReturn(Optional.empty());

    webTestClient.get()
      .uri("/sessions/default-project")
      .exchange()
      .expectStatus().isNoContent();
  }
}
