package com.github.spud.worksession.it.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.worksession.domain.project.ProjectStore;
import com.github.spud.worksession.domain.project.ProjectSummary;
import com.github.spud.worksession.domain.project.ResolutionLevel;
import com.github.spud.worksession.domain.session.SessionNotFoundException;
import com.github.spud.worksession.domain.session.SessionStatus;
import com.github.spud.worksession.domain.session.SessionStatusView;
import com.github.spud.worksession.domain.session.SessionStore;
import com.github.spud.worksession.domain.session.SessionTimeoutSweeper;
import com.github.spud.worksession.domain.session.SessionTracker;
import com.github.spud.worksession.domain.session.SessionTracker.StartSessionRequest;
import com.github.spud.worksession.domain.session.TokenCounts;
import com.github.spud.worksession.domain.session.WorkSession;
import com.github.spud.worksession.infrastructure.persistence.entity.SessionEventEntity;
import com.github.spud.worksession.infrastructure.persistence.repository.ProjectRepository;
import com.github.spud.worksession.infrastructure.persistence.repository.SessionEventRepository;
import com.github.spud.worksession.it.support.ContainersSupport;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

/**
 * Service-level integration tests: the tracker wired against Postgres, bypassing HTTP
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("it")
class SessionTrackerIT extends ContainersSupport {

  @Autowired
  private SessionTracker tracker;

  @Autowired
  private SessionTimeoutSweeper sweeper;

  @Autowired
  private SessionStore sessionStore;

  @Autowired
  private ProjectStore projectStore;

  @Autowired
  private ProjectRepository projectRepository;

  @Autowired
  private SessionEventRepository eventRepository;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  private String key;

  @BeforeEach
  void setUp() {
    jdbcTemplate.execute("TRUNCATE session_events, sessions, projects");
    key = "it-" + UUID.randomUUID();
  }

  private ProjectSummary createPrimary(String name) {
    projectRepository.insertIfAbsent(name, null, "{\"is_primary\": true}");
    return projectStore.findByName(name).orElseThrow();
  }

  private List<String> eventTypes(UUID sessionId) {
    return eventRepository.findBySessionIdOrderByOccurredAtAsc(sessionId).stream()
      .map(SessionEventEntity::getEventType)
      .collect(Collectors.toList());
  }

  @Test
  @DisplayName("start, record, end: counters reach the row in one final write")
  void fullLifecycle() {
    ProjectSummary primary = createPrimary("primary-it");

    UUID sid = tracker.startSession(StartSessionRequest.builder().trackingKey(key).build());
    tracker.recordTokenUsage(sid, 200, 50);
    tracker.recordTaskCreated(sid);
    tracker.recordTaskUpdated(sid, true);
    tracker.recordContextCreated(sid);

    WorkSession open = sessionStore.findById(sid).orElseThrow();
    assertThat(open.getProjectId()).isEqualTo(primary.id());
    assertThat(open.getTokens()).isEqualTo(TokenCounts.ZERO);
    assertThat(open.getMetadata())
      .containsEntry("project_resolution_method", ResolutionLevel.PRIMARY_PROJECT.label());

    SessionStatusView ended = tracker.endSession(sid);

    assertThat(ended.getStatus()).isEqualTo(SessionStatus.INACTIVE);
    WorkSession row = sessionStore.findById(sid).orElseThrow();
    assertThat(row.getTokens()).isEqualTo(TokenCounts.of(200, 50));
    assertThat(row.getActivity().tasksCompleted()).isEqualTo(1);
    assertThat(row.getActivity().contextsCreated()).isEqualTo(1);
    assertThat(row.getProductivityScore()).isPositive();
    assertThat(row.getMetadata()).containsEntry("ended_reason", "explicit");
    assertThat(tracker.getActiveSession(key)).isEmpty();
    assertThat(eventTypes(sid)).containsExactly("SESSION_START", "SESSION_END");

    assertThatThrownBy(() -> tracker.endSession(sid))
      .isInstanceOf(SessionNotFoundException.class);
  }

  @Test
  @DisplayName("session started with an empty registry lands in the system default project")
  void systemDefaultProject() {
    UUID sid = tracker.startSession(StartSessionRequest.builder().trackingKey(key).build());

    ProjectSummary project = tracker.getProjectForSession(sid).orElseThrow();
    assertThat(project.name()).isEqualTo("workspace-bootstrap");
    assertThat(tracker.currentDefaultProject()).contains(project);
  }

  @Test
  @DisplayName("open session written by an earlier process is adopted")
  void adoptsOpenSessionFromStore() {
    ProjectSummary project = projectStore.getOrCreateDefault("adopt-it");
    UUID sid = UUID.randomUUID();
    OffsetDateTime now = OffsetDateTime.now();
    sessionStore.insert(WorkSession.builder()
      .id(sid)
      .trackingKey(key)
      .projectId(project.id())
      .agentType("mcp-client")
      .startedAt(now)
      .lastActivityAt(now)
      .status(SessionStatus.ACTIVE)
      .build());

    assertThat(tracker.getActiveSession(key)).contains(sid);

    tracker.recordContextCreated(sid);
    assertThat(tracker.getSessionStatus(sid).getActivity().contextsCreated()).isEqualTo(1);
  }

  @Test
  @DisplayName("sweeper times out an idle session and flushes its counters")
  void sweepTimesOutIdleSession() {
    UUID sid = tracker.startSession(StartSessionRequest.builder().trackingKey(key).build());
    tracker.recordTokenUsage(sid, 10, 5);
    jdbcTemplate.update(
      "UPDATE sessions SET last_activity_at = now() - interval '3 hours' WHERE id = ?", sid);

    List<UUID> timedOut = sweeper.sweepOnce();

    assertThat(timedOut).containsExactly(sid);
    WorkSession row = sessionStore.findById(sid).orElseThrow();
    assertThat(row.getStatus()).isEqualTo(SessionStatus.INACTIVE);
    assertThat(row.getTokens()).isEqualTo(TokenCounts.of(10, 5));
    assertThat(row.isCountersFlushed()).isTrue();
    assertThat(tracker.getActiveSession(key)).isEmpty();
    assertThat(eventTypes(sid)).containsExactly("SESSION_START", "SESSION_TIMEOUT");
  }

  @Test
  @DisplayName("concurrent starts for one key leave exactly one open session")
  void concurrentStarts() throws Exception {
    createPrimary("race-it");
    int callers = 6;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch go = new CountDownLatch(1);
    List<Future<UUID>> results = new ArrayList<>();
    try {
      for (int i = 0; i < callers; i++) {
        results.add(pool.submit(() -> {
          go.await();
          return tracker.startSession(StartSessionRequest.builder().trackingKey(key).build());
        }));
      }
      go.countDown();
      Set<UUID> ids = new HashSet<>();
      for (Future<UUID> result : results) {
        ids.add(result.get(30, TimeUnit.SECONDS));
      }

      UUID active = tracker.getActiveSession(key).orElseThrow();
      Integer open = jdbcTemplate.queryForObject(
        "SELECT count(*) FROM sessions WHERE tracking_key = ? AND status = 'active'",
        Integer.class, key);
      assertThat(open).isEqualTo(1);
      assertThat(ids).contains(active);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  @DisplayName("reassignment is visible to the next project lookup")
  void assignProject() {
    UUID sid = tracker.startSession(StartSessionRequest.builder().trackingKey(key).build());
    ProjectSummary target = projectStore.getOrCreateDefault("Backend Services");

    ProjectSummary assigned = tracker.assignSessionToProject(sid, "backend");

    assertThat(assigned.id()).isEqualTo(target.id());
    assertThat(tracker.getProjectForSession(sid)).contains(target);
    assertThat(sessionStore.findById(sid).orElseThrow().getMetadata())
      .containsEntry("assigned_manually", true);
  }
}
