package com.github.spud.worksession.application.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Session tracking configuration
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.session")
public class SessionTrackingProperties {

  /**
   * Tracking key used when a caller does not pass one
   */
  private String trackingKey = "default";

  /**
   * Agent type stamped on new sessions when the caller does not pass one
   */
  private String agentType = "mcp-client";

  /**
   * Minimum spacing between opportunistic last_activity_at writes for one session
   */
  private Duration activityTouchInterval = Duration.ofMinutes(1);

  private TimeoutConfig timeout = new TimeoutConfig();

  private ProjectsConfig projects = new ProjectsConfig();

  private ProductivityConfig productivity = new ProductivityConfig();

  @Data
  public static class TimeoutConfig {

    /**
     * Start the sweeper with the application context
     */
    private boolean enabled = true;

    private Duration idleThreshold = Duration.ofHours(2);

    private Duration sweepInterval = Duration.ofMinutes(5);

    /**
     * Emit one liveness line every N sweeps that time nothing out
     */
    private int quietLogEvery = 12;
  }

  @Data
  public static class ProjectsConfig {

    private String systemDefaultName = "workspace-bootstrap";

    private String personalProjectName = "Personal Project";
  }

  @Data
  public static class ProductivityConfig {

    private double contextWeight = 2.0;

    private double completedTaskWeight = 3.0;
  }
}
