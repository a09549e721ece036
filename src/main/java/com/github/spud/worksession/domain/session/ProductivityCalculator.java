package com.github.spud.worksession.domain.session;

import com.github.spud.worksession.application.config.SessionTrackingProperties;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Productivity score written once when a session closes:
 * {@code (contexts * contextWeight + completedTasks * completedTaskWeight) / (hours + 1)},
 * rounded to two decimals. A zero duration is scored as one hour.
 */
@Component
@RequiredArgsConstructor
public class ProductivityCalculator {

  private static final double MILLIS_PER_HOUR = 3_600_000d;

  private final SessionTrackingProperties properties;

  public double score(ActivityCounts activity, Duration duration) {
    SessionTrackingProperties.ProductivityConfig weights = properties.getProductivity();
    double output = activity.contextsCreated() * weights.getContextWeight()
      + activity.tasksCompleted() * weights.getCompletedTaskWeight();
    double hours = Math.max(0L, duration.toMillis()) / MILLIS_PER_HOUR;
    if (hours == 0) {
      // a session without measurable duration counts as one hour
      hours = 1;
    }
    double raw = output / (hours + 1);
    return Math.round(raw * 100) / 100.0;
  }
}
