package io.breland.calhub.server.actuators;

import io.breland.calhub.server.calendar.coordination.SourceCoordinator;
import io.breland.calhub.server.calendar.model.EventSource;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class CalendarSourcesHealthIndicator implements HealthIndicator {
  private final SourceCoordinator sourceCoordinator;
  private final AtomicReference<Health> health = new AtomicReference<>(Health.unknown().build());

  public CalendarSourcesHealthIndicator(SourceCoordinator sourceCoordinator) {
    this.sourceCoordinator = sourceCoordinator;
  }

  @Scheduled(fixedDelayString = "PT15S")
  public void checkSources() {
    try {
      Map<EventSource, Boolean> sources = sourceCoordinator.healthCheck();
      if (sources.isEmpty()) {
        health.set(Health.status("DEGRADED").withDetail("error", "no sources enabled").build());
        return;
      }
      Health.Builder builder =
          sources.containsValue(false) ? Health.status("DEGRADED") : Health.up();
      sources.forEach((source, up) -> builder.withDetail(source.apiValue(), up ? "UP" : "DOWN"));
      if (sources.containsValue(false)) {
        log.warn("Calendar sources degraded: {}", sources);
      }
      health.set(builder.build());
    } catch (Exception e) {
      log.warn("Calendar source health check failed", e);
      health.set(Health.status("DEGRADED").withDetail("error", e.getMessage()).build());
    }
  }

  @Override
  public Health health() {
    return health.get();
  }
}
