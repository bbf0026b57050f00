package com.worklog.backend.source;

import com.worklog.backend.config.TimesheetProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Reports whether the activity tools are registered with the MCP client. */
@Component
public class ActivitySourceHealthIndicator implements HealthIndicator {

  private final McpActivitySourceClient sourceClient;
  private final TimesheetProperties.SourceProperties sourceProperties;
  private final Timer latencyTimer;

  public ActivitySourceHealthIndicator(
      McpActivitySourceClient sourceClient,
      TimesheetProperties properties,
      MeterRegistry meterRegistry) {
    this.sourceClient = sourceClient;
    this.sourceProperties = properties.getSource();
    this.latencyTimer =
        Timer.builder("activity_source_health_latency")
            .description("Latency of activity source health checks")
            .register(meterRegistry);
  }

  @Override
  public Health health() {
    long started = System.nanoTime();
    Map<String, Object> tools = new LinkedHashMap<>();
    boolean jiraAvailable = sourceClient.isToolAvailable(sourceProperties.getJiraTool());
    boolean githubAvailable = sourceClient.isToolAvailable(sourceProperties.getGithubTool());
    tools.put(sourceProperties.getJiraTool(), jiraAvailable ? "UP" : "DOWN");
    tools.put(sourceProperties.getGithubTool(), githubAvailable ? "UP" : "DOWN");
    long elapsed = System.nanoTime() - started;
    latencyTimer.record(Duration.ofNanos(elapsed));

    // Missing sources degrade timesheet rows but never block assembly.
    Health.Builder builder = jiraAvailable && githubAvailable ? Health.up() : Health.unknown();
    return builder
        .withDetail("latencyMs", TimeUnit.NANOSECONDS.toMillis(elapsed))
        .withDetail("tools", tools)
        .build();
  }
}
