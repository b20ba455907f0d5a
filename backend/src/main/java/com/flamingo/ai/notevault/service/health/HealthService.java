package com.flamingo.ai.notevault.service.health;

/** Service interface for health checks. */
public interface HealthService {

  /**
   * Checks database connectivity and collects embedding provider and queue status.
   *
   * @return the current health report
   */
  HealthReport check();
}
