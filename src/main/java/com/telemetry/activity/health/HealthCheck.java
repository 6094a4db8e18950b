package com.telemetry.activity.health;

/**
 * A named check reporting the health of one component.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
