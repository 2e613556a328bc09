package com.providergateway.service;

import com.providergateway.model.HealthState;
import com.providergateway.model.HealthStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class HealthStateMachineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void failuresDegradeThenTripAtThreshold() {
        HealthStatus status = HealthStatus.INITIAL;

        status = HealthStateMachine.onFailure(status, "timeout", NOW, 3);
        assertThat(status.getState()).isEqualTo(HealthState.DEGRADED);
        assertThat(status.isRoutable()).isTrue();

        status = HealthStateMachine.onFailure(status, "timeout", NOW, 3);
        assertThat(status.getState()).isEqualTo(HealthState.DEGRADED);

        status = HealthStateMachine.onFailure(status, "timeout", NOW, 3);
        assertThat(status.getState()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(status.getConsecutiveFailures()).isEqualTo(3);
        assertThat(status.isRoutable()).isFalse();
        assertThat(status.getLastError()).isEqualTo("timeout");
    }

    @Test
    void singleSuccessRestoresHealthy() {
        HealthStatus status = HealthStatus.INITIAL;
        for (int i = 0; i < 5; i++) {
            status = HealthStateMachine.onFailure(status, "boom", NOW, 3);
        }

        status = HealthStateMachine.onSuccess(status, NOW.plusSeconds(30));

        assertThat(status.getState()).isEqualTo(HealthState.HEALTHY);
        assertThat(status.getConsecutiveFailures()).isZero();
        assertThat(status.getLastSuccessAt()).isEqualTo(NOW.plusSeconds(30));
    }

    @Test
    void unknownProvidersAreRoutable() {
        assertThat(HealthStatus.INITIAL.getState()).isEqualTo(HealthState.UNKNOWN);
        assertThat(HealthStatus.INITIAL.isRoutable()).isTrue();
    }
}
