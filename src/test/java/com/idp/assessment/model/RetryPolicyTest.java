package com.idp.assessment.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    /**
     * Backoff doubles after every failed attempt and never exceeds the cap.
     */
    @Test
    void backoffIsExponentialAndCapped() {
        RetryPolicy policy = RetryPolicy.DEFAULT;

        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoffAfter(6)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.backoffAfter(64)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void atLeastOneAttempt() {
        assertThat(new RetryPolicy(0, null, null).maxAttempts()).isEqualTo(1);
    }
}
