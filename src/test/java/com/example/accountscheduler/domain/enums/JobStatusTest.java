package com.example.accountscheduler.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobStatus Enum Tests")
class JobStatusTest {

    @Test
    @DisplayName("Terminal states should be identified correctly")
    void terminalStatesShouldBeIdentified() {
        assertThat(JobStatus.DONE.isTerminal()).isTrue();
        assertThat(JobStatus.FAILED.isTerminal()).isTrue();
        assertThat(JobStatus.CANCELLED.isTerminal()).isTrue();

        assertThat(JobStatus.QUEUED.isTerminal()).isFalse();
        assertThat(JobStatus.RUNNING.isTerminal()).isFalse();
        assertThat(JobStatus.RETRYING.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("Only QUEUED and RETRYING are claimable")
    void claimableStatesShouldBeIdentified() {
        assertThat(JobStatus.QUEUED.isClaimable()).isTrue();
        assertThat(JobStatus.RETRYING.isClaimable()).isTrue();

        assertThat(JobStatus.RUNNING.isClaimable()).isFalse();
        assertThat(JobStatus.DONE.isClaimable()).isFalse();
        assertThat(JobStatus.FAILED.isClaimable()).isFalse();
        assertThat(JobStatus.CANCELLED.isClaimable()).isFalse();
    }

    @Test
    @DisplayName("Should follow the lifecycle transitions")
    void shouldFollowLifecycleTransitions() {
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.RUNNING)).isTrue();
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.CANCELLED)).isTrue();
        assertThat(JobStatus.RETRYING.canTransitionTo(JobStatus.RUNNING)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.DONE)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.RETRYING)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.QUEUED)).isTrue();

        assertThat(JobStatus.RETRYING.canTransitionTo(JobStatus.CANCELLED)).isFalse();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.CANCELLED)).isFalse();
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.DONE)).isFalse();
    }

    @Test
    @DisplayName("Terminal states should allow no transitions")
    void terminalStatesShouldAllowNoTransitions() {
        for (var terminal : new JobStatus[]{JobStatus.DONE, JobStatus.FAILED, JobStatus.CANCELLED}) {
            for (var target : JobStatus.values()) {
                assertThat(terminal.canTransitionTo(target)).as("%s -> %s", terminal, target).isFalse();
            }
        }
    }

    @Test
    @DisplayName("Should lookup by code or name")
    void shouldLookupByCode() {
        assertThat(JobStatus.fromCode("queued")).isEqualTo(JobStatus.QUEUED);
        assertThat(JobStatus.fromCode("FAILED")).isEqualTo(JobStatus.FAILED);
        assertThat(JobStatus.fromCode("Retrying")).isEqualTo(JobStatus.RETRYING);
    }

    @Test
    @DisplayName("Should throw for unknown code")
    void shouldThrowForUnknownCode() {
        assertThatThrownBy(() -> JobStatus.fromCode("paused"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown job status");
    }
}
