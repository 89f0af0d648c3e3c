package com.nevis.pdfscan.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentStatusTest {

    @Test
    void pending_ShouldMoveToProcessingOrFailed() {
        assertThat(DocumentStatus.PENDING.canTransitionTo(DocumentStatus.PROCESSING)).isTrue();
        assertThat(DocumentStatus.PENDING.canTransitionTo(DocumentStatus.FAILED)).isTrue();
        assertThat(DocumentStatus.PENDING.canTransitionTo(DocumentStatus.COMPLETED)).isFalse();
    }

    @Test
    void processing_ShouldOnlyMoveToTerminal() {
        assertThat(DocumentStatus.PROCESSING.canTransitionTo(DocumentStatus.COMPLETED)).isTrue();
        assertThat(DocumentStatus.PROCESSING.canTransitionTo(DocumentStatus.FAILED)).isTrue();
        assertThat(DocumentStatus.PROCESSING.canTransitionTo(DocumentStatus.PENDING)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = DocumentStatus.class, names = {"COMPLETED", "FAILED"})
    void terminalStatuses_ShouldNeverMove(DocumentStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (DocumentStatus next : DocumentStatus.values()) {
            assertThat(terminal.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    void fromTag_ShouldResolveLowerCaseTags() {
        assertThat(DocumentStatus.fromTag("completed")).isEqualTo(DocumentStatus.COMPLETED);
        assertThatThrownBy(() -> DocumentStatus.fromTag("archived"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
