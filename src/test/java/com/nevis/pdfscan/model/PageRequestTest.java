package com.nevis.pdfscan.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageRequestTest {

    @Test
    void limitAboveMaximum_ShouldBeClamped() {
        assertThat(PageRequest.of(5000, 0).limit()).isEqualTo(PageRequest.MAX_LIMIT);
    }

    @Test
    void invalidBounds_ShouldBeRejected() {
        assertThatThrownBy(() -> PageRequest.of(0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PageRequest.of(10, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void firstPage_ShouldUseDefaults() {
        assertThat(PageRequest.firstPage()).isEqualTo(new PageRequest(100, 0));
    }
}
