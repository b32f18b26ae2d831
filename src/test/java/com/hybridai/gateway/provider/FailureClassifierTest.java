package com.hybridai.gateway.provider;

import com.hybridai.gateway.model.FailureClass;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.*;

class FailureClassifierTest {

    @Test
    void classify_returnsRateLimited_for429() {
        assertThat(FailureClassifier.classify(429, "")).isEqualTo(FailureClass.RATE_LIMITED);
    }

    @Test
    void classify_returnsRateLimited_forVendorMarkers() {
        assertThat(FailureClassifier.classify(400, "{\"error\":{\"type\":\"rate_limit_error\"}}"))
                .isEqualTo(FailureClass.RATE_LIMITED);
        assertThat(FailureClassifier.classify(0, "Rate limit reached for gpt-4o"))
                .isEqualTo(FailureClass.RATE_LIMITED);
        assertThat(FailureClassifier.classify(503, "Too Many Requests"))
                .isEqualTo(FailureClass.RATE_LIMITED);
    }

    @Test
    void classify_returnsOther_forEverythingElse() {
        assertThat(FailureClassifier.classify(401, "invalid api key")).isEqualTo(FailureClass.OTHER);
        assertThat(FailureClassifier.classify(500, null)).isEqualTo(FailureClass.OTHER);
        assertThat(FailureClassifier.classify(new SocketTimeoutException("timeout"))).isEqualTo(FailureClass.OTHER);
    }

    @Test
    void classify_inspectsCauseChain() {
        final var wrapped = new IOException("request failed",
                new IllegalStateException("Error code: 429"));

        assertThat(FailureClassifier.classify(wrapped)).isEqualTo(FailureClass.RATE_LIMITED);
    }
}
