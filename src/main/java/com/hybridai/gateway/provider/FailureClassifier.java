package com.hybridai.gateway.provider;

import com.hybridai.gateway.model.FailureClass;

import java.util.List;

/**
 * Decides whether a failed provider call was rate-limited or failed for another reason.
 *
 * <p>A failure is {@link FailureClass#RATE_LIMITED} when the HTTP status is 429
 * or the vendor's error text carries a rate-limit marker such as
 * {@code rate_limit_error} (Anthropic) or {@code rate_limit_exceeded} (OpenAI).
 */
public final class FailureClassifier {

    private static final int TOO_MANY_REQUESTS = 429;

    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "rate_limit", "rate limit", "ratelimit", "too many requests", "429");

    private FailureClassifier() {}

    public static FailureClass classify(final int httpStatusCode, final String detail) {
        return isRateLimited(httpStatusCode, detail) ? FailureClass.RATE_LIMITED : FailureClass.OTHER;
    }

    /** Classify an exception by inspecting its message and the messages of its causes. */
    public static FailureClass classify(final Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (hasRateLimitMarker(current.getMessage())) {
                return FailureClass.RATE_LIMITED;
            }
            current = current.getCause() != current ? current.getCause() : null;
        }
        return FailureClass.OTHER;
    }

    public static boolean isRateLimited(final int httpStatusCode, final String detail) {
        return httpStatusCode == TOO_MANY_REQUESTS || hasRateLimitMarker(detail);
    }

    private static boolean hasRateLimitMarker(final String text) {
        if (text == null || text.isBlank()) return false;
        final String lower = text.toLowerCase();
        for (final String marker : RATE_LIMIT_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
