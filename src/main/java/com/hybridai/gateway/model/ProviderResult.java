package com.hybridai.gateway.model;

import java.time.Instant;

/**
 * Immutable outcome of a single provider attempt.
 *
 * <p>Returned by every {@link com.hybridai.gateway.provider.ProviderAdapter}.
 * On success {@code text} holds the model output; on failure
 * {@code failureClass} says why and {@code errorMessage} carries the vendor's
 * error detail for logs.
 */
public final class ProviderResult {

    public enum Status { SUCCESS, FAILURE }

    private final Status       status;
    private final ProviderId   provider;
    private final String       text;            // null on failure
    private final String       model;           // model actually requested, if known
    private final FailureClass failureClass;    // null on success
    private final String       errorMessage;    // null on success
    private final int          httpStatusCode;  // 0 if not applicable
    private final Instant      completedAt;

    private ProviderResult(final Builder b) {
        this.status         = b.status;
        this.provider       = b.provider;
        this.text           = b.text;
        this.model          = b.model;
        this.failureClass   = b.failureClass;
        this.errorMessage   = b.errorMessage;
        this.httpStatusCode = b.httpStatusCode;
        this.completedAt    = Instant.now();
    }

    public static Builder builder(final ProviderId provider) {
        return new Builder(provider);
    }

    public static final class Builder {
        private final ProviderId provider;
        private Status       status = Status.FAILURE;
        private FailureClass failureClass = FailureClass.OTHER;
        private String       text;
        private String       model;
        private String       errorMessage;
        private int          httpStatusCode;

        private Builder(final ProviderId provider) {
            this.provider = provider;
        }

        public Builder success(final String text, final int httpCode) {
            this.status         = Status.SUCCESS;
            this.text           = text;
            this.failureClass   = null;
            this.errorMessage   = null;
            this.httpStatusCode = httpCode;
            return this;
        }

        public Builder failure(final FailureClass failureClass, final String error, final int httpCode) {
            this.status         = Status.FAILURE;
            this.failureClass   = failureClass;
            this.errorMessage   = error;
            this.httpStatusCode = httpCode;
            this.text           = null;
            return this;
        }

        public Builder unavailable(final String reason) {
            return failure(FailureClass.UNAVAILABLE, reason, 0);
        }

        public Builder model(final String model) {
            this.model = model;
            return this;
        }

        public ProviderResult build() { return new ProviderResult(this); }
    }

    public Status       getStatus()         { return status; }
    public ProviderId   getProvider()       { return provider; }
    public String       getText()           { return text; }
    public String       getModel()          { return model; }
    public FailureClass getFailureClass()   { return failureClass; }
    public String       getErrorMessage()   { return errorMessage; }
    public int          getHttpStatusCode() { return httpStatusCode; }
    public Instant      getCompletedAt()    { return completedAt; }
    public boolean      isSuccess()         { return status == Status.SUCCESS; }

    /** True only for a success that carries non-blank text. */
    public boolean hasText() {
        return isSuccess() && text != null && !text.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderResult{provider=" + provider
             + ", status=" + status
             + (failureClass != null ? ", failure=" + failureClass : "")
             + (model != null ? ", model=" + model : "")
             + (errorMessage != null ? ", error=" + errorMessage : "")
             + (httpStatusCode > 0 ? ", http=" + httpStatusCode : "")
             + "}";
    }
}
