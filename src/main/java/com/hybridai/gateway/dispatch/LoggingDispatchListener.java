package com.hybridai.gateway.dispatch;

import com.hybridai.gateway.model.CompletionResult;
import com.hybridai.gateway.model.FailureClass;
import com.hybridai.gateway.model.ProviderId;
import com.hybridai.gateway.model.ProviderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link DispatchListener} that writes every dispatch event to SLF4J.
 *
 * <p>Rate-limited fallthroughs log at WARN, other failures and exhaustion at
 * ERROR, so the two failure classes can be told apart in log searches.
 */
public class LoggingDispatchListener implements DispatchListener {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingDispatchListener.class);

    @Override
    public void onDispatchStarted(final List<ProviderId> order, final int messageCount) {
        LOG.debug("Dispatching {} message(s), attempt order={}", messageCount, order);
    }

    @Override
    public void onProviderSkipped(final ProviderId provider, final String reason) {
        LOG.debug("Skipping unavailable provider={}: {}", provider, reason);
    }

    @Override
    public void onAttemptStarted(final ProviderId provider) {
        LOG.debug("Attempting provider={}", provider);
    }

    @Override
    public void onAttemptFailed(final ProviderResult result) {
        if (result.getFailureClass() == FailureClass.RATE_LIMITED) {
            LOG.warn("{} rate-limited, trying next provider: {}",
                    result.getProvider(), result.getErrorMessage());
        } else {
            LOG.error("{} failed ({}), trying next provider: {}",
                    result.getProvider(), result.getFailureClass(), result.getErrorMessage());
        }
    }

    @Override
    public void onSucceeded(final CompletionResult result) {
        if (result.isFailover()) {
            LOG.info("Served by fallback provider={} model={} after {} failed provider(s)",
                    result.getProvider(), result.getModel(), result.getFailedAttempts().size());
        } else {
            LOG.info("Served by primary provider={} model={}", result.getProvider(), result.getModel());
        }
    }

    @Override
    public void onAllFailed(final AllProvidersFailedException failure) {
        LOG.error("{}", failure.getMessage());
    }
}
