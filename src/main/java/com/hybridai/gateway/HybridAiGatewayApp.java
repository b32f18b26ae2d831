package com.hybridai.gateway;

import com.hybridai.gateway.config.GatewayConfig;
import com.hybridai.gateway.dispatch.AllProvidersFailedException;
import com.hybridai.gateway.dispatch.FailoverDispatcher;
import com.hybridai.gateway.dispatch.LoggingDispatchListener;
import com.hybridai.gateway.model.CallParameters;
import com.hybridai.gateway.model.ChatMessage;
import com.hybridai.gateway.model.CompletionResult;
import com.hybridai.gateway.provider.CredentialSource;
import com.hybridai.gateway.provider.ProviderRegistry;
import com.hybridai.gateway.retry.RetryExecutor;
import com.hybridai.gateway.status.StatusReporter;
import com.hybridai.gateway.status.StatusServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Hybrid AI Gateway: main entry point.
 *
 * <h2>Startup sequence</h2>
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Build the provider registry (missing keys leave a provider unavailable)</li>
 *   <li>Log provider status and start the status HTTP server</li>
 *   <li>With arguments: send them as one user message, log the reply, exit</li>
 *   <li>Without arguments: keep serving status until the JVM is stopped</li>
 * </ol>
 */
public class HybridAiGatewayApp {

    private static final Logger LOG = LoggerFactory.getLogger(HybridAiGatewayApp.class);

    public static void main(final String[] args) throws Exception {
        LOG.info("=================================================");
        LOG.info("  Hybrid AI Gateway  v1.0.0");
        LOG.info("=================================================");

        // ── 1. Configuration ──────────────────────────────────────────────────
        final GatewayConfig config = GatewayConfig.load();
        LOG.info("Configuration loaded. Primary: {}, Declared providers: {}",
                config.getPrimaryProvider(), config.getDeclaredProviderOrder());

        // ── 2. Providers ──────────────────────────────────────────────────────
        final CredentialSource credentials = CredentialSource.fromConfig(config)
                .orElse(CredentialSource.environment());
        final ProviderRegistry registry = ProviderRegistry.fromConfig(config, credentials);

        // ── 3. Core services ──────────────────────────────────────────────────
        final FailoverDispatcher dispatcher = new FailoverDispatcher(
                registry, new RetryExecutor(config), new LoggingDispatchListener());
        final StatusReporter reporter = new StatusReporter(registry);
        LOG.info("Status: {}", reporter.status().asMap());

        // ── 4. One-shot prompt ────────────────────────────────────────────────
        if (args.length > 0) {
            final int exitCode = runPrompt(dispatcher, String.join(" ", args));
            dispatcher.close();
            System.exit(exitCode);
            return;
        }

        // ── 5. Status server ──────────────────────────────────────────────────
        if (!config.isStatusServerEnabled()) {
            LOG.info("Status server disabled and no prompt given, nothing to do.");
            dispatcher.close();
            return;
        }
        final StatusServer server = new StatusServer(config.getStatusPort(), reporter);
        server.start();

        // ── 6. Shutdown hook ──────────────────────────────────────────────────
        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown hook triggered, stopping gateway...");
            server.stop();
            dispatcher.close();
            LOG.info("Hybrid AI Gateway shut down cleanly.");
            shutdownLatch.countDown();
        }, "shutdown-hook"));

        LOG.info("Hybrid AI Gateway is running. Press Ctrl+C to stop.");
        shutdownLatch.await();
    }

    private static int runPrompt(final FailoverDispatcher dispatcher, final String prompt) {
        try {
            final CompletionResult result = dispatcher.dispatch(
                    List.of(ChatMessage.user(prompt)), CallParameters.defaults());
            LOG.info("Response from {}:\n{}", result.getProvider(), result.getText());
            return 0;
        } catch (AllProvidersFailedException e) {
            LOG.error("✗ {}", e.getMessage());
            return 1;
        }
    }
}
