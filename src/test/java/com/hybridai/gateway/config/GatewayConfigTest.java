package com.hybridai.gateway.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import static com.hybridai.gateway.model.ProviderId.ANTHROPIC;
import static com.hybridai.gateway.model.ProviderId.OPENAI;
import static org.assertj.core.api.Assertions.*;

class GatewayConfigTest {

    @Test
    void bundledDefaults_areApplied() {
        final GatewayConfig config = GatewayConfig.from(ConfigFactory.empty());

        assertThat(config.getDefaultMaxTokens()).isEqualTo(1024);
        assertThat(config.getDefaultTemperature()).isEqualTo(0.7);
        assertThat(config.getRetryMaxAttempts()).isEqualTo(1);
        assertThat(config.getRetryInitialDelayMs()).isEqualTo(500L);
        assertThat(config.getRetryBackoffFactor()).isEqualTo(2.0);
        assertThat(config.getRetryMaxDelayMs()).isEqualTo(5000L);
        assertThat(config.getDeclaredProviderOrder()).containsExactly(ANTHROPIC, OPENAI);
    }

    @Test
    void primaryProvider_acceptsClaudeAlias() {
        final GatewayConfig config = GatewayConfig.from(ConfigFactory.parseString(
                "gateway.primary-provider = claude"));

        assertThat(config.getPrimaryProvider()).isEqualTo(ANTHROPIC);
    }

    @Test
    void primaryProvider_rejectsUnknownName() {
        final GatewayConfig config = GatewayConfig.from(ConfigFactory.parseString(
                "gateway.primary-provider = gemini"));

        assertThatThrownBy(config::getPrimaryProvider).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void declaredOrder_followsProviderList_withoutDuplicates() {
        final GatewayConfig config = GatewayConfig.from(ConfigFactory.parseString(
                "gateway.providers = [ { name = openai }, { name = anthropic }, { name = openai } ]"));

        assertThat(config.getDeclaredProviderOrder()).containsExactly(OPENAI, ANTHROPIC);
    }

    @Test
    void providerEnabled_defaultsToTrue_andFalseWhenUndeclared() {
        final GatewayConfig config = GatewayConfig.from(ConfigFactory.parseString(
                "gateway.providers = [ { name = openai } ]"));

        assertThat(config.isProviderEnabled(OPENAI)).isTrue();
        assertThat(config.isProviderEnabled(ANTHROPIC)).isFalse();
    }

    @Test
    void providerEnabled_honoursFlag() {
        final GatewayConfig config = GatewayConfig.from(ConfigFactory.parseString(
                "gateway.providers = [ { name = openai, enabled = false } ]"));

        assertThat(config.isProviderEnabled(OPENAI)).isFalse();
    }

    @Test
    void configuredApiKey_ignoresBlankValues() {
        final GatewayConfig config = GatewayConfig.from(ConfigFactory.parseString(
                "gateway.providers = [ { name = openai, api-key = \" \" }, { name = anthropic, api-key = sk-ant } ]"));

        assertThat(config.getConfiguredApiKey(OPENAI)).isEmpty();
        assertThat(config.getConfiguredApiKey(ANTHROPIC)).contains("sk-ant");
    }

    @Test
    void statusSettings_canBeOverridden() {
        final GatewayConfig config = GatewayConfig.from(ConfigFactory.parseString(
                "status { enabled = false, port = 9090 }"));

        assertThat(config.isStatusServerEnabled()).isFalse();
        assertThat(config.getStatusPort()).isEqualTo(9090);
    }
}
