/**
 * Relay configuration: YAML beans and the loader that resolves, overrides
 * and validates them.
 *
 * <p>
 * {@link com.endecrelay.core.config.RelayConfigLoader} maps the YAML file onto
 * {@link com.endecrelay.core.config.RelayConfig} and its nested
 * {@link com.endecrelay.core.config.BrokerSettings} and
 * {@link com.endecrelay.core.config.HealthCheckSettings}. Validation runs
 * before the configuration is handed out so the relay fails fast.
 * </p>
 *
 * @since 1.0.0
 */
package com.endecrelay.core.config;
