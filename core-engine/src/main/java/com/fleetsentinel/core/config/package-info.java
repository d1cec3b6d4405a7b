/**
 * YAML configuration for the engine: statistical, Isolation Forest, incident
 * and cycle settings, loaded and validated by
 * {@link com.fleetsentinel.core.config.EngineConfigLoader}.
 *
 * @since 1.0.0
 */
package com.fleetsentinel.core.config;
