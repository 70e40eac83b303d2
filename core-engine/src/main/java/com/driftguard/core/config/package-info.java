/**
 * YAML configuration of the monitoring stages.
 *
 * <p>
 * {@link com.driftguard.core.config.MonitorConfigLoader} resolves and parses
 * the file into {@link com.driftguard.core.config.MonitorConfig}, which is
 * validated before use.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftguard.core.config;
