/**
 * Configuration loading, validation and JSON settings.
 *
 * <p>
 * The seed file is YAML loaded by
 * {@link com.pulsesentinel.core.config.AlertingConfigLoader} into an
 * {@link com.pulsesentinel.core.config.AlertingConfig}; the same class is the
 * export/import format. Validation runs right after parsing so a broken seed
 * file stops start-up.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulsesentinel.core.config;
