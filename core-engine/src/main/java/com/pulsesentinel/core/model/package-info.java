/**
 * Domain model of the alerting engine.
 *
 * <ul>
 * <li>{@link com.pulsesentinel.core.model.MetricSnapshot}: one sample of all
 * metrics</li>
 * <li>{@link com.pulsesentinel.core.model.AlertRule}: threshold rule authored
 * by an operator</li>
 * <li>{@link com.pulsesentinel.core.model.Alert}: materialised breach with a
 * lifecycle</li>
 * <li>{@link com.pulsesentinel.core.model.Channel},
 * {@link com.pulsesentinel.core.model.Template},
 * {@link com.pulsesentinel.core.model.EscalationRule}: notification
 * configuration</li>
 * <li>{@link com.pulsesentinel.core.model.AuditEntry}: immutable audit
 * record</li>
 * </ul>
 *
 * <p>
 * Every type here serialises to snake_case JSON through
 * {@link com.pulsesentinel.core.config.JsonSupport}.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulsesentinel.core.model;
