/**
 * Periodic escalation of alerts that stay unacknowledged too long.
 */
package com.pulsesentinel.core.escalation;
