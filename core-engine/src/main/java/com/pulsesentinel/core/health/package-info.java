/**
 * Concurrent probing of dependent services (database, internal and external
 * APIs) on a cadence independent of rule evaluation.
 */
package com.pulsesentinel.core.health;
