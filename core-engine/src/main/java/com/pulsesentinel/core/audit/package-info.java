/**
 * Bounded, append-only audit trail of notification and lifecycle actions.
 */
package com.pulsesentinel.core.audit;
