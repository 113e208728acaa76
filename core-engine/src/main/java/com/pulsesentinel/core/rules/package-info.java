/**
 * Threshold rules and their evaluation against metric snapshots.
 */
package com.pulsesentinel.core.rules;
