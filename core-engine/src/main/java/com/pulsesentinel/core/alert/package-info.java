/**
 * Alert lifecycle and retention.
 */
package com.pulsesentinel.core.alert;
