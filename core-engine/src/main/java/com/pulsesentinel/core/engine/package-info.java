/**
 * The assembled alerting engine: component wiring, schedules, lifecycle,
 * persistence and configuration export/import.
 */
package com.pulsesentinel.core.engine;
