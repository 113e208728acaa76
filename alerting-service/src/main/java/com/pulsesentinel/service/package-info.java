/**
 * The runnable alerting service: environment configuration, HTTP transports
 * and probes, file-backed state and the health endpoint.
 */
package com.pulsesentinel.service;
