/**
 * Persistence capability. The engine depends only on
 * {@link com.pulsesentinel.core.store.StateStore}; durable implementations
 * live in the service module.
 */
package com.pulsesentinel.core.store;
