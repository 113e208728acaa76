package com.pulsesentinel.core.health;

import java.util.Map;

/**
 * Checks one dependent service.
 *
 * <p>
 * Returning normally means the service is up; the returned map is attached to
 * the result as details (may be empty). Throwing means the service is down.
 * </p>
 */
@FunctionalInterface
public interface ServiceProbe {

    Map<String, Object> check() throws Exception;
}
