package com.reflector.model;

/**
 * Marker for input types that carry a request body even on methods that normally have none
 * (GET, HEAD, DELETE, TRACE).
 * <p>
 * Forcing a request body is not recommended and exists for backwards compatibility with APIs
 * that already accept one.
 */
public interface RequestBodyEnforcer {
}
