package com.truetickets.server.resource;

/**
 * Marker for anything that should be registered with jersey: resources, filters, exception mappers.
 */
public interface JerseyResource {
}
