package com.ripple.resilience.client;

import com.ripple.resilience.registry.DependencySettings;

/**
 * Builds the transport of a dependency when its registry entry is created.
 */
@FunctionalInterface
public interface TransportFactory {

    Transport create(String dependency, DependencySettings settings);
}
