package org.minicc.node.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the shared services handed to controllers, keyed by their interface type.
 */
public final class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * Registers a service under its interface type.
     *
     * @param type     The type to register under.
     * @param instance The service.
     * @param <T>      The service type.
     * @throws IllegalArgumentException if the type is already taken.
     */
    public <T> void register(final Class<T> type, final T instance) {
        if (services.putIfAbsent(type, instance) != null) {
            throw new IllegalArgumentException("Service of type " + type.getName() + " is already registered.");
        }
    }

    /**
     * Looks up a service.
     *
     * @param type The type the service was registered under.
     * @param <T>  The service type.
     * @return The service.
     * @throws IllegalArgumentException if nothing is registered under the type.
     */
    public <T> T get(final Class<T> type) {
        final Object instance = services.get(type);
        if (instance == null) {
            throw new IllegalArgumentException("No service registered for type " + type.getName());
        }
        return type.cast(instance);
    }
}
