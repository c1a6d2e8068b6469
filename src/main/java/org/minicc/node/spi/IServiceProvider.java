package org.minicc.node.spi;

/**
 * Implemented by processes that share a service with other processes.
 * <p>
 * A process declares {@code require { localName = providerProcess }} in its configuration
 * and receives the provider's service under {@code localName} in its dependency map.
 */
public interface IServiceProvider {

    /**
     * Returns the service shared with dependent processes. Called once, right after
     * the provider has been instantiated.
     *
     * @return The service instance, or null if nothing is shared.
     */
    Object getExposedService();
}
