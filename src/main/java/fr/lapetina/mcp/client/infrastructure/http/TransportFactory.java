package fr.lapetina.mcp.client.infrastructure.http;

import fr.lapetina.mcp.client.domain.model.Destination;
import fr.lapetina.mcp.client.infrastructure.config.TransportConfig;

/**
 * Creates the transport of a destination. Called once per destination, on first use.
 */
@FunctionalInterface
public interface TransportFactory {

    Transport create(Destination destination, TransportConfig config);

    static TransportFactory http() {
        return HttpTransport::new;
    }

    static TransportFactory noOp() {
        return (destination, config) -> new NoOpTransport(destination);
    }
}
