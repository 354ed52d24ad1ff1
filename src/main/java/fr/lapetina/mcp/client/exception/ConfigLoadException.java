package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

/**
 * Registry or settings source is missing or malformed. Fatal at startup.
 */
public final class ConfigLoadException extends McpClientException {

    public ConfigLoadException(String message) {
        super(ErrorType.CONFIG_LOAD, message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(ErrorType.CONFIG_LOAD, message, cause);
    }
}
