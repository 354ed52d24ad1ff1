/**
 * Static destination registry.
 *
 * <p>The registry maps destination names to base URLs. It is loaded once from a JSON
 * document with a {@code servers} object and never mutated afterwards.
 */
package fr.lapetina.mcp.client.infrastructure.registry;
