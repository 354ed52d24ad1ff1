/**
 * Core domain model for destination calls.
 *
 * <p>All types are immutable records safe to share across threads.
 *
 * <h2>Key Types</h2>
 * <ul>
 *   <li>{@link fr.lapetina.mcp.client.domain.model.Destination} - Named tool server and its base URL</li>
 *   <li>{@link fr.lapetina.mcp.client.domain.model.CallEnvelope} - Request handed to a transport</li>
 *   <li>{@link fr.lapetina.mcp.client.domain.model.TransportResponse} - Status, decoded body and headers</li>
 *   <li>{@link fr.lapetina.mcp.client.domain.model.InvocationResult} - Per-item batch/fan-out outcome</li>
 *   <li>{@link fr.lapetina.mcp.client.domain.model.ErrorType} - Error classification</li>
 * </ul>
 */
package fr.lapetina.mcp.client.domain.model;
