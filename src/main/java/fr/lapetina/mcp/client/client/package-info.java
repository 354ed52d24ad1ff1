/**
 * Client facade: single invocations, batches, fan-outs, throttling and health checks over the
 * per-destination transports.
 */
package fr.lapetina.mcp.client.client;
