/**
 * Retry backoff schedules.
 *
 * <h2>Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Delay before retry n</th></tr>
 *   <tr><td>{@code NONE}</td><td>no retry at all</td></tr>
 *   <tr><td>{@code LINEAR}</td><td>base * n</td></tr>
 *   <tr><td>{@code EXPONENTIAL}</td><td>base * 2^(n-1)</td></tr>
 *   <tr><td>{@code FIBONACCI}</td><td>base * fib(n)</td></tr>
 * </table>
 *
 * <p>Every delay is then jittered by a uniform factor in [0.8, 1.2] and capped at the
 * configured maximum by {@link fr.lapetina.mcp.client.domain.retry.BackoffCalculator}.
 */
package fr.lapetina.mcp.client.domain.retry;
