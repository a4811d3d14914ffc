/**
 * StatsD Transport Port
 * =============================================================================
 *
 * <p>{@link com.questrail.statsd.transport.DatagramTransport} is the
 * framework-agnostic boundary between the send paths and a concrete
 * networking implementation (Netty UDP in production, a recording fake in
 * tests).</p>
 *
 * <h2>Netty containment</h2>
 * Netty is used for the socket, but Netty types do not cross this boundary.
 * Everything above the port sees only:
 * <ul>
 *   <li>Datagram payloads as {@link com.questrail.statsd.codec.ByteView}</li>
 *   <li>The destination as {@link com.questrail.statsd.resolve.StatsdEndpoint}</li>
 *   <li>Completion as {@link java.util.concurrent.CompletableFuture}</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of the port MUST:
 * <ul>
 *   <li>Send each payload as exactly one datagram, unmodified</li>
 *   <li>Not split, batch, retry or reorder payloads</li>
 *   <li>Report failures to the caller, never swallow them</li>
 * </ul>
 */
package com.questrail.statsd.transport;
