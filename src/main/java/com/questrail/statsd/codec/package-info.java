/**
 * StatsD Codec: Datagram Payload Mechanics
 * =============================================================================
 *
 * <p>Byte-level rules applied between an encoded metric payload and the
 * datagrams handed to the transport:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.statsd.codec.ByteView}: an immutable, non-copying
 *       window over an encoded payload</li>
 *   <li>{@link com.questrail.statsd.codec.PayloadSplitter}: the size-ceiling
 *       rule that turns one payload into one or more datagram payloads without
 *       breaking a metric line</li>
 * </ul>
 *
 * <h2>Placement</h2>
 *
 * <pre>
 *   String (metric lines)
 *        → UTF-8 bytes
 *            → PayloadSplitter   (size ceiling applied here)
 *                → ByteView chunks
 *                    → DatagramTransport
 * </pre>
 *
 * <p>Nothing in this package performs I/O, allocates sockets, or knows about
 * metric semantics. Both the blocking and the non-blocking send paths use the
 * same splitter.</p>
 */
package com.questrail.statsd.codec;
