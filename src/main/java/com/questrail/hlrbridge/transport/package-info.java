/**
 * Stream Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, a test double) and
 * the IPA multiplexer.
 *
 * <h2>Why these ports exist</h2>
 * Netty is used in production for its event loop model and lifecycle handling,
 * but Netty types must not leak into the protocol layers. Everything above the
 * transport adapter sees only:
 * <ul>
 *   <li>Raw received chunks as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Connection lifecycle notifications</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no framing or protocol interpretation)</li>
 *   <li>Serialize callbacks per connection</li>
 *   <li>Not retry writes or reconnect on their own</li>
 * </ul>
 */
package com.questrail.hlrbridge.transport;
