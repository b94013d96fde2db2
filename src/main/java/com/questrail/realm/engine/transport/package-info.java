/**
 * Line Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, a test double) and
 * the engine.
 *
 * <h2>Why these ports exist</h2>
 * Netty does the socket work in production without its types leaking into the
 * engine. Everything above the endpoint sees only:
 * <ul>
 *   <li>Decoded text lines as {@code String}</li>
 *   <li>Opaque connection ids</li>
 *   <li>Transport and connection lifecycle notifications</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Never interpret the text they carry</li>
 *   <li>Never touch world state</li>
 * </ul>
 */
package com.questrail.realm.engine.transport;
