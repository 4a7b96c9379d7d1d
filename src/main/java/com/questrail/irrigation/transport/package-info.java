/**
 * Weather Transport Port
 * =============================================================================
 *
 * The framework-agnostic boundary between a concrete HTTP implementation and
 * the weather gateway.
 *
 * <h2>Why this port exists</h2>
 * Production uses Netty for outbound HTTP <strong>without</strong> letting
 * Netty types leak into the gateway, the engine or their tests. Everything
 * above the adapter sees only a {@link java.net.URI} going out and a
 * {@link java.lang.String} body coming back.
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only (no JSON interpretation)</li>
 *   <li>Not acquire rate-limit slots or consult caches</li>
 *   <li>Not retry on failure</li>
 * </ul>
 */
package com.questrail.irrigation.transport;
