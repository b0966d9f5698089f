/**
 * Protocol-centric core for BosBase realtime channels.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants, the envelope model and its JSON codec</li>
 *   <li>The line-oriented event-stream parser</li>
 *   <li>The reconnect backoff table and the shared exception hierarchy</li>
 *   <li>Lightweight utilities (header lookup, query building, topic keys)</li>
 * </ul>
 *
 * <p>WebSocket and HTTP bindings live in the client module.
 */
package io.bosbase.realtime.core;
