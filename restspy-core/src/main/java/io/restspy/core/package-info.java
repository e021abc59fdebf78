/**
 * Framework-neutral model for REST Spy.
 *
 * <p>This module contains only:
 * <ul>
 *   <li>Path matchers ({@link io.restspy.core.Matchable}) and their per-port registry</li>
 *   <li>The response model shared by proxied, canned and not-found outcomes</li>
 *   <li>Content decoding and case-insensitive header lookup</li>
 * </ul>
 *
 * <p>HTTP client bindings, request dispatch and server lifecycle live in other modules.
 */
package io.restspy.core;
