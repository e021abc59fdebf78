/**
 * Mock server lifecycle for integration tests.
 *
 * <p>A {@link io.restspy.server.LocalServer} spawns and owns a server process and is
 * tracked by a {@link io.restspy.server.ServerRegistry}; an
 * {@link io.restspy.server.ExternalServer} points at an instance managed elsewhere and
 * only resets it on stop. {@link io.restspy.server.SpyClient} configures doubles and
 * proxies on either kind and reads back the spy log.
 */
package io.restspy.server;
