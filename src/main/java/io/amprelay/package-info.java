/**
 * AMP relay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.amprelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.amprelay.cli.AmpRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.amprelay.runtime.AmpRuntime} wires stores, routing, federation and peers.</li>
 *   <li>{@code io.amprelay.routing.RoutingEngine} decides local, relay or federated delivery.</li>
 * </ul>
 */
package io.amprelay;
