/**
 * Runtime wiring.
 *
 * <p>{@link io.amprelay.runtime.AmpRuntime} builds the stores, routing engine,
 * federation gateway and peer directory of one relay host and is the single
 * entry point used by the CLI and the HTTP API.
 */
package io.amprelay.runtime;
