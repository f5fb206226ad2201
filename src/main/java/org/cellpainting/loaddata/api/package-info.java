/**
 * CLI entry points for the {@code bind} and {@code combine} commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and
 * telemetry, validates paths, and invokes use cases.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded during setup; the bind use case spawns its
 * own group workers.</p>
 */
package org.cellpainting.loaddata.api;
