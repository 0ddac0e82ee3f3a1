/**
 * procwarden source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.procwarden.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.procwarden.cli.WardenCommand} maps commands to supervisor APIs.</li>
 *   <li>{@code io.procwarden.supervisor.ProcessSupervisor} wires registry, detector, terminator and monitor.</li>
 *   <li>{@code io.procwarden.registry.ProcessRegistry} is the authoritative record of spawned processes.</li>
 * </ul>
 */
package io.procwarden;
