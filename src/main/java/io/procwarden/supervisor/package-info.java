/**
 * Supervision package.
 *
 * <p>{@link io.procwarden.supervisor.ProcessSupervisor} owns one procwarden root
 * and is the API the CLI drives for spawning children and reclaiming orphans.
 */
package io.procwarden.supervisor;
