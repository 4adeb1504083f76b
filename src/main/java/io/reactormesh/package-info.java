/**
 * ReactorMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.reactormesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.reactormesh.cli.ReactorMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.reactormesh.runtime.ReactorMeshRuntime} wires the mesh, units, scheduler and trace.</li>
 *   <li>{@code io.reactormesh.scheduler.Scheduler} runs the Collect, Order, Admit, Execute cycle.</li>
 *   <li>{@code io.reactormesh.store.VersionStore} is the only shared mutable state.</li>
 * </ul>
 */
package io.reactormesh;
