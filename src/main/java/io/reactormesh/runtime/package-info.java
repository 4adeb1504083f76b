/**
 * Runtime orchestration package.
 *
 * <p>{@link io.reactormesh.runtime.ReactorMeshRuntime} owns the ingest and registration
 * APIs, the background reactor loop, settings hot reload, trace maintenance and the
 * health and metrics surfaces used by the CLI.
 */
package io.reactormesh.runtime;
