/**
 * Runtime orchestration package.
 *
 * <p>{@link io.provtrack.runtime.ProvTrackRuntime} ties the object store, the
 * dependency and provenance graphs, the revision source and the workflow
 * executor together behind the operations the CLI exposes.
 */
package io.provtrack.runtime;
