/**
 * provtrack source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.provtrack.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.provtrack.cli.ProvTrackCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.provtrack.runtime.ProvTrackRuntime} computes status and updates and records runs.</li>
 *   <li>{@code io.provtrack.persistence.Database} is the object store everything else persists through.</li>
 * </ul>
 */
package io.provtrack;
