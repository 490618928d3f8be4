/**
 * Public API of the VM manager.
 *
 * <p>Contains the {@link io.rollo.api.vmmanager.VmManagerAPI} entry point and the
 * value types exchanged with it. Failures are reported through the exception
 * hierarchy in {@code io.rollo.api.vmmanager.error}.</p>
 *
 * @see io.rollo.api.vmmanager.VmManagerAPI
 */
package io.rollo.api.vmmanager;
