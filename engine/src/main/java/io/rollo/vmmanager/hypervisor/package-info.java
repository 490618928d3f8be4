/**
 * Hypervisor client abstraction.
 *
 * <p>The engine never talks to a virtualization library directly. It goes through
 * {@link io.rollo.vmmanager.hypervisor.HypervisorClient}; the libvirt binding lives
 * in {@code io.rollo.vmmanager.hypervisor.libvirt}.</p>
 */
package io.rollo.vmmanager.hypervisor;
