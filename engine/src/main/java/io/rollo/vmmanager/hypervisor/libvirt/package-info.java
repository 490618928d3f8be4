/**
 * libvirt binding of the hypervisor client, built on {@code org.libvirt:libvirt}.
 */
package io.rollo.vmmanager.hypervisor.libvirt;
