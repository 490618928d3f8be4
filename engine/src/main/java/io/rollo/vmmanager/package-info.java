/**
 * VM orchestration and resource accounting engine.
 *
 * <p>Manages the virtual machines of a single hypervisor host: lifecycle
 * transitions, disk images, resource validation against host capacity and
 * runtime metrics.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link io.rollo.vmmanager.VmManager} - Main orchestrator and worker pool</li>
 *   <li>{@link io.rollo.vmmanager.connection.ConnectionManager} - Shared hypervisor connection</li>
 *   <li>{@link io.rollo.vmmanager.lifecycle.LifecycleController} - VM state machine</li>
 *   <li>{@link io.rollo.vmmanager.resource.ResourceAccountant} - Capacity, allocation and validation</li>
 *   <li>{@link io.rollo.vmmanager.storage.DiskImageManager} - Disk images via qemu-img</li>
 *   <li>{@link io.rollo.vmmanager.monitoring.MonitoringCollector} - Metrics and alerts</li>
 * </ul>
 *
 * @see io.rollo.vmmanager.VmManager
 */
package io.rollo.vmmanager;
