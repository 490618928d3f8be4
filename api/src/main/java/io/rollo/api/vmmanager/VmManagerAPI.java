package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * API for VM lifecycle management and resource accounting on a single host.
 *
 * <p>Every operation runs on the manager's worker pool. Futures complete
 * exceptionally with a {@link io.rollo.api.vmmanager.error.VmManagerException}
 * subclass that tells the caller whether a retry makes sense.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * VmManagerAPI api = vmManager.getApi();
 *
 * VmSpec spec = VmSpec.builder()
 *     .name("build-agent")
 *     .cpu(CpuConfig.of(4))
 *     .memory(MemoryConfig.of(8192))
 *     .disk(DiskConfig.boot("root", 40))
 *     .network(NetworkConfig.nat("eth0"))
 *     .build();
 *
 * api.createVm(spec)
 *     .thenCompose(created -> api.startVm(VmRef.byUuid(spec.uuid())))
 *     .thenAccept(result -> System.out.println(result.status()));
 * }</pre>
 */
public interface VmManagerAPI {

    // ==================== Lifecycle ====================

    /**
     * Validate, allocate disks for, and define a new VM. The VM is left stopped.
     *
     * @param spec VM configuration
     * @return future completing with the create result
     */
    @Nonnull
    CompletableFuture<OperationResult> createVm(@Nonnull VmSpec spec);

    /**
     * Start a VM. Starting a running VM is a successful no-op.
     *
     * @param ref target VM
     * @return future completing with the start result
     */
    @Nonnull
    CompletableFuture<OperationResult> startVm(@Nonnull VmRef ref);

    /**
     * Stop a VM.
     *
     * @param ref target VM
     * @param force destroy immediately instead of requesting a guest shutdown
     * @return future completing with the stop result
     */
    @Nonnull
    CompletableFuture<OperationResult> stopVm(@Nonnull VmRef ref, boolean force);

    /**
     * Stop a VM, wait for it to settle, and start it again.
     *
     * @param ref target VM
     * @param force destroy instead of requesting a guest shutdown
     * @return future completing with the restart result
     */
    @Nonnull
    CompletableFuture<OperationResult> restartVm(@Nonnull VmRef ref, boolean force);

    /**
     * Pause a running VM. A VM in any other state is reported, not raised.
     *
     * @param ref target VM
     * @return future completing with the pause result
     */
    @Nonnull
    CompletableFuture<OperationResult> pauseVm(@Nonnull VmRef ref);

    /**
     * Resume a paused VM. A VM in any other state is reported, not raised.
     *
     * @param ref target VM
     * @return future completing with the resume result
     */
    @Nonnull
    CompletableFuture<OperationResult> resumeVm(@Nonnull VmRef ref);

    /**
     * Delete a VM, destroying it first if it is running.
     *
     * @param ref target VM
     * @param deleteDisks remove backing disk images too
     * @return future completing with the result, listing deleted and failed disks
     */
    @Nonnull
    CompletableFuture<OperationResult> deleteVm(@Nonnull VmRef ref, boolean deleteDisks);

    /**
     * Clone a stopped VM under a new identity.
     *
     * @param source VM to copy
     * @param newName name of the clone
     * @param newUuid UUID of the clone
     * @return future completing with the clone result
     */
    @Nonnull
    CompletableFuture<OperationResult> cloneVm(@Nonnull VmRef source, @Nonnull String newName, @Nonnull String newUuid);

    /**
     * Change the vCPU count and/or memory of a VM.
     *
     * @param ref target VM
     * @param cpuCores new vCPU count, or 0 to keep
     * @param memoryMb new memory in MiB, or 0 to keep
     * @param live apply to a running VM
     * @return future completing with the resize result
     */
    @Nonnull
    CompletableFuture<OperationResult> resizeVm(@Nonnull VmRef ref, int cpuCores, long memoryMb, boolean live);

    /**
     * Set CPU scheduler and memory tuning controls of a VM.
     *
     * <p>The controls are persisted in the VM definition. On a running VM the
     * CPU controls take effect immediately; memory limits apply from the next
     * start and are listed under {@link OperationResult#DETAIL_PENDING_RESTART}.</p>
     *
     * @param ref target VM
     * @param controls values to set, null fields are kept
     * @return future completing with the result, listing the applied controls
     */
    @Nonnull
    CompletableFuture<OperationResult> setResourceLimits(@Nonnull VmRef ref, @Nonnull ResourceControls controls);

    // ==================== Queries ====================

    /**
     * List every domain the hypervisor knows.
     *
     * @return future completing with the summaries
     */
    @Nonnull
    CompletableFuture<List<VmSummary>> listVms();

    /**
     * Read the live status of a VM.
     *
     * @param ref target VM
     * @return future completing with the status
     */
    @Nonnull
    CompletableFuture<VmStatusInfo> getVmStatus(@Nonnull VmRef ref);

    /**
     * Collect runtime counters of a VM.
     *
     * @param ref target VM
     * @return future completing with the snapshot
     */
    @Nonnull
    CompletableFuture<VmMetricsSnapshot> getVmMetrics(@Nonnull VmRef ref);

    /**
     * Collect host level aggregates.
     *
     * @return future completing with the snapshot
     */
    @Nonnull
    CompletableFuture<HostMetricsSnapshot> getHostMetrics();

    // ==================== Resources ====================

    /**
     * Get per-VM maxima and current availability.
     *
     * @return future completing with the limits
     */
    @Nonnull
    CompletableFuture<ResourceLimits> getResourceLimits();

    /**
     * Validate a spec without committing anything.
     *
     * @param spec VM configuration
     * @return future completing with every violation found
     */
    @Nonnull
    CompletableFuture<ValidationResult> validateResources(@Nonnull VmSpec spec);

    /**
     * Check the hypervisor connection. Never completes exceptionally.
     *
     * @return future completing with the health report
     */
    @Nonnull
    CompletableFuture<ConnectionHealth> healthCheck();
}
