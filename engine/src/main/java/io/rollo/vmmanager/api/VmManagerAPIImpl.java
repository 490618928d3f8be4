package io.rollo.vmmanager.api;

import io.rollo.api.vmmanager.ConnectionHealth;
import io.rollo.api.vmmanager.HostMetricsSnapshot;
import io.rollo.api.vmmanager.OperationResult;
import io.rollo.api.vmmanager.ResourceControls;
import io.rollo.api.vmmanager.ResourceLimits;
import io.rollo.api.vmmanager.ValidationResult;
import io.rollo.api.vmmanager.VmManagerAPI;
import io.rollo.api.vmmanager.VmMetricsSnapshot;
import io.rollo.api.vmmanager.VmRef;
import io.rollo.api.vmmanager.VmSpec;
import io.rollo.api.vmmanager.VmStatusInfo;
import io.rollo.api.vmmanager.VmSummary;
import io.rollo.vmmanager.VmManager;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Implementation of the VmManagerAPI for embedding applications.
 */
public class VmManagerAPIImpl implements VmManagerAPI {

    private final VmManager vmManager;

    public VmManagerAPIImpl(@Nonnull VmManager vmManager) {
        this.vmManager = Objects.requireNonNull(vmManager, "vmManager");
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> createVm(@Nonnull VmSpec spec) {
        return vmManager.createVm(spec);
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> startVm(@Nonnull VmRef ref) {
        return vmManager.startVm(ref);
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> stopVm(@Nonnull VmRef ref, boolean force) {
        return vmManager.stopVm(ref, force);
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> restartVm(@Nonnull VmRef ref, boolean force) {
        return vmManager.restartVm(ref, force);
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> pauseVm(@Nonnull VmRef ref) {
        return vmManager.pauseVm(ref);
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> resumeVm(@Nonnull VmRef ref) {
        return vmManager.resumeVm(ref);
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> deleteVm(@Nonnull VmRef ref, boolean deleteDisks) {
        return vmManager.deleteVm(ref, deleteDisks);
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> cloneVm(@Nonnull VmRef source, @Nonnull String newName,
                                                      @Nonnull String newUuid) {
        return vmManager.cloneVm(source, newName, newUuid);
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> resizeVm(@Nonnull VmRef ref, int cpuCores, long memoryMb,
                                                       boolean live) {
        return vmManager.resizeVm(ref, cpuCores, memoryMb, live);
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> setResourceLimits(@Nonnull VmRef ref,
                                                                @Nonnull ResourceControls controls) {
        return vmManager.setResourceLimits(ref, controls);
    }

    @Override
    @Nonnull
    public CompletableFuture<List<VmSummary>> listVms() {
        return vmManager.listVms();
    }

    @Override
    @Nonnull
    public CompletableFuture<VmStatusInfo> getVmStatus(@Nonnull VmRef ref) {
        return vmManager.getVmStatus(ref);
    }

    @Override
    @Nonnull
    public CompletableFuture<VmMetricsSnapshot> getVmMetrics(@Nonnull VmRef ref) {
        return vmManager.getVmMetrics(ref);
    }

    @Override
    @Nonnull
    public CompletableFuture<HostMetricsSnapshot> getHostMetrics() {
        return vmManager.getHostMetrics();
    }

    @Override
    @Nonnull
    public CompletableFuture<ResourceLimits> getResourceLimits() {
        return vmManager.getResourceLimits();
    }

    @Override
    @Nonnull
    public CompletableFuture<ValidationResult> validateResources(@Nonnull VmSpec spec) {
        return vmManager.validateResources(spec);
    }

    @Override
    @Nonnull
    public CompletableFuture<ConnectionHealth> healthCheck() {
        return vmManager.healthCheck();
    }
}
