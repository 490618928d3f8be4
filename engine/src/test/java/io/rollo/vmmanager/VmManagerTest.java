package io.rollo.vmmanager;

import io.rollo.api.vmmanager.ConnectionHealth;
import io.rollo.api.vmmanager.CpuConfig;
import io.rollo.api.vmmanager.DiskConfig;
import io.rollo.api.vmmanager.MemoryConfig;
import io.rollo.api.vmmanager.NetworkConfig;
import io.rollo.api.vmmanager.OperationResult;
import io.rollo.api.vmmanager.ResourceControls;
import io.rollo.api.vmmanager.ResourceLimits;
import io.rollo.api.vmmanager.ValidationResult;
import io.rollo.api.vmmanager.VmManagerAPI;
import io.rollo.api.vmmanager.VmRef;
import io.rollo.api.vmmanager.VmSpec;
import io.rollo.api.vmmanager.VmState;
import io.rollo.api.vmmanager.VmSummary;
import io.rollo.api.vmmanager.error.NotFoundException;
import io.rollo.api.vmmanager.error.ValidationException;
import io.rollo.vmmanager.config.VmManagerConfig;
import io.rollo.vmmanager.event.VmEvent;
import io.rollo.vmmanager.hypervisor.FakeHypervisor;
import io.rollo.vmmanager.hypervisor.HypervisorState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VmManagerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path storage;

    private final FakeHypervisor hypervisor = new FakeHypervisor();
    private final List<VmEvent> events = new CopyOnWriteArrayList<>();
    private VmManager manager;

    @BeforeEach
    void setUp() {
        VmManagerConfig config = EngineFixture.defaultConfig(storage.resolve("images"));
        manager = new VmManager(config, hypervisor, events::add);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private void addStoppedVm(String name) {
        hypervisor.addDomain("<domain type='kvm'><name>" + name + "</name>"
                + "<uuid>9b2e4c1a-7d3f-4e8a-b6c5-" + String.format("%012d", name.hashCode() & 0xffff) + "</uuid>"
                + "<memory unit='MiB'>1024</memory><vcpu>2</vcpu></domain>", HypervisorState.SHUTOFF);
    }

    @Test
    void rejectsRequestsBeforeInitialize() {
        assertThat(manager.isInitialized()).isFalse();
        assertThatThrownBy(manager::listVms)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("VM manager not initialized");
    }

    @Test
    void initializeTwiceFails() throws Exception {
        manager.initialize();

        assertThatThrownBy(manager::initialize)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("VM manager already initialized");
    }

    @Test
    void initializeCreatesStorageAndConnects() throws Exception {
        manager.initialize();

        assertThat(manager.isInitialized()).isTrue();
        assertThat(storage.resolve("images")).isDirectory();
        assertThat(hypervisor.getOpens()).isEqualTo(1);
    }

    @Test
    void unreachableHypervisorDoesNotFailInitialize() throws Exception {
        hypervisor.setFailOpen(true);

        manager.initialize();

        assertThat(manager.isInitialized()).isTrue();
        ConnectionHealth health = manager.healthCheck().get(5, TimeUnit.SECONDS);
        assertThat(health.healthy()).isFalse();
        assertThat(health.error()).contains("Cannot connect");
    }

    @Test
    void operationsCompleteOnWorkerPool() throws Exception {
        addStoppedVm("web-01");
        manager.initialize();

        OperationResult started = manager.startVm(VmRef.byName("web-01")).get(5, TimeUnit.SECONDS);
        List<VmSummary> vms = manager.listVms().get(5, TimeUnit.SECONDS);

        assertThat(started.status()).isEqualTo(OperationResult.STARTED);
        assertThat(vms).singleElement().satisfies(vm -> assertThat(vm.state()).isEqualTo(VmState.RUNNING));
    }

    @Test
    void failuresCompleteFutureExceptionally() throws Exception {
        manager.initialize();

        assertThat(manager.getVmStatus(VmRef.byName("ghost")))
                .failsWithin(TIMEOUT)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(NotFoundException.class)
                .withMessageContaining("VM 'ghost' not found");
    }

    @Test
    void apiDelegatesToManager() throws Exception {
        addStoppedVm("db-01");
        manager.initialize();
        VmManagerAPI api = manager.getApi();

        ResourceLimits limits = api.getResourceLimits().get(5, TimeUnit.SECONDS);
        ValidationResult validation = api.validateResources(VmSpec.builder()
                .name("web-02")
                .cpu(CpuConfig.of(2))
                .memory(MemoryConfig.of(1024))
                .disk(DiskConfig.boot("root", 1))
                .network(NetworkConfig.nat("eth0"))
                .build()).get(5, TimeUnit.SECONDS);
        OperationResult stopped = api.stopVm(VmRef.byName("db-01"), false).get(5, TimeUnit.SECONDS);

        assertThat(limits.maxCpuCores()).isEqualTo(8);
        assertThat(limits.availableVcpus()).isEqualTo(30);
        assertThat(validation.valid()).isTrue();
        assertThat(stopped.status()).isEqualTo(OperationResult.ALREADY_STOPPED);
        assertThat(api.getHostMetrics().get(5, TimeUnit.SECONDS).totalVms()).isEqualTo(1);
    }

    @Test
    void resourceLimitsGoThroughTheApi() throws Exception {
        addStoppedVm("db-01");
        manager.initialize();
        VmManagerAPI api = manager.getApi();

        OperationResult result = api.setResourceLimits(VmRef.byName("db-01"),
                ResourceControls.none().withCpuShares(512)).get(5, TimeUnit.SECONDS);

        assertThat(result.status()).isEqualTo(OperationResult.LIMITS_SET);
        assertThat(hypervisor.domain("db-01").orElseThrow().getXml()).contains("<shares>512</shares>");
        assertThat(api.setResourceLimits(VmRef.byName("db-01"), ResourceControls.none()))
                .failsWithin(TIMEOUT)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsRequestsAfterShutdown() throws Exception {
        manager.initialize();
        manager.shutdown();

        assertThat(manager.isInitialized()).isFalse();
        assertThatThrownBy(() -> manager.startVm(VmRef.byName("web-01")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("VM manager is shut down");
        assertThat(hypervisor.getCloses()).isEqualTo(1);
    }

    @Test
    void shutdownIsIdempotent() throws Exception {
        manager.initialize();

        manager.shutdown();
        manager.shutdown();

        assertThat(hypervisor.getCloses()).isEqualTo(1);
    }
}
