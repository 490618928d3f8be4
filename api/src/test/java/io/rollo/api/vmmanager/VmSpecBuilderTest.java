package io.rollo.api.vmmanager;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VmSpecBuilderTest {

    @Test
    void appliesDefaults() {
        VmSpec spec = VmSpec.builder().name("web-01").build();

        assertThat(UUID.fromString(spec.uuid())).isNotNull();
        assertThat(spec.osType()).isEqualTo("linux");
        assertThat(spec.totalVcpus()).isEqualTo(1);
        assertThat(spec.memoryKib()).isEqualTo(1024L * 1024);
        assertThat(spec.vncEnabled()).isTrue();
        assertThat(spec.disks()).isEmpty();
        assertThat(spec.bootDisk()).isEmpty();
    }

    @Test
    void keepsGivenUuidAndDevices() {
        VmSpec spec = VmSpec.builder()
                .name("db-01")
                .uuid("2f0c8f64-1f3c-4b7a-9d8e-5a6b7c8d9e0f")
                .cpu(CpuConfig.topology(2, 2, 2))
                .memory(MemoryConfig.of(4096))
                .disk(DiskConfig.of("data", 50))
                .disks(List.of(DiskConfig.boot("root", 20)))
                .network(NetworkConfig.nat("eth0"))
                .vncEnabled(false)
                .build();

        assertThat(spec.uuid()).isEqualTo("2f0c8f64-1f3c-4b7a-9d8e-5a6b7c8d9e0f");
        assertThat(spec.totalVcpus()).isEqualTo(8);
        assertThat(spec.totalDiskGb()).isEqualTo(70.0);
        assertThat(spec.bootDisk()).map(DiskConfig::name).contains("root");
        assertThat(spec.networks()).hasSize(1);
        assertThat(spec.vncEnabled()).isFalse();
    }

    @Test
    void builtSpecIsDetachedFromBuilder() {
        VmSpecBuilder builder = VmSpec.builder().name("web-01").disk(DiskConfig.boot("root", 10));
        VmSpec first = builder.build();

        builder.disk(DiskConfig.of("data", 5));

        assertThat(first.disks()).hasSize(1);
        assertThatThrownBy(() -> first.disks().add(DiskConfig.of("x", 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nameIsRequired() {
        assertThatThrownBy(() -> VmSpec.builder().build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("VM name is required");
    }

    @Test
    void configCopiesAreIndependent() {
        CpuConfig cpu = CpuConfig.of(4).withPinning(List.of(0, 1, 2, 3)).withLimitPercent(50);
        MemoryConfig memory = MemoryConfig.of(2048).withHugepages(true);

        assertThat(cpu.pinning()).containsExactly(0, 1, 2, 3);
        assertThat(cpu.limitPercent()).isEqualTo(50);
        assertThat(CpuConfig.of(4).pinning()).isEmpty();
        assertThat(memory.hugepages()).isTrue();
        assertThat(memory.balloon()).isTrue();
        assertThat(memory.sizeKib()).isEqualTo(2048L * 1024);
    }
}
