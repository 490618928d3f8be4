package io.rollo.vmmanager.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class VmManagerConfigTest {

    @TempDir
    Path dir;

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        Path file = dir.resolve("conf/vm-manager.yml");

        VmManagerConfig config = VmManagerConfig.load(file);

        assertThat(file).exists();
        assertThat(Files.readString(file)).contains("connection:", "uri: qemu:///system", "resources:");
        assertThat(config.getConnection().getUri()).isEqualTo("qemu:///system");
        assertThat(config.getResources().getVcpuOvercommitRatio()).isEqualTo(4.0);
        assertThat(config.getLifecycle().getRestartSettleTimeoutSeconds()).isEqualTo(60);
        assertThat(config.getMonitoring().isEnabled()).isTrue();
    }

    @Test
    void savedConfigLoadsBack() throws Exception {
        Path file = dir.resolve("vm-manager.yml");
        VmManagerConfig config = new VmManagerConfig();
        config.getConnection().setUri("qemu+ssh://root@hv1/system");
        config.getStorage().setImageDirectory("/data/images");
        config.getResources().setMaxCpuCores(16);
        config.getMonitoring().setIntervalSeconds(30);
        config.save(file);

        VmManagerConfig loaded = VmManagerConfig.load(file);

        assertThat(loaded.getConnection().getUri()).isEqualTo("qemu+ssh://root@hv1/system");
        assertThat(loaded.getStorage().getImageDirectory()).isEqualTo("/data/images");
        assertThat(loaded.getResources().getMaxCpuCores()).isEqualTo(16);
        assertThat(loaded.getMonitoring().getIntervalSeconds()).isEqualTo(30);
    }

    @Test
    void partialFileKeepsDefaultsForOmittedKeys() throws Exception {
        Path file = dir.resolve("vm-manager.yml");
        Files.writeString(file, "connection:\n  uri: test:///default\nmonitoring:\n  enabled: false\n");

        VmManagerConfig config = VmManagerConfig.load(file);

        assertThat(config.getConnection().getUri()).isEqualTo("test:///default");
        assertThat(config.getConnection().getLivenessWindowSeconds()).isEqualTo(300);
        assertThat(config.getMonitoring().isEnabled()).isFalse();
        assertThat(config.getStorage().getQemuImgPath()).isEqualTo("qemu-img");
    }

    @Test
    void emptyFileYieldsDefaults() throws Exception {
        Path file = Files.createFile(dir.resolve("vm-manager.yml"));

        VmManagerConfig config = VmManagerConfig.load(file);

        assertThat(config.getResources().getMaxMemoryMb()).isEqualTo(65536);
    }
}
