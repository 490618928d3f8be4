package io.rollo.vmmanager.template;

import io.rollo.api.vmmanager.CpuConfig;
import io.rollo.api.vmmanager.DiskConfig;
import io.rollo.api.vmmanager.MemoryConfig;
import io.rollo.api.vmmanager.NetworkConfig;
import io.rollo.api.vmmanager.VmSpec;
import io.rollo.api.vmmanager.error.TemplateGenerationException;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainTemplateGeneratorTest {

    private final DomainTemplateGenerator generator = new DomainTemplateGenerator();

    @Test
    void generatesIdentityMemoryAndCpu() throws Exception {
        VmSpec spec = VmSpec.builder()
                .name("web-01")
                .uuid("0f8fad5b-d9cb-469f-a165-70867728950e")
                .description("front end")
                .cpu(CpuConfig.topology(2, 2, 1))
                .memory(MemoryConfig.of(2048))
                .disk(DiskConfig.boot("root", 20))
                .network(NetworkConfig.nat("eth0"))
                .build();

        Element root = DomainXml.parse(generator.generate(spec, List.of(Paths.get("/images/web-01-root.qcow2"))))
                .getDocumentElement();

        assertThat(root.getAttribute("type")).isEqualTo("kvm");
        assertThat(text(root, "name")).isEqualTo("web-01");
        assertThat(text(root, "uuid")).isEqualTo(spec.uuid());
        assertThat(text(root, "description")).isEqualTo("front end");
        assertThat(text(root, "memory")).isEqualTo("2048");
        assertThat(DomainXml.child(root, "memory").getAttribute("unit")).isEqualTo("MiB");
        assertThat(text(root, "vcpu")).isEqualTo("4");

        Element topology = DomainXml.child(DomainXml.child(root, "cpu"), "topology");
        assertThat(topology.getAttribute("sockets")).isEqualTo("2");
        assertThat(topology.getAttribute("cores")).isEqualTo("2");
        assertThat(topology.getAttribute("threads")).isEqualTo("1");
        assertThat(DomainXml.child(root, "cputune")).isNull();
    }

    @Test
    void generatedDefinitionRoundTripsThroughManifest() {
        VmSpec spec = VmSpec.builder()
                .name("db-01")
                .cpu(CpuConfig.of(4))
                .memory(MemoryConfig.of(4096))
                .disk(DiskConfig.boot("root", 20))
                .disk(DiskConfig.of("data", 100).withFormat("raw").withCache("none"))
                .network(NetworkConfig.nat("eth0"))
                .network(NetworkConfig.bridge("eth1", "br1").withMacAddress("52:54:00:12:34:56"))
                .build();
        List<Path> paths = List.of(Paths.get("/images/db-01-root.qcow2"), Paths.get("/images/db-01-data.raw"));

        DomainManifest manifest = DomainManifest.parse(generator.generate(spec, paths));

        assertThat(manifest.getName()).isEqualTo("db-01");
        assertThat(manifest.getUuid()).isEqualTo(spec.uuid());
        assertThat(manifest.getVcpus()).isEqualTo(4);
        assertThat(manifest.getMemoryKib()).isEqualTo(4096L * 1024);
        assertThat(manifest.getDiskPaths()).containsExactly("/images/db-01-root.qcow2", "/images/db-01-data.raw");
        assertThat(manifest.getDiskTargets()).containsExactly("vda", "vdb");
        assertThat(manifest.getDisks()).extracting(DomainManifest.DiskDevice::format).containsExactly("qcow2", "raw");
        assertThat(manifest.getInterfaces()).extracting(DomainManifest.InterfaceDevice::type)
                .containsExactly("network", "bridge");
        assertThat(manifest.getInterfaces()).extracting(DomainManifest.InterfaceDevice::macAddress)
                .containsExactly(null, "52:54:00:12:34:56");
        assertThat(manifest.getInterfaceTargets()).isEmpty();
    }

    @Test
    void onlyBootDiskGetsBootOrder() throws Exception {
        VmSpec spec = VmSpec.builder()
                .name("vm")
                .disk(DiskConfig.of("data", 5))
                .disk(DiskConfig.boot("root", 10).withReadOnly(true))
                .network(NetworkConfig.nat("eth0"))
                .build();

        Element root = DomainXml.parse(generator.generate(spec,
                List.of(Paths.get("/i/vm-data.qcow2"), Paths.get("/i/vm-root.qcow2")))).getDocumentElement();
        List<Element> disks = DomainXml.children(DomainXml.child(root, "devices"), "disk");

        assertThat(DomainXml.child(disks.get(0), "boot")).isNull();
        assertThat(DomainXml.child(disks.get(1), "boot").getAttribute("order")).isEqualTo("1");
        assertThat(DomainXml.child(disks.get(1), "readonly")).isNotNull();
        assertThat(DomainXml.child(disks.get(1), "driver").getAttribute("cache")).isEqualTo("writeback");
    }

    @Test
    void cpuTuningIsEmittedWhenRequested() throws Exception {
        VmSpec spec = VmSpec.builder()
                .name("tuned")
                .cpu(CpuConfig.of(2).withShares(512).withLimitPercent(50).withPinning(List.of(2, 3))
                        .withModel("Skylake-Server"))
                .disk(DiskConfig.boot("root", 10))
                .network(NetworkConfig.nat("eth0"))
                .build();

        Element root = DomainXml.parse(generator.generate(spec, List.of(Paths.get("/i/tuned.qcow2"))))
                .getDocumentElement();
        Element tune = DomainXml.child(root, "cputune");

        assertThat(text(tune, "shares")).isEqualTo("512");
        assertThat(text(tune, "period")).isEqualTo("100000");
        assertThat(text(tune, "quota")).isEqualTo("50000");
        assertThat(DomainXml.children(tune, "vcpupin"))
                .extracting(e -> e.getAttribute("vcpu") + ":" + e.getAttribute("cpuset"))
                .containsExactly("0:2", "1:3");

        Element cpu = DomainXml.child(root, "cpu");
        assertThat(cpu.getAttribute("mode")).isEqualTo("custom");
        assertThat(text(cpu, "model")).isEqualTo("Skylake-Server");
    }

    @Test
    void networkOptionsMapToInterfaceElements() throws Exception {
        VmSpec spec = VmSpec.builder()
                .name("net")
                .disk(DiskConfig.boot("root", 10))
                .network(NetworkConfig.vlan("eth0", "br0", 42).withBandwidthMbps(100))
                .vncEnabled(false)
                .build();

        Element root = DomainXml.parse(generator.generate(spec, List.of(Paths.get("/i/net.qcow2"))))
                .getDocumentElement();
        Element devices = DomainXml.child(root, "devices");
        Element iface = DomainXml.child(devices, "interface");

        assertThat(iface.getAttribute("type")).isEqualTo("bridge");
        assertThat(DomainXml.childAttribute(iface, "source", "bridge")).isEqualTo("br0");
        assertThat(DomainXml.child(DomainXml.child(iface, "vlan"), "tag").getAttribute("id")).isEqualTo("42");
        assertThat(DomainXml.childAttribute(DomainXml.child(iface, "bandwidth"), "inbound", "average"))
                .isEqualTo("12500");
        assertThat(DomainXml.child(devices, "graphics")).isNull();
    }

    @Test
    void specialCharactersAreEscaped() {
        VmSpec spec = VmSpec.builder()
                .name("escape")
                .description("<script>&\"quotes\"</script>")
                .disk(DiskConfig.boot("root", 10))
                .network(NetworkConfig.nat("eth0"))
                .build();

        String xml = generator.generate(spec, List.of(Paths.get("/i/a&b.qcow2")));

        assertThat(xml).doesNotContain("<script>");
        assertThat(DomainManifest.parse(xml).getDiskPaths()).containsExactly("/i/a&b.qcow2");
    }

    @Test
    void diskPathCountMustMatchSpec() {
        VmSpec spec = VmSpec.builder()
                .name("vm")
                .disk(DiskConfig.boot("root", 10))
                .network(NetworkConfig.nat("eth0"))
                .build();

        assertThatThrownBy(() -> generator.generate(spec, List.of()))
                .isInstanceOf(TemplateGenerationException.class)
                .hasMessageContaining("expected 1 disk paths");
    }

    @Test
    void diskTargetsFollowVirtioNaming() {
        assertThat(DomainTemplateGenerator.diskTarget(0)).isEqualTo("vda");
        assertThat(DomainTemplateGenerator.diskTarget(9)).isEqualTo("vdj");
        assertThatThrownBy(() -> DomainTemplateGenerator.diskTarget(26)).isInstanceOf(IllegalArgumentException.class);
    }

    private static String text(Element parent, String name) {
        return DomainXml.child(parent, name).getTextContent().trim();
    }
}
