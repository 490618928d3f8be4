package io.rollo.vmmanager.template;

import io.rollo.api.vmmanager.CpuConfig;
import io.rollo.api.vmmanager.DiskConfig;
import io.rollo.api.vmmanager.MemoryConfig;
import io.rollo.api.vmmanager.NetworkConfig;
import io.rollo.api.vmmanager.NetworkType;
import io.rollo.api.vmmanager.VmSpec;
import io.rollo.api.vmmanager.error.TemplateGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link VmSpec} into a KVM domain definition.
 *
 * <p>Pure formatting: no hypervisor or filesystem access. Disk image paths
 * are resolved by the caller and passed in attachment order.</p>
 */
public class DomainTemplateGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DomainTemplateGenerator.class);

    private static final int CFS_PERIOD_US = 100_000;
    private static final int KBYTES_PER_MBIT = 125;

    private final String arch;
    private final String machine;

    public DomainTemplateGenerator() {
        this("x86_64", "q35");
    }

    public DomainTemplateGenerator(@Nonnull String arch, @Nonnull String machine) {
        this.arch = Objects.requireNonNull(arch, "arch");
        this.machine = Objects.requireNonNull(machine, "machine");
    }

    /**
     * Generate the domain XML.
     *
     * @param spec VM configuration
     * @param diskPaths image path for each disk of the spec, same order
     * @return well-formed domain XML
     * @throws TemplateGenerationException if the definition cannot be produced
     */
    @Nonnull
    public String generate(@Nonnull VmSpec spec, @Nonnull List<Path> diskPaths) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(diskPaths, "diskPaths");
        if (diskPaths.size() != spec.disks().size()) {
            throw new TemplateGenerationException(spec.name(),
                    "expected " + spec.disks().size() + " disk paths, got " + diskPaths.size(), null);
        }

        String xml;
        try {
            Document document = DomainXml.newDocument();
            Element domain = document.createElement("domain");
            domain.setAttribute("type", "kvm");
            document.appendChild(domain);

            DomainXml.append(domain, "name", spec.name());
            DomainXml.append(domain, "uuid", spec.uuid());
            if (spec.description() != null) {
                DomainXml.append(domain, "description", spec.description());
            }
            appendMemory(domain, spec.memory());
            appendCpu(domain, spec.cpu());
            appendOs(domain);
            appendDevices(domain, spec, diskPaths);

            xml = DomainXml.serialize(document);
            // Re-parse to reject characters the serializer let through
            DomainXml.parse(xml);
        } catch (Exception e) {
            LOGGER.error("Failed to generate domain definition for '{}': {}", spec.name(), e.getMessage());
            throw new TemplateGenerationException(spec.name(), e.getMessage() != null ? e.getMessage()
                    : e.getClass().getSimpleName(), e);
        }

        LOGGER.debug("Generated domain definition for '{}'", spec.name());
        return xml;
    }

    private void appendMemory(Element domain, MemoryConfig memory) {
        Element size = DomainXml.append(domain, "memory", Long.toString(memory.sizeMb()));
        size.setAttribute("unit", "MiB");
        Element current = DomainXml.append(domain, "currentMemory", Long.toString(memory.sizeMb()));
        current.setAttribute("unit", "MiB");

        if (memory.hugepages()) {
            Element backing = DomainXml.append(domain, "memoryBacking");
            DomainXml.append(backing, "hugepages");
        }
    }

    private void appendCpu(Element domain, CpuConfig cpu) {
        Element vcpu = DomainXml.append(domain, "vcpu", Integer.toString(cpu.totalVcpus()));
        vcpu.setAttribute("placement", "static");

        boolean tuned = cpu.shares() != null || cpu.limitPercent() != null || !cpu.pinning().isEmpty();
        if (tuned) {
            Element tune = DomainXml.append(domain, "cputune");
            if (cpu.shares() != null) {
                DomainXml.append(tune, "shares", Integer.toString(cpu.shares()));
            }
            if (cpu.limitPercent() != null) {
                DomainXml.append(tune, "period", Integer.toString(CFS_PERIOD_US));
                DomainXml.append(tune, "quota", Integer.toString(CFS_PERIOD_US * cpu.limitPercent() / 100));
            }
            List<Integer> pinning = cpu.pinning();
            for (int i = 0; i < pinning.size(); i++) {
                Element pin = DomainXml.append(tune, "vcpupin");
                pin.setAttribute("vcpu", Integer.toString(i));
                pin.setAttribute("cpuset", Integer.toString(pinning.get(i)));
            }
        }

        Element cpuElement;
        if (cpu.model() != null) {
            cpuElement = DomainXml.append(domain, "cpu");
            cpuElement.setAttribute("mode", "custom");
            cpuElement.setAttribute("match", "exact");
            DomainXml.append(cpuElement, "model", cpu.model());
        } else {
            cpuElement = DomainXml.append(domain, "cpu");
            cpuElement.setAttribute("mode", "host-model");
        }
        Element topology = DomainXml.append(cpuElement, "topology");
        topology.setAttribute("sockets", Integer.toString(cpu.sockets()));
        topology.setAttribute("cores", Integer.toString(cpu.cores()));
        topology.setAttribute("threads", Integer.toString(cpu.threads()));
    }

    private void appendOs(Element domain) {
        Element os = DomainXml.append(domain, "os");
        Element type = DomainXml.append(os, "type", "hvm");
        type.setAttribute("arch", arch);
        type.setAttribute("machine", machine);

        Element features = DomainXml.append(domain, "features");
        DomainXml.append(features, "acpi");
        DomainXml.append(features, "apic");

        Element clock = DomainXml.append(domain, "clock");
        clock.setAttribute("offset", "utc");

        DomainXml.append(domain, "on_poweroff", "destroy");
        DomainXml.append(domain, "on_reboot", "restart");
        DomainXml.append(domain, "on_crash", "destroy");
    }

    private void appendDevices(Element domain, VmSpec spec, List<Path> diskPaths) {
        Element devices = DomainXml.append(domain, "devices");

        List<DiskConfig> disks = spec.disks();
        for (int i = 0; i < disks.size(); i++) {
            appendDisk(devices, disks.get(i), diskPaths.get(i), diskTarget(i));
        }
        for (NetworkConfig network : spec.networks()) {
            appendInterface(devices, network);
        }

        Element serial = DomainXml.append(devices, "serial");
        serial.setAttribute("type", "pty");
        DomainXml.append(serial, "target").setAttribute("port", "0");
        Element console = DomainXml.append(devices, "console");
        console.setAttribute("type", "pty");
        Element consoleTarget = DomainXml.append(console, "target");
        consoleTarget.setAttribute("type", "serial");
        consoleTarget.setAttribute("port", "0");

        Element channel = DomainXml.append(devices, "channel");
        channel.setAttribute("type", "unix");
        Element channelTarget = DomainXml.append(channel, "target");
        channelTarget.setAttribute("type", "virtio");
        channelTarget.setAttribute("name", "org.qemu.guest_agent.0");

        if (spec.vncEnabled()) {
            Element graphics = DomainXml.append(devices, "graphics");
            graphics.setAttribute("type", "vnc");
            graphics.setAttribute("port", "-1");
            graphics.setAttribute("autoport", "yes");
            graphics.setAttribute("listen", "127.0.0.1");
            Element video = DomainXml.append(devices, "video");
            DomainXml.append(video, "model").setAttribute("type", "virtio");
        }

        Element balloon = DomainXml.append(devices, "memballoon");
        balloon.setAttribute("model", spec.memory().balloon() ? "virtio" : "none");
    }

    private void appendDisk(Element devices, DiskConfig disk, Path path, String target) {
        Element element = DomainXml.append(devices, "disk");
        element.setAttribute("type", "file");
        element.setAttribute("device", "disk");

        Element driver = DomainXml.append(element, "driver");
        driver.setAttribute("name", "qemu");
        driver.setAttribute("type", disk.format());
        driver.setAttribute("cache", disk.cache());

        DomainXml.append(element, "source").setAttribute("file", path.toString());

        Element targetElement = DomainXml.append(element, "target");
        targetElement.setAttribute("dev", target);
        targetElement.setAttribute("bus", "virtio");

        if (disk.bootable()) {
            DomainXml.append(element, "boot").setAttribute("order", "1");
        }
        if (disk.readOnly()) {
            DomainXml.append(element, "readonly");
        }
    }

    private void appendInterface(Element devices, NetworkConfig network) {
        Element element = DomainXml.append(devices, "interface");
        if (network.type() == NetworkType.NAT) {
            element.setAttribute("type", "network");
            String name = network.network() != null ? network.network() : NetworkConfig.DEFAULT_NETWORK;
            DomainXml.append(element, "source").setAttribute("network", name);
        } else {
            element.setAttribute("type", "bridge");
            String bridge = network.bridge() != null ? network.bridge() : "br0";
            DomainXml.append(element, "source").setAttribute("bridge", bridge);
        }

        if (network.vlanId() != null) {
            Element vlan = DomainXml.append(element, "vlan");
            DomainXml.append(vlan, "tag").setAttribute("id", Integer.toString(network.vlanId()));
        }
        if (network.macAddress() != null) {
            DomainXml.append(element, "mac").setAttribute("address", network.macAddress());
        }
        DomainXml.append(element, "model").setAttribute("type", "virtio");

        if (network.bandwidthMbps() != null) {
            String average = Integer.toString(network.bandwidthMbps() * KBYTES_PER_MBIT);
            Element bandwidth = DomainXml.append(element, "bandwidth");
            DomainXml.append(bandwidth, "inbound").setAttribute("average", average);
            DomainXml.append(bandwidth, "outbound").setAttribute("average", average);
        }
    }

    /**
     * Virtio target device name for a disk index: vda, vdb, ...
     *
     * @param index zero based disk index
     * @return device name
     */
    @Nonnull
    public static String diskTarget(int index) {
        if (index < 0 || index >= 26) {
            throw new IllegalArgumentException("Disk index out of range: " + index);
        }
        return "vd" + (char) ('a' + index);
    }
}
