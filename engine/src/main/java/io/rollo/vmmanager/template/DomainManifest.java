package io.rollo.vmmanager.template;

import io.rollo.api.vmmanager.ResourceControls;
import io.rollo.api.vmmanager.error.TemplateGenerationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Structured view of a live domain definition.
 *
 * <p>Enumerates the disks and interfaces actually attached to a domain so
 * callers never have to guess device names. Rewrite methods return new
 * definitions and leave this manifest unchanged.</p>
 */
public final class DomainManifest {

    private final Document document;
    private final String name;
    private final String uuid;
    private final long memoryKib;
    private final long currentMemoryKib;
    private final int vcpus;
    private final List<DiskDevice> disks;
    private final List<InterfaceDevice> interfaces;
    private final ResourceControls resourceControls;

    private DomainManifest(Document document) {
        this.document = document;
        Element root = document.getDocumentElement();
        this.name = text(root, "name");
        this.uuid = text(root, "uuid");
        this.memoryKib = memory(root, "memory");
        long current = memory(root, "currentMemory");
        this.currentMemoryKib = current > 0 ? current : memoryKib;
        String vcpuText = text(root, "vcpu");
        this.vcpus = vcpuText.isEmpty() ? 0 : Integer.parseInt(vcpuText.trim());

        List<DiskDevice> diskList = new ArrayList<>();
        List<InterfaceDevice> interfaceList = new ArrayList<>();
        Element devices = DomainXml.child(root, "devices");
        if (devices != null) {
            for (Element disk : DomainXml.children(devices, "disk")) {
                diskList.add(new DiskDevice(
                        DomainXml.childAttribute(disk, "target", "dev"),
                        DomainXml.childAttribute(disk, "source", "file"),
                        DomainXml.childAttribute(disk, "driver", "type"),
                        disk.hasAttribute("device") ? disk.getAttribute("device") : "disk"));
            }
            for (Element iface : DomainXml.children(devices, "interface")) {
                interfaceList.add(new InterfaceDevice(
                        DomainXml.childAttribute(iface, "target", "dev"),
                        DomainXml.childAttribute(iface, "mac", "address"),
                        iface.getAttribute("type")));
            }
        }
        this.disks = List.copyOf(diskList);
        this.interfaces = List.copyOf(interfaceList);

        Element cputune = DomainXml.child(root, "cputune");
        Element memtune = DomainXml.child(root, "memtune");
        this.resourceControls = new ResourceControls(
                cputune != null ? number(cputune, "shares") : null,
                cputune != null ? number(cputune, "period") : null,
                cputune != null ? number(cputune, "quota") : null,
                memtune != null ? memoryOrNull(memtune, "hard_limit") : null,
                memtune != null ? memoryOrNull(memtune, "soft_limit") : null);
    }

    /**
     * Parse a domain definition.
     *
     * @param xml domain XML as returned by the hypervisor
     * @return the manifest
     * @throws TemplateGenerationException if the XML is not a domain definition
     */
    @Nonnull
    public static DomainManifest parse(@Nonnull String xml) {
        Objects.requireNonNull(xml, "xml");
        Document document;
        try {
            document = DomainXml.parse(xml);
        } catch (Exception e) {
            throw new TemplateGenerationException("unknown", "invalid domain definition: " + e.getMessage(), e);
        }
        if (!"domain".equals(document.getDocumentElement().getNodeName())) {
            throw new TemplateGenerationException("unknown",
                    "root element is <" + document.getDocumentElement().getNodeName() + ">, expected <domain>", null);
        }
        try {
            return new DomainManifest(document);
        } catch (NumberFormatException e) {
            throw new TemplateGenerationException("unknown", "invalid number in domain definition: "
                    + e.getMessage(), e);
        }
    }

    // ==================== Queries ====================

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public String getUuid() {
        return uuid;
    }

    public long getMemoryKib() {
        return memoryKib;
    }

    public long getCurrentMemoryKib() {
        return currentMemoryKib;
    }

    public int getVcpus() {
        return vcpus;
    }

    @Nonnull
    public List<DiskDevice> getDisks() {
        return disks;
    }

    @Nonnull
    public List<InterfaceDevice> getInterfaces() {
        return interfaces;
    }

    /**
     * Scheduler and memory tuning of the definition. Absent settings are null.
     *
     * @return tuning from {@code <cputune>} and {@code <memtune>}
     */
    @Nonnull
    public ResourceControls getResourceControls() {
        return resourceControls;
    }

    /**
     * Image files backing the domain's disks. CD-ROMs and non-file disks are excluded.
     *
     * @return image paths in attachment order
     */
    @Nonnull
    public List<String> getDiskPaths() {
        List<String> paths = new ArrayList<>();
        for (DiskDevice disk : disks) {
            if (disk.isFileBackedDisk()) {
                paths.add(disk.sourceFile());
            }
        }
        return paths;
    }

    /**
     * Target devices to read block statistics from.
     *
     * @return device names such as vda
     */
    @Nonnull
    public List<String> getDiskTargets() {
        List<String> targets = new ArrayList<>();
        for (DiskDevice disk : disks) {
            if (disk.target() != null && "disk".equals(disk.device())) {
                targets.add(disk.target());
            }
        }
        return targets;
    }

    /**
     * Host-side interface devices to read network statistics from. Only running
     * domains have them.
     *
     * @return device names such as vnet0
     */
    @Nonnull
    public List<String> getInterfaceTargets() {
        List<String> targets = new ArrayList<>();
        for (InterfaceDevice iface : interfaces) {
            if (iface.target() != null) {
                targets.add(iface.target());
            }
        }
        return targets;
    }

    // ==================== Rewrites ====================

    /**
     * Produce the definition of a clone.
     *
     * <p>Replaces name and UUID, points every disk listed in {@code diskMapping}
     * at its copy, and drops MAC addresses and runtime target devices so the
     * hypervisor assigns fresh ones.</p>
     *
     * @param newName clone name
     * @param newUuid clone UUID
     * @param diskMapping source image path to copied image path
     * @return clone definition
     */
    @Nonnull
    public String rewriteForClone(@Nonnull String newName, @Nonnull String newUuid,
                                  @Nonnull Map<String, String> diskMapping) {
        Objects.requireNonNull(newName, "newName");
        Objects.requireNonNull(newUuid, "newUuid");
        Objects.requireNonNull(diskMapping, "diskMapping");

        Document copy = copyDocument();
        Element root = copy.getDocumentElement();
        setText(root, "name", newName);
        setText(root, "uuid", newUuid);

        Element devices = DomainXml.child(root, "devices");
        if (devices != null) {
            for (Element disk : DomainXml.children(devices, "disk")) {
                Element source = DomainXml.child(disk, "source");
                if (source != null && diskMapping.containsKey(source.getAttribute("file"))) {
                    source.setAttribute("file", diskMapping.get(source.getAttribute("file")));
                }
            }
            for (Element iface : DomainXml.children(devices, "interface")) {
                removeChildren(iface, "mac");
                removeChildren(iface, "target");
            }
        }
        return serialize(copy, newName);
    }

    /**
     * Produce a definition with a different vCPU count and/or memory size.
     *
     * @param newVcpus vCPU count, or 0 to keep
     * @param newMemoryKib memory, or 0 to keep
     * @return updated definition
     */
    @Nonnull
    public String withResources(int newVcpus, long newMemoryKib) {
        Document copy = copyDocument();
        Element root = copy.getDocumentElement();

        if (newVcpus > 0) {
            setText(root, "vcpu", Integer.toString(newVcpus));
            Element cpu = DomainXml.child(root, "cpu");
            Element topology = cpu != null ? DomainXml.child(cpu, "topology") : null;
            if (topology != null) {
                topology.setAttribute("sockets", "1");
                topology.setAttribute("cores", Integer.toString(newVcpus));
                topology.setAttribute("threads", "1");
            }
            Element cputune = DomainXml.child(root, "cputune");
            if (cputune != null) {
                for (Element pin : DomainXml.children(cputune, "vcpupin")) {
                    if (Integer.parseInt(pin.getAttribute("vcpu")) >= newVcpus) {
                        cputune.removeChild(pin);
                    }
                }
            }
        }
        if (newMemoryKib > 0) {
            for (String element : List.of("memory", "currentMemory")) {
                Element memory = DomainXml.child(root, element);
                if (memory != null) {
                    memory.setAttribute("unit", "KiB");
                    memory.setTextContent(Long.toString(newMemoryKib));
                }
            }
        }
        return serialize(copy, name);
    }

    /**
     * Produce a definition with updated CPU scheduler and memory tuning. Null
     * fields of {@code controls} keep the current setting.
     *
     * @param controls values to set
     * @return updated definition
     */
    @Nonnull
    public String withResourceControls(@Nonnull ResourceControls controls) {
        Objects.requireNonNull(controls, "controls");
        Document copy = copyDocument();
        Element root = copy.getDocumentElement();

        if (controls.hasCpuControls()) {
            Element cputune = DomainXml.child(root, "cputune");
            if (cputune == null) {
                cputune = DomainXml.append(root, "cputune");
            }
            setIfPresent(cputune, "shares", controls.cpuShares());
            setIfPresent(cputune, "period", controls.cpuPeriodUs());
            setIfPresent(cputune, "quota", controls.cpuQuotaUs());
        }
        if (controls.hasMemoryControls()) {
            Element memtune = DomainXml.child(root, "memtune");
            if (memtune == null) {
                memtune = DomainXml.append(root, "memtune");
            }
            setIfPresent(memtune, "hard_limit", controls.memoryHardLimitKib());
            setIfPresent(memtune, "soft_limit", controls.memorySoftLimitKib());
            for (Element limit : DomainXml.children(memtune, "hard_limit")) {
                limit.setAttribute("unit", "KiB");
            }
            for (Element limit : DomainXml.children(memtune, "soft_limit")) {
                limit.setAttribute("unit", "KiB");
            }
        }
        return serialize(copy, name);
    }

    // ==================== Internals ====================

    private Document copyDocument() {
        return (Document) document.cloneNode(true);
    }

    private static String serialize(Document document, String identity) {
        try {
            return DomainXml.serialize(document);
        } catch (Exception e) {
            throw new TemplateGenerationException(identity, e.getMessage() != null ? e.getMessage()
                    : e.getClass().getSimpleName(), e);
        }
    }

    private static String text(Element root, String name) {
        Element element = DomainXml.child(root, name);
        return element != null ? element.getTextContent().trim() : "";
    }

    private static void setText(Element root, String name, String value) {
        Element element = DomainXml.child(root, name);
        if (element == null) {
            element = DomainXml.append(root, name);
        }
        element.setTextContent(value);
    }

    private static void setIfPresent(Element parent, String name, @Nullable Long value) {
        if (value != null) {
            setText(parent, name, Long.toString(value));
        }
    }

    private static Long number(Element parent, String name) {
        String value = text(parent, name);
        return value.isEmpty() ? null : Long.parseLong(value);
    }

    private static Long memoryOrNull(Element parent, String name) {
        return DomainXml.child(parent, name) != null ? memory(parent, name) : null;
    }

    private static void removeChildren(Element parent, String name) {
        for (Element child : DomainXml.children(parent, name)) {
            parent.removeChild(child);
        }
    }

    private static long memory(Element root, String name) {
        Element element = DomainXml.child(root, name);
        if (element == null) {
            return 0;
        }
        long value = Long.parseLong(element.getTextContent().trim());
        String unit = element.hasAttribute("unit") ? element.getAttribute("unit") : "KiB";
        return toKib(value, unit);
    }

    static long toKib(long value, @Nonnull String unit) {
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "b":
            case "bytes":
                return value / 1024;
            case "k":
            case "kib":
                return value;
            case "kb":
                return value * 1000 / 1024;
            case "m":
            case "mib":
                return value * 1024;
            case "mb":
                return value * 1000 * 1000 / 1024;
            case "g":
            case "gib":
                return value * 1024 * 1024;
            case "gb":
                return value * 1000 * 1000 * 1000 / 1024;
            default:
                throw new NumberFormatException("unknown memory unit '" + unit + "'");
        }
    }

    /**
     * One disk device of the definition.
     *
     * @param target guest device name (vda, sda, ...), null if absent
     * @param sourceFile backing image path, null for non-file disks
     * @param format driver format, null if absent
     * @param device device kind: disk, cdrom, floppy, lun
     */
    public record DiskDevice(
            @Nullable String target,
            @Nullable String sourceFile,
            @Nullable String format,
            @Nonnull String device) {

        public boolean isFileBackedDisk() {
            return sourceFile != null && !sourceFile.isEmpty() && "disk".equals(device);
        }
    }

    /**
     * One network interface of the definition.
     *
     * @param target host-side device name (vnet0, ...), only present while running
     * @param macAddress MAC address, null if the hypervisor has not assigned one
     * @param type interface type: network, bridge, ...
     */
    public record InterfaceDevice(
            @Nullable String target,
            @Nullable String macAddress,
            @Nonnull String type) {
    }
}
