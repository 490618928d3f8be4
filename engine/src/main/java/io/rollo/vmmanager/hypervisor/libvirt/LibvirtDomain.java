package io.rollo.vmmanager.hypervisor.libvirt;

import io.rollo.vmmanager.hypervisor.BlockStats;
import io.rollo.vmmanager.hypervisor.CpuTimes;
import io.rollo.vmmanager.hypervisor.DomainInfo;
import io.rollo.vmmanager.hypervisor.GuestMemoryStats;
import io.rollo.vmmanager.hypervisor.HypervisorDomain;
import io.rollo.vmmanager.hypervisor.HypervisorException;
import io.rollo.vmmanager.hypervisor.HypervisorState;
import io.rollo.vmmanager.hypervisor.InterfaceStats;
import org.libvirt.Domain;
import org.libvirt.DomainBlockStats;
import org.libvirt.DomainInterfaceStats;
import org.libvirt.LibvirtException;
import org.libvirt.MemoryStatistic;
import org.libvirt.SchedLongParameter;
import org.libvirt.SchedParameter;
import org.libvirt.SchedUlongParameter;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;

/**
 * {@link HypervisorDomain} backed by a libvirt {@link Domain}.
 */
class LibvirtDomain implements HypervisorDomain {

    private static final String STATE_PREFIX = "VIR_DOMAIN_";
    private static final int MEMORY_STAT_SLOTS = 16;
    private static final String QUOTA_SUFFIX = "_quota";

    private final Domain domain;
    private final String name;
    private final String uuid;

    LibvirtDomain(@Nonnull Domain domain) throws HypervisorException {
        this.domain = Objects.requireNonNull(domain, "domain");
        try {
            this.name = domain.getName();
            this.uuid = domain.getUUIDString();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("read domain identity", e);
        }
    }

    @Override
    @Nonnull
    public String name() {
        return name;
    }

    @Override
    @Nonnull
    public String uuid() {
        return uuid;
    }

    @Override
    @Nonnull
    public DomainInfo info() throws HypervisorException {
        try {
            org.libvirt.DomainInfo info = domain.getInfo();
            return new DomainInfo(mapState(info.state), info.maxMem, info.memory, info.nrVirtCpu, info.cpuTime);
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("get info of " + name, e);
        }
    }

    static HypervisorState mapState(org.libvirt.DomainInfo.DomainState state) {
        if (state == null) {
            return HypervisorState.NOSTATE;
        }
        String raw = state.name();
        if (raw.startsWith(STATE_PREFIX)) {
            raw = raw.substring(STATE_PREFIX.length());
        }
        try {
            return HypervisorState.valueOf(raw);
        } catch (IllegalArgumentException e) {
            return HypervisorState.NOSTATE;
        }
    }

    @Override
    @Nonnull
    public String xmlDescription() throws HypervisorException {
        try {
            return domain.getXMLDesc(0);
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("get definition of " + name, e);
        }
    }

    @Override
    public void create() throws HypervisorException {
        try {
            domain.create();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("start " + name, e);
        }
    }

    @Override
    public void destroy() throws HypervisorException {
        try {
            domain.destroy();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("destroy " + name, e);
        }
    }

    @Override
    public void shutdown() throws HypervisorException {
        try {
            domain.shutdown();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("shut down " + name, e);
        }
    }

    @Override
    public void suspend() throws HypervisorException {
        try {
            domain.suspend();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("suspend " + name, e);
        }
    }

    @Override
    public void resume() throws HypervisorException {
        try {
            domain.resume();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("resume " + name, e);
        }
    }

    @Override
    public void undefine() throws HypervisorException {
        try {
            domain.undefine();
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("undefine " + name, e);
        }
    }

    @Override
    public void setMemory(long memoryKib) throws HypervisorException {
        try {
            domain.setMemory(memoryKib);
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("set memory of " + name, e);
        }
    }

    @Override
    public void setVcpus(int vcpus) throws HypervisorException {
        try {
            domain.setVcpus(vcpus);
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("set vCPUs of " + name, e);
        }
    }

    @Override
    public void setSchedulerParameters(@Nonnull Map<String, Long> parameters) throws HypervisorException {
        SchedParameter[] params = new SchedParameter[parameters.size()];
        int i = 0;
        for (Map.Entry<String, Long> entry : parameters.entrySet()) {
            params[i++] = schedParameter(entry.getKey(), entry.getValue());
        }
        try {
            domain.setSchedulerParameters(params);
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("set scheduler parameters of " + name, e);
        }
    }

    // quotas are signed (-1 is unlimited), shares and periods are unsigned
    static SchedParameter schedParameter(String field, long value) {
        if (field.endsWith(QUOTA_SUFFIX)) {
            SchedLongParameter param = new SchedLongParameter();
            param.field = field;
            param.value = value;
            return param;
        }
        SchedUlongParameter param = new SchedUlongParameter();
        param.field = field;
        param.value = value;
        return param;
    }

    @Override
    @Nonnull
    public BlockStats blockStats(@Nonnull String device) throws HypervisorException {
        try {
            DomainBlockStats stats = domain.blockStats(device);
            return new BlockStats(stats.rd_req, stats.rd_bytes, stats.wr_req, stats.wr_bytes, stats.errs);
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("read block stats of " + name + "/" + device, e);
        }
    }

    @Override
    @Nonnull
    public InterfaceStats interfaceStats(@Nonnull String device) throws HypervisorException {
        try {
            DomainInterfaceStats stats = domain.interfaceStats(device);
            return new InterfaceStats(
                    stats.rx_bytes, stats.rx_packets, stats.rx_errs, stats.rx_drop,
                    stats.tx_bytes, stats.tx_packets, stats.tx_errs, stats.tx_drop);
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("read interface stats of " + name + "/" + device, e);
        }
    }

    // libvirt-java exposes only the total; the user/system split is reported as unknown
    @Override
    @Nonnull
    public CpuTimes cpuTimes() throws HypervisorException {
        return new CpuTimes(info().cpuTimeNs(), -1, -1);
    }

    @Override
    @Nonnull
    public GuestMemoryStats memoryStats() throws HypervisorException {
        MemoryStatistic[] stats;
        try {
            stats = domain.memoryStats(MEMORY_STAT_SLOTS);
        } catch (LibvirtException e) {
            throw LibvirtErrors.translate("read memory stats of " + name, e);
        }
        long available = -1;
        long unused = -1;
        long rss = -1;
        if (stats != null) {
            for (MemoryStatistic stat : stats) {
                String tag = String.valueOf(stat.getTag());
                if (tag.endsWith("_AVAILABLE")) {
                    available = stat.getValue();
                } else if (tag.endsWith("_UNUSED")) {
                    unused = stat.getValue();
                } else if (tag.endsWith("_RSS")) {
                    rss = stat.getValue();
                }
            }
        }
        return new GuestMemoryStats(available, unused, rss);
    }
}
