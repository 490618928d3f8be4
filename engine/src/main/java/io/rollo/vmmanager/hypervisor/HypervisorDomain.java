package io.rollo.vmmanager.hypervisor;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Handle to one domain. Only valid while the client that produced it is open.
 */
public interface HypervisorDomain {

    @Nonnull
    String name();

    @Nonnull
    String uuid();

    @Nonnull
    DomainInfo info() throws HypervisorException;

    /**
     * Get the current domain definition.
     *
     * @return domain XML
     * @throws HypervisorException if the hypervisor fails
     */
    @Nonnull
    String xmlDescription() throws HypervisorException;

    void create() throws HypervisorException;

    void destroy() throws HypervisorException;

    void shutdown() throws HypervisorException;

    void suspend() throws HypervisorException;

    void resume() throws HypervisorException;

    void undefine() throws HypervisorException;

    /**
     * Change the balloon target of a running domain.
     *
     * @param memoryKib new memory
     * @throws HypervisorException if the hypervisor refuses
     */
    void setMemory(long memoryKib) throws HypervisorException;

    void setVcpus(int vcpus) throws HypervisorException;

    /**
     * Change scheduler parameters of a running domain, such as {@code cpu_shares},
     * {@code vcpu_period} and {@code vcpu_quota}.
     *
     * @param parameters parameter name to value
     * @throws HypervisorException if the hypervisor refuses
     */
    void setSchedulerParameters(@Nonnull Map<String, Long> parameters) throws HypervisorException;

    @Nonnull
    BlockStats blockStats(@Nonnull String device) throws HypervisorException;

    @Nonnull
    InterfaceStats interfaceStats(@Nonnull String device) throws HypervisorException;

    @Nonnull
    CpuTimes cpuTimes() throws HypervisorException;

    /**
     * Read balloon driver statistics.
     *
     * @return the statistics, with unreported values negative
     * @throws HypervisorException if the hypervisor fails
     */
    @Nonnull
    GuestMemoryStats memoryStats() throws HypervisorException;
}
