package io.rollo.vmmanager.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Configuration for the VM manager.
 *
 * <p>Loaded from a YAML file such as {@code vm-manager.yml}. Every value has a
 * default, so an empty file yields a working configuration for a local
 * {@code qemu:///system} host.</p>
 */
public class VmManagerConfig {

    private ConnectionConfig connection = new ConnectionConfig();
    private StorageConfig storage = new StorageConfig();
    private ResourceConfig resources = new ResourceConfig();
    private LifecycleConfig lifecycle = new LifecycleConfig();
    private MonitoringConfig monitoring = new MonitoringConfig();

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static VmManagerConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            VmManagerConfig config = new VmManagerConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(VmManagerConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            VmManagerConfig config = yaml.load(is);
            return config != null ? config : new VmManagerConfig();
        }
    }

    /**
     * Save configuration to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(options);
        try (Writer writer = Files.newBufferedWriter(path)) {
            // Untagged root so the file loads back under the default tag inspector
            writer.write(yaml.dumpAs(this, Tag.MAP, DumperOptions.FlowStyle.BLOCK));
        }
    }

    // Getters and Setters

    public ConnectionConfig getConnection() {
        return connection;
    }

    public void setConnection(ConnectionConfig connection) {
        this.connection = connection;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage;
    }

    public ResourceConfig getResources() {
        return resources;
    }

    public void setResources(ResourceConfig resources) {
        this.resources = resources;
    }

    public LifecycleConfig getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(LifecycleConfig lifecycle) {
        this.lifecycle = lifecycle;
    }

    public MonitoringConfig getMonitoring() {
        return monitoring;
    }

    public void setMonitoring(MonitoringConfig monitoring) {
        this.monitoring = monitoring;
    }

    /**
     * Hypervisor connection settings.
     */
    public static class ConnectionConfig {
        private String uri = "qemu:///system";
        private int livenessWindowSeconds = 300;
        private int lockTimeoutSeconds = 30;

        public String getUri() {
            return uri;
        }

        public void setUri(String uri) {
            this.uri = uri;
        }

        /**
         * How long a successful liveness probe is trusted before the next call probes again.
         */
        public int getLivenessWindowSeconds() {
            return livenessWindowSeconds;
        }

        public void setLivenessWindowSeconds(int livenessWindowSeconds) {
            this.livenessWindowSeconds = livenessWindowSeconds;
        }

        public int getLockTimeoutSeconds() {
            return lockTimeoutSeconds;
        }

        public void setLockTimeoutSeconds(int lockTimeoutSeconds) {
            this.lockTimeoutSeconds = lockTimeoutSeconds;
        }
    }

    /**
     * Disk image storage settings.
     */
    public static class StorageConfig {
        private String imageDirectory = "/var/lib/libvirt/images";
        private String qemuImgPath = "qemu-img";
        private int imageTimeoutSeconds = 600;
        private double freeSpaceRatio = 0.9;

        public String getImageDirectory() {
            return imageDirectory;
        }

        public void setImageDirectory(String imageDirectory) {
            this.imageDirectory = imageDirectory;
        }

        public String getQemuImgPath() {
            return qemuImgPath;
        }

        public void setQemuImgPath(String qemuImgPath) {
            this.qemuImgPath = qemuImgPath;
        }

        public int getImageTimeoutSeconds() {
            return imageTimeoutSeconds;
        }

        public void setImageTimeoutSeconds(int imageTimeoutSeconds) {
            this.imageTimeoutSeconds = imageTimeoutSeconds;
        }

        public double getFreeSpaceRatio() {
            return freeSpaceRatio;
        }

        public void setFreeSpaceRatio(double freeSpaceRatio) {
            this.freeSpaceRatio = freeSpaceRatio;
        }
    }

    /**
     * Resource accounting and per-VM limits.
     */
    public static class ResourceConfig {
        private double vcpuOvercommitRatio = 4.0;
        private double hostMemoryRatio = 0.9;
        private long allocationCacheTtlMillis = 2000;
        private int maxCpuCores = 32;
        private int maxSockets = 4;
        private int maxThreads = 2;
        private long minMemoryMb = 512;
        private long maxMemoryMb = 65536;
        private int maxDisks = 10;
        private double maxDiskGb = 2000.0;
        private int maxNetworks = 5;

        public double getVcpuOvercommitRatio() {
            return vcpuOvercommitRatio;
        }

        public void setVcpuOvercommitRatio(double vcpuOvercommitRatio) {
            this.vcpuOvercommitRatio = vcpuOvercommitRatio;
        }

        public double getHostMemoryRatio() {
            return hostMemoryRatio;
        }

        public void setHostMemoryRatio(double hostMemoryRatio) {
            this.hostMemoryRatio = hostMemoryRatio;
        }

        /**
         * Lifetime of a cached allocation scan. Zero disables the cache.
         */
        public long getAllocationCacheTtlMillis() {
            return allocationCacheTtlMillis;
        }

        public void setAllocationCacheTtlMillis(long allocationCacheTtlMillis) {
            this.allocationCacheTtlMillis = allocationCacheTtlMillis;
        }

        public int getMaxCpuCores() {
            return maxCpuCores;
        }

        public void setMaxCpuCores(int maxCpuCores) {
            this.maxCpuCores = maxCpuCores;
        }

        public int getMaxSockets() {
            return maxSockets;
        }

        public void setMaxSockets(int maxSockets) {
            this.maxSockets = maxSockets;
        }

        public int getMaxThreads() {
            return maxThreads;
        }

        public void setMaxThreads(int maxThreads) {
            this.maxThreads = maxThreads;
        }

        public long getMinMemoryMb() {
            return minMemoryMb;
        }

        public void setMinMemoryMb(long minMemoryMb) {
            this.minMemoryMb = minMemoryMb;
        }

        public long getMaxMemoryMb() {
            return maxMemoryMb;
        }

        public void setMaxMemoryMb(long maxMemoryMb) {
            this.maxMemoryMb = maxMemoryMb;
        }

        public int getMaxDisks() {
            return maxDisks;
        }

        public void setMaxDisks(int maxDisks) {
            this.maxDisks = maxDisks;
        }

        public double getMaxDiskGb() {
            return maxDiskGb;
        }

        public void setMaxDiskGb(double maxDiskGb) {
            this.maxDiskGb = maxDiskGb;
        }

        public int getMaxNetworks() {
            return maxNetworks;
        }

        public void setMaxNetworks(int maxNetworks) {
            this.maxNetworks = maxNetworks;
        }
    }

    /**
     * Worker pool and composed-operation settings.
     */
    public static class LifecycleConfig {
        private int workerThreads = 8;
        private int restartSettleTimeoutSeconds = 60;
        private long settlePollMillis = 500;

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getRestartSettleTimeoutSeconds() {
            return restartSettleTimeoutSeconds;
        }

        public void setRestartSettleTimeoutSeconds(int restartSettleTimeoutSeconds) {
            this.restartSettleTimeoutSeconds = restartSettleTimeoutSeconds;
        }

        public long getSettlePollMillis() {
            return settlePollMillis;
        }

        public void setSettlePollMillis(long settlePollMillis) {
            this.settlePollMillis = settlePollMillis;
        }
    }

    /**
     * Metrics polling, event forwarding and host alerts.
     */
    public static class MonitoringConfig {
        private boolean enabled = true;
        private int intervalSeconds = 5;
        private boolean eventsEnabled = false;
        private double memoryAlertThreshold = 0.90;
        private double cpuAlertThreshold = 0.95;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public boolean isEventsEnabled() {
            return eventsEnabled;
        }

        public void setEventsEnabled(boolean eventsEnabled) {
            this.eventsEnabled = eventsEnabled;
        }

        public double getMemoryAlertThreshold() {
            return memoryAlertThreshold;
        }

        public void setMemoryAlertThreshold(double memoryAlertThreshold) {
            this.memoryAlertThreshold = memoryAlertThreshold;
        }

        public double getCpuAlertThreshold() {
            return cpuAlertThreshold;
        }

        public void setCpuAlertThreshold(double cpuAlertThreshold) {
            this.cpuAlertThreshold = cpuAlertThreshold;
        }
    }
}
