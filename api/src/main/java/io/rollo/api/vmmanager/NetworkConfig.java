package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One guest network interface.
 *
 * @param name interface name, unique within the VM
 * @param type attachment type
 * @param network virtual network name for NAT interfaces
 * @param bridge host bridge for bridge and VLAN interfaces
 * @param vlanId VLAN tag, null when untagged
 * @param ipAddress static IP address, null for DHCP
 * @param macAddress MAC address, null to let the hypervisor assign one
 * @param bandwidthMbps bandwidth cap in Mbps, null for unlimited
 */
public record NetworkConfig(
        @Nonnull String name,
        @Nonnull NetworkType type,
        @Nullable String network,
        @Nullable String bridge,
        @Nullable Integer vlanId,
        @Nullable String ipAddress,
        @Nullable String macAddress,
        @Nullable Integer bandwidthMbps) {

    public static final String DEFAULT_NETWORK = "default";

    public NetworkConfig {
        Objects.requireNonNull(name, "name");
        type = type == null ? NetworkType.NAT : type;
    }

    @Nonnull
    public static NetworkConfig nat(@Nonnull String name) {
        return new NetworkConfig(name, NetworkType.NAT, DEFAULT_NETWORK, null, null, null, null, null);
    }

    @Nonnull
    public static NetworkConfig bridge(@Nonnull String name, @Nonnull String bridge) {
        return new NetworkConfig(name, NetworkType.BRIDGE, null, bridge, null, null, null, null);
    }

    @Nonnull
    public static NetworkConfig vlan(@Nonnull String name, @Nonnull String bridge, int vlanId) {
        return new NetworkConfig(name, NetworkType.VLAN, null, bridge, vlanId, null, null, null);
    }

    @Nonnull
    public NetworkConfig withMacAddress(@Nullable String macAddress) {
        return new NetworkConfig(name, type, network, bridge, vlanId, ipAddress, macAddress, bandwidthMbps);
    }

    @Nonnull
    public NetworkConfig withIpAddress(@Nullable String ipAddress) {
        return new NetworkConfig(name, type, network, bridge, vlanId, ipAddress, macAddress, bandwidthMbps);
    }

    @Nonnull
    public NetworkConfig withVlanId(@Nullable Integer vlanId) {
        return new NetworkConfig(name, type, network, bridge, vlanId, ipAddress, macAddress, bandwidthMbps);
    }

    @Nonnull
    public NetworkConfig withBandwidthMbps(@Nullable Integer bandwidthMbps) {
        return new NetworkConfig(name, type, network, bridge, vlanId, ipAddress, macAddress, bandwidthMbps);
    }
}
