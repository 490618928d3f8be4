package io.rollo.api.vmmanager;

/**
 * How a guest interface attaches to the host network.
 */
public enum NetworkType {
    /**
     * Virtual network with NAT, the default.
     */
    NAT,

    /**
     * Host bridge.
     */
    BRIDGE,

    /**
     * Host bridge with an 802.1Q tag.
     */
    VLAN
}
