package io.rollo.vmmanager.hypervisor.libvirt;

import io.rollo.vmmanager.hypervisor.HypervisorException;
import org.libvirt.LibvirtException;

import javax.annotation.Nonnull;

/**
 * Maps libvirt error codes onto {@link HypervisorException.Kind}.
 */
final class LibvirtErrors {

    private LibvirtErrors() {
    }

    @Nonnull
    static HypervisorException translate(@Nonnull String action, @Nonnull LibvirtException e) {
        return new HypervisorException(kindOf(e), action + ": " + e.getMessage(), e);
    }

    @Nonnull
    static HypervisorException.Kind kindOf(@Nonnull LibvirtException e) {
        org.libvirt.Error error = e.getError();
        if (error == null || error.getCode() == null) {
            return HypervisorException.Kind.OPERATION;
        }
        switch (error.getCode()) {
            case VIR_ERR_NO_DOMAIN:
                return HypervisorException.Kind.NO_DOMAIN;
            case VIR_ERR_NO_CONNECT:
            case VIR_ERR_INVALID_CONN:
            case VIR_ERR_RPC:
            case VIR_ERR_SYSTEM_ERROR:
            case VIR_ERR_AUTH_FAILED:
                return HypervisorException.Kind.CONNECTION;
            default:
                return HypervisorException.Kind.OPERATION;
        }
    }
}
