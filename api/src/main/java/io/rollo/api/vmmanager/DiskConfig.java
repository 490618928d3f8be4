package io.rollo.api.vmmanager;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One virtual disk backed by an image file.
 *
 * @param name disk name, unique within the VM
 * @param sizeGb virtual size in GiB
 * @param format image format (qcow2, raw or vmdk)
 * @param cache hypervisor cache mode
 * @param bootable whether the guest boots from this disk
 * @param path explicit image path, null to place it in the storage directory
 * @param baseImage backing image for copy-on-write disks, null for a blank disk
 * @param readOnly attach the disk read-only
 */
public record DiskConfig(
        @Nonnull String name,
        double sizeGb,
        @Nonnull String format,
        @Nonnull String cache,
        boolean bootable,
        @Nullable String path,
        @Nullable String baseImage,
        boolean readOnly) {

    public static final String DEFAULT_FORMAT = "qcow2";
    public static final String DEFAULT_CACHE = "writeback";

    public DiskConfig {
        Objects.requireNonNull(name, "name");
        format = format == null ? DEFAULT_FORMAT : format;
        cache = cache == null ? DEFAULT_CACHE : cache;
    }

    @Nonnull
    public static DiskConfig of(@Nonnull String name, double sizeGb) {
        return new DiskConfig(name, sizeGb, DEFAULT_FORMAT, DEFAULT_CACHE, false, null, null, false);
    }

    @Nonnull
    public static DiskConfig boot(@Nonnull String name, double sizeGb) {
        return new DiskConfig(name, sizeGb, DEFAULT_FORMAT, DEFAULT_CACHE, true, null, null, false);
    }

    @Nonnull
    public DiskConfig withFormat(@Nonnull String format) {
        return new DiskConfig(name, sizeGb, format, cache, bootable, path, baseImage, readOnly);
    }

    @Nonnull
    public DiskConfig withCache(@Nonnull String cache) {
        return new DiskConfig(name, sizeGb, format, cache, bootable, path, baseImage, readOnly);
    }

    @Nonnull
    public DiskConfig withPath(@Nullable String path) {
        return new DiskConfig(name, sizeGb, format, cache, bootable, path, baseImage, readOnly);
    }

    @Nonnull
    public DiskConfig withBaseImage(@Nullable String baseImage) {
        return new DiskConfig(name, sizeGb, format, cache, bootable, path, baseImage, readOnly);
    }

    @Nonnull
    public DiskConfig withReadOnly(boolean readOnly) {
        return new DiskConfig(name, sizeGb, format, cache, bootable, path, baseImage, readOnly);
    }
}
