package io.rollo.vmmanager.storage;

import io.rollo.api.vmmanager.DiskConfig;
import io.rollo.vmmanager.config.VmManagerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Creates, copies and removes VM disk images.
 *
 * <p>New images are created with {@code qemu-img create}; clones are plain
 * file copies. Images live in the configured storage directory unless a disk
 * names an explicit path.</p>
 */
public class DiskImageManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiskImageManager.class);

    private final Path storageDirectory;
    private final String qemuImgPath;
    private final Duration timeout;
    private final CommandRunner runner;

    public DiskImageManager(@Nonnull VmManagerConfig.StorageConfig config) {
        this(config, new ProcessCommandRunner());
    }

    /**
     * Create a disk image manager.
     *
     * @param config storage settings
     * @param runner runs {@code qemu-img}
     */
    public DiskImageManager(@Nonnull VmManagerConfig.StorageConfig config, @Nonnull CommandRunner runner) {
        Objects.requireNonNull(config, "config");
        this.storageDirectory = Paths.get(config.getImageDirectory());
        this.qemuImgPath = Objects.requireNonNull(config.getQemuImgPath(), "qemuImgPath");
        this.timeout = Duration.ofSeconds(config.getImageTimeoutSeconds());
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /**
     * Initialize the storage directory.
     *
     * @throws IOException if the directory cannot be created
     */
    public void initialize() throws IOException {
        Files.createDirectories(storageDirectory);
        LOGGER.info("Disk image storage at {}", storageDirectory);
    }

    @Nonnull
    public Path getStorageDirectory() {
        return storageDirectory;
    }

    /**
     * Image path for a disk of a new VM.
     *
     * @param vmName VM name
     * @param disk disk configuration
     * @return the explicit path, or {@code <storage>/<vm>-<disk>.<format>}
     */
    @Nonnull
    public Path resolvePath(@Nonnull String vmName, @Nonnull DiskConfig disk) {
        if (disk.path() != null) {
            return Paths.get(disk.path());
        }
        return storageDirectory.resolve(vmName + "-" + disk.name() + "." + disk.format());
    }

    /**
     * Image path for a cloned disk.
     *
     * @param cloneName name of the clone
     * @param source source image path
     * @return {@code <storage>/<clone>-<source file name>}
     */
    @Nonnull
    public Path clonePath(@Nonnull String cloneName, @Nonnull Path source) {
        return storageDirectory.resolve(cloneName + "-" + source.getFileName());
    }

    /**
     * Create a new image with {@code qemu-img}.
     *
     * @param path target image path, must not exist
     * @param disk disk configuration
     * @throws IOException if the image exists or qemu-img fails
     */
    public void createImage(@Nonnull Path path, @Nonnull DiskConfig disk) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(disk, "disk");
        if (Files.exists(path)) {
            throw new FileAlreadyExistsException(path.toString());
        }

        List<String> command = new ArrayList<>();
        command.add(qemuImgPath);
        command.add("create");
        command.add("-f");
        command.add(disk.format());
        if (disk.baseImage() != null) {
            command.add("-b");
            command.add(disk.baseImage());
            command.add("-F");
            command.add(baseFormat(disk.baseImage()));
        }
        command.add(path.toString());
        command.add(Math.round(disk.sizeGb() * 1024) + "M");

        LOGGER.info("Creating {} image {} ({} GB)", disk.format(), path, disk.sizeGb());
        CommandRunner.CommandResult result = runner.run(command, timeout);
        if (!result.isSuccess()) {
            throw new IOException("qemu-img create failed for " + path + " (exit " + result.exitCode() + "): "
                    + result.output().trim());
        }
    }

    private static String baseFormat(String baseImage) {
        String lower = baseImage.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".raw") || lower.endsWith(".img")) {
            return "raw";
        }
        if (lower.endsWith(".vmdk")) {
            return "vmdk";
        }
        return "qcow2";
    }

    /**
     * Copy an image. The target must not exist.
     *
     * @param source source image
     * @param target target image
     * @throws IOException if copying fails
     */
    public void copyImage(@Nonnull Path source, @Nonnull Path target) throws IOException {
        LOGGER.info("Copying image {} to {}", source, target);
        Files.copy(source, target);
    }

    /**
     * Delete an image. A missing file counts as deleted.
     *
     * @param path image path
     * @throws IOException if the file exists but cannot be removed
     */
    public void deleteImage(@Nonnull Path path) throws IOException {
        if (Files.deleteIfExists(path)) {
            LOGGER.info("Deleted image {}", path);
        } else {
            LOGGER.debug("Image {} already absent", path);
        }
    }

    /**
     * Delete images created by a failed operation, logging instead of throwing.
     *
     * @param paths images to remove
     */
    public void rollback(@Nonnull List<Path> paths) {
        for (Path path : paths) {
            try {
                deleteImage(path);
            } catch (IOException e) {
                LOGGER.error("Failed to roll back image {}: {}", path, e.getMessage());
            }
        }
    }

    /**
     * Usable free space of the storage directory's file store.
     *
     * @return free bytes
     * @throws IOException if the file store cannot be read
     */
    public long freeSpaceBytes() throws IOException {
        Path probe = Files.exists(storageDirectory) ? storageDirectory : storageDirectory.toAbsolutePath().getRoot();
        return Files.getFileStore(probe).getUsableSpace();
    }
}
