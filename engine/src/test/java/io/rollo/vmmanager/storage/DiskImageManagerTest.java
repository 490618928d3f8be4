package io.rollo.vmmanager.storage;

import io.rollo.api.vmmanager.DiskConfig;
import io.rollo.vmmanager.config.VmManagerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiskImageManagerTest {

    @TempDir
    Path storage;

    @Mock
    private CommandRunner runner;

    private DiskImageManager images;

    @BeforeEach
    void setUp() {
        VmManagerConfig.StorageConfig config = new VmManagerConfig.StorageConfig();
        config.setImageDirectory(storage.toString());
        config.setQemuImgPath("/usr/bin/qemu-img");
        config.setImageTimeoutSeconds(30);
        images = new DiskImageManager(config, runner);
    }

    @Test
    void resolvesPathsInStorageDirectory() {
        assertThat(images.resolvePath("web", DiskConfig.boot("root", 10)))
                .isEqualTo(storage.resolve("web-root.qcow2"));
        assertThat(images.resolvePath("web", DiskConfig.of("data", 10).withFormat("raw")))
                .isEqualTo(storage.resolve("web-data.raw"));
        assertThat(images.resolvePath("web", DiskConfig.of("data", 10).withPath("/srv/data.img")))
                .isEqualTo(Path.of("/srv/data.img"));
        assertThat(images.clonePath("web-2", storage.resolve("web-root.qcow2")))
                .isEqualTo(storage.resolve("web-2-web-root.qcow2"));
    }

    @Test
    void createsImageWithQemuImg() throws Exception {
        when(runner.run(anyList(), any())).thenReturn(new CommandRunner.CommandResult(0, ""));
        Path target = storage.resolve("web-root.qcow2");

        images.createImage(target, DiskConfig.boot("root", 1.5));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(runner).run(command.capture(), eq(Duration.ofSeconds(30)));
        assertThat(command.getValue())
                .containsExactly("/usr/bin/qemu-img", "create", "-f", "qcow2", target.toString(), "1536M");
    }

    @Test
    void passesBackingImageWithItsFormat() throws Exception {
        when(runner.run(anyList(), any())).thenReturn(new CommandRunner.CommandResult(0, ""));
        Path target = storage.resolve("web-root.qcow2");

        images.createImage(target, DiskConfig.boot("root", 20).withBaseImage("/images/base/ubuntu.IMG"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(runner).run(command.capture(), any());
        assertThat(command.getValue()).containsSubsequence("-b", "/images/base/ubuntu.IMG", "-F", "raw");
    }

    @Test
    void refusesToOverwriteExistingImage() throws Exception {
        Path target = Files.createFile(storage.resolve("web-root.qcow2"));

        assertThatThrownBy(() -> images.createImage(target, DiskConfig.boot("root", 10)))
                .isInstanceOf(FileAlreadyExistsException.class);
        verify(runner, never()).run(anyList(), any());
    }

    @Test
    void failedQemuImgIsIoError() throws Exception {
        when(runner.run(anyList(), any()))
                .thenReturn(new CommandRunner.CommandResult(1, "qemu-img: Could not create: Permission denied\n"));

        assertThatThrownBy(() -> images.createImage(storage.resolve("x.qcow2"), DiskConfig.boot("root", 10)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("exit 1")
                .hasMessageEndingWith("Permission denied");
    }

    @Test
    void copiesImagesWithoutOverwriting() throws Exception {
        Path source = Files.writeString(storage.resolve("a.qcow2"), "image bytes");
        Path target = storage.resolve("b.qcow2");

        images.copyImage(source, target);

        assertThat(target).hasContent("image bytes");
        assertThatThrownBy(() -> images.copyImage(source, target)).isInstanceOf(FileAlreadyExistsException.class);
    }

    @Test
    void deleteTreatsMissingImageAsDeleted() throws Exception {
        Path image = Files.createFile(storage.resolve("a.qcow2"));

        images.deleteImage(image);
        images.deleteImage(image);

        assertThat(image).doesNotExist();
    }

    @Test
    void rollbackRemovesWhatItCanAndKeepsGoing() throws Exception {
        Path stuck = Files.createDirectories(storage.resolve("stuck.qcow2"));
        Files.createFile(stuck.resolve("child"));
        Path created = Files.createFile(storage.resolve("created.qcow2"));

        images.rollback(List.of(stuck, created));

        assertThat(stuck).exists();
        assertThat(created).doesNotExist();
    }

    @Test
    void initializeCreatesStorageDirectory() throws Exception {
        VmManagerConfig.StorageConfig config = new VmManagerConfig.StorageConfig();
        config.setImageDirectory(storage.resolve("nested/images").toString());
        DiskImageManager nested = new DiskImageManager(config, runner);

        nested.initialize();

        assertThat(nested.getStorageDirectory()).isDirectory();
        assertThat(nested.freeSpaceBytes()).isPositive();
    }
}
