package io.rollo.vmmanager.resource;

import java.io.IOException;

/**
 * Reports free space of the image storage.
 */
@FunctionalInterface
public interface StorageProbe {

    long freeBytes() throws IOException;
}
