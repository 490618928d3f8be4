/**
 * Disk image management.
 */
package io.rollo.vmmanager.storage;
