/**
 * Shared hypervisor connection and error translation.
 */
package io.rollo.vmmanager.connection;
