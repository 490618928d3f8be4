/**
 * VM lifecycle state machine and per-VM operation locking.
 */
package io.rollo.vmmanager.lifecycle;
