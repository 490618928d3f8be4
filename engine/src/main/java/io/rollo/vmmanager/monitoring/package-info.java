/**
 * Periodic metric collection, status change detection and host alerts.
 */
package io.rollo.vmmanager.monitoring;
