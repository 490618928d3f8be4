/**
 * Host capacity, allocation accounting and resource validation.
 */
package io.rollo.vmmanager.resource;
