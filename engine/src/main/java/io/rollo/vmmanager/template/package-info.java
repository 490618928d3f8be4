/**
 * Domain definition generation and parsing.
 *
 * <p>{@link io.rollo.vmmanager.template.DomainTemplateGenerator} writes new
 * definitions; {@link io.rollo.vmmanager.template.DomainManifest} reads live
 * ones back and derives clone and resize definitions from them.</p>
 */
package io.rollo.vmmanager.template;
