/**
 * OpenStack integration layer for the MCP server.
 *
 * <p>This package contains:
 * <ul>
 *   <li>{@link org.tanzu.openstackmcp.openstack.KeystoneSession} – Keystone v3 token and service catalog.</li>
 *   <li>{@link org.tanzu.openstackmcp.openstack.OpenStackClient} – REST client for Nova, Cinder and Neutron (token header, 401 retry, error mapping).</li>
 *   <li>{@link org.tanzu.openstackmcp.openstack.OpenStackService} – MCP tool implementations.</li>
 * </ul>
 *
 * <p>Failures surface as subclasses of {@link org.tanzu.openstackmcp.openstack.OpenStackException}.
 */
package org.tanzu.openstackmcp.openstack;
