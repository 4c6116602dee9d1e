/**
 * Configuration for the OpenStack MCP server.
 *
 * <p>Provides Keystone credentials and timeouts ({@link org.tanzu.openstackmcp.config.OpenStackConfig}),
 * fallback credential resolution from OS_* variables, VCAP_SERVICES and a JSON file
 * ({@link org.tanzu.openstackmcp.config.OpenStackConfigProcessor}), WebClient setup with optional
 * insecure SSL ({@link org.tanzu.openstackmcp.config.WebClientConfig}) and the inventory worker pool
 * ({@link org.tanzu.openstackmcp.config.InventoryExecutorConfig}).
 */
package org.tanzu.openstackmcp.config;
