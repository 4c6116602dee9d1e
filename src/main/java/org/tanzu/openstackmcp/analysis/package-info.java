/**
 * Decision logic over normalized inventory: capacity utilization, per-server health,
 * service health probing and recommendation rules.
 */
package org.tanzu.openstackmcp.analysis;
