/**
 * Typed inventory records and their collection.
 *
 * <p>{@link org.tanzu.openstackmcp.inventory.ResourceNormalizer} turns raw service JSON into
 * records; {@link org.tanzu.openstackmcp.inventory.InventoryCollector} fetches collections
 * concurrently and reports per-collection failures as diagnostics.
 */
package org.tanzu.openstackmcp.inventory;
