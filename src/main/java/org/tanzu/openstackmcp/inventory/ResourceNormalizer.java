package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Maps raw OpenStack JSON objects onto the typed inventory records.
 *
 * <p>Every method is total: a sparse or partially populated object yields a record
 * with the documented defaults, never an exception. Vendor-prefixed keys
 * ({@code OS-EXT-SRV-ATTR:host}, {@code os-flavor-access:is_public}, ...) are read
 * under their raw names and exposed under plain ones; keys not listed here are dropped.
 * A missing status becomes {@value #UNKNOWN_STATUS}. Nested mappings come out sorted by key,
 * so the result does not depend on the order of keys in the response.
 */
@Component
public class ResourceNormalizer {

    public static final String UNKNOWN_STATUS = "unknown";

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    public ServerRecord toServer(JsonNode node) {
        JsonNode raw = orEmpty(node);
        return new ServerRecord(
            text(raw, "id"),
            text(raw, "name"),
            textOr(raw, "status", UNKNOWN_STATUS),
            text(raw, "OS-EXT-SRV-ATTR:host"),
            text(raw, "created"),
            nestedId(raw, "flavor"),
            nestedId(raw, "image"),
            intOrNull(raw, "OS-EXT-STS:power_state"),
            text(raw, "OS-EXT-STS:task_state")
        );
    }

    public ServerDetails toServerDetails(JsonNode node) {
        JsonNode raw = orEmpty(node);
        JsonNode fault = raw.get("fault");
        return new ServerDetails(
            toServer(raw),
            text(raw, "updated"),
            fault != null && fault.isObject() ? text(fault, "message") : null,
            addresses(raw.get("addresses")),
            stringMap(raw.get("metadata"))
        );
    }

    public HypervisorRecord toHypervisor(JsonNode node) {
        JsonNode raw = orEmpty(node);
        JsonNode service = raw.get("service");
        return new HypervisorRecord(
            text(raw, "id"),
            text(raw, "hypervisor_hostname"),
            service != null && service.isObject() ? text(service, "host") : null,
            text(raw, "state"),
            textOr(raw, "status", UNKNOWN_STATUS),
            longOr(raw, "vcpus", 0),
            longOr(raw, "vcpus_used", 0),
            longOr(raw, "memory_mb", 0),
            longOr(raw, "memory_mb_used", 0),
            longOr(raw, "local_gb", 0),
            longOr(raw, "local_gb_used", 0),
            longOr(raw, "free_ram_mb", 0),
            longOr(raw, "free_disk_gb", 0),
            longOr(raw, "running_vms", 0),
            text(raw, "hypervisor_type"),
            longOrNull(raw, "hypervisor_version")
        );
    }

    /**
     * Older Nova releases report a flavor without swap as an empty string; that reads as 0.
     */
    public FlavorRecord toFlavor(JsonNode node) {
        JsonNode raw = orEmpty(node);
        return new FlavorRecord(
            text(raw, "id"),
            text(raw, "name"),
            longOr(raw, "vcpus", 0),
            longOr(raw, "ram", 0),
            longOr(raw, "disk", 0),
            longOr(raw, raw.has("OS-FLV-EXT-DATA:ephemeral") ? "OS-FLV-EXT-DATA:ephemeral" : "ephemeral", 0),
            longOr(raw, "swap", 0),
            bool(raw, raw.has("os-flavor-access:is_public") ? "os-flavor-access:is_public" : "is_public")
        );
    }

    public FlavorDetails toFlavorDetails(JsonNode node) {
        JsonNode raw = orEmpty(node);
        JsonNode extraSpecs = raw.has("OS-FLV-WITH-EXT-SPECS:extra_specs")
            ? raw.get("OS-FLV-WITH-EXT-SPECS:extra_specs")
            : raw.get("extra_specs");
        return new FlavorDetails(toFlavor(raw), stringMap(extraSpecs));
    }

    public ImageRecord toImage(JsonNode node) {
        JsonNode raw = orEmpty(node);
        return new ImageRecord(
            text(raw, "id"),
            text(raw, "name"),
            textOr(raw, "status", UNKNOWN_STATUS),
            text(raw, "created"),
            text(raw, "updated"),
            longOrNull(raw, raw.has("OS-EXT-IMG-SIZE:size") ? "OS-EXT-IMG-SIZE:size" : "size"),
            longOr(raw, "minDisk", 0),
            longOr(raw, "minRam", 0),
            intOrNull(raw, "progress")
        );
    }

    public ImageDetails toImageDetails(JsonNode node) {
        JsonNode raw = orEmpty(node);
        return new ImageDetails(toImage(raw), stringMap(raw.get("metadata")));
    }

    public VolumeRecord toVolume(JsonNode node) {
        JsonNode raw = orEmpty(node);
        return new VolumeRecord(
            text(raw, "id"),
            text(raw, "name"),
            textOr(raw, "status", UNKNOWN_STATUS),
            longOr(raw, "size", 0),
            text(raw, "volume_type"),
            text(raw, "created_at"),
            idList(raw.get("attachments"), "server_id"),
            text(raw, "availability_zone"),
            bool(raw, "bootable")
        );
    }

    public VolumeTypeRecord toVolumeType(JsonNode node) {
        JsonNode raw = orEmpty(node);
        return new VolumeTypeRecord(
            text(raw, "id"),
            text(raw, "name"),
            text(raw, "description"),
            bool(raw, raw.has("os-volume-type-access:is_public") ? "os-volume-type-access:is_public" : "is_public"),
            stringMap(raw.get("extra_specs"))
        );
    }

    public NetworkRecord toNetwork(JsonNode node) {
        JsonNode raw = orEmpty(node);
        return new NetworkRecord(
            text(raw, "id"),
            text(raw, "name"),
            textOr(raw, "status", UNKNOWN_STATUS),
            boolOrNull(raw, "admin_state_up"),
            bool(raw, "shared"),
            bool(raw, "router:external"),
            text(raw, "provider:network_type"),
            idList(raw.get("subnets"), "id")
        );
    }

    public SubnetRecord toSubnet(JsonNode node) {
        JsonNode raw = orEmpty(node);
        List<String> pools = new ArrayList<>();
        JsonNode rawPools = raw.get("allocation_pools");
        if (rawPools != null && rawPools.isArray()) {
            for (JsonNode pool : rawPools) {
                String start = text(pool, "start");
                String end = text(pool, "end");
                if (start != null || end != null) {
                    pools.add(start + "-" + end);
                }
            }
        }
        Long ipVersion = longOrNull(raw, "ip_version");
        return new SubnetRecord(
            text(raw, "id"),
            text(raw, "name"),
            text(raw, "network_id"),
            text(raw, "cidr"),
            ipVersion == null ? null : ipVersion.intValue(),
            text(raw, "gateway_ip"),
            bool(raw, "enable_dhcp"),
            Collections.unmodifiableList(pools)
        );
    }

    public RouterRecord toRouter(JsonNode node) {
        JsonNode raw = orEmpty(node);
        JsonNode gateway = raw.get("external_gateway_info");
        return new RouterRecord(
            text(raw, "id"),
            text(raw, "name"),
            textOr(raw, "status", UNKNOWN_STATUS),
            boolOrNull(raw, "admin_state_up"),
            gateway != null && gateway.isObject() ? text(gateway, "network_id") : null,
            boolOrNull(raw, "ha"),
            boolOrNull(raw, "distributed")
        );
    }

    private static JsonNode orEmpty(JsonNode node) {
        return node == null ? MissingNode.getInstance() : node;
    }

    private static String text(JsonNode raw, String field) {
        JsonNode value = raw.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static String textOr(JsonNode raw, String field, String fallback) {
        String value = text(raw, field);
        return value == null || value.isEmpty() ? fallback : value;
    }

    private static Long longOrNull(JsonNode raw, String field) {
        JsonNode value = raw.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.canConvertToLong() ? value.asLong() : null;
        }
        if (value.isTextual() && INTEGER.matcher(value.asText().trim()).matches()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                // wider than a long
                return null;
            }
        }
        return null;
    }

    private static long longOr(JsonNode raw, String field, long fallback) {
        Long value = longOrNull(raw, field);
        return value == null ? fallback : value;
    }

    private static Integer intOrNull(JsonNode raw, String field) {
        Long value = longOrNull(raw, field);
        return value == null || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE ? null : value.intValue();
    }

    /**
     * Truthiness as the services express it: JSON booleans, "true"/"True" strings, non-zero numbers.
     */
    private static boolean bool(JsonNode raw, String field) {
        Boolean value = boolOrNull(raw, field);
        return value != null && value;
    }

    private static Boolean boolOrNull(JsonNode raw, String field) {
        JsonNode value = raw.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.asLong() != 0;
        }
        if (value.isTextual()) {
            return "true".equalsIgnoreCase(value.asText().trim());
        }
        return Boolean.FALSE;
    }

    private static String nestedId(JsonNode raw, String field) {
        JsonNode reference = raw.get(field);
        return reference != null && reference.isObject() ? text(reference, "id") : null;
    }

    /**
     * Reads an array of ids, either plain strings or objects carrying the id under {@code key}.
     */
    private static List<String> idList(JsonNode array, String key) {
        if (array == null || !array.isArray()) {
            return Collections.emptyList();
        }
        List<String> ids = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            String id = element.isObject() ? text(element, key) : (element.isValueNode() ? element.asText() : null);
            if (id != null) {
                ids.add(id);
            }
        }
        return Collections.unmodifiableList(ids);
    }

    private static Map<String, String> stringMap(JsonNode object) {
        if (object == null || !object.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, String> values = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            values.put(field.getKey(), value.isValueNode() ? (value.isNull() ? null : value.asText()) : value.toString());
        }
        return Collections.unmodifiableMap(values);
    }

    private static Map<String, List<String>> addresses(JsonNode object) {
        if (object == null || !object.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, List<String>> addresses = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> networks = object.fields();
        while (networks.hasNext()) {
            Map.Entry<String, JsonNode> network = networks.next();
            addresses.put(network.getKey(), idList(network.getValue(), "addr"));
        }
        return Collections.unmodifiableMap(addresses);
    }
}
