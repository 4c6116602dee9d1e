package org.tanzu.openstackmcp.inventory;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Counts resources per value of one of their fields.
 */
@Component
public class StatusTabulator {

    /**
     * Builds a value-to-count breakdown. Resources whose field is null or empty are
     * counted under {@value ResourceNormalizer#UNKNOWN_STATUS}; the counts always sum
     * to the size of {@code resources}.
     *
     * @param resources the collection to tabulate
     * @param field accessor for the tabulated field, e.g. {@code ServerRecord::getStatus}
     * @return counts keyed by field value, in order of first appearance
     */
    public <T> Map<String, Integer> tabulate(Collection<? extends T> resources, Function<? super T, String> field) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        for (T resource : resources) {
            String value = field.apply(resource);
            String key = value == null || value.isEmpty() ? ResourceNormalizer.UNKNOWN_STATUS : value;
            breakdown.merge(key, 1, Integer::sum);
        }
        return breakdown;
    }
}
