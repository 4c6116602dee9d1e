package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Total, used and available amount of one resource with its utilization.
 *
 * {@code available} is {@code total - used} and goes negative on over-committed
 * hosts; {@code utilization_percent} may exceed 100 for the same reason.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CapacityMetric {

    private final long total;
    private final long used;
    private final long available;
    private final double utilizationPercent;

    private CapacityMetric(long total, long used) {
        this.total = total;
        this.used = used;
        this.available = total - used;
        this.utilizationPercent = percent(used, total);
    }

    public static CapacityMetric of(long total, long used) {
        return new CapacityMetric(total, used);
    }

    /**
     * {@code used / total * 100} rounded half-up to two decimals, or 0 when total is not positive.
     */
    public static double percent(long used, long total) {
        if (total <= 0) {
            return 0;
        }
        return BigDecimal.valueOf(used * 100.0 / total).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * True when {@code used / total} strictly exceeds {@code threshold}; never true for an empty pool.
     */
    public boolean exceeds(double threshold) {
        return total > 0 && (double) used / total > threshold;
    }

    public long getTotal() { return total; }
    public long getUsed() { return used; }
    public long getAvailable() { return available; }
    public double getUtilizationPercent() { return utilizationPercent; }

    @Override
    public String toString() {
        return used + "/" + total + " (" + utilizationPercent + "%)";
    }
}
