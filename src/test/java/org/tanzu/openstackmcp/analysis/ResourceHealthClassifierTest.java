package org.tanzu.openstackmcp.analysis;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.tanzu.openstackmcp.inventory.ServerRecord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tanzu.openstackmcp.InventoryFixtures.server;

class ResourceHealthClassifierTest {

    private final ResourceHealthClassifier classifier = new ResourceHealthClassifier();

    @ParameterizedTest(name = "{0} with power state {1} is {2}")
    @CsvSource({
        "ACTIVE, 1, HEALTHY",
        "ACTIVE, 0, TRANSITIONING",
        "ACTIVE, , TRANSITIONING",
        "ERROR, 1, ERROR",
        "ERROR, , ERROR",
        "SHUTOFF, 4, STOPPED",
        "SUSPENDED, 7, STOPPED",
        "BUILD, 0, TRANSITIONING",
        "unknown, , TRANSITIONING"
    })
    void shouldClassifyServer(String status, Integer powerState, ResourceHealth expected) {
        ServerRecord record = server("s-1", "vm", status, null, powerState);

        assertThat(classifier.classify(record)).isEqualTo(expected);
    }
}
