package org.tanzu.openstackmcp.report;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullSource;

import static org.assertj.core.api.Assertions.assertThat;

class ReportFormatTest {

    @ParameterizedTest(name = "''{0}'' is {1}")
    @CsvSource({
        "detailed, DETAILED",
        "DETAILED, DETAILED",
        "' detailed ', DETAILED",
        "summary, SUMMARY",
        "full, SUMMARY",
        "'', SUMMARY"
    })
    void shouldParseFormat(String value, ReportFormat expected) {
        assertThat(ReportFormat.from(value)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullSource
    void shouldDefaultToDetailed(String value) {
        assertThat(ReportFormat.from(value)).isEqualTo(ReportFormat.DETAILED);
    }
}
