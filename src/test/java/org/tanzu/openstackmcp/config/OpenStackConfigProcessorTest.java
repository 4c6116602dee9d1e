package org.tanzu.openstackmcp.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class OpenStackConfigProcessorTest {

    private OpenStackConfig config;
    private MockEnvironment environment;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        config = new OpenStackConfig();
        config.setConfigFile(tempDir.resolve("missing.json").toString());
        environment = new MockEnvironment();
    }

    private void process() {
        new OpenStackConfigProcessor(config, environment).processConfiguration();
    }

    @Test
    @DisplayName("Should keep bound properties untouched")
    void shouldKeepBoundProperties() {
        config.setAuthUrl("https://bound.example.com/identity/v3");
        config.setUsername("bound-user");
        config.setPassword("bound-password");
        config.setProjectName("bound-project");
        environment.setProperty("OS_AUTH_URL", "https://rc.example.com/identity/v3");
        environment.setProperty("OS_USERNAME", "rc-user");

        process();

        assertThat(config.getAuthUrl()).isEqualTo("https://bound.example.com/identity/v3");
        assertThat(config.getUsername()).isEqualTo("bound-user");
    }

    @Test
    @DisplayName("Should fill missing settings from OS_* variables")
    void shouldUseRcVariables() {
        config.setUsername("bound-user");
        environment.setProperty("OS_AUTH_URL", "https://rc.example.com/identity/v3");
        environment.setProperty("OS_USERNAME", "rc-user");
        environment.setProperty("OS_PASSWORD", "rc-password");
        environment.setProperty("OS_PROJECT_NAME", "rc-project");
        environment.setProperty("OS_REGION_NAME", "RegionTwo");
        environment.setProperty("OS_INTERFACE", "internal");

        process();

        assertThat(config.getAuthUrl()).isEqualTo("https://rc.example.com/identity/v3");
        assertThat(config.getUsername()).isEqualTo("bound-user");
        assertThat(config.getPassword()).isEqualTo("rc-password");
        assertThat(config.getProjectName()).isEqualTo("rc-project");
        assertThat(config.getRegionName()).isEqualTo("RegionTwo");
        assertThat(config.getInterfaceType()).isEqualTo("internal");
    }

    @Test
    @DisplayName("Should replace unresolved placeholders from VCAP_SERVICES")
    void shouldUseVcapServices() {
        config.setAuthUrl("${OPENSTACK_AUTH_URL}");
        environment.setProperty("VCAP_SERVICES", ("{'user-provided': [{'name': 'my-openstack', 'credentials': {"
            + "'auth_url': 'https://vcap.example.com/identity/v3', 'username': 'vcap-user', 'password': 'vcap-password',"
            + "'project_name': 'vcap-project', 'user_domain_name': 'corp', 'insecure': false}}]}").replace('\'', '"'));

        process();

        assertThat(config.getAuthUrl()).isEqualTo("https://vcap.example.com/identity/v3");
        assertThat(config.getProjectName()).isEqualTo("vcap-project");
        assertThat(config.getUserDomainName()).isEqualTo("corp");
        assertThat(config.isInsecure()).isFalse();
    }

    @Test
    @DisplayName("Should fall back to the JSON config file")
    void shouldUseConfigFile() throws Exception {
        Path file = tempDir.resolve("openstack_config.json");
        Files.writeString(file, ("{'AUTH_URL': 'https://file.example.com/identity/v3', 'USERNAME': 'file-user',"
            + " 'PASSWORD': 'file-password', 'PROJECT': 'file-project', 'DOMAIN': 'lab', 'REGION': 'RegionThree'}")
            .replace('\'', '"'));
        config.setConfigFile(file.toString());

        process();

        assertThat(config.getAuthUrl()).isEqualTo("https://file.example.com/identity/v3");
        assertThat(config.getUsername()).isEqualTo("file-user");
        assertThat(config.getUserDomainName()).isEqualTo("lab");
        assertThat(config.getProjectDomainName()).isEqualTo("lab");
        assertThat(config.getRegionName()).isEqualTo("RegionThree");
    }

    @Test
    @DisplayName("Should leave the configuration incomplete when no source provides it")
    void shouldStayIncomplete() {
        OpenStackConfigProcessor processor = new OpenStackConfigProcessor(config, environment);

        processor.processConfiguration();

        assertThat(processor.isConfigurationComplete()).isFalse();
        assertThat(config.getAuthUrl()).isNull();
    }
}
