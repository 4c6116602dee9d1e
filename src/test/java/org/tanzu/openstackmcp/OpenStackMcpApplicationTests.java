package org.tanzu.openstackmcp;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;
import org.tanzu.openstackmcp.config.OpenStackConfig;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@TestPropertySource(properties = {
    "openstack.auth-url=https://test-openstack.example.com/identity/v3",
    "openstack.username=test-user",
    "openstack.password=test-password",
    "openstack.project-name=test-project",
    "openstack.insecure=true"
})
class OpenStackMcpApplicationTests {

    @Autowired
    private ApplicationContext applicationContext;

    @Autowired
    private OpenStackConfig openStackConfig;

    @Test
    void contextLoads() {
        assertThat(openStackConfig.getAuthUrl()).isEqualTo("https://test-openstack.example.com/identity/v3");
        assertThat(openStackConfig.getProbeTimeout()).hasSeconds(15);
    }

    @Test
    void registersEveryTool() {
        List<?> registerTools = applicationContext.getBean("registerTools", List.class);

        assertThat(registerTools)
            .hasOnlyElementsOfType(ToolCallback.class)
            .asInstanceOf(InstanceOfAssertFactories.list(ToolCallback.class))
            .extracting(callback -> callback.getToolDefinition().name())
            .containsExactlyInAnyOrder(
                "list_servers", "get_server_details", "list_hypervisors", "list_flavors", "get_flavor_details",
                "list_images", "get_image_details", "list_volumes", "list_volume_types", "list_networks",
                "list_subnets", "list_routers", "analyze_server_resources", "get_infrastructure_summary",
                "get_resource_utilization", "check_service_health", "generate_inventory_report");
    }
}
