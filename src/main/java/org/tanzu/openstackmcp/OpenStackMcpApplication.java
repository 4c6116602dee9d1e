package org.tanzu.openstackmcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.tanzu.openstackmcp.openstack.OpenStackService;

import java.util.List;

/**
 * Main Spring Boot application class for the OpenStack MCP (Model Context Protocol) Server.
 *
 * The server connects to an OpenStack cloud through Keystone and exposes read-only
 * inventory, health and recommendation operations as tools for AI assistants and
 * other MCP clients.
 *
 * Key features:
 * - Lists compute, block storage and network resources in a normalized form
 * - Aggregates hypervisor capacity and flags over-utilized hosts
 * - Probes Nova, Cinder and Neutron independently and reports a combined verdict
 * - Generates inventory reports with prioritized recommendations
 * - Reads credentials from properties, OS_* variables, Cloud Foundry bindings or a JSON file
 */
@SpringBootApplication
@EnableConfigurationProperties
public class OpenStackMcpApplication {

    /**
     * Main application entry point.
     *
     * The MCP server identity is set as system properties before startup so that it is
     * always reported as "openstack-mcp" version "1.0.0", whatever the environment provides.
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        System.setProperty("spring.application.name", "openstack-mcp");
        System.setProperty("spring.ai.mcp.server.name", "openstack-mcp");
        System.setProperty("spring.ai.mcp.server.version", "1.0.0");

        SpringApplication.run(OpenStackMcpApplication.class, args);
    }

    /**
     * Registers the OpenStack tools with the MCP server.
     *
     * @param openStackService The service containing the OpenStack tools
     * @return List of ToolCallback objects representing the available MCP tools
     */
    @Bean
    public List<ToolCallback> registerTools(OpenStackService openStackService) {
        return List.of(ToolCallbacks.from(openStackService));
    }
}
