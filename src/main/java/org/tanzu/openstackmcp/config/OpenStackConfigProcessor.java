package org.tanzu.openstackmcp.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Fills in OpenStack credentials that Spring property binding left empty.
 *
 * The processor runs once after the context is initialized. Each credential is
 * only written while it is still missing or a "${...}" placeholder, so a value found
 * in an earlier source is never overridden by a later one.
 *
 * Configuration priority (highest to lowest):
 * 1. Spring properties and OPENSTACK_* environment variables (already bound)
 * 2. Classic OpenStack RC variables (OS_AUTH_URL, OS_USERNAME, ...)
 * 3. Cloud Foundry service binding (VCAP_SERVICES)
 * 4. JSON configuration file (openstack.config-file)
 */
@Component
public class OpenStackConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(OpenStackConfigProcessor.class);

    private final OpenStackConfig openStackConfig;
    private final Environment environment;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenStackConfigProcessor(OpenStackConfig openStackConfig, Environment environment) {
        this.openStackConfig = openStackConfig;
        this.environment = environment;
    }

    /**
     * Resolves missing OpenStack settings from the fallback sources in priority order.
     */
    @PostConstruct
    public void processConfiguration() {
        logger.info("Processing OpenStack configuration...");
        logger.info("Current config - Auth URL: '{}', Username: '{}', Project: '{}', Password: '{}'",
                   openStackConfig.getAuthUrl(),
                   openStackConfig.getUsername(),
                   openStackConfig.getProjectName(),
                   openStackConfig.getPassword() != null ? "***" : "null");

        if (isConfigurationComplete()) {
            logger.info("OpenStack configuration is complete from application properties");
            return;
        }

        applyRcEnvironment();
        if (isConfigurationComplete()) {
            logger.info("OpenStack configuration completed from OS_* environment variables");
            return;
        }

        applyVcapServices();
        if (isConfigurationComplete()) {
            logger.info("OpenStack configuration completed from VCAP_SERVICES");
            return;
        }

        applyConfigFile();
        if (isConfigurationComplete()) {
            logger.info("OpenStack configuration completed from {}", openStackConfig.getConfigFile());
        } else {
            logger.warn("OpenStack configuration is incomplete; tool calls will fail to authenticate");
        }
    }

    /**
     * A configuration is complete when auth URL, username, password and project
     * are all present and none of them is an unresolved placeholder.
     */
    boolean isConfigurationComplete() {
        boolean authUrlValid = isPresent(openStackConfig.getAuthUrl());
        boolean usernameValid = isPresent(openStackConfig.getUsername());
        boolean passwordValid = isPresent(openStackConfig.getPassword());
        boolean projectValid = isPresent(openStackConfig.getProjectName());

        logger.debug("Configuration validation - Auth URL valid: {}, Username valid: {}, Password valid: {}, Project valid: {}",
                    authUrlValid, usernameValid, passwordValid, projectValid);

        return authUrlValid && usernameValid && passwordValid && projectValid;
    }

    private void applyRcEnvironment() {
        if (!isPresent(environment.getProperty("OS_AUTH_URL"))) {
            logger.debug("OS_AUTH_URL not set, skipping OpenStack RC variables");
            return;
        }
        logger.info("Using OS_* environment variables for OpenStack configuration");
        fill(openStackConfig::getAuthUrl, openStackConfig::setAuthUrl, environment.getProperty("OS_AUTH_URL"), "auth URL");
        fill(openStackConfig::getUsername, openStackConfig::setUsername, environment.getProperty("OS_USERNAME"), "username");
        fill(openStackConfig::getPassword, openStackConfig::setPassword, environment.getProperty("OS_PASSWORD"), null);
        fill(openStackConfig::getProjectName, openStackConfig::setProjectName, environment.getProperty("OS_PROJECT_NAME"), "project");
        overrideIfPresent(openStackConfig::setUserDomainName, environment.getProperty("OS_USER_DOMAIN_NAME"));
        overrideIfPresent(openStackConfig::setProjectDomainName, environment.getProperty("OS_PROJECT_DOMAIN_NAME"));
        overrideIfPresent(openStackConfig::setRegionName, environment.getProperty("OS_REGION_NAME"));
        overrideIfPresent(openStackConfig::setInterfaceType, environment.getProperty("OS_INTERFACE"));
    }

    private void applyVcapServices() {
        String vcapServices = environment.getProperty("VCAP_SERVICES");
        logger.info("VCAP_SERVICES available: {}", isPresent(vcapServices));
        if (!isPresent(vcapServices)) {
            return;
        }

        try {
            JsonNode credentials = findOpenStackCredentials(objectMapper.readTree(vcapServices));
            if (credentials == null) {
                logger.warn("No OpenStack service found in VCAP_SERVICES");
                return;
            }
            fill(openStackConfig::getAuthUrl, openStackConfig::setAuthUrl, text(credentials, "auth_url"), "auth URL");
            fill(openStackConfig::getUsername, openStackConfig::setUsername, text(credentials, "username"), "username");
            fill(openStackConfig::getPassword, openStackConfig::setPassword, text(credentials, "password"), null);
            fill(openStackConfig::getProjectName, openStackConfig::setProjectName, text(credentials, "project_name"), "project");
            overrideIfPresent(openStackConfig::setUserDomainName, text(credentials, "user_domain_name"));
            overrideIfPresent(openStackConfig::setProjectDomainName, text(credentials, "project_domain_name"));
            overrideIfPresent(openStackConfig::setRegionName, text(credentials, "region_name"));
            if (credentials.has("insecure")) {
                boolean insecure = credentials.path("insecure").asBoolean(true);
                openStackConfig.setInsecure(insecure);
                logger.info("Set insecure from VCAP: {}", insecure);
            }
        } catch (IOException e) {
            logger.error("Error processing VCAP_SERVICES: {}", e.getMessage(), e);
        }
    }

    /**
     * Reads the flat JSON file format (AUTH_URL, USERNAME, PASSWORD, PROJECT, DOMAIN, REGION).
     */
    private void applyConfigFile() {
        String configFile = openStackConfig.getConfigFile();
        if (!isPresent(configFile)) {
            return;
        }
        Path path = Path.of(configFile);
        if (!Files.isReadable(path)) {
            logger.debug("OpenStack config file {} not found", path.toAbsolutePath());
            return;
        }

        logger.info("Loading OpenStack config from: {}", path.toAbsolutePath());
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            fill(openStackConfig::getAuthUrl, openStackConfig::setAuthUrl, text(root, "AUTH_URL"), "auth URL");
            fill(openStackConfig::getUsername, openStackConfig::setUsername, text(root, "USERNAME"), "username");
            fill(openStackConfig::getPassword, openStackConfig::setPassword, text(root, "PASSWORD"), null);
            fill(openStackConfig::getProjectName, openStackConfig::setProjectName, text(root, "PROJECT"), "project");
            String domain = text(root, "DOMAIN");
            overrideIfPresent(openStackConfig::setUserDomainName, domain);
            overrideIfPresent(openStackConfig::setProjectDomainName, domain);
            overrideIfPresent(openStackConfig::setRegionName, text(root, "REGION"));
        } catch (IOException e) {
            logger.error("Error reading OpenStack config file {}: {}", path, e.getMessage(), e);
        }
    }

    /**
     * Finds the credentials of the first bound service whose name contains "openstack".
     */
    private JsonNode findOpenStackCredentials(JsonNode vcapServicesNode) {
        for (JsonNode serviceNode : vcapServicesNode) {
            for (JsonNode service : serviceNode) {
                String serviceName = service.path("name").asText();
                logger.debug("Found service: {}", serviceName);
                if (serviceName.toLowerCase().contains("openstack")) {
                    logger.info("Found OpenStack service: {}", serviceName);
                    return service.path("credentials");
                }
            }
        }
        return null;
    }

    /**
     * Writes {@code value} only when the current value is missing or a placeholder.
     * A null label keeps the value out of the log.
     */
    private void fill(Supplier<String> current, Consumer<String> setter, String value, String label) {
        if (isPresent(current.get()) || !isPresent(value)) {
            return;
        }
        setter.accept(value);
        if (label != null) {
            logger.info("Set {}: {}", label, value);
        } else {
            logger.info("Set password: ***");
        }
    }

    private void overrideIfPresent(Consumer<String> setter, String value) {
        if (isPresent(value)) {
            setter.accept(value);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.trim().isEmpty() && !value.contains("${");
    }
}
