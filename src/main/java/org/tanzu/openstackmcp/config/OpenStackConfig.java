package org.tanzu.openstackmcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration class for OpenStack connection settings.
 *
 * This class uses Spring Boot's @ConfigurationProperties to bind the Keystone
 * credentials and the timeouts used by the inventory engine. Properties are bound
 * with the "openstack" prefix, so "openstack.auth-url", "openstack.username" and
 * so on map onto this class; OPENSTACK_AUTH_URL style environment variables work
 * through Spring's relaxed binding.
 *
 * Values that are still missing after binding are filled in at startup by
 * {@link OpenStackConfigProcessor} from the classic OS_* variables, Cloud Foundry
 * service bindings or a JSON configuration file.
 */
@Component
@ConfigurationProperties(prefix = "openstack")
public class OpenStackConfig {

    /** Keystone v3 endpoint, e.g. https://cloud.example.com/identity/v3 */
    private String authUrl;

    /** Username for password authentication */
    private String username;

    /** Password for password authentication */
    private String password;

    /** Project the token is scoped to */
    private String projectName;

    /** Domain of the user (default: Default) */
    private String userDomainName = "Default";

    /** Domain of the project (default: Default) */
    private String projectDomainName = "Default";

    /** Region used to pick endpoints from the service catalog (default: RegionOne) */
    private String regionName = "RegionOne";

    /** Catalog endpoint interface: public, internal or admin (default: public) */
    private String interfaceType = "public";

    /** Whether to skip SSL certificate validation (default: true for development) */
    private boolean insecure = true;

    /** Response timeout for a single HTTP request */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /** Upper bound for fetching one resource collection during report assembly */
    private Duration fetchTimeout = Duration.ofSeconds(30);

    /** Upper bound for one service health probe */
    private Duration probeTimeout = Duration.ofSeconds(15);

    /** Upper bound for collecting a whole snapshot; finished sections are kept on expiry */
    private Duration reportDeadline = Duration.ofSeconds(60);

    /** JSON file consulted when neither properties nor environment provide credentials */
    private String configFile = "config/openstack_config.json";

    public String getAuthUrl() { return authUrl; }
    public void setAuthUrl(String authUrl) { this.authUrl = authUrl; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getProjectName() { return projectName; }
    public void setProjectName(String projectName) { this.projectName = projectName; }

    public String getUserDomainName() { return userDomainName; }
    public void setUserDomainName(String userDomainName) { this.userDomainName = userDomainName; }

    public String getProjectDomainName() { return projectDomainName; }
    public void setProjectDomainName(String projectDomainName) { this.projectDomainName = projectDomainName; }

    public String getRegionName() { return regionName; }
    public void setRegionName(String regionName) { this.regionName = regionName; }

    public String getInterfaceType() { return interfaceType; }
    public void setInterfaceType(String interfaceType) { this.interfaceType = interfaceType; }

    /**
     * Checks if SSL certificate validation should be skipped.
     * @return true if SSL validation is disabled, false otherwise
     */
    public boolean isInsecure() { return insecure; }
    public void setInsecure(boolean insecure) { this.insecure = insecure; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public Duration getFetchTimeout() { return fetchTimeout; }
    public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }

    public Duration getProbeTimeout() { return probeTimeout; }
    public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }

    public Duration getReportDeadline() { return reportDeadline; }
    public void setReportDeadline(Duration reportDeadline) { this.reportDeadline = reportDeadline; }

    public String getConfigFile() { return configFile; }
    public void setConfigFile(String configFile) { this.configFile = configFile; }

    /**
     * Returns a string representation of the configuration.
     *
     * The password is hidden so it never appears in logs or debug output.
     *
     * @return String representation with password hidden
     */
    @Override
    public String toString() {
        return "OpenStackConfig{" +
                "authUrl='" + authUrl + '\'' +
                ", username='" + username + '\'' +
                ", password='[HIDDEN]'" +
                ", projectName='" + projectName + '\'' +
                ", userDomainName='" + userDomainName + '\'' +
                ", projectDomainName='" + projectDomainName + '\'' +
                ", regionName='" + regionName + '\'' +
                ", interfaceType='" + interfaceType + '\'' +
                ", insecure=" + insecure +
                '}';
    }
}
