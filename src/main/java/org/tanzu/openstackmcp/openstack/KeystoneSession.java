package org.tanzu.openstackmcp.openstack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.tanzu.openstackmcp.config.OpenStackConfig;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Keystone v3 token and service catalog, shared by every request to the cloud.
 *
 * The session authenticates lazily with the password method and reuses the token
 * until it is close to expiry or a service rejects it. Concurrent callers that find
 * no usable token wait for a single authentication instead of each starting one.
 *
 * Endpoints come from the token's service catalog, filtered by interface and region.
 * A service missing from the catalog falls back to the devstack layout under the
 * auth URL's host, e.g. {@code https://cloud/compute/v2.1/{project_id}}.
 */
@Component
public class KeystoneSession {

    private static final Logger logger = LoggerFactory.getLogger(KeystoneSession.class);

    /** Tokens are renewed this long before Keystone would expire them */
    private static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private static final String SUBJECT_TOKEN_HEADER = "X-Subject-Token";

    private final OpenStackConfig openStackConfig;
    private final WebClient webClient;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Object authenticationLock = new Object();

    private volatile Token token;
    // guarded by authenticationLock
    private CompletableFuture<Token> pendingAuthentication;

    public KeystoneSession(OpenStackConfig openStackConfig, WebClient.Builder webClientBuilder, Clock clock) {
        this.openStackConfig = openStackConfig;
        this.webClient = webClientBuilder.build();
        this.clock = clock;
    }

    /**
     * Returns a valid token, authenticating first if there is none or it is about to expire.
     *
     * @throws AuthenticationException if Keystone rejects the credentials
     * @throws TransportException if Keystone cannot be reached
     * @throws MalformedResponseException if the token response lacks the token or project
     */
    public String token() {
        return current().value;
    }

    public String projectId() {
        return current().projectId;
    }

    /**
     * Base URL of a service, without a trailing slash.
     */
    public String endpoint(ServiceType service) {
        return current().endpoints.get(service);
    }

    /**
     * Drops the cached token so the next call authenticates again.
     */
    public void invalidate() {
        synchronized (authenticationLock) {
            token = null;
        }
        logger.info("Keystone token invalidated");
    }

    /**
     * Drops the cached token only if it is still the one a service rejected, so a
     * token another thread has just obtained survives.
     */
    public void invalidate(String rejectedToken) {
        synchronized (authenticationLock) {
            Token current = token;
            if (current != null && current.value.equals(rejectedToken)) {
                token = null;
                logger.info("Keystone token rejected by a service, invalidated");
            }
        }
    }

    /**
     * The first caller without a usable token authenticates; callers arriving meanwhile
     * wait on its future. The lock only guards the hand-off, never the Keystone call.
     */
    private Token current() {
        Token current = token;
        if (isUsable(current)) {
            return current;
        }
        CompletableFuture<Token> authentication;
        boolean authenticating = false;
        synchronized (authenticationLock) {
            current = token;
            if (isUsable(current)) {
                return current;
            }
            if (pendingAuthentication == null) {
                pendingAuthentication = new CompletableFuture<>();
                authenticating = true;
            }
            authentication = pendingAuthentication;
        }

        if (authenticating) {
            try {
                Token fresh = authenticate();
                synchronized (authenticationLock) {
                    token = fresh;
                }
                authentication.complete(fresh);
            } catch (RuntimeException | Error e) {
                authentication.completeExceptionally(e);
            } finally {
                synchronized (authenticationLock) {
                    pendingAuthentication = null;
                }
            }
        }
        return await(authentication);
    }

    private boolean isUsable(Token candidate) {
        return candidate != null && !candidate.expiresBefore(clock.instant().plus(EXPIRY_MARGIN));
    }

    private static Token await(CompletableFuture<Token> authentication) {
        try {
            return authentication.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private Token authenticate() {
        String authUrl = trimTrailingSlash(openStackConfig.getAuthUrl());
        if (authUrl == null || authUrl.isEmpty()) {
            throw new AuthenticationException("OpenStack auth URL is not configured");
        }
        logger.info("Authenticating with Keystone at {} as {} (project {})",
                   authUrl, openStackConfig.getUsername(), openStackConfig.getProjectName());

        ResponseEntity<String> response;
        try {
            response = webClient.post()
                .uri(authUrl + "/auth/tokens")
                .bodyValue(passwordAuthRequest())
                .retrieve()
                .toEntity(String.class)
                .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()
                    || e.getStatusCode().value() == HttpStatus.FORBIDDEN.value()) {
                throw new AuthenticationException("Authentication failed: " + e.getStatusCode().value()
                    + " " + e.getStatusText(), e);
            }
            throw new TransportException(null, "Keystone returned " + e.getStatusCode().value()
                + " " + e.getStatusText(), e);
        } catch (WebClientException e) {
            throw new TransportException(null, "Keystone request failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new MalformedResponseException(null, "Keystone returned no response");
        }
        String value = response.getHeaders().getFirst(SUBJECT_TOKEN_HEADER);
        if (value == null || value.isEmpty()) {
            throw new MalformedResponseException(null, "Keystone response has no " + SUBJECT_TOKEN_HEADER + " header");
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response.getBody() == null ? "" : response.getBody()).path("token");
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(null, "Unreadable Keystone token body: " + e.getOriginalMessage(), e);
        }
        String projectId = body.path("project").path("id").asText(null);
        if (projectId == null || projectId.isEmpty()) {
            throw new MalformedResponseException(null, "Keystone token is not scoped to a project");
        }

        Map<ServiceType, String> endpoints = new EnumMap<>(ServiceType.class);
        for (ServiceType service : ServiceType.values()) {
            endpoints.put(service, resolveEndpoint(service, body.path("catalog"), authUrl, projectId));
        }
        Instant expiresAt = parseExpiry(body.path("expires_at").asText(null));

        logger.info("Obtained Keystone token for project {} (expires {}); endpoints {}", projectId, expiresAt, endpoints);
        return new Token(value, projectId, expiresAt, endpoints);
    }

    private ObjectNode passwordAuthRequest() {
        ObjectNode request = objectMapper.createObjectNode();
        ObjectNode auth = request.putObject("auth");

        ObjectNode identity = auth.putObject("identity");
        identity.putArray("methods").add("password");
        ObjectNode user = identity.putObject("password").putObject("user");
        user.put("name", openStackConfig.getUsername());
        user.putObject("domain").put("name", openStackConfig.getUserDomainName());
        user.put("password", openStackConfig.getPassword());

        ObjectNode project = auth.putObject("scope").putObject("project");
        project.put("name", openStackConfig.getProjectName());
        project.putObject("domain").put("name", openStackConfig.getProjectDomainName());
        return request;
    }

    String resolveEndpoint(ServiceType service, JsonNode catalog, String authUrl, String projectId) {
        String url = findCatalogUrl(service, catalog);
        if (url != null) {
            url = trimTrailingSlash(url);
            if (service == ServiceType.NETWORK && !url.endsWith("/v2.0")) {
                url = url + "/v2.0";
            }
            return url;
        }

        URI auth = URI.create(authUrl);
        String fallback = auth.getScheme() + "://" + auth.getRawAuthority() + service.getFallbackPath();
        if (service.isProjectScoped()) {
            fallback = fallback + "/" + projectId;
        }
        logger.warn("No {} endpoint in the service catalog, using {}", service.getServiceName(), fallback);
        return fallback;
    }

    /**
     * Catalog types are tried in preference order; an endpoint must match the configured
     * interface and, when a region is configured, the region.
     */
    private String findCatalogUrl(ServiceType service, JsonNode catalog) {
        if (catalog == null || !catalog.isArray()) {
            return null;
        }
        String region = openStackConfig.getRegionName();
        for (String type : service.getCatalogTypes()) {
            for (JsonNode entry : catalog) {
                if (!type.equals(entry.path("type").asText())) {
                    continue;
                }
                for (JsonNode endpoint : entry.path("endpoints")) {
                    boolean interfaceMatches = openStackConfig.getInterfaceType().equals(endpoint.path("interface").asText());
                    boolean regionMatches = region == null || region.isEmpty()
                        || region.equals(endpoint.path("region_id").asText())
                        || region.equals(endpoint.path("region").asText());
                    String url = endpoint.path("url").asText(null);
                    if (interfaceMatches && regionMatches && url != null && !url.isEmpty()) {
                        return url;
                    }
                }
            }
        }
        return null;
    }

    private static Instant parseExpiry(String expiresAt) {
        if (expiresAt == null) {
            return null;
        }
        try {
            return Instant.parse(expiresAt);
        } catch (DateTimeParseException e) {
            logger.warn("Unparseable token expiry '{}'; the token is reused until rejected", expiresAt);
            return null;
        }
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static final class Token {
        private final String value;
        private final String projectId;
        private final Instant expiresAt;
        private final Map<ServiceType, String> endpoints;

        private Token(String value, String projectId, Instant expiresAt, Map<ServiceType, String> endpoints) {
            this.value = value;
            this.projectId = projectId;
            this.expiresAt = expiresAt;
            this.endpoints = Collections.unmodifiableMap(endpoints);
        }

        private boolean expiresBefore(Instant instant) {
            return expiresAt != null && expiresAt.isBefore(instant);
        }
    }
}
