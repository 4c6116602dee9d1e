package org.tanzu.openstackmcp.openstack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Client for the Nova, Cinder and Neutron REST APIs.
 *
 * Every request carries the token of the shared {@link KeystoneSession} in the
 * X-Auth-Token header. When a service answers 401 the token is invalidated and the
 * request is retried once with a fresh one; a second 401 is an
 * {@link AuthenticationException}. Other failures map onto the
 * {@link OpenStackException} hierarchy:
 * - 404 on a detail request: the resource does not exist (empty result)
 * - any other HTTP error, connection failure or timeout: {@link TransportException}
 * - a body that is not JSON or lacks the expected key: {@link MalformedResponseException}
 */
@Component
public class OpenStackClient implements CloudResourceClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenStackClient.class);

    private static final String AUTH_TOKEN_HEADER = "X-Auth-Token";

    private final KeystoneSession session;
    private final WebClient webClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenStackClient(KeystoneSession session, WebClient.Builder webClientBuilder) {
        this.session = session;
        this.webClient = webClientBuilder.build();
    }

    @Override
    public List<JsonNode> list(ResourceKind kind) {
        logger.debug("=== OPENSTACK LIST: {} ===", kind);
        JsonNode body = invoke(kind, kind.getListPath());
        JsonNode items = body.get(kind.getCollectionKey());
        if (items == null || !items.isArray()) {
            throw new MalformedResponseException(kind,
                "Response for " + kind + " has no '" + kind.getCollectionKey() + "' array");
        }
        List<JsonNode> result = new ArrayList<>(items.size());
        items.forEach(result::add);
        return result;
    }

    @Override
    public Optional<JsonNode> get(ResourceKind kind, String id) {
        logger.debug("=== OPENSTACK GET: {} {} ===", kind.getDetailKey(), id);
        String path = kind.detailPath(UriUtils.encodePathSegment(id, StandardCharsets.UTF_8));
        JsonNode body;
        try {
            body = invoke(kind, path);
        } catch (NotFoundException e) {
            return Optional.empty();
        }
        JsonNode item = body.get(kind.getDetailKey());
        if (item == null || !item.isObject()) {
            throw new MalformedResponseException(kind,
                "Response for " + kind.getDetailKey() + " " + id + " has no '" + kind.getDetailKey() + "' object");
        }
        return Optional.of(item);
    }

    private JsonNode invoke(ResourceKind kind, String path) {
        String token = session.token();
        try {
            return request(kind, path, token);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() != HttpStatus.UNAUTHORIZED.value()) {
                throw translate(kind, path, e);
            }
            logger.warn("Received 401 Unauthorized for {}, refreshing Keystone token and retrying once", path);
            session.invalidate(token);
        }

        try {
            return request(kind, path, session.token());
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
                throw new AuthenticationException("Token rejected by " + kind.getService().getServiceName()
                    + " after re-authentication", e);
            }
            throw translate(kind, path, e);
        }
    }

    private JsonNode request(ResourceKind kind, String path, String token) {
        String url = session.endpoint(kind.getService()) + path;
        String response;
        try {
            response = webClient.get()
                .uri(url)
                .header(AUTH_TOKEN_HEADER, token)
                .retrieve()
                .bodyToMono(String.class)
                .block();
        } catch (WebClientResponseException e) {
            throw e;
        } catch (WebClientException e) {
            logger.warn("Request to {} failed: {}", url, e.getMessage());
            throw new TransportException(kind, "Request for " + kind + " failed: " + e.getMessage(), e);
        }

        if (response == null || response.trim().isEmpty()) {
            throw new MalformedResponseException(kind, "Empty response from " + url);
        }
        try {
            return objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(kind, "Unreadable response from " + url + ": " + e.getOriginalMessage(), e);
        }
    }

    private OpenStackException translate(ResourceKind kind, String path, WebClientResponseException e) {
        int status = e.getStatusCode().value();
        if (status == HttpStatus.NOT_FOUND.value() && !path.equals(kind.getListPath())) {
            return new NotFoundException(kind, path.substring(path.lastIndexOf('/') + 1));
        }
        logger.warn("{} returned {} for {}", kind.getService().getServiceName(), status, path);
        return new TransportException(kind, kind.getService().getServiceName() + " returned " + status
            + " " + e.getStatusText() + " for " + kind);
    }
}
