package org.tanzu.openstackmcp.openstack;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.openstackmcp.config.OpenStackConfig;
import org.tanzu.openstackmcp.config.WebClientConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the Keystone session and the service client against a WireMock cloud.
 */
class OpenStackClientTest {

    private static final String AUTH_PATH = "/identity/v3/auth/tokens";
    private static final String PROJECT_ID = "p-0001";
    private static final String SERVERS_PATH = "/compute/v2.1/" + PROJECT_ID + "/servers/detail";

    private WireMockServer cloud;
    private KeystoneSession session;
    private OpenStackClient client;

    @BeforeEach
    void setUp() {
        cloud = new WireMockServer(options().dynamicPort());
        cloud.start();

        OpenStackConfig config = new OpenStackConfig();
        config.setAuthUrl(cloud.baseUrl() + "/identity/v3/");
        config.setUsername("admin");
        config.setPassword("secret");
        config.setProjectName("demo");
        config.setInsecure(false);
        config.setRequestTimeout(Duration.ofSeconds(5));

        WebClient.Builder builder = new WebClientConfig().webClientBuilder(config);
        session = new KeystoneSession(config, builder, Clock.systemUTC());
        client = new OpenStackClient(session, builder);
    }

    @AfterEach
    void tearDown() {
        cloud.stop();
    }

    /** JSON written with single quotes, with {base} standing for the WireMock URL. */
    private String json(String text) {
        return text.replace('\'', '"').replace("{base}", cloud.baseUrl());
    }

    private String tokenBody() {
        return json("{'token': {'expires_at': '2099-01-01T00:00:00.000000Z', 'project': {'id': '" + PROJECT_ID + "'},"
            + " 'catalog': ["
            + "  {'type': 'compute', 'endpoints': ["
            + "    {'interface': 'admin', 'region_id': 'RegionOne', 'url': 'http://admin.invalid/compute'},"
            + "    {'interface': 'public', 'region_id': 'RegionTwo', 'url': 'http://other-region.invalid/compute'},"
            + "    {'interface': 'public', 'region_id': 'RegionOne', 'url': '{base}/compute/v2.1/" + PROJECT_ID + "/'}]},"
            + "  {'type': 'volumev3', 'endpoints': ["
            + "    {'interface': 'public', 'region_id': 'RegionOne', 'url': '{base}/volume/v3/" + PROJECT_ID + "'}]}"
            + "]}}");
    }

    private void stubToken(String token) {
        cloud.stubFor(post(urlEqualTo(AUTH_PATH))
            .willReturn(aResponse().withStatus(201)
                .withHeader("Content-Type", "application/json")
                .withHeader("X-Subject-Token", token)
                .withBody(tokenBody())));
    }

    @Nested
    @DisplayName("Keystone session")
    class Session {

        @Test
        @DisplayName("Should authenticate with the password method scoped to the project")
        void shouldAuthenticate() {
            stubToken("tok-1");

            assertThat(session.token()).isEqualTo("tok-1");
            assertThat(session.projectId()).isEqualTo(PROJECT_ID);
            cloud.verify(postRequestedFor(urlEqualTo(AUTH_PATH))
                .withRequestBody(matchingJsonPath("$.auth.identity.methods[0]", equalTo("password")))
                .withRequestBody(matchingJsonPath("$.auth.identity.password.user.name", equalTo("admin")))
                .withRequestBody(matchingJsonPath("$.auth.identity.password.user.domain.name", equalTo("Default")))
                .withRequestBody(matchingJsonPath("$.auth.scope.project.name", equalTo("demo"))));
        }

        @Test
        @DisplayName("Should pick the catalog endpoint matching interface and region")
        void shouldResolveCatalogEndpoints() {
            stubToken("tok-1");

            assertThat(session.endpoint(ServiceType.COMPUTE)).isEqualTo(cloud.baseUrl() + "/compute/v2.1/" + PROJECT_ID);
            assertThat(session.endpoint(ServiceType.BLOCK_STORAGE)).isEqualTo(cloud.baseUrl() + "/volume/v3/" + PROJECT_ID);
        }

        @Test
        @DisplayName("Should fall back to the auth host for services missing from the catalog")
        void shouldFallBackForMissingService() {
            stubToken("tok-1");

            assertThat(session.endpoint(ServiceType.NETWORK)).isEqualTo(cloud.baseUrl() + "/networking/v2.0");
        }

        @Test
        @DisplayName("Should reuse the token across requests")
        void shouldReuseToken() {
            stubToken("tok-1");
            cloud.stubFor(get(urlEqualTo(SERVERS_PATH)).willReturn(okJson("{\"servers\": []}")));

            client.list(ResourceKind.SERVERS);
            client.list(ResourceKind.SERVERS);

            cloud.verify(1, postRequestedFor(urlEqualTo(AUTH_PATH)));
        }

        @Test
        @DisplayName("Should authenticate once for callers that need a token at the same time")
        void shouldShareOneAuthenticationAcrossThreads() throws Exception {
            cloud.stubFor(post(urlEqualTo(AUTH_PATH))
                .willReturn(aResponse().withStatus(201)
                    .withHeader("Content-Type", "application/json")
                    .withHeader("X-Subject-Token", "tok-1")
                    .withBody(tokenBody())
                    .withFixedDelay(500)));
            ExecutorService callers = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<String>> tokens = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    tokens.add(callers.submit(() -> {
                        start.await();
                        return session.token();
                    }));
                }
                start.countDown();

                for (Future<String> token : tokens) {
                    assertThat(token.get(10, TimeUnit.SECONDS)).isEqualTo("tok-1");
                }
            } finally {
                callers.shutdownNow();
            }
            cloud.verify(1, postRequestedFor(urlEqualTo(AUTH_PATH)));
        }

        @Test
        @DisplayName("Should authenticate again after a failed attempt")
        void shouldRetryAuthenticationAfterFailure() {
            cloud.stubFor(post(urlEqualTo(AUTH_PATH)).inScenario("keystone").whenScenarioStateIs(STARTED)
                .willReturn(aResponse().withStatus(503))
                .willSetStateTo("recovered"));
            cloud.stubFor(post(urlEqualTo(AUTH_PATH)).inScenario("keystone").whenScenarioStateIs("recovered")
                .willReturn(aResponse().withStatus(201).withHeader("X-Subject-Token", "tok-2").withBody(tokenBody())));

            assertThatThrownBy(() -> session.token())
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("503");
            assertThat(session.token()).isEqualTo("tok-2");
        }

        @Test
        @DisplayName("Should report rejected credentials as an authentication failure")
        void shouldRejectBadCredentials() {
            cloud.stubFor(post(urlEqualTo(AUTH_PATH)).willReturn(aResponse().withStatus(401)));

            assertThatThrownBy(() -> client.list(ResourceKind.SERVERS))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("401");
        }

        @Test
        @DisplayName("Should treat a token response without the token header as malformed")
        void shouldRejectMissingTokenHeader() {
            cloud.stubFor(post(urlEqualTo(AUTH_PATH)).willReturn(aResponse().withStatus(201).withBody(tokenBody())));

            assertThatThrownBy(() -> session.token()).isInstanceOf(MalformedResponseException.class);
        }
    }

    @Nested
    @DisplayName("Service requests")
    class Requests {

        @Test
        @DisplayName("Should list a collection with the session token")
        void shouldListServers() {
            stubToken("tok-1");
            cloud.stubFor(get(urlEqualTo(SERVERS_PATH))
                .willReturn(okJson(json("{'servers': [{'id': 's-1'}, {'id': 's-2'}]}"))));

            List<JsonNode> servers = client.list(ResourceKind.SERVERS);

            assertThat(servers).extracting(node -> node.path("id").asText()).containsExactly("s-1", "s-2");
            cloud.verify(getRequestedFor(urlEqualTo(SERVERS_PATH)).withHeader("X-Auth-Token", equalTo("tok-1")));
        }

        @Test
        @DisplayName("Should re-authenticate once when a service rejects the token")
        void shouldRetryAfterUnauthorized() {
            cloud.stubFor(post(urlEqualTo(AUTH_PATH)).inScenario("token").whenScenarioStateIs(STARTED)
                .willReturn(aResponse().withStatus(201).withHeader("X-Subject-Token", "tok-1").withBody(tokenBody()))
                .willSetStateTo("renewed"));
            cloud.stubFor(post(urlEqualTo(AUTH_PATH)).inScenario("token").whenScenarioStateIs("renewed")
                .willReturn(aResponse().withStatus(201).withHeader("X-Subject-Token", "tok-2").withBody(tokenBody())));
            cloud.stubFor(get(urlEqualTo(SERVERS_PATH)).withHeader("X-Auth-Token", equalTo("tok-1"))
                .willReturn(aResponse().withStatus(401)));
            cloud.stubFor(get(urlEqualTo(SERVERS_PATH)).withHeader("X-Auth-Token", equalTo("tok-2"))
                .willReturn(okJson(json("{'servers': [{'id': 's-1'}]}"))));

            assertThat(client.list(ResourceKind.SERVERS)).hasSize(1);
            cloud.verify(2, postRequestedFor(urlEqualTo(AUTH_PATH)));
        }

        @Test
        @DisplayName("Should give up after a second rejection")
        void shouldFailAfterRepeatedUnauthorized() {
            stubToken("tok-1");
            cloud.stubFor(get(urlEqualTo(SERVERS_PATH)).willReturn(aResponse().withStatus(401)));

            assertThatThrownBy(() -> client.list(ResourceKind.SERVERS))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("nova");
            cloud.verify(2, getRequestedFor(urlEqualTo(SERVERS_PATH)));
        }

        @Test
        @DisplayName("Should return empty for a resource that does not exist")
        void shouldReturnEmptyOnNotFound() {
            stubToken("tok-1");
            cloud.stubFor(get(urlEqualTo("/compute/v2.1/" + PROJECT_ID + "/servers/missing"))
                .willReturn(aResponse().withStatus(404)));

            assertThat(client.get(ResourceKind.SERVERS, "missing")).isEmpty();
        }

        @Test
        @DisplayName("Should return the detail object of an existing resource")
        void shouldGetFlavor() {
            stubToken("tok-1");
            cloud.stubFor(get(urlEqualTo("/compute/v2.1/" + PROJECT_ID + "/flavors/f-1"))
                .willReturn(okJson(json("{'flavor': {'id': 'f-1', 'name': 'm1.small'}}"))));

            Optional<JsonNode> flavor = client.get(ResourceKind.FLAVORS, "f-1");

            assertThat(flavor).hasValueSatisfying(node -> assertThat(node.path("name").asText()).isEqualTo("m1.small"));
        }

        @Test
        @DisplayName("Should report a server error as a transport failure")
        void shouldReportServerError() {
            stubToken("tok-1");
            cloud.stubFor(get(urlEqualTo("/volume/v3/" + PROJECT_ID + "/volumes/detail"))
                .willReturn(aResponse().withStatus(503)));

            assertThatThrownBy(() -> client.list(ResourceKind.VOLUMES))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("cinder returned 503");
        }

        @Test
        @DisplayName("Should reject a listing without its collection key")
        void shouldRejectMissingCollection() {
            stubToken("tok-1");
            cloud.stubFor(get(urlEqualTo("/networking/v2.0/networks")).willReturn(okJson("{\"items\": []}")));

            assertThatThrownBy(() -> client.list(ResourceKind.NETWORKS))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("'networks'");
        }

        @Test
        @DisplayName("Should reject a body that is not JSON")
        void shouldRejectUnreadableBody() {
            stubToken("tok-1");
            cloud.stubFor(get(urlEqualTo(SERVERS_PATH)).willReturn(aResponse().withStatus(200).withBody("<html>")));

            assertThatThrownBy(() -> client.list(ResourceKind.SERVERS)).isInstanceOf(MalformedResponseException.class);
        }
    }
}
