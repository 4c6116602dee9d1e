package org.tanzu.openstackmcp.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;

/**
 * Configuration class for the WebClient used to talk to Keystone, Nova, Cinder and Neutron.
 *
 * The builder carries the JSON headers, the per-request response timeout and the
 * SSL policy. When certificate validation is disabled the connector trusts every
 * certificate, which is common for lab clouds with self-signed endpoints.
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /** Service listings for large clouds exceed the 256 KB codec default */
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    /**
     * Creates and configures a WebClient.Builder for OpenStack API communication.
     *
     * @param openStackConfig The OpenStack configuration containing SSL and timeout settings
     * @return A configured WebClient.Builder
     * @throws IllegalStateException if the insecure SSL context cannot be built
     */
    @Bean
    public WebClient.Builder webClientBuilder(OpenStackConfig openStackConfig) {
        logger.info("Configuring WebClient.Builder for OpenStack: {} (insecure={}, requestTimeout={})",
                   openStackConfig.getAuthUrl(), openStackConfig.isInsecure(), openStackConfig.getRequestTimeout());

        HttpClient httpClient = HttpClient.create()
            .responseTimeout(openStackConfig.getRequestTimeout())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) openStackConfig.getRequestTimeout().toMillis());

        if (openStackConfig.isInsecure()) {
            try {
                logger.warn("SSL validation is DISABLED for OpenStack connections (insecure=true). This is not recommended for production!");

                SslContext sslContext = SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
                httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));

                logger.debug("Created HttpClient with insecure SSL context");
            } catch (SSLException e) {
                logger.error("Failed to configure insecure SSL context: {}", e.getMessage(), e);
                throw new IllegalStateException("Failed to configure insecure SSL context", e);
            }
        } else {
            logger.info("Using default SSL validation for OpenStack connections");
        }

        return WebClient.builder()
            .defaultHeader("Content-Type", "application/json")
            .defaultHeader("Accept", "application/json")
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
