package com.agentgraph.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;

/**
 * Request/response logging for outbound HTTP calls made through Spring's
 * {@code RestClient} (tools and model providers). Credentials are masked.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClientCustomizer loggingRestClientCustomizer() {
        return restClientBuilder -> restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final Logger httpLogger = LoggerFactory.getLogger("com.agentgraph.http");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
                throws IOException {
            long started = System.currentTimeMillis();
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("--> {} {} headers={} ({} bytes)", request.getMethod(), request.getURI(),
                        masked(request.getHeaders()), body.length);
            }
            ClientHttpResponse response = execution.execute(request, body);
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("<-- {} {} {} in {} ms", response.getStatusCode().value(), request.getMethod(),
                        request.getURI(), System.currentTimeMillis() - started);
            }
            return response;
        }

        static HttpHeaders masked(HttpHeaders headers) {
            HttpHeaders copy = new HttpHeaders();
            headers.forEach((name, values) -> {
                if (HttpHeaders.AUTHORIZATION.equalsIgnoreCase(name)
                        || "x-api-key".equalsIgnoreCase(name)
                        || "x-goog-api-key".equalsIgnoreCase(name)) {
                    copy.add(name, "****");
                } else {
                    copy.addAll(name, values);
                }
            });
            return copy;
        }
    }
}
