package com.scanops.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer(ScanOpsProperties properties) {
        return restClientBuilder -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(properties.getBackend().getTimeout());
            requestFactory.setReadTimeout(properties.getBackend().getTimeout());
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            // Buffering lets the interceptor read the body before the caller does
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(requestFactory));
        };
    }

    private static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.scanops.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(request, response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            if (!httpLogger.isDebugEnabled()) {
                return;
            }
            httpLogger.debug("--> {} {}", request.getMethod(), request.getURI());
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        private void logResponse(HttpRequest request, ClientHttpResponse response) throws IOException {
            int status;
            try {
                status = response.getStatusCode().value();
            } catch (IOException e) {
                status = -1;
            }
            if (status >= 400) {
                httpLogger.warn("<-- {} {} {}", status, request.getMethod(), request.getURI());
            } else {
                httpLogger.debug("<-- {} {} {}", status, request.getMethod(), request.getURI());
            }
            if (httpLogger.isDebugEnabled()) {
                byte[] body = StreamUtils.copyToByteArray(response.getBody());
                if (body.length > 0) {
                    httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
                }
            }
        }
    }
}
