package com.openrag.authservice;

import com.openrag.authservice.config.AuthProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * OpenRAG auth service: session tokens, OAuth login and data-source connections, the API key gate
 * for machine transports, and the OIDC discovery documents OpenSearch validates tokens against.
 */
@SpringBootApplication
@EnableConfigurationProperties(AuthProperties.class)
public class AuthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
