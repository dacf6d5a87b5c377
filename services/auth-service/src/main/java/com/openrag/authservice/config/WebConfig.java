package com.openrag.authservice.config;

import com.openrag.authservice.infrastructure.web.RequestAuthGuard;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: the auth guard interceptor and CORS for the local front ends.
 *
 * <p>Session cookies are sent cross-origin during development, so credentials are allowed for the
 * listed origins only.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final RequestAuthGuard requestAuthGuard;

    public WebConfig(RequestAuthGuard requestAuthGuard) {
        this.requestAuthGuard = requestAuthGuard;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(requestAuthGuard);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/auth/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
