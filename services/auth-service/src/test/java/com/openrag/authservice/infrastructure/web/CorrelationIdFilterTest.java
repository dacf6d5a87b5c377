package com.openrag.authservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.openrag.observability.CorrelationContext;
import com.openrag.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates correlation ID when none provided")
    void generatesCorrelationIdWhenNoneProvided() throws Exception {
        var request = new MockHttpServletRequest();
        var response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(request, response, chain);

        assertThat(response.getHeader("X-Correlation-ID")).isNotBlank();
    }

    @Test
    @DisplayName("propagates existing correlation ID from header")
    void propagatesExistingCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "test-abc-123");
        var response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(request, response, chain);

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("binds the correlation ID to the holder and MDC while the chain runs")
    void setsCorrelationContextDuringFilterChain() throws Exception {
        var capturedId = new AtomicReference<String>();
        var capturedMdc = new AtomicReference<String>();
        FilterChain capturingChain = (req, resp) -> {
            capturedId.set(CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null));
            capturedMdc.set(MDC.get(CorrelationContext.MDC_CORRELATION_ID));
        };

        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain-123");

        filter.doFilter(request, new MockHttpServletResponse(), capturingChain);

        assertThat(capturedId.get()).isEqualTo("during-chain-123");
        assertThat(capturedMdc.get()).isEqualTo("during-chain-123");
    }

    @Test
    @DisplayName("clears CorrelationContextHolder after request completes")
    void clearsCorrelationContextAfterRequest() throws Exception {
        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
