package com.openrag.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge and
 * attaching the authenticated caller after the fact.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("returns empty when no context is set")
        void emptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("stores and clears context")
        void storesAndClears() {
            var ctx = CorrelationContext.of("corr-1");
            CorrelationContextHolder.set(ctx);
            assertThat(CorrelationContextHolder.get()).contains(ctx);

            CorrelationContextHolder.clear();
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("rejects null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("rejects blank correlation ID")
        void rejectsBlankCorrelationId() {
            assertThatThrownBy(() -> CorrelationContext.of(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("populates correlation ID and leaves user keys unset before authentication")
        void populatesCorrelationOnly() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("authMethod")).isNull();
        }

        @Test
        @DisplayName("attachUser adds user and auth method to MDC")
        void attachUser() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));

            CorrelationContextHolder.attachUser("user-7", "session");

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("userId")).isEqualTo("user-7");
            assertThat(MDC.get("authMethod")).isEqualTo("session");
            assertThat(CorrelationContextHolder.get().orElseThrow().userId()).isEqualTo("user-7");
        }

        @Test
        @DisplayName("attachUser without a context is a no-op")
        void attachUserWithoutContext() {
            CorrelationContextHolder.attachUser("user-7", "api_key");

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get("userId")).isNull();
        }

        @Test
        @DisplayName("clear removes every MDC key")
        void clearRemovesMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "user-1", "api_key"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("authMethod")).isNull();
        }
    }
}
