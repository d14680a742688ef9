package io.github.jakubt4.satti.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void requestsBeyondBudgetAreRejected() throws Exception {
        final var filter = new RateLimitFilter(2, objectMapper);

        assertThat(call(filter, "10.0.0.1").getStatus()).isEqualTo(200);
        assertThat(call(filter, "10.0.0.1").getStatus()).isEqualTo(200);
        final var rejected = call(filter, "10.0.0.1");

        assertThat(rejected.getStatus()).isEqualTo(429);
        assertThat(rejected.getContentAsString()).contains("Too Many Requests");
    }

    @Test
    void budgetIsPerClientAddress() throws Exception {
        final var filter = new RateLimitFilter(1, objectMapper);

        assertThat(call(filter, "10.0.0.1").getStatus()).isEqualTo(200);
        assertThat(call(filter, "10.0.0.2").getStatus()).isEqualTo(200);
        assertThat(call(filter, "10.0.0.1").getStatus()).isEqualTo(429);
    }

    @Test
    void nonPositiveLimitDisablesFilter() throws Exception {
        final var filter = new RateLimitFilter(0, objectMapper);

        for (var i = 0; i < 50; i++) {
            assertThat(call(filter, "10.0.0.1").getStatus()).isEqualTo(200);
        }
    }

    private static MockHttpServletResponse call(final RateLimitFilter filter, final String remoteAddr) throws Exception {
        final var request = new MockHttpServletRequest("GET", "/commands");
        request.setRemoteAddr(remoteAddr);
        final var response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }
}
