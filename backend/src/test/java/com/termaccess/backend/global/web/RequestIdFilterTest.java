package com.termaccess.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    @DisplayName("a host supplied request id is echoed and visible in the MDC during the call")
    void propagatesHostRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/hooks/grants");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "host-req-1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seen.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
            }
        });

        assertThat(seen.get()).isEqualTo("host-req-1");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("host-req-1");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    @DisplayName("missing ids are generated and overlong ids are truncated")
    void resolvesRequestId() {
        assertThat(RequestIdFilter.resolveRequestId(null)).hasSize(36);
        assertThat(RequestIdFilter.resolveRequestId("  ")).hasSize(36);
        assertThat(RequestIdFilter.resolveRequestId("x".repeat(100))).hasSize(64);
    }
}
