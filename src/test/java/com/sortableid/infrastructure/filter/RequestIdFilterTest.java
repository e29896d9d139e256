package com.sortableid.infrastructure.filter;

import com.sortableid.infrastructure.context.RequestContext;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void shouldPropagateIncomingRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/ids");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> {
            seen.set(RequestContext.getRequestId());
            seenInMdc.set(MDC.get("requestId"));
        });

        assertEquals("abc-123", seen.get());
        assertEquals("abc-123", seenInMdc.get());
        assertEquals("abc-123", response.getHeader(RequestIdFilter.REQUEST_ID_HEADER));
    }

    @Test
    void shouldGenerateRequestIdWhenMissing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/generator");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        String requestId = response.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
        assertNotNull(requestId);
        assertDoesNotThrow(() -> UUID.fromString(requestId));
    }

    @Test
    void shouldReplaceOversizedRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/generator");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "x".repeat(RequestIdFilter.MAX_REQUEST_ID_LENGTH + 1));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertEquals(36, response.getHeader(RequestIdFilter.REQUEST_ID_HEADER).length());
    }

    @Test
    void shouldClearContextAfterRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/generator");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc-123");

        assertThrows(IllegalStateException.class, () -> filter.doFilter(request, new MockHttpServletResponse(),
            (req, res) -> { throw new IllegalStateException("downstream failure"); }));

        assertNull(RequestContext.getRequestId());
        assertNull(MDC.get("requestId"));
    }
}
