package com.phillippitts.vani.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void usesRequestIdFromHeader() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("test-request-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/turns");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("test-request-123");
            assertThat(ThreadContext.get("method")).isEqualTo("POST");
            assertThat(ThreadContext.get("uri")).isEqualTo("/api/turns");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
    }

    @Test
    void generatesUuidIfRequestIdHeaderIsBlank() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("   ");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/turns");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId"))
                    .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/turns");
        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("uri")).isNull();
    }

    @Test
    void handlesNonHttpServletRequest() throws ServletException, IOException {
        ServletRequest nonHttpRequest = mock(ServletRequest.class);

        filter.doFilter(nonHttpRequest, response, chain);

        verify(chain).doFilter(nonHttpRequest, response);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }
}
