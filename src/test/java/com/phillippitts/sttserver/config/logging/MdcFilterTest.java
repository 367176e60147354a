package com.phillippitts.sttserver.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;
    private final Map<String, String> seenByChain = new HashMap<>();

    @BeforeEach
    void setUp() throws ServletException, IOException {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/transcribe");
        doAnswer(invocation -> {
            seenByChain.putAll(ThreadContext.getContext());
            return null;
        }).when(chain).doFilter(any(), any());
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void propagatesRequestIdHeaderAndEchoesIt() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-123");

        filter.doFilter(request, response, chain);

        assertThat(seenByChain).containsEntry("requestId", "req-123");
        verify(response).setHeader(MdcFilter.REQUEST_ID_HEADER, "req-123");
    }

    @Test
    void generatesUuidIfNoRequestIdHeader() throws ServletException, IOException {
        filter.doFilter(request, response, chain);

        assertThat(seenByChain.get("requestId")).matches(UUID_PATTERN);
        ArgumentCaptor<String> echoed = ArgumentCaptor.forClass(String.class);
        verify(response).setHeader(eq(MdcFilter.REQUEST_ID_HEADER), echoed.capture());
        assertThat(echoed.getValue()).isEqualTo(seenByChain.get("requestId"));
    }

    @Test
    void generatesUuidIfRequestIdHeaderIsBlank() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("   ");

        filter.doFilter(request, response, chain);

        assertThat(seenByChain.get("requestId")).matches(UUID_PATTERN);
    }

    @Test
    void setsUserIdMethodAndUri() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-xyz");
        when(request.getHeader(MdcFilter.USER_ID_HEADER)).thenReturn("user-abc");

        filter.doFilter(request, response, chain);

        assertThat(seenByChain)
                .containsEntry("requestId", "req-xyz")
                .containsEntry("userId", "user-abc")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/transcribe");
    }

    @Test
    void skipsBlankUserId() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.USER_ID_HEADER)).thenReturn("  ");

        filter.doFilter(request, response, chain);

        assertThat(seenByChain).doesNotContainKey("userId");
    }

    @Test
    void clearsContextAfterRequest() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.USER_ID_HEADER)).thenReturn("user-456");

        filter.doFilter(request, response, chain);

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void passesNonHttpRequestsThrough() throws ServletException, IOException {
        ServletRequest nonHttpRequest = mock(ServletRequest.class);

        filter.doFilter(nonHttpRequest, response, chain);

        verify(chain).doFilter(nonHttpRequest, response);
        assertThat(seenByChain).isEmpty();
    }

    @Test
    void preventsContextLeakageBetweenRequests() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-1");
        when(request.getHeader(MdcFilter.USER_ID_HEADER)).thenReturn("user-1");
        filter.doFilter(request, response, chain);
        seenByChain.clear();

        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-2");
        when(request.getHeader(MdcFilter.USER_ID_HEADER)).thenReturn(null);
        filter.doFilter(request, response, chain);

        assertThat(seenByChain).containsEntry("requestId", "req-2").doesNotContainKey("userId");
    }
}
