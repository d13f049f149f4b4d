package com.phillippitts.speaktoavatar.config.logging;

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
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.matches;
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

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/connection_status");
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void usesAndEchoesIncomingRequestId() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-42");
        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("req-42");
            assertThat(ThreadContext.get("roomId")).isNull();
            assertThat(ThreadContext.get("sessionId")).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader("X-Request-ID", "req-42");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void generatesRequestIdWhenHeaderBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("  ");
        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).matches(UUID_PATTERN);
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader(eq("X-Request-ID"), matches(UUID_PATTERN));
    }

    @Test
    void leaveRouteTagsRoomId() throws ServletException, IOException {
        when(request.getMethod()).thenReturn("DELETE");
        when(request.getRequestURI()).thenReturn("/api/avatar/leave_room/room-7");
        doAnswer(invocation -> {
            assertThat(ThreadContext.get("roomId")).isEqualTo("room-7");
            assertThat(ThreadContext.get("sessionId")).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
    }

    @Test
    void cancelRouteTagsSessionId() throws ServletException, IOException {
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/query/cancel/s-99");
        doAnswer(invocation -> {
            assertThat(ThreadContext.get("sessionId")).isEqualTo("s-99");
            assertThat(ThreadContext.get("roomId")).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
    }

    @Test
    void idsAreCleanedBeforeTheyReachTheLog() throws ServletException, IOException {
        MdcFilter.putPathIds("/api/avatar/leave_room/" + "r".repeat(100));
        assertThat(ThreadContext.get("roomId")).hasSize(64);

        ThreadContext.clearAll();
        when(request.getHeader("X-Request-ID")).thenReturn("req\nforged line");
        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("req_forged_line");
            return null;
        }).when(chain).doFilter(any(), any());

        assertThatNoException().isThrownBy(() -> filter.doFilter(request, response, chain));
        verify(response).setHeader("X-Request-ID", "req_forged_line");
    }

    @Test
    void nestedPathsAreNotTreatedAsIds() {
        MdcFilter.putPathIds("/api/avatar/leave_room/room-1/extra");
        MdcFilter.putPathIds(null);

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void clearsContextWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-1");
        when(request.getRequestURI()).thenReturn("/api/query/cancel/s-1");
        doThrow(new ServletException("boom")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("boom");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void passesNonHttpRequestsThrough() throws ServletException, IOException {
        ServletRequest plain = mock(ServletRequest.class);

        filter.doFilter(plain, response, chain);

        verify(chain).doFilter(plain, response);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }
}
