package com.phillippitts.speaktoavatar.config.logging;

import com.phillippitts.speaktoavatar.util.LogSanitizer;
import com.phillippitts.speaktoavatar.util.TimeUtils;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Tags every request's log lines with the ids the log pattern prints.
 *
 * <ul>
 *   <li>{@code requestId}: the {@code X-Request-ID} header, or a generated UUID; echoed back</li>
 *   <li>{@code roomId}: the live id of {@code DELETE /api/avatar/leave_room/{roomId}}</li>
 *   <li>{@code sessionId}: the stream id of {@code POST /api/query/cancel/{sessionId}}</li>
 * </ul>
 * Routes that carry their ids in the JSON body get {@code roomId}/{@code sessionId} from the
 * coordinator and the pipeline once the body is parsed.
 *
 * <p>The context is always cleared after the request. Streamed queries keep {@code requestId}
 * on the pipeline thread through the executor's task decorator.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    private static final Logger LOG = LogManager.getLogger(MdcFilter.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final int MAX_ID_LENGTH = 64;
    private static final PathMatcher PATHS = new AntPathMatcher();
    private static final List<String> ID_ROUTES = List.of(
            "/api/avatar/leave_room/{roomId}",
            "/api/query/cancel/{sessionId}");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        long start = System.nanoTime();
        try {
            String requestId = idOrGenerate(http.getHeader(REQUEST_ID_HEADER));
            ThreadContext.put("requestId", requestId);
            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
            }
            putPathIds(http.getRequestURI());
            chain.doFilter(request, response);
        } finally {
            if (LOG.isDebugEnabled() && response instanceof HttpServletResponse httpResponse) {
                LOG.debug("{} {} -> {} in {}ms", http.getMethod(), http.getRequestURI(),
                        httpResponse.getStatus(), TimeUtils.elapsedMillis(start));
            }
            ThreadContext.clearAll();
        }
    }

    static void putPathIds(String uri) {
        if (uri == null) {
            return;
        }
        for (String route : ID_ROUTES) {
            if (PATHS.match(route, uri)) {
                Map<String, String> ids = PATHS.extractUriTemplateVariables(route, uri);
                ids.forEach((key, value) -> ThreadContext.put(key, clean(value)));
                return;
            }
        }
    }

    private static String idOrGenerate(String header) {
        return (header == null || header.isBlank()) ? UUID.randomUUID().toString() : clean(header);
    }

    // ids end up verbatim in log lines
    private static String clean(String id) {
        return LogSanitizer.truncate(id.replaceAll("[\\p{Cntrl}\\s]", "_"), MAX_ID_LENGTH);
    }
}
