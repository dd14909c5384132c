package com.di.etlcontrol.config;

import com.di.etlcontrol.monitor.EtlRun;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags the log lines of each HTTP request with the run and request it belongs to.
 * <p>
 * MDC keys:
 * <ul>
 *   <li>{@code requestId} – from the {@code X-Request-Id} header of a stage executor, else generated</li>
 *   <li>{@code requestPath} – request URI, read by GlobalExceptionHandler</li>
 *   <li>{@code etlId} – identifier of the current run</li>
 * </ul>
 * The request id is echoed in the response header. MDC is cleared in {@code finally}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class MdcRequestFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    static final String REQUEST_ID = "requestId";
    static final String REQUEST_PATH = "requestPath";
    static final String ETL_ID = "etlId";

    private static final Pattern SAFE_REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final EtlRun etlRun;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = requestIdOf(request);
        String path = request.getRequestURI();
        MDC.put(REQUEST_ID, requestId);
        MDC.put(REQUEST_PATH, path != null ? path : "");
        MDC.put(ETL_ID, etlRun.getEtlId());
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID);
            MDC.remove(REQUEST_PATH);
            MDC.remove(ETL_ID);
        }
    }

    // headers that would break the log line are replaced
    static String requestIdOf(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (header != null && SAFE_REQUEST_ID.matcher(header).matches()) {
            return header;
        }
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
