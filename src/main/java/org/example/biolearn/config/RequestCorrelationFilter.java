package org.example.biolearn.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Tags every request with an id, echoed in {@code X-Request-Id}, exposed to the error handler
 * as a request attribute and carried in the MDC for the content API's log lines.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = RequestCorrelation.fromHeaderOrNew(request.getHeader(RequestCorrelation.HEADER_NAME));
        request.setAttribute(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        response.setHeader(RequestCorrelation.HEADER_NAME, requestId);

        try (MDC.MDCCloseable ignored = MDC.putCloseable(RequestCorrelation.ATTRIBUTE_NAME, requestId)) {
            chain.doFilter(request, response);
        }
    }
}
