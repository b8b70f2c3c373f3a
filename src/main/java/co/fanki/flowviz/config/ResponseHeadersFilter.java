package co.fanki.flowviz.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Locks the viewer down to same-origin content and logs every request
 * with its duration.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ResponseHeadersFilter extends OncePerRequestFilter {

    private static final Logger LOG = LoggerFactory.getLogger(
            ResponseHeadersFilter.class);

    static final String CONTENT_SECURITY_POLICY =
            "default-src 'self'; script-src 'self'; style-src 'self';"
                    + " img-src 'self' data:;";

    @Override
    protected void doFilterInternal(final HttpServletRequest request,
            final HttpServletResponse response, final FilterChain chain)
            throws ServletException, IOException {

        response.setHeader("Content-Security-Policy",
                CONTENT_SECURITY_POLICY);
        response.setHeader("Cross-Origin-Opener-Policy", "same-origin");
        response.setHeader("Cross-Origin-Embedder-Policy", "require-corp");

        final long start = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            final double durationMs =
                    (System.nanoTime() - start) / 1_000_000d;
            LOG.info("Served {} {} ({} ms)", request.getRequestURI(),
                    response.getStatus(),
                    String.format("%.1f", durationMs));
        }
    }

}
