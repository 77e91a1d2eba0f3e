package io.paywire.x402.server;

import io.paywire.x402.error.ErrorKind;
import io.paywire.x402.util.Json;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Servlet adapter for a {@link ResourceServer}. The chain runs only after the
 * payment has been settled; the receipt header is set before the resource
 * writes its response.
 */
public class PaymentFilter implements Filter {
    private static final Logger log = LoggerFactory.getLogger(PaymentFilter.class);

    /** Request attribute holding the {@link ProcessResult} of a paid request. */
    public static final String ATTR_RESULT = "x402.payment.result";

    private final ResourceServer server;

    public PaymentFilter(ResourceServer server) {
        this.server = Objects.requireNonNull(server);
    }

    @Override
    public void doFilter(ServletRequest req, ServletResponse resp, FilterChain chain)
            throws IOException, ServletException {
        if (!(req instanceof HttpServletRequest) || !(resp instanceof HttpServletResponse)) {
            chain.doFilter(req, resp);
            return;
        }
        HttpServletRequest request = (HttpServletRequest) req;
        HttpServletResponse response = (HttpServletResponse) resp;

        ProcessResult result;
        try {
            result = server.processRequest(toContext(request));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("x402 payment processing interrupted URL: {}", request.getRequestURL());
            write(response, ProcessResult.paymentError(ErrorKind.FACILITATOR_UNREACHABLE,
                    "payment processing interrupted"));
            return;
        }

        if (result.type() == ProcessResult.Type.NO_PAYMENT_REQUIRED) {
            chain.doFilter(req, resp);
            return;
        }
        if (result.type() == ProcessResult.Type.PAID) {
            result.headers().forEach(response::setHeader);
            request.setAttribute(ATTR_RESULT, result);
            chain.doFilter(req, resp);
            return;
        }
        write(response, result);
    }

    private static HttpRequestContext toContext(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        Enumeration<String> names = request.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, request.getHeader(name));
        }
        String path = request.getRequestURI();
        String context = request.getContextPath();
        if (context != null && !context.isEmpty() && path.startsWith(context)) {
            path = path.substring(context.length());
        }
        StringBuffer url = request.getRequestURL();
        return new HttpRequestContext(request.getMethod(), path, url != null ? url.toString() : path, headers,
                request.getRemoteAddr(), request.getContentLengthLong());
    }

    private static void write(HttpServletResponse response, ProcessResult result) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.resetBuffer();
        response.setStatus(result.status());
        result.headers().forEach(response::setHeader);
        response.setContentType("application/json");
        response.getWriter().write(Json.MAPPER.writeValueAsString(result.body()));
        response.flushBuffer();
    }
}
