/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.management;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

/**
 * Rejects requests whose method is not one of the allowed methods with
 * <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/405">405 Method Not Allowed</a>
 * and an {@code Allow} header listing the permitted methods.
 * Allowed requests continue down the filter chain.
 */
public class MethodNotAllowedFilter extends Filter {

    public static final MethodNotAllowedFilter GET_ONLY = new MethodNotAllowedFilter(Set.of("GET"));

    private final Set<String> allowedMethods;
    private final String allowHeader;

    MethodNotAllowedFilter(Set<String> allowedMethods) {
        if (allowedMethods.isEmpty()) {
            throw new IllegalArgumentException("At least one method must be allowed");
        }
        Set<String> normalised = new TreeSet<>();
        allowedMethods.forEach(m -> normalised.add(m.toUpperCase(Locale.ROOT)));
        this.allowedMethods = Set.copyOf(normalised);
        this.allowHeader = String.join(", ", normalised);
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        final String requestMethod = exchange.getRequestMethod();
        if (requestMethod != null && allowedMethods.contains(requestMethod.toUpperCase(Locale.ROOT))) {
            chain.doFilter(exchange);
        }
        else {
            try (exchange) {
                // the request body is deliberately left unread
                exchange.getResponseHeaders().add("Allow", allowHeader);
                exchange.sendResponseHeaders(405, -1);
            }
        }
    }

    @Override
    public String description() {
        return "Allows only " + allowHeader;
    }
}
