/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.management;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MethodNotAllowedFilterTest {

    @Mock
    private HttpExchange httpExchange;

    @Mock
    private Headers responseHeaders;

    @Mock
    private Filter.Chain remainingFilterChain;

    @BeforeEach
    void setUp() {
        lenient().when(httpExchange.getRequestBody()).thenReturn(InputStream.nullInputStream());
    }

    @ParameterizedTest
    @CsvSource({ "GET", "get" })
    void shouldForwardGetRequestToFilterChain(String httpMethod) throws IOException {
        // Given
        when(httpExchange.getRequestMethod()).thenReturn(httpMethod);

        // When
        MethodNotAllowedFilter.GET_ONLY.doFilter(httpExchange, remainingFilterChain);

        // Then
        verify(remainingFilterChain).doFilter(httpExchange);
        verify(httpExchange, never()).sendResponseHeaders(anyInt(), anyLong());
    }

    @ParameterizedTest
    @CsvSource({ "TRACE", "OPTIONS", "HEAD", "POST", "PUT", "CONNECT", "PATCH", "DELETE" })
    void shouldRejectRequestWithHttpMethod(String httpMethod) throws IOException {
        // Given
        when(httpExchange.getRequestMethod()).thenReturn(httpMethod);
        when(httpExchange.getResponseHeaders()).thenReturn(responseHeaders);

        // When
        MethodNotAllowedFilter.GET_ONLY.doFilter(httpExchange, remainingFilterChain);

        // Then
        verify(httpExchange).sendResponseHeaders(405, -1);
        verify(responseHeaders).add("Allow", "GET");
        verify(httpExchange).close();
        verify(remainingFilterChain, never()).doFilter(any(HttpExchange.class));
    }

    @Test
    void shouldListEveryAllowedMethod() throws IOException {
        // Given
        MethodNotAllowedFilter filter = new MethodNotAllowedFilter(Set.of("get", "HEAD"));
        when(httpExchange.getRequestMethod()).thenReturn("POST");
        when(httpExchange.getResponseHeaders()).thenReturn(responseHeaders);

        // When
        filter.doFilter(httpExchange, remainingFilterChain);

        // Then
        verify(responseHeaders).add("Allow", "GET, HEAD");
        assertThat(filter.description()).isEqualTo("Allows only GET, HEAD");
    }

    @Test
    void shouldRequireAnAllowedMethod() {
        Set<String> none = Set.of();
        assertThatThrownBy(() -> new MethodNotAllowedFilter(none)).isInstanceOf(IllegalArgumentException.class);
    }
}
