/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator;

import java.io.IOException;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junitpioneer.jupiter.RestoreSystemProperties;
import org.junitpioneer.jupiter.SetSystemProperty;

import com.sun.net.httpserver.HttpServer;

import static org.assertj.core.api.Assertions.assertThat;

@RestoreSystemProperties
class OperatorMainHttpServerTest {

    // each test binds its own port, some platforms are slow to release them

    private HttpServer httpServer;

    @BeforeEach
    void setUp() {
        httpServer = null;
    }

    @AfterEach
    void tearDown() {
        if (httpServer != null) {
            httpServer.stop(0);
        }
    }

    private static OperatorConfig bindTo(String address) {
        return OperatorConfig.fromEnvironment(Map.of("BIND_ADDRESS", address));
    }

    @Test
    void shouldBindToConfiguredAddress() throws IOException {
        // When
        httpServer = OperatorMain.createHttpServer(bindTo("127.0.0.1:14561"));

        // Then
        assertThat(httpServer.getAddress().getAddress().getHostAddress()).isEqualTo("127.0.0.1");
        assertThat(httpServer.getAddress().getPort()).isEqualTo(14561);
    }

    @Test
    void shouldLimitRequestTime() throws IOException {
        // Given
        System.clearProperty("sun.net.httpserver.maxReqTime");

        // When
        httpServer = OperatorMain.createHttpServer(bindTo("127.0.0.1:14565"));

        // Then
        assertThat(System.getProperty("sun.net.httpserver.maxReqTime")).isEqualTo("60");
    }

    @Test
    void shouldLimitResponseTime() throws IOException {
        // Given
        System.clearProperty("sun.net.httpserver.maxRspTime");

        // When
        httpServer = OperatorMain.createHttpServer(bindTo("127.0.0.1:14576"));

        // Then
        assertThat(System.getProperty("sun.net.httpserver.maxRspTime")).isEqualTo("120");
    }

    @Test
    @SetSystemProperty(key = "sun.net.httpserver.maxReqTime", value = "12")
    void shouldRespectUserConfigurationForRequestTimeout() throws IOException {
        // When
        httpServer = OperatorMain.createHttpServer(bindTo("127.0.0.1:12565"));

        // Then
        assertThat(System.getProperty("sun.net.httpserver.maxReqTime")).isEqualTo("12");
    }

    @Test
    @SetSystemProperty(key = "sun.net.httpserver.maxRspTime", value = "24")
    void shouldRespectUserConfigurationForResponseTimeout() throws IOException {
        // When
        httpServer = OperatorMain.createHttpServer(bindTo("127.0.0.1:12576"));

        // Then
        assertThat(System.getProperty("sun.net.httpserver.maxRspTime")).isEqualTo("24");
    }
}
