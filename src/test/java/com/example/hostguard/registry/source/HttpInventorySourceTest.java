package com.example.hostguard.registry.source;

import com.example.hostguard.registry.HostSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HttpInventorySourceTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private HttpInventorySource source(String token) {
        return new HttpInventorySource("cmdb", server.url("/hosts").toString(), token,
                Duration.ofSeconds(2), new OkHttpClient(), new ObjectMapper());
    }

    @Test
    void loadsHostListAndSendsBearerToken() throws InterruptedException {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("[{\"name\":\"vm-1\",\"private_ip\":\"10.8.0.1\",\"tags\":{\"env\":\"production\"}},"
                        + "{\"hostname\":\"vm-2\",\"ip\":\"10.8.0.2\"}]"));

        HttpInventorySource source = source("s3cret");
        List<RawHostRecord> records = source.parse();

        assertEquals(2, records.size());
        assertEquals("vm-1", records.get(0).getName());
        assertEquals("production", records.get(0).getEnvironment());
        assertEquals("10.8.0.2", records.get(1).getAddress());
        assertEquals(HostSource.CLOUD, source.type());
        assertEquals("cloud:cmdb", source.name());

        RecordedRequest request = server.takeRequest();
        assertEquals("/hosts", request.getPath());
        assertEquals("Bearer s3cret", request.getHeader("Authorization"));
    }

    @Test
    void omitsAuthorizationWithoutToken() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{\"hosts\": []}"));

        assertTrue(source("").parse().isEmpty());
        assertNull(server.takeRequest().getHeader("Authorization"));
    }

    @Test
    void nullFieldsInPayloadDoNotBecomeHostnames() {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"hosts\": [{\"hostname\": null, \"name\": \"vm-7\", \"ip\": null, \"address\": \"10.8.0.7\"},"
                        + "{\"hostname\": null, \"ip\": \"10.8.0.9\"}]}"));

        List<RawHostRecord> records = source(null).parse();

        assertEquals(1, records.size());
        assertEquals("vm-7", records.get(0).getName());
        assertEquals("10.8.0.7", records.get(0).getAddress());
    }

    @Test
    void serverErrorYieldsNothing() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));

        assertTrue(source(null).parse().isEmpty());
    }

    @Test
    void invalidJsonYieldsNothing() {
        server.enqueue(new MockResponse().setBody("<html>"));

        assertTrue(source(null).parse().isEmpty());
    }

    @Test
    void invalidEndpointYieldsNothing() {
        HttpInventorySource source = new HttpInventorySource("bad", "not a url", null,
                Duration.ofSeconds(1), new OkHttpClient(), new ObjectMapper());

        assertTrue(source.parse().isEmpty());
    }
}
