package io.staking.core.rpc;

import io.staking.core.clock.ManualClock;
import io.staking.core.node.NodeConfig;
import io.staking.core.node.StakingNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

class RpcServerAuthTest {

    private RpcServer server;
    private StakingNode node;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (node != null) {
            node.close();
        }
    }

    @Test
    void statusEndpointRequiresAuthWhenConfigured() throws Exception {
        int port = freePort();
        node = StakingNode.inMemory(NodeConfig.defaultLocal(), new ManualClock(1_700_000_000L));
        node.start();

        server = new RpcServer(node, "127.0.0.1", port, "rpc-secret");
        server.start();

        HttpClient client = HttpClient.newHttpClient();
        URI uri = new URI("http://127.0.0.1:" + port + "/status");

        HttpResponse<String> unauthorized = client.send(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(401, unauthorized.statusCode());
        assertEquals("Bearer", unauthorized.headers().firstValue("WWW-Authenticate").orElse(null));

        HttpRequest wrongToken = HttpRequest.newBuilder(uri)
                .header("Authorization", "Bearer nope")
                .GET()
                .build();
        assertEquals(401, client.send(wrongToken, HttpResponse.BodyHandlers.ofString()).statusCode());

        HttpRequest authorizedRequest = HttpRequest.newBuilder(uri)
                .header("Authorization", "Bearer rpc-secret")
                .GET()
                .build();
        HttpResponse<String> authorized = client.send(authorizedRequest, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, authorized.statusCode());
        assertTrue(authorized.body().contains("\"operator\":\"operator\""));
        assertTrue(authorized.body().contains("\"time\":1700000000"));
    }

    @Test
    void apiKeyHeaderIsAccepted() throws Exception {
        int port = freePort();
        node = StakingNode.inMemory(NodeConfig.defaultLocal(), new ManualClock(1_700_000_000L));
        node.start();

        server = new RpcServer(node, "127.0.0.1", port, "rpc-secret");
        server.start();

        HttpRequest request = HttpRequest.newBuilder(new URI("http://127.0.0.1:" + port + "/pools"))
                .header("X-API-Key", "rpc-secret")
                .GET()
                .build();
        HttpResponse<String> response = HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, response.statusCode());
        assertEquals("{\"pools\":[]}", response.body());
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
