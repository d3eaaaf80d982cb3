package io.mockchain.core.api;

import io.mockchain.core.consensus.ConsensusSettings;
import io.mockchain.core.node.Node;
import io.mockchain.core.node.NodeConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerAuthTest {

    private ApiServer server;
    private Node node;

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
    void balanceEndpointRequiresAuth() throws Exception {
        int port = freePort();
        node = Node.inMemory(NodeConfig.builder()
                .consensus(ConsensusSettings.proofOfWork(1))
                .minerAddress("miner")
                .faucetAmount(1234)
                .build());
        node.requestFaucet("alice");
        node.tick().orElseThrow();

        server = new ApiServer(node, "127.0.0.1", port, "secret-token");
        server.start();

        HttpClient client = HttpClient.newHttpClient();

        URI uri = new URI("http://127.0.0.1:" + port + "/balance?address=alice");
        HttpResponse<String> unauthorized = client.send(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(401, unauthorized.statusCode());
        assertTrue(unauthorized.headers().firstValue("WWW-Authenticate").isPresent());

        HttpRequest wrongToken = HttpRequest.newBuilder(uri)
                .header("Authorization", "Bearer nope")
                .GET()
                .build();
        assertEquals(401, client.send(wrongToken, HttpResponse.BodyHandlers.ofString()).statusCode());

        HttpRequest authorizedRequest = HttpRequest.newBuilder(uri)
                .header("Authorization", "Bearer secret-token")
                .GET()
                .build();
        HttpResponse<String> authorized = client.send(authorizedRequest, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, authorized.statusCode());
        assertTrue(authorized.body().contains("\"balance\":1234"));

        HttpRequest apiKeyRequest = HttpRequest.newBuilder(uri)
                .header("X-API-Key", "secret-token")
                .GET()
                .build();
        assertEquals(200, client.send(apiKeyRequest, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
