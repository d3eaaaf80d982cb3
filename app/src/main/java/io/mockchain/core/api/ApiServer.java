package io.mockchain.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.mockchain.core.ledger.Ledger;
import io.mockchain.core.metrics.BlockMetrics;
import io.mockchain.core.node.FaucetResult;
import io.mockchain.core.node.Node;
import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.Hashes;
import io.mockchain.core.protocol.Transaction;
import io.mockchain.core.protocol.TransactionRejectedException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP/JSON gateway onto a {@link Node}. Every handler is a thin translation of a request into
 * one node operation; all validation lives in the ledger.
 */
public final class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());
    private static final String ERROR_ATTRIBUTE = "mockchain.error";

    private final Node node;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(Node node, String bindAddress, int port, String authToken) {
        this.node = node;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("API server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/transactions", new SubmitHandler());
        server.createContext("/balance", new BalanceHandler());
        server.createContext("/faucet", new FaucetHandler());
        server.createContext("/chain", new ChainInfoHandler());
        server.createContext("/blocks", new BlockHandler());
        server.createContext("/metrics", new MetricsHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "API server listening on http://" + bindAddress + ':' + port + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /** Shared method check, auth, timing and error envelope. */
    private abstract class Endpoint implements HttpHandler {
        private final String allowedMethod;

        Endpoint(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        abstract int serve(HttpExchange exchange) throws IOException;

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = BlockMetrics.startRequest();
            int status = 500;
            try {
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = serve(exchange);
            } catch (Exception e) {
                LOG.log(Level.WARNING, path + " handler failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                BlockMetrics.recordRequest(sample, method, path, status, (String) exchange.getAttribute(ERROR_ATTRIBUTE));
                exchange.close();
            }
        }
    }

    final class SubmitHandler extends Endpoint {
        SubmitHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            TransactionRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), TransactionRequest.class);
            } catch (MismatchedInputException e) {
                if (isField(e, "amount")) {
                    return sendError(exchange, 400, TransactionRejectedException.Reason.INVALID_AMOUNT.code(), "amount must be a whole number");
                }
                return sendError(exchange, 400, "invalid_json", "Failed to parse transaction request");
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse transaction request");
            }
            if (req == null || req.from == null || req.from.isBlank() || req.to == null || req.to.isBlank()) {
                return sendError(exchange, 400, "missing_fields", "Fields 'from' and 'to' are required");
            }
            if (Transaction.FAUCET_ADDRESS.equals(req.from)) {
                return sendError(exchange, 403, "reserved_sender", "The faucet sender is reserved; use /faucet");
            }
            byte[] signature;
            try {
                signature = req.signature == null ? new byte[0] : Hashes.fromHex(req.signature);
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, TransactionRejectedException.Reason.INVALID_SIGNATURE.code(), "signature must be hexadecimal");
            }
            Transaction tx = Transaction.builder()
                    .from(req.from)
                    .to(req.to)
                    .amount(req.amount)
                    .timestamp(req.timestamp)
                    .signature(signature)
                    .build();
            try {
                node.submitTransaction(tx);
            } catch (TransactionRejectedException e) {
                int code = e.reason() == TransactionRejectedException.Reason.POOL_FULL ? 503 : 400;
                return sendError(exchange, code, e.reason().code(), e.getMessage());
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("status", "ok")
                    .put("txId", tx.id());
            return sendJson(exchange, 200, resp);
        }
    }

    final class BalanceHandler extends Endpoint {
        BalanceHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String address = queryParam(exchange, "address");
            if (address == null || address.isBlank()) {
                return sendError(exchange, 400, "missing_address", "Query parameter 'address' is required");
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("address", address)
                    .put("balance", node.getBalance(address));
            return sendJson(exchange, 200, resp);
        }
    }

    final class FaucetHandler extends Endpoint {
        FaucetHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            FaucetRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), FaucetRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse faucet request");
            }
            if (req == null || req.address == null || req.address.isBlank()) {
                return sendError(exchange, 400, "missing_address", "Field 'address' is required");
            }
            FaucetResult result;
            try {
                result = node.requestFaucet(req.address);
            } catch (TransactionRejectedException e) {
                int code = e.reason() == TransactionRejectedException.Reason.POOL_FULL ? 503 : 400;
                return sendError(exchange, code, e.reason().code(), e.getMessage());
            }
            if (!result.granted()) {
                long seconds = Math.max(1L, (result.retryAfter().toMillis() + 999) / 1000);
                exchange.getResponseHeaders().set("Retry-After", Long.toString(seconds));
                return sendError(exchange, 429, "rate_limited", "Faucet already used; retry in " + seconds + "s");
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("status", "granted")
                    .put("amount", result.amount())
                    .put("txId", result.txId())
                    .put("message", "Faucet funds queued for next block");
            return sendJson(exchange, 200, resp);
        }
    }

    final class ChainInfoHandler extends Endpoint {
        ChainInfoHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            Ledger ledger = node.ledger();
            Block tip = ledger.tip();
            ObjectNode resp = mapper.createObjectNode();
            resp.put("consensus", ledger.consensusName());
            resp.put("length", tip.index() + 1);
            resp.put("height", tip.index());
            resp.put("head", tip.hash());
            resp.put("pending", ledger.pendingCount());
            resp.put("supply", ledger.totalSupply());
            resp.put("producing", node.isProducing());
            return sendJson(exchange, 200, resp);
        }
    }

    final class BlockHandler extends Endpoint {
        BlockHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String raw = queryParam(exchange, "index");
            long index;
            try {
                index = raw == null ? node.ledger().tip().index() : Long.parseLong(raw);
            } catch (NumberFormatException e) {
                return sendError(exchange, 400, "invalid_index", "Query parameter 'index' must be an integer");
            }
            Optional<Block> block = node.ledger().block(index);
            if (block.isEmpty()) {
                return sendError(exchange, 404, "block_not_found", "No block at index " + index);
            }
            return sendJson(exchange, 200, toJson(block.get()));
        }
    }

    final class MetricsHandler extends Endpoint {
        MetricsHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            byte[] out = BlockMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
            exchange.sendResponseHeaders(200, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
            return 200;
        }
    }

    public static class TransactionRequest {
        public String from;
        public String to;
        public long amount;
        public long timestamp;
        public String signature;
    }

    public static class FaucetRequest {
        public String address;
    }

    private ObjectNode toJson(Block block) {
        ObjectNode json = mapper.createObjectNode()
                .put("index", block.index())
                .put("timestamp", block.timestamp())
                .put("previousHash", block.previousHash())
                .put("hash", block.hash())
                .put("nonce", block.nonce())
                .put("miner", block.miner());
        ArrayNode txs = json.putArray("transactions");
        for (Transaction tx : block.transactions()) {
            txs.addObject()
                    .put("id", tx.id())
                    .put("from", tx.from())
                    .put("to", tx.to())
                    .put("amount", tx.amount())
                    .put("timestamp", tx.timestamp())
                    .put("signature", Hashes.toHex(tx.signature()));
        }
        return json;
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        exchange.setAttribute(ERROR_ATTRIBUTE, code);
        ObjectNode body = mapper.createObjectNode();
        body.put("error", code);
        body.put("message", message);
        return sendJson(exchange, status, body);
    }

    private static boolean isField(MismatchedInputException e, String field) {
        return e.getPath().stream().anyMatch(ref -> field.equals(ref.getFieldName()));
    }

    private static String queryParam(HttpExchange exchange, String key) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String part : query.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            String[] kv = part.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String k = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (key.equals(k)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
