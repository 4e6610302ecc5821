package io.staking.core.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.staking.core.metrics.HttpMetrics;
import io.staking.core.metrics.LedgerMetrics;
import io.staking.core.node.LedgerBootstrap;
import io.staking.core.node.StakingNode;
import io.staking.core.protocol.Pool;
import io.staking.core.protocol.PoolStatus;
import io.staking.core.protocol.Receipt;
import io.staking.core.protocol.StakePosition;
import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;
import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierBenefit;
import io.staking.core.protocol.TierClaim;
import io.staking.core.protocol.UserStats;
import io.staking.core.storage.EventJournal;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON-over-HTTP front of a {@link StakingNode}.
 *
 * Ledger calls are POSTs whose body carries the {@code caller} identity, as
 * supplied by the execution environment in front of this server. Queries are
 * GETs with query parameters. Ledger errors come back as 4xx with
 * {@code {error, code, message}}.
 */
public final class RpcServer {
    private static final Logger LOG = Logger.getLogger(RpcServer.class.getName());
    private static final int MAX_EVENT_PAGE = 1_000;
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "Staking Ledger RPC API",
    "version": "1.0.0"
  },
  "paths": {
    "/status": { "get": { "summary": "Node status", "responses": { "200": { "description": "Status" } } } },
    "/stats": { "get": { "summary": "Protocol-wide aggregates", "responses": { "200": { "description": "Stats" } } } },
    "/pools": { "get": { "summary": "All pools", "responses": { "200": { "description": "Pool list" } } } },
    "/pool": {
      "get": {
        "summary": "Pool by id",
        "parameters": [ { "name": "id", "in": "query", "required": true, "schema": { "type": "integer" } } ],
        "responses": { "200": { "description": "Pool" }, "404": { "description": "Unknown pool" } }
      }
    },
    "/position": {
      "get": {
        "summary": "Position with pending rewards and cooldown state",
        "parameters": [
          { "name": "pool", "in": "query", "required": true, "schema": { "type": "integer" } },
          { "name": "staker", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Position" }, "404": { "description": "No position" } }
      }
    },
    "/user": {
      "get": {
        "summary": "Per-staker totals and voting power",
        "parameters": [ { "name": "staker", "in": "query", "required": true, "schema": { "type": "string" } } ],
        "responses": { "200": { "description": "User stats" }, "404": { "description": "Unknown staker" } }
      }
    },
    "/tier": {
      "get": {
        "summary": "Live tier, benefits and tier record of a position",
        "parameters": [
          { "name": "pool", "in": "query", "required": true, "schema": { "type": "integer" } },
          { "name": "staker", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Tier info" }, "404": { "description": "No position" } }
      }
    },
    "/tiers": { "get": { "summary": "Tier benefit table", "responses": { "200": { "description": "Benefits" } } } },
    "/events": {
      "get": {
        "summary": "Page through the event journal",
        "parameters": [
          { "name": "from", "in": "query", "required": false, "schema": { "type": "integer" } },
          { "name": "limit", "in": "query", "required": false, "schema": { "type": "integer" } }
        ],
        "responses": { "200": { "description": "Events in sequence order" } }
      }
    },
    "/pools/create": { "post": { "summary": "Create a pool (operator)", "responses": { "201": { "description": "Created" } } } },
    "/pools/fund": { "post": { "summary": "Fund a pool's reward balance (operator)", "responses": { "200": { "description": "Funded" } } } },
    "/pools/pause": { "post": { "summary": "Pause a pool (operator)", "responses": { "200": { "description": "Paused" } } } },
    "/pools/resume": { "post": { "summary": "Resume a pool (operator)", "responses": { "200": { "description": "Resumed" } } } },
    "/pools/end": { "post": { "summary": "End a pool (operator)", "responses": { "200": { "description": "Ended" } } } },
    "/stake/deposit": { "post": { "summary": "Deposit into a pool", "responses": { "200": { "description": "Deposited" } } } },
    "/stake/withdraw": { "post": { "summary": "Withdraw principal", "responses": { "200": { "description": "Withdrawn" } } } },
    "/stake/cooldown": { "post": { "summary": "Start the cooldown", "responses": { "200": { "description": "Cooldown started" } } } },
    "/rewards/claim": { "post": { "summary": "Claim rewards", "responses": { "200": { "description": "Claimed" } } } },
    "/rewards/claim-tier": { "post": { "summary": "Claim rewards with loyalty bonus", "responses": { "200": { "description": "Claimed" } } } },
    "/rewards/compound": { "post": { "summary": "Re-stake rewards", "responses": { "200": { "description": "Compounded" } } } },
    "/tiers/check": { "post": { "summary": "Ratchet the tier record of a position", "responses": { "200": { "description": "Tier" } } } },
    "/tiers/initialize": { "post": { "summary": "Install the benefit table once (operator)", "responses": { "200": { "description": "Installed" } } } },
    "/loyalty": { "post": { "summary": "Enable or disable the loyalty program (operator)", "responses": { "200": { "description": "Toggled" } } } },
    "/metrics": { "get": { "summary": "Metrics scrape", "responses": { "200": { "description": "Text exposition" } } } },
    "/openapi.json": { "get": { "summary": "This document", "responses": { "200": { "description": "OpenAPI" } } } }
  },
  "components": {
    "schemas": {
      "LedgerCall": {
        "type": "object",
        "required": ["caller"],
        "properties": {
          "caller": { "type": "string" },
          "poolId": { "type": "integer", "format": "int64" },
          "amount": { "type": "integer", "format": "int64" }
        }
      },
      "Error": {
        "type": "object",
        "properties": {
          "error": { "type": "string" },
          "code": { "type": "integer" },
          "message": { "type": "string" }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final StakingNode node;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public RpcServer(StakingNode node, String bindAddress, int port, String authToken) {
        this.node = node;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("RPC server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);

        server.createContext("/status", new QueryHandler(uri -> status()));
        server.createContext("/stats", new QueryHandler(uri -> LedgerJson.protocolStats(node.protocolStats())));
        server.createContext("/pools", new QueryHandler(uri -> LedgerJson.pools(node.listPools())));
        server.createContext("/pool", new QueryHandler(this::pool));
        server.createContext("/position", new QueryHandler(this::position));
        server.createContext("/user", new QueryHandler(this::user));
        server.createContext("/tier", new QueryHandler(this::tier));
        server.createContext("/tiers", new QueryHandler(uri -> LedgerJson.tierBenefits(node.tierBenefits())));
        server.createContext("/events", new QueryHandler(this::events));

        server.createContext("/pools/create", new OperationHandler(201, body -> {
            OptionalLong duration = body.hasNonNull("duration")
                    ? OptionalLong.of(requiredLong(body, "duration"))
                    : OptionalLong.empty();
            Receipt<Long> r = node.createPool(caller(body), requiredText(body, "name"),
                    requiredLong(body, "dailyRateBps"), requiredLong(body, "minStake"),
                    requiredLong(body, "lockPeriod"), requiredLong(body, "cooldownPeriod"), duration);
            return withEvents(r, mapper.createObjectNode().put("poolId", r.value()));
        }));
        server.createContext("/pools/fund", new OperationHandler(200, body -> {
            long poolId = requiredLong(body, "poolId");
            Receipt<Long> r = node.fundRewardPool(caller(body), poolId, requiredLong(body, "amount"));
            return withEvents(r, mapper.createObjectNode().put("poolId", poolId).put("rewardPoolBalance", r.value()));
        }));
        server.createContext("/pools/pause", new OperationHandler(200,
                body -> statusChange(body, node::pausePool)));
        server.createContext("/pools/resume", new OperationHandler(200,
                body -> statusChange(body, node::resumePool)));
        server.createContext("/pools/end", new OperationHandler(200,
                body -> statusChange(body, node::endPool)));

        server.createContext("/stake/deposit", new OperationHandler(200, body -> {
            Receipt<Long> r = node.deposit(caller(body), requiredLong(body, "poolId"), requiredLong(body, "amount"));
            return withEvents(r, mapper.createObjectNode().put("totalStake", r.value()));
        }));
        server.createContext("/stake/withdraw", new OperationHandler(200, body -> {
            Receipt<Long> r = node.withdraw(caller(body), requiredLong(body, "poolId"), requiredLong(body, "amount"));
            return withEvents(r, mapper.createObjectNode().put("netAmount", r.value()));
        }));
        server.createContext("/stake/cooldown", new OperationHandler(200, body -> {
            Receipt<Long> r = node.startCooldown(caller(body), requiredLong(body, "poolId"));
            return withEvents(r, mapper.createObjectNode().put("cooldownEnds", r.value()));
        }));

        server.createContext("/rewards/claim", new OperationHandler(200, body -> {
            Receipt<Long> r = node.claim(caller(body), requiredLong(body, "poolId"));
            return withEvents(r, mapper.createObjectNode().put("netRewards", r.value()));
        }));
        server.createContext("/rewards/claim-tier", new OperationHandler(200, body -> {
            Receipt<TierClaim> r = node.claimWithTierBonus(caller(body), requiredLong(body, "poolId"));
            TierClaim c = r.value();
            return withEvents(r, mapper.createObjectNode()
                    .put("netRewards", c.netRewards())
                    .put("tierBonus", c.tierBonus())
                    .put("feeDiscount", c.feeDiscount())
                    .put("tier", c.tier().level()));
        }));
        server.createContext("/rewards/compound", new OperationHandler(200, body -> {
            Receipt<Long> r = node.compound(caller(body), requiredLong(body, "poolId"));
            return withEvents(r, mapper.createObjectNode().put("netRewards", r.value()));
        }));

        server.createContext("/tiers/check", new OperationHandler(200, body -> {
            Receipt<Tier> r = node.checkAndUpgradeTier(caller(body), requiredLong(body, "poolId"));
            return withEvents(r, mapper.createObjectNode()
                    .put("tier", r.value().level())
                    .put("tierName", r.value().displayName()));
        }));
        server.createContext("/tiers/initialize", new OperationHandler(200, body -> {
            JsonNode benefits = body.get("benefits");
            if (benefits == null || !benefits.isObject()) {
                throw new BadRequest("missing_fields", "Field 'benefits' must be an object");
            }
            Map<Tier, TierBenefit> table = parseBenefits(benefits);
            Receipt<Map<Tier, TierBenefit>> r = node.initializeTierBenefits(caller(body), table);
            ObjectNode resp = mapper.createObjectNode();
            resp.set("benefits", LedgerJson.tierBenefits(r.value()));
            return withEvents(r, resp);
        }));
        server.createContext("/loyalty", new OperationHandler(200, body -> {
            JsonNode enabled = body.get("enabled");
            if (enabled == null || !enabled.isBoolean()) {
                throw new BadRequest("missing_fields", "Field 'enabled' must be a boolean");
            }
            Receipt<Boolean> r = node.setLoyaltyEnabled(caller(body), enabled.booleanValue());
            return withEvents(r, mapper.createObjectNode().put("enabled", r.value()));
        }));

        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "RPC server listening on http://" + bindAddress + ':' + port + (authToken != null ? " (auth required)" : ""));
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

    /** Actual port, useful when started on port 0. */
    public int port() {
        return server != null ? server.getAddress().getPort() : port;
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

    // -------------------- queries --------------------

    private ObjectNode status() {
        ObjectNode resp = mapper.createObjectNode();
        resp.put("time", node.clock().now());
        resp.put("operator", node.config().operator);
        resp.put("pools", node.listPools().size());
        resp.put("loyaltyEnabled", node.loyaltyEnabled());
        resp.put("lastEventSequence", node.journal().lastSequence());
        return resp;
    }

    private ObjectNode pool(URI uri) {
        long id = requiredLongParam(uri, "id");
        Pool pool = node.getPool(id)
                .orElseThrow(() -> new StakingException(StakingError.POOL_NOT_FOUND, "Unknown pool " + id));
        return LedgerJson.pool(pool);
    }

    private ObjectNode position(URI uri) {
        long poolId = requiredLongParam(uri, "pool");
        String staker = requiredParam(uri, "staker");
        StakePosition position = node.getPosition(poolId, staker)
                .orElseThrow(() -> new StakingException(StakingError.POSITION_NOT_FOUND,
                        "No position for pool#" + poolId + "/" + staker));
        ObjectNode resp = LedgerJson.position(poolId, staker, position);
        resp.put("pendingRewards", node.pendingRewards(staker, poolId));
        resp.put("cooldownState", node.cooldownState(staker, poolId).name().toLowerCase(Locale.ROOT));
        return resp;
    }

    private ObjectNode user(URI uri) {
        String staker = requiredParam(uri, "staker");
        UserStats stats = node.getUserStats(staker)
                .orElseThrow(() -> new StakingException(StakingError.POSITION_NOT_FOUND, "Unknown staker " + staker));
        ObjectNode resp = LedgerJson.userStats(staker, stats);
        resp.put("votingPower", node.votingPower(staker));
        resp.put("balance", node.balanceOf(staker));
        return resp;
    }

    private ObjectNode tier(URI uri) {
        long poolId = requiredLongParam(uri, "pool");
        String staker = requiredParam(uri, "staker");
        return LedgerJson.tierInfo(poolId, staker, node.tierInfo(staker, poolId));
    }

    private ObjectNode events(URI uri) {
        String fromRaw = queryParam(uri, "from");
        String limitRaw = queryParam(uri, "limit");
        long from = fromRaw == null ? 1L : parseLong("from", fromRaw);
        long limit = limitRaw == null ? 100L : parseLong("limit", limitRaw);
        if (from < 1 || limit < 1 || limit > MAX_EVENT_PAGE) {
            throw new BadRequest("invalid_range", "Expect from >= 1 and 1 <= limit <= " + MAX_EVENT_PAGE);
        }
        EventJournal journal = node.journal();
        return LedgerJson.journalPage(journal.readFrom(from, (int) limit), journal.lastSequence());
    }

    // -------------------- operations --------------------

    private ObjectNode statusChange(JsonNode body, StatusCall call) {
        long poolId = requiredLong(body, "poolId");
        Receipt<PoolStatus> r = call.apply(caller(body), poolId);
        return withEvents(r, mapper.createObjectNode()
                .put("poolId", poolId)
                .put("status", r.value().name().toLowerCase(Locale.ROOT)));
    }

    private ObjectNode withEvents(Receipt<?> receipt, ObjectNode resp) {
        resp.set("events", LedgerJson.events(receipt.events()));
        return resp;
    }

    private Map<Tier, TierBenefit> parseBenefits(JsonNode benefits) {
        try {
            return LedgerBootstrap.parseTierBenefits(benefits);
        } catch (IllegalArgumentException e) {
            throw new BadRequest("invalid_benefits", Optional.ofNullable(e.getMessage()).orElse("Invalid benefit table"));
        }
    }

    // -------------------- handlers --------------------

    @FunctionalInterface
    private interface Query {
        ObjectNode run(URI uri);
    }

    @FunctionalInterface
    private interface Operation {
        ObjectNode run(JsonNode body);
    }

    @FunctionalInterface
    private interface StatusCall {
        Receipt<PoolStatus> apply(String caller, long poolId);
    }

    /** Method check, auth, error mapping and request metrics shared by every endpoint. */
    abstract class Endpoint implements HttpHandler {
        private final String allowedMethod;

        Endpoint(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!exchange.getRequestURI().getPath().equals(path)) {
                    status = sendError(exchange, 404, "not_found", "No endpoint " + exchange.getRequestURI().getPath());
                    return;
                }
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = serve(exchange);
            } catch (BadRequest e) {
                status = sendError(exchange, 400, e.code, e.getMessage());
            } catch (StakingException e) {
                HttpMetrics.countLedgerError(path, e.error());
                status = sendLedgerError(exchange, e);
            } catch (Exception e) {
                LOG.log(Level.WARNING, path + " handler failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }

        abstract int serve(HttpExchange exchange) throws IOException;
    }

    final class QueryHandler extends Endpoint {
        private final Query query;

        QueryHandler(Query query) {
            super("GET");
            this.query = query;
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, query.run(exchange.getRequestURI()));
        }
    }

    final class OperationHandler extends Endpoint {
        private final int successStatus;
        private final Operation operation;

        OperationHandler(int successStatus, Operation operation) {
            super("POST");
            this.successStatus = successStatus;
            this.operation = operation;
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            JsonNode body;
            try {
                body = mapper.readTree(exchange.getRequestBody());
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse request body");
            }
            if (body == null || !body.isObject()) {
                return sendError(exchange, 400, "invalid_json", "Request body must be a JSON object");
            }
            return sendJson(exchange, successStatus, operation.run(body));
        }
    }

    final class MetricsHandler extends Endpoint {
        MetricsHandler() {
            super("GET");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            byte[] payload = LedgerMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
            return 200;
        }
    }

    final class OpenApiHandler extends Endpoint {
        OpenApiHandler() {
            super("GET");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    // -------------------- helpers --------------------

    static int httpStatus(StakingError error) {
        return switch (error) {
            case NOT_AUTHORIZED -> 403;
            case POOL_NOT_FOUND, POSITION_NOT_FOUND -> 404;
            case INVALID_AMOUNT, INVALID_PARAMETER -> 400;
            case INSUFFICIENT_STAKE, COOLDOWN_ACTIVE, POOL_INACTIVE, NO_REWARDS,
                    TRANSFER_FAILED, LOYALTY_DISABLED, ALREADY_INITIALIZED -> 409;
        };
    }

    private int sendLedgerError(HttpExchange exchange, StakingException e) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", e.error().wireName());
        node.put("code", e.error().code());
        node.put("message", e.getMessage());
        return sendJson(exchange, httpStatus(e.error()), node);
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else if (body instanceof String str) {
            payload = str.getBytes(StandardCharsets.UTF_8);
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private static String caller(JsonNode body) {
        return requiredText(body, "caller");
    }

    private static String requiredText(JsonNode body, String field) {
        JsonNode v = body.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) {
            throw new BadRequest("missing_fields", "Field '" + field + "' is required");
        }
        return v.asText();
    }

    private static long requiredLong(JsonNode body, String field) {
        JsonNode v = body.get(field);
        if (v == null || !v.canConvertToLong() || !v.isIntegralNumber()) {
            throw new BadRequest("missing_fields", "Field '" + field + "' must be an integer");
        }
        return v.longValue();
    }

    private String requiredParam(URI uri, String name) {
        String value = queryParam(uri, name);
        if (value == null || value.isBlank()) {
            throw new BadRequest("missing_" + name, "Query parameter '" + name + "' is required");
        }
        return value;
    }

    private long requiredLongParam(URI uri, String name) {
        return parseLong(name, requiredParam(uri, name));
    }

    private static long parseLong(String name, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new BadRequest("invalid_" + name, "Query parameter '" + name + "' must be an integer");
        }
    }

    private String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] kv = pair.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (name.equals(key)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    /** Malformed request; always a 400. */
    private static final class BadRequest extends RuntimeException {
        private final String code;

        BadRequest(String code, String message) {
            super(message);
            this.code = code;
        }
    }
}
