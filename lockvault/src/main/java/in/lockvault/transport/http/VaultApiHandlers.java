package in.lockvault.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.lockvault.application.service.DepositLedger;
import in.lockvault.application.service.ExpiryScheduler;
import in.lockvault.application.service.OwnershipService;
import in.lockvault.application.service.RoleEngine;
import in.lockvault.domain.common.VaultErrorCode;
import in.lockvault.domain.common.VaultEvent;
import in.lockvault.domain.deposit.DepositRecord;
import in.lockvault.domain.exception.VaultException;
import in.lockvault.domain.role.AccountRoles;
import in.lockvault.domain.role.ExpiryProbeResult;
import in.lockvault.domain.role.Role;
import in.lockvault.domain.role.TimedRole;
import in.lockvault.security.InputValidator;
import in.lockvault.service.core.EventService;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * REST handlers for the vault API.
 *
 * Amounts travel as decimal strings. Every failure answers
 * {@code {"success":false,"error":CODE,"message":...}}.
 */
public final class VaultApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(VaultApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private static final int DEFAULT_EVENT_PAGE = 200;
    private static final int MAX_EVENT_PAGE = 2000;

    private final DepositLedger ledger;
    private final RoleEngine roleEngine;
    private final ExpiryScheduler expiryScheduler;
    private final OwnershipService ownershipService;
    private final EventService eventService;
    private final InputValidator validator;
    private final Clock clock;

    public VaultApiHandlers(DepositLedger ledger, RoleEngine roleEngine, ExpiryScheduler expiryScheduler,
                            OwnershipService ownershipService, EventService eventService,
                            InputValidator validator, Clock clock) {
        this.ledger = ledger;
        this.roleEngine = roleEngine;
        this.expiryScheduler = expiryScheduler;
        this.ownershipService = ownershipService;
        this.eventService = eventService;
        this.validator = validator;
        this.clock = clock;
    }

    public RoutingHandler routes(HttpHandler metricsHandler) {
        return Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", this::health)
            .post("/api/deposits", this::deposit)
            .post("/api/withdrawals", this::withdraw)
            .get("/api/vault/total-locked", this::totalLocked)
            .get("/api/accounts/{account}/deposits", this::deposits)
            .get("/api/accounts/{account}/deposits/{index}", this::depositByIndex)
            .get("/api/accounts/{account}/summary", this::summary)
            .get("/api/expiry/probe", this::probe)
            .post("/api/expiry/sweep", this::sweep)
            .get("/api/events", this::events)
            .post("/api/admin/owner", this::transferOwnership)
            .setFallbackHandler(exchange -> sendError(exchange, StatusCodes.NOT_FOUND, "NOT_FOUND",
                "No route for " + exchange.getRequestMethod() + " " + exchange.getRequestPath()));
    }

    // ═══════════════════════════════════════════════════════════════
    // LEDGER
    // ═══════════════════════════════════════════════════════════════

    /**
     * POST /api/deposits - {"account":..., "amount":"1.5", "lockDays":180}
     */
    public void deposit(HttpServerExchange exchange) {
        withBody(exchange, body -> {
            String account = validator.validateAccount(requiredText(body, "account"));
            BigDecimal amount = requiredDecimal(body, "amount");
            validator.validateAmount(amount);
            long lockDays = requiredLong(body, "lockDays");

            DepositRecord record = ledger.deposit(account, amount, Duration.ofDays(lockDays));

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("account", account);
            response.put("deposit", depositJson(record));
            return response;
        });
    }

    /**
     * POST /api/withdrawals - {"account":..., "index":0}
     */
    public void withdraw(HttpServerExchange exchange) {
        withBody(exchange, body -> {
            String account = validator.validateAccount(requiredText(body, "account"));
            int index = requiredInt(body, "index");
            validator.validateIndex(index);

            BigDecimal amount = ledger.withdraw(account, index);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("account", account);
            response.put("index", index);
            response.put("amount", amount.toPlainString());
            return response;
        });
    }

    public void totalLocked(HttpServerExchange exchange) {
        respond(exchange, () -> Map.of("totalLocked", ledger.getTotalLocked().toPlainString()));
    }

    public void deposits(HttpServerExchange exchange) {
        respond(exchange, () -> {
            String account = validator.validateAccount(pathParam(exchange, "account"));
            List<Map<String, Object>> deposits = ledger.getUserDeposits(account).stream()
                .map(VaultApiHandlers::depositJson)
                .toList();
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("account", account);
            response.put("deposits", deposits);
            return response;
        });
    }

    public void depositByIndex(HttpServerExchange exchange) {
        respond(exchange, () -> {
            String account = validator.validateAccount(pathParam(exchange, "account"));
            int index = parseInt(pathParam(exchange, "index"), "index");
            validator.validateIndex(index);
            return depositJson(ledger.getDepositByIndex(account, index));
        });
    }

    /**
     * GET /api/accounts/{account}/summary - totals and roles for one account.
     */
    public void summary(HttpServerExchange exchange) {
        respond(exchange, () -> {
            String account = validator.validateAccount(pathParam(exchange, "account"));
            AccountRoles roles = roleEngine.getRoles(account);

            List<String> held = new ArrayList<>();
            for (Role role : Role.values()) {
                if (roles.hasRole(role)) {
                    held.add(role.getDisplayName());
                }
            }

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("account", account);
            response.put("depositCount", ledger.getDepositCount(account));
            response.put("lifetimeDeposited", ledger.getLifetimeDeposited(account).toPlainString());
            response.put("activeDeposited", ledger.getActiveDeposited(account).toPlainString());
            response.put("roles", held);
            response.put("temporaryRole", timedRoleJson(roles.timedRole()));
            return response;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // EXPIRY
    // ═══════════════════════════════════════════════════════════════

    public void probe(HttpServerExchange exchange) {
        respond(exchange, () -> {
            ExpiryProbeResult result = expiryScheduler.probe();
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("workNeeded", result.workNeeded());
            response.put("candidates", result.candidates());
            return response;
        });
    }

    /**
     * POST /api/expiry/sweep - {"candidates":[...], "count":n}; count defaults to the list size.
     */
    public void sweep(HttpServerExchange exchange) {
        withBody(exchange, body -> {
            JsonNode candidatesNode = body.get("candidates");
            if (candidatesNode == null || !candidatesNode.isArray()) {
                throw new IllegalArgumentException("candidates must be an array");
            }
            List<String> candidates = new ArrayList<>();
            candidatesNode.forEach(n -> candidates.add(n.isNull() ? null : n.asText()));
            int count = body.hasNonNull("count") ? requiredInt(body, "count") : candidates.size();

            int expired = expiryScheduler.sweep(candidates, count);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("expired", expired);
            return response;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // EVENTS / ADMIN / HEALTH
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /api/events?afterSeq=0&limit=200
     */
    public void events(HttpServerExchange exchange) {
        respond(exchange, () -> {
            Deque<String> afterSeqQ = exchange.getQueryParameters().get("afterSeq");
            Deque<String> limitQ = exchange.getQueryParameters().get("limit");

            long afterSeq = afterSeqQ == null ? 0L : parseLong(afterSeqQ.peekFirst(), "afterSeq");
            int limit = limitQ == null ? DEFAULT_EVENT_PAGE : parseInt(limitQ.peekFirst(), "limit");
            limit = Math.max(1, Math.min(limit, MAX_EVENT_PAGE));

            List<Map<String, Object>> events = eventService.listAfter(afterSeq, limit).stream()
                .map(VaultApiHandlers::eventJson)
                .toList();

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("events", events);
            response.put("latestSeq", eventService.currentSeq());
            return response;
        });
    }

    /**
     * POST /api/admin/owner - {"caller":..., "newOwner":...}
     */
    public void transferOwnership(HttpServerExchange exchange) {
        withBody(exchange, body -> {
            ownershipService.transferOwnership(requiredText(body, "caller"), requiredText(body, "newOwner"));
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("owner", ownershipService.getOwner());
            return response;
        });
    }

    public void health(HttpServerExchange exchange) {
        respond(exchange, () -> {
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "ok");
            health.put("ts", clock.instant().toString());
            health.put("totalLocked", ledger.getTotalLocked().toPlainString());
            health.put("latestSeq", eventService.currentSeq());
            return health;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // PLUMBING
    // ═══════════════════════════════════════════════════════════════

    private void withBody(HttpServerExchange exchange, Function<JsonNode, Object> work) {
        exchange.getRequestReceiver().receiveFullString((ex, raw) -> {
            JsonNode body;
            try {
                body = MAPPER.readTree(raw == null || raw.isBlank() ? "{}" : raw);
            } catch (JsonProcessingException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, "INVALID_REQUEST", "Malformed JSON body");
                return;
            }
            respond(ex, () -> work.apply(body));
        });
    }

    private void respond(HttpServerExchange exchange, Supplier<Object> work) {
        Object result;
        try {
            result = work.get();
        } catch (VaultException e) {
            sendError(exchange, statusFor(e.getCode()), e.getCode().name(), e.getMessage());
            return;
        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("{} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error");
            return;
        }
        sendJson(exchange, StatusCodes.OK, result);
    }

    static int statusFor(VaultErrorCode code) {
        return switch (code.getKind()) {
            case VALIDATION -> StatusCodes.BAD_REQUEST;
            case STATE_CONFLICT -> StatusCodes.CONFLICT;
            case AUTHORIZATION -> StatusCodes.FORBIDDEN;
            case EXTERNAL -> StatusCodes.BAD_GATEWAY;
        };
    }

    private void sendJson(HttpServerExchange exchange, int status, Object data) {
        try {
            String json = MAPPER.writeValueAsString(data);
            exchange.setStatusCode(status);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
            exchange.getResponseSender().send(json);
        } catch (JsonProcessingException e) {
            log.error("Failed to send JSON response: {}", e.getMessage());
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("{\"success\":false,\"error\":\"INTERNAL_ERROR\"}");
        }
    }

    private void sendError(HttpServerExchange exchange, int status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", code);
        body.put("message", message);
        sendJson(exchange, status, body);
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null ? null : values.peekFirst();
    }

    private static String requiredText(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return node.asText();
    }

    private static BigDecimal requiredDecimal(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " is not a decimal: " + node.asText());
        }
    }

    private static long requiredLong(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (node.canConvertToLong() && node.isIntegralNumber()) {
            return node.asLong();
        }
        return parseLong(node.asText(), field);
    }

    private static long parseLong(String value, String field) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException(field + " is not an integer: " + value);
        }
    }

    private static int requiredInt(JsonNode body, String field) {
        return toInt(requiredLong(body, field), field);
    }

    private static int parseInt(String value, String field) {
        return toInt(parseLong(value, field), field);
    }

    private static int toInt(long value, String field) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(field + " is out of range: " + value);
        }
        return (int) value;
    }

    private static Map<String, Object> depositJson(DepositRecord record) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("index", record.index());
        map.put("amount", record.amount().toPlainString());
        map.put("createdAt", record.createdAt().getEpochSecond());
        map.put("lockUntil", record.lockUntil().getEpochSecond());
        map.put("state", record.state().name());
        map.put("withdrawn", record.withdrawn());
        return map;
    }

    private static Map<String, Object> timedRoleJson(TimedRole timedRole) {
        if (timedRole == null) {
            return null;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("active", timedRole.active());
        map.put("lastActive", timedRole.lastActive().toString());
        map.put("expiry", timedRole.expiry().toString());
        return map;
    }

    private static Map<String, Object> eventJson(VaultEvent e) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("seq", e.seq());
        map.put("type", e.type().name());
        map.put("account", e.account());
        map.put("payload", e.payload());
        map.put("ts", e.ts().toString());
        map.put("createdBy", e.createdBy());
        return map;
    }
}
