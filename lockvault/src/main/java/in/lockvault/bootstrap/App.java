package in.lockvault.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.lockvault.application.port.output.FundsTransfer;
import in.lockvault.application.port.output.VaultRepository;
import in.lockvault.application.service.DepositLedger;
import in.lockvault.application.service.ExpiryScheduler;
import in.lockvault.application.service.ExpirySweepJob;
import in.lockvault.application.service.OwnershipService;
import in.lockvault.application.service.RoleEngine;
import in.lockvault.config.VaultConfig;
import in.lockvault.infrastructure.metrics.PrometheusMetricsHandler;
import in.lockvault.infrastructure.metrics.PrometheusVaultMetrics;
import in.lockvault.infrastructure.persistence.InMemoryVaultRepository;
import in.lockvault.infrastructure.persistence.PostgresVaultRepository;
import in.lockvault.infrastructure.transfer.BookEntryFundsTransfer;
import in.lockvault.migration.VaultSchemaMigration;
import in.lockvault.security.InputValidator;
import in.lockvault.service.core.EventService;
import in.lockvault.transport.http.VaultApiHandlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires storage, the ledger / role engine / expiry scheduler, the Prometheus registry and
 * the Undertow API from environment configuration.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== LockVault Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        VaultConfig config = VaultConfig.fromEnv();
        StartupConfigValidator.validate(config);

        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Storage
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = null;
        VaultRepository repository;
        if (config.storage() == VaultConfig.StorageType.POSTGRES) {
            dataSource = createDataSource(config);
            new VaultSchemaMigration(dataSource).migrate();
            repository = new PostgresVaultRepository(dataSource);
        } else {
            repository = new InMemoryVaultRepository();
        }
        log.info("✓ Storage ready: {}", config.storage());

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusVaultMetrics metrics = new PrometheusVaultMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Core services
        // ═══════════════════════════════════════════════════════════════
        InputValidator validator = new InputValidator();
        EventService eventService = new EventService(repository);
        eventService.addListener(e -> log.debug("[EVENT] #{} {} {}", e.seq(), e.type(), e.payload()));

        FundsTransfer fundsTransfer = new BookEntryFundsTransfer();
        RoleEngine roleEngine = new RoleEngine(repository, eventService, metrics);
        DepositLedger ledger = new DepositLedger(repository, roleEngine, fundsTransfer, eventService, metrics, clock);
        ExpiryScheduler expiryScheduler = new ExpiryScheduler(repository, eventService, metrics, clock,
            config.triggerRegistryId());
        OwnershipService ownershipService = new OwnershipService(repository, eventService, validator, clock,
            config.owner());

        metrics.updateTotalLocked(ledger.getTotalLocked());

        ExpirySweepJob sweepJob = null;
        if (config.selfScheduledSweep()) {
            sweepJob = new ExpirySweepJob(expiryScheduler, config.sweepPollInterval(), clock);
            sweepJob.start();
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP API
        // ═══════════════════════════════════════════════════════════════
        VaultApiHandlers api = new VaultApiHandlers(ledger, roleEngine, expiryScheduler, ownershipService,
            eventService, validator, clock);
        HttpHandler routes = api.routes(new PrometheusMetricsHandler(metrics.getRegistry(),
            () -> metrics.updateTotalLocked(ledger.getTotalLocked())));

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(withCors(routes))
            .build();
        server.start();
        log.info("✓ HTTP API server started on http://localhost:{}/ (network={}, trigger={})",
            config.port(), config.network(), config.triggerRegistryId());

        HikariDataSource poolToClose = dataSource;
        ExpirySweepJob jobToStop = sweepJob;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down LockVault...");
            if (jobToStop != null) {
                jobToStop.stop();
                log.info("Expiry sweep job: runs={}, roles expired={}, last run={}",
                    jobToStop.getTotalRuns(), jobToStop.getTotalExpired(), jobToStop.getLastRunTime());
            }
            server.stop();
            if (poolToClose != null) {
                poolToClose.close();
            }
        }, "lockvault-shutdown"));
    }

    static HttpHandler withCors(HttpHandler next) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }

    private static HikariDataSource createDataSource(VaultConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("lockvault-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
