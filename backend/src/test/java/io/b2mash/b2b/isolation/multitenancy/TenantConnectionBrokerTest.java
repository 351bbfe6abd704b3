package io.b2mash.b2b.isolation.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.isolation.audit.AuditEventRecord;
import io.b2mash.b2b.isolation.audit.AuditService;
import io.b2mash.b2b.isolation.exception.CleanupFailureException;
import io.b2mash.b2b.isolation.exception.TenantIsolationViolationException;
import io.b2mash.b2b.isolation.tenant.Tenant;
import io.b2mash.b2b.isolation.tenant.TenantRegistry;
import io.b2mash.b2b.isolation.testutil.FakeConnection;
import io.b2mash.b2b.isolation.testutil.FakeConnectionPool;
import io.b2mash.b2b.isolation.testutil.TestTenants;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

@ExtendWith(MockitoExtension.class)
class TenantConnectionBrokerTest {

  @Mock private TenantRegistry tenantRegistry;
  @Mock private AuditService auditService;

  private final BrokerProperties properties = new BrokerProperties("public", 30, 5);

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  private TenantConnectionBroker broker(TenantConnectionPool pool) {
    return new TenantConnectionBroker(tenantRegistry, pool, auditService, properties);
  }

  private Tenant registered(String subdomain) {
    var tenant = TestTenants.tenant(subdomain);
    when(tenantRegistry.resolve(subdomain)).thenReturn(Optional.of(tenant));
    return tenant;
  }

  @Test
  void unknownTenant_rejectedWithoutBorrowingOrRunningWork() {
    when(tenantRegistry.resolve("nonexistent-shop")).thenReturn(Optional.empty());
    var pool = new FakeConnectionPool(1);
    var calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                broker(pool)
                    .withTenantConnection("nonexistent-shop", handle -> calls.incrementAndGet()))
        .isInstanceOf(TenantIsolationViolationException.class)
        .hasMessage("Tenant 'nonexistent-shop' not found or invalid");

    assertThat(calls).hasValue(0);
    assertThat(pool.borrowCount()).isZero();
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().action()).isEqualTo("security.tenant_isolation_violation");
    assertThat(captor.getValue().entityId()).isEqualTo("nonexistent-shop");
  }

  @Test
  void tenantWithUnusableStoredSubdomain_isRejected() {
    String longSubdomain = "a".repeat(55);
    registered(longSubdomain);
    var pool = new FakeConnectionPool(1);

    assertThatThrownBy(
            () -> broker(pool).withTenantConnection(longSubdomain, TenantHandle::schemaName))
        .isInstanceOf(TenantIsolationViolationException.class);
    assertThat(pool.borrowCount()).isZero();
  }

  @Test
  void work_runsOnTenantSchemaAndConnectionIsReleasedOnDefault() {
    var tenant = registered("alpha");
    var connection = new FakeConnection();
    var pool = new FakeConnectionPool(connection);
    var pathDuringWork = new AtomicReference<String>();
    var mdcDuringWork = new AtomicReference<String>();

    String schema =
        broker(pool)
            .withTenantConnection(
                "alpha",
                handle -> {
                  pathDuringWork.set(connection.searchPath());
                  mdcDuringWork.set(MDC.get("tenantId"));
                  handle.execute("INSERT INTO products (name) VALUES ('x')");
                  return handle.schemaName();
                });

    assertThat(schema).isEqualTo("tenant_alpha");
    assertThat(pathDuringWork).hasValue("\"tenant_alpha\", public");
    assertThat(mdcDuringWork).hasValue(tenant.getId().toString());
    assertThat(connection.executed()).contains("INSERT INTO products (name) VALUES ('x')");
    assertThat(pool.searchPathsAtRelease()).containsExactly("public");
    assertThat(pool.destroyed()).isEmpty();
    assertThat(MDC.get("tenantId")).isNull();
  }

  @Test
  void mdc_previousValuesRestoredAfterScope() {
    registered("alpha");
    var pool = new FakeConnectionPool(1);
    MDC.put("tenantId", "outer");

    broker(pool).withTenantConnection("alpha", TenantHandle::schemaName);

    assertThat(MDC.get("tenantId")).isEqualTo("outer");
    assertThat(MDC.get("tenantSchema")).isNull();
  }

  @Test
  void failingWork_isRethrownAfterReset() {
    registered("alpha");
    var pool = new FakeConnectionPool(1);
    var failure = new IllegalStateException("boom");

    assertThatThrownBy(
            () ->
                broker(pool)
                    .withTenantConnection(
                        "alpha",
                        handle -> {
                          throw failure;
                        }))
        .isSameAs(failure);

    assertThat(failure.getSuppressed()).isEmpty();
    assertThat(pool.searchPathsAtRelease()).containsExactly("public");
    assertThat(pool.destroyed()).isEmpty();
  }

  @Test
  void errorFromWork_stillResetsConnection() {
    registered("alpha");
    var pool = new FakeConnectionPool(1);

    assertThatThrownBy(
            () ->
                broker(pool)
                    .withTenantConnection(
                        "alpha",
                        handle -> {
                          throw new StackOverflowError();
                        }))
        .isInstanceOf(StackOverflowError.class);

    assertThat(pool.searchPathsAtRelease()).containsExactly("public");
  }

  @Test
  void resetFailure_destroysConnectionInsteadOfReleasing() {
    registered("alpha");
    var contaminated = new FakeConnection().failingReset();
    var pool = new FakeConnectionPool(contaminated);

    assertThatThrownBy(
            () -> broker(pool).withTenantConnection("alpha", TenantHandle::schemaName))
        .isInstanceOf(CleanupFailureException.class)
        .hasCauseInstanceOf(SQLException.class);

    assertThat(pool.destroyed()).containsExactly(contaminated);
    assertThat(pool.releaseCount()).isZero();
    assertThat(pool.peekIdle()).isNotSameAs(contaminated);
    assertThat(pool.peekIdle().searchPath()).isEqualTo("public");
  }

  @Test
  void resetFailureAfterFailingWork_isAttachedAsSuppressed() {
    registered("alpha");
    var contaminated = new FakeConnection().failingReset();
    var pool = new FakeConnectionPool(contaminated);
    var failure = new IllegalArgumentException("bad input");

    assertThatThrownBy(
            () ->
                broker(pool)
                    .withTenantConnection(
                        "alpha",
                        handle -> {
                          throw failure;
                        }))
        .isSameAs(failure);

    assertThat(failure.getSuppressed()).hasSize(1);
    assertThat(failure.getSuppressed()[0]).isInstanceOf(SQLException.class);
    assertThat(pool.destroyed()).containsExactly(contaminated);
  }

  @Test
  void unverifiedReset_destroysConnection() {
    registered("alpha");
    var sticky = new FakeConnection().ignoringReset();
    var pool = new FakeConnectionPool(sticky);

    assertThatThrownBy(
            () -> broker(pool).withTenantConnection("alpha", TenantHandle::schemaName))
        .isInstanceOf(CleanupFailureException.class);

    assertThat(pool.destroyed()).containsExactly(sticky);
    assertThat(pool.searchPathsAtRelease()).isEmpty();
  }

  @Test
  void scopeFailure_destroysConnectionAndSkipsWork() {
    registered("alpha");
    var broken = new FakeConnection().failingScope();
    var pool = new FakeConnectionPool(broken);
    var calls = new AtomicInteger();

    assertThatThrownBy(
            () -> broker(pool).withTenantConnection("alpha", handle -> calls.incrementAndGet()))
        .isInstanceOf(DataAccessResourceFailureException.class);

    assertThat(calls).hasValue(0);
    assertThat(pool.destroyed()).containsExactly(broken);
  }

  @Test
  void handle_isUnusableAfterScopeEnds() {
    registered("alpha");
    var pool = new FakeConnectionPool(1);

    TenantHandle leaked = broker(pool).withTenantConnection("alpha", handle -> handle);

    assertThatThrownBy(() -> leaked.execute("DELETE FROM products"))
        .isInstanceOf(IllegalStateException.class);
    assertThat(leaked.isOpen()).isFalse();
  }

  @Test
  void borrowFailure_isTranslated() throws SQLException {
    registered("alpha");
    var pool = mock(TenantConnectionPool.class);
    when(pool.borrow()).thenThrow(new SQLException("Connection is not available"));

    assertThatThrownBy(
            () -> broker(pool).withTenantConnection("alpha", TenantHandle::schemaName))
        .isInstanceOf(CannotGetJdbcConnectionException.class);
    verify(pool, never()).release(org.mockito.ArgumentMatchers.any());
  }

  @Test
  void sizeOnePool_neverHandsOutTenantScopedConnection() throws Exception {
    registered("alpha");
    registered("beta");
    var pool = new FakeConnectionPool(1);
    var only = pool.peekIdle();
    var broker = broker(pool);
    Queue<String> violations = new ConcurrentLinkedQueue<>();
    int threads = 8;
    int iterations = 50;
    var start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);

    try {
      var futures = new ArrayList<Future<?>>();
      for (int t = 0; t < threads; t++) {
        int threadIndex = t;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < iterations; i++) {
                    String subdomain = (threadIndex + i) % 2 == 0 ? "alpha" : "beta";
                    boolean fail = i % 7 == 0;
                    try {
                      broker.withTenantConnection(
                          subdomain,
                          handle -> {
                            String expected = "\"tenant_" + subdomain + "\", public";
                            if (!expected.equals(only.searchPath())) {
                              violations.add("saw " + only.searchPath() + " for " + subdomain);
                            }
                            if (fail) {
                              throw new IllegalStateException("planned failure");
                            }
                            return null;
                          });
                    } catch (IllegalStateException expected) {
                      // planned
                    }
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(60, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(violations).isEmpty();
    assertThat(pool.borrowCount()).isEqualTo(threads * iterations);
    assertThat(pool.releaseCount()).isEqualTo(threads * iterations);
    assertThat(pool.searchPathsAtRelease()).containsOnly("public");
    assertThat(pool.destroyed()).isEmpty();
  }

  @Test
  void registryConnection_runsOnVerifiedDefaultConnection() {
    var connection = new FakeConnection();
    var pool = new FakeConnectionPool(connection);

    String result = broker(pool).withRegistryConnection(handle -> "ok");

    assertThat(result).isEqualTo("ok");
    assertThat(connection.executed()).containsExactly("SHOW search_path", "SHOW search_path");
    assertThat(pool.searchPathsAtRelease()).containsExactly("public");
  }

  @Test
  void registryConnection_destroysConnectionLeftOnTenantPath() {
    var leaked = new FakeConnection();
    leaked.setSearchPath("\"tenant_alpha\", public");
    var pool = new FakeConnectionPool(leaked);
    var calls = new AtomicInteger();

    assertThatThrownBy(() -> broker(pool).withRegistryConnection(handle -> calls.incrementAndGet()))
        .isInstanceOf(DataAccessResourceFailureException.class);

    assertThat(calls).hasValue(0);
    assertThat(pool.destroyed()).containsExactly(leaked);
    assertThat(pool.releaseCount()).isZero();
  }

  @Test
  void registryConnection_destroysConnectionChangedByWork() {
    var connection = new FakeConnection();
    var pool = new FakeConnectionPool(connection);

    assertThatThrownBy(
            () ->
                broker(pool)
                    .withRegistryConnection(
                        handle -> {
                          connection.setSearchPath("\"tenant_beta\"");
                          return null;
                        }))
        .isInstanceOf(CleanupFailureException.class);

    assertThat(pool.destroyed()).containsExactly(connection);
  }
}
