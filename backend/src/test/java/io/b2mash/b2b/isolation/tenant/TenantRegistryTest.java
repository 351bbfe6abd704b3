package io.b2mash.b2b.isolation.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.isolation.audit.AuditEventRecord;
import io.b2mash.b2b.isolation.audit.AuditService;
import io.b2mash.b2b.isolation.exception.InvalidIdentifierException;
import io.b2mash.b2b.isolation.exception.ResourceConflictException;
import io.b2mash.b2b.isolation.exception.ResourceNotFoundException;
import io.b2mash.b2b.isolation.testutil.TestTenants;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.ArgumentMatchers;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TenantRegistryTest {

  @Mock private TenantRepository tenantRepository;
  @Mock private AuditService auditService;

  private TenantRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new TenantRegistry(tenantRepository, auditService);
  }

  @Test
  void resolve_byIdWhenIdentifierIsUuid() {
    var tenant = TestTenants.tenant("alpha");
    when(tenantRepository.findById(tenant.getId())).thenReturn(Optional.of(tenant));

    assertThat(registry.resolve(tenant.getId().toString())).contains(tenant);
    verify(tenantRepository, never()).findBySubdomainIgnoreCase(any());
  }

  @Test
  void resolve_bySubdomainIgnoringCase() {
    var tenant = TestTenants.tenant("alpha");
    when(tenantRepository.findBySubdomainIgnoreCase("ALPHA")).thenReturn(Optional.of(tenant));

    assertThat(registry.resolve(" ALPHA ")).contains(tenant);
    assertThat(registry.exists("ALPHA")).isTrue();
  }

  @Test
  void resolve_blankIdentifierFindsNothing() {
    assertThat(registry.resolve("  ")).isEmpty();
    assertThat(registry.exists(null)).isFalse();
    verifyNoInteractions(tenantRepository);
  }

  @Test
  void resolve_unknownTenantIsEmptyWhateverTheStatusFilter() {
    when(tenantRepository.findBySubdomainIgnoreCase("ghost")).thenReturn(Optional.empty());

    assertThat(registry.exists("ghost")).isFalse();
  }

  @Test
  void register_storesLowercaseSubdomain() {
    when(tenantRepository.existsBySubdomainIgnoreCase("alpha-test")).thenReturn(false);
    when(tenantRepository.saveAndFlush(any(Tenant.class)))
        .thenAnswer(
            invocation -> {
              Tenant saved = invocation.getArgument(0);
              ReflectionTestUtils.setField(saved, "id", UUID.randomUUID());
              return saved;
            });

    var tenant = registry.register("Alpha-Test", "Alpha", Plan.PRO);

    assertThat(tenant.getSubdomain()).isEqualTo("alpha-test");
    assertThat(tenant.getPlan()).isEqualTo(Plan.PRO);
    assertThat(tenant.getStatus()).isEqualTo(TenantStatus.ACTIVE);
    assertThat(tenant.getCreatedAt()).isNotNull();
  }

  @Test
  void register_rejectsTakenSubdomain() {
    when(tenantRepository.existsBySubdomainIgnoreCase("alpha")).thenReturn(true);

    assertThatThrownBy(() -> registry.register("ALPHA", "Alpha", Plan.FREE))
        .isInstanceOf(ResourceConflictException.class);
    verify(tenantRepository, never()).saveAndFlush(any());
  }

  @Test
  void register_translatesUniqueViolationFromConcurrentInsert() {
    when(tenantRepository.existsBySubdomainIgnoreCase("alpha")).thenReturn(false);
    when(tenantRepository.saveAndFlush(any(Tenant.class)))
        .thenThrow(new DataIntegrityViolationException("uq_tenants_subdomain_lower"));

    assertThatThrownBy(() -> registry.register("alpha", "Alpha", Plan.FREE))
        .isInstanceOf(ResourceConflictException.class)
        .hasCauseInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void register_rejectsMalformedSubdomain() {
    assertThatThrownBy(() -> registry.register("no spaces", "Alpha", Plan.FREE))
        .isInstanceOf(InvalidIdentifierException.class);
    verifyNoInteractions(tenantRepository);
  }

  @Test
  void register_rejectsSurroundingWhitespace() {
    assertThatThrownBy(() -> registry.register(" alpha", "Alpha", Plan.FREE))
        .isInstanceOf(InvalidIdentifierException.class);
    verifyNoInteractions(tenantRepository);
  }

  @Test
  void register_rejectsSubdomainTooLongForSchemaName() {
    // valid as a DNS label (63 max) but over the 50 character schema limit
    String subdomain = "a".repeat(55);

    assertThatThrownBy(() -> registry.register(subdomain, "Long", Plan.FREE))
        .isInstanceOf(InvalidIdentifierException.class)
        .extracting(e -> ((InvalidIdentifierException) e).getReason())
        .isEqualTo("exceeds 50 character limit");
    verifyNoInteractions(tenantRepository);
  }

  @Test
  void updateStatus_rejectsNullBeforeLoading() {
    var id = UUID.randomUUID();

    assertThatThrownBy(() -> registry.updateStatus(id, null))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(tenantRepository, auditService);
  }

  @Test
  void updatePlan_rejectsNullBeforeLoading() {
    var id = UUID.randomUUID();

    assertThatThrownBy(() -> registry.updatePlan(id, null))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(tenantRepository);
  }

  @Test
  void updateStatus_stampsUpdatedAtAndAudits() {
    var tenant = TestTenants.tenant("alpha", TenantStatus.PENDING);
    ReflectionTestUtils.setField(tenant, "updatedAt", Instant.EPOCH);
    when(tenantRepository.findById(tenant.getId())).thenReturn(Optional.of(tenant));
    when(tenantRepository.save(tenant)).thenReturn(tenant);

    registry.updateStatus(tenant.getId(), TenantStatus.ACTIVE);

    assertThat(tenant.getStatus()).isEqualTo(TenantStatus.ACTIVE);
    assertThat(tenant.getUpdatedAt()).isAfter(Instant.EPOCH);
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().action()).isEqualTo("tenant.status_changed");
    assertThat(captor.getValue().details()).containsEntry("from", "PENDING");
    assertThat(captor.getValue().details()).containsEntry("to", "ACTIVE");
  }

  @Test
  void updateStatus_toSameStatusDoesNotAudit() {
    var tenant = TestTenants.tenant("alpha");
    when(tenantRepository.findById(tenant.getId())).thenReturn(Optional.of(tenant));
    when(tenantRepository.save(tenant)).thenReturn(tenant);

    registry.updateStatus(tenant.getId(), TenantStatus.ACTIVE);

    verifyNoInteractions(auditService);
  }

  @Test
  void updateStatus_unknownTenantThrows() {
    var id = UUID.randomUUID();
    when(tenantRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> registry.updateStatus(id, TenantStatus.SUSPENDED))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void updateTenant_appliesOnlyNonNullFields() {
    var tenant = TestTenants.tenant("alpha");
    when(tenantRepository.findById(tenant.getId())).thenReturn(Optional.of(tenant));
    when(tenantRepository.save(tenant)).thenReturn(tenant);

    registry.updateTenant(tenant.getId(), new TenantUpdate(null, Plan.ENTERPRISE, null));

    assertThat(tenant.getName()).isEqualTo("alpha Store");
    assertThat(tenant.getPlan()).isEqualTo(Plan.ENTERPRISE);
    assertThat(tenant.getStatus()).isEqualTo(TenantStatus.ACTIVE);
    verifyNoInteractions(auditService);
  }

  @Test
  void delete_refusesActiveTenant() {
    var tenant = TestTenants.tenant("alpha");
    when(tenantRepository.findById(tenant.getId())).thenReturn(Optional.of(tenant));

    var result = registry.delete(tenant.getId());

    assertThat(result.success()).isFalse();
    assertThat(result.error()).contains("Suspend first");
    verify(tenantRepository, never()).delete(ArgumentMatchers.<Tenant>any());
  }

  @Test
  void delete_removesSuspendedTenant() {
    var tenant = TestTenants.tenant("alpha", TenantStatus.SUSPENDED);
    when(tenantRepository.findById(tenant.getId())).thenReturn(Optional.of(tenant));

    var result = registry.delete(tenant.getId());

    assertThat(result.success()).isTrue();
    verify(tenantRepository).delete(tenant);
  }

  @Test
  void delete_missingTenantIsFailedResult() {
    var id = UUID.randomUUID();
    when(tenantRepository.findById(id)).thenReturn(Optional.empty());

    var result = registry.delete(id);

    assertThat(result.success()).isFalse();
    assertThat(result.error()).isEqualTo("Tenant not found");
  }

  @Test
  void stats_countsByStatusAndPlan() {
    when(tenantRepository.count()).thenReturn(5L);
    when(tenantRepository.countByStatus(TenantStatus.ACTIVE)).thenReturn(4L);
    when(tenantRepository.countByStatus(TenantStatus.PENDING)).thenReturn(1L);
    when(tenantRepository.countByStatus(TenantStatus.SUSPENDED)).thenReturn(0L);
    when(tenantRepository.countByStatus(TenantStatus.MAINTENANCE)).thenReturn(0L);
    for (Plan plan : Plan.values()) {
      when(tenantRepository.countByPlan(plan)).thenReturn(plan == Plan.PRO ? 2L : 1L);
    }
    when(tenantRepository.countByCreatedAtAfter(any(Instant.class))).thenReturn(3L);

    var stats = registry.stats();

    assertThat(stats.total()).isEqualTo(5);
    assertThat(stats.byStatus()).containsEntry(TenantStatus.ACTIVE, 4L);
    assertThat(stats.byStatus()).containsEntry(TenantStatus.SUSPENDED, 0L);
    assertThat(stats.byPlan()).containsEntry(Plan.PRO, 2L);
    assertThat(stats.recent()).isEqualTo(3);
  }
}
