package io.b2mash.b2b.isolation.tenant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Row of the shared tenant registry. Schema and bucket names are derived from {@code subdomain}
 * and {@code id}, so neither changes after creation.
 */
@Entity
@Table(name = "tenants", schema = "public")
public class Tenant {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "subdomain", nullable = false, unique = true, updatable = false, length = 63)
  private String subdomain;

  @Column(name = "name", nullable = false)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "plan", nullable = false)
  private Plan plan;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false)
  private TenantStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Tenant() {}

  public Tenant(String subdomain, String name, Plan plan, TenantStatus status) {
    this.subdomain = subdomain;
    this.name = name;
    this.plan = plan;
    this.status = status;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getSubdomain() {
    return subdomain;
  }

  public String getName() {
    return name;
  }

  public Plan getPlan() {
    return plan;
  }

  public TenantStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void updateStatus(TenantStatus status) {
    this.status = status;
    this.updatedAt = Instant.now();
  }

  public void updatePlan(Plan plan) {
    this.plan = plan;
    this.updatedAt = Instant.now();
  }

  public void rename(String name) {
    this.name = name;
    this.updatedAt = Instant.now();
  }
}
