package io.b2mash.b2b.isolation.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TenantSchemaTest {

  @Test
  void equalForSameSubdomainRegardlessOfCase() {
    assertThat(TenantSchema.forSubdomain("Shop")).isEqualTo(TenantSchema.forSubdomain("shop"));
    assertThat(TenantSchema.forSubdomain("Shop").hashCode())
        .isEqualTo(TenantSchema.forSubdomain("shop").hashCode());
  }

  @Test
  void toStringIsSchemaName() {
    assertThat(TenantSchema.forSubdomain("shop")).hasToString("tenant_shop");
  }
}
