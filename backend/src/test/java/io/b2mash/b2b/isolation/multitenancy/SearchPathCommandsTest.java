package io.b2mash.b2b.isolation.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SearchPathCommandsTest {

  @Test
  void scopeToQuotesTenantSchemaAndAppendsDefault() {
    var schema = TenantSchema.forSubdomain("alpha-test");

    assertThat(SearchPathCommands.scopeTo(schema, "public"))
        .isEqualTo("SET search_path TO \"tenant_alpha-test\", public");
  }

  @Test
  void resetToUsesDefaultSchema() {
    assertThat(SearchPathCommands.resetTo("public")).isEqualTo("SET search_path TO public");
  }

  @Test
  void rejectsSuspiciousDefaultSchema() {
    var schema = TenantSchema.forSubdomain("alpha");

    assertThatThrownBy(() -> SearchPathCommands.scopeTo(schema, "public; DROP TABLE x"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SearchPathCommands.resetTo("\"public\""))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SearchPathCommands.resetTo(null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
