package io.b2mash.b2b.isolation.provisioning;

import io.b2mash.b2b.isolation.tenant.Plan;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ProvisioningRequest(
    @NotBlank @Size(min = 3, max = 30) String subdomain,
    @NotBlank String name,
    Plan plan,
    @Email String adminEmail) {}
