package io.b2mash.b2b.isolation.provisioning;

/** Countable resources that {@link QuotaPolicy#checkQuota} knows a limit for. */
public enum QuotaResource {
  PRODUCTS,
  STORAGE_BYTES,
  STAFF_USERS,
  ORDERS_PER_MONTH
}
