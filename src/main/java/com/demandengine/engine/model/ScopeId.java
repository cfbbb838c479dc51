package com.demandengine.engine.model;

import com.demandengine.exception.InvalidScopeException;

import java.util.regex.Pattern;

/**
 * A tenant, optionally narrowed to one product. A missing product id is the
 * company-wide aggregate scope.
 */
public record ScopeId(String tenantId, String productId) {

    private static final Pattern ID_PATTERN = Pattern.compile("^[a-zA-Z0-9._:-]{1,64}$");
    private static final String COMPANY_WIDE = "*";

    public ScopeId {
        if (tenantId == null || !ID_PATTERN.matcher(tenantId).matches()) {
            throw new InvalidScopeException("tenantId must match " + ID_PATTERN.pattern() + " but was '" + tenantId + "'");
        }
        if (productId != null && productId.isBlank()) {
            productId = null;
        }
        if (productId != null && !ID_PATTERN.matcher(productId).matches()) {
            throw new InvalidScopeException("productId must match " + ID_PATTERN.pattern() + " but was '" + productId + "'");
        }
    }

    public static ScopeId of(String tenantId, String productId) {
        return new ScopeId(tenantId, productId);
    }

    public static ScopeId companyWide(String tenantId) {
        return new ScopeId(tenantId, null);
    }

    public boolean isCompanyWide() {
        return productId == null;
    }

    /** Stable string key, {@code tenant/product} or {@code tenant/*}. */
    public String key() {
        return tenantId + "/" + (productId == null ? COMPANY_WIDE : productId);
    }

    @Override
    public String toString() {
        return key();
    }
}
