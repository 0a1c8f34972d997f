package com.openforge.posgate.rbac;

/** The checks {@link AuthorizationEngine#admit} runs, in order. */
public enum AuthorizationStage {
    TENANT_SCOPED,
    ROLE_CHECKED,
    PERMISSION_CHECKED,
    ADMITTED
}
