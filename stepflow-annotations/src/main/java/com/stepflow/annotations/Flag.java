package com.stepflow.annotations;

/**
 * Tri-state flag for annotation attributes that may be left unset.
 */
public enum Flag {
    /** Not configured; the runtime default applies. */
    UNSET,
    /** Explicitly enabled. */
    TRUE,
    /** Explicitly disabled. */
    FALSE;

    /** Returns the boxed value, or null when {@link #UNSET}. */
    public Boolean toBoolean() {
        switch (this) {
            case TRUE:
                return Boolean.TRUE;
            case FALSE:
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
