/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

/**
 * Thrown when quota group definitions do not form a well-formed tree.
 */
public class QuotaTopologyException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String quotaName;

    /**
     * @param quotaName the group at which the inconsistency was found
     * @param message   description of the inconsistency
     */
    public QuotaTopologyException(String quotaName, String message) {
        super("Quota group '" + quotaName + "': " + message);
        this.quotaName = quotaName;
    }

    /**
     * @return the group at which the inconsistency was found
     */
    public String getQuotaName() {
        return quotaName;
    }
}
