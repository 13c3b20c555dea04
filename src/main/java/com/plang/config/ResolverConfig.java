package com.plang.config;

import com.plang.conflict.ConflictResolver;

/**
 * Conflict resolver settings.
 *
 * @param signatureLength Leading entry-block instructions compared when looking for action conflicts
 */
public record ResolverConfig(int signatureLength) {

    public static ResolverConfig defaults() {
        return new ResolverConfig(ConflictResolver.DEFAULT_SIGNATURE_LENGTH);
    }
}
