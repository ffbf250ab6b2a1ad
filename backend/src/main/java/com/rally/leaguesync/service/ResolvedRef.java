package com.rally.leaguesync.service;

/** Id of a reference row found or created by the {@link EntityResolver}. */
public record ResolvedRef(Long id, boolean created) {
}
