package com.missingtable.sync.service;

import com.missingtable.sync.dto.MatchSnapshot;

import java.util.Optional;

/**
 * Result of identity resolution. {@code adoptExternalId} is true when the row was found
 * by natural key and still lacks the incoming external id.
 */
public record IdentityResolution(Optional<MatchSnapshot> existing, String naturalKey, boolean adoptExternalId) {

    static IdentityResolution found(MatchSnapshot snapshot, String naturalKey, boolean adopt) {
        return new IdentityResolution(Optional.of(snapshot), naturalKey, adopt);
    }

    static IdentityResolution absent(String naturalKey) {
        return new IdentityResolution(Optional.empty(), naturalKey, false);
    }
}
