package dev.orderscanner.email;

import java.util.Optional;

/**
 * Access tokens for the email provider, keyed by owner. Filled by the
 * authentication layer.
 */
public interface AccessTokenStore {

    Optional<String> findToken(String ownerKey);

    void store(String ownerKey, String accessToken);

    void revoke(String ownerKey);
}
