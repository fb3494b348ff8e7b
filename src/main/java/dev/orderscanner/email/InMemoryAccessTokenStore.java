package dev.orderscanner.email;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryAccessTokenStore implements AccessTokenStore {

    private final Map<String, String> tokens = new ConcurrentHashMap<>();

    @Override
    public Optional<String> findToken(String ownerKey) {
        return Optional.ofNullable(tokens.get(ownerKey));
    }

    @Override
    public void store(String ownerKey, String accessToken) {
        tokens.put(ownerKey, accessToken);
    }

    @Override
    public void revoke(String ownerKey) {
        tokens.remove(ownerKey);
    }
}
