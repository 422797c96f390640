package com.zust.backend.auth.federation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Provider tag → provider, built once from every {@link OAuthProvider} bean.
 */
@Slf4j
@Component
public class OAuthProviderRegistry {

    private final Map<String, OAuthProvider> providers;

    public OAuthProviderRegistry(List<OAuthProvider> providers) {
        Map<String, OAuthProvider> byName = new LinkedHashMap<>();
        for (OAuthProvider provider : providers) {
            OAuthProvider previous = byName.putIfAbsent(provider.name(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate OAuth provider tag: " + provider.name());
            }
        }
        this.providers = Collections.unmodifiableMap(byName);
        log.info("OAuth providers registered: {}", this.providers.keySet());
    }

    public Optional<OAuthProvider> find(String tag) {
        if (tag == null) return Optional.empty();
        return Optional.ofNullable(providers.get(tag));
    }
}
