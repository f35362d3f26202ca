package de.levingamer8.launcherauth.account;

import java.time.Instant;

public record AccountSummary(
        String uuid,
        String username,
        ProviderType type,
        boolean active,
        Instant lastUsed
) {}
