package de.levingamer8.launcherauth.account;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which identity provider issued an account's tokens.
 * MOJANG is the legacy username/password login, MICROSOFT the OAuth login chained through Xbox Live.
 */
public enum ProviderType {
    MOJANG("mojang"),
    MICROSOFT("microsoft");

    private final String id;

    ProviderType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static ProviderType fromString(String s) {
        if (s == null) return MOJANG;
        return switch (s.trim().toLowerCase()) {
            case "microsoft", "msa" -> MICROSOFT;
            default -> MOJANG;
        };
    }
}
