package de.levingamer8.launcherauth.auth;

/**
 * Why a login, refresh or token call failed. Callers switch on this to decide between
 * "ask the user again", "try later" and "tell the user what is missing".
 */
public enum AuthFailure {
    /** Missing or malformed caller input. */
    VALIDATION,
    /** Required configuration (e.g. the Microsoft client id) is not set. */
    CONFIGURATION,
    /** The provider answered with something we cannot use. */
    PROTOCOL,
    /** Non-success HTTP status. */
    HTTP,
    /** The Microsoft account has no Xbox account attached. */
    NO_LINKED_ACCOUNT,
    /** The account does not own Minecraft. */
    NO_ENTITLEMENT,
    /** The stored account has no refresh token. */
    NO_REFRESH_TOKEN,
    TIMEOUT,
    /** Connection-level failure before any HTTP status was seen. */
    NETWORK,
    /** The account store could not persist the result. */
    STORAGE,
    /** No account with the given uuid. */
    NOT_FOUND;

    /** Failures that say nothing about the credentials themselves. */
    public boolean isTransient() {
        return this == TIMEOUT || this == NETWORK;
    }
}
