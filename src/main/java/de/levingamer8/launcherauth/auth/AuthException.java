package de.levingamer8.launcherauth.auth;

/**
 * Typed failure of a provider call. {@link #status()} is {@code -1} when no HTTP status was
 * received; {@link #hop()} is only set for the Microsoft chain.
 */
public class AuthException extends Exception {

    private final AuthFailure failure;
    private final int status;
    private final String providerMessage;
    private final MicrosoftAuthChain.Hop hop;

    public AuthException(AuthFailure failure, String message) {
        this(failure, message, -1, null, null, null);
    }

    public AuthException(AuthFailure failure, String message, Throwable cause) {
        this(failure, message, -1, null, null, cause);
    }

    private AuthException(AuthFailure failure, String message, int status, String providerMessage,
                          MicrosoftAuthChain.Hop hop, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.status = status;
        this.providerMessage = providerMessage;
        this.hop = hop;
    }

    public static AuthException http(int status, String providerMessage, String message) {
        return new AuthException(AuthFailure.HTTP, message, status, providerMessage, null, null);
    }

    public static AuthException of(AuthFailure failure, int status, String providerMessage, String message) {
        return new AuthException(failure, message, status, providerMessage, null, null);
    }

    /** Same failure, attributed to a hop of the Microsoft chain. */
    public AuthException at(MicrosoftAuthChain.Hop hop) {
        if (this.hop != null) return this;
        AuthException e = new AuthException(failure, hop.label() + ": " + getMessage(), status, providerMessage, hop, getCause());
        e.setStackTrace(getStackTrace());
        return e;
    }

    public AuthFailure failure() { return failure; }
    public int status() { return status; }
    public String providerMessage() { return providerMessage; }
    public MicrosoftAuthChain.Hop hop() { return hop; }
}
