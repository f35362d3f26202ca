package de.levingamer8.launcherauth.account;

/**
 * Outcome of a store mutation. Failures keep their cause so callers can log or retry.
 */
public record StoreResult(Status status, String message, Throwable cause) {

    public enum Status { OK, NOT_FOUND, INVALID, FAILED }

    private static final StoreResult SUCCESS = new StoreResult(Status.OK, null, null);

    public static StoreResult ok() {
        return SUCCESS;
    }

    public static StoreResult notFound(String uuid) {
        return new StoreResult(Status.NOT_FOUND, "No account with uuid " + uuid, null);
    }

    public static StoreResult invalid(String message) {
        return new StoreResult(Status.INVALID, message, null);
    }

    public static StoreResult failed(String message, Throwable cause) {
        return new StoreResult(Status.FAILED, message, cause);
    }

    public boolean isSuccess() {
        return status == Status.OK;
    }
}
