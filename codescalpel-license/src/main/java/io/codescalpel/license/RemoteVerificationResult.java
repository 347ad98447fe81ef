package io.codescalpel.license;

/**
 * Outcome of a remote verification call.
 *
 * <p>Exactly one of {@code entitlements} and {@code message} is set. Entitlements
 * only ever come from a verifier response; a failure never carries a default record.
 *
 * @param entitlements what the verifier reported, null on failure
 * @param failure why the call failed, {@link Failure#NONE} on success
 * @param message failure description, safe to log (no token material)
 */
public record RemoteVerificationResult(
    VerifiedEntitlements entitlements,
    Failure failure,
    String message
) {

    public enum Failure {
        NONE,
        /** Timeout, DNS failure, connection refused or interrupted. */
        NETWORK,
        /** Non-2xx status or a body that is not a verifier response. */
        PROTOCOL,
        /** The endpoint resolved to an untrusted or non-HTTP(S) URL. */
        UNTRUSTED_URL
    }

    public static RemoteVerificationResult success(VerifiedEntitlements entitlements) {
        return new RemoteVerificationResult(entitlements, Failure.NONE, null);
    }

    public static RemoteVerificationResult failure(Failure failure, String message) {
        return new RemoteVerificationResult(null, failure, message);
    }

    public boolean succeeded() {
        return failure == Failure.NONE;
    }
}
