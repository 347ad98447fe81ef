package io.codescalpel.license;

/**
 * Signing algorithms accepted on license tokens.
 */
public enum JwtAlgorithm {

    /**
     * RSA with SHA-256. The production mode: licenses are signed offline and
     * verified against an embedded public key.
     */
    RS256,

    /**
     * HMAC with SHA-256. Development only; rejected unless explicitly enabled.
     */
    HS256;

    /**
     * Look up an algorithm by its JOSE header name.
     *
     * @return the algorithm, or null if unsupported
     */
    public static JwtAlgorithm fromHeader(String alg) {
        if (alg == null) {
            return null;
        }
        for (JwtAlgorithm a : values()) {
            if (a.name().equals(alg)) {
                return a;
            }
        }
        return null;
    }
}
