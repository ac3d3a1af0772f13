package org.nocodenation.oauth2manager;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Utility class for PKCE (Proof Key for Code Exchange) and state values.
 * <p>
 * This class generates PKCE code verifiers and challenges according to RFC 7636, and the
 * random state values that protect the authorization callback against CSRF.
 */
public final class PkceUtils {

    /** Random bytes behind each verifier and state: 256 bits of entropy. */
    static final int RANDOM_BYTES = 32;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private PkceUtils() {
    }

    /**
     * Class representing PKCE values (code verifier and code challenge).
     * <p>
     * The code challenge is sent with the authorization request; the code verifier is kept
     * and sent when exchanging the authorization code for tokens.
     */
    public static class PkceValues {
        private final String codeVerifier;
        private final String codeChallenge;

        public PkceValues(String codeVerifier, String codeChallenge) {
            this.codeVerifier = codeVerifier;
            this.codeChallenge = codeChallenge;
        }

        public String getCodeVerifier() {
            return codeVerifier;
        }

        /**
         * Gets the PKCE code challenge.
         *
         * @return The code challenge string (BASE64URL-encoded SHA-256 hash of the code verifier)
         */
        public String getCodeChallenge() {
            return codeChallenge;
        }
    }

    /**
     * Generates a fresh code verifier and its S256 code challenge.
     *
     * @return A PkceValues object containing the generated code verifier and challenge
     */
    public static PkceValues generatePkceValues() {
        String codeVerifier = generateCodeVerifier();
        return new PkceValues(codeVerifier, generateCodeChallenge(codeVerifier));
    }

    /**
     * Generates a code verifier according to RFC 7636.
     * <p>
     * The verifier is 32 bytes from a {@link SecureRandom}, BASE64URL-encoded without padding,
     * which yields 43 characters from the unreserved set [A-Z], [a-z], [0-9], "-", "_".
     *
     * @return a random 43-character code verifier
     */
    public static String generateCodeVerifier() {
        return randomUrlSafeString();
    }

    /**
     * Generates a random state value for CSRF protection, with 256 bits of entropy.
     *
     * @return a random URL-safe state string
     */
    public static String generateState() {
        return randomUrlSafeString();
    }

    /**
     * Generates a code challenge from a code verifier according to RFC 7636.
     * <p>
     * The code challenge is the BASE64URL-encoded (no padding) SHA-256 hash of the ASCII
     * representation of the code verifier string.
     *
     * @param codeVerifier the code verifier string
     * @return the BASE64URL-encoded SHA-256 hash of the code verifier
     */
    public static String generateCodeChallenge(String codeVerifier) {
        byte[] challengeBytes = sha256().digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
        return URL_ENCODER.encodeToString(challengeBytes);
    }

    private static String randomUrlSafeString() {
        byte[] bytes = new byte[RANDOM_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return URL_ENCODER.encodeToString(bytes);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
