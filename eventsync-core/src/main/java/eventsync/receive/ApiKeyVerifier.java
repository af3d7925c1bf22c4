package eventsync.receive;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Constant-time comparison of a presented key against the configured one.
 */
final class ApiKeyVerifier {
  private static final String BEARER_PREFIX = "Bearer ";

  private final byte[] expected;

  ApiKeyVerifier(String expectedKey) {
    this.expected = expectedKey == null || expectedKey.isEmpty()
        ? null
        : expectedKey.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * @throws SyncAuthenticationException if no key is configured or the key does not match
   */
  void verify(String presentedKey) {
    if (expected == null) {
      throw new SyncAuthenticationException("No API key configured");
    }
    if (presentedKey == null
        || !MessageDigest.isEqual(expected, presentedKey.getBytes(StandardCharsets.UTF_8))) {
      throw new SyncAuthenticationException("Unauthorized");
    }
  }

  /**
   * Strips a {@code Bearer } prefix from an {@code Authorization} header value.
   */
  static String bearerToken(String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
      return null;
    }
    return authorizationHeader.substring(BEARER_PREFIX.length()).trim();
  }
}
