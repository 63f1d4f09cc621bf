package io.xrdinfo.application.globalconf;

import io.xrdinfo.domain.error.TrustException;
import java.security.InvalidAlgorithmParameterException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.Signature;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;
import java.util.Locale;
import java.util.Map;

/**
 * Maps algorithm identifiers used in configuration directories to JCA implementations.
 *
 * <p>Both XML-DSig/XML-Enc URIs and plain JCA names are accepted. Anything else is a {@link TrustException}: a
 * directory whose algorithms cannot be checked cannot be trusted.</p>
 */
final class CryptoAlgorithms {
  private static final Map<String, String> DIGESTS = Map.ofEntries(
      Map.entry("http://www.w3.org/2000/09/xmldsig#sha1", "SHA-1"),
      Map.entry("http://www.w3.org/2001/04/xmldsig-more#sha224", "SHA-224"),
      Map.entry("http://www.w3.org/2001/04/xmlenc#sha256", "SHA-256"),
      Map.entry("http://www.w3.org/2001/04/xmldsig-more#sha384", "SHA-384"),
      Map.entry("http://www.w3.org/2001/04/xmlenc#sha512", "SHA-512"),
      Map.entry("SHA-1", "SHA-1"),
      Map.entry("SHA-224", "SHA-224"),
      Map.entry("SHA-256", "SHA-256"),
      Map.entry("SHA-384", "SHA-384"),
      Map.entry("SHA-512", "SHA-512"));

  private static final Map<String, SignatureSpec> SIGNATURES = Map.ofEntries(
      Map.entry("http://www.w3.org/2001/04/xmldsig-more#rsa-sha256", SignatureSpec.plain("SHA256withRSA")),
      Map.entry("http://www.w3.org/2001/04/xmldsig-more#rsa-sha384", SignatureSpec.plain("SHA384withRSA")),
      Map.entry("http://www.w3.org/2001/04/xmldsig-more#rsa-sha512", SignatureSpec.plain("SHA512withRSA")),
      Map.entry("http://www.w3.org/2007/05/xmldsig-more#sha256-rsa-MGF1", SignatureSpec.pss("SHA-256")),
      Map.entry("http://www.w3.org/2007/05/xmldsig-more#sha384-rsa-MGF1", SignatureSpec.pss("SHA-384")),
      Map.entry("http://www.w3.org/2007/05/xmldsig-more#sha512-rsa-MGF1", SignatureSpec.pss("SHA-512")),
      Map.entry("http://www.w3.org/2001/04/xmldsig-more#ecdsa-sha256", SignatureSpec.plain("SHA256withECDSA")),
      Map.entry("http://www.w3.org/2001/04/xmldsig-more#ecdsa-sha384", SignatureSpec.plain("SHA384withECDSA")),
      Map.entry("http://www.w3.org/2001/04/xmldsig-more#ecdsa-sha512", SignatureSpec.plain("SHA512withECDSA")),
      Map.entry("SHA256WITHRSA", SignatureSpec.plain("SHA256withRSA")),
      Map.entry("SHA384WITHRSA", SignatureSpec.plain("SHA384withRSA")),
      Map.entry("SHA512WITHRSA", SignatureSpec.plain("SHA512withRSA")),
      Map.entry("SHA256WITHECDSA", SignatureSpec.plain("SHA256withECDSA")),
      Map.entry("SHA384WITHECDSA", SignatureSpec.plain("SHA384withECDSA")),
      Map.entry("SHA512WITHECDSA", SignatureSpec.plain("SHA512withECDSA")));

  private CryptoAlgorithms() {}

  static MessageDigest digest(String identifier) throws TrustException {
    String key = identifier.trim();
    String name = DIGESTS.get(key);
    if (name == null) {
      name = DIGESTS.get(key.toUpperCase(Locale.ROOT));
    }
    if (name == null) {
      throw new TrustException("Unsupported digest algorithm: " + identifier);
    }
    try {
      return MessageDigest.getInstance(name);
    } catch (NoSuchAlgorithmException ex) {
      throw new TrustException("Digest algorithm not available: " + identifier, ex);
    }
  }

  static Signature signature(String identifier) throws TrustException {
    String key = identifier.trim();
    SignatureSpec spec = SIGNATURES.get(key);
    if (spec == null) {
      spec = SIGNATURES.get(key.toUpperCase(Locale.ROOT));
    }
    if (spec == null) {
      throw new TrustException("Unsupported signature algorithm: " + identifier);
    }
    try {
      Signature signature = Signature.getInstance(spec.jcaName());
      if (spec.pssDigest() != null) {
        signature.setParameter(pssParameters(spec.pssDigest()));
      }
      return signature;
    } catch (NoSuchAlgorithmException | InvalidAlgorithmParameterException ex) {
      throw new TrustException("Signature algorithm not available: " + identifier, ex);
    }
  }

  // Salt length equals the digest length.
  private static PSSParameterSpec pssParameters(String digest) {
    return switch (digest) {
      case "SHA-256" -> new PSSParameterSpec(digest, "MGF1", MGF1ParameterSpec.SHA256, 32, 1);
      case "SHA-384" -> new PSSParameterSpec(digest, "MGF1", MGF1ParameterSpec.SHA384, 48, 1);
      default -> new PSSParameterSpec(digest, "MGF1", MGF1ParameterSpec.SHA512, 64, 1);
    };
  }

  private record SignatureSpec(String jcaName, String pssDigest) {
    static SignatureSpec plain(String jcaName) {
      return new SignatureSpec(jcaName, null);
    }

    static SignatureSpec pss(String digest) {
      return new SignatureSpec("RSASSA-PSS", digest);
    }
  }
}
