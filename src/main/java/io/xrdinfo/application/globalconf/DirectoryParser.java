package io.xrdinfo.application.globalconf;

import io.xrdinfo.application.mime.MimeHeaders;
import io.xrdinfo.application.mime.MimePart;
import io.xrdinfo.application.mime.MultipartReader;
import io.xrdinfo.domain.conf.ConfigurationDirectory;
import io.xrdinfo.domain.conf.DirectoryEntry;
import io.xrdinfo.domain.conf.DirectorySignature;
import io.xrdinfo.domain.error.FormatException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Parses a signed configuration directory into listing rows, directory defaults and the
 * detached signature.
 * <p><strong>Format:</strong> the directory is {@code multipart/related}. Its first part is a {@code multipart/mixed}
 * listing: one header-only part with {@code Expire-date} and {@code Version}, then one part per configuration file
 * carrying {@code Content-identifier}, {@code Content-location}, {@code Hash-algorithm-id}, an optional
 * {@code Expire-date} and the base64 digest as body. The second part carries {@code Signature-algorithm-id}, an
 * optional {@code Verification-certificate-hash} and the base64 signature as body.</p>
 * <p><strong>Signed data:</strong> the complete first part, headers included, exactly as received.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class DirectoryParser {
  private static final Logger log = LoggerFactory.getLogger(DirectoryParser.class);

  static final String CONTENT_IDENTIFIER = "Content-identifier";
  static final String CONTENT_LOCATION = "Content-location";
  static final String HASH_ALGORITHM_ID = "Hash-algorithm-id";
  static final String EXPIRE_DATE = "Expire-date";
  static final String VERSION = "Version";
  static final String SIGNATURE_ALGORITHM_ID = "Signature-algorithm-id";
  static final String VERIFICATION_CERTIFICATE_HASH = "Verification-certificate-hash";

  /**
   * Parses a directory.
   *
   * @param contentType HTTP {@code Content-Type} header value, or {@code null} when the body starts with its own
   *     header block
   * @param body directory bytes
   * @return parsed directory
   * @throws FormatException on missing boundaries, parts or required headers
   */
  public ConfigurationDirectory parse(String contentType, byte[] body) throws FormatException {
    byte[] multipart = body;
    String outerType = contentType;
    if (outerType == null || !isMultipart(outerType)) {
      MimePart leading = MultipartReader.splitHeaders(body);
      Optional<String> declared = leading.headers().get("Content-Type");
      if (declared.isEmpty() || !isMultipart(declared.get())) {
        throw new FormatException("Configuration directory is not a multipart document");
      }
      outerType = declared.get();
      multipart = leading.body();
    }
    String outerBoundary = boundary(outerType, "directory");
    List<MimePart> outer = MultipartReader.split(multipart, outerBoundary);
    if (outer.size() < 2) {
      throw new FormatException("Configuration directory must contain a listing and a signature part (found "
          + outer.size() + ")");
    }

    MimePart listing = outer.get(0);
    String listingType = require(listing.headers(), "Content-Type", "directory listing");
    List<MimePart> rows = MultipartReader.split(listing.body(), boundary(listingType, "directory listing"));

    Instant expireDate = null;
    String version = null;
    List<DirectoryEntry> entries = new ArrayList<>();
    for (MimePart row : rows) {
      MimeHeaders headers = row.headers();
      if (isHeaderBlock(headers)) {
        Optional<String> expire = headers.get(EXPIRE_DATE);
        if (expire.isPresent()) {
          expireDate = parseInstant(expire.get());
        }
        version = headers.get(VERSION).orElse(version);
        continue;
      }
      entries.add(toEntry(row));
    }
    DirectorySignature signature = toSignature(outer.get(1));
    log.debug("Parsed configuration directory version {} with {} entries", version, entries.size());
    return new ConfigurationDirectory(expireDate, version, entries, signature, listing.raw());
  }

  /** The directory header block carries none of the per-entry headers. */
  private static boolean isHeaderBlock(MimeHeaders headers) {
    return headers.get(CONTENT_IDENTIFIER).isEmpty()
        && headers.get(CONTENT_LOCATION).isEmpty()
        && headers.get(HASH_ALGORITHM_ID).isEmpty();
  }

  private static DirectoryEntry toEntry(MimePart row) throws FormatException {
    MimeHeaders headers = row.headers();
    String identifierHeader = require(headers, CONTENT_IDENTIFIER, "directory entry");
    String contentIdentifier = MimeHeaders.mainValue(identifierHeader);
    String instance = MimeHeaders.parameter(identifierHeader, "instance").orElse(null);
    String location = require(headers, CONTENT_LOCATION, contentIdentifier);
    String algorithm = require(headers, HASH_ALGORITHM_ID, contentIdentifier);
    Instant expire = null;
    Optional<String> expireHeader = headers.get(EXPIRE_DATE);
    if (expireHeader.isPresent()) {
      expire = parseInstant(expireHeader.get());
    }
    byte[] digest = decodeBase64(row.body(), contentIdentifier + " digest");
    return new DirectoryEntry(contentIdentifier, instance, location, expire, algorithm, digest);
  }

  private static DirectorySignature toSignature(MimePart part) throws FormatException {
    MimeHeaders headers = part.headers();
    String algorithm = require(headers, SIGNATURE_ALGORITHM_ID, "signature part");
    byte[] certHash = null;
    String certHashAlgorithm = null;
    Optional<String> certHashHeader = headers.get(VERIFICATION_CERTIFICATE_HASH);
    if (certHashHeader.isPresent()) {
      certHash = decodeBase64(
          MimeHeaders.mainValue(certHashHeader.get()).getBytes(StandardCharsets.US_ASCII),
          VERIFICATION_CERTIFICATE_HASH);
      certHashAlgorithm = MimeHeaders.parameter(certHashHeader.get(), "hash-algorithm-id")
          .orElseThrow(() -> new FormatException(VERIFICATION_CERTIFICATE_HASH + " lacks hash-algorithm-id"));
    }
    byte[] value = decodeBase64(part.body(), "signature value");
    return new DirectorySignature(algorithm, value, certHash, certHashAlgorithm);
  }

  private static boolean isMultipart(String contentType) {
    return MimeHeaders.mainValue(contentType).toLowerCase(Locale.ROOT).startsWith("multipart/");
  }

  private static String boundary(String contentType, String what) throws FormatException {
    return MimeHeaders.parameter(contentType, "boundary")
        .filter(value -> !value.isBlank())
        .orElseThrow(() -> new FormatException("Missing multipart boundary for " + what));
  }

  private static String require(MimeHeaders headers, String name, String what) throws FormatException {
    Optional<String> value = headers.get(name).filter(v -> !v.isBlank());
    if (value.isEmpty()) {
      throw new FormatException("Missing " + name + " header in " + what);
    }
    return value.get();
  }

  private static Instant parseInstant(String value) throws FormatException {
    try {
      return OffsetDateTime.parse(value.trim()).toInstant();
    } catch (DateTimeParseException ex) {
      throw new FormatException("Malformed " + EXPIRE_DATE + ": " + value, ex);
    }
  }

  private static byte[] decodeBase64(byte[] text, String what) throws FormatException {
    String compact = new String(text, StandardCharsets.US_ASCII).replaceAll("\\s+", "");
    if (compact.isEmpty()) {
      throw new FormatException("Missing " + what);
    }
    try {
      return Base64.getDecoder().decode(compact);
    } catch (IllegalArgumentException ex) {
      throw new FormatException("Malformed base64 in " + what, ex);
    }
  }
}
