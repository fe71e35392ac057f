package com.aiadvent.techdebt.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A single detected issue. Serialized with the field names the report renderers already read
 * ({@code type}, {@code effort}, {@code cwe}); the identifier is a stable hash of kind, file
 * and line so unchanged input always yields the same ids.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
  "id",
  "type",
  "severity",
  "category",
  "file",
  "line",
  "message",
  "effort",
  "businessImpact",
  "cwe"
})
public record Finding(
    @JsonProperty("type") FindingKind kind,
    Severity severity,
    String file,
    Integer line,
    String message,
    @JsonProperty("effort") int effortMinutes,
    @JsonProperty("cwe") String weaknessId) {

  private static final int ID_LENGTH = 8;

  public Finding {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(file, "file");
    message = message != null ? message : "";
    effortMinutes = Math.max(0, effortMinutes);
  }

  public static Finding of(
      FindingKind kind, Severity severity, String file, Integer line, String message, int effort) {
    return new Finding(kind, severity, file, line, message, effort, null);
  }

  @JsonProperty("id")
  public String id() {
    String key = kind.code() + ":" + file + ":" + (line != null ? line : 0);
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(key.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash).substring(0, ID_LENGTH);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }

  @JsonProperty("category")
  public FindingCategory category() {
    return kind.category();
  }

  @JsonProperty("businessImpact")
  public String businessImpact() {
    return severity.businessImpact();
  }

  @JsonIgnore
  public boolean isSecurity() {
    return kind.isSecurity();
  }
}
