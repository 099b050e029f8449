package com.nfservice.plugboleto.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response of one PlugBoleto call: the decoded JSON body or, for undecoded binary calls,
 * the raw bytes, plus the HTTP status code.
 */
public final class ApiResponse {

  private final JsonNode body;
  private final byte[] raw;
  private final int httpCode;

  private ApiResponse(JsonNode body, byte[] raw, int httpCode) {
    this.body = body;
    this.raw = raw;
    this.httpCode = httpCode;
  }

  public static ApiResponse decoded(JsonNode body, int httpCode) {
    return new ApiResponse(body, null, httpCode);
  }

  public static ApiResponse binary(byte[] raw, int httpCode) {
    return new ApiResponse(null, raw, httpCode);
  }

  /** Decoded body, or null when the response was kept binary. */
  public JsonNode getBody() {
    return body;
  }

  /** Raw bytes, or null when the response was decoded. */
  public byte[] getRaw() {
    return raw;
  }

  public boolean isDecoded() {
    return body != null;
  }

  public int getHttpCode() {
    return httpCode;
  }

  public ServiceEnvelope envelope() {
    return new ServiceEnvelope(body);
  }
}
