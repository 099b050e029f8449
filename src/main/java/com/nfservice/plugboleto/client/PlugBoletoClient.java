package com.nfservice.plugboleto.client;

import org.springframework.util.MultiValueMap;

/**
 * Abstraction over the PlugBoleto REST API.
 *
 * <p>Credential headers, base URL selection and JSON encoding live behind this interface so
 * the services only deal with paths, bodies and envelopes. Error envelopes (HTTP 4xx with
 * {@code _status: erro}) are returned, not thrown; callers inspect them.
 */
public interface PlugBoletoClient {

  /**
   * @throws com.nfservice.plugboleto.exception.TransportFailureException if the service is
   *     unreachable or returns a server error
   */
  ApiResponse get(String path, MultiValueMap<String, String> params);

  /**
   * GET without decoding: a 200 body is returned as raw bytes, any other status is decoded
   * as an envelope.
   */
  ApiResponse getBinary(String path, MultiValueMap<String, String> params);

  ApiResponse post(String path, Object body, MultiValueMap<String, String> params);

  ApiResponse put(String path, Object body, MultiValueMap<String, String> params);

  ApiResponse delete(String path, MultiValueMap<String, String> params);
}
