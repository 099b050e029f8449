package com.nfservice.plugboleto.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.nfservice.plugboleto.configuration.PlugBoletoProperties;
import com.nfservice.plugboleto.exception.TransportFailureException;
import java.io.IOException;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * HTTP-based implementation of {@link PlugBoletoClient} using {@link RestTemplate}.
 *
 * <p>Adds the {@code cnpj-sh}, {@code token-sh} and {@code cnpj-cedente} headers to every
 * call and translates infrastructure failures (HTTP 5xx, timeouts, unreadable bodies) into
 * {@link TransportFailureException}. HTTP 4xx responses carry a regular error envelope and
 * are returned to the caller.
 */
@Component
public class PlugBoletoClientImpl implements PlugBoletoClient {

  private static final Logger LOG = LoggerFactory.getLogger(PlugBoletoClientImpl.class);

  private final RestTemplate restTemplate;
  private final PlugBoletoProperties properties;
  private final ObjectMapper objectMapper;

  public PlugBoletoClientImpl(RestTemplate restTemplate, PlugBoletoProperties properties,
      ObjectMapper objectMapper) {
    this.restTemplate = restTemplate;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public ApiResponse get(String path, MultiValueMap<String, String> params) {
    return execute(HttpMethod.GET, path, null, params, true);
  }

  @Override
  public ApiResponse getBinary(String path, MultiValueMap<String, String> params) {
    return execute(HttpMethod.GET, path, null, params, false);
  }

  @Override
  public ApiResponse post(String path, Object body, MultiValueMap<String, String> params) {
    return execute(HttpMethod.POST, path, body, params, true);
  }

  @Override
  public ApiResponse put(String path, Object body, MultiValueMap<String, String> params) {
    return execute(HttpMethod.PUT, path, body, params, true);
  }

  @Override
  public ApiResponse delete(String path, MultiValueMap<String, String> params) {
    return execute(HttpMethod.DELETE, path, null, params, true);
  }

  private ApiResponse execute(HttpMethod method, String path, Object body,
      MultiValueMap<String, String> params, boolean decode) {
    URI uri = buildUri(path, params);
    HttpEntity<Object> entity = new HttpEntity<>(body, defaultHeaders());
    byte[] content;
    int httpCode;
    try {
      ResponseEntity<byte[]> response = restTemplate.exchange(uri, method, entity, byte[].class);
      content = response.getBody();
      httpCode = response.getStatusCode().value();
    } catch (HttpClientErrorException e) {
      content = e.getResponseBodyAsByteArray();
      httpCode = e.getStatusCode().value();
      LOG.debug("event=plugboleto.client_error method={} path={} httpCode={}", method, path,
          httpCode);
    } catch (HttpServerErrorException e) {
      throw new TransportFailureException("PlugBoleto returned error: " + e.getStatusCode());
    } catch (ResourceAccessException e) {
      throw new TransportFailureException("PlugBoleto is unavailable: " + e.getMessage(), e);
    }

    if (!decode && httpCode == 200) {
      return ApiResponse.binary(content == null ? new byte[0] : content, httpCode);
    }
    return ApiResponse.decoded(readJson(content, path), httpCode);
  }

  private JsonNode readJson(byte[] content, String path) {
    if (content == null || content.length == 0) {
      return NullNode.getInstance();
    }
    try {
      return objectMapper.readTree(content);
    } catch (IOException e) {
      throw new TransportFailureException("Unreadable PlugBoleto response for " + path, e);
    }
  }

  URI buildUri(String path, MultiValueMap<String, String> params) {
    String normalized = path.startsWith("/") ? path : "/" + path;
    UriComponentsBuilder builder =
        UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl() + normalized);
    if (params != null) {
      MultiValueMap<String, String> filtered = new LinkedMultiValueMap<>();
      params.forEach((name, values) -> {
        if (name == null || name.isBlank()) {
          return;
        }
        for (String value : values) {
          if (value != null && !value.isBlank()) {
            filtered.add(name, value);
          }
        }
      });
      builder.queryParams(filtered);
    }
    return builder.encode().build().toUri();
  }

  private HttpHeaders defaultHeaders() {
    HttpHeaders headers = new HttpHeaders();
    headers.set("cnpj-sh", properties.getCnpjSh());
    headers.set("token-sh", properties.getTokenSh());
    headers.set("cnpj-cedente", properties.getCnpjCedente());
    headers.setContentType(MediaType.APPLICATION_JSON);
    return headers;
  }
}
