package com.nfservice.plugboleto.configuration;

import java.time.Duration;

/**
 * Credentials and endpoint settings for the PlugBoleto API.
 *
 * <p>Built once by {@link ApplicationConfiguration} and passed to the transport client
 * constructor. Instances are immutable; switching environment means building a new value.
 */
public final class PlugBoletoProperties {

  static final String PRODUCTION_URL = "https://plugboleto.com.br/api/v1";
  static final String SANDBOX_URL = "https://homologacao.plugboleto.com.br/api/v1";

  private final String cnpjSh;
  private final String tokenSh;
  private final String cnpjCedente;
  private final boolean production;
  private final String baseUrlOverride;
  private final Duration connectTimeout;
  private final Duration readTimeout;

  public PlugBoletoProperties(String cnpjSh, String tokenSh, String cnpjCedente,
      boolean production, String baseUrlOverride, Duration connectTimeout,
      Duration readTimeout) {
    this.cnpjSh = cnpjSh == null ? "" : cnpjSh;
    this.tokenSh = tokenSh == null ? "" : tokenSh;
    this.cnpjCedente = cnpjCedente == null ? "" : cnpjCedente;
    this.production = production;
    this.baseUrlOverride = baseUrlOverride;
    this.connectTimeout = connectTimeout;
    this.readTimeout = readTimeout;
  }

  /** Sandbox settings with the given credentials, used mostly by tests. */
  public static PlugBoletoProperties sandbox(String cnpjSh, String tokenSh, String cnpjCedente) {
    return new PlugBoletoProperties(cnpjSh, tokenSh, cnpjCedente, false, null,
        Duration.ofSeconds(10), Duration.ofSeconds(30));
  }

  public PlugBoletoProperties withBaseUrl(String baseUrl) {
    return new PlugBoletoProperties(cnpjSh, tokenSh, cnpjCedente, production, baseUrl,
        connectTimeout, readTimeout);
  }

  public String getCnpjSh() {
    return cnpjSh;
  }

  public String getTokenSh() {
    return tokenSh;
  }

  public String getCnpjCedente() {
    return cnpjCedente;
  }

  public boolean isProduction() {
    return production;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  /**
   * Resolves the API root. An explicit override wins, otherwise the production flag picks
   * between the production and sandbox hosts.
   */
  public String getBaseUrl() {
    if (baseUrlOverride != null && !baseUrlOverride.isBlank()) {
      return baseUrlOverride.endsWith("/")
          ? baseUrlOverride.substring(0, baseUrlOverride.length() - 1)
          : baseUrlOverride;
    }
    return production ? PRODUCTION_URL : SANDBOX_URL;
  }

  @Override
  public String toString() {
    return "PlugBoletoProperties{cnpjSh=" + cnpjSh + ", cnpjCedente=" + cnpjCedente
        + ", production=" + production + ", baseUrl=" + getBaseUrl() + "}";
  }
}
