package com.nfservice.plugboleto.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Read access to the PlugBoleto response envelope:
 * {@code {"_status": "sucesso"|"erro", "_mensagem": "...", "_dados": ...}}.
 *
 * <p>{@code _dados} is either a {@code _sucesso}/{@code _falha} partitioned object or a flat
 * list, depending on the endpoint.
 */
public final class ServiceEnvelope {

  public static final String STATUS_ERROR = "erro";

  private final JsonNode root;

  public ServiceEnvelope(JsonNode root) {
    this.root = root == null ? MissingNode.getInstance() : root;
  }

  /** True when the body has the envelope's status discriminator. */
  public static boolean isEnvelope(JsonNode node) {
    return node != null && node.isObject() && node.has("_status");
  }

  public boolean isError() {
    return STATUS_ERROR.equalsIgnoreCase(root.path("_status").asText());
  }

  public String getMessage() {
    return root.path("_mensagem").asText("");
  }

  public JsonNode getData() {
    return root.path("_dados");
  }

  /**
   * Collects {@code field} from every item of a list-shaped {@code _dados}, as text for
   * scalars and as compact JSON otherwise. Items without the field contribute nothing.
   */
  public List<String> reasons(String field) {
    List<String> reasons = new ArrayList<>();
    JsonNode data = getData();
    if (!data.isArray()) {
      if (data.has(field)) {
        reasons.add(text(data.get(field)));
      }
      return reasons;
    }
    for (JsonNode item : data) {
      if (item.has(field) && !item.get(field).isNull()) {
        reasons.add(text(item.get(field)));
      }
    }
    return reasons;
  }

  static String text(JsonNode node) {
    return node.isValueNode() ? node.asText() : node.toString();
  }
}
