package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Return file upload: the file content and the CNAB layout it was written in. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReturnFileRequest {

  private String content;
  private String layout = "400";

  public String getContent() {
    return content;
  }

  public void setContent(String content) {
    this.content = content;
  }

  public String getLayout() {
    return layout;
  }

  public void setLayout(String layout) {
    this.layout = layout;
  }
}
