package io.socialcomply.platform.integration.storage;

import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.OutputStream;

/** {@link ObjectResponseSink} over a servlet response. */
public class ServletResponseSink implements ObjectResponseSink {

  private final HttpServletResponse response;

  public ServletResponseSink(HttpServletResponse response) {
    this.response = response;
  }

  @Override
  public void setHeader(String name, String value) {
    response.setHeader(name, value);
  }

  @Override
  public OutputStream body() throws IOException {
    return response.getOutputStream();
  }
}
