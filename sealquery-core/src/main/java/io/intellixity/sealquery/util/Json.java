package io.intellixity.sealquery.util;

import com.fasterxml.jackson.databind.ObjectMapper;

/** Shared Jackson mapper. Configured once; safe to share across threads. */
public final class Json {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private Json() {}

  public static ObjectMapper mapper() {
    return MAPPER;
  }
}
