package com.scylladb.admin.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/** Shared Jackson configuration for remote payloads and command line output. */
public final class Json {
  /** Mapper used for every remote payload; tolerant of unknown fields and enum values. */
  public static final ObjectMapper MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE, true)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  /** Pretty printing writer for human readable output. */
  public static final ObjectWriter PRETTY_WRITER = MAPPER.writer().withDefaultPrettyPrinter();

  private Json() {}
}
