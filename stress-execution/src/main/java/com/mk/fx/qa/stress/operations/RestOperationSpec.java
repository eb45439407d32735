package com.mk.fx.qa.stress.operations;

import jakarta.validation.constraints.Min;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One configured REST call, bound from {@code stress.client.operations[*]}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestOperationSpec {

  /** Display name; derived from method and path when blank. */
  private String name;

  @Builder.Default private String method = "GET";

  @Builder.Default private String path = "/";

  @Builder.Default private Map<String, String> headers = new LinkedHashMap<>();

  /** Literal body; serialized as JSON unless it is a string. */
  private Object body;

  /** Adds an {@code id} query parameter drawn from the worker's random source. */
  private boolean randomQuery;

  /** When positive and no body is set, sends a random alphanumeric payload up to this length. */
  @Min(0)
  private int randomPayloadLength;

  /** Required response status; {@code null} accepts any status below 400. */
  private Integer expectedStatus;
}
