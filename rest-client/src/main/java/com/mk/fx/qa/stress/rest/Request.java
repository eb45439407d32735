package com.mk.fx.qa.stress.rest;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Request {
  private HttpMethod method;
  private String path;
  private Map<String, String> headers;
  private Map<String, String> query;
  private Object body;
}
