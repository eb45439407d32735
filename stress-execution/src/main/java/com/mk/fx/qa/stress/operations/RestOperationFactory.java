package com.mk.fx.qa.stress.operations;

import com.mk.fx.qa.stress.executors.RequestContext;
import com.mk.fx.qa.stress.model.ClientOperation;
import com.mk.fx.qa.stress.model.NamedOperation;
import com.mk.fx.qa.stress.rest.HttpMethod;
import com.mk.fx.qa.stress.rest.Request;
import com.mk.fx.qa.stress.rest.RestResponseData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/** Builds the operation table from configured REST calls. */
@Slf4j
public final class RestOperationFactory {

  static final int RANDOM_ID_BOUND = 1_000_000;

  private RestOperationFactory() {
    throw new UnsupportedOperationException("RestOperationFactory cannot be instantiated");
  }

  /**
   * Converts each configured call into a named operation, preserving order. An empty or missing list yields a
   * single {@code GET /}.
   *
   * @throws IllegalArgumentException on an unknown HTTP method or a duplicate name
   */
  public static List<NamedOperation> create(List<RestOperationSpec> specs) {
    if (specs == null || specs.isEmpty()) {
      log.info("No operations configured, defaulting to GET /");
      return List.of(new NamedOperation("GET /", forSpec(RestOperationSpec.builder().name("GET /").build())));
    }

    List<NamedOperation> operations = new ArrayList<>(specs.size());
    for (RestOperationSpec spec : specs) {
      var name = spec.getName() != null && !spec.getName().isBlank() ? spec.getName() : defaultName(spec);
      if (operations.stream().anyMatch(o -> o.name().equals(name))) {
        throw new IllegalArgumentException("Duplicate operation name: " + name);
      }
      operations.add(new NamedOperation(name, forSpec(spec)));
    }
    return List.copyOf(operations);
  }

  static ClientOperation forSpec(RestOperationSpec spec) {
    var method = parseMethod(spec.getMethod());
    var path = spec.getPath() != null ? spec.getPath() : "/";
    var headers = spec.getHeaders() != null ? Map.copyOf(spec.getHeaders()) : Map.<String, String>of();
    return context -> {
      var request = buildRequest(spec, method, path, headers, context);
      CompletableFuture<RestResponseData> response =
          context.client().sendAsync(request, context.remaining());
      return response.thenApply(data -> verifyStatus(spec, data, method, path));
    };
  }

  static Request buildRequest(
      RestOperationSpec spec,
      HttpMethod method,
      String path,
      Map<String, String> headers,
      RequestContext context) {
    Map<String, String> query = new LinkedHashMap<>();
    if (spec.isRandomQuery()) {
      query.put("id", Integer.toString(context.nextRandomInt(0, RANDOM_ID_BOUND)));
    }
    Object body = spec.getBody();
    if (body == null && spec.getRandomPayloadLength() > 0) {
      body = context.nextRandomString(spec.getRandomPayloadLength());
    }
    return Request.builder()
        .method(method)
        .path(path)
        .headers(headers)
        .query(query)
        .body(body)
        .build();
  }

  private static RestResponseData verifyStatus(
      RestOperationSpec spec, RestResponseData data, HttpMethod method, String path) {
    var status = data.getStatusCode();
    var accepted = spec.getExpectedStatus() != null ? status == spec.getExpectedStatus() : status < 400;
    if (!accepted) {
      throw new UnexpectedStatusException(status, method.name(), path);
    }
    return data;
  }

  private static HttpMethod parseMethod(String method) {
    if (method == null || method.isBlank()) {
      return HttpMethod.GET;
    }
    try {
      return HttpMethod.valueOf(method.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unsupported HTTP method: " + method, e);
    }
  }

  private static String defaultName(RestOperationSpec spec) {
    return parseMethod(spec.getMethod()).name() + " " + (spec.getPath() != null ? spec.getPath() : "/");
  }
}
