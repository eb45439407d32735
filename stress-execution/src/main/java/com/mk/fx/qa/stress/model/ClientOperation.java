package com.mk.fx.qa.stress.model;

import com.mk.fx.qa.stress.executors.RequestContext;
import java.util.concurrent.CompletableFuture;

/**
 * One unit of traffic-generating work. Implementations should honour the context's cancellation
 * token; the returned future may complete normally, be cancelled, or complete exceptionally.
 * Throwing synchronously is treated the same as returning a failed future.
 */
@FunctionalInterface
public interface ClientOperation {

  CompletableFuture<?> invoke(RequestContext context) throws Exception;
}
