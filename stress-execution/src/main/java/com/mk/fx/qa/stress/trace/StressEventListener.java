package com.mk.fx.qa.stress.trace;

import com.mk.fx.qa.stress.model.OperationOutcome;

/** Receives every classified outcome. Implementations must be safe for concurrent callers. */
public interface StressEventListener extends AutoCloseable {

  StressEventListener NONE =
      new StressEventListener() {
        @Override
        public void onOutcome(int workerIndex, long iteration, String operation, OperationOutcome outcome) {}

        @Override
        public void close() {}
      };

  void onOutcome(int workerIndex, long iteration, String operation, OperationOutcome outcome);

  @Override
  void close();
}
