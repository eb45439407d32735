package com.mk.fx.qa.stress.model;

public enum StressClientState {
  CREATED,
  PROBING,
  RUNNING,
  STOPPING,
  STOPPED
}
