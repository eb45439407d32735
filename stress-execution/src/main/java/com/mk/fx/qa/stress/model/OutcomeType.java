package com.mk.fx.qa.stress.model;

public enum OutcomeType {
  SUCCESS,
  CANCELLED,
  FAILURE
}
