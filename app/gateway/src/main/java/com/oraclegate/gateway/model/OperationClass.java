package com.oraclegate.gateway.model;

/** Selects which quota counter and limit a request is charged against. */
public enum OperationClass {
  /** Read-style tool calls (price, analysis, health). */
  GENERAL,
  /** Calls with real-world cost such as on-chain oracle feeds. */
  COST_SENSITIVE
}
