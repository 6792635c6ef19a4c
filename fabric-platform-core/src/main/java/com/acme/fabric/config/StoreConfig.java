package com.acme.fabric.config;

/** Limits for JDBC statements issued by the repositories. Pure POJO - no framework dependencies. */
public class StoreConfig {

  private int statementTimeoutSeconds = 5;

  public int getStatementTimeoutSeconds() {
    return statementTimeoutSeconds;
  }

  public void setStatementTimeoutSeconds(int statementTimeoutSeconds) {
    this.statementTimeoutSeconds = statementTimeoutSeconds;
  }
}
