package com.flamingo.ai.knowledge.exception;

/** Exception thrown when a bounded backend call exceeds its time limit. */
public class CallTimeoutException extends KnowledgeRetrievalException {

  private final String callName;

  public CallTimeoutException(String callName, Throwable cause) {
    super(
        "Call '" + callName + "' timed out",
        "The request took too long to complete. Please try again.",
        cause);
    this.callName = callName;
  }

  public String getCallName() {
    return callName;
  }
}
