package com.flamingo.ai.knowledge.domain.enums;

/** Usage counters recorded per tenant and day. */
public enum UsageMetric {
  RETRIEVALS
}
