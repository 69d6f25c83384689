package com.phonebook.directory.service;

import com.phonebook.directory.model.AuditAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class DirectoryMetrics {

  static final String REQUEST_TOTAL = "directory.request.total";

  public static final String RESULT_SUCCESS = "success";
  public static final String RESULT_INVALID_INPUT = "invalid_input";
  public static final String RESULT_CONFLICT = "conflict";
  public static final String RESULT_NOT_FOUND = "not_found";
  public static final String RESULT_ERROR = "error";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> requestCounters = new ConcurrentHashMap<>();

  public DirectoryMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordRequest(AuditAction action, String result) {
    requestCounters
        .computeIfAbsent(action.tag() + "|" + result, key -> registerCounter(action, result))
        .increment();
  }

  private Counter registerCounter(AuditAction action, String result) {
    return Counter.builder(REQUEST_TOTAL)
        .description("Directory API calls by action and outcome")
        .tags(Tags.of("action", action.tag(), "result", result))
        .register(meterRegistry);
  }
}
