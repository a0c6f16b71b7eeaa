package com.acme.wizard.step;

import com.acme.wizard.context.ContextView;
import java.util.Map;

/** A reusable validation rule over a step's local data. Must be free of I/O. */
@FunctionalInterface
public interface StepValidator {

  void validate(ContextView context, Map<String, Object> data, ValidationResult.Builder result);

  static StepValidator required(String field, String message) {
    return (context, data, result) -> {
      Object value = data.get(field);
      if (value == null || (value instanceof String s && s.isBlank())) {
        result.error(field, message);
      }
    };
  }
}
