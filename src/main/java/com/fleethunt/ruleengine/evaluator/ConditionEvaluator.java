package com.fleethunt.ruleengine.evaluator;

import com.fleethunt.model.IntegerCondition;
import com.fleethunt.model.RegexCondition;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class ConditionEvaluator {

  private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

  /**
   * Full-string, case-sensitive match of the attribute's string form.
   */
  public boolean evaluate(RegexCondition condition, String actualValue) {
    if (condition == null || actualValue == null || condition.attributeRegex() == null) {
      return false;
    }
    try {
      return compile(condition.attributeRegex()).matcher(actualValue).matches();
    } catch (PatternSyntaxException ex) {
      return false;
    }
  }

  public boolean evaluate(IntegerCondition condition, Long actualValue) {
    if (condition == null || actualValue == null || condition.operator() == null) {
      return false;
    }
    int cmp = Long.compare(actualValue, condition.value());
    return switch (condition.operator()) {
      case LESS_THAN -> cmp < 0;
      case EQUAL -> cmp == 0;
      case GREATER_THAN -> cmp > 0;
    };
  }

  Pattern compile(String regex) {
    return patternCache.computeIfAbsent(regex, Pattern::compile);
  }
}
