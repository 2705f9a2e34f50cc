package com.fleethunt.ruleengine.evaluator;

import com.fleethunt.enums.ClientAttribute;
import com.fleethunt.exception.ValidationException;
import com.fleethunt.model.IntegerCondition;
import com.fleethunt.model.RegexCondition;
import com.fleethunt.model.RuleGroup;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks rule well-formedness when a rule group is added, so malformed rules never reach the
 * foreman's active table.
 */
public class RuleValidator {

  public RuleGroup validate(RuleGroup group) {
    if (group == null) {
      throw new ValidationException("Rule group must not be null");
    }
    for (RegexCondition condition : group.regexRules()) {
      validateRegex(condition);
    }
    for (IntegerCondition condition : group.integerRules()) {
      validateInteger(condition);
    }
    return group;
  }

  private void validateRegex(RegexCondition condition) {
    if (condition == null) {
      throw new ValidationException("Regex condition must not be null");
    }
    requireKnownAttribute(condition.attributeName());
    if (condition.attributeRegex() == null) {
      throw new ValidationException(
          "Regex condition on '" + condition.attributeName() + "' has no pattern");
    }
    try {
      Pattern.compile(condition.attributeRegex());
    } catch (PatternSyntaxException ex) {
      throw new ValidationException(
          "Invalid regex '" + condition.attributeRegex() + "' for attribute '"
              + condition.attributeName() + "'", ex);
    }
  }

  private void validateInteger(IntegerCondition condition) {
    if (condition == null) {
      throw new ValidationException("Integer condition must not be null");
    }
    requireKnownAttribute(condition.attributeName());
    if (condition.operator() == null) {
      throw new ValidationException(
          "Integer condition on '" + condition.attributeName() + "' has no operator");
    }
  }

  private void requireKnownAttribute(String attributeName) {
    if (ClientAttribute.fromAttributeName(attributeName).isEmpty()) {
      throw new ValidationException("Unknown client attribute: '" + attributeName + "'");
    }
  }
}
