package com.fleethunt.model;

import com.fleethunt.exception.ValidationException;
import java.util.List;
import java.util.Objects;

/**
 * One OR-branch of a hunt's matching rules. Every condition in the group must hold.
 */
public record RuleGroup(
    List<RegexCondition> regexRules,
    List<IntegerCondition> integerRules
) {

  public RuleGroup {
    if ((regexRules != null && regexRules.stream().anyMatch(Objects::isNull))
        || (integerRules != null && integerRules.stream().anyMatch(Objects::isNull))) {
      throw new ValidationException("Rule group must not contain null conditions");
    }
    regexRules = regexRules == null ? List.of() : List.copyOf(regexRules);
    integerRules = integerRules == null ? List.of() : List.copyOf(integerRules);
  }
}
