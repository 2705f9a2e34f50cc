package com.fleethunt.model;

import java.util.List;

public record AddRuleRequest(
    List<RegexCondition> regexRules,
    List<IntegerCondition> integerRules
) {}
