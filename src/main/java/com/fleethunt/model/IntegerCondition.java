package com.fleethunt.model;

import com.fleethunt.enums.IntegerOperator;

public record IntegerCondition(
    String attributeName,
    IntegerOperator operator,
    long value
) {}
