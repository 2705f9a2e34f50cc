package com.fleethunt.model;

public record RegexCondition(
    String attributeName,
    String attributeRegex
) {}
