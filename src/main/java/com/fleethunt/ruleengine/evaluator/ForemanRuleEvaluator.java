package com.fleethunt.ruleengine.evaluator;

import com.fleethunt.enums.ClientAttribute;
import com.fleethunt.model.ClientRecord;
import com.fleethunt.model.ForemanRule;
import com.fleethunt.model.IntegerCondition;
import com.fleethunt.model.RegexCondition;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ForemanRuleEvaluator {

  private static final Logger log = LoggerFactory.getLogger(ForemanRuleEvaluator.class);

  private final ClientAttributeExtractor attributeExtractor;
  private final ConditionEvaluator conditionEvaluator;

  public ForemanRuleEvaluator(ClientAttributeExtractor attributeExtractor,
                              ConditionEvaluator conditionEvaluator) {
    this.attributeExtractor = attributeExtractor;
    this.conditionEvaluator = conditionEvaluator;
  }

  /**
   * A rule matches when every regex and integer condition in it holds.
   */
  public boolean matches(ForemanRule rule, ClientRecord client) {
    for (RegexCondition condition : rule.regexRules()) {
      if (!matchesRegex(condition, client)) {
        return false;
      }
    }
    for (IntegerCondition condition : rule.integerRules()) {
      if (!matchesInteger(condition, client)) {
        return false;
      }
    }
    return true;
  }

  private boolean matchesRegex(RegexCondition condition, ClientRecord client) {
    Optional<ClientAttribute> attribute = ClientAttribute.fromAttributeName(condition.attributeName());
    if (attribute.isEmpty()) {
      log.debug("Skipping regex condition on unknown attribute '{}'", condition.attributeName());
      return false;
    }
    return conditionEvaluator.evaluate(
        condition, attributeExtractor.extractString(client, attribute.get()));
  }

  private boolean matchesInteger(IntegerCondition condition, ClientRecord client) {
    Optional<ClientAttribute> attribute = ClientAttribute.fromAttributeName(condition.attributeName());
    if (attribute.isEmpty()) {
      log.debug("Skipping integer condition on unknown attribute '{}'", condition.attributeName());
      return false;
    }
    return conditionEvaluator.evaluate(
        condition, attributeExtractor.extractInteger(client, attribute.get()));
  }
}
