package com.fleethunt.config;

import com.fleethunt.ruleengine.evaluator.ClientAttributeExtractor;
import com.fleethunt.ruleengine.evaluator.ConditionEvaluator;
import com.fleethunt.ruleengine.evaluator.ForemanRuleEvaluator;
import com.fleethunt.ruleengine.evaluator.RuleValidator;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ForemanConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ClientAttributeExtractor clientAttributeExtractor() {
    return new ClientAttributeExtractor();
  }

  @Bean
  public ConditionEvaluator conditionEvaluator() {
    return new ConditionEvaluator();
  }

  @Bean
  public ForemanRuleEvaluator foremanRuleEvaluator(ClientAttributeExtractor extractor,
                                                   ConditionEvaluator conditionEvaluator) {
    return new ForemanRuleEvaluator(extractor, conditionEvaluator);
  }

  @Bean
  public RuleValidator ruleValidator() {
    return new RuleValidator();
  }
}
