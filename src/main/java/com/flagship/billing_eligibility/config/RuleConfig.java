package com.flagship.billing_eligibility.config;

import com.flagship.billing_eligibility.rules.BaselineEligibilityRule;
import com.flagship.billing_eligibility.rules.ImageFloorEligibilityRule;
import com.flagship.billing_eligibility.rules.RuleRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers every rule version the service knows. Append new versions here;
 * never edit or remove a registered one.
 */
@Configuration
public class RuleConfig {

    @Bean
    public RuleRegistry ruleRegistry(EligibilityProperties properties) {
        return new RuleRegistry(
                new BaselineEligibilityRule(),
                new ImageFloorEligibilityRule(properties.getRules().getMinImages())
        );
    }
}
