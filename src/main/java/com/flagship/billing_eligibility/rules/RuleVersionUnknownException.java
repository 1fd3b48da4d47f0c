package com.flagship.billing_eligibility.rules;

import com.flagship.billing_eligibility.exception.EligibilityException;
import lombok.Getter;

import java.util.Set;

@Getter
public class RuleVersionUnknownException extends EligibilityException {

    private final String ruleVersion;

    public RuleVersionUnknownException(String ruleVersion, Set<String> registered) {
        super(String.format("Unknown rule version '%s'. Registered: %s", ruleVersion, registered));
        this.ruleVersion = ruleVersion;
    }

    @Override
    public String getErrorCode() {
        return "RULE_VERSION_UNKNOWN";
    }
}
