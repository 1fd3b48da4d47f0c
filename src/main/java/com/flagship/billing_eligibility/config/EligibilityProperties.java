package com.flagship.billing_eligibility.config;

import com.flagship.billing_eligibility.rules.ImageFloorEligibilityRule;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Settings under the {@code eligibility} prefix.
 */
@ConfigurationProperties(prefix = "eligibility")
@Validated
@Getter
@Setter
public class EligibilityProperties {

    @Valid
    private final Publish publish = new Publish();

    @Valid
    private final Vendors vendors = new Vendors();

    @Valid
    private final Rules rules = new Rules();

    @Getter
    @Setter
    public static class Publish {

        /**
         * Environment name. Keys the current pointer and the publish lease.
         */
        @NotBlank
        private String environment = "default";

        @NotBlank
        private String defaultRuleVersion = "v1";

        /**
         * How long a publish lease stays valid before another cycle may take it over.
         */
        @NotNull
        private Duration leaseTtl = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Vendors {

        /**
         * Vendors allowed to own scope packages. Empty accepts any vendor.
         */
        private Set<String> allowed = new LinkedHashSet<>();
    }

    @Getter
    @Setter
    public static class Rules {

        /**
         * Image floor of rule v2. Part of what v2 means: changing it on a
         * deployment that already published v2 snapshots breaks reproducibility.
         */
        @Min(1)
        private int minImages = ImageFloorEligibilityRule.DEFAULT_MIN_IMAGES;
    }
}
