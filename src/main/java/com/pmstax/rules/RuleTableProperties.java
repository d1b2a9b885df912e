package com.pmstax.rules;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-tax-year overrides of the statutory defaults.
 *
 * <pre>
 * pmstax.rules.overrides[2025-26].section-80c-limit=200000
 * pmstax.rules.overrides[2025-26].ltcg-exemption-limit=150000
 * </pre>
 *
 * Keys are the kebab-case names of {@link StatutoryLimits} properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pmstax.rules")
public class RuleTableProperties {

    private Map<String, Map<String, BigDecimal>> overrides = new LinkedHashMap<>();
}
