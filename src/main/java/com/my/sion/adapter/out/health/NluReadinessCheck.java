package com.my.sion.adapter.out.health;

import com.my.sion.adapter.out.rules.RuleTableLoader;
import com.my.sion.config.AppConfig;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class NluReadinessCheck implements HealthCheck {

    private final RuleTableLoader ruleTableLoader;
    private final AppConfig appConfig;

    public NluReadinessCheck(RuleTableLoader ruleTableLoader, AppConfig appConfig) {
        this.ruleTableLoader = ruleTableLoader;
        this.appConfig = appConfig;
    }

    @Override
    public HealthCheckResponse call() {
        int intentRules = ruleTableLoader.intentRuleTable().size();
        int entityRules = ruleTableLoader.entityPatternTable().size();
        return HealthCheckResponse.named("nlu-readiness")
                .withData("intentRules", intentRules)
                .withData("entityKinds", entityRules)
                .withData("classifier", appConfig.nlu().classifier())
                .withData("zoneId", appConfig.nlu().zoneId())
                .status(intentRules > 0 && entityRules > 0)
                .build();
    }
}
