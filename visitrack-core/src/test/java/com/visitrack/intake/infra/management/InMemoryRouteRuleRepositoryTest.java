package com.visitrack.intake.infra.management;

import com.visitrack.intake.api.config.IntakeConfig;
import com.visitrack.intake.api.config.RouteFilterConfig;
import com.visitrack.intake.api.model.RuleScope;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRouteRuleRepositoryTest {

    @Test
    void seedsFromConfig() {
        IntakeConfig config = IntakeConfig.builder()
                .globalRules(RouteFilterConfig.excluding("/admin/*"))
                .tenantRules("acme", RouteFilterConfig.includingOnly("/shop/*"))
                .build();

        InMemoryRouteRuleRepository repository = InMemoryRouteRuleRepository.from(config);

        assertThat(repository.rulesFor(RuleScope.GLOBAL)).isEqualTo(RouteFilterConfig.excluding("/admin/*"));
        assertThat(repository.rulesFor(RuleScope.tenant("acme")).includeOnly()).hasSize(1);
        assertThat(repository.tenants()).containsExactly("acme");
    }

    @Test
    void unknownTenantHasNoRules() {
        assertThat(new InMemoryRouteRuleRepository().rulesFor(RuleScope.tenant("nobody")))
                .isEqualTo(RouteFilterConfig.EMPTY);
    }

    @Test
    void changesNotifyListenersWithScope() {
        InMemoryRouteRuleRepository repository = new InMemoryRouteRuleRepository();
        List<RuleScope> changed = new ArrayList<>();
        repository.addChangeListener(changed::add);

        repository.reconfigure(RuleScope.tenant("acme"), RouteFilterConfig.excluding("/x"));
        repository.reconfigure(RuleScope.GLOBAL, RouteFilterConfig.excluding("/y"));
        repository.removeTenant("acme");
        repository.removeTenant("acme");

        assertThat(changed).containsExactly(RuleScope.tenant("acme"), RuleScope.GLOBAL, RuleScope.tenant("acme"));
        assertThat(repository.tenants()).isEmpty();
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        InMemoryRouteRuleRepository repository = new InMemoryRouteRuleRepository();
        List<RuleScope> changed = new ArrayList<>();
        repository.addChangeListener(scope -> {
            throw new IllegalStateException("listener bug");
        });
        repository.addChangeListener(changed::add);

        repository.reconfigure(RuleScope.GLOBAL, RouteFilterConfig.EMPTY);

        assertThat(changed).containsExactly(RuleScope.GLOBAL);
    }
}
