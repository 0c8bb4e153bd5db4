package com.starscape.phototriage.features.grouprules.app;

import com.starscape.phototriage.common.config.TriageProperties;
import com.starscape.phototriage.features.grouprules.app.rules.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class GroupRuleCatalog {
    
    @Bean
    public GroupRuleEngine groupRuleEngine(TriageProperties properties) {
        return new GroupRuleEngine(rules(properties.getGroupRules()));
    }
    
    /**
     * Group rules in priority order.
     */
    public static List<GroupRule> rules(TriageProperties.GroupRules config) {
        return List.of(
            new ThumbnailRule(config.getThumbnailMarkers(), config.getThumbnailMaxDistance()),
            new PreviewRule(),
            new OlderLibraryCopyRule(),
            new PhotoBoothFilteredRule(),
            new ResolutionDerivativeRule(config.getDerivativeMaxDistance(), config.getDerivativeResolutionRatio()),
            new GenericNameRule(),
            new SameResolutionDuplicateRule(config.getTieBreakMaxDistance())
        );
    }
}
