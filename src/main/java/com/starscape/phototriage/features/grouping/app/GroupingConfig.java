package com.starscape.phototriage.features.grouping.app;

import com.starscape.phototriage.common.config.TriageProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class GroupingConfig {
    
    @Bean
    public SameScenePredicate sameScenePredicate(TriageProperties properties) {
        return SameScenePredicate.from(properties.getGrouping());
    }
    
    @Bean
    public SimilarityGrouper similarityGrouper(TriageProperties properties, SameScenePredicate predicate) {
        TriageProperties.Grouping config = properties.getGrouping();
        return new SimilarityGrouper(
            new PairwiseComparator(predicate, config.getComparisonBlockSize()),
            List.of(
                new SingleLinkageStrategy(),
                new CompleteLinkageStrategy(config.getBridgeMinPairs(), config.getBridgeMaxPrimaryDistance())
            )
        );
    }
}
