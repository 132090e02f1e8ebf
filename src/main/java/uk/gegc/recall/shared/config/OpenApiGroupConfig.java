package uk.gegc.recall.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per feature area.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi cardsGroup() {
        return GroupedOpenApi.builder()
                .group("cards")
                .displayName("Cards")
                .pathsToMatch("/api/v1/cards/**")
                .build();
    }

    @Bean
    public GroupedOpenApi reviewGroup() {
        return GroupedOpenApi.builder()
                .group("review")
                .displayName("Review Queue & Answers")
                .pathsToMatch("/api/v1/review/**")
                .build();
    }
}
