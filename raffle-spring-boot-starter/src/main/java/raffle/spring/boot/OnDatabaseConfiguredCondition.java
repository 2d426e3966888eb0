package raffle.spring.boot;

import org.springframework.boot.autoconfigure.condition.AnyNestedCondition;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;

/**
 * Matches when either {@code raffle.database.url} or {@code raffle.database.path} is set.
 */
class OnDatabaseConfiguredCondition extends AnyNestedCondition {

    OnDatabaseConfiguredCondition() {
        super(ConfigurationPhase.PARSE_CONFIGURATION);
    }

    @ConditionalOnProperty(prefix = "raffle.database", name = "url")
    static class UrlConfigured {
    }

    @ConditionalOnProperty(prefix = "raffle.database", name = "path")
    static class PathConfigured {
    }
}
