package tw.gc.greyoak.score.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Freezes the bound {@link ScoringProperties} into the {@link ScoringConfig} bundle.
 * A bad configuration stops the application here.
 */
@Configuration
@Slf4j
public class ScoringConfiguration {

    @Bean
    public ScoringConfig scoringConfig(ScoringProperties properties) {
        ScoringConfig config = ScoringConfig.from(properties);
        log.info("⚙️ Scoring config loaded: version={}, sectors={}, hash={}",
                config.getCodeVersion(), config.getSectorGroups().size(), config.getHash());
        return config;
    }
}
