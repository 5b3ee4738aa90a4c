package com.prakash.studyplanner.config;

import com.prakash.studyplanner.model.BlockType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Placement policy for the suggestion generator, bound to <strong>studyplanner.scheduling</strong>.
 *
 * Example configuration in <code>application.properties</code>:
 * <pre>
 * studyplanner.scheduling.look-ahead-days=14
 * studyplanner.scheduling.default-duration-minutes=60
 * studyplanner.scheduling.eligible-block-types=STUDY,FREE
 * studyplanner.scheduling.insights-enabled=true
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "studyplanner.scheduling")
@Getter
@Setter
public class SchedulingConfig {

    /**
     * Number of days, starting today, over which availability blocks are expanded.
     */
    private int lookAheadDays = 14;

    /**
     * Session length used for assignments without a usable estimate.
     */
    private int defaultDurationMinutes = 60;

    /**
     * Block types sessions may be placed in.
     */
    private Set<BlockType> eligibleBlockTypes = EnumSet.of(BlockType.STUDY, BlockType.FREE);

    /**
     * Whether generation asks the chat model for a study-tips paragraph.
     */
    private boolean insightsEnabled = true;
}
