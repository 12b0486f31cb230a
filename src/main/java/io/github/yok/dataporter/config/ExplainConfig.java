package io.github.yok.dataporter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code explain} section in {@code application.yml}. Controls
 * the timeline image produced by the {@code explain} command.
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "explain")
@Data
public class ExplainConfig {

    /**
     * PNG file written when {@code --output} is not given.
     */
    private String outputFile = "explain_plan.png";

    /**
     * Image width in pixels.
     */
    private int width = 3000;

    /**
     * Image height in pixels.
     */
    private int height = 1800;

    /**
     * Column at which operation labels are wrapped on the y axis.
     */
    private int labelWrapWidth = 20;
}
