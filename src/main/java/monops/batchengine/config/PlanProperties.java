package monops.batchengine.config;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Batch size tiers. Supporters are listed explicitly; everyone else gets the free tier.
 */
@Data
@Component
@ConfigurationProperties(prefix = "monops.plan")
public class PlanProperties {

    private int freeMaxBatchSize = 10;

    private int supporterMaxBatchSize = 1000;

    /** Addresses on the supporter tier, any case. */
    private List<String> supporters = new ArrayList<>();
}
