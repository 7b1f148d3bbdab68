package monops.batchengine.service.preflight;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import monops.batchengine.config.PlanProperties;

/**
 * Resolves the batch size limit for an account from the configured plan tiers.
 */
@Component
public class PlanLimitResolver {

    private final PlanProperties properties;
    private final Set<String> supporters;

    public PlanLimitResolver(PlanProperties properties) {
        this.properties = properties;
        this.supporters = properties.getSupporters().stream()
            .map(address -> address.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    public int limitFor(String account) {
        return isSupporter(account) ? properties.getSupporterMaxBatchSize() : properties.getFreeMaxBatchSize();
    }

    public boolean isSupporter(String account) {
        return account != null && supporters.contains(account.toLowerCase(Locale.ROOT));
    }
}
