package br.com.fantasydraft.backend.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "draft")
public class DraftProperties {

    private int defaultTimeLimitSeconds = 60;
    private int defaultEntitiesPerTeam = 6;
    private int defaultBudgetPerTeam = 100;
    private int defaultMaxTeams = 8;
    private int maxTeamsLimit = 16;
    private int defaultAuctionDurationSeconds = 60;
    private int defaultStartingBid = 1;
    private int presenceTimeoutSeconds = 120;

    private Sweep sweep = new Sweep();

    @Data
    public static class Sweep {
        private boolean enabled = true;
        private long intervalMs = 1000;
        private long lockTtlMs = 5000;
        private int poolSize = 2;
        private String threadNamePrefix = "draft-sweep-";
    }
}
