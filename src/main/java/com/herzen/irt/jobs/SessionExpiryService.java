package com.herzen.irt.jobs;

import com.herzen.irt.fitting.ModelCache;
import com.herzen.irt.repository.AnalysisResultJdbcRepository;
import com.herzen.irt.repository.DatasetJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class SessionExpiryService {
    private static final Logger log = LoggerFactory.getLogger(SessionExpiryService.class);

    private final DatasetJdbcRepository datasets;
    private final AnalysisResultJdbcRepository results;
    private final ModelCache modelCache;
    private final Clock clock;

    public SessionExpiryService(DatasetJdbcRepository datasets,
                                AnalysisResultJdbcRepository results,
                                ModelCache modelCache,
                                Clock clock) {
        this.datasets = datasets;
        this.results = results;
        this.modelCache = modelCache;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${irt.sessions.purge-fixed-delay-ms:300000}")
    public void scheduledPurge() {
        purgeExpired();
    }

    public List<String> purgeExpired() {
        Instant now = clock.instant();
        List<String> expired = datasets.purgeExpired(now);
        int rows = results.purgeExpired(now);
        expired.forEach(modelCache::invalidate);
        if (!expired.isEmpty() || rows > 0) {
            log.info("Purged {} expired datasets and {} result/status rows", expired.size(), rows);
        }
        return expired;
    }
}
