package dao.tron.anchor.scheduler;

import dao.tron.anchor.config.AnchorProperties;
import dao.tron.anchor.service.FlushEngine;
import dao.tron.anchor.service.FlushResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class BatchingScheduler {

    private final FlushEngine flushEngine;
    private final AnchorProperties props;

    public BatchingScheduler(FlushEngine flushEngine, AnchorProperties props) {
        this.flushEngine = flushEngine;
        this.props = props;
    }

    @Scheduled(cron = "${anchor.flush.schedule:10 0 * * * *}")
    public void tick() {
        if (!props.getFlush().isEnabled()) {
            return;
        }
        try {
            FlushResult result = flushEngine.flush();
            if (result.ran()) {
                log.info("Flush tick done: batch={}, members={}, submitted={}, failed={}, confirmed={}",
                        result.batchRoot(), result.members(), result.submitted(), result.failed(), result.confirmed());
            }
        } catch (Exception e) {
            log.error("Flush tick failed: {}", e.getMessage(), e);
        }
    }
}
