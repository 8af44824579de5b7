package com.aitimeline.api.service.enhancement;

import com.aitimeline.api.mapper.EnhancementJobMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 재시작 전에 등록만 되고 시작되지 않은 queued 작업을 다시 실행기에 넣는다.
 * processing 작업은 DatabaseInitializer 가 먼저 failed 로 정리한다.
 */
@Slf4j
@Component
@Order(2)
public class QueuedJobResumer implements ApplicationRunner {

    private final EnhancementJobMapper jobMapper;
    private final EnhancementJobProcessor processor;
    private final boolean autoProcess;

    public QueuedJobResumer(EnhancementJobMapper jobMapper,
                            EnhancementJobProcessor processor,
                            @Value("${enhancement.auto-process:true}") boolean autoProcess) {
        this.jobMapper = jobMapper;
        this.processor = processor;
        this.autoProcess = autoProcess;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!autoProcess) {
            log.info("[Enhance] auto-process disabled, queued jobs wait for manual processing");
            return;
        }

        List<Long> jobIds = jobMapper.findQueuedJobIds();
        for (Long jobId : jobIds) {
            processor.processAsync(jobId);
        }
        if (!jobIds.isEmpty()) {
            log.info("[Enhance] resumed {} queued jobs after restart", jobIds.size());
        }
    }
}
