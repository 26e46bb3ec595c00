package com.wordhub.gameservice.clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 回合倒计时专用线程池。
 *
 * 1. 核心线程数取 scheduler.clock.corePoolSize；
 * 2. 线程命名为 turn-clock-N，守护线程；
 * 3. 任务满时 DiscardPolicy 直接丢弃（丢掉的只是某一帧 tick）；
 * 4. setRemoveOnCancelPolicy(true)，cancel 后从队列移除。
 */
@Configuration
public class ClockSchedulerConfig {

    @Value("${scheduler.clock.corePoolSize:2}")
    private int corePoolSize;

    @Bean(name = "turnClockScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor turnClockScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "turn-clock-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
