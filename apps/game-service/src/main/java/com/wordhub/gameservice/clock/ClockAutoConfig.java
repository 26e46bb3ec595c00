package com.wordhub.gameservice.clock;

import com.wordhub.gameservice.clock.scheduler.CountdownScheduler;
import com.wordhub.gameservice.clock.scheduler.CountdownSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * 倒计时 Bean 装配：把调度线程池与 Redis 注入通用调度引擎。
 * 线程池由 {@link ClockSchedulerConfig} 提供。
 */
@Configuration
public class ClockAutoConfig {

    @Bean
    public CountdownScheduler countdownScheduler(RedisTemplate<String, Object> redisTemplate,
                                                 @Qualifier("turnClockScheduler") ScheduledThreadPoolExecutor turnClockScheduler) {
        return new CountdownSchedulerImpl(redisTemplate, turnClockScheduler);
    }
}
