package com.wordhub.gameservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 机器人相关线程池，与回合倒计时的线程池分开，互不影响。
 *  - robotScheduler：人类请求返回后，延迟执行机器人回合；
 *  - solverExecutor：最佳走法求解；
 *  - dictionaryCheckExecutor：人类走子后的异步词典校验。
 */
@Configuration
public class RobotSchedulerConfig {

    @Value("${words.robot.solver-threads:2}")
    private int solverThreads;

    @Bean(name = "robotScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService robotScheduler() {
        int poolSize = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
        ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(poolSize, daemon("robot-turn-"));
        exec.setRemoveOnCancelPolicy(true);
        return exec;
    }

    @Bean(name = "solverExecutor", destroyMethod = "shutdownNow")
    public ExecutorService solverExecutor() {
        return new ThreadPoolExecutor(solverThreads, solverThreads, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(64), daemon("word-solver-"), new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "dictionaryCheckExecutor", destroyMethod = "shutdownNow")
    public ExecutorService dictionaryCheckExecutor() {
        // 只推送提示消息，队列满时直接丢弃
        return new ThreadPoolExecutor(1, 1, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(256), daemon("dict-check-"), new ThreadPoolExecutor.DiscardPolicy());
    }

    private static ThreadFactory daemon(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + idx.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
