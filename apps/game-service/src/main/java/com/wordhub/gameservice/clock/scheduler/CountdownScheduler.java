package com.wordhub.gameservice.clock.scheduler;

/**
 * CountdownScheduler
 * ---------------------------------------
 * 通用的“倒计时调度器”接口，不依赖具体游戏。
 *
 *  - 提供启动/恢复/停止/全量恢复；
 *  - 暴露“每秒 tick 回调”和“到期 timeout 回调”；
 *  - 广播、规则判定由上层协调器负责。
 */
public interface CountdownScheduler {

    /**
     * 每秒触发一次，报告 key 的 owner、绝对截止时间、剩余秒数。
     */
    interface TickListener {
        /**
         * @param key              业务键（如 "words:{gameKey}"）
         * @param owner            被计时的一方（玩家 key）
         * @param deadlineEpochMs  绝对截止时间（毫秒）
         * @param remainingSeconds 剩余秒数（服务端计算）
         */
        void onTick(String key, String owner, long deadlineEpochMs, long remainingSeconds);
    }

    /**
     * 到期时回调一次，由上层做权威处理。
     */
    interface TimeoutHandler {
        /**
         * @param version 启动时传入的版本号，上层据此判断回调是否已过期
         */
        void onTimeout(String key, String owner, long version);
    }

    void setTickListener(TickListener listener);

    /**
     * 启动或恢复指定 key 的倒计时；同一 key 的旧任务会先被停掉。
     * 状态会持久化（Redis），用于重启恢复。
     */
    void startOrResume(String key, String owner, long deadlineEpochMs, long version, TimeoutHandler onTimeout);

    /**
     * 停止指定 key 的倒计时并清理持久化状态（幂等）。
     * @return 停止时剩余的毫秒数；没有运行中的倒计时返回 0
     */
    long stop(String key);

    /**
     * 从持久化介质恢复所有未到期的倒计时；已到期的抢到 holder 后直接回调一次超时。
     * @return 恢复的任务数
     */
    int restoreAllActive(TimeoutHandler onTimeout);
}
