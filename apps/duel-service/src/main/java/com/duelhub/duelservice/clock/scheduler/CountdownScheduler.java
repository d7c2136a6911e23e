package com.duelhub.duelservice.clock.scheduler;

/**
 * CountdownScheduler
 * ---------------------------------------
 * 通用倒计时调度器接口，不依赖具体对决规则。
 *
 * 约定：
 *  - 每个 key 同时最多一个倒计时，重复启动会替换旧任务；
 *  - 每秒回调一次 tick，到期回调一次 timeout；
 *  - 广播、判定等业务动作由上层协调器负责。
 */
public interface CountdownScheduler {

    /**
     * 每秒触发一次，报告当前 key 的 owner、绝对截止时间、剩余秒数。
     */
    interface TickListener {
        /**
         * @param key              业务键（如 "duel:{matchId}"）
         * @param owner            被计时的对象（如回合阶段）
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
         * @param key     业务键
         * @param owner   被计时的对象
         * @param version 启动时携带的版本（上层用于识别过期回调）
         */
        void onTimeout(String key, String owner, String version);
    }

    void setTickListener(TickListener listener);

    /**
     * 启动指定 key 的倒计时；已存在则先取消。
     * 截止时间已过时直接回调 timeout，不再调度。
     */
    void start(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout);

    /**
     * 停止指定 key 的倒计时（不打断正在执行的回调）。
     */
    void stop(String key);

    /** 当前是否有该 key 的倒计时在跑 */
    boolean isActive(String key);
}
