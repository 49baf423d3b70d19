package com.withretries.config;

import com.withretries.model.enums.RetryProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 重试执行器配置（绑定前缀：retry）
 *
 * YAML 示例：
 * retry:
 *   wheel:
 *     tick-duration: 10ms
 *     ticks-per-wheel: 512
 *     max-pending-timeouts: 100000
 *   executor:
 *     core-pool-size: 8
 *     max-pool-size: 32
 *     queue-capacity: 1000
 *     keep-alive: 60s
 *   defaults:
 *     profile: standard
 *     max-attempts: 3
 *     initial-delay: 500ms
 *     max-delay: 30s
 *     exponential-backoff: true
 *     jitter: true
 *   shutdown:
 *     await: 30s
 *   log-events: true
 */
@Validated
@ConfigurationProperties(prefix = "retry")
public class RetryCallProperties {

    @Valid
    private Wheel wheel = new Wheel();

    @Valid
    private Exec executor = new Exec();

    @Valid
    private Defaults defaults = new Defaults();

    private Shutdown shutdown = new Shutdown();

    /** 是否注册日志监听器 */
    private boolean logEvents = true;

    // ----------------- 嵌套配置对象 -----------------

    public static class Wheel {
        /** 时间轮刻度，决定等待的最小精度 */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        @Min(1)
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量，<=0 表示不限制 */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Exec {
        @Min(1)
        private int corePoolSize = 8;

        @Min(1)
        private int maxPoolSize = 32;

        /** 任务队列容量 */
        @Min(1)
        private int queueCapacity = 1000;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
    }

    /**
     * 未显式指定策略时使用的默认值
     * 为 null 的项由 profile 决定
     */
    public static class Defaults {
        private RetryProfile profile = RetryProfile.STANDARD;

        @Min(1)
        private Integer maxAttempts;

        private Duration initialDelay;

        /** 最大间隔，null 表示不封顶 */
        private Duration maxDelay;

        private boolean exponentialBackoff = true;

        private boolean jitter = true;

        public RetryProfile getProfile() { return profile; }
        public void setProfile(RetryProfile profile) { this.profile = profile; }
        public Integer getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(Integer maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public boolean isExponentialBackoff() { return exponentialBackoff; }
        public void setExponentialBackoff(boolean exponentialBackoff) { this.exponentialBackoff = exponentialBackoff; }
        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Exec getExecutor() { return executor; }
    public void setExecutor(Exec executor) { this.executor = executor; }

    public Defaults getDefaults() { return defaults; }
    public void setDefaults(Defaults defaults) { this.defaults = defaults; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    public boolean isLogEvents() { return logEvents; }
    public void setLogEvents(boolean logEvents) { this.logEvents = logEvents; }

    /** 以毫秒返回刻度（供 HashedWheelTimer 使用），最小 1ms */
    public long wheelTickMillis() { return Math.max(1, wheel.getTickDuration().toMillis()); }

    /** 线程池 keepAlive 秒 */
    public long executorKeepAliveSeconds() { return executor.getKeepAlive().toSeconds(); }
}
