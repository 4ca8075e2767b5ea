package com.wangbin.homesync.core.channel;

import com.wangbin.homesync.core.config.SyncProperties;
import lombok.Getter;

/**
 * 重连退避策略（指数退避 + 长间隔重试）。
 * <p>
 * 第 n 次连续失败后的延迟为 base * 2^(n-1)，限制在 [base, max] 内；
 * 连续失败超过阈值后改用固定的长间隔。
 */
@Getter
public class ReconnectPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int maxBackoffAttempts;
    private final long longIntervalMs;

    public ReconnectPolicy(long baseDelayMs, long maxDelayMs, int maxBackoffAttempts, long longIntervalMs) {
        if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("重连延迟配置非法: base=" + baseDelayMs + ", max=" + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxBackoffAttempts = Math.max(1, maxBackoffAttempts);
        this.longIntervalMs = Math.max(longIntervalMs, maxDelayMs);
    }

    public static ReconnectPolicy from(SyncProperties.Push push) {
        return new ReconnectPolicy(push.getReconnectBaseDelayMs(),
                push.getReconnectMaxDelayMs(),
                push.getMaxBackoffAttempts(),
                push.getLongRetryIntervalMs());
    }

    /**
     * 指数退避延迟
     *
     * @param attempt 连续失败次数，从1开始
     */
    public long backoffDelay(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        // 2^62 以上直接取最大值，避免溢出
        if (exponent >= 62) {
            return maxDelayMs;
        }
        long factor = 1L << exponent;
        if (factor > maxDelayMs / baseDelayMs) {
            return maxDelayMs;
        }
        return Math.min(maxDelayMs, Math.max(baseDelayMs, baseDelayMs * factor));
    }

    /**
     * 是否已进入长间隔重试
     */
    public boolean isLongInterval(int attempt) {
        return attempt > maxBackoffAttempts;
    }

    /**
     * 第 attempt 次连续失败后实际使用的重连延迟
     */
    public long nextDelay(int attempt) {
        return isLongInterval(attempt) ? longIntervalMs : backoffDelay(attempt);
    }
}
