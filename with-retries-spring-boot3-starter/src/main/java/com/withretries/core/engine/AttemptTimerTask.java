package com.withretries.core.engine;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 时间轮上的等待任务
 * 让时间轮返回的 Timeout 能识别所属的调用, 停机时据此结束未到期的调用
 */
final class AttemptTimerTask implements TimerTask {

    private final AttemptLoop<?, ?, ?> loop;

    AttemptTimerTask(AttemptLoop<?, ?, ?> loop) {
        this.loop = loop;
    }

    @Override
    public void run(Timeout timeout) {
        if (timeout.isCancelled()) {
            return;
        }
        loop.resume();
    }

    AttemptLoop<?, ?, ?> getLoop() {
        return loop;
    }
}
