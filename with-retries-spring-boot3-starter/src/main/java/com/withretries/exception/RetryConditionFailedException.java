package com.withretries.exception;

/**
 * retryWhen 判定成功结果仍需重试时产生的失败
 * 与操作异常一样计入尝试次数，耗尽后同样交给 onExhausted 或直接作为失败返回
 */
public class RetryConditionFailedException extends RuntimeException {

    private final transient Object rejectedResult;

    private final int attempt;

    public RetryConditionFailedException(Object rejectedResult, int attempt) {
        super("Failed given condition at attempt " + attempt);
        this.rejectedResult = rejectedResult;
        this.attempt = attempt;
    }

    /** 被 retryWhen 拒绝的结果 */
    public Object getRejectedResult() {
        return rejectedResult;
    }

    public int getAttempt() {
        return attempt;
    }
}
