package com.whenthen.domain.executor;

import com.whenthen.domain.playlet.ActionType;

import java.util.concurrent.CompletableFuture;

/**
 * ActionExecutor - 行为执行器接口
 * <p>
 * 每种行为类型一个实现。执行器自行负责超时，超时以失败结果或异常完成 future 的方式返回。
 * 测试中可以使用记录型的 Mock 实现。
 * </p>
 */
public interface ActionExecutor {

    ActionType type();

    /**
     * 执行一个行为
     * @param context 执行上下文
     * @return 执行结果
     */
    CompletableFuture<ActionOutcome> execute(ActionContext context);
}
