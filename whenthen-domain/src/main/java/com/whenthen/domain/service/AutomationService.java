package com.whenthen.domain.service;

import com.whenthen.domain.dispatch.AssignmentResult;
import com.whenthen.domain.event.TorrentEvent;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.task.Task;

import java.util.List;

/**
 * AutomationService - 自动化引擎服务接口
 * <p>
 * 负责核心的控制流逻辑：
 * 1. 接收种子事件并分发给匹配的 Playlet
 * 2. 处理用户对任务与 Playlet 的命令
 * 3. 启动时对账并恢复中断的任务
 * </p>
 * <p>
 * 所有方法都必须在引擎循环上调用。
 * </p>
 */
public interface AutomationService {

    /**
     * 加载并对账已保存的任务，然后开始监听事件
     *
     * @return 被重置为等待状态的任务数
     */
    int start();

    void stop();

    /**
     * 处理种子事件
     * <p>
     * 先更新种子注册表，再交给触发分发器。
     * </p>
     * @param event 发生的事件
     * @return 本次事件创建的任务
     */
    List<Task> onTorrentEvent(TorrentEvent event);

    /**
     * 把种子指派给指定 Playlet
     *
     * @param manual 手动指派跳过触发类型与条件检查
     */
    AssignmentResult assign(long torrentId, String torrentName, String playletId, boolean manual);

    CommandOutcome retryTask(String taskId);

    CommandOutcome removeTask(String taskId);

    CommandOutcome reassignTask(String taskId, String playletId);

    /**
     * 删除全部已完成与已失败的任务
     *
     * @return 删除的任务数
     */
    int clearFinishedTasks();

    /**
     * 保存 Playlet；保存前校验，无效定义抛出 IllegalArgumentException
     */
    Playlet savePlaylet(Playlet playlet);

    /**
     * 启用或停用 Playlet。停用后执行中的任务在下一个行为边界暂停；重新启用时恢复其等待中的任务。
     */
    CommandOutcome setPlayletEnabled(String playletId, boolean enabled);

    CommandOutcome deletePlaylet(String playletId);
}
