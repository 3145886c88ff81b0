package com.whenthen.infrastructure.executor;

import com.whenthen.domain.executor.ActionContext;
import com.whenthen.domain.executor.ActionExecutor;
import com.whenthen.domain.executor.ActionOutcome;
import com.whenthen.domain.gateway.TorrentGateway;
import com.whenthen.domain.guard.InFlightCommandRegistry;
import com.whenthen.domain.playlet.ActionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * DeleteSourceActionExecutor - 删除源种子，deleteFiles 默认为 true
 * <p>
 * 与用户发起的删除共享在途命令去重，同一种子的删除只发出一次。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeleteSourceActionExecutor implements ActionExecutor {

    static final String COMMAND = "delete";

    private final TorrentGateway torrentGateway;
    private final InFlightCommandRegistry inFlightCommands;

    @Override
    public ActionType type() {
        return ActionType.DELETE_SOURCE;
    }

    @Override
    public CompletableFuture<ActionOutcome> execute(ActionContext context) {
        Object flag = context.getAction().getConfig().get("deleteFiles");
        boolean deleteFiles = flag == null || Boolean.parseBoolean(flag.toString());
        long torrentId = context.getTorrentId();
        log.info("Task {} deleting torrent {} (files: {})", context.getTaskId(), torrentId, deleteFiles);
        return inFlightCommands.dedup(COMMAND, torrentId, () -> torrentGateway.delete(torrentId, deleteFiles))
                .thenApply(ignored -> ActionOutcome.success());
    }
}
