package com.whenthen.domain.executor;

import com.whenthen.domain.gateway.TorrentFile;
import com.whenthen.domain.playlet.FileFilter;
import com.whenthen.domain.playlet.PlayletAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * ActionContext - 执行上下文
 * <p>
 * 文件列表为种子的原始文件，文件过滤原样交给执行器自行解释。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionContext {

    private String taskId;

    private PlayletAction action;

    private long torrentId;

    private String torrentName;

    @Builder.Default
    private List<TorrentFile> files = new ArrayList<>();

    private FileFilter fileFilter;
}
