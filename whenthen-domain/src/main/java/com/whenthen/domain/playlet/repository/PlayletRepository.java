package com.whenthen.domain.playlet.repository;

import com.whenthen.domain.playlet.Playlet;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * PlayletRepository - Playlet 仓储接口
 * <p>
 * findAll 的返回顺序即用户排列顺序，特异性打分平局时以此顺序为准，实现必须保证稳定。
 * </p>
 *
 * @author whenthen
 */
public interface PlayletRepository {

    /**
     * 按用户排列顺序返回全部 Playlet
     */
    List<Playlet> findAll();

    Optional<Playlet> findById(@NotBlank String playletId);

    /**
     * 保存 Playlet，新建时追加到末尾
     */
    void save(@NotNull Playlet playlet);

    void delete(@NotBlank String playletId);
}
