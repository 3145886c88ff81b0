package com.whenthen.infrastructure.persistence.playlet;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.playlet.repository.PlayletRepository;
import com.whenthen.infrastructure.persistence.playlet.converter.PlayletConverter;
import com.whenthen.infrastructure.persistence.playlet.entity.PlayletDO;
import com.whenthen.infrastructure.persistence.playlet.mapper.PlayletMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PlayletRepositoryImpl - Playlet 仓储实现
 * <p>
 * 列表按用户排列顺序（sort_order）返回；更新时保留原有顺序。
 * </p>
 */
@Repository
@Validated
public class PlayletRepositoryImpl implements PlayletRepository {

    private final PlayletMapper playletMapper;

    public PlayletRepositoryImpl(PlayletMapper playletMapper) {
        this.playletMapper = playletMapper;
    }

    @Override
    public List<Playlet> findAll() {
        return playletMapper.selectList(
                new LambdaQueryWrapper<PlayletDO>()
                        .orderByAsc(PlayletDO::getSortOrder)
        ).stream()
                .map(PlayletConverter::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Playlet> findById(String playletId) {
        return Optional.ofNullable(PlayletConverter.toDomain(playletMapper.selectById(playletId)));
    }

    @Override
    @Transactional
    public void save(Playlet playlet) {
        PlayletDO dataObject = PlayletConverter.toDataObject(playlet);
        PlayletDO existing = playletMapper.selectById(playlet.getId());
        if (existing == null) {
            dataObject.setSortOrder(nextSortOrder());
            playletMapper.insert(dataObject);
        } else {
            dataObject.setSortOrder(existing.getSortOrder());
            playletMapper.updateById(dataObject);
        }
    }

    @Override
    public void delete(String playletId) {
        playletMapper.deleteById(playletId);
    }

    private int nextSortOrder() {
        PlayletDO last = playletMapper.selectOne(
                new LambdaQueryWrapper<PlayletDO>()
                        .orderByDesc(PlayletDO::getSortOrder)
                        .last("LIMIT 1")
        );
        return last != null && last.getSortOrder() != null ? last.getSortOrder() + 1 : 0;
    }
}
