package com.whenthen.infrastructure.persistence.playlet.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.whenthen.infrastructure.persistence.playlet.entity.PlayletDO;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface PlayletMapper extends BaseMapper<PlayletDO> {
}
