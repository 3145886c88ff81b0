package com.whenthen.infrastructure.persistence.playlet.converter;

import com.whenthen.domain.playlet.ConditionLogic;
import com.whenthen.domain.playlet.FileFilter;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.playlet.PlayletAction;
import com.whenthen.domain.playlet.TriggerCondition;
import com.whenthen.domain.playlet.TriggerConfig;
import com.whenthen.domain.playlet.TriggerType;
import com.whenthen.infrastructure.persistence.JsonColumns;
import com.whenthen.infrastructure.persistence.playlet.entity.PlayletDO;

/**
 * PlayletConverter - Playlet 转换器
 * <p>
 * 负责领域对象与数据对象之间的转换，sortOrder 由仓储维护
 * </p>
 */
public class PlayletConverter {

    public static PlayletDO toDataObject(Playlet domain) {
        if (domain == null) {
            return null;
        }

        PlayletDO dataObject = new PlayletDO();
        dataObject.setId(domain.getId());
        dataObject.setName(domain.getName());
        dataObject.setEnabled(domain.isEnabled());
        dataObject.setTriggerConfig(JsonColumns.toMap(domain.getTrigger()));
        dataObject.setConditionLogic(domain.getConditionLogic() != null
                ? domain.getConditionLogic().getCode() : ConditionLogic.AND.getCode());
        dataObject.setConditions(JsonColumns.toMaps(domain.getConditions()));
        dataObject.setFileFilter(JsonColumns.toMap(domain.getFileFilter()));
        dataObject.setActions(JsonColumns.toMaps(domain.getActions()));
        dataObject.setCreatedAt(domain.getCreatedAt());
        return dataObject;
    }

    public static Playlet toDomain(PlayletDO dataObject) {
        if (dataObject == null) {
            return null;
        }

        Playlet domain = new Playlet();
        domain.setId(dataObject.getId());
        domain.setName(dataObject.getName());
        domain.setEnabled(dataObject.getEnabled() == null || dataObject.getEnabled());
        TriggerConfig trigger = JsonColumns.fromMap(dataObject.getTriggerConfig(), TriggerConfig.class);
        domain.setTrigger(trigger != null ? trigger : TriggerConfig.of(TriggerType.TORRENT_ADDED));
        domain.setConditionLogic(ConditionLogic.fromCode(dataObject.getConditionLogic()));
        domain.setConditions(JsonColumns.fromMaps(dataObject.getConditions(), TriggerCondition.class));
        domain.setFileFilter(JsonColumns.fromMap(dataObject.getFileFilter(), FileFilter.class));
        domain.setActions(JsonColumns.fromMaps(dataObject.getActions(), PlayletAction.class));
        domain.setCreatedAt(dataObject.getCreatedAt());
        return domain;
    }
}
