package com.whenthen.app.parser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.whenthen.app.dto.PlayletBundleYamlDto;
import com.whenthen.app.dto.PlayletYamlDto;
import com.whenthen.domain.playlet.ActionType;
import com.whenthen.domain.playlet.ConditionField;
import com.whenthen.domain.playlet.ConditionLogic;
import com.whenthen.domain.playlet.ConditionOperator;
import com.whenthen.domain.playlet.FileFilter;
import com.whenthen.domain.playlet.FileFilterCategory;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.playlet.PlayletAction;
import com.whenthen.domain.playlet.SizeOperator;
import com.whenthen.domain.playlet.TriggerCondition;
import com.whenthen.domain.playlet.TriggerConfig;
import com.whenthen.domain.playlet.TriggerType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * PlayletYamlParser - 解析 Playlet 的 YAML 定义
 * <p>
 * 支持单个 Playlet，或以 {@code playlets:} 为根的列表。未知的枚举取值抛出 IllegalArgumentException。
 * </p>
 */
@Component
public class PlayletYamlParser {

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public List<Playlet> parse(String yamlContent) {
        try {
            JsonNode root = mapper.readTree(yamlContent);
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new IllegalArgumentException("Playlet YAML is empty");
            }
            if (root.has("playlets")) {
                PlayletBundleYamlDto bundle = mapper.treeToValue(root, PlayletBundleYamlDto.class);
                List<PlayletYamlDto> items = bundle.getPlaylets() != null ? bundle.getPlaylets() : new ArrayList<>();
                return items.stream().map(this::convert).collect(Collectors.toList());
            }
            return List.of(convert(mapper.treeToValue(root, PlayletYamlDto.class)));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse Playlet YAML: " + e.getMessage(), e);
        }
    }

    private Playlet convert(PlayletYamlDto dto) {
        TriggerConfig trigger = TriggerConfig.of(TriggerType.TORRENT_ADDED);
        if (dto.getTrigger() != null) {
            trigger = TriggerConfig.builder()
                    .type(dto.getTrigger().getType() != null
                            ? TriggerType.fromCode(dto.getTrigger().getType()) : TriggerType.TORRENT_ADDED)
                    .seedingRatio(dto.getTrigger().getSeedingRatio())
                    .watchFolder(dto.getTrigger().getWatchFolder())
                    .build();
        }

        List<TriggerCondition> conditions = new ArrayList<>();
        if (dto.getConditions() != null) {
            conditions = dto.getConditions().stream().map(this::convertCondition).collect(Collectors.toList());
        }

        List<PlayletAction> actions = new ArrayList<>();
        if (dto.getActions() != null) {
            actions = dto.getActions().stream().map(this::convertAction).collect(Collectors.toList());
        }

        return Playlet.builder()
                .id(dto.getId() != null && !dto.getId().isBlank() ? dto.getId() : UUID.randomUUID().toString())
                .name(dto.getName())
                .enabled(dto.getEnabled() == null || dto.getEnabled())
                .trigger(trigger)
                .conditionLogic(ConditionLogic.fromCode(dto.getConditionLogic()))
                .conditions(conditions)
                .fileFilter(convertFileFilter(dto.getFileFilter()))
                .actions(actions)
                .build();
    }

    private TriggerCondition convertCondition(PlayletYamlDto.ConditionYamlDto dto) {
        return TriggerCondition.builder()
                .id(dto.getId() != null ? dto.getId() : UUID.randomUUID().toString())
                .field(dto.getField() != null ? ConditionField.fromCode(dto.getField()) : ConditionField.NAME)
                .operator(dto.getOperator() != null ? ConditionOperator.fromCode(dto.getOperator()) : ConditionOperator.CONTAINS)
                .sizeOperator(dto.getSizeOperator() != null ? SizeOperator.fromCode(dto.getSizeOperator()) : null)
                .value(dto.getValue() != null ? dto.getValue() : "")
                .numericValue(dto.getNumericValue())
                .numericValueEnd(dto.getNumericValueEnd())
                .negate(dto.isNegate())
                .build();
    }

    private FileFilter convertFileFilter(PlayletYamlDto.FileFilterYamlDto dto) {
        if (dto == null) {
            return null;
        }
        return FileFilter.builder()
                .category(dto.getCategory() != null ? FileFilterCategory.fromCode(dto.getCategory()) : FileFilterCategory.ALL)
                .customExtensions(dto.getCustomExtensions() != null ? new ArrayList<>(dto.getCustomExtensions()) : new ArrayList<>())
                .selectLargest(dto.isSelectLargest())
                .minSizeMb(dto.getMinSizeMb())
                .namePattern(dto.getNamePattern())
                .build();
    }

    private PlayletAction convertAction(PlayletYamlDto.ActionYamlDto dto) {
        if (dto.getType() == null) {
            throw new IllegalArgumentException("Action type is required");
        }
        PlayletAction action = PlayletAction.create(ActionType.fromCode(dto.getType()));
        if (dto.getId() != null && !dto.getId().isBlank()) {
            action.setId(dto.getId());
        }
        if (dto.getConfig() != null) {
            for (Map.Entry<String, Object> entry : dto.getConfig().entrySet()) {
                action.getConfig().put(entry.getKey(), entry.getValue());
            }
        }
        return action;
    }
}
