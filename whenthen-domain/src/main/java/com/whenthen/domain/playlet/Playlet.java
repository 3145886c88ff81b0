package com.whenthen.domain.playlet;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Playlet - 自动化规则（聚合根）
 * <p>
 * 由触发器、匹配条件、可选的文件过滤和有序的行为列表组成。
 * 行为的顺序在编写时确定，执行时严格按顺序进行。
 * </p>
 *
 * @author whenthen
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Playlet {

    private static final Map<TriggerType, String> TRIGGER_SUFFIX = Map.of(
            TriggerType.DOWNLOAD_COMPLETE, "on complete",
            TriggerType.METADATA_RECEIVED, "on metadata",
            TriggerType.SEEDING_RATIO, "on ratio",
            TriggerType.FOLDER_WATCH, "from folder");

    private String id;

    /**
     * 显示名称，为空时由行为和条件推导
     */
    private String name;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private TriggerConfig trigger = TriggerConfig.of(TriggerType.TORRENT_ADDED);

    @Builder.Default
    private List<PlayletAction> actions = new ArrayList<>();

    @Builder.Default
    private List<TriggerCondition> conditions = new ArrayList<>();

    @Builder.Default
    private ConditionLogic conditionLogic = ConditionLogic.AND;

    private FileFilter fileFilter;

    private Instant createdAt;

    public TriggerType triggerType() {
        return trigger != null && trigger.getType() != null ? trigger.getType() : TriggerType.TORRENT_ADDED;
    }

    public boolean hasTrigger(TriggerType type) {
        return triggerType() == type;
    }

    /**
     * 校验 Playlet 配置有效性
     */
    public void validate() {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Playlet ID cannot be empty");
        }
        if (trigger != null && trigger.getSeedingRatio() != null && trigger.getSeedingRatio() < 0) {
            throw new IllegalArgumentException("Seeding ratio must not be negative. PlayletId: " + id);
        }
        Set<String> actionIds = new HashSet<>();
        for (PlayletAction action : actions) {
            if (action.getId() == null || action.getType() == null) {
                throw new IllegalArgumentException("Every action needs an id and a type. PlayletId: " + id);
            }
            if (!actionIds.add(action.getId())) {
                throw new IllegalArgumentException("Duplicate action id: " + action.getId() + ". PlayletId: " + id);
            }
        }
        for (TriggerCondition condition : conditions) {
            if (condition.getField() == null) {
                throw new IllegalArgumentException("Condition field cannot be null. PlayletId: " + id);
            }
        }
    }

    /**
     * 推导显示名称
     * <p>
     * 有名称时直接返回；否则按 "When {subject} {conditions}, {actions} {trigger}" 拼接，
     * 没有条件时为 "{Actions} {trigger}"，都没有时为 "New playlet"。
     * </p>
     */
    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name.trim();
        }

        String actionStr = actions.stream()
                .map(a -> a.getType().getVerb())
                .collect(Collectors.joining(" & "));
        String suffix = TRIGGER_SUFFIX.getOrDefault(triggerType(), "");

        List<String> filled = conditions.stream()
                .filter(this::isFilled)
                .map(this::describe)
                .collect(Collectors.toList());

        if (!filled.isEmpty()) {
            String condStr = String.join(conditionLogic == ConditionLogic.OR ? " or " : " & ", filled);
            String base = "When " + subject() + " " + condStr;
            if (actionStr.isEmpty()) {
                return base;
            }
            base = base + ", " + actionStr;
            return suffix.isEmpty() ? base : base + " " + suffix;
        }

        if (!actionStr.isEmpty()) {
            String capitalized = Character.toUpperCase(actionStr.charAt(0)) + actionStr.substring(1);
            return suffix.isEmpty() ? capitalized : capitalized + " " + suffix;
        }
        return "New playlet";
    }

    private boolean isFilled(TriggerCondition c) {
        if (c.getField() == ConditionField.NAME) {
            return c.getValue() != null && !c.getValue().isBlank();
        }
        return c.getNumericValue() != null;
    }

    private String describe(TriggerCondition c) {
        String op = c.getSizeOperator() != null ? c.getSizeOperator().getCode() : SizeOperator.GT.getCode();
        switch (c.getField()) {
            case TOTAL_SIZE:
                return "size " + op + " " + formatNumber(c.getNumericValue());
            case FILE_COUNT:
                return "files " + op + " " + formatNumber(c.getNumericValue());
            default:
                String neg = c.isNegate() ? "not " : "";
                return neg + operatorWord(c.getOperator()) + " '" + c.getValue().trim() + "'";
        }
    }

    private String subject() {
        if (fileFilter == null || fileFilter.getCategory() == null) {
            return "any torrent";
        }
        switch (fileFilter.getCategory()) {
            case VIDEO:
                return "video torrents";
            case AUDIO:
                return "audio torrents";
            case SUBTITLE:
                return "subtitle torrents";
            case CUSTOM:
                List<String> exts = fileFilter.getCustomExtensions();
                return exts != null && !exts.isEmpty() ? String.join(", ", exts) + " torrents" : "any torrent";
            default:
                return "any torrent";
        }
    }

    private static String operatorWord(ConditionOperator operator) {
        if (operator == null) {
            return "contains";
        }
        switch (operator) {
            case NOT_CONTAINS:
                return "excludes";
            case STARTS_WITH:
                return "starts with";
            case ENDS_WITH:
                return "ends with";
            case EQUALS:
                return "equals";
            case REGEX:
                return "matches";
            default:
                return "contains";
        }
    }

    private static String formatNumber(Double value) {
        if (value == null) {
            return "";
        }
        return value == Math.rint(value) ? String.valueOf(value.longValue()) : String.valueOf(value);
    }
}
