package com.whenthen.domain.matcher;

import com.whenthen.domain.playlet.ConditionField;
import com.whenthen.domain.playlet.ConditionLogic;
import com.whenthen.domain.playlet.ConditionOperator;
import com.whenthen.domain.playlet.SizeOperator;
import com.whenthen.domain.playlet.TriggerCondition;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * ConditionEvaluator - 条件求值器
 * <p>
 * 纯函数：判断一组条件在给定逻辑下是否匹配一个种子。
 * 空条件列表恒为 true；非法正则视为不匹配，不抛异常。
 * </p>
 */
@Slf4j
public class ConditionEvaluator {

    private static final double BYTES_PER_MB = 1024d * 1024d;

    public boolean matches(List<TriggerCondition> conditions, ConditionLogic logic, MatchSubject subject) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        if (logic == ConditionLogic.OR) {
            return conditions.stream().anyMatch(c -> evaluate(c, subject));
        }
        return conditions.stream().allMatch(c -> evaluate(c, subject));
    }

    /**
     * 求值单个条件，已包含 negate
     */
    public boolean evaluate(TriggerCondition condition, MatchSubject subject) {
        ConditionField field = condition.getField() != null ? condition.getField() : ConditionField.NAME;
        if (field.isNumeric()) {
            Double actual = numericAttribute(field, subject);
            if (actual == null) {
                log.debug("Condition {} skipped: {} unavailable for '{}'", condition.getId(), field.getCode(), subject.getName());
                return false;
            }
            return applyNegate(condition, compareNumeric(condition, actual));
        }
        return applyNegate(condition, compareName(condition, subject.getName()));
    }

    private boolean applyNegate(TriggerCondition condition, boolean result) {
        return condition.isNegate() != result;
    }

    private Double numericAttribute(ConditionField field, MatchSubject subject) {
        if (field == ConditionField.TOTAL_SIZE) {
            return subject.getTotalBytes() == null ? null : subject.getTotalBytes() / BYTES_PER_MB;
        }
        return subject.getFileCount() == null ? null : subject.getFileCount().doubleValue();
    }

    private boolean compareNumeric(TriggerCondition condition, double actual) {
        Double start = condition.getNumericValue();
        if (start == null) {
            // unconfigured numeric condition
            return true;
        }
        SizeOperator operator = condition.getSizeOperator() != null ? condition.getSizeOperator() : SizeOperator.GT;
        switch (operator) {
            case LT:
                return actual < start;
            case BETWEEN:
                double end = condition.getNumericValueEnd() != null ? condition.getNumericValueEnd() : start;
                return actual >= start && actual <= end;
            case GT:
            default:
                return actual > start;
        }
    }

    private boolean compareName(TriggerCondition condition, String rawName) {
        String name = rawName == null ? "" : rawName;
        String value = condition.getValue() == null ? "" : condition.getValue();
        String lowerName = name.toLowerCase(Locale.ROOT);
        String lowerValue = value.toLowerCase(Locale.ROOT);
        ConditionOperator operator = condition.getOperator() != null ? condition.getOperator() : ConditionOperator.CONTAINS;
        switch (operator) {
            case NOT_CONTAINS:
                return !lowerName.contains(lowerValue);
            case STARTS_WITH:
                return lowerName.startsWith(lowerValue);
            case ENDS_WITH:
                return lowerName.endsWith(lowerValue);
            case EQUALS:
                return lowerName.equals(lowerValue);
            case REGEX:
                return findRegex(value, name);
            case CONTAINS:
            default:
                return lowerName.contains(lowerValue);
        }
    }

    private boolean findRegex(String pattern, String name) {
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(name).find();
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex '{}' treated as non-matching: {}", pattern, e.getDescription());
            return false;
        }
    }
}
