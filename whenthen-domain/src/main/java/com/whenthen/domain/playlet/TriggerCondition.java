package com.whenthen.domain.playlet;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TriggerCondition - 匹配条件
 * <p>
 * 字符串字段使用 operator 与 value 比较（忽略大小写）；
 * 数值字段使用 sizeOperator 与 numericValue / numericValueEnd 比较，total_size 以 MB 计。
 * </p>
 *
 * @author whenthen
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerCondition {

    private String id;

    @Builder.Default
    private ConditionField field = ConditionField.NAME;

    @Builder.Default
    private ConditionOperator operator = ConditionOperator.CONTAINS;

    /**
     * 数值运算符，为空时按 gt 处理
     */
    private SizeOperator sizeOperator;

    @Builder.Default
    private String value = "";

    private Double numericValue;

    private Double numericValueEnd;

    /**
     * 对单个条件结果取反
     */
    private boolean negate;
}
