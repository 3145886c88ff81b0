package com.whenthen.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * MultiResponse - 携带列表的响应
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class MultiResponse<T> extends Response {
    private List<T> data = new ArrayList<>();

    public static <T> MultiResponse<T> of(List<T> data) {
        MultiResponse<T> response = new MultiResponse<>();
        response.setData(data != null ? data : new ArrayList<>());
        return response;
    }

    public int getTotal() {
        return data.size();
    }
}
