package com.whenthen.client.dto;

import lombok.Data;

import java.io.Serializable;

/**
 * Response - 接口响应基类
 * <p>
 * 命令被拒绝时 success 为 false，errCode 为命令结果码（如 DUPLICATE_ASSIGNMENT）。
 * </p>
 */
@Data
public class Response implements Serializable {
    private static final long serialVersionUID = 1L;

    private boolean success = true;
    private String errCode;
    private String errMessage;

    public static Response buildSuccess() {
        return new Response();
    }

    public static Response buildFailure(String errCode, String errMessage) {
        Response response = new Response();
        response.markFailed(errCode, errMessage);
        return response;
    }

    protected void markFailed(String errCode, String errMessage) {
        this.success = false;
        this.errCode = errCode;
        this.errMessage = errMessage;
    }
}
