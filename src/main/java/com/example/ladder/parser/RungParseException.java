package com.example.ladder.parser;

import lombok.Getter;

/**
 * rung 结构解析失败。抛出后整条 rung 视为无效，不会有部分结果。
 */
@Getter
public class RungParseException extends RuntimeException {

    /** 出错 token 的下标，-1 表示不适用 */
    private final int position;

    /** 出错的 token 文本，可能为 null */
    private final String token;

    public RungParseException(String message, int position, String token) {
        super(message);
        this.position = position;
        this.token = token;
    }

    /** 错误种类，等于异常类的简单名去掉 Exception 后缀 */
    public String getKind() {
        String name = getClass().getSimpleName();
        return name.endsWith("Exception") ? name.substring(0, name.length() - "Exception".length()) : name;
    }
}
