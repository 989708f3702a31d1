package com.example.ladder.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RungParseResult {

    public static final int STATUS_OK = 0;
    public static final int STATUS_REJECTED = 1;
    public static final int STATUS_PARSE_ERROR = 2;

    /**
     * 0 = 解析成功
     * 1 = 输入被拒绝（未进入解析）
     * 2 = 结构错误，整条 rung 无效
     */
    private int status;

    /** 错误说明，成功时为 null */
    private String message;

    /** 错误种类，e.g. MalformedBranchEnd；成功时为 null */
    private String errorKind;

    /** 出错 token 下标，-1 表示不适用 */
    private int position;

    private RungSequence sequence;

    public static RungParseResult success(RungSequence sequence) {
        return new RungParseResult(STATUS_OK, null, null, -1, sequence);
    }

    public static RungParseResult rejected(String msg) {
        return new RungParseResult(STATUS_REJECTED, msg, null, -1, null);
    }

    public static RungParseResult failed(String kind, String msg, int position) {
        return new RungParseResult(STATUS_PARSE_ERROR, msg, kind, position, null);
    }

    public boolean isSuccess() {
        return status == STATUS_OK;
    }
}
