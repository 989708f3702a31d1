package com.example.ladder.config;

import com.example.ladder.parser.SequenceBuilder;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Setter
@Getter
@Component
@ConfigurationProperties(prefix = "ladder.parser")
public class RungParserProperties {

    /** 顶层分支 id 前缀，e.g. branch_ -> branch_0, branch_1 ... */
    private String branchIdPrefix = SequenceBuilder.DEFAULT_BRANCH_ID_PREFIX;

    /** 解析成功后以 DEBUG 输出整条序列 */
    private boolean logSequence = false;

    /** rung 文本最大长度，0 表示不限制 */
    private int maxTextLength = 0;

    public boolean exceedsMaxLength(String text) {
        return maxTextLength > 0 && text != null && text.length() > maxTextLength;
    }
}
