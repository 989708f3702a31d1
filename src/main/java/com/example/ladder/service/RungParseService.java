package com.example.ladder.service;

import com.example.ladder.config.RungParserProperties;
import com.example.ladder.model.RungParseResult;
import com.example.ladder.model.RungSequence;
import com.example.ladder.parser.RungParseException;
import com.example.ladder.parser.RungTokenizer;
import com.example.ladder.parser.SequenceBuilder;
import com.example.ladder.rung.Rung;
import com.example.ladder.util.JsonUtils;
import com.example.ladder.util.RungSequencePrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * rung 文本解析入口：分词 + 构建序列。
 * 每次解析都新建 SequenceBuilder，可以并发调用。
 */
@Slf4j
@Service
public class RungParseService {

    private final RungParserProperties properties;
    private final ObjectMapper objectMapper;
    private final RungTokenizer tokenizer = new RungTokenizer();

    public RungParseService(RungParserProperties properties,
                            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public RungParseResult parse(String text) {
        if (text == null) {
            return RungParseResult.rejected("Rung text is null");
        }
        if (properties.exceedsMaxLength(text)) {
            log.warn("Rung rejected, length={} exceeds max={}", text.length(), properties.getMaxTextLength());
            return RungParseResult.rejected("Rung text longer than " + properties.getMaxTextLength() + " characters");
        }

        try {
            return RungParseResult.success(parseOrThrow(text));
        } catch (RungParseException e) {
            log.warn("Rung failed to parse. kind={}, position={}, msg={}", e.getKind(), e.getPosition(), e.getMessage());
            return RungParseResult.failed(e.getKind(), e.getMessage(), e.getPosition());
        }
    }

    /**
     * @throws RungParseException 结构错误
     */
    public RungSequence parseOrThrow(String text) {
        SequenceBuilder builder = new SequenceBuilder(properties.getBranchIdPrefix());
        RungSequence seq = builder.buildSequence(tokenizer.tokenize(text));
        if (properties.isLogSequence() && log.isDebugEnabled()) {
            log.debug("Parsed rung '{}':\n{}", text, RungSequencePrinter.prettyPrint(seq));
        }
        return seq;
    }

    public Rung newRung(int number, String text) {
        return new Rung(number, text, tokenizer, properties.getBranchIdPrefix());
    }

    public String toJson(RungSequence sequence) {
        return JsonUtils.toJson(objectMapper, sequence);
    }
}
