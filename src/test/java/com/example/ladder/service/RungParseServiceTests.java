package com.example.ladder.service;

import com.example.ladder.Application;
import com.example.ladder.config.RungParserProperties;
import com.example.ladder.model.RungParseResult;
import com.example.ladder.model.RungSequence;
import com.example.ladder.parser.MalformedBranchContinuationException;
import com.example.ladder.rung.Rung;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = Application.class)
class RungParseServiceTests {

    @Autowired
    private RungParseService rungParseService;

    @Autowired
    private RungParserProperties properties;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void bindsTestProperties() {
        assertEquals("br_", properties.getBranchIdPrefix());
        assertTrue(properties.isLogSequence());
        assertEquals(200, properties.getMaxTextLength());
    }

    @Test
    void parsesValidRung() {
        RungParseResult result = rungParseService.parse("XIC(A)[XIC(B),XIC(C)]OTE(D);");

        assertTrue(result.isSuccess());
        assertEquals(RungParseResult.STATUS_OK, result.getStatus());
        RungSequence seq = result.getSequence();
        assertEquals(7, seq.size());
        assertEquals("br_0", seq.get(1).getBranchId());
        assertEquals("br_0:1", seq.get(3).getBranchId());
    }

    @Test
    void reportsStructuralErrorWithPosition() {
        RungParseResult result = rungParseService.parse("XIC(A)]OTE(B)");

        assertFalse(result.isSuccess());
        assertEquals(RungParseResult.STATUS_PARSE_ERROR, result.getStatus());
        assertEquals("MalformedBranchEnd", result.getErrorKind());
        assertEquals(1, result.getPosition());
        assertNull(result.getSequence());

        RungParseResult comma = rungParseService.parse(",XIC(A)");
        assertEquals("MalformedBranchContinuation", comma.getErrorKind());
        assertEquals(0, comma.getPosition());
    }

    @Test
    void rejectsOverlongOrNullText() {
        String longText = "XIC(A)".repeat(40);

        RungParseResult result = rungParseService.parse(longText);
        assertEquals(RungParseResult.STATUS_REJECTED, result.getStatus());
        assertEquals(RungParseResult.STATUS_REJECTED, rungParseService.parse(null).getStatus());
    }

    @Test
    void parseOrThrowPropagates() {
        assertThrows(MalformedBranchContinuationException.class, () -> rungParseService.parseOrThrow(",XIC(A)"));
    }

    @Test
    void concurrentParsesDoNotShareState() throws Exception {
        String text = "XIC(A)[XIC(B),[XIC(C),XIC(D)]]OTE(E)";
        RungSequence expected = rungParseService.parseOrThrow(text);

        Thread[] threads = new Thread[4];
        RungSequence[] results = new RungSequence[threads.length];
        for (int i = 0; i < threads.length; i++) {
            final int idx = i;
            threads[i] = new Thread(() -> results[idx] = rungParseService.parseOrThrow(text));
            threads[i].start();
        }
        for (Thread t : threads) {
            t.join();
        }
        for (RungSequence r : results) {
            assertEquals(expected, r);
        }
    }

    @Test
    void newRungUsesConfiguredPrefix() {
        Rung rung = rungParseService.newRung(5, "[XIC(A),XIC(B)]");

        assertEquals(5, rung.getNumber());
        assertTrue(rung.getBranches().containsKey("br_0"));
    }

    @Test
    void writesJson() throws Exception {
        String json = rungParseService.toJson(rungParseService.parseOrThrow("XIC(A)[XIC(B),XIC(C)]OTE(D)"));

        JsonNode tree = objectMapper.readTree(json);
        assertEquals(7, tree.get("elements").size());
        assertEquals(5, tree.get("branches").get("br_0").get("endPosition").asInt());
    }
}
