package com.example.ladder.util;

import com.example.ladder.model.RungBranch;
import com.example.ladder.model.RungElement;
import com.example.ladder.model.RungSequence;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class JsonUtils {

    /**
     * 序列转 JSON 树：
     * { "elements": [...], "branches": { id: {rootBranchId, startPosition, endPosition, nestedBranches:[id...]} } }
     * nestedBranches 只写 id，完整记录在 branches 里按 id 查。
     */
    public static ObjectNode toTree(ObjectMapper mapper, RungSequence sequence) {
        ObjectNode root = mapper.createObjectNode();

        ArrayNode elements = root.putArray("elements");
        for (RungElement e : sequence.getElements()) {
            elements.add(mapper.<JsonNode>valueToTree(e));
        }

        ObjectNode branches = root.putObject("branches");
        for (RungBranch b : sequence.getBranches().branches()) {
            ObjectNode node = branches.putObject(b.getBranchId());
            node.put("rootBranchId", b.getRootBranchId());
            node.put("startPosition", b.getStartPosition());
            node.put("endPosition", b.getEndPosition());
            ArrayNode nested = node.putArray("nestedBranches");
            for (RungBranch child : b.getNestedBranches()) {
                nested.add(child.getBranchId());
            }
        }
        return root;
    }

    public static String toJson(ObjectMapper mapper, RungSequence sequence) {
        try {
            return mapper.writeValueAsString(toTree(mapper, sequence));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rung sequence", e);
        }
    }
}
