package com.argument.mapping.argweave.service.llm;

import com.argument.mapping.argweave.exception.SynthesisException;
import com.argument.mapping.argweave.service.graph.PremiseCluster;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Claim synthesizer backed by a chat model.
 * The model is asked for strict JSON and is told to compress, never to add facts;
 * the rewirer still checks the reply independently.
 */
@Slf4j
@RequiredArgsConstructor
public class LlmClaimSynthesizer implements ClaimSynthesizer {

    private static final String SYSTEM_PROMPT = """
You are an expert in argument analysis. Your task is to synthesize one intermediate claim
from a cluster of related premises that all support the same target claim.

CRITICAL CONSTRAINTS:
1. ONLY summarize what is directly stated or implied by the premises
2. DO NOT add new facts, statistics, names, or external knowledge
3. DO NOT introduce numbers unless present in the premises
4. Keep the synthetic claim SHORT (at most %d words)
5. The claim must be general enough to be supported by ALL premises in the cluster

Your role is COMPRESSION and SUMMARIZATION, not inference of new information.

Respond with raw JSON only, no markdown:
{"text": "...", "label": "...", "coherent": true, "confidence": 0.0, "reasoning": "..."}

Set coherent=false when the premises do not share a clear theme.
""";

    private final ChatLanguageModel chatLanguageModel;
    private final ObjectMapper objectMapper;
    private final int maxWords;

    @Override
    public SynthesizedClaim synthesize(PremiseCluster cluster) {
        log.debug("Requesting synthetic claim for {} ({} premises)", cluster.getClusterId(), cluster.size());

        SystemMessage systemMessage = SystemMessage.from(String.format(SYSTEM_PROMPT, maxWords));
        UserMessage userMessage = UserMessage.from(buildUserPrompt(cluster));
        Response<AiMessage> response = chatLanguageModel.generate(systemMessage, userMessage);

        if (response == null || response.content() == null || response.content().text() == null) {
            throw new SynthesisException("Empty model reply for cluster " + cluster.getClusterId());
        }
        return parse(response.content().text(), cluster.getClusterId());
    }

    private String buildUserPrompt(PremiseCluster cluster) {
        StringBuilder prompt = new StringBuilder();
        if (cluster.getTargetText() != null) {
            prompt.append("Target claim: ").append(cluster.getTargetText()).append("\n\n");
        }
        prompt.append("Premises (").append(cluster.size()).append("):\n");
        for (int i = 0; i < cluster.getPremiseTexts().size(); i++) {
            prompt.append("  ").append(i + 1).append(". ").append(cluster.getPremiseTexts().get(i)).append("\n");
        }
        prompt.append("\nReturn the synthesized intermediate claim.");
        return prompt.toString();
    }

    SynthesizedClaim parse(String reply, String clusterId) {
        String json = stripCodeFence(reply.trim());
        try {
            JsonNode root = objectMapper.readTree(json);
            String text = root.path("text").asText("");
            if (text.isBlank()) {
                throw new SynthesisException("Model reply for cluster " + clusterId + " has no claim text");
            }
            return SynthesizedClaim.builder()
                    .text(text.trim())
                    .label(root.hasNonNull("label") ? root.get("label").asText() : null)
                    .coherent(root.path("coherent").asBoolean(false))
                    .confidence(root.path("confidence").asDouble(0.0))
                    .reasoning(root.path("reasoning").asText(null))
                    .build();
        } catch (JsonProcessingException e) {
            throw new SynthesisException("Unparseable model reply for cluster " + clusterId, e);
        }
    }

    private String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int lastFence = text.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, lastFence).trim();
    }
}
