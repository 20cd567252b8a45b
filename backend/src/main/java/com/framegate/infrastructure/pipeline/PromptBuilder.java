package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.model.RetryAction;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

@Component
public class PromptBuilder {

    private static final int HASH_LENGTH = 16;

    public BuiltPrompt build(PromptTemplates templates,
                             String characterId,
                             String moveId,
                             int frameIndex,
                             int totalFrames,
                             int attemptIndex,
                             RetryAction strategy,
                             boolean loopClosure) {
        Map<String, String> vars = Map.of(
                "{frame_index}", String.valueOf(frameIndex),
                "{total_frames}", String.valueOf(totalFrames),
                "{attempt_index}", String.valueOf(attemptIndex),
                "{character_id}", characterId,
                "{move_id}", moveId);

        StringBuilder prompt = new StringBuilder(render(selectTemplate(templates, frameIndex, attemptIndex, strategy), vars));
        StringBuilder negative = new StringBuilder(templates.negative());

        String directive = strategy.getPromptDirective();
        if (directive != null) {
            if (strategy == RetryAction.TIGHTEN_NEGATIVE) {
                negative.append('\n').append(directive);
            } else {
                prompt.append("\n\n").append(directive);
            }
        }
        if (loopClosure) {
            prompt.append("\n\n").append(render(templates.loopClosure(), vars));
        }

        String p = prompt.toString();
        String n = negative.toString();
        return new BuiltPrompt(p, n, hash(p + "\n--\n" + n));
    }

    String selectTemplate(PromptTemplates templates, int frameIndex, int attemptIndex, RetryAction strategy) {
        if (strategy.isReAnchor()) {
            return templates.lock();
        }
        if (frameIndex == 0 && attemptIndex == 1) {
            return templates.master();
        }
        return templates.variation();
    }

    private static String render(String template, Map<String, String> vars) {
        String result = template;
        for (Map.Entry<String, String> e : vars.entrySet()) {
            result = result.replace(e.getKey(), e.getValue());
        }
        return result;
    }

    static String hash(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
