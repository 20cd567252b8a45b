package com.framegate.infrastructure.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.framegate.domain.frame.exception.ConfigException;
import com.framegate.domain.frame.model.RunManifest;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SHA-256 over canonical (sorted-key) JSON of the manifest, the resolved settings and the
 * anchor bytes. Equal fingerprints mean a persisted run can be resumed as-is.
 */
@Component
public class ManifestFingerprint {

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .findAndAddModules()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.INDENT_OUTPUT, false)
            .build();

    public String compute(RunManifest manifest, PipelineSettings settings, byte[] anchorBytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            Map<String, Object> canonical = new LinkedHashMap<>();
            canonical.put("manifest", manifest);
            canonical.put("settings", settings);
            digest.update(canonicalMapper.writeValueAsBytes(canonical));
            digest.update("\n".getBytes(StandardCharsets.UTF_8));
            digest.update(anchorBytes);
            return HexFormat.of().formatHex(digest.digest());
        } catch (JsonProcessingException e) {
            throw new ConfigException("Manifest could not be serialized for fingerprinting", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
