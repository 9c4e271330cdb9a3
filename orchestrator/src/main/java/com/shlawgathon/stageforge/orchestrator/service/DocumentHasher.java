package com.shlawgathon.stageforge.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprint of a working document's JSON form. Map keys are written
 * in sorted order, so equal documents hash equally regardless of insertion order.
 */
public class DocumentHasher {

    private final ObjectMapper objectMapper;

    public DocumentHasher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalStateException if the document holds values Jackson cannot serialize
     */
    public String hash(WorkingDocument document) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(document);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Working document is not JSON-serializable: " + e.getOriginalMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
