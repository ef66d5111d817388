package com.mediapipeline.service;

import com.mediapipeline.exception.InvalidUploadEventException;
import com.mediapipeline.model.RenditionSpec;
import com.mediapipeline.model.UploadEvent;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

@Service
public class UploadEventValidator {

    // Ids become path segments of the output keys
    private static final Pattern VALID_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-.@]+$");

    private static final int MAX_OBJECT_KEY_LENGTH = 1024;

    /**
     * Rejects events that no retry could fix.
     *
     * @throws InvalidUploadEventException on a missing or unsafe required field, or an unknown rendition
     */
    public void validate(UploadEvent event) {
        if (event == null) {
            throw new InvalidUploadEventException("Upload event is empty");
        }
        if (event.getVersion() > UploadEvent.CURRENT_VERSION) {
            throw new InvalidUploadEventException("Unsupported upload event version: " + event.getVersion());
        }
        requireId("uploadId", event.getUploadId());
        requireId("userId", event.getUserId());
        validateObjectKey(event.getRawVideoPath());
        resolveLadder(event);
    }

    /**
     * Ladder in the order requested by the event, defaulting to the canonical ladder.
     * Duplicate labels are dropped.
     */
    public List<RenditionSpec> resolveLadder(UploadEvent event) {
        List<String> labels = event.getResolutions() == null || event.getResolutions().isEmpty()
                ? RenditionSpec.DEFAULT_LADDER
                : event.getResolutions();

        Set<String> unique = new LinkedHashSet<>(labels);
        List<RenditionSpec> ladder = new ArrayList<>(unique.size());
        for (String label : unique) {
            ladder.add(RenditionSpec.forLabel(label).orElseThrow(() ->
                    new InvalidUploadEventException("Unsupported rendition: '" + label
                            + "'. Supported renditions: " + String.join(", ", RenditionSpec.DEFAULT_LADDER))));
        }
        return ladder;
    }

    private void requireId(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidUploadEventException("Missing required field: " + field);
        }
        if (value.contains("..") || !VALID_ID_PATTERN.matcher(value).matches()) {
            throw new InvalidUploadEventException("Field " + field + " contains invalid characters");
        }
    }

    private void validateObjectKey(String rawVideoPath) {
        if (rawVideoPath == null || rawVideoPath.isBlank()) {
            throw new InvalidUploadEventException("Missing required field: rawVideoPath");
        }
        if (rawVideoPath.contains("..")) {
            throw new InvalidUploadEventException("rawVideoPath cannot contain path traversal sequences");
        }
        if (rawVideoPath.length() > MAX_OBJECT_KEY_LENGTH) {
            throw new InvalidUploadEventException("rawVideoPath exceeds maximum length");
        }
        // Object keys are arbitrary UTF-8; only control characters are refused
        if (rawVideoPath.chars().anyMatch(Character::isISOControl)) {
            throw new InvalidUploadEventException("rawVideoPath contains control characters");
        }
    }
}
