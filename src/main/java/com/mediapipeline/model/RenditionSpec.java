package com.mediapipeline.model;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One rung of the HLS ladder. The table is fixed; the ladder order comes from the upload event.
 */
@Value
public class RenditionSpec {

    public static final List<String> DEFAULT_LADDER = List.of("1080p", "720p", "480p", "360p");

    private static final Map<String, RenditionSpec> PROFILES = new LinkedHashMap<>();

    static {
        PROFILES.put("1080p", new RenditionSpec("1080p", 1920, 1080, 5000, 192));
        PROFILES.put("720p", new RenditionSpec("720p", 1280, 720, 2800, 128));
        PROFILES.put("480p", new RenditionSpec("480p", 854, 480, 1400, 96));
        PROFILES.put("360p", new RenditionSpec("360p", 640, 360, 800, 64));
    }

    String label;
    int width;
    int height;
    int videoBitrateKbps;
    int audioBitrateKbps;

    public static Optional<RenditionSpec> forLabel(String label) {
        return Optional.ofNullable(label).map(PROFILES::get);
    }

    /** Peak bandwidth in bits per second, as advertised in the master manifest. */
    public int bandwidth() {
        return (videoBitrateKbps + audioBitrateKbps) * 1000;
    }

    public String resolution() {
        return width + "x" + height;
    }
}
