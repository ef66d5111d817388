package com.mediapipeline.service;

import org.apache.commons.io.FilenameUtils;

import java.util.Locale;

public final class MediaContentTypes {

    public static final String HLS_PLAYLIST = "application/vnd.apple.mpegurl";
    public static final String MPEG_TS = "video/MP2T";
    public static final String JPEG = "image/jpeg";

    private MediaContentTypes() {
    }

    public static String forKey(String key) {
        switch (FilenameUtils.getExtension(key).toLowerCase(Locale.ROOT)) {
            case "m3u8":
                return HLS_PLAYLIST;
            case "ts":
                return MPEG_TS;
            case "m4s":
                return "video/iso.segment";
            case "mp4":
                return "video/mp4";
            case "jpg":
            case "jpeg":
                return JPEG;
            case "png":
                return "image/png";
            default:
                return "application/octet-stream";
        }
    }
}
