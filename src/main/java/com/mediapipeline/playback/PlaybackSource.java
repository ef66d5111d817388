package com.mediapipeline.playback;

import com.mediapipeline.model.VideoDescriptor;
import org.springframework.http.ResponseEntity;

/**
 * Where playback bytes come from. Chosen once at startup:
 * {@link PrivateStorageSource} when storage credentials are configured,
 * {@link PublicPassthroughSource} otherwise.
 * Callers have already checked that the descriptor is ready and the parameters are valid.
 */
public interface PlaybackSource {

    String mode();

    String fetchMaster(VideoDescriptor video);

    String fetchVariant(VideoDescriptor video, String rendition);

    ResponseEntity<byte[]> fetchSegment(VideoDescriptor video, String rendition, String segment);

    ResponseEntity<byte[]> fetchThumbnail(VideoDescriptor video);
}
