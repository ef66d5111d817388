package com.mediapipeline.queue;

import com.mediapipeline.model.VideoDeletedEvent;
import com.mediapipeline.service.MediaPurgeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
@Slf4j
public class VideoDeletedListener {

    // Ids end up in the deleted prefix; anything looser could widen it
    private static final Pattern VALID_ID = Pattern.compile("^[a-zA-Z0-9_\\-.@]+$");

    private final MediaPurgeService purgeService;

    public VideoDeletedListener(MediaPurgeService purgeService) {
        this.purgeService = purgeService;
    }

    @RabbitListener(queues = "${media.queue.purge:playback.purge}")
    public void onVideoDeleted(VideoDeletedEvent event) {
        if (!isValidId(event.getUploadId()) || !isValidId(event.getUserId())) {
            log.error("Rejecting video deleted event with invalid ids: {}", event);
            throw new AmqpRejectAndDontRequeueException("Video deleted event without valid uploadId/userId");
        }
        purgeService.purge(event);
    }

    private static boolean isValidId(String id) {
        return id != null && !id.contains("..") && VALID_ID.matcher(id).matches();
    }
}
