package com.mediapipeline.queue;

import com.mediapipeline.model.VideoDeletedEvent;
import com.mediapipeline.service.MediaPurgeService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class VideoDeletedListenerTest {

    @Mock
    private MediaPurgeService purgeService;

    @InjectMocks
    private VideoDeletedListener listener;

    @Test
    void purgesValidEvent() {
        VideoDeletedEvent event = new VideoDeletedEvent("abc123", "u1", "raw/u1/abc123/video.mp4");

        listener.onVideoDeleted(event);

        verify(purgeService).purge(event);
    }

    @Test
    void rejectsIdsThatWouldWidenThePrefix() {
        assertThatThrownBy(() -> listener.onVideoDeleted(new VideoDeletedEvent("abc123", "", null)))
                .isInstanceOf(AmqpRejectAndDontRequeueException.class);
        assertThatThrownBy(() -> listener.onVideoDeleted(new VideoDeletedEvent("../x", "u1", null)))
                .isInstanceOf(AmqpRejectAndDontRequeueException.class);
        assertThatThrownBy(() -> listener.onVideoDeleted(new VideoDeletedEvent("abc123", "u1/other", null)))
                .isInstanceOf(AmqpRejectAndDontRequeueException.class);

        verifyNoInteractions(purgeService);
    }
}
