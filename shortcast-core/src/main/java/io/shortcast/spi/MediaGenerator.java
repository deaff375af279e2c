package io.shortcast.spi;

import io.shortcast.config.ChannelConfig;
import io.shortcast.model.MediaRef;
import io.shortcast.model.QueueItem;

/**
 * External media generation (text-to-speech, video rendering).
 */
public interface MediaGenerator {

    /**
     * Generates the narration shared by every channel of a cycle. Called exactly once per cycle.
     *
     * @param item the selected item
     * @return reference to the generated audio
     * @throws Exception if generation fails; the cycle is aborted
     */
    MediaRef generateSharedAudio(QueueItem item) throws Exception;

    /**
     * Renders the video variant for one primary channel on top of the shared narration.
     *
     * @param item    the selected item
     * @param channel the primary channel the variant is rendered for
     * @param audio   the shared narration
     * @return reference to the rendered video
     * @throws Exception if rendering fails; only this channel is affected
     */
    MediaRef generateVideo(QueueItem item, ChannelConfig channel, MediaRef audio) throws Exception;

    /**
     * Releases a generated artifact once the cycle no longer needs it (deletes temporary
     * files and similar). Default does nothing.
     *
     * @param media the artifact to release
     * @throws Exception if the artifact cannot be released; logged and ignored by the caller
     */
    default void discard(MediaRef media) throws Exception {
    }
}
