package io.shortcast.spi;

import io.shortcast.config.ChannelConfig;
import io.shortcast.config.PlatformKind;
import io.shortcast.model.MediaRef;
import io.shortcast.model.QueueItem;

/**
 * Uploads media to one platform kind. One publisher serves every channel of its kind;
 * the channel's {@link ChannelConfig#credentialRef()} selects the account.
 *
 * <p>Publishers are invoked sequentially on the scheduler thread and may block for as
 * long as the upload takes.
 */
public interface ChannelPublisher {

    /**
     * The platform kind this publisher serves.
     *
     * @return the platform kind
     */
    PlatformKind platform();

    /**
     * Publishes the media to the channel.
     *
     * @param channel the destination channel
     * @param item    the item the media was generated from (title, metadata)
     * @param media   the video to upload
     * @return whether the platform accepted the upload
     * @throws Exception on failure; {@link ChannelPublishException} carries its own classification,
     *                   {@link java.io.IOException} counts as a network failure
     */
    PublishResult publish(ChannelConfig channel, QueueItem item, MediaRef media) throws Exception;

    /**
     * Inspects the channel's credentials without publishing anything.
     *
     * @param channel the channel to inspect
     * @return the credential health; default {@link CredentialHealth#UNKNOWN}
     */
    default CredentialHealth inspectCredentials(ChannelConfig channel) {
        return CredentialHealth.UNKNOWN;
    }
}
