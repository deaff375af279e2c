package io.shortcast.testing;

import io.shortcast.config.ChannelConfig;
import io.shortcast.config.PlatformKind;
import io.shortcast.model.ErrorKind;
import io.shortcast.model.MediaRef;
import io.shortcast.model.QueueItem;
import io.shortcast.spi.ChannelPublisher;
import io.shortcast.spi.CredentialHealth;
import io.shortcast.spi.PublishResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publisher that succeeds by default and can be told to reject or throw per channel.
 */
public final class StubPublisher implements ChannelPublisher {

    public record Call(String channelId, String itemId, MediaRef media) {
    }

    private final PlatformKind platform;
    private final Map<String, ErrorKind> rejections = new ConcurrentHashMap<>();
    private final Map<String, Throwable> failures = new ConcurrentHashMap<>();
    private final Map<String, CredentialHealth> credentials = new ConcurrentHashMap<>();
    public final List<Call> calls = new CopyOnWriteArrayList<>();

    public StubPublisher(PlatformKind platform) {
        this.platform = platform;
    }

    public static StubPublisher primary() {
        return new StubPublisher(PlatformKind.PRIMARY);
    }

    public static StubPublisher secondary() {
        return new StubPublisher(PlatformKind.SECONDARY);
    }

    public StubPublisher reject(String channelId, ErrorKind errorKind) {
        rejections.put(channelId, errorKind);
        return this;
    }

    public StubPublisher fail(String channelId, Throwable failure) {
        failures.put(channelId, failure);
        return this;
    }

    public StubPublisher credentials(String channelId, CredentialHealth health) {
        credentials.put(channelId, health);
        return this;
    }

    @Override
    public PlatformKind platform() {
        return platform;
    }

    @Override
    public PublishResult publish(ChannelConfig channel, QueueItem item, MediaRef media) throws Exception {
        calls.add(new Call(channel.id(), item.id(), media));
        Throwable failure = failures.get(channel.id());
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure != null) {
            throw (Exception) failure;
        }
        ErrorKind rejection = rejections.get(channel.id());
        if (rejection != null) {
            return PublishResult.rejected(rejection, "rejected by stub");
        }
        return PublishResult.published("https://example.test/" + channel.id() + "/" + item.id());
    }

    @Override
    public CredentialHealth inspectCredentials(ChannelConfig channel) {
        return credentials.getOrDefault(channel.id(), ChannelPublisher.super.inspectCredentials(channel));
    }
}
