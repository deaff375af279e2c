package io.shortcast.spring.boot;

import io.shortcast.config.PublisherConfig;
import io.shortcast.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for shortcast.
 *
 * <pre>
 * shortcast:
 *   channels:
 *     - id: primary1
 *       platform: youtube
 *       credential-ref: tokens/primary1.json
 *     - id: secondary1
 *       platform: tiktok
 *       credential-ref: cookies/secondary1.txt
 *   scheduler:
 *     timezone: Europe/Bucharest
 *     daily-fetch-time: "08:00"
 *     daily-publish-times: ["09:00", "13:00", "17:00"]
 * </pre>
 *
 * @see ShortcastAutoConfiguration
 */
@ConfigurationProperties(prefix = "shortcast")
public class ShortcastProperties {

    /**
     * Destination channels, in publishing order.
     */
    private List<Channel> channels = new ArrayList<>();

    private final Scheduler scheduler = new Scheduler();
    private final Selection selection = new Selection();
    private final Publish publish = new Publish();
    private final Notification notification = new Notification();
    private final Store store = new Store();
    private final Metrics metrics = new Metrics();
    private final Runner runner = new Runner();

    public List<Channel> getChannels() {
        return channels;
    }

    public void setChannels(List<Channel> channels) {
        this.channels = channels;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Selection getSelection() {
        return selection;
    }

    public Publish getPublish() {
        return publish;
    }

    public Notification getNotification() {
        return notification;
    }

    public Store getStore() {
        return store;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Runner getRunner() {
        return runner;
    }

    /**
     * Normalizes and validates the bound values.
     *
     * @return the validated publisher configuration
     * @throws io.shortcast.config.ConfigInvalidException listing every problem found
     */
    public PublisherConfig toPublisherConfig() {
        PublisherConfig.Builder builder = PublisherConfig.builder()
                .publishTimes(scheduler.getDailyPublishTimes())
                .legacyPublishTime(scheduler.getDailyPublishTime())
                .fetchTime(scheduler.getDailyFetchTime())
                .fetchIntervalHours(scheduler.getFetchIntervalHours())
                .zone(scheduler.getTimezone())
                .ordering(selection.getOrdering())
                .refillOnEmpty(publish.isRefillOnEmpty());
        for (Channel channel : channels) {
            builder.channel(channel.getId(), channel.getPlatform(), channel.isEnabled(),
                    channel.getCredentialRef(), channel.getMediaFolderRef());
        }
        return builder.build();
    }

    public static class Channel {
        private String id;

        /**
         * {@code primary} / {@code youtube} or {@code secondary} / {@code tiktok}.
         */
        private String platform;
        private boolean enabled = true;
        private String credentialRef;
        private String mediaFolderRef;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getPlatform() {
            return platform;
        }

        public void setPlatform(String platform) {
            this.platform = platform;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCredentialRef() {
            return credentialRef;
        }

        public void setCredentialRef(String credentialRef) {
            this.credentialRef = credentialRef;
        }

        public String getMediaFolderRef() {
            return mediaFolderRef;
        }

        public void setMediaFolderRef(String mediaFolderRef) {
            this.mediaFolderRef = mediaFolderRef;
        }
    }

    public static class Scheduler {
        /**
         * IANA zone the times of day are interpreted in. Defaults to UTC.
         */
        private String timezone;

        /**
         * Daily fetch time ({@code HH:mm}).
         */
        private String dailyFetchTime;
        private int fetchIntervalHours = 24;

        /**
         * Publish times of day; takes precedence over {@link #dailyPublishTime}.
         */
        private List<String> dailyPublishTimes = new ArrayList<>();

        /**
         * Single publish time, kept for older configuration files.
         */
        private String dailyPublishTime;

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public String getDailyFetchTime() {
            return dailyFetchTime;
        }

        public void setDailyFetchTime(String dailyFetchTime) {
            this.dailyFetchTime = dailyFetchTime;
        }

        public int getFetchIntervalHours() {
            return fetchIntervalHours;
        }

        public void setFetchIntervalHours(int fetchIntervalHours) {
            this.fetchIntervalHours = fetchIntervalHours;
        }

        public List<String> getDailyPublishTimes() {
            return dailyPublishTimes;
        }

        public void setDailyPublishTimes(List<String> dailyPublishTimes) {
            this.dailyPublishTimes = dailyPublishTimes;
        }

        public String getDailyPublishTime() {
            return dailyPublishTime;
        }

        public void setDailyPublishTime(String dailyPublishTime) {
            this.dailyPublishTime = dailyPublishTime;
        }
    }

    public static class Selection {
        /**
         * {@code score-desc} (default) or {@code fifo}.
         */
        private String ordering = "score-desc";

        public String getOrdering() {
            return ordering;
        }

        public void setOrdering(String ordering) {
            this.ordering = ordering;
        }
    }

    public static class Publish {
        private boolean refillOnEmpty = true;

        public boolean isRefillOnEmpty() {
            return refillOnEmpty;
        }

        public void setRefillOnEmpty(boolean refillOnEmpty) {
            this.refillOnEmpty = refillOnEmpty;
        }
    }

    public static class Notification {
        private List<String> recipients = new ArrayList<>();
        private int queueCapacity = 256;

        public List<String> getRecipients() {
            return recipients;
        }

        public void setRecipients(List<String> recipients) {
            this.recipients = recipients;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class Store {
        /**
         * {@code jdbc} (default when a DataSource is present) or {@code memory}.
         */
        private StoreType type = StoreType.JDBC;
        private String stateTable = TableNames.DEFAULT_STATE_TABLE;
        private String consumedTable = TableNames.DEFAULT_CONSUMED_TABLE;
        private String queueTable = TableNames.DEFAULT_QUEUE_TABLE;

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public String getStateTable() {
            return stateTable;
        }

        public void setStateTable(String stateTable) {
            this.stateTable = stateTable;
        }

        public String getConsumedTable() {
            return consumedTable;
        }

        public void setConsumedTable(String consumedTable) {
            this.consumedTable = consumedTable;
        }

        public String getQueueTable() {
            return queueTable;
        }

        public void setQueueTable(String queueTable) {
            this.queueTable = queueTable;
        }

        boolean hasDefaultTables() {
            return TableNames.DEFAULT_STATE_TABLE.equals(stateTable)
                    && TableNames.DEFAULT_CONSUMED_TABLE.equals(consumedTable)
                    && TableNames.DEFAULT_QUEUE_TABLE.equals(queueTable);
        }
    }

    public enum StoreType {
        JDBC,
        MEMORY
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "shortcast";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    public static class Runner {
        /**
         * Run the {@code --mode} dispatch on startup.
         */
        private boolean enabled = true;

        /**
         * In continuous mode, block the startup thread until the application shuts down.
         */
        private boolean awaitTermination = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isAwaitTermination() {
            return awaitTermination;
        }

        public void setAwaitTermination(boolean awaitTermination) {
            this.awaitTermination = awaitTermination;
        }
    }
}
