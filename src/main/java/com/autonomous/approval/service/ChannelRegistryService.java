package com.autonomous.approval.service;

import com.autonomous.approval.exception.NameCollisionException;
import com.autonomous.approval.exception.PlatformException;
import com.autonomous.approval.exception.PlatformUnavailableException;
import com.autonomous.approval.model.Channel;
import com.autonomous.approval.model.ChannelSnapshot;
import com.slack.api.model.Conversation;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns the session to channel mapping. One Slack channel per session, created on
 * the first approval request and archived when the session ends. Every mutation is
 * serialized on the registry and followed by a full snapshot write.
 */
@Slf4j
@Service
public class ChannelRegistryService {

    private static final int MAX_PART_LENGTH = 20;
    private static final int HASH_LENGTH = 8;
    private static final int SUFFIX_LENGTH = 4;
    private static final String SUFFIX_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final SecureRandom RANDOM = new SecureRandom();

    @Value("${approval.channel.prefix:appr}")
    private String channelPrefix = "appr";

    @Value("${approval.channel.max-name-length:80}")
    private int maxNameLength = 80;

    private final SlackService slackService;
    private final ChannelSnapshotStore snapshotStore;
    private final PlatformHealth platformHealth;
    private final ApprovalMessageBuilder messageBuilder;
    private final Clock clock;

    private final Map<String, Channel> channels = new LinkedHashMap<>();
    private final Map<String, String> sessionIndex = new LinkedHashMap<>();

    public ChannelRegistryService(SlackService slackService, ChannelSnapshotStore snapshotStore,
                                  PlatformHealth platformHealth, ApprovalMessageBuilder messageBuilder,
                                  Clock clock) {
        this.slackService = slackService;
        this.snapshotStore = snapshotStore;
        this.platformHealth = platformHealth;
        this.messageBuilder = messageBuilder;
        this.clock = clock;
    }

    public void setChannelPrefix(String channelPrefix) {
        this.channelPrefix = channelPrefix;
    }

    public void setMaxNameLength(int maxNameLength) {
        this.maxNameLength = maxNameLength;
    }

    @PostConstruct
    public synchronized void loadSnapshot() {
        channels.clear();
        sessionIndex.clear();
        snapshotStore.load().ifPresent(snapshot -> {
            for (ChannelSnapshot.ChannelEntry entry : snapshot.getChannels()) {
                if (entry.getChannelId() != null && entry.getChannel() != null) {
                    channels.put(entry.getChannelId(), entry.getChannel());
                }
            }
            for (ChannelSnapshot.SessionIndexEntry entry : snapshot.getSessionIndex()) {
                Channel channel = channels.get(entry.getChannelId());
                if (channel != null && !channel.isArchived() && !channel.isArchivePending()) {
                    sessionIndex.put(entry.getSessionId(), entry.getChannelId());
                }
            }
            log.info("[Channels] Restored {} channels ({} active) from snapshot saved at {}",
                channels.size(), sessionIndex.size(), snapshot.getSavedAt());
        });
    }

    public Channel resolveOrCreateChannel(String sessionId, List<String> displayNameParts) {
        return resolveOrCreateChannel(sessionId, null, displayNameParts, Map.of());
    }

    /**
     * Returns the active channel of the session, creating it on first use.
     *
     * @param displayNameParts human readable parts of the channel name (project, session, ...)
     * @param context          extra details shown in the welcome message
     * @throws PlatformUnavailableException when a channel must be created and Slack is unhealthy
     * @throws NameCollisionException       when the name is taken even after one suffixed retry
     * @throws PlatformException            when an earlier channel of the session still awaits
     *                                      archival and Slack refuses to archive it
     */
    public synchronized Channel resolveOrCreateChannel(String sessionId, String subSessionId,
                                                       List<String> displayNameParts,
                                                       Map<String, String> context) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        String existingId = sessionIndex.get(sessionId);
        if (existingId != null) {
            Channel existing = channels.get(existingId);
            if (existing != null && !existing.isArchived()) {
                return existing;
            }
        }
        if (!platformHealth.isHealthy()) {
            throw new PlatformUnavailableException("conversations.create",
                "Slack is unavailable, cannot open a channel for session " + sessionId);
        }
        archiveDeferredChannels(sessionId);

        String name = generateChannelName(sessionId, displayNameParts);
        Conversation created;
        try {
            created = slackService.createChannel(name);
        } catch (NameCollisionException e) {
            String retryName = withSuffix(name, randomSuffix());
            log.warn("[Channels] Name {} taken for session {}, retrying as {}", name, sessionId, retryName);
            created = slackService.createChannel(retryName);
        }

        Channel channel = Channel.builder()
            .id(created.getId())
            .displayName(created.getName() != null ? created.getName() : name)
            .sessionId(sessionId)
            .subSessionId(subSessionId)
            .createdAt(clock.instant())
            .build();
        channels.put(channel.getId(), channel);
        sessionIndex.put(sessionId, channel.getId());
        persist();
        log.info("[Channels] Created #{} ({}) for session {}", channel.getDisplayName(), channel.getId(), sessionId);

        try {
            slackService.postMessage(channel.getId(), messageBuilder.welcome(channel, context));
        } catch (PlatformException e) {
            log.warn("[Channels] Welcome message failed in {} for session {}: {}",
                channel.getId(), sessionId, e.getMessage());
        }
        return channel;
    }

    /**
     * Archives a channel. Archiving an archived channel succeeds without calling Slack.
     *
     * @return {@code true} when the channel is archived; {@code false} for an unknown
     *         id or when Slack could not be reached and archival was deferred
     */
    public synchronized boolean archiveChannel(String channelId) {
        Channel channel = channels.get(channelId);
        if (channel == null) {
            log.warn("[Channels] Archive requested for unknown channel {}", channelId);
            return false;
        }
        if (channel.isArchived()) {
            return true;
        }
        sessionIndex.remove(channel.getSessionId(), channelId);

        if (!platformHealth.isHealthy()) {
            deferArchival(channel, "Slack is unavailable");
            return false;
        }
        try {
            slackService.postMessage(channelId, messageBuilder.closing(channel, clock.instant()));
        } catch (PlatformException e) {
            log.warn("[Channels] Closing message failed in {} for session {}: {}",
                channelId, channel.getSessionId(), e.getMessage());
        }
        try {
            slackService.archiveChannel(channelId);
        } catch (PlatformException e) {
            deferArchival(channel, e.getMessage());
            return false;
        }
        markArchived(channel);
        return true;
    }

    public synchronized boolean archiveBySession(String sessionId) {
        String channelId = sessionIndex.get(sessionId);
        if (channelId == null) {
            log.debug("[Channels] No active channel for session {}", sessionId);
            return false;
        }
        return archiveChannel(channelId);
    }

    public synchronized Optional<Channel> findBySession(String sessionId) {
        return Optional.ofNullable(sessionIndex.get(sessionId)).map(channels::get);
    }

    public synchronized Optional<Channel> findById(String channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    public synchronized List<Channel> activeChannels() {
        return sessionIndex.values().stream()
            .map(channels::get)
            .collect(Collectors.toList());
    }

    public synchronized List<Channel> pendingArchivals() {
        return channels.values().stream()
            .filter(Channel::isArchivePending)
            .collect(Collectors.toList());
    }

    /**
     * Counts archived Slack channels carrying the approval prefix. Slack only deletes
     * channels on Enterprise Grid, so cleanup reports rather than removes.
     */
    public long countArchivedApprovalChannels() {
        if (!platformHealth.isHealthy()) {
            throw new PlatformUnavailableException("conversations.list", "Slack is unavailable");
        }
        String namePrefix = channelPrefix + "-";
        return slackService.listChannels().stream()
            .filter(Conversation::isArchived)
            .filter(c -> c.getName() != null && c.getName().startsWith(namePrefix))
            .count();
    }

    @EventListener
    public void onHealthChanged(PlatformHealthChangedEvent event) {
        if (event.isHealthy()) {
            retryPendingArchivals();
        }
    }

    public synchronized int retryPendingArchivals() {
        List<Channel> pending = new ArrayList<>(pendingArchivals());
        int archived = 0;
        for (Channel channel : pending) {
            try {
                slackService.archiveChannel(channel.getId());
                markArchived(channel);
                archived++;
            } catch (PlatformException e) {
                log.warn("[Channels] Deferred archival of {} (session {}) failed again: {}",
                    channel.getId(), channel.getSessionId(), e.getMessage());
            }
        }
        if (!pending.isEmpty()) {
            log.info("[Channels] Archived {}/{} deferred channels", archived, pending.size());
        }
        return archived;
    }

    /**
     * Builds {@code <prefix>-<parts...>-<hash>}, where the hash is the first 8 hex chars
     * of SHA-256(sessionId). Parts are shortened so the hash always survives the
     * length limit, which keeps the name stable for a given session.
     */
    public String generateChannelName(String sessionId, List<String> displayNameParts) {
        String hash = sha256Hex(sessionId).substring(0, HASH_LENGTH);
        List<String> parts = new ArrayList<>();
        if (displayNameParts != null) {
            for (String part : displayNameParts) {
                String sanitized = sanitizePart(part);
                if (!sanitized.isEmpty()) {
                    parts.add(sanitized);
                }
            }
        }
        String prefix = sanitizePart(channelPrefix);
        int budget = maxNameLength - prefix.length() - HASH_LENGTH - 2;
        String middle = String.join("-", parts);
        if (middle.length() > budget) {
            middle = trimDashes(middle.substring(0, Math.max(0, budget)));
        }
        return middle.isEmpty() ? prefix + "-" + hash : prefix + "-" + middle + "-" + hash;
    }

    static String sanitizePart(String part) {
        if (part == null) {
            return "";
        }
        String sanitized = part.toLowerCase()
            .replaceAll("[^a-z0-9-]", "-")
            .replaceAll("-+", "-");
        sanitized = trimDashes(sanitized);
        if (sanitized.length() > MAX_PART_LENGTH) {
            sanitized = trimDashes(sanitized.substring(0, MAX_PART_LENGTH));
        }
        return sanitized;
    }

    private String withSuffix(String name, String suffix) {
        String tail = "-" + suffix;
        if (name.length() + tail.length() > maxNameLength) {
            name = trimDashes(name.substring(0, maxNameLength - tail.length()));
        }
        return name + tail;
    }

    private void archiveDeferredChannels(String sessionId) {
        for (Channel channel : new ArrayList<>(channels.values())) {
            if (channel.isArchivePending() && sessionId.equals(channel.getSessionId())) {
                slackService.archiveChannel(channel.getId());
                markArchived(channel);
            }
        }
    }

    private void deferArchival(Channel channel, String reason) {
        channel.setArchivePending(true);
        persist();
        log.warn("[Channels] Archival of {} (session {}) deferred until Slack recovers: {}",
            channel.getId(), channel.getSessionId(), reason);
    }

    private void markArchived(Channel channel) {
        channel.setArchived(true);
        channel.setArchivePending(false);
        sessionIndex.remove(channel.getSessionId(), channel.getId());
        persist();
        log.info("[Channels] Archived #{} ({}) for session {}",
            channel.getDisplayName(), channel.getId(), channel.getSessionId());
    }

    private void persist() {
        ChannelSnapshot snapshot = new ChannelSnapshot();
        channels.forEach((id, channel) -> snapshot.getChannels().add(new ChannelSnapshot.ChannelEntry(id, channel)));
        sessionIndex.forEach((session, id) ->
            snapshot.getSessionIndex().add(new ChannelSnapshot.SessionIndexEntry(session, id)));
        snapshot.setSavedAt(clock.instant());
        try {
            snapshotStore.save(snapshot);
        } catch (UncheckedIOException e) {
            log.error("[Channels] Could not persist channel snapshot, in-memory state is ahead of disk", e);
        }
    }

    private static String randomSuffix() {
        StringBuilder sb = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(SUFFIX_ALPHABET.charAt(RANDOM.nextInt(SUFFIX_ALPHABET.length())));
        }
        return sb.toString();
    }

    private static String trimDashes(String value) {
        return value.replaceAll("^-+", "").replaceAll("-+$", "");
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
