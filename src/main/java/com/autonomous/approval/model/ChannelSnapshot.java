package com.autonomous.approval.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of the channel registry. Entries are written as two-element
 * arrays, {@code [key, value]}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChannelSnapshot {
    private List<ChannelEntry> channels = new ArrayList<>();
    private List<SessionIndexEntry> sessionIndex = new ArrayList<>();
    private Instant savedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"channelId", "channel"})
    public static class ChannelEntry {
        private String channelId;
        private Channel channel;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"sessionId", "channelId"})
    public static class SessionIndexEntry {
        private String sessionId;
        private String channelId;
    }
}
