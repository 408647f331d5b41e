package com.autonomous.approval.service;

import com.autonomous.approval.exception.AuthErrorException;
import com.autonomous.approval.exception.NameCollisionException;
import com.autonomous.approval.exception.PlatformException;
import com.autonomous.approval.exception.PlatformUnavailableException;
import com.autonomous.approval.exception.ThrottledException;
import com.autonomous.approval.model.SlackMessage;
import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.SlackApiTextResponse;
import com.slack.api.methods.request.api.ApiTestRequest;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.request.chat.ChatUpdateRequest;
import com.slack.api.methods.request.conversations.ConversationsArchiveRequest;
import com.slack.api.methods.request.conversations.ConversationsCreateRequest;
import com.slack.api.methods.request.conversations.ConversationsListRequest;
import com.slack.api.methods.request.users.UsersInfoRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import com.slack.api.methods.response.conversations.ConversationsCreateResponse;
import com.slack.api.methods.response.conversations.ConversationsListResponse;
import com.slack.api.methods.response.users.UsersInfoResponse;
import com.slack.api.model.Conversation;
import com.slack.api.model.ConversationType;
import com.slack.api.model.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Outbound Slack Web API calls. Every call waits on the {@link PlatformRateLimiter}
 * gate first; Slack error codes are translated into the platform exception
 * hierarchy, and throttled calls are retried a bounded number of times.
 */
@Slf4j
@Service
public class SlackService {

    private static final Set<String> THROTTLE_ERRORS = Set.of("ratelimited", "rate_limited");
    private static final Set<String> AUTH_ERRORS =
        Set.of("not_authed", "invalid_auth", "account_inactive", "token_revoked", "token_expired");
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int LIST_PAGE_SIZE = 1000;

    @FunctionalInterface
    interface SlackCall<T extends SlackApiTextResponse> {
        T execute(MethodsClient methods) throws IOException, SlackApiException;
    }

    @Value("${slack.bot.token}")
    private String slackBotToken;

    @Value("${approval.slack.max-throttle-retries:3}")
    private int maxThrottleRetries = 3;

    private final Slack slack;
    private final PlatformRateLimiter rateLimiter;
    private final PlatformHealth platformHealth;

    public SlackService(Slack slack, PlatformRateLimiter rateLimiter, PlatformHealth platformHealth) {
        this.slack = slack;
        this.rateLimiter = rateLimiter;
        this.platformHealth = platformHealth;
    }

    public void setSlackBotToken(String slackBotToken) {
        this.slackBotToken = slackBotToken;
    }

    public void setMaxThrottleRetries(int maxThrottleRetries) {
        this.maxThrottleRetries = maxThrottleRetries;
    }

    /**
     * Creates a public channel.
     *
     * @throws NameCollisionException when Slack answers {@code name_taken}
     */
    public Conversation createChannel(String name) {
        try {
            ConversationsCreateResponse response = invoke("conversations.create", methods ->
                methods.conversationsCreate(ConversationsCreateRequest.builder()
                    .name(name)
                    .isPrivate(false)
                    .build()));
            return response.getChannel();
        } catch (NameCollisionException e) {
            throw new NameCollisionException("conversations.create", name);
        }
    }

    /**
     * Posts a message to a channel and returns its timestamp, which identifies
     * the message for later edits and thread replies.
     */
    public String postMessage(String channel, SlackMessage message) {
        ChatPostMessageResponse response = invoke("chat.postMessage", methods ->
            methods.chatPostMessage(ChatPostMessageRequest.builder()
                .channel(channel)
                .text(message.getText())
                .blocks(message.getBlocks())
                .build()));
        return response.getTs();
    }

    public String postThreadReply(String channel, String threadTs, SlackMessage message) {
        ChatPostMessageResponse response = invoke("chat.postMessage", methods ->
            methods.chatPostMessage(ChatPostMessageRequest.builder()
                .channel(channel)
                .threadTs(threadTs)
                .text(message.getText())
                .blocks(message.getBlocks())
                .build()));
        return response.getTs();
    }

    public void updateMessage(String channel, String ts, SlackMessage message) {
        invoke("chat.update", methods ->
            methods.chatUpdate(ChatUpdateRequest.builder()
                .channel(channel)
                .ts(ts)
                .text(message.getText())
                .blocks(message.getBlocks())
                .build()));
    }

    /**
     * Archives a channel. A channel that is already archived, or no longer
     * exists, counts as archived.
     */
    public void archiveChannel(String channelId) {
        try {
            invoke("conversations.archive", methods ->
                methods.conversationsArchive(ConversationsArchiveRequest.builder()
                    .channel(channelId)
                    .build()));
        } catch (PlatformException e) {
            if ("already_archived".equals(e.getErrorCode())) {
                log.debug("[Slack] Channel {} was already archived", channelId);
                return;
            }
            if ("channel_not_found".equals(e.getErrorCode())) {
                log.warn("[Slack] Channel {} no longer exists, treating as archived", channelId);
                return;
            }
            throw e;
        }
    }

    /** Lists every public and private channel visible to the bot, archived ones included. */
    public List<Conversation> listChannels() {
        List<Conversation> channels = new ArrayList<>();
        String cursor = null;
        do {
            String pageCursor = cursor;
            ConversationsListResponse response = invoke("conversations.list", methods ->
                methods.conversationsList(ConversationsListRequest.builder()
                    .types(List.of(ConversationType.PUBLIC_CHANNEL, ConversationType.PRIVATE_CHANNEL))
                    .excludeArchived(false)
                    .limit(LIST_PAGE_SIZE)
                    .cursor(pageCursor)
                    .build()));
            if (response.getChannels() != null) {
                channels.addAll(response.getChannels());
            }
            cursor = response.getResponseMetadata() != null ? response.getResponseMetadata().getNextCursor() : null;
        } while (cursor != null && !cursor.isBlank());
        return channels;
    }

    /** Lightweight liveness check ({@code api.test}). Never throws. */
    public boolean probe() {
        try {
            invoke("api.test", methods -> methods.apiTest(ApiTestRequest.builder().build()));
            return true;
        } catch (PlatformException e) {
            log.debug("[Slack] Probe failed: {}", e.getMessage());
            return false;
        }
    }

    /** Best-effort lookup of a user's display name; empty when Slack cannot tell us. */
    public Optional<String> lookupDisplayName(String userId) {
        try {
            UsersInfoResponse response = invoke("users.info", methods ->
                methods.usersInfo(UsersInfoRequest.builder().user(userId).build()));
            User user = response.getUser();
            if (user == null) {
                return Optional.empty();
            }
            String realName = user.getRealName();
            return Optional.ofNullable(realName != null && !realName.isBlank() ? realName : user.getName());
        } catch (PlatformException e) {
            log.debug("[Slack] Could not resolve name of user {}: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }

    <T extends SlackApiTextResponse> T invoke(String operation, SlackCall<T> call) {
        if (platformHealth.isAuthFailed()) {
            throw new AuthErrorException(operation, "invalid_auth");
        }
        int attempt = 0;
        while (true) {
            attempt++;
            rateLimiter.acquire();
            try {
                return execute(operation, call);
            } catch (ThrottledException e) {
                rateLimiter.onThrottled();
                if (attempt > maxThrottleRetries) {
                    log.error("[Slack] {} still throttled after {} attempts", operation, attempt);
                    throw e;
                }
                log.warn("[Slack] {} throttled, retrying ({}/{})", operation, attempt, maxThrottleRetries);
            }
        }
    }

    private <T extends SlackApiTextResponse> T execute(String operation, SlackCall<T> call) {
        T response;
        try {
            response = call.execute(slack.methods(slackBotToken));
        } catch (SlackApiException e) {
            if (e.getResponse() != null && e.getResponse().code() == HTTP_TOO_MANY_REQUESTS) {
                throw new ThrottledException(operation, "ratelimited");
            }
            String code = e.getError() != null ? e.getError().getError() : null;
            throw translate(operation, code);
        } catch (IOException e) {
            platformHealth.markUnreachable(operation + ": " + e.getMessage());
            throw new PlatformUnavailableException(operation, "Slack unreachable during " + operation, e);
        }
        if (response == null) {
            throw new PlatformException(operation, null, "Empty response from Slack for " + operation);
        }
        if (!response.isOk()) {
            throw translate(operation, response.getError());
        }
        return response;
    }

    private PlatformException translate(String operation, String errorCode) {
        if (errorCode == null) {
            return new PlatformException(operation, null, "Slack call " + operation + " failed");
        }
        if ("name_taken".equals(errorCode)) {
            return new NameCollisionException(operation, null);
        }
        if (THROTTLE_ERRORS.contains(errorCode)) {
            return new ThrottledException(operation, errorCode);
        }
        if (AUTH_ERRORS.contains(errorCode)) {
            platformHealth.markAuthFailure(errorCode);
            return new AuthErrorException(operation, errorCode);
        }
        return new PlatformException(operation, errorCode, "Slack call " + operation + " failed: " + errorCode);
    }
}
