package com.autonomous.approval.service;

import com.autonomous.approval.model.ResolvedApproval;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Tells the outside world that an approval resolved: a JSON result file the agent
 * can poll, plus a POST to every registered callback URL.
 */
@Slf4j
@Service
public class ApprovalNotifier {

    @Value("${approval.results.path:${java.io.tmpdir}}")
    private String resultsPath = System.getProperty("java.io.tmpdir");

    private final RestTemplate restTemplate;
    private final ApprovalCallbackRegistry callbackRegistry;
    private final ObjectMapper mapper;
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public ApprovalNotifier(RestTemplate restTemplate, ApprovalCallbackRegistry callbackRegistry) {
        this.restTemplate = restTemplate;
        this.callbackRegistry = callbackRegistry;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void setResultsPath(String resultsPath) {
        this.resultsPath = resultsPath;
    }

    public void notifyResolved(ResolvedApproval resolved) {
        writeResultFile(resolved);
        for (String url : callbackRegistry.complete(resolved)) {
            postCallbackAsync(url, resolved);
        }
    }

    /** Registers a callback URL; posts right away when the approval already resolved. */
    public void registerCallback(String approvalId, String callbackUrl) {
        callbackRegistry.register(approvalId, callbackUrl)
            .ifPresent(resolved -> postCallbackAsync(callbackUrl, resolved));
    }

    public Path resultFile(String approvalId) {
        return Paths.get(resultsPath, "approval-" + approvalId + ".json");
    }

    CompletableFuture<Void> postCallbackAsync(String url, ResolvedApproval resolved) {
        return CompletableFuture.runAsync(() -> postCallback(url, resolved), executor);
    }

    private void postCallback(String url, ResolvedApproval resolved) {
        try {
            restTemplate.postForEntity(url, resolved, Void.class);
            log.info("[Notify] Posted result of approval {} to {}", resolved.getApprovalId(), url);
        } catch (RestClientException e) {
            log.warn("[Notify] Callback {} for approval {} failed: {}", url, resolved.getApprovalId(), e.getMessage());
        }
    }

    private void writeResultFile(ResolvedApproval resolved) {
        Path file = resultFile(resolved.getApprovalId());
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, "approval-" + resolved.getApprovalId(), ".tmp");
            try {
                mapper.writeValue(temp.toFile(), resolved);
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            log.error("[Notify] Could not write result file {} for approval {} (session {})",
                file, resolved.getApprovalId(), resolved.getSessionId(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
