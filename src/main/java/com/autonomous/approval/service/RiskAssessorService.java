package com.autonomous.approval.service;

import com.autonomous.approval.model.RiskLevel;
import com.autonomous.approval.model.RiskRule;
import com.autonomous.approval.model.RiskRuleSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Scores a command before it is put in front of a human. Rules are regular
 * expressions mapped to a level; the highest matching level wins.
 */
@Slf4j
@Service
public class RiskAssessorService {

    static final String BUNDLED_RULES = "risk-rules.yaml";

    @Value("${approval.risk.rules-path:config/risk-rules.yaml}")
    private String rulesPath = "config/risk-rules.yaml";

    private final ObjectMapper yamlMapper;

    private volatile List<CompiledRule> rules = List.of();
    private volatile RiskLevel defaultLevel = RiskLevel.MEDIUM;

    public RiskAssessorService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setRulesPath(String rulesPath) {
        this.rulesPath = rulesPath;
    }

    @PostConstruct
    public void loadRules() {
        RiskRuleSet ruleSet = readRuleSet();
        List<CompiledRule> compiled = new ArrayList<>();
        for (RiskRule rule : ruleSet.getRules()) {
            RiskLevel level = RiskLevel.fromValue(rule.getLevel()).orElse(null);
            if (level == null || rule.getPattern() == null) {
                log.warn("[Risk] Skipping rule with pattern '{}' and level '{}'", rule.getPattern(), rule.getLevel());
                continue;
            }
            try {
                compiled.add(new CompiledRule(Pattern.compile(rule.getPattern()), level));
            } catch (PatternSyntaxException e) {
                log.warn("[Risk] Skipping invalid pattern '{}': {}", rule.getPattern(), e.getDescription());
            }
        }
        this.rules = List.copyOf(compiled);
        this.defaultLevel = RiskLevel.fromValue(ruleSet.getDefaultLevel()).orElse(RiskLevel.MEDIUM);
        log.info("[Risk] Loaded {} risk rules (default level {})", compiled.size(), defaultLevel.getValue());
    }

    /**
     * Returns the risk of a command. An explicit {@code risk} entry in the metadata
     * overrides the rules.
     */
    public RiskLevel assess(String command, Map<String, String> metadata) {
        if (metadata != null) {
            String explicit = metadata.get("risk");
            if (explicit != null) {
                var level = RiskLevel.fromValue(explicit);
                if (level.isPresent()) {
                    return level.get();
                }
                log.warn("[Risk] Ignoring unknown risk level '{}'", explicit);
            }
        }
        if (command == null) {
            return defaultLevel;
        }
        RiskLevel highest = null;
        for (CompiledRule rule : rules) {
            if (rule.pattern.matcher(command).find()
                && (highest == null || rule.level.ordinal() > highest.ordinal())) {
                highest = rule.level;
            }
        }
        return highest != null ? highest : defaultLevel;
    }

    public int getRuleCount() {
        return rules.size();
    }

    private RiskRuleSet readRuleSet() {
        File file = new File(rulesPath);
        try {
            if (file.isFile()) {
                log.info("[Risk] Reading risk rules from {}", file.getAbsolutePath());
                return yamlMapper.readValue(file, RiskRuleSet.class);
            }
            try (InputStream in = new ClassPathResource(BUNDLED_RULES).getInputStream()) {
                log.debug("[Risk] {} not found, using bundled rules", rulesPath);
                return yamlMapper.readValue(in, RiskRuleSet.class);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load risk rules", e);
        }
    }

    private static final class CompiledRule {
        private final Pattern pattern;
        private final RiskLevel level;

        private CompiledRule(Pattern pattern, RiskLevel level) {
            this.pattern = pattern;
            this.level = level;
        }
    }
}
