package com.example.deal_bot.ops;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SystemFlagService {

    private static final Logger log = LoggerFactory.getLogger(SystemFlagService.class);

    private final SystemFlagRepository repo;

    public SystemFlagService(SystemFlagRepository repo) {
        this.repo = repo;
    }

    /**
     * Return the value for the key or null if not present.
     */
    public String get(String key) {
        return repo.findById(key).map(SystemFlag::getValue).orElse(null);
    }

    public int getInt(String key, int defaultValue) {
        String v = get(key);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("flag {} is not an int: '{}', using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key) {
        return "true".equalsIgnoreCase(trim(get(key)));
    }

    /** カンマ区切りの値を空要素を除いて返す */
    public List<String> getList(String key) {
        String v = get(key);
        if (v == null || v.isBlank()) {
            return List.of();
        }
        return Arrays.stream(v.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public void set(String key, String value) {
        SystemFlag f = repo.findById(key).orElseGet(() -> new SystemFlag(key, null));
        f.setValue(value);
        repo.save(f);
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }
}
