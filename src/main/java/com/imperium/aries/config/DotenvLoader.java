package com.imperium.aries.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 启动前读取工作目录下的 .env，把 KEY=VALUE 写入系统属性，
 * application.yaml 中的 ${DB_URL}、${SMTP_PASSWORD}、${JWT_SECRET} 等占位符据此解析。
 * 已通过 -D 显式指定的属性不会被覆盖。
 */
public final class DotenvLoader {

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)\\s*=(.*)$");

    private DotenvLoader() {
    }

    public static void load() {
        load(Paths.get(System.getProperty("user.dir")).resolve(".env"));
    }

    /**
     * @return 实际写入系统属性的条目数
     */
    public static int load(Path envPath) {
        if (!Files.isRegularFile(envPath)) {
            System.out.println("[DotenvLoader] .env not found, skipped: " + envPath);
            return 0;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(envPath);
        } catch (IOException e) {
            System.err.println("[DotenvLoader] Failed to read " + envPath + ": " + e.getMessage());
            return 0;
        }
        int loaded = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Matcher matcher = ENV_LINE.matcher(trimmed);
            if (!matcher.matches()) {
                continue;
            }
            String key = matcher.group(1);
            if (System.getProperty(key) != null) {
                continue;
            }
            String value = unquote(matcher.group(2).trim());
            System.setProperty(key, value);
            loaded++;
            System.out.println("[DotenvLoader] Loaded: " + key + " = " + (isSensitive(key) ? "***" : value));
        }
        return loaded;
    }

    static boolean isSensitive(String key) {
        String upper = key.toUpperCase(Locale.ROOT);
        return upper.contains("PASSWORD") || upper.contains("SECRET") || upper.contains("KEY") || upper.endsWith("PWD");
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1).replace("\\\"", "\"");
        }
        return s;
    }
}
