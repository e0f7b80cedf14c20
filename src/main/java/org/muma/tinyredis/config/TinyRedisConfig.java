package org.muma.tinyredis.config;

import lombok.Getter;
import lombok.Setter;
import org.muma.tinyredis.protocol.RespDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 服务配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (tiny-redis.properties) > 默认值
 */
@Getter
@Setter
public class TinyRedisConfig {

    private static final Logger log = LoggerFactory.getLogger(TinyRedisConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "tiny-redis.properties";

    // --- Core Settings ---
    private String host = "0.0.0.0";
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default

    // --- Protocol Limits ---
    private long maxBulkLength = RespDecoder.DEFAULT_MAX_BULK_LENGTH;
    private int maxMultiBulkLength = RespDecoder.DEFAULT_MAX_ARRAY_LENGTH;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    /**
     * 完整加载流程：先定位配置文件，再依次叠加文件、环境变量、命令行
     */
    public static TinyRedisConfig load(String[] args, Map<String, String> env) {
        TinyRedisConfig config = new TinyRedisConfig();
        config.configFilePath = findConfigPath(args, config.configFilePath);
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides(env);
        config.parseArgs(args);
        log.info("TinyRedisConfig initialized: {}", config);
        return config;
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Missing value for argument '{}', ignored.", arg);
                break;
            }
            switch (arg) {
                case "--config" -> this.configFilePath = args[++i];
                case "--host" -> this.host = args[++i];
                case "--port" -> this.port = parseInt("--port", args[++i], this.port);
                case "--threads" -> this.workerThreads = parseInt("--threads", args[++i], this.workerThreads);
                default -> log.warn("Unknown argument '{}', ignored.", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.host = props.getProperty("server.host", this.host);
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);

        // 2. Protocol
        String bulk = props.getProperty("proto.max_bulk_len");
        if (bulk != null) {
            try {
                long parsed = parseSize(bulk);
                if (parsed > RespDecoder.MAX_BULK_LENGTH_LIMIT) {
                    log.warn("proto.max_bulk_len '{}' exceeds the {} byte limit, clamped.",
                            bulk, RespDecoder.MAX_BULK_LENGTH_LIMIT);
                    parsed = RespDecoder.MAX_BULK_LENGTH_LIMIT;
                }
                this.maxBulkLength = parsed;
            } catch (NumberFormatException e) {
                log.warn("Invalid proto.max_bulk_len '{}', using default {}.", bulk, this.maxBulkLength);
            }
        }
        this.maxMultiBulkLength = getInt(props, "proto.max_multibulk_len", this.maxMultiBulkLength);
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envHost = env.get("REDIS_HOST");
        if (envHost != null) {
            this.host = envHost;
            log.info("Host overridden by ENV: {}", this.host);
        }

        String envPort = env.get("REDIS_PORT");
        if (envPort != null) {
            this.port = parseInt("REDIS_PORT", envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }
    }

    private static String findConfigPath(String[] args, String defaultPath) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return defaultPath;
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    // 辅助：解析带单位的大小 (64mb, 1gb)
    static long parseSize(String sizeStr) {
        String s = sizeStr.toLowerCase(Locale.ROOT).trim();
        long multiplier = 1;
        if (s.endsWith("kb")) {
            multiplier = 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("mb")) {
            multiplier = 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("gb")) {
            multiplier = 1024 * 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("b")) {
            s = s.substring(0, s.length() - 1);
        }
        return Long.parseLong(s.trim()) * multiplier;
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : parseInt(key, val, defaultValue);
    }

    private int parseInt(String name, String value, int defaultValue) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for {}, using {}.", value, name, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{host=" + host + ", port=" + port + ", workerThreads=" + workerThreads
                + ", maxBulkLength=" + maxBulkLength + "}";
    }
}
