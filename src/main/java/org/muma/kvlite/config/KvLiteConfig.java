package org.muma.kvlite.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (kvlite.properties) > 默认值
 */
@Getter
@Setter
public class KvLiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KvLiteConfig.class);
    private static final KvLiteConfig INSTANCE = new KvLiteConfig();

    public static final String DEFAULT_CONFIG_FILE = "kvlite.properties";

    // --- Core Settings ---
    private int port = 6379;
    private String bindAddress = "0.0.0.0";
    private int workerThreads = 0; // 0 = Netty default

    // --- Store ---
    private StoreScope storeScope = StoreScope.SERVER;

    // --- Diagnostics ---
    private long slowLogMillis = 10;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    // --- Enums ---
    public enum StoreScope {
        // 整个进程共享一个存储
        SERVER,
        // 每个连接独立的存储，连接关闭即丢弃
        CONNECTION
    }

    // --- Singleton Access ---
    KvLiteConfig() {
    }

    public static KvLiteConfig getInstance() {
        return INSTANCE;
    }

    // --- Loading Logic ---

    /**
     * 完整加载流程：先读文件，再应用环境变量，最后应用命令行参数
     */
    public void load(String[] args) {
        // 命令行可能指定了配置文件路径，需要先取出来
        String path = findConfigPath(args);
        if (path != null) {
            this.configFilePath = path;
        }
        loadConfig(configFilePath);
        applyEnvOverrides(System.getenv());
        parseArgs(args);
        log.info("KvLiteConfig initialized: {}", this);
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring argument without value: {}", arg);
                break;
            }
            switch (arg) {
                case "--config" -> this.configFilePath = args[++i];
                case "--port" -> this.port = parseInt("--port", args[++i]);
                case "--bind" -> this.bindAddress = args[++i];
                case "--store-scope" -> this.storeScope = parseScope(args[++i]);
                default -> log.warn("Unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        this.port = getInt(props, "server.port", this.port);
        this.bindAddress = props.getProperty("server.bind", this.bindAddress);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);
        this.slowLogMillis = getInt(props, "command.slow_log_millis", (int) this.slowLogMillis);

        String scope = props.getProperty("store.scope");
        if (scope != null) {
            try {
                this.storeScope = parseScope(scope);
            } catch (IllegalArgumentException e) {
                log.warn("Invalid store.scope value '{}', using default {}.", scope, this.storeScope);
            }
        }
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("KVLITE_PORT");
        if (envPort != null) {
            this.port = parseInt("KVLITE_PORT", envPort);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envScope = env.get("KVLITE_STORE_SCOPE");
        if (envScope != null) {
            this.storeScope = parseScope(envScope);
            log.info("Store scope overridden by ENV: {}", this.storeScope);
        }
    }

    private static String findConfigPath(String[] args) {
        for (int i = 0; i + 1 < args.length; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
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

    private static StoreScope parseScope(String value) {
        return StoreScope.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + value, e);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val) : defaultValue;
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", bind=" + bindAddress + ", storeScope=" + storeScope
                + ", workerThreads=" + workerThreads + "}";
    }
}
