package com.lingbus.core.config;

import com.lingbus.api.exception.LingBusException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * 从 YAML 读取 {@link LingBusConfig}
 * <pre>
 * lingbus:
 *   max-events-per-window: 1000
 *   max-handler-time-ms-per-window: 500
 *   monitor-interval-ms: 1000
 *   auto-start-monitoring: true
 *   max-dispatch-depth: 64
 * </pre>
 * 缺失的键保持默认值。
 */
@Slf4j
public class LingBusConfigLoader {

    public static final String DEFAULT_RESOURCE = "lingbus.yml";

    private LingBusConfigLoader() {
    }

    /**
     * 从 classpath 读取 lingbus.yml，不存在时返回默认配置
     */
    public static LingBusConfig loadDefault() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = LingBusConfigLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.debug("{} not found on classpath, using defaults", DEFAULT_RESOURCE);
                return LingBusConfig.defaults();
            }
            return load(in);
        } catch (IOException e) {
            throw new LingBusException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static LingBusConfig load(InputStream inputStream) {
        // 只构造基础类型，不允许任意标签实例化
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object document = yaml.load(inputStream);

        LingBusConfig.LingBusConfigBuilder builder = LingBusConfig.builder();
        if (!(document instanceof Map<?, ?> root)) {
            return builder.build();
        }
        Object section = root.containsKey("lingbus") ? root.get("lingbus") : root;
        if (!(section instanceof Map<?, ?> props)) {
            return builder.build();
        }

        Number value;
        if ((value = number(props, "max-events-per-window")) != null) {
            builder.maxEventsPerWindow(value.intValue());
        }
        if ((value = number(props, "max-handler-time-ms-per-window")) != null) {
            builder.maxHandlerTimeMsPerWindow(value.longValue());
        }
        if ((value = number(props, "monitor-interval-ms")) != null) {
            builder.monitorIntervalMs(value.longValue());
        }
        if ((value = number(props, "max-dispatch-depth")) != null) {
            builder.maxDispatchDepth(value.intValue());
        }
        Object autoStart = props.get("auto-start-monitoring");
        if (autoStart instanceof Boolean b) {
            builder.autoStartMonitoring(b);
        }

        LingBusConfig config = builder.build();
        log.info("Loaded LingBus config: {}", config);
        return config;
    }

    private static Number number(Map<?, ?> props, String key) {
        Object raw = props.get(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number n) {
            return n;
        }
        throw new LingBusException("Config key [" + key + "] must be a number, got: " + raw);
    }
}
