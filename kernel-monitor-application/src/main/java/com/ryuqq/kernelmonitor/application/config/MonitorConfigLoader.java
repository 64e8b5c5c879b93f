package com.ryuqq.kernelmonitor.application.config;

import com.ryuqq.kernelmonitor.core.config.HostDiagnostics;
import com.ryuqq.kernelmonitor.core.config.MonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 모니터 설정 로더.
 *
 * <p>프로세스 시작 시 한 번 호출되어 {@link MonitorConfig}와 {@link HostDiagnostics}
 * 스냅샷을 만듭니다.</p>
 *
 * <p><strong>우선순위 (뒤가 앞을 덮어씀):</strong></p>
 * <ol>
 *   <li>기본값 ({@link MonitorConfig#MonitorConfig()})</li>
 *   <li>클래스패스 properties 리소스 (기본 {@value #DEFAULT_RESOURCE}, 없으면 생략)</li>
 *   <li>환경 변수 ({@value #ENV_PREFIX} + 대문자 키, 예: {@code KERNEL_MONITOR_TIMEOUT_THRESHOLD})</li>
 * </ol>
 *
 * <p><strong>인식하는 키:</strong></p>
 * <ul>
 *   <li>{@value #ENABLE_TIMEOUT_MONITORING}: boolean</li>
 *   <li>{@value #WARNING_THRESHOLD}: 초 (소수 허용)</li>
 *   <li>{@value #TIMEOUT_THRESHOLD}: 초 (소수 허용)</li>
 *   <li>{@value #AUTO_INTERRUPT}: boolean</li>
 *   <li>{@value #DEBUG_TRANSPORT_LOGGING}: boolean (호스트 진단)</li>
 *   <li>{@value #LOG_TRANSPORT_MESSAGES}: boolean (호스트 진단)</li>
 * </ul>
 *
 * <p>파싱할 수 없는 값이나 임계값 조합 오류는 {@link IllegalArgumentException}으로
 * 거부되며, 잘못된 설정은 모니터까지 전달되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MonitorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MonitorConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "kernel-monitor.properties";
    public static final String ENV_PREFIX = "KERNEL_MONITOR_";

    public static final String ENABLE_TIMEOUT_MONITORING = "enable_timeout_monitoring";
    public static final String WARNING_THRESHOLD = "warning_threshold";
    public static final String TIMEOUT_THRESHOLD = "timeout_threshold";
    public static final String AUTO_INTERRUPT = "auto_interrupt";
    public static final String DEBUG_TRANSPORT_LOGGING = "debug_transport_logging";
    public static final String LOG_TRANSPORT_MESSAGES = "log_transport_messages";

    private final Map<String, String> environment;
    private final String resourceName;
    private final ClassLoader classLoader;

    /**
     * 생성자 (프로세스 환경 변수 + 기본 리소스).
     */
    public MonitorConfigLoader() {
        this(System.getenv(), DEFAULT_RESOURCE);
    }

    /**
     * 생성자.
     *
     * @param environment 환경 변수 맵
     * @param resourceName 클래스패스 리소스 이름 (null이면 리소스 생략)
     * @throws IllegalArgumentException environment가 null인 경우
     */
    public MonitorConfigLoader(Map<String, String> environment, String resourceName) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.environment = environment;
        this.resourceName = resourceName;
        this.classLoader = MonitorConfigLoader.class.getClassLoader();
    }

    /**
     * 모니터 설정 로드.
     *
     * @return 검증된 MonitorConfig
     * @throws IllegalArgumentException 값을 파싱할 수 없거나 임계값 조합이 유효하지 않은 경우
     * @throws IllegalStateException 리소스를 읽을 수 없는 경우
     */
    public MonitorConfig load() {
        Properties properties = readResource();
        MonitorConfig defaults = new MonitorConfig();

        MonitorConfig config = new MonitorConfig(
            booleanValue(properties, ENABLE_TIMEOUT_MONITORING, defaults.enabled()),
            doubleValue(properties, WARNING_THRESHOLD, defaults.warningThresholdSeconds()),
            doubleValue(properties, TIMEOUT_THRESHOLD, defaults.timeoutThresholdSeconds()),
            booleanValue(properties, AUTO_INTERRUPT, defaults.autoInterruptEnabled())
        );

        log.info("Monitor config loaded: enabled={}, warning={}s, timeout={}s, auto_interrupt={}",
            config.enabled(), config.warningThresholdSeconds(), config.timeoutThresholdSeconds(),
            config.autoInterruptEnabled());
        return config;
    }

    /**
     * 호스트 진단 플래그 로드.
     *
     * @return HostDiagnostics
     * @throws IllegalArgumentException 값을 파싱할 수 없는 경우
     */
    public HostDiagnostics loadDiagnostics() {
        Properties properties = readResource();
        return new HostDiagnostics(
            booleanValue(properties, DEBUG_TRANSPORT_LOGGING, false),
            booleanValue(properties, LOG_TRANSPORT_MESSAGES, false)
        );
    }

    private Properties readResource() {
        Properties properties = new Properties();
        if (resourceName == null || resourceName.isBlank()) {
            return properties;
        }
        try (InputStream in = classLoader.getResourceAsStream(resourceName)) {
            if (in == null) {
                log.debug("Config resource {} not found, using defaults", resourceName);
                return properties;
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config resource: " + resourceName, e);
        }
        return properties;
    }

    private String rawValue(Properties properties, String key) {
        String fromEnv = environment.get(ENV_PREFIX + key.toUpperCase(Locale.ROOT));
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        String fromResource = properties.getProperty(key);
        if (fromResource != null && !fromResource.isBlank()) {
            return fromResource.trim();
        }
        return null;
    }

    private boolean booleanValue(Properties properties, String key, boolean defaultValue) {
        String value = rawValue(properties, key);
        if (value == null) {
            return defaultValue;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException(
                "Invalid boolean for " + key + " (current: " + value + ")");
        };
    }

    private double doubleValue(Properties properties, String key, double defaultValue) {
        String value = rawValue(properties, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + " (current: " + value + ")", e);
        }
    }
}
