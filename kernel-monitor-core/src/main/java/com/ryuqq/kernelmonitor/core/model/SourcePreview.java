package com.ryuqq.kernelmonitor.core.model;

/**
 * 소스 코드 미리보기 생성 유틸리티.
 *
 * <p>미리보기는 로그 가독성을 위한 용도로만 사용되며, 실행되거나 파싱되지 않습니다.</p>
 *
 * <ul>
 *   <li>null 또는 빈 소스: {@value #EMPTY}</li>
 *   <li>레코드 보관용: 앞 {@value #RECORD_LENGTH}자</li>
 *   <li>로그 출력용: 줄바꿈을 {@code \n} 리터럴로 이스케이프</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SourcePreview {

    /**
     * 빈 소스 표기.
     */
    public static final String EMPTY = "<empty>";

    /**
     * ExecutionRecord에 보관하는 미리보기 최대 길이.
     */
    public static final int RECORD_LENGTH = 100;

    /**
     * 로그 라인에 출력하는 미리보기 최대 길이.
     */
    public static final int LOG_LENGTH = 50;

    // Utility class - prevent instantiation
    private SourcePreview() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 소스를 최대 길이로 자름.
     *
     * @param source 원본 소스 (null 허용)
     * @param maxLength 최대 길이 (양수)
     * @return 잘린 미리보기, 빈 소스는 {@value #EMPTY}
     * @throws IllegalArgumentException maxLength가 양수가 아닌 경우
     */
    public static String of(String source, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive (current: " + maxLength + ")");
        }
        if (source == null || source.isEmpty()) {
            return EMPTY;
        }
        if (source.length() <= maxLength) {
            return source;
        }
        int end = maxLength;
        // surrogate pair 중간에서 자르지 않음
        if (Character.isHighSurrogate(source.charAt(end - 1))) {
            end--;
        }
        return source.substring(0, end);
    }

    /**
     * 로그 출력용 미리보기.
     *
     * @param preview 미리보기 (null 허용)
     * @param maxLength 최대 길이
     * @return 줄바꿈이 이스케이프된 한 줄 문자열
     */
    public static String forLog(String preview, int maxLength) {
        return escapeLineBreaks(of(preview, maxLength));
    }

    /**
     * 줄바꿈 이스케이프.
     *
     * @param text 원본 문자열
     * @return CR/LF가 {@code \r}/{@code \n} 리터럴로 바뀐 문자열
     */
    public static String escapeLineBreaks(String text) {
        if (text == null) {
            return null;
        }
        return text.replace("\r", "\\r").replace("\n", "\\n");
    }
}
