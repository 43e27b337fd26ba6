package com.ryuqq.resilience.core.model;

import java.util.regex.Pattern;

/**
 * 보호 대상 Operation의 식별자.
 *
 * <p>OperationId 하나당 Circuit Breaker 하나와 메트릭 항목 하나가 대응됩니다.
 * 동일한 식별자로 들어온 호출은 같은 Circuit Breaker 상태를 공유합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.), 콜론(:)만 허용</li>
 * </ul>
 *
 * <p>예: {@code bedrock.invoke-model}, {@code healthlake:search}</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_.:]+$");
    private static final int MAX_LENGTH = 255;

    private final String value;

    private OperationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("OperationId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "OperationId contains invalid characters. Only alphanumeric, hyphen, underscore, dot and colon are allowed"
            );
        }
        this.value = value;
    }

    /**
     * OperationId 생성.
     *
     * @param value 식별자 문자열
     * @return OperationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationId of(String value) {
        return new OperationId(value);
    }

    /**
     * 식별자 문자열 조회.
     *
     * @return 식별자 문자열
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationId that = (OperationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OperationId{" + value + '}';
    }
}
