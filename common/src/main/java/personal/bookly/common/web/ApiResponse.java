package personal.bookly.common.web;

/**
 * 관리용 API 응답 포맷
 * 테넌트 설정(영업시간, 블랙아웃, 스태프 일정, 멤버십 관리) 응답을 감싼다
 *
 * @param result  응답 결과 ("success")
 * @param message 응답 메시지
 * @param data    응답 데이터
 * @param <T>     데이터 타입
 */
public record ApiResponse<T>(
        String result,
        String message,
        T data
) {
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>("success", message, data);
    }

    public static ApiResponse<Void> success(String message) {
        return new ApiResponse<>("success", message, null);
    }
}
