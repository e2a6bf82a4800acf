package net.layerline.core.service;

/** inputParams 에서 실행기가 직접 해석하는 키 */
public final class JobParams {
    private JobParams() {}

    /** 원격 처리기에 올려야 하는 소스 아티팩트 URL */
    public static final String SOURCE_URL = "sourceUrl";

    /** 알림 요약에 쓰는 표시 이름 */
    public static final String DISPLAY_NAME = "displayName";
}
