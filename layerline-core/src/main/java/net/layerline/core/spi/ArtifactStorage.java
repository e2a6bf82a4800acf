package net.layerline.core.spi;

public interface ArtifactStorage {

    /** 소스 아티팩트를 원격 처리기가 접근 가능한 위치로 옮기고 그 위치를 돌려준다 */
    String stage(String sourceUrl) throws Exception;

    /** 원격 산출물을 내구 저장소로 내려받아 보관 위치를 돌려준다 */
    String persist(String remoteUrl, String objectKey) throws Exception;
}
