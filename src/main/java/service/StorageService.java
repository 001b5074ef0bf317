package service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 키-값 저장소를 담당하는 서비스 클래스
 * 모든 연결이 하나의 인스턴스를 공유하며, 각 연산은 다른 연결의 연산에 대해 원자적입니다.
 */
public class StorageService {

    // 키-값 저장소 (스레드 안전)
    private final Map<String, String> keyValueStore = new ConcurrentHashMap<>();

    /**
     * 키-값을 저장합니다. 기존 값은 덮어씁니다.
     */
    public void set(String key, String value) {
        keyValueStore.put(key, value);
    }

    /**
     * 키에 해당하는 값을 가져옵니다.
     * @return 키가 없으면 null
     */
    public String get(String key) {
        return keyValueStore.get(key);
    }

    /**
     * 저장된 키의 개수를 반환합니다.
     */
    public int size() {
        return keyValueStore.size();
    }
}
