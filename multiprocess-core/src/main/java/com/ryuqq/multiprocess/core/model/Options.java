package com.ryuqq.multiprocess.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 워커 간에 주고받는 옵션 맵.
 *
 * <p>InitialOptions(시드 함수가 만든 초기 옵션)와 SharedOptions(각 워커의 기여를 병합한 공유 옵션)
 * 모두 이 타입으로 표현됩니다. 프로세스 경계를 넘어가므로 값은 JSON으로 표현 가능한 타입만 허용합니다.</p>
 *
 * <p><strong>값 정규화:</strong></p>
 * <ul>
 *   <li>String, Boolean, null: 그대로</li>
 *   <li>Byte, Short, Integer, Long: Long</li>
 *   <li>Float, Double: Double (유한한 값만)</li>
 *   <li>List: 원소를 정규화한 변경 불가 List</li>
 *   <li>Map: 키가 문자열이어야 하며, 값을 정규화한 변경 불가 Map (삽입 순서 유지)</li>
 * </ul>
 * <p>그 밖의 타입은 거부합니다. 정규화 덕분에 JSON을 거쳐 받은 값이 보낸 값과 equals로 같습니다.</p>
 *
 * <p><strong>불변성:</strong> 중첩된 List/Map까지 변경 불가. {@link #merge(Options)}는 새 인스턴스를 반환합니다.</p>
 * <p><strong>순서:</strong> 삽입 순서를 유지합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Options {

    private static final Options EMPTY = new Options(Collections.emptyMap());

    private final Map<String, Object> values;

    private Options(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Map으로부터 Options 생성.
     *
     * @param values 옵션 값 (null이면 빈 Options)
     * @return Options 인스턴스
     * @throws IllegalArgumentException 키가 null이거나 빈 문자열인 경우, 값이 JSON 타입이 아닌 경우
     */
    public static Options of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String key = requireKey(entry.getKey());
            copy.put(key, normalize(key, entry.getValue()));
        }
        return new Options(Collections.unmodifiableMap(copy));
    }

    /**
     * 단일 키로 Options 생성.
     *
     * @param key 키
     * @param value 값 (null 허용)
     * @return Options 인스턴스
     */
    public static Options of(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(requireKey(key), normalize(key, value));
        return new Options(Collections.unmodifiableMap(map));
    }

    /**
     * 두 개의 키로 Options 생성.
     *
     * @return Options 인스턴스
     */
    public static Options of(String key1, Object value1, String key2, Object value2) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(requireKey(key1), normalize(key1, value1));
        map.put(requireKey(key2), normalize(key2, value2));
        return new Options(Collections.unmodifiableMap(map));
    }

    /**
     * 빈 Options.
     *
     * @return 빈 Options 인스턴스
     */
    public static Options empty() {
        return EMPTY;
    }

    /**
     * 다른 Options를 병합한 새 인스턴스 생성.
     *
     * <p>키가 충돌하면 {@code other}의 값이 이깁니다 (last-write-wins).
     * 기존 키의 위치는 유지되고, 새 키는 뒤에 추가됩니다.</p>
     *
     * @param other 병합할 Options
     * @return 병합된 Options
     * @throws IllegalArgumentException other가 null인 경우
     */
    public Options merge(Options other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(other.values);
        return new Options(Collections.unmodifiableMap(merged));
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Object getOrDefault(String key, Object defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    /**
     * 문자열 값 조회.
     *
     * @param key 키
     * @return 문자열 값 (없으면 null)
     * @throws IllegalStateException 값이 문자열이 아닌 경우
     */
    public String getString(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new IllegalStateException("Option \"" + key + "\" is not a string: " + value.getClass().getName());
        }
        return (String) value;
    }

    /**
     * 정수 값 조회.
     *
     * @param key 키
     * @return 정수 값
     * @throws IllegalStateException 값이 없거나, 정수가 아니거나, int 범위를 벗어난 경우
     */
    public int getInt(String key) {
        long value = getLong(key);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalStateException("Option \"" + key + "\" does not fit in int: " + value);
        }
        return (int) value;
    }

    /**
     * long 값 조회.
     *
     * <p>소수부가 없는 Double은 long으로 변환하고, 소수부가 있으면 거부합니다.</p>
     *
     * @param key 키
     * @return long 값
     * @throws IllegalStateException 값이 없거나 정수가 아닌 경우
     */
    public long getLong(String key) {
        Object value = values.get(key);
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Double) {
            double number = (Double) value;
            if (number == Math.rint(number) && number >= Long.MIN_VALUE && number <= Long.MAX_VALUE) {
                return (long) number;
            }
            throw new IllegalStateException("Option \"" + key + "\" is not an integral number: " + value);
        }
        throw new IllegalStateException("Option \"" + key + "\" is not a number: " + value);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 읽기 전용 Map 뷰.
     *
     * @return 변경 불가능한 Map (중첩된 List/Map 포함)
     */
    public Map<String, Object> asMap() {
        return values;
    }

    private static Object normalize(String path, Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            // Float는 십진 표기 기준으로 변환 (0.1f → 0.1)
            double number = value instanceof Float ? Double.parseDouble(value.toString()) : (Double) value;
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new IllegalArgumentException("Option \"" + path + "\" must be a finite number: " + value);
            }
            return number;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            int index = 0;
            for (Object element : (List<?>) value) {
                copy.add(normalize(path + "[" + index++ + "]", element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new IllegalArgumentException(
                        "Option \"" + path + "\" must have string keys: " + entry.getKey());
                }
                String key = (String) entry.getKey();
                copy.put(key, normalize(path + "." + key, entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        throw new IllegalArgumentException(
            "Option \"" + path + "\" is not a JSON value: " + value.getClass().getName());
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Option key cannot be null or blank");
        }
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Options options = (Options) o;
        return values.equals(options.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Options" + values;
    }
}
